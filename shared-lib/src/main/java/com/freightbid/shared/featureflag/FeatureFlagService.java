package com.freightbid.shared.featureflag;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;

/**
 * Feature flag service backed by Redis hashes.
 *
 * Key pattern:  feature-flags:{tenantId}
 * Field:        {flagName}
 * Value:        "true" | "false"
 *
 * Registered via FeatureFlagAutoConfiguration (Spring Boot auto-config).
 * Set a flag via Redis CLI:
 *   HSET feature-flags:default bid_intake_paused true
 *   HSET feature-flags:default backhaul_bonus_enabled false
 */
@Slf4j
@RequiredArgsConstructor
public class FeatureFlagService {

    private static final String FLAG_KEY_PREFIX = "feature-flags:";
    private static final String GLOBAL_TENANT   = "global";

    public static final String DEFAULT_TENANT = "default";

    // Well-known flag names
    public static final String BID_INTAKE_PAUSED       = "bid_intake_paused";
    public static final String BACKHAUL_BONUS_ENABLED  = "backhaul_bonus_enabled";
    public static final String NO_SHOW_SWEEP_ENABLED   = "no_show_sweep_enabled";

    private final RedisTemplate<String, String> redisTemplate;

    /**
     * Returns true if the flag is enabled for the given tenant.
     * Falls back to global flag, then to the provided default value.
     */
    public boolean isEnabled(String tenantId, String flagName, boolean defaultValue) {
        Object tenantVal = redisTemplate.opsForHash().get(FLAG_KEY_PREFIX + tenantId, flagName);
        if (tenantVal != null) {
            return Boolean.parseBoolean(tenantVal.toString());
        }

        Object globalVal = redisTemplate.opsForHash().get(FLAG_KEY_PREFIX + GLOBAL_TENANT, flagName);
        if (globalVal != null) {
            return Boolean.parseBoolean(globalVal.toString());
        }

        log.debug("Feature flag '{}' not found for tenant='{}', using default={}", flagName, tenantId, defaultValue);
        return defaultValue;
    }

    public boolean isEnabled(String flagName, boolean defaultValue) {
        return isEnabled(DEFAULT_TENANT, flagName, defaultValue);
    }

    public void setFlag(String tenantId, String flagName, boolean value) {
        redisTemplate.opsForHash().put(FLAG_KEY_PREFIX + tenantId, flagName, String.valueOf(value));
        log.info("Feature flag set: tenant={} flag={} value={}", tenantId, flagName, value);
    }

    /**
     * Initialise default flags if they are not yet set (called at startup).
     */
    public void initDefaults(String tenantId) {
        String key = FLAG_KEY_PREFIX + tenantId;
        setIfAbsent(key, BID_INTAKE_PAUSED,      "false");
        setIfAbsent(key, BACKHAUL_BONUS_ENABLED, "true");
        setIfAbsent(key, NO_SHOW_SWEEP_ENABLED,  "true");
        redisTemplate.expire(key, Duration.ofDays(365));
    }

    private void setIfAbsent(String key, String field, String value) {
        redisTemplate.opsForHash().putIfAbsent(key, field, value);
    }
}
