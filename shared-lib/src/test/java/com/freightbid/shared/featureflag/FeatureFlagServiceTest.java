package com.freightbid.shared.featureflag;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FeatureFlagServiceTest {

    @Mock private RedisTemplate<String, String> redisTemplate;
    @Mock private HashOperations<String, Object, Object> hashOperations;

    private FeatureFlagService service;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForHash()).thenReturn(hashOperations);
        service = new FeatureFlagService(redisTemplate);
    }

    @Test
    @DisplayName("Tenant value wins over global and default")
    void tenantValue() {
        when(hashOperations.get("feature-flags:default", FeatureFlagService.BID_INTAKE_PAUSED)).thenReturn("true");

        assertThat(service.isEnabled(FeatureFlagService.BID_INTAKE_PAUSED, false)).isTrue();
    }

    @Test
    @DisplayName("Falls back to the global tenant, then to the default")
    void fallbacks() {
        when(hashOperations.get("feature-flags:default", FeatureFlagService.BACKHAUL_BONUS_ENABLED)).thenReturn(null);
        when(hashOperations.get("feature-flags:global", FeatureFlagService.BACKHAUL_BONUS_ENABLED)).thenReturn("false");
        when(hashOperations.get("feature-flags:default", FeatureFlagService.NO_SHOW_SWEEP_ENABLED)).thenReturn(null);
        when(hashOperations.get("feature-flags:global", FeatureFlagService.NO_SHOW_SWEEP_ENABLED)).thenReturn(null);

        assertThat(service.isEnabled(FeatureFlagService.BACKHAUL_BONUS_ENABLED, true)).isFalse();
        assertThat(service.isEnabled(FeatureFlagService.NO_SHOW_SWEEP_ENABLED, true)).isTrue();
    }

    @Test
    @DisplayName("Defaults are seeded without overwriting existing values")
    void initDefaults() {
        service.initDefaults(FeatureFlagService.DEFAULT_TENANT);

        verify(hashOperations).putIfAbsent("feature-flags:default", FeatureFlagService.BID_INTAKE_PAUSED, "false");
        verify(hashOperations).putIfAbsent("feature-flags:default", FeatureFlagService.BACKHAUL_BONUS_ENABLED, "true");
        verify(hashOperations).putIfAbsent("feature-flags:default", FeatureFlagService.NO_SHOW_SWEEP_ENABLED, "true");
    }
}
