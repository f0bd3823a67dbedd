package com.freightbid.auction.config;

import com.freightbid.shared.featureflag.FeatureFlagService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Seeds default feature flags for the "default" tenant on startup.
 * Flags already set in Redis are NOT overwritten (putIfAbsent).
 *
 * To pause bid intake at runtime without restart:
 *   redis-cli HSET feature-flags:default bid_intake_paused true
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class FeatureFlagInitializer {

    private final FeatureFlagService featureFlagService;

    @Bean
    public ApplicationRunner seedAuctionFeatureFlags() {
        return args -> {
            featureFlagService.initDefaults(FeatureFlagService.DEFAULT_TENANT);
            log.info("Feature flags initialised for auction-service");
        };
    }
}
