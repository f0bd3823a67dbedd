package com.freightbid.shared.featureflag;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Registers FeatureFlagService whenever spring-data-redis is on the classpath,
 * so services that include shared-lib get it without component-scan changes.
 */
@AutoConfiguration(after = RedisAutoConfiguration.class)
@ConditionalOnClass(StringRedisTemplate.class)
public class FeatureFlagAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public FeatureFlagService featureFlagService(StringRedisTemplate stringRedisTemplate) {
        return new FeatureFlagService(stringRedisTemplate);
    }
}
