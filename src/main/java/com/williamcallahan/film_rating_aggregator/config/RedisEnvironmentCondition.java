/**
 * Custom condition that checks if Redis connection settings are present
 * This enables the shared Redis response cache automatically when they are available
 *
 * @author William Callahan
 *
 * Features:
 * - Checks for REDIS_SERVER environment variable or spring.data.redis.host/port
 * - Logs once when Redis is detected
 */
package com.williamcallahan.film_rating_aggregator.config;

import com.williamcallahan.film_rating_aggregator.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Condition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.env.Environment;
import org.springframework.core.type.AnnotatedTypeMetadata;
import org.springframework.lang.NonNull;

public class RedisEnvironmentCondition implements Condition {

    private static final Logger logger = LoggerFactory.getLogger(RedisEnvironmentCondition.class);
    private static volatile boolean hasLoggedRedisDetection = false;

    @Override
    public boolean matches(@NonNull ConditionContext context, @NonNull AnnotatedTypeMetadata metadata) {
        Environment env = context.getEnvironment();

        boolean hasRedisConfig = ValidationUtils.hasText(env.getProperty("REDIS_SERVER"))
            || ValidationUtils.hasText(env.getProperty("spring.data.redis.host"))
            || ValidationUtils.hasText(env.getProperty("spring.data.redis.port"));

        if (hasRedisConfig && !hasLoggedRedisDetection) {
            logger.info("Redis settings detected - enabling shared response cache");
            hasLoggedRedisDetection = true;
        }

        return hasRedisConfig;
    }
}
