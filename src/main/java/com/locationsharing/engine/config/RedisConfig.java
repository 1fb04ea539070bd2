package com.locationsharing.engine.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

/**
 * Redis wiring for the shared presence store.
 *
 * Presence records are plain JSON strings, so the auto-configured
 * {@code StringRedisTemplate} serves reads and writes. Change notifications
 * arrive over pub/sub on channels named after the record keys; this container
 * hosts the pattern subscriptions.
 */
@Configuration
@ConditionalOnProperty(name = "location-sharing.store.type", havingValue = "redis", matchIfMissing = true)
public class RedisConfig {

    @Bean
    public RedisMessageListenerContainer redisMessageListenerContainer(RedisConnectionFactory connectionFactory) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        return container;
    }
}
