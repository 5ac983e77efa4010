package com.whereq.scribe.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.scribe.notify.RedisStatusNotifier;
import com.whereq.scribe.notify.StatusNotifier;
import com.whereq.scribe.queue.JobQueue;
import com.whereq.scribe.queue.RedisJobQueue;
import com.whereq.scribe.store.JobStore;
import com.whereq.scribe.store.RedisJobStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Clock;

/**
 * Redis backend for job store, queue and status notifier
 */
@Configuration
@ConditionalOnProperty(name = "scribe.backend", havingValue = "redis", matchIfMissing = true)
public class RedisConfig {

    @Bean
    public ReactiveRedisTemplate<String, String> reactiveRedisTemplate(
            ReactiveRedisConnectionFactory connectionFactory) {

        RedisSerializationContext<String, String> serializationContext =
            RedisSerializationContext.<String, String>newSerializationContext(new StringRedisSerializer())
                .hashKey(new StringRedisSerializer())
                .hashValue(new StringRedisSerializer())
                .build();

        return new ReactiveRedisTemplate<>(connectionFactory, serializationContext);
    }

    @Bean
    public StatusNotifier statusNotifier(ReactiveRedisTemplate<String, String> reactiveRedisTemplate,
                                         ObjectMapper objectMapper) {
        return new RedisStatusNotifier(reactiveRedisTemplate, objectMapper);
    }

    @Bean
    public JobStore jobStore(ReactiveRedisTemplate<String, String> reactiveRedisTemplate,
                             ObjectMapper objectMapper,
                             StatusNotifier statusNotifier,
                             Clock clock,
                             ScribeProperties properties) {
        return new RedisJobStore(reactiveRedisTemplate, objectMapper, statusNotifier, clock,
            properties.getStore().getTtl());
    }

    @Bean
    public JobQueue jobQueue(ReactiveRedisTemplate<String, String> reactiveRedisTemplate) {
        return new RedisJobQueue(reactiveRedisTemplate);
    }
}
