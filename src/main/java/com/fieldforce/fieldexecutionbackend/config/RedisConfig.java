package com.fieldforce.fieldexecutionbackend.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fieldforce.fieldexecutionbackend.model.ProgressRecord;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis wiring for the progress store. Only active with the {@code redis} profile;
 * the default profile keeps progress records in MongoDB.
 */
@Configuration
@Profile("redis")
public class RedisConfig {

    /**
     * Activity results carry their own {@code kind} discriminator, so no default typing is needed.
     */
    public static ObjectMapper createRedisObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    public static Jackson2JsonRedisSerializer<ProgressRecord> progressRecordSerializer() {
        return new Jackson2JsonRedisSerializer<>(createRedisObjectMapper(), ProgressRecord.class);
    }

    @Bean
    public RedisTemplate<String, ProgressRecord> progressRedisTemplate(RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, ProgressRecord> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);

        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(progressRecordSerializer());
        template.setHashKeySerializer(new StringRedisSerializer());
        template.setHashValueSerializer(progressRecordSerializer());

        template.afterPropertiesSet();
        return template;
    }
}
