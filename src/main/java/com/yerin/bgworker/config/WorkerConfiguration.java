package com.yerin.bgworker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.bgworker.backend.pg.PgEnqueuer;
import com.yerin.bgworker.backend.pg.PgQueueClient;
import com.yerin.bgworker.backend.redis.RedisEnqueuer;
import com.yerin.bgworker.backend.redis.RedisQueueClient;
import com.yerin.bgworker.domain.WorkerMetrics;
import com.yerin.bgworker.worker.AppContext;
import com.yerin.bgworker.worker.Enqueuer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Storage clients and enqueuers of the enabled backends, plus the {@link AppContext} handed to
 * workers.
 */
@Configuration
@EnableConfigurationProperties(WorkerProperties.class)
public class WorkerConfiguration {

    @Bean
    @ConditionalOnProperty(prefix = "bgworker.pg", name = "enable", havingValue = "true")
    public PgQueueClient pgQueueClient(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, WorkerProperties properties) {
        return new PgQueueClient(jdbcTemplate, objectMapper, properties.getPg().getSchema());
    }

    @Bean
    @ConditionalOnProperty(prefix = "bgworker.pg", name = "enable", havingValue = "true")
    public PgEnqueuer pgEnqueuer(PgQueueClient pgQueueClient, WorkerMetrics metrics) {
        return new PgEnqueuer(pgQueueClient, metrics);
    }

    @Bean
    @ConditionalOnProperty(prefix = "bgworker.redis", name = "enable", havingValue = "true")
    public RedisQueueClient redisQueueClient(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                             WorkerProperties properties) {
        return new RedisQueueClient(redisTemplate, objectMapper, properties.getRedis().getPrefix());
    }

    @Bean
    @ConditionalOnProperty(prefix = "bgworker.redis", name = "enable", havingValue = "true")
    public RedisEnqueuer redisEnqueuer(RedisQueueClient redisQueueClient, WorkerMetrics metrics) {
        return new RedisEnqueuer(redisQueueClient, metrics);
    }

    @Bean
    public AppContext appContext(WorkerProperties properties, ObjectMapper objectMapper,
                                 ObjectProvider<Enqueuer> enqueuers) {
        return new AppContext(properties, objectMapper, enqueuers.orderedStream().toList());
    }
}
