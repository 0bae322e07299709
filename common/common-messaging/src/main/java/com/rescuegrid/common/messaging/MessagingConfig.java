package com.rescuegrid.common.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 메시징 공통 설정.
 *
 * <h3>등록하는 빈</h3>
 * <ul>
 *   <li>{@link ChannelClient} - {@code rescuegrid.messaging.transport}에 따라 Redis Streams 또는 in-memory</li>
 *   <li>{@link EventCodec}, {@link EventPublisher} (Circuit Breaker {@code eventPublisher} 적용)</li>
 *   <li>{@link EventConsumerLoopFactory} - 서비스별 소비자 루프 생성</li>
 *   <li>{@code eventPublishExecutor} - 커밋 후 비동기 발행용 bounded 스레드 풀</li>
 * </ul>
 *
 * <p>발행 풀이 가득 차면 {@code DiscardOldestPolicy}가 가장 오래된 발행 작업을 버린다.
 * 발행은 best-effort이며 요청 스레드를 막지 않는다.</p>
 */
@Slf4j
@Configuration
@EnableAsync
@EnableConfigurationProperties(MessagingProperties.class)
public class MessagingConfig {

    @Bean
    public EventCodec eventCodec(ObjectMapper objectMapper) {
        return new EventCodec(objectMapper);
    }

    // spring.data.redis.timeout 미설정 시 Lettuce 기본값
    static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(60);

    @Bean
    public ChannelClient channelClient(MessagingProperties properties,
                                       EventCodec eventCodec,
                                       ObjectProvider<StringRedisTemplate> redisTemplate,
                                       ObjectProvider<RedisProperties> redisProperties,
                                       @Value("${spring.application.name:rescuegrid}") String applicationName) {
        MessagingProperties.Redis redis = properties.getRedis();
        if (properties.getTransport() == MessagingProperties.Transport.IN_MEMORY) {
            log.info("Messaging transport: in-memory");
            return new InMemoryChannelClient(eventCodec, redis.getVisibilityTimeout(), redis.getMaxReceiveCount());
        }

        String consumerName = redis.getConsumerName() != null
                ? redis.getConsumerName()
                : applicationName + "-" + UUID.randomUUID().toString().substring(0, 8);
        Duration commandTimeout = commandTimeout(redisProperties.getIfAvailable());
        Duration waitTime = properties.getConsumer().getWaitTime();
        if (waitTime.compareTo(commandTimeout) >= 0) {
            log.warn("rescuegrid.messaging.consumer.wait-time ({}) is not shorter than the Redis command timeout ({}); "
                    + "long-poll will be capped at {}", waitTime, commandTimeout,
                    RedisStreamChannelClient.maxBlockFor(commandTimeout));
        }
        log.info("Messaging transport: redis streams (consumer={}, commandTimeout={})", consumerName, commandTimeout);
        return new RedisStreamChannelClient(redisTemplate.getObject(), eventCodec, redis, consumerName, commandTimeout);
    }

    static Duration commandTimeout(RedisProperties redisProperties) {
        if (redisProperties == null || redisProperties.getTimeout() == null) {
            return DEFAULT_COMMAND_TIMEOUT;
        }
        return redisProperties.getTimeout();
    }

    @Bean
    public EventPublisher eventPublisher(ChannelClient channelClient, EventCodec eventCodec,
                                         CircuitBreakerRegistry circuitBreakerRegistry) {
        return new EventPublisher(channelClient, eventCodec, circuitBreakerRegistry.circuitBreaker("eventPublisher"));
    }

    @Bean
    public EventConsumerLoopFactory eventConsumerLoopFactory(ChannelClient channelClient,
                                                             EventCodec eventCodec,
                                                             MessagingProperties properties) {
        return new EventConsumerLoopFactory(channelClient, eventCodec, properties);
    }

    @Bean(name = "eventPublishExecutor")
    public Executor eventPublishExecutor(MessagingProperties properties) {
        MessagingProperties.Publisher publisher = properties.getPublisher();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(publisher.getCorePoolSize());
        executor.setMaxPoolSize(publisher.getMaxPoolSize());
        executor.setQueueCapacity(publisher.getQueueCapacity());
        executor.setThreadNamePrefix("event-publish-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.DiscardOldestPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
