package com.rescuegrid.common.messaging;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 메시징 설정 ({@code rescuegrid.messaging.*}).
 *
 * <pre>
 * rescuegrid:
 *   messaging:
 *     transport: redis            # redis | in-memory
 *     auto-create-topics: true
 *     consumer:
 *       max-messages: 10
 *       wait-time: 20s
 *       init-retry-delay: 5s
 *       error-backoff: 5s
 *     redis:
 *       visibility-timeout: 30s
 *       max-receive-count: 5
 * </pre>
 */
@ConfigurationProperties(prefix = "rescuegrid.messaging")
public class MessagingProperties {

    public enum Transport {
        REDIS,
        IN_MEMORY
    }

    private Transport transport = Transport.REDIS;
    // false면 토픽은 외부에서 프로비저닝되고, 소비자는 토픽이 생길 때까지 초기화를 재시도한다
    private boolean autoCreateTopics = true;
    private final Consumer consumer = new Consumer();
    private final Redis redis = new Redis();
    private final Publisher publisher = new Publisher();

    public Transport getTransport() {
        return transport;
    }

    public void setTransport(Transport transport) {
        this.transport = transport;
    }

    public boolean isAutoCreateTopics() {
        return autoCreateTopics;
    }

    public void setAutoCreateTopics(boolean autoCreateTopics) {
        this.autoCreateTopics = autoCreateTopics;
    }

    public Consumer getConsumer() {
        return consumer;
    }

    public Redis getRedis() {
        return redis;
    }

    public Publisher getPublisher() {
        return publisher;
    }

    public static class Consumer {
        private boolean enabled = true;
        private int maxMessages = 10;
        private Duration waitTime = Duration.ofSeconds(20);
        private Duration initRetryDelay = Duration.ofSeconds(5);
        private Duration errorBackoff = Duration.ofSeconds(5);
        private Duration shutdownTimeout = Duration.ofSeconds(10);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxMessages() {
            return maxMessages;
        }

        public void setMaxMessages(int maxMessages) {
            this.maxMessages = maxMessages;
        }

        public Duration getWaitTime() {
            return waitTime;
        }

        public void setWaitTime(Duration waitTime) {
            this.waitTime = waitTime;
        }

        public Duration getInitRetryDelay() {
            return initRetryDelay;
        }

        public void setInitRetryDelay(Duration initRetryDelay) {
            this.initRetryDelay = initRetryDelay;
        }

        public Duration getErrorBackoff() {
            return errorBackoff;
        }

        public void setErrorBackoff(Duration errorBackoff) {
            this.errorBackoff = errorBackoff;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }
    }

    public static class Redis {
        private String keyPrefix = "rescuegrid";
        private String consumerName;
        private Duration visibilityTimeout = Duration.ofSeconds(30);
        private int maxReceiveCount = 5;

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public String getConsumerName() {
            return consumerName;
        }

        public void setConsumerName(String consumerName) {
            this.consumerName = consumerName;
        }

        public Duration getVisibilityTimeout() {
            return visibilityTimeout;
        }

        public void setVisibilityTimeout(Duration visibilityTimeout) {
            this.visibilityTimeout = visibilityTimeout;
        }

        public int getMaxReceiveCount() {
            return maxReceiveCount;
        }

        public void setMaxReceiveCount(int maxReceiveCount) {
            this.maxReceiveCount = maxReceiveCount;
        }
    }

    public static class Publisher {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 500;

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }
}
