package com.rescuegrid.common.messaging;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * 단일 JVM 토픽/큐 구현 ({@code transport: in-memory}).
 *
 * <p>Redis 없이 로컬 실행과 테스트를 하기 위한 구현. Redis 구현과 같은 수신 의미론을 따른다:
 * visibility timeout 동안 숨김 → 미삭제 시 재전달(receiveCount 증가) → 한도 도달 시 DLQ.</p>
 */
@Slf4j
public class InMemoryChannelClient implements ChannelClient {

    private static final String TOPIC_PREFIX = "memory:topic:";

    private final EventCodec eventCodec;
    private final Duration visibilityTimeout;
    private final int maxReceiveCount;
    private final Clock clock;

    private final Map<String, Set<String>> subscriptions = new ConcurrentHashMap<>();  // 토픽 → 큐 이름들
    private final Map<String, MemoryQueue> queues = new ConcurrentHashMap<>();

    public InMemoryChannelClient(EventCodec eventCodec, Duration visibilityTimeout, int maxReceiveCount) {
        this(eventCodec, visibilityTimeout, maxReceiveCount, Clock.systemUTC());
    }

    public InMemoryChannelClient(EventCodec eventCodec, Duration visibilityTimeout, int maxReceiveCount,
                                 Clock clock) {
        this.eventCodec = eventCodec;
        this.visibilityTimeout = visibilityTimeout;
        this.maxReceiveCount = maxReceiveCount;
        this.clock = clock;
    }

    @Override
    public Optional<String> findTopic(String topicName) {
        return subscriptions.containsKey(topicName)
                ? Optional.of(TOPIC_PREFIX + topicName)
                : Optional.empty();
    }

    @Override
    public String createTopic(String topicName) {
        subscriptions.computeIfAbsent(topicName, name -> new CopyOnWriteArraySet<>());
        return TOPIC_PREFIX + topicName;
    }

    @Override
    public String publish(String topicRef, String message, Map<String, String> attributes) {
        String topicName = topicRef.startsWith(TOPIC_PREFIX) ? topicRef.substring(TOPIC_PREFIX.length()) : topicRef;
        Set<String> subscribers = subscriptions.get(topicName);
        if (subscribers == null) {
            throw new ChannelNotFoundException("Topic not found: " + topicName);
        }

        String messageId = UUID.randomUUID().toString();
        String body = eventCodec.envelope(topicRef, message);
        for (String queueName : subscribers) {
            queues.get(queueName).offer(messageId, body);
        }
        return messageId;
    }

    @Override
    public String resolveQueue(String queueName, String topicName) {
        Set<String> subscribers = subscriptions.get(topicName);
        if (subscribers == null) {
            throw new ChannelNotFoundException("Topic not found: " + topicName);
        }
        queues.computeIfAbsent(queueName, name -> new MemoryQueue(name));
        subscribers.add(queueName);
        return queueName;
    }

    @Override
    public List<ReceivedMessage> receive(String queueRef, int maxMessages, Duration waitTime) {
        return queueFor(queueRef).receive(maxMessages, waitTime);
    }

    @Override
    public void delete(String queueRef, String receiptHandle) {
        queueFor(queueRef).delete(receiptHandle);
    }

    /** 아직 삭제되지 않은 메시지 수 (처리 중 포함) */
    public int depth(String queueName) {
        return queueFor(queueName).depth();
    }

    /** DLQ로 이동한 메시지 본문 */
    public List<String> deadLetters(String queueName) {
        return queueFor(queueName).deadLetters();
    }

    private MemoryQueue queueFor(String queueRef) {
        MemoryQueue queue = queues.get(queueRef);
        if (queue == null) {
            throw new ChannelNotFoundException("Queue not resolved: " + queueRef);
        }
        return queue;
    }

    private static final class Entry {
        private final String messageId;
        private final String body;
        private long receiveCount;
        private long visibleAtMillis;
        private String receiptHandle;

        private Entry(String messageId, String body) {
            this.messageId = messageId;
            this.body = body;
        }
    }

    private final class MemoryQueue {
        private final String name;
        private final List<Entry> entries = new ArrayList<>();
        private final List<String> deadLetters = new ArrayList<>();

        private MemoryQueue(String name) {
            this.name = name;
        }

        synchronized void offer(String messageId, String body) {
            entries.add(new Entry(messageId, body));
            notifyAll();
        }

        synchronized List<ReceivedMessage> receive(int maxMessages, Duration waitTime) {
            long deadline = clock.millis() + waitTime.toMillis();
            List<ReceivedMessage> received = collectVisible(maxMessages);
            try {
                while (received.isEmpty()) {
                    long remaining = deadline - clock.millis();
                    if (remaining <= 0) {
                        break;
                    }
                    wait(Math.min(remaining, nextVisibleDelay()));
                    received = collectVisible(maxMessages);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();  // 종료 신호: 빈 결과로 복귀
            }
            return received;
        }

        synchronized void delete(String receiptHandle) {
            entries.removeIf(entry -> receiptHandle.equals(entry.receiptHandle));
        }

        synchronized int depth() {
            return entries.size();
        }

        synchronized List<String> deadLetters() {
            return List.copyOf(deadLetters);
        }

        private List<ReceivedMessage> collectVisible(int maxMessages) {
            long now = clock.millis();
            List<ReceivedMessage> received = new ArrayList<>();
            Iterator<Entry> iterator = entries.iterator();
            while (iterator.hasNext() && received.size() < maxMessages) {
                Entry entry = iterator.next();
                if (entry.visibleAtMillis > now) {
                    continue;
                }
                if (entry.receiveCount >= maxReceiveCount) {
                    iterator.remove();
                    deadLetters.add(entry.body);
                    log.warn("Moved message to DLQ: queue={}, messageId={}, receiveCount={}",
                            name, entry.messageId, entry.receiveCount);
                    continue;
                }
                entry.receiveCount++;
                entry.visibleAtMillis = now + visibilityTimeout.toMillis();
                entry.receiptHandle = UUID.randomUUID().toString();
                received.add(new ReceivedMessage(entry.messageId, entry.receiptHandle, entry.body,
                        entry.receiveCount));
            }
            return received;
        }

        private long nextVisibleDelay() {
            long now = clock.millis();
            long delay = Long.MAX_VALUE;
            for (Entry entry : entries) {
                delay = Math.min(delay, Math.max(1, entry.visibleAtMillis - now));
            }
            return delay;
        }
    }
}
