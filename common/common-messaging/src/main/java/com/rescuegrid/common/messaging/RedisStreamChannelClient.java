package com.rescuegrid.common.messaging;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.PendingMessage;
import org.springframework.data.redis.connection.stream.PendingMessages;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StreamOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Redis Streams 기반 토픽/큐 (Redis Stream Channel Client)
 *
 * <h3>매핑</h3>
 * <pre>
 *   토픽            → Stream     {prefix}:topic:{topicName}   (등록 목록: SET {prefix}:topics)
 *   큐(구독)         → Consumer Group (그룹명 = 큐 이름)
 *   receive         → XREADGROUP ... BLOCK {wait} STREAMS key &gt;
 *   delete (ack)    → XACK
 *   visibility      → PEL 항목의 idle 시간 ≥ visibilityTimeout 이면 XCLAIM으로 재수신
 *   DLQ             → 전달 횟수 ≥ maxReceiveCount 이면 {prefix}:dlq:{queueName} 로 XADD 후 XACK
 * </pre>
 *
 * <h3>★ long-poll과 명령 타임아웃</h3>
 * <p>Lettuce는 블로킹 XREADGROUP도 클라이언트 명령 타임아웃({@code spring.data.redis.timeout})으로 기다린다.
 * BLOCK이 그보다 길면 빈 poll마다 QueryTimeoutException이 나고, 취소된 읽기가 서버에서 가져간 메시지는
 * visibility timeout 동안 PEL에 묶인다. 그래서 BLOCK은 항상 명령 타임아웃보다 짧게 자른다.</p>
 *
 * <p>하나의 토픽 Stream에 여러 Consumer Group을 두면 그룹마다 모든 메시지를 받으므로
 * 토픽 → 큐 fan-out이 된다. 그룹은 {@code 0-0} 오프셋으로 만들어 구독 전에 발행된 메시지도 받는다.</p>
 *
 * <h3>★ Redis Pub/Sub이 아닌 이유</h3>
 * <p>Pub/Sub은 fire-and-forget이라 구독자가 없거나 처리 중 죽으면 메시지가 사라진다.
 * Stream + Consumer Group은 ack 전까지 PEL에 남아 at-least-once 재전달이 가능하다.</p>
 */
@Slf4j
public class RedisStreamChannelClient implements ChannelClient {

    static final String BODY_FIELD = "body";
    private static final String BUSY_GROUP = "BUSYGROUP";
    private static final Duration BLOCK_MARGIN = Duration.ofSeconds(1);

    private final StringRedisTemplate redisTemplate;
    private final EventCodec eventCodec;
    private final MessagingProperties.Redis properties;
    private final String consumerName;
    private final Duration maxBlock;

    // 큐 이름 → 구독 중인 토픽 Stream key
    private final Map<String, String> queueStreams = new ConcurrentHashMap<>();

    public RedisStreamChannelClient(StringRedisTemplate redisTemplate, EventCodec eventCodec,
                                    MessagingProperties.Redis properties, String consumerName,
                                    Duration commandTimeout) {
        this.redisTemplate = redisTemplate;
        this.eventCodec = eventCodec;
        this.properties = properties;
        this.consumerName = consumerName;
        this.maxBlock = maxBlockFor(commandTimeout);
    }

    /** 명령 타임아웃보다 1초 짧게. 타임아웃이 1초 이하면 절반 */
    static Duration maxBlockFor(Duration commandTimeout) {
        Duration limit = commandTimeout.minus(BLOCK_MARGIN);
        return limit.isNegative() || limit.isZero() ? commandTimeout.dividedBy(2) : limit;
    }

    @Override
    public Optional<String> findTopic(String topicName) {
        Boolean registered = redisTemplate.opsForSet().isMember(topicsKey(), topicName);
        return Boolean.TRUE.equals(registered) ? Optional.of(streamKey(topicName)) : Optional.empty();
    }

    @Override
    public String createTopic(String topicName) {
        redisTemplate.opsForSet().add(topicsKey(), topicName);  // SADD: 이미 있으면 no-op
        return streamKey(topicName);
    }

    @Override
    public String publish(String topicRef, String message, Map<String, String> attributes) {
        Map<String, String> fields = new LinkedHashMap<>(attributes);
        fields.put(BODY_FIELD, eventCodec.envelope(topicRef, message));
        RecordId recordId = redisTemplate.opsForStream().add(topicRef, fields);
        return recordId != null ? recordId.getValue() : null;
    }

    @Override
    public String resolveQueue(String queueName, String topicName) {
        if (findTopic(topicName).isEmpty()) {
            throw new ChannelNotFoundException("Topic not found: " + topicName);
        }
        String streamKey = streamKey(topicName);
        createGroupIfAbsent(streamKey, queueName);
        queueStreams.put(queueName, streamKey);
        return queueName;
    }

    @Override
    public List<ReceivedMessage> receive(String queueRef, int maxMessages, Duration waitTime) {
        String streamKey = streamFor(queueRef);
        List<ReceivedMessage> messages = new ArrayList<>(reclaimExpired(streamKey, queueRef, maxMessages));

        int remaining = maxMessages - messages.size();
        if (remaining <= 0) {
            return messages;
        }

        StreamReadOptions options = StreamReadOptions.empty().count(remaining);
        if (messages.isEmpty() && !waitTime.isZero()) {
            // 재수신할 메시지가 없을 때만 long-poll
            options = options.block(waitTime.compareTo(maxBlock) > 0 ? maxBlock : waitTime);
        }

        List<MapRecord<String, Object, Object>> records = redisTemplate.opsForStream().read(
                Consumer.from(queueRef, consumerName),
                options,
                StreamOffset.create(streamKey, ReadOffset.lastConsumed()));

        if (records != null) {
            for (MapRecord<String, Object, Object> record : records) {
                messages.add(toMessage(record, 1));
            }
        }
        return messages;
    }

    @Override
    public void delete(String queueRef, String receiptHandle) {
        redisTemplate.opsForStream().acknowledge(streamFor(queueRef), queueRef, receiptHandle);
    }

    /**
     * visibility timeout이 지난 미확인 메시지를 회수한다.
     * 전달 횟수가 한도에 도달한 메시지는 DLQ로 보낸다.
     */
    private List<ReceivedMessage> reclaimExpired(String streamKey, String group, int maxMessages) {
        StreamOperations<String, Object, Object> ops = redisTemplate.opsForStream();
        PendingMessages pending = ops.pending(streamKey, group, Range.unbounded(), maxMessages);
        if (pending == null || pending.isEmpty()) {
            return List.of();
        }

        Duration visibilityTimeout = properties.getVisibilityTimeout();
        List<RecordId> claimable = new ArrayList<>();
        Map<String, Long> deliveryCounts = new HashMap<>();

        for (PendingMessage pendingMessage : pending) {
            if (pendingMessage.getElapsedTimeSinceLastDelivery().compareTo(visibilityTimeout) < 0) {
                continue;  // 아직 다른 수신자가 처리 중
            }
            if (pendingMessage.getTotalDeliveryCount() >= properties.getMaxReceiveCount()) {
                deadLetter(streamKey, group, pendingMessage);
                continue;
            }
            claimable.add(pendingMessage.getId());
            deliveryCounts.put(pendingMessage.getIdAsString(), pendingMessage.getTotalDeliveryCount());
        }

        if (claimable.isEmpty()) {
            return List.of();
        }

        List<MapRecord<String, Object, Object>> claimed = ops.claim(
                streamKey, group, consumerName, visibilityTimeout, claimable.toArray(new RecordId[0]));
        if (claimed == null) {
            return List.of();
        }

        List<ReceivedMessage> messages = new ArrayList<>(claimed.size());
        for (MapRecord<String, Object, Object> record : claimed) {
            long previous = deliveryCounts.getOrDefault(record.getId().getValue(), 0L);
            messages.add(toMessage(record, previous + 1));
        }
        return messages;
    }

    private void deadLetter(String streamKey, String group, PendingMessage pendingMessage) {
        StreamOperations<String, Object, Object> ops = redisTemplate.opsForStream();
        String id = pendingMessage.getIdAsString();

        List<MapRecord<String, Object, Object>> records = ops.range(streamKey, Range.closed(id, id));
        if (records != null && !records.isEmpty()) {
            Map<Object, Object> fields = new LinkedHashMap<>(records.get(0).getValue());
            fields.put("sourceStream", streamKey);
            fields.put("sourceId", id);
            fields.put("receiveCount", String.valueOf(pendingMessage.getTotalDeliveryCount()));
            ops.add(dlqKey(group), fields);
        }
        ops.acknowledge(streamKey, group, id);

        log.warn("Moved message to DLQ: queue={}, messageId={}, receiveCount={}",
                group, id, pendingMessage.getTotalDeliveryCount());
    }

    private void createGroupIfAbsent(String streamKey, String group) {
        byte[] rawKey = streamKey.getBytes(StandardCharsets.UTF_8);
        try {
            // MKSTREAM: 아직 발행된 적 없는 토픽에도 그룹을 만들 수 있다
            redisTemplate.execute((RedisCallback<String>) (RedisConnection connection) ->
                    connection.streamCommands().xGroupCreate(rawKey, group, ReadOffset.from("0-0"), true));
            log.info("Consumer group created: stream={}, group={}", streamKey, group);
        } catch (DataAccessException e) {
            if (!isBusyGroup(e)) {
                throw e;
            }
            log.debug("Consumer group already exists: stream={}, group={}", streamKey, group);
        }
    }

    private static boolean isBusyGroup(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t.getMessage() != null && t.getMessage().contains(BUSY_GROUP)) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    private static ReceivedMessage toMessage(MapRecord<String, Object, Object> record, long receiveCount) {
        Object body = record.getValue().get(BODY_FIELD);
        String id = record.getId().getValue();
        return new ReceivedMessage(id, id, body != null ? body.toString() : null, receiveCount);
    }

    private String streamFor(String queueRef) {
        String streamKey = queueStreams.get(queueRef);
        if (streamKey == null) {
            throw new ChannelNotFoundException("Queue not resolved: " + queueRef);
        }
        return streamKey;
    }

    private String topicsKey() {
        return properties.getKeyPrefix() + ":topics";
    }

    private String streamKey(String topicName) {
        return properties.getKeyPrefix() + ":topic:" + topicName;
    }

    private String dlqKey(String queueName) {
        return properties.getKeyPrefix() + ":dlq:" + queueName;
    }
}
