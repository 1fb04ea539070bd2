package com.locationsharing.engine.store;

import com.locationsharing.engine.exception.PublishFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.data.redis.listener.PatternTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@link SharedLocationStore} backed by Redis.
 *
 * Storage format:
 * - Key: the presence key (e.g. "presence/alice"), a hash
 * - Field "payload": the encoded record
 * - Field "revision": the writer's revision
 *
 * The revision compare, the write and the change notification run in one Lua
 * script, so a stale write can never overwrite a newer one and every accepted
 * write is published on a channel named after its key. Peers subscribe to
 * those channels with a pattern.
 *
 * Keys expire after the retention period so abandoned records do not outlive
 * their owners indefinitely.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "location-sharing.store.type", havingValue = "redis", matchIfMissing = true)
public class RedisSharedLocationStore implements SharedLocationStore {

    static final String PAYLOAD_FIELD = "payload";
    static final String REVISION_FIELD = "revision";

    private static final RedisScript<Long> PUT_IF_NEWER = new DefaultRedisScript<>(
        "local current = redis.call('HGET', KEYS[1], 'revision') "
            + "if current and tonumber(current) >= tonumber(ARGV[2]) then return 0 end "
            + "redis.call('HSET', KEYS[1], 'payload', ARGV[1], 'revision', ARGV[2]) "
            + "redis.call('EXPIRE', KEYS[1], ARGV[3]) "
            + "redis.call('PUBLISH', KEYS[1], ARGV[1]) "
            + "return 1",
        Long.class);

    private static final RedisScript<Long> REMOVE = new DefaultRedisScript<>(
        "local removed = redis.call('DEL', KEYS[1]) "
            + "if removed > 0 then redis.call('PUBLISH', KEYS[1], '') end "
            + "return removed",
        Long.class);

    private final StringRedisTemplate redisTemplate;
    private final RedisMessageListenerContainer listenerContainer;
    private final Duration retention;

    public RedisSharedLocationStore(
        StringRedisTemplate redisTemplate,
        RedisMessageListenerContainer listenerContainer,
        @Value("${location-sharing.store.retention-hours:24}") long retentionHours
    ) {
        this.redisTemplate = redisTemplate;
        this.listenerContainer = listenerContainer;
        this.retention = Duration.ofHours(retentionHours);
    }

    @Override
    public boolean put(String key, String payload, long revision) {
        try {
            Long accepted = redisTemplate.execute(PUT_IF_NEWER, List.of(key),
                payload, String.valueOf(revision), String.valueOf(retention.toSeconds()));
            boolean written = accepted != null && accepted == 1L;
            if (!written) {
                log.debug("Rejected stale write: key={}, revision={}", key, revision);
            }
            return written;
        } catch (DataAccessException e) {
            throw new PublishFailureException("Failed to write " + key + " to Redis", e);
        }
    }

    @Override
    public void remove(String key) {
        try {
            redisTemplate.execute(REMOVE, List.of(key));
        } catch (DataAccessException e) {
            throw new PublishFailureException("Failed to remove " + key + " from Redis", e);
        }
    }

    @Override
    public Optional<String> get(String key) {
        try {
            Object payload = redisTemplate.opsForHash().get(key, PAYLOAD_FIELD);
            return Optional.ofNullable(payload).map(Object::toString);
        } catch (DataAccessException e) {
            log.warn("Failed to read {} from Redis: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public StoreSubscription onValueChanged(String keyPattern, Consumer<StoreChange> listener) {
        MessageListener messageListener = changeListener(listener);
        PatternTopic topic = new PatternTopic(keyPattern);
        listenerContainer.addMessageListener(messageListener, topic);
        log.info("Subscribed to store changes on '{}'", keyPattern);
        return () -> listenerContainer.removeMessageListener(messageListener, topic);
    }

    static MessageListener changeListener(Consumer<StoreChange> listener) {
        return (Message message, byte[] pattern) -> {
            String key = new String(message.getChannel(), StandardCharsets.UTF_8);
            String payload = new String(message.getBody(), StandardCharsets.UTF_8);
            listener.accept(new StoreChange(key, payload.isEmpty() ? null : payload));
        };
    }
}
