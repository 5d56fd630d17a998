package com.flagrank.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.flagrank.config.FlagrankRuntimeProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

/**
 * Fans score events out to every instance over a Redis pub/sub channel.
 * <p>
 * Each instance keeps its own running tallies, so every event must reach every instance. Events are
 * applied locally first and then broadcast; an instance ignores its own broadcasts. Pub/sub delivery is
 * at most once: a peer that misses a broadcast (or cannot read one) is repaired by a ledger resync, and
 * failing that by the periodic reconciliation pass. While Redis is unreachable events stay local and
 * publishing is retried after a backoff.
 */
@Service
@Primary
@ConditionalOnProperty(
        prefix = "flagrank.worker",
        name = "queue-mode",
        havingValue = "redis"
)
public class RedisScoreEventQueue implements ScoreEventQueue, MessageListener {

    private static final Logger log = LoggerFactory.getLogger(RedisScoreEventQueue.class);
    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    private static final Duration REDIS_FAILURE_BACKOFF = Duration.ofSeconds(5);

    private final StringRedisTemplate stringRedisTemplate;
    private final RedisMessageListenerContainer scoreEventListenerContainer;
    private final FlagrankRuntimeProperties flagrankRuntimeProperties;
    private final InMemoryScoreEventQueue localQueue;
    private final String instanceId = UUID.randomUUID().toString();

    private volatile boolean running = true;
    private volatile boolean fallbackMode;
    private volatile long redisRetryNotBeforeNanos;

    public RedisScoreEventQueue(
            StringRedisTemplate stringRedisTemplate,
            RedisMessageListenerContainer scoreEventListenerContainer,
            FlagrankRuntimeProperties flagrankRuntimeProperties,
            InMemoryScoreEventQueue localQueue
    ) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.scoreEventListenerContainer = scoreEventListenerContainer;
        this.flagrankRuntimeProperties = flagrankRuntimeProperties;
        this.localQueue = localQueue;
    }

    @PostConstruct
    void subscribe() {
        scoreEventListenerContainer.addMessageListener(this, new ChannelTopic(resolveChannel()));
        log.info("Score events fan out over Redis channel {} (instance {})", resolveChannel(), instanceId);
    }

    @PreDestroy
    void unsubscribe() {
        running = false;
        scoreEventListenerContainer.removeMessageListener(this);
    }

    @Override
    public void enqueue(ScoreEvent event) {
        if (!running) {
            throw new IllegalStateException("Score event queue is not running");
        }
        ScoreEvent requiredEvent = Objects.requireNonNull(event, "event is required");
        String channel = resolveChannel();
        localQueue.enqueue(requiredEvent);
        if (!shouldAttemptRedis()) {
            log.debug("Redis in backoff; score entry {} stays local", requiredEvent.entryKey());
            return;
        }
        try {
            stringRedisTemplate.convertAndSend(channel, serialize(new Broadcast(instanceId, requiredEvent)));
            markRedisHealthy();
        } catch (RuntimeException ex) {
            markRedisFailure(ex);
        }
    }

    @Override
    public void setConsumer(ScoreEventConsumer consumer) {
        localQueue.setConsumer(Objects.requireNonNull(consumer, "consumer is required"));
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        String payload = new String(message.getBody(), StandardCharsets.UTF_8);
        Broadcast broadcast;
        try {
            broadcast = OBJECT_MAPPER.readValue(payload, Broadcast.class);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            UUID teamId = teamIdOf(payload);
            log.warn(
                    "Unreadable score event broadcast; resyncing {} from the ledger ({})",
                    teamId != null ? "team " + teamId : "all teams",
                    ex.getMessage()
            );
            localQueue.requestResync(teamId);
            return;
        }
        if (instanceId.equals(broadcast.origin())) {
            return;
        }
        localQueue.enqueue(broadcast.event());
    }

    boolean isFallbackMode() {
        return fallbackMode;
    }

    String instanceId() {
        return instanceId;
    }

    static String serialize(Broadcast broadcast) {
        try {
            return OBJECT_MAPPER.writeValueAsString(broadcast);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize score event", ex);
        }
    }

    // Best effort: a payload that is valid JSON but not a valid event still names its team.
    static UUID teamIdOf(String payload) {
        try {
            JsonNode teamId = OBJECT_MAPPER.readTree(payload).path("event").path("teamId");
            return teamId.isTextual() ? UUID.fromString(teamId.asText()) : null;
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            return null;
        }
    }

    private String resolveChannel() {
        String channel = flagrankRuntimeProperties.getWorker().getRedisChannel();
        if (channel == null || channel.isBlank()) {
            throw new IllegalStateException("flagrank.worker.redis-channel must not be blank");
        }
        return channel.trim();
    }

    private boolean shouldAttemptRedis() {
        return !fallbackMode || System.nanoTime() - redisRetryNotBeforeNanos >= 0;
    }

    private void markRedisFailure(RuntimeException ex) {
        redisRetryNotBeforeNanos = System.nanoTime() + REDIS_FAILURE_BACKOFF.toNanos();
        if (!fallbackMode) {
            fallbackMode = true;
            log.warn(
                    "Redis score channel is unavailable ({}); events stay local until it recovers and peers catch up on reconciliation",
                    safeMessage(ex)
            );
        }
    }

    private void markRedisHealthy() {
        if (fallbackMode) {
            log.info("Redis score channel restored; broadcasting score events again");
        }
        fallbackMode = false;
        redisRetryNotBeforeNanos = 0L;
    }

    private static String safeMessage(RuntimeException ex) {
        String message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }

    record Broadcast(String origin, ScoreEvent event) {
    }
}
