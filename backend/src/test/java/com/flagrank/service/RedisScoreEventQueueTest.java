package com.flagrank.service;

import com.flagrank.config.FlagrankRuntimeProperties;
import com.flagrank.model.ScoreEntryKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.DefaultMessage;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisScoreEventQueueTest {

    private static final String CHANNEL = "flagrank:test:score:events";
    private static final OffsetDateTime SOLVED_AT = OffsetDateTime.of(2026, 3, 14, 12, 0, 0, 0, ZoneOffset.UTC);

    @Mock
    private StringRedisTemplate stringRedisTemplate;

    @Mock
    private RedisMessageListenerContainer listenerContainer;

    @Mock
    private InMemoryScoreEventQueue localQueue;

    private FlagrankRuntimeProperties flagrankRuntimeProperties;
    private RedisScoreEventQueue redisScoreEventQueue;

    @BeforeEach
    void setUp() {
        flagrankRuntimeProperties = new FlagrankRuntimeProperties();
        flagrankRuntimeProperties.getWorker().setRedisChannel(CHANNEL);
        redisScoreEventQueue = new RedisScoreEventQueue(
                stringRedisTemplate,
                listenerContainer,
                flagrankRuntimeProperties,
                localQueue
        );
    }

    @Test
    void subscribesToConfiguredChannel() {
        redisScoreEventQueue.subscribe();

        verify(listenerContainer).addMessageListener(redisScoreEventQueue, new ChannelTopic(CHANNEL));
    }

    @Test
    void enqueueAppliesLocallyAndBroadcastsToPeers() {
        ScoreEvent event = solveEvent();

        redisScoreEventQueue.enqueue(event);

        verify(localQueue).enqueue(event);
        verify(stringRedisTemplate).convertAndSend(
                eq(CHANNEL),
                argThat((Object payload) -> payload.toString().contains("\"origin\":\"" + redisScoreEventQueue.instanceId() + "\"")
                        && payload.toString().contains(event.teamId().toString())
                        && payload.toString().contains("\"occurredAt\":\"2026-03-14T12:00:00Z\""))
        );
        assertFalse(redisScoreEventQueue.isFallbackMode());
    }

    @Test
    void publishFailureKeepsEventLocalAndBacksOff() {
        ScoreEvent first = solveEvent();
        ScoreEvent second = solveEvent();
        when(stringRedisTemplate.convertAndSend(eq(CHANNEL), anyString()))
                .thenThrow(new RedisConnectionFailureException("redis unavailable"));

        redisScoreEventQueue.enqueue(first);
        redisScoreEventQueue.enqueue(second);

        verify(localQueue).enqueue(first);
        verify(localQueue).enqueue(second);
        verify(stringRedisTemplate, times(1)).convertAndSend(anyString(), anyString());
        assertTrue(redisScoreEventQueue.isFallbackMode());
    }

    @Test
    void peerBroadcastIsHandedToLocalDispatcher() {
        ScoreEvent event = solveEvent();
        String payload = RedisScoreEventQueue.serialize(new RedisScoreEventQueue.Broadcast("peer-instance", event));

        redisScoreEventQueue.onMessage(message(payload), null);

        verify(localQueue).enqueue(event);
    }

    @Test
    void ownBroadcastIsIgnored() {
        String payload = RedisScoreEventQueue.serialize(
                new RedisScoreEventQueue.Broadcast(redisScoreEventQueue.instanceId(), solveEvent())
        );

        redisScoreEventQueue.onMessage(message(payload), null);

        verifyNoInteractions(localQueue);
    }

    @Test
    void invalidEventForKnownTeamResyncsThatTeam() {
        UUID teamId = UUID.randomUUID();
        String payload = "{\"origin\":\"peer-instance\",\"event\":{\"teamId\":\"" + teamId + "\",\"entryKey\":\"\"}}";

        redisScoreEventQueue.onMessage(message(payload), null);

        verify(localQueue).requestResync(teamId);
        verify(localQueue, never()).enqueue(any());
    }

    @Test
    void unparseablePayloadResyncsEveryTeam() {
        redisScoreEventQueue.onMessage(message("not json"), null);

        verify(localQueue).requestResync(null);
    }

    @Test
    void enqueueFailsFastWhenChannelIsBlank() {
        flagrankRuntimeProperties.getWorker().setRedisChannel("   ");

        IllegalStateException thrown = assertThrows(
                IllegalStateException.class,
                () -> redisScoreEventQueue.enqueue(solveEvent())
        );

        assertEquals("flagrank.worker.redis-channel must not be blank", thrown.getMessage());
        verifyNoInteractions(localQueue);
    }

    private static DefaultMessage message(String payload) {
        return new DefaultMessage(CHANNEL.getBytes(StandardCharsets.UTF_8), payload.getBytes(StandardCharsets.UTF_8));
    }

    private static ScoreEvent solveEvent() {
        return new ScoreEvent(UUID.randomUUID(), "solve:" + UUID.randomUUID(), ScoreEntryKind.SOLVE, 100, SOLVED_AT);
    }
}
