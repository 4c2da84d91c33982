package com.jonathantong.SensorRelay.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jonathantong.SensorRelay.broadcast.BroadcastHub;
import com.jonathantong.SensorRelay.model.ChangeEvent;
import com.jonathantong.SensorRelay.service.SensorHistoryService;
import com.jonathantong.SensorRelay.service.WatchedEntities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket endpoint for live subscribers.
 * A new subscriber is registered with the hub, then receives the latest stored values of every
 * watched entity. Anything the subscriber sends is ignored.
 */
@Component
public class SensorWebSocketHandler extends TextWebSocketHandler {

    private static final Logger logger = LoggerFactory.getLogger(SensorWebSocketHandler.class);

    private final BroadcastHub broadcastHub;
    private final SensorHistoryService sensorHistoryService;
    private final WatchedEntities watchedEntities;
    private final ObjectMapper objectMapper;
    private final int initialCount;
    private final int sendTimeLimitMs;
    private final int bufferSizeLimit;

    private final Map<String, WebSocketSubscriberConnection> connections = new ConcurrentHashMap<>();

    @Autowired
    public SensorWebSocketHandler(
            BroadcastHub broadcastHub,
            SensorHistoryService sensorHistoryService,
            WatchedEntities watchedEntities,
            ObjectMapper objectMapper,
            @Value("${sensorrelay.history.initial-count:5}") int initialCount,
            @Value("${sensorrelay.web.send-time-limit-ms:5000}") int sendTimeLimitMs,
            @Value("${sensorrelay.web.buffer-size-limit:65536}") int bufferSizeLimit) {
        this.broadcastHub = broadcastHub;
        this.sensorHistoryService = sensorHistoryService;
        this.watchedEntities = watchedEntities;
        this.objectMapper = objectMapper;
        this.initialCount = initialCount;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimit = bufferSizeLimit;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        // Live fan-out and the history replay below may send concurrently
        WebSocketSubscriberConnection connection = new WebSocketSubscriberConnection(
                new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit));

        connections.put(session.getId(), connection);
        broadcastHub.subscribe(connection);

        sendInitialValues(connection);
    }

    private void sendInitialValues(WebSocketSubscriberConnection connection) {
        for (String entityId : watchedEntities.getEntityIds()) {
            List<ChangeEvent> events;
            try {
                events = sensorHistoryService.latestEvents(entityId, initialCount);
            } catch (DataAccessException e) {
                logger.error("Failed to load initial values for subscriber {}: {}", connection.getId(), e.getMessage());
                return;
            }

            for (ChangeEvent event : events) {
                try {
                    connection.send(objectMapper.writeValueAsString(event));
                } catch (IOException | RuntimeException e) {
                    // The connection is unusable; the live fan-out will unregister it
                    logger.warn("Initial send of {} to subscriber {} failed: {}", entityId, connection.getId(), e.getMessage());
                    return;
                }
            }
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        // keep-alive only
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        logger.debug("Transport error on subscriber {}: {}", session.getId(), exception.getMessage());
        release(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        logger.debug("Subscriber {} closed: {}", session.getId(), status);
        release(session);
    }

    private void release(WebSocketSession session) {
        WebSocketSubscriberConnection connection = connections.remove(session.getId());
        if (connection != null) {
            broadcastHub.unsubscribe(connection);
        }
    }
}
