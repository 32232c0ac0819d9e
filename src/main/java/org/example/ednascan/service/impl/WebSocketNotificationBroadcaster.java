package org.example.ednascan.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.ednascan.dto.event.PipelineEvent;
import org.example.ednascan.service.NotificationBroadcaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

// a slow client overflows its buffer and is dropped
@Service
public class WebSocketNotificationBroadcaster extends TextWebSocketHandler implements NotificationBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(WebSocketNotificationBroadcaster.class);

    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;
    private final int sendTimeLimitMillis;
    private final int bufferSizeLimitBytes;

    public WebSocketNotificationBroadcaster(ObjectMapper objectMapper,
                                            @Value("${notifications.send-time-limit-ms:5000}") int sendTimeLimitMillis,
                                            @Value("${notifications.buffer-size-limit-bytes:524288}") int bufferSizeLimitBytes) {
        this.objectMapper = objectMapper;
        this.sendTimeLimitMillis = sendTimeLimitMillis;
        this.bufferSizeLimitBytes = bufferSizeLimitBytes;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSession decorated = new ConcurrentWebSocketSessionDecorator(
                session, sendTimeLimitMillis, bufferSizeLimitBytes,
                ConcurrentWebSocketSessionDecorator.OverflowStrategy.TERMINATE);
        sessions.put(session.getId(), decorated);
        log.info("WebSocket observer {} connected", session.getId());

        Map<String, Object> greeting = new LinkedHashMap<>();
        greeting.put("type", "connected");
        greeting.put("message", "Real-time connection established");
        try {
            send(decorated, objectMapper.writeValueAsString(greeting));
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize greeting", e);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session.getId());
        log.info("WebSocket observer {} disconnected ({})", session.getId(), status);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("WebSocket observer {} transport error: {}", session.getId(), exception.getMessage());
        drop(session.getId());
    }

    @Override
    public void publish(PipelineEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Could not serialize {} event", event.getType(), e);
            return;
        }
        for (WebSocketSession session : sessions.values()) {
            send(session, payload);
        }
        log.debug("Published {} to {} observers", event.getType(), sessions.size());
    }

    private void send(WebSocketSession session, String payload) {
        if (!session.isOpen()) {
            drop(session.getId());
            return;
        }
        try {
            session.sendMessage(new TextMessage(payload));
        } catch (IOException | RuntimeException e) {
            log.warn("Dropping WebSocket observer {}: {}", session.getId(), e.getMessage());
            drop(session.getId());
        }
    }

    private void drop(String sessionId) {
        WebSocketSession session = sessions.remove(sessionId);
        if (session == null) {
            return;
        }
        try {
            session.close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (IOException e) {
            log.debug("Closing dropped observer {} failed: {}", sessionId, e.getMessage());
        }
    }
}
