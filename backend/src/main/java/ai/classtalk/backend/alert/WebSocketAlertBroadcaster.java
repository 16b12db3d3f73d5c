package ai.classtalk.backend.alert;

import ai.classtalk.backend.model.dto.AlertEvent;
import ai.classtalk.backend.service.ModerationMetricsService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fans alert events out to every connected observer.
 *
 * The registry is a concurrent set. Each event is serialized once and written
 * on the alert executor, so a slow observer never blocks ingestion. Every
 * session is wrapped in a {@link ConcurrentWebSocketSessionDecorator}, which
 * bounds how long and how much a slow peer may buffer before it is dropped.
 */
@Component
public class WebSocketAlertBroadcaster extends TextWebSocketHandler implements AlertBroadcaster {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketAlertBroadcaster.class);

    static final String CONNECTED_TYPE = "CONNECTED";

    private final Set<WebSocketSession> observers = ConcurrentHashMap.newKeySet();
    private final Map<String, WebSocketSession> decoratedById = new ConcurrentHashMap<>();

    private final ObjectMapper objectMapper;
    private final Executor alertExecutor;
    private final ModerationMetricsService metricsService;
    private final int sendTimeLimitMs;
    private final int bufferSizeLimit;

    @Autowired
    public WebSocketAlertBroadcaster(ObjectMapper objectMapper,
                                     @Qualifier("alertExecutor") Executor alertExecutor,
                                     ModerationMetricsService metricsService,
                                     @Value("${app.alerts.send-time-limit-ms:5000}") int sendTimeLimitMs,
                                     @Value("${app.alerts.buffer-size-limit:524288}") int bufferSizeLimit) {
        this.objectMapper = objectMapper;
        this.alertExecutor = alertExecutor;
        this.metricsService = metricsService;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimit = bufferSizeLimit;
        metricsService.registerObserverGauge(observers::size);
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        ObserverIdentity identity = (ObserverIdentity) session.getAttributes()
                .get(AuthenticatingHandshakeInterceptor.IDENTITY_ATTRIBUTE);
        if (identity == null) {
            // the handshake interceptor guarantees an identity; anything else is a wiring error
            session.close(CloseStatus.POLICY_VIOLATION);
            return;
        }

        WebSocketSession observer = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit);
        decoratedById.put(session.getId(), observer);
        observers.add(observer);

        Map<String, Object> ack = new LinkedHashMap<>();
        ack.put("type", CONNECTED_TYPE);
        ack.put("userId", identity.getUserId());
        ack.put("message", "Connected to moderation alerts");
        observer.sendMessage(new TextMessage(objectMapper.writeValueAsString(ack)));

        logger.info("Observer connected ({} open)", observers.size());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        remove(session.getId());
        logger.info("Observer disconnected with status {} ({} open)", status.getCode(), observers.size());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        logger.warn("Observer transport error: {}", exception.getMessage());
        remove(session.getId());
    }

    @Override
    public void publish(AlertEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            logger.error("Could not serialize {} for session {}", event.getType(), event.getSessionId(), e);
            return;
        }

        metricsService.recordAlertBroadcast(event.getType());
        if (observers.isEmpty()) {
            logger.debug("No observers connected for {}", event.getType());
            return;
        }

        TextMessage message = new TextMessage(payload);
        try {
            alertExecutor.execute(() -> deliver(message));
        } catch (RejectedExecutionException e) {
            metricsService.recordAlertDeliveryFailure();
            logger.warn("Alert executor saturated, dropping {} for session {}", event.getType(), event.getSessionId());
        }
    }

    @Override
    public int connectedObserverCount() {
        return observers.size();
    }

    void deliver(TextMessage message) {
        List<WebSocketSession> broken = new ArrayList<>();
        for (WebSocketSession observer : observers) {
            if (!observer.isOpen()) {
                broken.add(observer);
                continue;
            }
            try {
                observer.sendMessage(message);
            } catch (IOException | RuntimeException e) {
                metricsService.recordAlertDeliveryFailure();
                logger.warn("Failed to deliver alert to observer {}: {}", observer.getId(), e.getMessage());
                broken.add(observer);
            }
        }
        for (WebSocketSession observer : broken) {
            remove(observer.getId());
            closeQuietly(observer);
        }
    }

    private void remove(String sessionId) {
        WebSocketSession observer = decoratedById.remove(sessionId);
        if (observer != null) {
            observers.remove(observer);
        }
    }

    private void closeQuietly(WebSocketSession observer) {
        try {
            if (observer.isOpen()) {
                observer.close(CloseStatus.SESSION_NOT_RELIABLE);
            }
        } catch (IOException e) {
            logger.debug("Error closing broken observer {}: {}", observer.getId(), e.getMessage());
        }
    }
}
