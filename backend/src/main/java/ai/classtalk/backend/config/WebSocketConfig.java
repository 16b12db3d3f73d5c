package ai.classtalk.backend.config;

import ai.classtalk.backend.alert.AuthenticatingHandshakeInterceptor;
import ai.classtalk.backend.alert.WebSocketAlertBroadcaster;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.util.List;

/**
 * Registers the moderation alert endpoint that dashboards subscribe to.
 */
@Slf4j
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final WebSocketAlertBroadcaster alertBroadcaster;
    private final AuthenticatingHandshakeInterceptor handshakeInterceptor;
    private final String endpointPath;
    private final List<String> allowedOrigins;

    public WebSocketConfig(WebSocketAlertBroadcaster alertBroadcaster,
                           AuthenticatingHandshakeInterceptor handshakeInterceptor,
                           @Value("${app.alerts.endpoint:/ws/monitor}") String endpointPath,
                           @Value("${app.cors.allowed-origins:https://localhost:5173,https://localhost:3000}") List<String> allowedOrigins) {
        this.alertBroadcaster = alertBroadcaster;
        this.handshakeInterceptor = handshakeInterceptor;
        this.endpointPath = endpointPath;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        log.info("Registering alert endpoint {} for origins {}", endpointPath, allowedOrigins);
        registry.addHandler(alertBroadcaster, endpointPath)
                .addInterceptors(handshakeInterceptor)
                .setAllowedOrigins(allowedOrigins.toArray(new String[0]));
    }
}
