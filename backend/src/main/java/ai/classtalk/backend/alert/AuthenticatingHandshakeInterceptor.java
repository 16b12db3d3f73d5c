package ai.classtalk.backend.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.util.Map;
import java.util.Optional;

/**
 * Rejects WebSocket upgrades that carry no resolvable identity, before the
 * connection is opened.
 */
@Component
public class AuthenticatingHandshakeInterceptor implements HandshakeInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(AuthenticatingHandshakeInterceptor.class);

    public static final String IDENTITY_ATTRIBUTE = "observerIdentity";

    private final IdentityResolver identityResolver;

    @Autowired
    public AuthenticatingHandshakeInterceptor(IdentityResolver identityResolver) {
        this.identityResolver = identityResolver;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        Optional<ObserverIdentity> identity = identityResolver.resolveIdentity(request);
        if (identity.isEmpty()) {
            logger.warn("Rejected unauthenticated observer connection from {}", request.getRemoteAddress());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }
        attributes.put(IDENTITY_ATTRIBUTE, identity.get());
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        if (exception != null) {
            logger.warn("Observer handshake failed: {}", exception.getMessage());
        }
    }
}
