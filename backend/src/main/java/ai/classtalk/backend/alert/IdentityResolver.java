package ai.classtalk.backend.alert;

import org.springframework.http.server.ServerHttpRequest;

import java.util.Optional;

/**
 * Resolves the caller of a WebSocket upgrade request.
 * An empty result rejects the upgrade.
 */
public interface IdentityResolver {

    Optional<ObserverIdentity> resolveIdentity(ServerHttpRequest request);
}
