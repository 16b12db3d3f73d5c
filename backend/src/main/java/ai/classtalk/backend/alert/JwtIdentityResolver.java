package ai.classtalk.backend.alert;

import ai.classtalk.backend.util.SecurityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Optional;

/**
 * Resolves observers from the same HS256 bearer tokens the REST API accepts.
 *
 * Browsers cannot set headers on a WebSocket upgrade, so the token may also
 * be passed as the {@code access_token} query parameter.
 */
@Component
public class JwtIdentityResolver implements IdentityResolver {

    private static final Logger logger = LoggerFactory.getLogger(JwtIdentityResolver.class);

    static final String TOKEN_QUERY_PARAM = "access_token";
    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtDecoder jwtDecoder;

    @Autowired
    public JwtIdentityResolver(JwtDecoder jwtDecoder) {
        this.jwtDecoder = jwtDecoder;
    }

    @Override
    public Optional<ObserverIdentity> resolveIdentity(ServerHttpRequest request) {
        String token = extractToken(request);
        if (token == null) {
            logger.debug("WebSocket upgrade without credentials from {}", request.getRemoteAddress());
            return Optional.empty();
        }

        try {
            Jwt jwt = jwtDecoder.decode(token);
            if (jwt.getSubject() == null) {
                return Optional.empty();
            }
            return Optional.of(new ObserverIdentity(jwt.getSubject(), displayName(jwt)));
        } catch (JwtException e) {
            logger.warn("Rejected WebSocket token: {}", SecurityUtils.sanitizeForLogging(e.getMessage()));
            return Optional.empty();
        }
    }

    /**
     * Display name claim resolution shared with the REST layer:
     * {@code name}, then {@code preferred_username}, then the subject.
     */
    public static String displayName(Jwt jwt) {
        String name = jwt.getClaimAsString("name");
        if (name == null || name.isBlank()) {
            name = jwt.getClaimAsString("preferred_username");
        }
        if (name == null || name.isBlank()) {
            name = jwt.getSubject();
        }
        return name;
    }

    private String extractToken(ServerHttpRequest request) {
        String header = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            return header.substring(BEARER_PREFIX.length()).trim();
        }
        String queryToken = UriComponentsBuilder.fromUri(request.getURI())
                .build()
                .getQueryParams()
                .getFirst(TOKEN_QUERY_PARAM);
        return (queryToken == null || queryToken.isBlank()) ? null : queryToken;
    }
}
