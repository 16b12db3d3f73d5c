package ai.classtalk.backend.alert;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JwtIdentityResolverTest {

    @Mock
    private JwtDecoder jwtDecoder;

    @InjectMocks
    private JwtIdentityResolver resolver;

    @Test
    @DisplayName("A bearer header should resolve to the token subject and display name")
    void shouldResolveFromAuthorizationHeader() {
        MockHttpServletRequest servletRequest = new MockHttpServletRequest("GET", "/ws/monitor");
        servletRequest.addHeader(HttpHeaders.AUTHORIZATION, "Bearer header-token");
        when(jwtDecoder.decode("header-token")).thenReturn(jwt("instructor-1", "Ms. Rivera"));

        Optional<ObserverIdentity> identity = resolver.resolveIdentity(new ServletServerHttpRequest(servletRequest));

        assertThat(identity).isPresent();
        assertThat(identity.get().getUserId()).isEqualTo("instructor-1");
        assertThat(identity.get().getDisplayName()).isEqualTo("Ms. Rivera");
    }

    @Test
    @DisplayName("Browsers may pass the token as a query parameter")
    void shouldResolveFromQueryParameter() {
        MockHttpServletRequest servletRequest = new MockHttpServletRequest("GET", "/ws/monitor");
        servletRequest.setQueryString("access_token=query-token");
        when(jwtDecoder.decode("query-token")).thenReturn(jwt("instructor-2", null));

        Optional<ObserverIdentity> identity = resolver.resolveIdentity(new ServletServerHttpRequest(servletRequest));

        assertThat(identity).isPresent();
        assertThat(identity.get().getDisplayName()).isEqualTo("instructor-2");
    }

    @Test
    void shouldRejectMissingToken() {
        MockHttpServletRequest servletRequest = new MockHttpServletRequest("GET", "/ws/monitor");

        assertThat(resolver.resolveIdentity(new ServletServerHttpRequest(servletRequest))).isEmpty();
        verifyNoInteractions(jwtDecoder);
    }

    @Test
    void shouldRejectInvalidToken() {
        MockHttpServletRequest servletRequest = new MockHttpServletRequest("GET", "/ws/monitor");
        servletRequest.addHeader(HttpHeaders.AUTHORIZATION, "Bearer forged");
        when(jwtDecoder.decode("forged")).thenThrow(new BadJwtException("Signed JWT rejected: Invalid signature"));

        assertThat(resolver.resolveIdentity(new ServletServerHttpRequest(servletRequest))).isEmpty();
    }

    @Test
    void shouldPreferNameThenPreferredUsername() {
        Jwt withUsername = Jwt.withTokenValue("t")
                .header("alg", "HS256")
                .subject("instructor-3")
                .claim("preferred_username", "rivera")
                .build();

        assertThat(JwtIdentityResolver.displayName(jwt("instructor-1", "Ms. Rivera"))).isEqualTo("Ms. Rivera");
        assertThat(JwtIdentityResolver.displayName(withUsername)).isEqualTo("rivera");
    }

    private static Jwt jwt(String subject, String name) {
        Jwt.Builder builder = Jwt.withTokenValue("t").header("alg", "HS256").subject(subject);
        if (name != null) {
            builder.claim("name", name);
        }
        return builder.build();
    }
}
