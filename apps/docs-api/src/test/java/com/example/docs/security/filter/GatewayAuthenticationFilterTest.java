package com.example.docs.security.filter;

import com.example.docs.config.properties.DocsProperties;
import com.example.docs.security.context.AuthContext;
import com.example.docs.security.context.AuthContextHolder;
import com.example.docs.security.exception.AuthenticationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GatewayAuthenticationFilter")
class GatewayAuthenticationFilterTest {

    private static final String HEADER_USER_ID = "X-User-Id";
    private static final String HEADER_USER_EMAIL = "X-User-Email";

    private GatewayAuthenticationFilter filter;
    private AtomicReference<AuthContext> captured;
    private WebFilterChain capturingChain;

    @BeforeEach
    void setUp() {
        filter = new GatewayAuthenticationFilter(new DocsProperties(null, null, null));
        captured = new AtomicReference<>();
        capturingChain = exchange -> contextIfPresent()
                .doOnNext(captured::set)
                .then();
    }

    // Anonymous requests leave the context without a caller
    private static Mono<AuthContext> contextIfPresent() {
        return AuthContextHolder.getContext()
                .onErrorResume(AuthenticationException.class, e -> Mono.empty());
    }

    private static MockServerWebExchange exchangeWith(MockServerHttpRequest.BaseBuilder<?> request) {
        return MockServerWebExchange.from(request.build());
    }

    @Nested
    @DisplayName("valid identity")
    class ValidIdentity {

        @Test
        @DisplayName("should store the caller in the reactive context")
        void shouldStoreAuthContext() {
            MockServerWebExchange exchange = exchangeWith(MockServerHttpRequest.get("/api/v1/workspaces/acme/documents")
                    .header(HEADER_USER_ID, " user-42 ")
                    .header(HEADER_USER_EMAIL, "user-42@example.com"));

            StepVerifier.create(filter.filter(exchange, capturingChain))
                    .verifyComplete();

            assertThat(captured.get()).isEqualTo(new AuthContext("user-42", "user-42@example.com"));
        }

        @Test
        @DisplayName("should treat a blank email as absent")
        void shouldDropBlankEmail() {
            MockServerWebExchange exchange = exchangeWith(MockServerHttpRequest.get("/api/v1/workspaces/acme/documents")
                    .header(HEADER_USER_ID, "user-42")
                    .header(HEADER_USER_EMAIL, "   "));

            StepVerifier.create(filter.filter(exchange, capturingChain))
                    .verifyComplete();

            assertThat(captured.get().email()).isNull();
        }

        @Test
        @DisplayName("should read custom header names from configuration")
        void shouldUseConfiguredHeaders() {
            GatewayAuthenticationFilter customFilter = new GatewayAuthenticationFilter(new DocsProperties(
                    new DocsProperties.GatewayProperties("X-Auth-Sub", null), null, null));
            MockServerWebExchange exchange = exchangeWith(MockServerHttpRequest.get("/api/v1/workspaces/acme/documents")
                    .header("X-Auth-Sub", "user-7"));

            StepVerifier.create(customFilter.filter(exchange, capturingChain))
                    .verifyComplete();

            assertThat(captured.get().userId()).isEqualTo("user-7");
        }
    }

    @Nested
    @DisplayName("missing or malformed identity")
    class MissingIdentity {

        @Test
        @DisplayName("should continue anonymously without the header")
        void shouldContinueAnonymously() {
            AtomicBoolean chainCalled = new AtomicBoolean();
            WebFilterChain chain = exchange -> contextIfPresent()
                    .doOnNext(captured::set)
                    .then(Mono.fromRunnable(() -> chainCalled.set(true)));
            MockServerWebExchange exchange = exchangeWith(MockServerHttpRequest.get("/api/v1/workspaces/acme/documents"));

            StepVerifier.create(filter.filter(exchange, chain))
                    .verifyComplete();

            assertThat(chainCalled).isTrue();
            assertThat(captured.get()).isNull();
        }

        @Test
        @DisplayName("should reject identities with unsafe characters")
        void shouldRejectMalformedId() {
            MockServerWebExchange exchange = exchangeWith(MockServerHttpRequest.get("/api/v1/workspaces/acme/documents")
                    .header(HEADER_USER_ID, "user 42; drop"));

            StepVerifier.create(filter.filter(exchange, capturingChain))
                    .expectError(AuthenticationException.class)
                    .verify();
        }

        @Test
        @DisplayName("should fail later when a handler requires the caller")
        void shouldFailWhenContextRequired() {
            WebFilterChain chain = exchange -> AuthContextHolder.getContext().then();
            MockServerWebExchange exchange = exchangeWith(MockServerHttpRequest.get("/api/v1/workspaces/acme/documents"));

            StepVerifier.create(filter.filter(exchange, chain))
                    .expectError(AuthenticationException.class)
                    .verify();
        }
    }
}
