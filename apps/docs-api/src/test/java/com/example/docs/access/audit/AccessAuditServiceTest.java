package com.example.docs.access.audit;

import com.example.docs.access.document.AccessLogDoc;
import com.example.docs.access.model.AccessDecision;
import com.example.docs.access.model.AccessType;
import com.example.docs.access.model.DenyReason;
import com.example.docs.access.model.MethodClass;
import com.example.docs.access.model.ResourceKind;
import com.example.docs.access.repository.AccessLogRepository;
import com.example.docs.config.properties.DocsProperties;
import com.example.docs.document.document.DocumentDoc;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Map;

import static com.example.docs.util.AuthContextTestBuilder.aUser;
import static com.example.docs.util.DocumentTestBuilder.aDocument;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AccessAuditService")
class AccessAuditServiceTest {

    @Mock
    private AccessLogRepository accessLogRepository;

    private AccessAuditService auditService;

    @BeforeEach
    void setUp() {
        auditService = new AccessAuditService(
                accessLogRepository, new ObjectMapper(), new DocsProperties(null, null, null));
    }

    @Nested
    @DisplayName("record")
    class Record {

        @Test
        @DisplayName("should persist the entry with the first forwarded hop and a truncated user agent")
        void shouldPersistEntry() {
            DocumentDoc document = aDocument().withId("doc-9").build();
            MockServerHttpRequest request = MockServerHttpRequest.get("/api/v1/workspaces/acme/documents/doc-9")
                    .header("X-Forwarded-For", "203.0.113.7, 10.0.0.1")
                    .header("User-Agent", "a".repeat(600))
                    .build();
            when(accessLogRepository.save(any(AccessLogDoc.class)))
                    .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

            StepVerifier.create(auditService.record(AccessType.ADMIN_VIEW, document, aUser("admin-1"), request,
                            Map.of("ownerId", "owner-1")))
                    .expectNextCount(1)
                    .verifyComplete();

            ArgumentCaptor<AccessLogDoc> captor = ArgumentCaptor.forClass(AccessLogDoc.class);
            verify(accessLogRepository).save(captor.capture());
            AccessLogDoc saved = captor.getValue();
            assertThat(saved.getResourceKind()).isEqualTo(ResourceKind.DOCUMENT);
            assertThat(saved.getResourceId()).isEqualTo("doc-9");
            assertThat(saved.getUserId()).isEqualTo("admin-1");
            assertThat(saved.getAccessType()).isEqualTo(AccessType.ADMIN_VIEW);
            assertThat(saved.getIpAddress()).isEqualTo("203.0.113.7");
            assertThat(saved.getUserAgent()).hasSize(500);
            assertThat(saved.getMetadata()).containsEntry("ownerId", "owner-1");
        }

        @Test
        @DisplayName("should propagate repository failures")
        void shouldPropagateFailures() {
            when(accessLogRepository.save(any(AccessLogDoc.class)))
                    .thenReturn(Mono.error(new IllegalStateException("write failed")));

            StepVerifier.create(auditService.record(AccessType.VIEW, aDocument().build(), aUser("user-1"),
                            null, null))
                    .expectError(IllegalStateException.class)
                    .verify();
        }

        @Test
        @DisplayName("should store empty metadata when none is given")
        void shouldDefaultMetadata() {
            when(accessLogRepository.save(any(AccessLogDoc.class)))
                    .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

            StepVerifier.create(auditService.record(AccessType.LOCK, aDocument().build(), aUser("user-1"),
                            null, null))
                    .assertNext(saved -> {
                        assertThat(saved.getMetadata()).isEmpty();
                        assertThat(saved.getIpAddress()).isNull();
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("logDecision")
    class LogDecision {

        @Test
        @DisplayName("should log allows and denials without a request")
        void shouldLogWithoutRequest() {
            assertThatCode(() -> {
                auditService.logDecision(aUser("user-1"), "acme", aDocument().build(), MethodClass.SAFE,
                        AccessDecision.allow("OWNER"), null);
                auditService.logDecision(null, "acme", null, MethodClass.MUTATING,
                        AccessDecision.deny("AUTHENTICATED", DenyReason.UNAUTHENTICATED), null);
            }).doesNotThrowAnyException();
        }
    }

    @Test
    @DisplayName("should read history newest first from the repository")
    void shouldReadHistory() {
        DocumentDoc document = aDocument().withId("doc-3").build();
        AccessLogDoc entry = AccessLogDoc.builder().id("log-1").accessType(AccessType.VIEW).build();
        when(accessLogRepository.findByResourceKindAndResourceIdOrderByCreatedAtDesc(ResourceKind.DOCUMENT, "doc-3"))
                .thenReturn(Flux.just(entry));

        StepVerifier.create(auditService.history(document))
                .expectNext(entry)
                .verifyComplete();
    }
}
