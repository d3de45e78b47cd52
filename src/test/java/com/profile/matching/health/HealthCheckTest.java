package com.profile.matching.health;

import com.profile.matching.llm.ReasonBackend;
import com.profile.matching.retrieval.RetrievalException;
import com.profile.matching.retrieval.embedding.EmbeddingModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Health Check Tests")
class HealthCheckTest {

    @Nested
    @DisplayName("HealthStatus")
    class HealthStatusTests {

        @Test
        @DisplayName("Factories set status and message")
        void factories() {
            assertTrue(HealthStatus.up().isUp());
            assertEquals("OK", HealthStatus.up().message());
            assertTrue(HealthStatus.degraded("slow").isDegraded());
            assertTrue(HealthStatus.down("gone").isDown());
            assertEquals("gone", HealthStatus.down("gone").message());
        }

        @Test
        @DisplayName("Only DOWN stops serving")
        void canServe() {
            assertTrue(HealthStatus.up().canServe());
            assertTrue(HealthStatus.degraded("fallback reasons").canServe());
            assertFalse(HealthStatus.down("no model").canServe());
            assertEquals(HealthStatus.Status.DOWN, HealthStatus.Status.DEGRADED.worse(HealthStatus.Status.DOWN));
            assertEquals(HealthStatus.Status.DEGRADED, HealthStatus.Status.DEGRADED.worse(HealthStatus.Status.UP));
        }

        @Test
        @DisplayName("withDetail() adds details and keeps them immutable")
        void withDetail() {
            HealthStatus status = HealthStatus.up().withDetail("latencyMs", 42L).withDetail("model", "m");

            assertEquals(42L, status.details().get("latencyMs"));
            assertEquals(2, status.details().size());
            assertThrows(UnsupportedOperationException.class, () -> status.details().put("x", "y"));
        }
    }

    @Nested
    @DisplayName("ReasonBackendHealthCheck")
    class ReasonBackendTests {

        @Test
        @DisplayName("Reachable backend is UP")
        void reachable() {
            ReasonBackend backend = mock(ReasonBackend.class);
            when(backend.getBackendName()).thenReturn("Ollama/mistral");
            when(backend.isAvailable()).thenReturn(true);

            ReasonBackendHealthCheck check = new ReasonBackendHealthCheck(backend);

            assertEquals("reason-backend:Ollama/mistral", check.getName());
            assertTrue(check.check().isUp());
            assertTrue(check.check().details().containsKey("latencyMs"));
        }

        @Test
        @DisplayName("Unreachable backend only degrades")
        void unreachable() {
            ReasonBackend backend = mock(ReasonBackend.class);
            when(backend.getBackendName()).thenReturn("Ollama/mistral");
            when(backend.isAvailable()).thenReturn(false);

            assertTrue(new ReasonBackendHealthCheck(backend).check().isDegraded());
        }
    }

    @Nested
    @DisplayName("EmbeddingModelHealthCheck")
    class EmbeddingModelTests {

        @Test
        @DisplayName("DOWN until warm-up succeeds, then UP without further calls")
        void warmUp() {
            EmbeddingModel model = mock(EmbeddingModel.class);
            when(model.getModelName()).thenReturn("Ollama/all-minilm");
            doThrow(new RetrievalException("loading")).doNothing().when(model).warmUp();

            EmbeddingModelHealthCheck check = new EmbeddingModelHealthCheck(model);

            assertTrue(check.check().isDown());
            assertTrue(check.check().isUp());
            assertTrue(check.check().isUp());
            verify(model, times(2)).warmUp();
        }
    }

    @Nested
    @DisplayName("HealthCheckRegistry")
    class RegistryTests {

        private HealthCheck fixed(String name, HealthStatus status) {
            return new HealthCheck() {
                @Override
                public String getName() {
                    return name;
                }

                @Override
                public HealthStatus check() {
                    return status;
                }
            };
        }

        @Test
        @DisplayName("Empty registry is UP")
        void empty() {
            assertTrue(new HealthCheckRegistry().checkAll().isUp());
        }

        @Test
        @DisplayName("Aggregate is the worst individual status")
        void worstWins() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(fixed("a", HealthStatus.up()));
            registry.register(fixed("b", HealthStatus.degraded("fallback only")));

            HealthStatus degraded = registry.checkAll();
            assertTrue(degraded.isDegraded());
            assertEquals("b: fallback only", degraded.message());

            registry.register(fixed("c", HealthStatus.down("no model")));
            HealthStatus down = registry.checkAll();
            assertTrue(down.isDown());
            assertEquals(3, down.details().size());
            assertEquals(Map.of("status", "UP", "message", "OK"), down.details().get("a"));
        }

        @Test
        @DisplayName("Null checks are ignored")
        void nullIgnored() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(null);

            assertEquals(0, registry.size());
        }
    }
}
