package fr.lapetina.llmrouter.integration;

import fr.lapetina.llmrouter.domain.model.GenerationRequest;
import fr.lapetina.llmrouter.domain.model.GenerationResponse;
import fr.lapetina.llmrouter.domain.model.HealthStatus;
import fr.lapetina.llmrouter.domain.model.ModelCapability;
import fr.lapetina.llmrouter.domain.model.RoutingHints;
import fr.lapetina.llmrouter.infrastructure.cache.CacheKeyBuilder;
import fr.lapetina.llmrouter.router.RoutingException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for the fully wired router.
 * Configuration is externalized to test-config.yaml.
 */
class RequestRouterIntegrationTest {

    private TestRouterFactory factory;

    @BeforeEach
    void setUp() {
        factory = TestRouterFactory.create();
    }

    @AfterEach
    void tearDown() {
        if (factory != null) {
            factory.close();
        }
    }

    @Test
    @DisplayName("should route a valid request to the requested model")
    void shouldRouteValidRequest() throws Exception {
        factory.backend("model-a").respondWith("Hello, world!");

        GenerationResponse response = factory.getRouter()
                .route(GenerationRequest.ofPrompt("model-a", "Say hello"))
                .get(5, TimeUnit.SECONDS);

        assertThat(response.content()).isEqualTo("Hello, world!");
        assertThat(response.modelId()).isEqualTo("model-a");
        assertThat(response.fromCache()).isFalse();
    }

    @Test
    @DisplayName("should cache responses in both tiers with the model type TTL")
    void shouldCacheInBothTiers() throws Exception {
        GenerationRequest request = GenerationRequest.ofPrompt("model-a", "Cache me");
        String key = new CacheKeyBuilder("test:").build(request);

        factory.getRouter().route(request).get(5, TimeUnit.SECONDS);
        factory.getResponseCache().clear();
        GenerationResponse second = factory.getRouter().route(request).get(5, TimeUnit.SECONDS);

        assertThat(factory.getSharedTier().contains(key)).isTrue();
        assertThat(factory.getSharedTier().ttlOf(key)).isEqualTo(Duration.ofSeconds(120));
        assertThat(second.fromCache()).isTrue();
        assertThat(factory.backend("model-a").getInvocationCount()).isEqualTo(1);
        assertThat(factory.getMetricsCollector().getMetrics("model-a", Duration.ofMinutes(1)).cacheHits())
                .isEqualTo(1);
    }

    @Test
    @DisplayName("should use the model TTL override")
    void shouldUseModelTtlOverride() throws Exception {
        GenerationRequest request = GenerationRequest.ofPrompt("model-embed", "Embed me");

        factory.getRouter().route(request).get(5, TimeUnit.SECONDS);

        assertThat(factory.getSharedTier().ttlOf(new CacheKeyBuilder("test:").build(request)))
                .isEqualTo(Duration.ofHours(2));
    }

    @Test
    @DisplayName("should never route to disabled models")
    void shouldSkipDisabledModels() throws Exception {
        for (int i = 0; i < 6; i++) {
            GenerationResponse response = factory.getRouter()
                    .route(GenerationRequest.ofPrompt("model-legacy", "Prompt " + i))
                    .get(5, TimeUnit.SECONDS);
            assertThat(response.modelId()).isNotEqualTo("model-legacy");
        }
        assertThat(factory.getBackends().getCreationCount("model-legacy")).isZero();
    }

    @Test
    @DisplayName("should reject requests no model can serve")
    void shouldRejectUnservableRequest() {
        GenerationRequest request = GenerationRequest.builder()
                .modelId("auto")
                .userPrompt("Look at this")
                .routingHints(RoutingHints.requiring(ModelCapability.VISION))
                .build();
        CompletableFuture<GenerationResponse> future = factory.getRouter().route(request);

        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(RoutingException.class);
    }

    @Test
    @DisplayName("should reject prompts over the configured length")
    void shouldRejectLongPrompt() {
        CompletableFuture<GenerationResponse> future = factory.getRouter()
                .route(GenerationRequest.ofPrompt("auto", "x".repeat(2001)));

        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(RoutingException.class)
                .hasMessageContaining("maximum length");
    }

    @Test
    @DisplayName("should fail over when a backend fails")
    void shouldFailOver() throws Exception {
        factory.backend("model-a").failWith(new RuntimeException("Connection refused"));

        GenerationResponse response = factory.getRouter()
                .route(GenerationRequest.ofPrompt("model-a", "Hello"))
                .get(5, TimeUnit.SECONDS);

        assertThat(response.modelId()).isNotEqualTo("model-a");
        assertThat(factory.getRouter().getHealth("model-a").status()).isEqualTo(HealthStatus.UNHEALTHY);
    }

    @Test
    @DisplayName("should process multiple concurrent requests")
    void shouldProcessConcurrentRequests() throws Exception {
        int count = 20;
        List<CompletableFuture<GenerationResponse>> futures = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            futures.add(factory.getRouter().route(GenerationRequest.ofPrompt("auto", "Hello " + i)));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(30, TimeUnit.SECONDS);

        for (int i = 0; i < count; i++) {
            assertThat(futures.get(i).get().content()).isEqualTo("echo: Hello " + i);
        }
        assertThat(factory.getMetricsCollector().activeRequestCount()).isZero();
    }

    @Test
    @DisplayName("should export Prometheus metrics")
    void shouldExportPrometheusMetrics() throws Exception {
        factory.getRouter().route(GenerationRequest.ofPrompt("model-b", "Measure me")).get(5, TimeUnit.SECONDS);

        String scrape = factory.getMetricsRegistry().scrape();

        assertThat(scrape).contains("llm_router_test_requests_total");
        assertThat(scrape).contains("llm_router_test_model_health");
    }
}
