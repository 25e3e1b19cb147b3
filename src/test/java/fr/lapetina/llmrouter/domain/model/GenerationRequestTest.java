package fr.lapetina.llmrouter.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GenerationRequestTest {

    @Test
    @DisplayName("should treat auto and default as automatic model selection")
    void shouldDetectAutomaticModel() {
        assertThat(GenerationRequest.ofPrompt("auto", "x").isAutomaticModel()).isTrue();
        assertThat(GenerationRequest.ofPrompt("DEFAULT", "x").isAutomaticModel()).isTrue();
        assertThat(GenerationRequest.ofPrompt("model-a", "x").isAutomaticModel()).isFalse();
    }

    @Test
    @DisplayName("should default optional parts")
    void shouldDefaultOptionalParts() {
        GenerationRequest request = GenerationRequest.ofPrompt("auto", "Hello");

        assertThat(request.history()).isEmpty();
        assertThat(request.executionSettings()).isEmpty();
        assertThat(request.routingHints()).isSameAs(RoutingHints.none());
        assertThat(request.routingHints().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("should copy settings defensively and keep null values")
    void shouldCopySettings() {
        Map<String, Object> settings = new HashMap<>();
        settings.put("stop", null);
        GenerationRequest request = GenerationRequest.builder()
                .modelId("auto")
                .userPrompt("Hello")
                .executionSettings(settings)
                .build();

        settings.put("temperature", 0.3);

        assertThat(request.executionSettings()).containsOnlyKeys("stop");
        assertThatThrownBy(() -> request.executionSettings().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("should compare requests by content")
    void shouldCompareByContent() {
        GenerationRequest first = GenerationRequest.builder()
                .modelId("auto").userPrompt("Hi").setting("temperature", 0.2).build();
        GenerationRequest second = GenerationRequest.builder()
                .modelId("auto").userPrompt("Hi").setting("temperature", 0.2).build();

        assertThat(first).isEqualTo(second);
    }

    @Test
    @DisplayName("should mark cache hits with a fresh id")
    void shouldMarkCacheHits() {
        GenerationResponse response = new GenerationResponse(
                "resp-1", "model-a", "text", null, null, null, false);

        GenerationResponse hit = response.asCacheHit("resp-2");

        assertThat(hit.fromCache()).isTrue();
        assertThat(hit.responseId()).isEqualTo("resp-2");
        assertThat(hit.content()).isEqualTo("text");
        assertThat(hit.usage()).isEqualTo(UsageStatistics.empty());
    }

    @Test
    @DisplayName("should clamp model weights to at least one")
    void shouldClampWeights() {
        ModelDescriptor descriptor = ModelDescriptor.builder().id("model-a").weight(0).build();

        assertThat(descriptor.weight()).isEqualTo(1);
        assertThat(descriptor.supports(Set.of())).isTrue();
        assertThat(descriptor.supports(Set.of(ModelCapability.VISION))).isFalse();
    }
}
