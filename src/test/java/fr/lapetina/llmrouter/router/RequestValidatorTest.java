package fr.lapetina.llmrouter.router;

import fr.lapetina.llmrouter.domain.model.GenerationRequest;
import fr.lapetina.llmrouter.domain.model.GenerationRequest.ChatMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestValidatorTest {

    private final RequestValidator validator = new RequestValidator(20);

    @Test
    @DisplayName("should accept a prompt-only request")
    void shouldAcceptPromptRequest() {
        assertThatCode(() -> validator.validate(GenerationRequest.ofPrompt("auto", "Hello")))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("should accept a history-only request")
    void shouldAcceptHistoryRequest() {
        GenerationRequest request = GenerationRequest.builder()
                .modelId("model-a")
                .addMessage(ChatMessage.user("Hi"))
                .addMessage(ChatMessage.assistant("Hello!"))
                .build();

        assertThatCode(() -> validator.validate(request)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("should require a model id")
    void shouldRequireModelId() {
        assertThatThrownBy(() -> validator.validate(GenerationRequest.ofPrompt(" ", "Hello")))
                .isInstanceOf(RoutingException.class)
                .hasMessageContaining("Model id is required");
    }

    @Test
    @DisplayName("should require a prompt or history")
    void shouldRequireContent() {
        assertThatThrownBy(() -> validator.validate(GenerationRequest.ofPrompt("auto", null)))
                .isInstanceOf(RoutingException.class)
                .hasMessageContaining("Either user prompt or history");
    }

    @Test
    @DisplayName("should enforce the maximum prompt length")
    void shouldEnforceMaxLength() {
        assertThatThrownBy(() -> validator.validate(GenerationRequest.ofPrompt("auto", "x".repeat(21))))
                .isInstanceOf(RoutingException.class)
                .hasMessageContaining("exceeds maximum length of 20");

        GenerationRequest longSystem = GenerationRequest.builder()
                .modelId("auto").userPrompt("ok").systemPrompt("y".repeat(25)).build();
        assertThatThrownBy(() -> validator.validate(longSystem))
                .hasMessageContaining("System prompt");
    }

    @Test
    @DisplayName("should reject messages without role")
    void shouldRejectMessagesWithoutRole() {
        GenerationRequest request = GenerationRequest.builder()
                .modelId("auto")
                .addMessage(null, "orphan")
                .build();

        assertThatThrownBy(() -> validator.validate(request))
                .isInstanceOf(RoutingException.class)
                .hasMessageContaining("role");
    }
}
