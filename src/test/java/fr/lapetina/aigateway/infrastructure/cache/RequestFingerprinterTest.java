package fr.lapetina.aigateway.infrastructure.cache;

import fr.lapetina.aigateway.domain.model.ChatMessage;
import fr.lapetina.aigateway.domain.model.CompletionRequest;
import fr.lapetina.aigateway.infrastructure.json.ObjectMappers;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RequestFingerprinterTest {

    private final RequestFingerprinter fingerprinter = new RequestFingerprinter(ObjectMappers.create());

    private static CompletionRequest prompt(String text) {
        return CompletionRequest.ofPrompt(text);
    }

    @Test
    @DisplayName("should ignore case and surrounding whitespace")
    void shouldNormalizeContent() {
        assertThat(fingerprinter.fingerprint(prompt("  What is   a Circuit Breaker? ")))
                .isEqualTo(fingerprinter.fingerprint(prompt("what is a circuit breaker?")));
    }

    @Test
    @DisplayName("should produce a 64 character hex digest")
    void shouldProduceSha256Hex() {
        assertThat(fingerprinter.fingerprint(prompt("hello"))).matches("[0-9a-f]{64}");
    }

    @Test
    @DisplayName("should differ when generation parameters differ")
    void shouldIncludeParameters() {
        CompletionRequest base = prompt("hello");

        assertThat(fingerprinter.fingerprint(base.toBuilder().temperature(0.1).build()))
                .isNotEqualTo(fingerprinter.fingerprint(base));
        assertThat(fingerprinter.fingerprint(base.toBuilder().maxTokens(16).build()))
                .isNotEqualTo(fingerprinter.fingerprint(base));
        assertThat(fingerprinter.fingerprint(base.toBuilder().model("gpt-4o").build()))
                .isNotEqualTo(fingerprinter.fingerprint(base));
    }

    @Test
    @DisplayName("should treat default and explicit default parameters alike")
    void shouldApplyDefaults() {
        CompletionRequest implicit = prompt("hello");
        CompletionRequest explicit = implicit.toBuilder()
                .temperature(CompletionRequest.DEFAULT_TEMPERATURE)
                .maxTokens(CompletionRequest.DEFAULT_MAX_TOKENS)
                .build();

        assertThat(fingerprinter.fingerprint(explicit)).isEqualTo(fingerprinter.fingerprint(implicit));
    }

    @Test
    @DisplayName("should ignore provider override and request id")
    void shouldIgnoreRouting() {
        CompletionRequest base = prompt("hello");
        CompletionRequest routed = base.toBuilder().provider("anthropic").requestId("other").build();

        assertThat(fingerprinter.fingerprint(routed)).isEqualTo(fingerprinter.fingerprint(base));
    }

    @Test
    @DisplayName("should distinguish message roles")
    void shouldIncludeRoles() {
        CompletionRequest asUser = CompletionRequest.builder()
                .messages(List.of(ChatMessage.user("be brief")))
                .build();
        CompletionRequest asSystem = CompletionRequest.builder()
                .messages(List.of(ChatMessage.system("be brief")))
                .build();

        assertThat(fingerprinter.fingerprint(asUser)).isNotEqualTo(fingerprinter.fingerprint(asSystem));
    }

    @Test
    @DisplayName("should scope similarity by model")
    void shouldScopeByModel() {
        assertThat(RequestFingerprinter.scopeOf(prompt("hi"))).isEqualTo("default");
        assertThat(RequestFingerprinter.scopeOf(prompt("hi").toBuilder().model("gpt-4o").build()))
                .isEqualTo("gpt-4o");
    }
}
