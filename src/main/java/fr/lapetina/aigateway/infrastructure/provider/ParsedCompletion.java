package fr.lapetina.aigateway.infrastructure.provider;

import fr.lapetina.aigateway.domain.model.TokenUsage;

/**
 * Completion extracted from a provider response body.
 *
 * @param model model reported by the provider, or null when the body does not carry one
 */
public record ParsedCompletion(String content, TokenUsage usage, String finishReason, String model) {
}
