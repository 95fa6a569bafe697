/**
 * Provider adapters.
 *
 * <p>One adapter per backend family translates the canonical request into the vendor's REST
 * call and the vendor's answer back into a {@link fr.lapetina.aigateway.domain.model.CompletionResult}.
 * Failures are classified here and nowhere else.
 *
 * <ul>
 *   <li>{@link fr.lapetina.aigateway.infrastructure.provider.OpenAiAdapter}</li>
 *   <li>{@link fr.lapetina.aigateway.infrastructure.provider.AnthropicAdapter}</li>
 *   <li>{@link fr.lapetina.aigateway.infrastructure.provider.VertexAdapter}</li>
 *   <li>{@link fr.lapetina.aigateway.infrastructure.provider.GrokAdapter}</li>
 *   <li>{@link fr.lapetina.aigateway.infrastructure.provider.CopilotAdapter}</li>
 * </ul>
 */
package fr.lapetina.aigateway.infrastructure.provider;
