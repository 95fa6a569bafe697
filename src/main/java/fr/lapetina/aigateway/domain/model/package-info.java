/**
 * Domain model of the gateway.
 *
 * <p>Requests and results are provider-neutral: each adapter translates them to and from its
 * backend's wire format.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.aigateway.domain.model.CompletionRequest} - Immutable canonical request</li>
 *   <li>{@link fr.lapetina.aigateway.domain.model.CompletionResult} - Immutable canonical result with usage and cost</li>
 *   <li>{@link fr.lapetina.aigateway.domain.model.ProviderProfile} - Weight, quality rank and pricing of a provider</li>
 *   <li>{@link fr.lapetina.aigateway.domain.model.ProviderSnapshot} - Routing-time view passed to strategies</li>
 *   <li>{@link fr.lapetina.aigateway.domain.model.CircuitState} - Circuit breaker states</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Every type in this package is immutable.
 */
package fr.lapetina.aigateway.domain.model;
