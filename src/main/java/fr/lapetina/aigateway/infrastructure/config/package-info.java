/**
 * Configuration loading and hot-reload support.
 *
 * <p>YAML is bound onto {@link fr.lapetina.aigateway.infrastructure.config.GatewayConfig} by SnakeYAML,
 * validated, and handed to listeners. API keys may reference environment variables as {@code ${NAME}}.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code strategy}, {@code enableFailover}, {@code enableLoadBalancing}, {@code enableCircuitBreaker}</li>
 *   <li>{@code providers} - Backends, their weights, quality ranks and pricing</li>
 *   <li>{@code circuitBreaker} - Failure isolation thresholds</li>
 *   <li>{@code retry} - Backoff policy</li>
 *   <li>{@code loadBalancing} - Concurrency limits and wait queue</li>
 *   <li>{@code request} - Deadlines and timeouts</li>
 *   <li>{@code healthCheck} - Health check interval</li>
 *   <li>{@code cache} - Memory and persistent tiers, similarity lookup</li>
 *   <li>{@code budgets} - Daily and monthly spend limits</li>
 *   <li>{@code events}, {@code server}, {@code metrics}</li>
 * </ul>
 *
 * @see fr.lapetina.aigateway.infrastructure.config.ConfigLoader
 */
package fr.lapetina.aigateway.infrastructure.config;
