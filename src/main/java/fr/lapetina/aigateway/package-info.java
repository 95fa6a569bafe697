/**
 * AI Provider Gateway - routes LLM completion requests across OpenAI, Anthropic, Vertex AI, Grok
 * and Copilot with failover, circuit breaking, response caching and budget tracking.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.aigateway.RouterFactory} - Main entry point for creating
 *       a fully-configured router from YAML configuration</li>
 *   <li>{@link fr.lapetina.aigateway.router.ProviderRouter} - The routing facade</li>
 *   <li>{@link fr.lapetina.aigateway.GatewayApplication} - Standalone HTTP server</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (RouterFactory factory = RouterFactory.create("gateway.yaml").start()) {
 *     ProviderRouter router = factory.getRouter();
 *
 *     RouteResult result = router.route("Hello!", RouteOptions.builder()
 *             .priority(Priority.HIGH)
 *             .build());
 *     System.out.println(result.provider() + ": " + result.response());
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Load balancing strategies (cost-based, performance-based, quality-based, round-robin, weighted)</li>
 *   <li>Per-provider circuit breakers, bounded retries with backoff and failover</li>
 *   <li>Exact and similarity response cache, in memory and in an embedded H2 store</li>
 *   <li>Token usage ledger with daily and monthly budgets</li>
 *   <li>Hot-reload configuration without restart</li>
 *   <li>Micrometer metrics with Prometheus export, fed by a Disruptor event bus</li>
 * </ul>
 *
 * @see fr.lapetina.aigateway.RouterFactory
 * @see fr.lapetina.aigateway.router.ProviderRouter
 */
package fr.lapetina.aigateway;
