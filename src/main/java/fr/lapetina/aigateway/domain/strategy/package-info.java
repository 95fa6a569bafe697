/**
 * Load balancing strategies that order candidate providers for a request.
 *
 * <p>The router walks the ordered list: the first provider is the preferred one, the rest form
 * the failover order. All implementations are thread-safe.
 *
 * <h2>Available Strategies</h2>
 * <table border="1">
 *   <tr><th>Strategy</th><th>Order</th></tr>
 *   <tr><td>{@code cost-based}</td><td>Ascending estimated cost of the request</td></tr>
 *   <tr><td>{@code performance-based}</td><td>Ascending rolling median latency</td></tr>
 *   <tr><td>{@code quality-based}</td><td>Static quality rank, overridable per request</td></tr>
 *   <tr><td>{@code round-robin}</td><td>Rotating starting provider</td></tr>
 *   <tr><td>{@code weighted}</td><td>Weighted random draw without replacement</td></tr>
 * </table>
 *
 * <p>Ties always break by registration order.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * LoadBalancingStrategy strategy = StrategyFactory.create("weighted", new Random(42)).orElseThrow();
 * List<ProviderSnapshot> ordered = strategy.order(candidates, request);
 * }</pre>
 *
 * @see fr.lapetina.aigateway.domain.strategy.LoadBalancingStrategy
 * @see fr.lapetina.aigateway.domain.strategy.StrategyFactory
 */
package fr.lapetina.aigateway.domain.strategy;
