/**
 * The routing facade and its public request and result types.
 *
 * <p>{@link fr.lapetina.aigateway.router.ProviderRouter} owns one set of providers, breakers,
 * limiters and counters. It is built by {@link fr.lapetina.aigateway.RouterFactory} and torn
 * down by {@link fr.lapetina.aigateway.router.ProviderRouter#shutdown()}.
 */
package fr.lapetina.aigateway.router;
