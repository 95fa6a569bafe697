/**
 * Provider registry and health monitoring.
 *
 * <p>The {@link fr.lapetina.aigateway.infrastructure.health.ProviderRegistry} keeps every
 * configured provider in registration order together with its circuit breaker and latency
 * window. The {@link fr.lapetina.aigateway.infrastructure.health.HealthMonitor} checks them
 * periodically.
 */
package fr.lapetina.aigateway.infrastructure.health;
