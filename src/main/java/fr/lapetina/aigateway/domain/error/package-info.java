/**
 * Error taxonomy.
 *
 * <p>All errors are unchecked and extend {@link fr.lapetina.aigateway.domain.error.GatewayException}.
 * Provider failures are classified once, by the adapter that observed them, into an
 * {@link fr.lapetina.aigateway.domain.error.ErrorType}; retry and failover decisions read
 * {@link fr.lapetina.aigateway.domain.error.ErrorType#isRetryable()} and never reclassify.
 */
package fr.lapetina.aigateway.domain.error;
