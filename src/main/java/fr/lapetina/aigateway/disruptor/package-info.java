/**
 * LMAX Disruptor-based event bus for router observability.
 *
 * <p>The router publishes {@link fr.lapetina.aigateway.domain.event.RouterEvent}s into a
 * pre-allocated ring buffer; handler threads turn them into metrics and deliver them to
 * listeners. Publishing uses {@code tryNext} and never blocks a request: a full buffer drops the
 * event and counts it.
 *
 * <h2>Handler Stages</h2>
 * <pre>
 * Metrics → Listener dispatch
 * </pre>
 *
 * @see fr.lapetina.aigateway.disruptor.RouterEventBus
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.aigateway.disruptor;
