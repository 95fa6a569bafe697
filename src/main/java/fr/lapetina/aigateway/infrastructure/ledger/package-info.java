/**
 * Usage ledger and budget enforcement.
 *
 * <p>{@link fr.lapetina.aigateway.infrastructure.ledger.TokenTracker} appends one row per
 * completed request to an H2 table and keeps daily and monthly totals in step with it.
 */
package fr.lapetina.aigateway.infrastructure.ledger;
