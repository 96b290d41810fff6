/**
 * <strong>Purpose:</strong> Array structure model and the two delimiter matching policies.
 * <p><strong>Pipeline role:</strong> Pure functions of one read's segment list, invoked by the writer.
 * <p><strong>Concurrency:</strong> Matchers are immutable and keep per-read state on the stack.
 *
 * @since 0.1.0
 */
package io.lrma.longsplit.domain.split;
