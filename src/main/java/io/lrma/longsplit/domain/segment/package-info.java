/**
 * <strong>Purpose:</strong> Segment labels attached to reads and the codec for their tag form.
 * <p><strong>Pipeline role:</strong> Decoded by workers, re-encoded for every emitted array element.
 * <p><strong>Concurrency:</strong> Immutable values and stateless codec; safe to share across workers.
 *
 * @since 0.1.0
 */
package io.lrma.longsplit.domain.segment;
