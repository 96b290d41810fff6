/**
 * <strong>Purpose:</strong> Ports defining the read source -> segmentation -> element sink contracts.
 * <p><strong>Pipeline role:</strong> Application boundary; adapters in {@code infrastructure} implement them.
 * <p><strong>Concurrency:</strong> Sources are read by the producer thread only; sinks are written by the
 * single writer thread only; metrics ports must be thread-safe.
 *
 * @since 0.1.0
 */
package io.lrma.longsplit.application.port;
