/**
 * Metrics adapters that bridge {@link io.lrma.longsplit.application.port.MetricsPort} to OpenTelemetry.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe and support concurrent metric updates.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code segment.*} namespace.</p>
 */
package io.lrma.longsplit.infrastructure.metrics;
