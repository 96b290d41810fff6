/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and bound read-level diagnostics.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe when invoked from pipeline threads.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package io.lrma.longsplit.logging;
