package io.lrma.longsplit.application.port;

import io.lrma.longsplit.domain.read.Read;

/**
 * <strong>What:</strong> Output port receiving split array elements.
 * <p><strong>Why:</strong> Keeps the writer stage independent of the record container it produces.</p>
 * <p><strong>Role:</strong> Output port on the sink side of the segmentation pipeline.</p>
 * <p><strong>Thread-safety:</strong> Not required; the pipeline guarantees a single writer thread.</p>
 * <p><strong>Observability:</strong> Write failures are fatal to the run and must propagate.</p>
 *
 * @since 0.1.0
 */
public interface ArrayElementSink extends AutoCloseable {
  /**
   * Writes one array element record.
   *
   * @param element element read to persist; never {@code null}
   * @throws Exception if the underlying container rejects the write
   */
  void write(Read element) throws Exception;

  /**
   * Flushes buffered records.
   *
   * @throws Exception if flushing fails
   */
  default void flush() throws Exception {}

  /**
   * Finalizes the output container. Implementations must tolerate repeated calls.
   *
   * @throws Exception if finalization fails
   */
  @Override
  default void close() throws Exception {}
}
