package io.lrma.longsplit.application.port;

import io.lrma.longsplit.domain.read.Read;

/**
 * <strong>What:</strong> Input port supplying annotated reads in stream order.
 * <p><strong>Why:</strong> Lets the segmentation pipeline run over files, fixtures, or other record
 * containers without binding to a container library.</p>
 * <p><strong>Role:</strong> Input port on the producer side of the segmentation pipeline.</p>
 * <p><strong>Thread-safety:</strong> Not required; only the producer thread reads from a source.</p>
 *
 * @since 0.1.0
 */
public interface ReadSource extends AutoCloseable {
  /**
   * Returns the next read or {@code null} when the stream is exhausted.
   *
   * @return next read, or {@code null} at end of input
   * @throws Exception if the underlying container cannot be read
   *
   * <p><strong>Concurrency:</strong> Invoke from a single thread.</p>
   * <p><strong>Performance:</strong> Expected to stream records without loading the whole input.</p>
   */
  Read next() throws Exception;

  /**
   * Releases the underlying container.
   *
   * @throws Exception if closing fails
   */
  @Override
  default void close() throws Exception {}
}
