package io.lrma.longsplit.application.pipeline;

/**
 * Totals reported when a segmentation run completes.
 *
 * @param readsProcessed reads consumed by the writer
 * @param elementsWritten element records written to the sink
 * @param readsWithoutBoundaries reads where no delimiter boundary or template was found
 * @since 0.1.0
 */
public record SegmentationSummary(long readsProcessed, long elementsWritten, long readsWithoutBoundaries) {}
