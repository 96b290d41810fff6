/**
 * <strong>Purpose:</strong> Segmentation use case: read source to decoding workers to the single element writer.
 * <p><strong>Pipeline role:</strong> Application layer orchestrating domain matchers over ports.
 * <p><strong>Concurrency:</strong> {@link io.lrma.longsplit.application.pipeline.SegmentationUseCase} owns all
 * threads; decoders are shared by workers, the element writer is confined to the writer thread.
 * <p><strong>Observability:</strong> Emits {@code segment.*} metrics and progress logs.
 *
 * @since 0.1.0
 */
package io.lrma.longsplit.application.pipeline;
