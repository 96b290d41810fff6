/**
 * Read values exchanged between the record stream adapters and the segmentation pipeline.
 *
 * @since 0.1.0
 */
package io.lrma.longsplit.domain.read;
