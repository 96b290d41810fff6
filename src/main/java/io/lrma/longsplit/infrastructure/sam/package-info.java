/**
 * htsjdk-backed adapters reading annotated reads from and writing array elements to SAM/BAM files.
 *
 * @since 0.1.0
 */
package io.lrma.longsplit.infrastructure.sam;
