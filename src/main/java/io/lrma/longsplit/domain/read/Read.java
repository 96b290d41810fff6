package io.lrma.longsplit.domain.read;

import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable sequencing read as seen by the segmentation pipeline.
 * <p><strong>Why:</strong> Decouples the matchers and writer from the record container library.</p>
 * <p><strong>Role:</strong> Domain value produced by a {@code ReadSource} and consumed by an
 * {@code ArrayElementSink}; derived array elements are always new instances.</p>
 * <p><strong>Thread-safety:</strong> Immutable; arrays are cloned on the way in and out.</p>
 *
 * @param name read name
 * @param bases base calls, one byte per base
 * @param qualities Phred base qualities aligned 1:1 with {@code bases}; empty when the record has none
 * @param tags record tags in source order
 * @param unmapped whether the record carries the unmapped flag
 * @param mappingQuality mapping quality value
 * @since 0.1.0
 */
public record Read(
    String name,
    byte[] bases,
    byte[] qualities,
    ReadTags tags,
    boolean unmapped,
    int mappingQuality) {

  /** Mapping quality written on records that have no meaningful alignment. */
  public static final int MAPPING_QUALITY_UNAVAILABLE = 255;

  /**
   * Copies arrays and checks that qualities line up with bases.
   *
   * @throws IllegalArgumentException if qualities are present but differ in length from bases
   */
  public Read {
    Objects.requireNonNull(name, "name");
    bases = bases == null ? new byte[0] : bases.clone();
    qualities = qualities == null ? new byte[0] : qualities.clone();
    tags = Objects.requireNonNullElse(tags, ReadTags.empty());
    if (qualities.length != 0 && qualities.length != bases.length) {
      throw new IllegalArgumentException(
          "read " + name + " has " + qualities.length + " qualities for " + bases.length + " bases");
    }
  }

  @Override
  public byte[] bases() {
    return bases.clone();
  }

  @Override
  public byte[] qualities() {
    return qualities.clone();
  }

  /**
   * Returns the number of bases.
   *
   * @return read length
   */
  public int length() {
    return bases.length;
  }

  /**
   * Indicates whether per-base qualities are recorded.
   *
   * @return {@code true} when qualities are present
   */
  public boolean hasQualities() {
    return qualities.length > 0;
  }

  /**
   * Copies the inclusive base range {@code [start, end]}.
   *
   * @param start first base, inclusive
   * @param end last base, inclusive
   * @return copied bases
   */
  public byte[] basesBetween(int start, int end) {
    return Arrays.copyOfRange(bases, start, end + 1);
  }

  /**
   * Copies the inclusive quality range {@code [start, end]}, or an empty array when the read has none.
   *
   * @param start first base, inclusive
   * @param end last base, inclusive
   * @return copied qualities
   */
  public byte[] qualitiesBetween(int start, int end) {
    if (qualities.length == 0) {
      return new byte[0];
    }
    return Arrays.copyOfRange(qualities, start, end + 1);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Read that)) {
      return false;
    }
    return unmapped == that.unmapped
        && mappingQuality == that.mappingQuality
        && name.equals(that.name)
        && Arrays.equals(bases, that.bases)
        && Arrays.equals(qualities, that.qualities)
        && tags.equals(that.tags);
  }

  @Override
  public int hashCode() {
    int result = name.hashCode();
    result = 31 * result + Arrays.hashCode(bases);
    result = 31 * result + Arrays.hashCode(qualities);
    result = 31 * result + tags.hashCode();
    result = 31 * result + Boolean.hashCode(unmapped);
    result = 31 * result + Integer.hashCode(mappingQuality);
    return result;
  }

  @Override
  public String toString() {
    return "Read{"
        + "name='" + name + '\''
        + ", length=" + bases.length
        + ", tags=" + tags
        + ", unmapped=" + unmapped
        + ", mappingQuality=" + mappingQuality
        + '}';
  }
}
