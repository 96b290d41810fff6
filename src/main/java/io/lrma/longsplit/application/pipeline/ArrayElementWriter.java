package io.lrma.longsplit.application.pipeline;

import io.lrma.longsplit.application.port.ArrayElementSink;
import io.lrma.longsplit.domain.read.Read;
import io.lrma.longsplit.domain.read.ReadTags;
import io.lrma.longsplit.domain.read.SegmentedRead;
import io.lrma.longsplit.domain.segment.Segment;
import io.lrma.longsplit.domain.segment.SegmentTagCodec;
import io.lrma.longsplit.domain.split.ElementSpan;
import io.lrma.longsplit.domain.split.SplitResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Materializes located array elements as new reads and hands them to the sink.
 * <p><strong>Output record:</strong> named {@code {source}_{start}-{end}_{prev}-{delimiter}}; bases and
 * qualities sliced inclusively; source tags copied in order with the segment tag replaced by the
 * segments whose start lies within the element's segment window, shifted to element coordinates
 * and clipped to the element; unmapped; mapping quality
 * {@value Read#MAPPING_QUALITY_UNAVAILABLE}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owned by the single pipeline writer.</p>
 * <p><strong>Observability:</strong> Sink failures propagate unchanged and abort the run.</p>
 *
 * @since 0.1.0
 */
public final class ArrayElementWriter {
  private final ArrayElementSink sink;
  private final String segmentsTag;

  /**
   * Creates a writer emitting to {@code sink}.
   *
   * @param sink destination for element reads
   * @param segmentsTag tag key that receives the recomputed segment annotation
   */
  public ArrayElementWriter(ArrayElementSink sink, String segmentsTag) {
    this.sink = Objects.requireNonNull(sink, "sink");
    this.segmentsTag = Objects.requireNonNull(segmentsTag, "segmentsTag");
  }

  /**
   * Writes every span of {@code result} for the given read.
   *
   * @param segmented source read with its segments
   * @param result matcher outcome for that read
   * @return number of element records written
   * @throws Exception if the sink rejects a write
   */
  public int writeAll(SegmentedRead segmented, SplitResult result) throws Exception {
    int written = 0;
    for (ElementSpan span : result.spans()) {
      write(segmented.read(), segmented.segments(), span);
      written++;
    }
    return written;
  }

  /**
   * Builds and writes one element record.
   *
   * @param source read the element is cut from
   * @param segments segments of {@code source}
   * @param span element location
   * @throws Exception if the sink rejects the write
   */
  public void write(Read source, List<Segment> segments, ElementSpan span) throws Exception {
    sink.write(buildElement(source, segments, span));
  }

  /**
   * Builds the element record for {@code span} without writing it.
   *
   * @param source read the element is cut from
   * @param segments segments of {@code source}
   * @param span element location; must lie within the read
   * @return new element read
   * @throws IllegalArgumentException if the span extends past the end of the read
   */
  public Read buildElement(Read source, List<Segment> segments, ElementSpan span) {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(span, "span");
    if (span.endCoord() >= source.length()) {
      throw new IllegalArgumentException(
          "span " + span.startCoord() + "-" + span.endCoord() + " exceeds read " + source.name()
              + " of length " + source.length());
    }
    String name =
        source.name() + "_" + span.startCoord() + "-" + span.endCoord() + "_"
            + span.previousDelimiter() + "-" + span.delimiter();
    byte[] bases = source.basesBetween(span.startCoord(), span.endCoord());
    byte[] qualities =
        source.hasQualities() ? source.qualitiesBetween(span.startCoord(), span.endCoord()) : new byte[0];
    List<Segment> contained = segmentsWithin(segments, span.segmentStart(), span.segmentEnd());
    List<Segment> local = relativeTo(contained, span.startCoord(), bases.length);
    ReadTags tags = source.tags().with(segmentsTag, SegmentTagCodec.encode(local));
    return new Read(name, bases, qualities, tags, true, Read.MAPPING_QUALITY_UNAVAILABLE);
  }

  /**
   * Selects segments whose start lies in {@code [from, to]}.
   *
   * @param segments candidate segments, in read order
   * @param from inclusive lower bound
   * @param to inclusive upper bound
   * @return matching segments in read order
   */
  static List<Segment> segmentsWithin(List<Segment> segments, int from, int to) {
    List<Segment> contained = new ArrayList<>();
    for (Segment segment : segments) {
      if (segment.start() >= from && segment.start() <= to) {
        contained.add(segment);
      }
    }
    return contained;
  }

  /**
   * Shifts segments into element coordinates and clips them to {@code [0, length - 1]}; segments
   * lying wholly outside the element are dropped.
   *
   * @param segments segments in source read coordinates
   * @param offset source coordinate of the element's first base
   * @param length element length
   * @return segments in element coordinates, in read order
   */
  static List<Segment> relativeTo(List<Segment> segments, int offset, int length) {
    List<Segment> local = new ArrayList<>(segments.size());
    for (Segment segment : segments) {
      int start = Math.max(0, segment.start() - offset);
      int end = Math.min(length - 1, segment.end() - offset);
      if (start <= end) {
        local.add(new Segment(segment.name(), start, end));
      }
    }
    return local;
  }
}
