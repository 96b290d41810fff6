package io.lrma.longsplit.domain.split;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.lrma.longsplit.domain.segment.Segment;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class SimpleDelimiterMatcherTest {
  private static final List<List<String>> WINDOWS = List.of(List.of("A", "B"), List.of("Y", "Z"));

  @Test
  void splitsBetweenDelimiterWindowsWithoutDelimiters() {
    SimpleDelimiterMatcher matcher = new SimpleDelimiterMatcher(WINDOWS, false);

    SplitResult result = matcher.split(blocks("A", "B", "x", "x", "Y", "Z"), 60);

    assertEquals(2, result.boundaries());
    assertEquals(1, result.spans().size());
    ElementSpan span = result.spans().get(0);
    assertEquals(20, span.startCoord());
    assertEquals(39, span.endCoord());
    assertEquals("A/B", span.previousDelimiter());
    assertEquals("Y/Z", span.delimiter());
  }

  @Test
  void keepsDelimitersAndEmitsLeadingAndTrailingElements() {
    SimpleDelimiterMatcher matcher = new SimpleDelimiterMatcher(WINDOWS, true);

    SplitResult result = matcher.split(blocks("x", "A", "B", "x", "Y", "Z", "x"), 70);

    assertEquals(2, result.boundaries());
    assertEquals(3, result.spans().size());
    assertSpan(result.spans().get(0), 0, 29, SimpleDelimiterMatcher.READ_START, "A/B");
    assertSpan(result.spans().get(1), 10, 59, "A/B", "Y/Z");
    assertSpan(result.spans().get(2), 40, 69, "Y/Z", SimpleDelimiterMatcher.READ_END);
  }

  @Test
  void noMatchingLabelsYieldsOnlyTheRemainderElement() {
    SimpleDelimiterMatcher matcher = new SimpleDelimiterMatcher(WINDOWS, false);

    SplitResult result = matcher.split(blocks("p", "q", "r"), 30);

    assertEquals(0, result.boundaries());
    assertEquals(1, result.spans().size());
    assertSpan(result.spans().get(0), 0, 29, SimpleDelimiterMatcher.READ_START, SimpleDelimiterMatcher.READ_END);
  }

  @Test
  void mismatchResetsPartialWindow() {
    SimpleDelimiterMatcher matcher = new SimpleDelimiterMatcher(List.of(List.of("A", "B")), false);

    SplitResult interrupted = matcher.split(blocks("A", "x", "B"), 30);
    SplitResult contiguous = matcher.split(blocks("A", "x", "A", "B"), 40);

    assertEquals(0, interrupted.boundaries());
    assertEquals(1, contiguous.boundaries());
    assertSpan(contiguous.spans().get(0), 0, 19, SimpleDelimiterMatcher.READ_START, "A/B");
  }

  @Test
  void boundariesAreOrderedByPositionNotWindowOrder() {
    SimpleDelimiterMatcher matcher = new SimpleDelimiterMatcher(WINDOWS, false);

    SplitResult result = matcher.split(blocks("Y", "Z", "x", "A", "B", "x"), 60);

    // the leading element before Y is empty and skipped
    assertEquals(2, result.boundaries());
    assertEquals(2, result.spans().size());
    assertSpan(result.spans().get(0), 20, 29, "Y/Z", "A/B");
    assertSpan(result.spans().get(1), 50, 59, "A/B", SimpleDelimiterMatcher.READ_END);
  }

  @Test
  void spansAreClampedToReadLength() {
    SimpleDelimiterMatcher matcher = new SimpleDelimiterMatcher(WINDOWS, true);

    SplitResult result = matcher.split(blocks("A", "B", "x", "Y", "Z"), 45);

    for (ElementSpan span : result.spans()) {
      assertTrue(span.endCoord() <= 44);
      assertTrue(span.startCoord() <= span.endCoord());
    }
  }

  @Test
  void windowsMergeFirstTwoElements() {
    ArrayElementStructure structure = ArrayElementStructure.of(List.of(
        List.of("A", "10x_Adapter", "random", "Poly_A", "3p_Adapter"),
        List.of("B", "10x_Adapter", "random", "Poly_A", "3p_Adapter"),
        List.of("C", "10x_Adapter", "random"),
        List.of("P")));

    List<List<String>> windows = SimpleDelimiterMatcher.windowsFor(structure);

    assertEquals(List.of(
        List.of("Poly_A", "3p_Adapter", "B", "10x_Adapter"),
        List.of("C", "10x_Adapter"),
        List.of("P")), windows);
  }

  /** Builds ten-base segments laid end to end. */
  private static List<Segment> blocks(String... labels) {
    List<Segment> segments = new ArrayList<>();
    for (int i = 0; i < labels.length; i++) {
      segments.add(new Segment(labels[i], i * 10, i * 10 + 9));
    }
    return segments;
  }

  private static void assertSpan(ElementSpan span, int start, int end, String previous, String delimiter) {
    assertEquals(start, span.startCoord(), "start");
    assertEquals(end, span.endCoord(), "end");
    assertEquals(previous, span.previousDelimiter());
    assertEquals(delimiter, span.delimiter());
  }
}
