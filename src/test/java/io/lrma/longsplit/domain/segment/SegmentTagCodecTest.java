package io.lrma.longsplit.domain.segment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class SegmentTagCodecTest {

  @Test
  void decodesPipeSeparatedTokensInOrder() {
    List<Segment> segments =
        SegmentTagCodec.decode("read1", "A:0-15|10x_Adapter:16-37|random:38-47|Poly_A:48-77");

    assertEquals(4, segments.size());
    assertEquals(new Segment("A", 0, 15), segments.get(0));
    assertEquals(new Segment("10x_Adapter", 16, 37), segments.get(1));
    assertEquals(new Segment("Poly_A", 48, 77), segments.get(3));
  }

  @Test
  void acceptsCommaSeparatorAndWhitespace() {
    List<Segment> segments = SegmentTagCodec.decode("read1", "A:0-9, B:10-19");

    assertEquals(List.of(new Segment("A", 0, 9), new Segment("B", 10, 19)), segments);
  }

  @Test
  void labelsMayContainColons() {
    Segment segment = SegmentTagCodec.decodeToken("read1", "cDNA:sense:5-40");

    assertEquals("cDNA:sense", segment.name());
    assertEquals(5, segment.start());
    assertEquals(40, segment.end());
  }

  @Test
  void blankValueDecodesToNoSegments() {
    assertTrue(SegmentTagCodec.decode("read1", "  ").isEmpty());
  }

  @Test
  void rejectsMalformedTokensWithReadName() {
    MalformedSegmentTagException missingRange =
        assertThrows(MalformedSegmentTagException.class, () -> SegmentTagCodec.decode("r7", "A:0-9|B"));
    assertEquals("r7", missingRange.readName());

    assertThrows(MalformedSegmentTagException.class, () -> SegmentTagCodec.decode("r7", "A:9-3"));
    assertThrows(MalformedSegmentTagException.class, () -> SegmentTagCodec.decode("r7", "A:x-3"));
    assertThrows(MalformedSegmentTagException.class, () -> SegmentTagCodec.decode("r7", "A:0-9||B:10-12"));
    assertThrows(MalformedSegmentTagException.class, () -> SegmentTagCodec.decode("r7", "A:-1-3"));
    assertThrows(MalformedSegmentTagException.class, () -> SegmentTagCodec.decode("r7", "A:0-99999999999"));
  }

  @Test
  void encodeJoinsWithCommas() {
    String encoded = SegmentTagCodec.encode(List.of(new Segment("A", 0, 9), new Segment("B", 10, 19)));

    assertEquals("A:0-9,B:10-19", encoded);
    assertEquals("", SegmentTagCodec.encode(List.of()));
  }

  @Test
  void segmentRejectsInvertedRange() {
    assertThrows(IllegalArgumentException.class, () -> new Segment("A", 5, 4));
    assertThrows(IllegalArgumentException.class, () -> new Segment("A", -1, 4));
    assertEquals(1, new Segment("A", 4, 4).length());
  }
}
