package io.lrma.longsplit.domain.split;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ArrayElementStructureTest {

  @Test
  void copiesInputDefensively() {
    List<String> first = new ArrayList<>(List.of("A", "B"));
    ArrayElementStructure structure = ArrayElementStructure.of(List.of(first, List.of("P")));
    first.add("C");

    assertEquals(2, structure.size());
    assertEquals(List.of("A", "B"), structure.element(0));
    assertThrows(UnsupportedOperationException.class, () -> structure.elements().add(List.of("Z")));
  }

  @Test
  void rejectsEmptyLayoutsAndLabels() {
    assertThrows(IllegalArgumentException.class, () -> ArrayElementStructure.of(List.of()));
    assertThrows(IllegalArgumentException.class, () -> ArrayElementStructure.of(List.of(List.of())));
    assertThrows(IllegalArgumentException.class, () -> ArrayElementStructure.of(List.of(List.of("A", " "))));
  }

  @Test
  void equalityFollowsLabels() {
    assertEquals(
        ArrayElementStructure.of(List.of(List.of("A"), List.of("B"))),
        ArrayElementStructure.of(List.of(List.of("A"), List.of("B"))));
  }
}
