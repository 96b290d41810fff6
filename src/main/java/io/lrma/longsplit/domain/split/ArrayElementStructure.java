package io.lrma.longsplit.domain.split;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Expected layout of an array read as an ordered list of element templates.
 * <p><strong>Why:</strong> Both delimiter matchers derive their search targets from this layout.</p>
 * <p><strong>Role:</strong> Immutable configuration value built once per run and passed explicitly to
 * the matcher chosen for the run.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across threads.</p>
 *
 * @since 0.1.0
 */
public final class ArrayElementStructure {
  private final List<List<String>> elements;

  private ArrayElementStructure(List<List<String>> elements) {
    this.elements = elements;
  }

  /**
   * Builds a structure from element templates.
   *
   * @param elements element templates in array order; each is an ordered list of segment labels
   * @return validated structure
   * @throws IllegalArgumentException if there are no templates, a template is empty, or a label is blank
   */
  public static ArrayElementStructure of(List<? extends List<String>> elements) {
    Objects.requireNonNull(elements, "elements");
    if (elements.isEmpty()) {
      throw new IllegalArgumentException("array element structure must contain at least one element");
    }
    List<List<String>> copy = new ArrayList<>(elements.size());
    for (int i = 0; i < elements.size(); i++) {
      List<String> template = elements.get(i);
      if (template == null || template.isEmpty()) {
        throw new IllegalArgumentException("array element " + i + " must list at least one segment label");
      }
      for (String label : template) {
        if (label == null || label.isBlank()) {
          throw new IllegalArgumentException("array element " + i + " contains a blank segment label");
        }
      }
      copy.add(List.copyOf(template));
    }
    return new ArrayElementStructure(List.copyOf(copy));
  }

  /**
   * Returns the element templates.
   *
   * @return immutable list of immutable label lists
   */
  public List<List<String>> elements() {
    return elements;
  }

  /**
   * Returns the template at {@code index}.
   *
   * @param index element index
   * @return immutable label list
   */
  public List<String> element(int index) {
    return elements.get(index);
  }

  /**
   * Returns the number of element templates.
   *
   * @return template count
   */
  public int size() {
    return elements.size();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof ArrayElementStructure that && elements.equals(that.elements);
  }

  @Override
  public int hashCode() {
    return elements.hashCode();
  }

  @Override
  public String toString() {
    return "ArrayElementStructure" + elements;
  }
}
