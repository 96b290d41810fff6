package io.lrma.longsplit.config;

import io.lrma.longsplit.domain.split.ArrayElementStructure;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Catalogue of built-in array layouts selectable with {@code model=}.
 *
 * <p>Each element template is an adapter label followed by the cDNA labels
 * {@code 10x_Adapter, random, Poly_A, 3p_Adapter}; the final template is the closing adapter alone.</p>
 *
 * @since 0.1.0
 */
public final class ArrayModels {
  /** Model used when none is configured. */
  public static final String DEFAULT_MODEL = "mas15";

  private static final List<String> ELEMENT_BODY = List.of("10x_Adapter", "random", "Poly_A", "3p_Adapter");
  private static final Map<String, ArrayElementStructure> MODELS = buildModels();

  private ArrayModels() {}

  /**
   * Looks up a built-in model by name (case-insensitive).
   *
   * @param name model name such as {@code mas15}
   * @return array layout
   * @throws IllegalArgumentException if no model has that name
   */
  public static ArrayElementStructure get(String name) {
    Objects.requireNonNull(name, "name");
    ArrayElementStructure structure = MODELS.get(name.trim().toLowerCase(Locale.ROOT));
    if (structure == null) {
      throw new IllegalArgumentException("Unknown model '" + name + "'; expected one of " + names());
    }
    return structure;
  }

  /**
   * Returns the built-in model names in catalogue order.
   *
   * @return model names
   */
  public static Set<String> names() {
    return MODELS.keySet();
  }

  private static Map<String, ArrayElementStructure> buildModels() {
    Map<String, ArrayElementStructure> models = new LinkedHashMap<>();
    models.put("mas15", layout(List.of("A", "B", "C", "D", "E", "F", "G", "H", "I", "J", "K", "L", "M", "N", "O"), "P"));
    models.put("mas10", layout(List.of("Q", "C", "M", "I", "O", "J", "B", "D", "K", "H"), "R"));
    return Collections.unmodifiableMap(models);
  }

  private static ArrayElementStructure layout(List<String> adapters, String closingAdapter) {
    List<List<String>> elements = new ArrayList<>(adapters.size() + 1);
    for (String adapter : adapters) {
      List<String> element = new ArrayList<>(ELEMENT_BODY.size() + 1);
      element.add(adapter);
      element.addAll(ELEMENT_BODY);
      elements.add(element);
    }
    elements.add(List.of(closingAdapter));
    return ArrayElementStructure.of(elements);
  }
}
