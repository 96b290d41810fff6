package io.lrma.longsplit.config;

import io.lrma.longsplit.domain.split.ArrayElementStructure;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads a custom array layout from a YAML template file.
 *
 * <pre>
 * elements:
 *   - [A, 10x_Adapter, random, Poly_A, 3p_Adapter]
 *   - [P]
 * </pre>
 *
 * @since 0.1.0
 */
public final class ArrayElementStructureLoader {
  private ArrayElementStructureLoader() {}

  /**
   * Reads and validates the template file at {@code path}.
   *
   * @param path YAML template file
   * @return array layout
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document does not describe a valid layout
   */
  public static ArrayElementStructure load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      return parse(document, path.toString());
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse template file " + path, ex);
    }
  }

  static ArrayElementStructure parse(Object document, String source) {
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException(source + ": template must be a mapping with an 'elements' list");
    }
    Object elementsNode = root.get("elements");
    if (!(elementsNode instanceof List<?> rawElements)) {
      throw new IllegalArgumentException(source + ": 'elements' must be a list of label lists");
    }
    List<List<String>> elements = new ArrayList<>(rawElements.size());
    for (int i = 0; i < rawElements.size(); i++) {
      Object element = rawElements.get(i);
      if (!(element instanceof List<?> rawLabels)) {
        throw new IllegalArgumentException(source + ": element " + i + " must be a list of labels");
      }
      List<String> labels = new ArrayList<>(rawLabels.size());
      for (Object label : rawLabels) {
        if (label == null) {
          throw new IllegalArgumentException(source + ": element " + i + " contains an empty label");
        }
        labels.add(label.toString().trim());
      }
      elements.add(labels);
    }
    try {
      return ArrayElementStructure.of(elements);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(source + ": " + ex.getMessage(), ex);
    }
  }
}
