package io.lrma.longsplit.domain.read;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered, immutable mapping of two-character record tags to their values.
 *
 * <p>Values keep whatever Java type the record stream produced (strings, boxed numbers,
 * arrays) so they can be copied verbatim onto derived records.</p>
 *
 * @since 0.1.0
 */
public final class ReadTags {
  private static final ReadTags EMPTY = new ReadTags(new LinkedHashMap<>());

  private final Map<String, Object> values;

  private ReadTags(LinkedHashMap<String, Object> values) {
    this.values = Collections.unmodifiableMap(values);
  }

  /**
   * Returns an empty tag set.
   *
   * @return shared empty instance
   */
  public static ReadTags empty() {
    return EMPTY;
  }

  /**
   * Copies the supplied entries, preserving iteration order.
   *
   * @param entries tag entries; {@code null} values are rejected
   * @return immutable tag set
   */
  public static ReadTags of(Map<String, ?> entries) {
    Objects.requireNonNull(entries, "entries");
    LinkedHashMap<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : entries.entrySet()) {
      copy.put(
          Objects.requireNonNull(entry.getKey(), "tag key"),
          Objects.requireNonNull(entry.getValue(), "tag value"));
    }
    return copy.isEmpty() ? EMPTY : new ReadTags(copy);
  }

  /**
   * Looks up a tag value.
   *
   * @param key tag key
   * @return value when present
   */
  public Optional<Object> get(String key) {
    return Optional.ofNullable(values.get(key));
  }

  /**
   * Looks up a tag value and renders it as text.
   *
   * @param key tag key
   * @return string form of the value when present
   */
  public Optional<String> getString(String key) {
    return get(key).map(Object::toString);
  }

  /**
   * Indicates whether {@code key} is present.
   *
   * @param key tag key
   * @return {@code true} when the tag exists
   */
  public boolean contains(String key) {
    return values.containsKey(key);
  }

  /**
   * Returns a copy with {@code key} set to {@code value}; an existing key keeps its position.
   *
   * @param key tag key
   * @param value new value
   * @return new tag set
   */
  public ReadTags with(String key, Object value) {
    LinkedHashMap<String, Object> copy = new LinkedHashMap<>(values);
    copy.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    return new ReadTags(copy);
  }

  /**
   * Exposes the tags as a read-only map in record order.
   *
   * @return unmodifiable view
   */
  public Map<String, Object> asMap() {
    return values;
  }

  /**
   * Returns the number of tags.
   *
   * @return tag count
   */
  public int size() {
    return values.size();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ReadTags that)) {
      return false;
    }
    return values.equals(that.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "ReadTags" + values.keySet();
  }
}
