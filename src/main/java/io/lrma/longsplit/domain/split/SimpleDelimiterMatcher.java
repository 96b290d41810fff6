package io.lrma.longsplit.domain.split;

import io.lrma.longsplit.domain.segment.Segment;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Splits reads on short delimiter windows derived from the structure boundaries.
 * <p><strong>Why:</strong> Tolerates unknown interior content when per-element exactness is not needed.</p>
 * <p><strong>Windows:</strong> the last two labels of the first template joined with the first two
 * labels of the second form the first window; every later template contributes its first two labels.
 * Each window must match contiguously and in order.</p>
 * <p><strong>Slicing:</strong> elements run from the previous boundary (or read start) to the current
 * boundary, with a final remainder element up to the last base. When delimiters are kept, each
 * delimiter is repeated in both neighbouring elements; otherwise the delimiter bases are dropped.</p>
 * <p><strong>Thread-safety:</strong> Immutable; match state is local to each {@link #split} call.</p>
 *
 * @since 0.1.0
 */
public final class SimpleDelimiterMatcher implements DelimiterMatcher {
  /** Number of boundary labels taken from each side of a template gap. */
  public static final int BOUNDARY_LABELS = 2;

  static final String READ_START = "START";
  static final String READ_END = "END";

  private final List<List<String>> windows;
  private final List<String> windowNames;
  private final boolean keepDelimiters;

  /**
   * Creates a matcher over explicit delimiter windows.
   *
   * @param windows delimiter windows; each a non-empty ordered label tuple
   * @param keepDelimiters whether delimiter bases stay in the emitted elements
   */
  public SimpleDelimiterMatcher(List<? extends List<String>> windows, boolean keepDelimiters) {
    Objects.requireNonNull(windows, "windows");
    List<List<String>> copy = new ArrayList<>(windows.size());
    List<String> names = new ArrayList<>(windows.size());
    for (List<String> window : windows) {
      if (window == null || window.isEmpty()) {
        throw new IllegalArgumentException("delimiter windows must not be empty");
      }
      copy.add(List.copyOf(window));
      names.add(String.join("/", window));
    }
    this.windows = List.copyOf(copy);
    this.windowNames = List.copyOf(names);
    this.keepDelimiters = keepDelimiters;
  }

  /**
   * Creates a matcher whose windows are derived from {@code structure}.
   *
   * @param structure array layout
   * @param keepDelimiters whether delimiter bases stay in the emitted elements
   * @return configured matcher
   */
  public static SimpleDelimiterMatcher fromStructure(ArrayElementStructure structure, boolean keepDelimiters) {
    return new SimpleDelimiterMatcher(windowsFor(structure), keepDelimiters);
  }

  /**
   * Derives the delimiter windows for a structure.
   *
   * @param structure array layout
   * @return windows in template order
   */
  public static List<List<String>> windowsFor(ArrayElementStructure structure) {
    Objects.requireNonNull(structure, "structure");
    List<List<String>> result = new ArrayList<>();
    List<String> first = structure.element(0);
    List<String> merged = new ArrayList<>(first.subList(Math.max(0, first.size() - BOUNDARY_LABELS), first.size()));
    if (structure.size() > 1) {
      List<String> second = structure.element(1);
      merged.addAll(second.subList(0, Math.min(BOUNDARY_LABELS, second.size())));
    }
    result.add(List.copyOf(merged));
    for (int i = 2; i < structure.size(); i++) {
      List<String> element = structure.element(i);
      result.add(List.copyOf(element.subList(0, Math.min(BOUNDARY_LABELS, element.size()))));
    }
    return List.copyOf(result);
  }

  /**
   * Returns the delimiter windows in use.
   *
   * @return immutable windows
   */
  public List<List<String>> windows() {
    return windows;
  }

  @Override
  public SplitMode mode() {
    return SplitMode.SIMPLE;
  }

  @Override
  public SplitResult split(List<Segment> segments, int readLength) {
    Objects.requireNonNull(segments, "segments");
    List<WindowState> states = new ArrayList<>(windows.size());
    for (int i = 0; i < windows.size(); i++) {
      states.add(new WindowState(i, windows.get(i)));
    }

    for (Segment segment : segments) {
      for (WindowState state : states) {
        state.accept(segment);
      }
    }

    List<WindowState> completed = new ArrayList<>();
    for (WindowState state : states) {
      if (state.complete()) {
        completed.add(state);
      }
    }
    completed.sort(Comparator.comparingInt(state -> state.start.start()));

    List<ElementSpan> spans = new ArrayList<>(completed.size() + 1);
    int cursor = 0;
    String previous = READ_START;
    for (WindowState state : completed) {
      String name = windowNames.get(state.index);
      int segmentEnd = state.end.end();
      int end = keepDelimiters ? segmentEnd : state.start.start() - 1;
      addSpan(spans, readLength, cursor, end, cursor, segmentEnd, previous, name);
      cursor = keepDelimiters ? state.start.start() : state.end.end() + 1;
      previous = name;
    }
    addSpan(spans, readLength, cursor, readLength - 1, cursor, readLength - 1, previous, READ_END);
    return new SplitResult(completed.size(), spans);
  }

  private static void addSpan(
      List<ElementSpan> spans,
      int readLength,
      int start,
      int end,
      int segmentStart,
      int segmentEnd,
      String previous,
      String delimiter) {
    int clampedEnd = Math.min(end, readLength - 1);
    if (start > clampedEnd) {
      return;
    }
    spans.add(new ElementSpan(start, clampedEnd, segmentStart, segmentEnd, previous, delimiter, 0));
  }

  /** Match progress of one delimiter window over a single read. */
  private static final class WindowState {
    private final int index;
    private final List<String> labels;
    private int matched;
    private Segment start;
    private Segment end;

    private WindowState(int index, List<String> labels) {
      this.index = index;
      this.labels = labels;
    }

    void accept(Segment segment) {
      if (complete()) {
        return;
      }
      if (segment.name().equals(labels.get(matched))) {
        if (matched == 0) {
          start = segment;
        }
        matched++;
        if (matched == labels.size()) {
          end = segment;
        }
      } else {
        matched = 0;
        start = null;
        end = null;
      }
    }

    boolean complete() {
      return matched == labels.size();
    }
  }
}
