package io.lrma.longsplit.domain.split;

import io.lrma.longsplit.domain.segment.Segment;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Splits reads by matching every element template of the structure in full.
 * <p><strong>Scoring:</strong> each label matched in place adds {@value #MATCH_SCORE}; a label reached by
 * skipping over missing template labels adds {@value #INDEL_SCORE}. A segment that matches neither the
 * next label nor any later one discards the template's partial progress.</p>
 * <p><strong>Assumptions:</strong> each template occurs at most once per read and occurrences do not
 * overlap. Templates left incomplete at the end of the read produce nothing.</p>
 * <p><strong>Thread-safety:</strong> Immutable; match state is local to each {@link #split} call.</p>
 *
 * @since 0.1.0
 */
public final class BoundedRegionMatcher implements DelimiterMatcher {
  /** Score for a label matched at its expected template position. */
  public static final int MATCH_SCORE = 2;
  /** Score for a label matched after skipping missing template labels. */
  public static final int INDEL_SCORE = 1;

  private final ArrayElementStructure structure;
  private final boolean keepDelimiters;

  /**
   * Creates a bounded-region matcher.
   *
   * @param structure array layout whose templates are matched in full
   * @param keepDelimiters whether the outermost matched segments stay in the emitted elements
   */
  public BoundedRegionMatcher(ArrayElementStructure structure, boolean keepDelimiters) {
    this.structure = Objects.requireNonNull(structure, "structure");
    this.keepDelimiters = keepDelimiters;
  }

  @Override
  public SplitMode mode() {
    return SplitMode.BOUNDED_REGION;
  }

  @Override
  public SplitResult split(List<Segment> segments, int readLength) {
    Objects.requireNonNull(segments, "segments");
    List<TemplateState> states = match(segments);

    List<TemplateState> completed = new ArrayList<>();
    for (TemplateState state : states) {
      if (state.complete) {
        completed.add(state);
      }
    }
    completed.sort(Comparator.comparingInt(state -> state.captured.get(0).start()));

    List<ElementSpan> spans = new ArrayList<>(completed.size());
    for (TemplateState state : completed) {
      List<Segment> captured = state.captured;
      Segment first = captured.get(0);
      Segment last = captured.get(captured.size() - 1);
      int start;
      int end;
      if (keepDelimiters) {
        start = first.start();
        end = last.end();
      } else {
        if (captured.size() < 3) {
          continue;
        }
        start = captured.get(1).start();
        end = captured.get(captured.size() - 2).end();
      }
      end = Math.min(end, readLength - 1);
      if (start > end) {
        continue;
      }
      spans.add(new ElementSpan(start, end, first.start(), last.end(), first.name(), last.name(), state.score));
    }
    return new SplitResult(completed.size(), spans);
  }

  /**
   * Runs the template state machines over {@code segments} and returns the score of each template.
   *
   * @param segments segments of one read
   * @return per-template score, or {@code -1} for templates that did not complete
   */
  public int[] scores(List<Segment> segments) {
    List<TemplateState> states = match(Objects.requireNonNull(segments, "segments"));
    int[] scores = new int[states.size()];
    for (int i = 0; i < scores.length; i++) {
      TemplateState state = states.get(i);
      scores[i] = state.complete ? state.score : -1;
    }
    return scores;
  }

  private List<TemplateState> match(List<Segment> segments) {
    List<TemplateState> states = new ArrayList<>(structure.size());
    for (List<String> template : structure.elements()) {
      states.add(new TemplateState(template));
    }
    for (Segment segment : segments) {
      for (TemplateState state : states) {
        if (!state.complete) {
          state.accept(segment);
        }
      }
    }
    return states;
  }

  /** Match progress of one element template over a single read. */
  private static final class TemplateState {
    private final List<String> labels;
    private final List<Segment> captured = new ArrayList<>();
    private int matched;
    private int score;
    private boolean complete;

    private TemplateState(List<String> labels) {
      this.labels = labels;
    }

    void accept(Segment segment) {
      String name = segment.name();
      if (name.equals(labels.get(matched))) {
        advance(segment, 1, MATCH_SCORE);
      } else if (matched == 0 || !skipAhead(segment)) {
        reset();
      }
      if (matched == labels.size()) {
        complete = true;
      }
    }

    private boolean skipAhead(Segment segment) {
      for (int offset = 1; offset < labels.size() - matched; offset++) {
        if (segment.name().equals(labels.get(matched + offset))) {
          advance(segment, 1 + offset, INDEL_SCORE);
          return true;
        }
      }
      return false;
    }

    private void advance(Segment segment, int step, int points) {
      matched += step;
      captured.add(segment);
      score += points;
    }

    private void reset() {
      matched = 0;
      captured.clear();
      score = 0;
    }
  }
}
