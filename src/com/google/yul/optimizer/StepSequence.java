/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.yul.optimizer;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * An ordered list of optimizer steps, parsed from the abbreviation grammar:
 *
 * <pre>
 * sequence = (abbreviation | '[' abbreviation* ']')*
 * </pre>
 *
 * Whitespace is ignored. A bracketed group is run repeatedly until the code size of the program
 * stops changing, at most {@link #MAX_REPETITIONS} times. Groups do not nest.
 */
public final class StepSequence {

  public static final int MAX_REPETITIONS = 12;

  /** A run of consecutive steps; repeated ones come from a bracketed group. */
  public record Segment(ImmutableList<PassFactory> steps, boolean repeated) {}

  private static final StepSequence EMPTY = new StepSequence(ImmutableList.of());

  private final ImmutableList<Segment> segments;

  private StepSequence(ImmutableList<Segment> segments) {
    this.segments = segments;
  }

  public static StepSequence empty() {
    return EMPTY;
  }

  /**
   * Parses a sequence of step abbreviations.
   *
   * @throws UnknownStepException for a character that is not a registered abbreviation
   * @throws InvalidOptimizerStepException for nested or unbalanced brackets
   */
  public static StepSequence parse(String text) {
    checkNotNull(text);
    List<Segment> segments = new ArrayList<>();
    ImmutableList.Builder<PassFactory> current = ImmutableList.builder();
    int groupStart = -1;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (Character.isWhitespace(c)) {
        continue;
      }
      if (c == '[') {
        if (groupStart >= 0) {
          throw new InvalidOptimizerStepException("Nested brackets are not supported", "[", i);
        }
        addSegment(segments, current.build(), false);
        current = ImmutableList.builder();
        groupStart = i;
      } else if (c == ']') {
        if (groupStart < 0) {
          throw new InvalidOptimizerStepException("Unbalanced brackets", "]", i);
        }
        addSegment(segments, current.build(), true);
        current = ImmutableList.builder();
        groupStart = -1;
      } else {
        PassFactory step = OptimizerSteps.forAbbreviation(c);
        if (step == null) {
          throw new UnknownStepException(String.valueOf(c), i);
        }
        current.add(step);
      }
    }
    if (groupStart >= 0) {
      throw new InvalidOptimizerStepException("Unbalanced brackets", "[", groupStart);
    }
    addSegment(segments, current.build(), false);
    return new StepSequence(ImmutableList.copyOf(segments));
  }

  /**
   * Builds a sequence from full step names, run once each in order.
   *
   * @throws UnknownStepException for the first name that is not registered, with its list index
   */
  public static StepSequence ofNames(List<String> names) {
    ImmutableList.Builder<PassFactory> steps = ImmutableList.builder();
    for (int i = 0; i < names.size(); i++) {
      PassFactory step = OptimizerSteps.forName(names.get(i));
      if (step == null) {
        throw new UnknownStepException(names.get(i), i);
      }
      steps.add(step);
    }
    List<Segment> segments = new ArrayList<>();
    addSegment(segments, steps.build(), false);
    return new StepSequence(ImmutableList.copyOf(segments));
  }

  /** Checks {@code text} against the grammar without running anything. */
  public static void validate(String text) {
    parse(text);
  }

  static boolean isReservedCharacter(char c) {
    return c == '[' || c == ']' || Character.isWhitespace(c);
  }

  /** Appends a segment, merging runs of steps that are not repeated. */
  private static void addSegment(
      List<Segment> segments, ImmutableList<PassFactory> steps, boolean repeated) {
    if (steps.isEmpty()) {
      return;
    }
    int last = segments.size() - 1;
    if (!repeated && last >= 0 && !segments.get(last).repeated()) {
      steps =
          ImmutableList.<PassFactory>builder()
              .addAll(segments.remove(last).steps())
              .addAll(steps)
              .build();
    }
    segments.add(new Segment(steps, repeated));
  }

  public ImmutableList<Segment> getSegments() {
    return segments;
  }

  public boolean isEmpty() {
    return segments.isEmpty();
  }

  /** The names of the steps in order of appearance, each group listed once. */
  public ImmutableList<String> getStepNames() {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (Segment segment : segments) {
      for (PassFactory step : segment.steps()) {
        names.add(step.getName());
      }
    }
    return names.build();
  }

  /** The sequence in abbreviation form; parsing it yields an equal sequence. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Segment segment : segments) {
      if (segment.repeated()) {
        sb.append('[');
      }
      for (PassFactory step : segment.steps()) {
        sb.append(step.getAbbreviation());
      }
      if (segment.repeated()) {
        sb.append(']');
      }
    }
    return sb.toString();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof StepSequence && ((StepSequence) o).segments.equals(segments);
  }

  @Override
  public int hashCode() {
    return segments.hashCode();
  }
}
