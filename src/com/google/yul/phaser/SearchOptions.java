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

package com.google.yul.phaser;

import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.ForOverride;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * When an {@link AlgorithmRunner} stops and what it records along the way. Without any limit the
 * search runs until its thread is interrupted.
 */
@AutoValue
public abstract class SearchOptions {

  /** The number of generations to breed after the initial one. */
  public abstract OptionalInt getMaxRounds();

  /** Checked between generations, so a round in progress is always finished. */
  public abstract Optional<Duration> getTimeBudget();

  /** Stop after this many generations without an improvement of the best fitness. */
  public abstract OptionalInt getPlateauRounds();

  /** A file to write the population to after every generation. */
  public abstract Optional<Path> getAutosaveFile();

  SearchOptions() {}

  public static Builder builder() {
    return new AutoValue_SearchOptions.Builder();
  }

  /** A builder for {@link SearchOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setMaxRounds(int x);

    public abstract Builder setTimeBudget(Duration x);

    public abstract Builder setPlateauRounds(int x);

    public abstract Builder setAutosaveFile(Path x);

    @ForOverride
    abstract SearchOptions autoBuild();

    public final SearchOptions build() {
      SearchOptions result = autoBuild();
      checkState(result.getMaxRounds().orElse(0) >= 0, "Negative round limit");
      checkState(result.getPlateauRounds().orElse(1) >= 1, "Plateau must be at least one round");
      checkState(
          !result.getTimeBudget().map(Duration::isNegative).orElse(false),
          "Negative time budget");
      return result;
    }
  }
}
