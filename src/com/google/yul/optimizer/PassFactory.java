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

import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.ForOverride;
import java.util.function.Function;

/**
 * A factory for optimizer steps.
 *
 * <p>Contains the meta-data of a step: the name under which it appears in logs and step lists, and
 * the single character standing for it in a step sequence.
 */
@AutoValue
public abstract class PassFactory {

  /** The name of the pass as it will appear in logs. */
  public abstract String getName();

  /** The character that stands for this step in a step sequence string. */
  public abstract char getAbbreviation();

  /**
   * A simple factory function for creating actual pass instances.
   *
   * <p>Users should call {@link #create(OptimizerContext)} rather than use this object directly.
   */
  abstract Function<OptimizerContext, ? extends CompilerPass> getInternalFactory();

  PassFactory() {
    // Subclasses in this package only.
  }

  /** A builder for a {@link PassFactory}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setName(String x);

    public abstract Builder setAbbreviation(char x);

    public abstract Builder setInternalFactory(
        Function<OptimizerContext, ? extends CompilerPass> x);

    @ForOverride
    abstract PassFactory autoBuild();

    public final PassFactory build() {
      PassFactory result = autoBuild();
      checkState(!result.getName().isEmpty());
      checkState(
          !StepSequence.isReservedCharacter(result.getAbbreviation()),
          "Abbreviation %s of %s is reserved",
          result.getAbbreviation(),
          result.getName());
      return result;
    }
  }

  public static Builder builder() {
    return new AutoValue_PassFactory.Builder();
  }

  /** Creates a new compiler pass to be run. */
  final CompilerPass create(OptimizerContext context) {
    return getInternalFactory().apply(context);
  }
}
