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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.math.LongMath;
import com.google.yul.optimizer.Program;

/**
 * The ratio of the optimised code size to the original one, as a fixed point number with {@code
 * precision} decimal digits. A program of size zero always scores {@code 1.0}.
 *
 * <p>Unlike {@link ProgramSize}, every program of a corpus carries the same weight.
 */
public final class RelativeProgramSize implements FitnessMetric {

  private final Program program;
  private final int repetitions;
  private final long scale;
  private final int originalSize;

  public RelativeProgramSize(Program program, int repetitions, int precision) {
    checkArgument(repetitions >= 1, "Repetitions must be positive: %s", repetitions);
    checkArgument(precision >= 0 && precision <= 18, "Precision out of range: %s", precision);
    this.program = checkNotNull(program);
    this.repetitions = repetitions;
    this.scale = LongMath.pow(10, precision);
    this.originalSize = program.codeSize();
  }

  @Override
  public long evaluate(Chromosome chromosome) {
    if (originalSize == 0) {
      return scale;
    }
    int size = ProgramSize.optimisedSize(program, chromosome, repetitions);
    return Math.round((double) size / originalSize * scale);
  }
}
