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

import com.google.yul.optimizer.Program;
import com.google.yul.optimizer.StepSequence;

/**
 * The code size of a program after the chromosome's steps have been applied to it a given number
 * of times. The program itself is never modified; each evaluation works on a copy.
 */
public final class ProgramSize implements FitnessMetric {

  private final Program program;
  private final int repetitions;

  public ProgramSize(Program program, int repetitions) {
    checkArgument(repetitions >= 1, "Repetitions must be positive: %s", repetitions);
    this.program = checkNotNull(program);
    this.repetitions = repetitions;
  }

  @Override
  public long evaluate(Chromosome chromosome) {
    return optimisedSize(program, chromosome, repetitions);
  }

  static int optimisedSize(Program program, Chromosome chromosome, int repetitions) {
    Program copy = program.cloneProgram();
    StepSequence sequence = chromosome.toStepSequence();
    for (int i = 0; i < repetitions; i++) {
      copy.optimise(sequence);
    }
    return copy.codeSize();
  }
}
