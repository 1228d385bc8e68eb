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

import com.google.common.collect.ImmutableList;
import com.google.yul.ir.CharStream;
import com.google.yul.optimizer.ErrorManager;
import com.google.yul.optimizer.InvalidProgramException;
import com.google.yul.optimizer.Program;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * The benchmark programs a chromosome is scored on. The programs are loaded and normalized once
 * and never modified afterwards.
 */
public final class Corpus {
  private static final Logger logger = Logger.getLogger(Corpus.class.getName());

  private final ImmutableList<Program> programs;

  private Corpus(ImmutableList<Program> programs) {
    checkArgument(!programs.isEmpty(), "Empty corpus");
    this.programs = programs;
  }

  public static Corpus of(List<Program> programs) {
    return new Corpus(ImmutableList.copyOf(programs));
  }

  /**
   * Loads every file. Loading stops at the first file that cannot be read or is not a valid
   * program; its errors have been reported to {@code errorManager}.
   */
  public static Corpus load(List<Path> files, ErrorManager errorManager)
      throws IOException, InvalidProgramException {
    ImmutableList.Builder<Program> programs = ImmutableList.builder();
    for (Path file : files) {
      programs.add(Program.load(CharStream.fromFile(file), errorManager));
    }
    Corpus corpus = new Corpus(programs.build());
    logger.info("Loaded " + corpus.size() + " program(s)");
    return corpus;
  }

  public int size() {
    return programs.size();
  }

  /** One metric per program, in corpus order. */
  public ImmutableList<FitnessMetric> metrics(Function<Program, FitnessMetric> metricFactory) {
    ImmutableList.Builder<FitnessMetric> metrics = ImmutableList.builder();
    for (Program program : programs) {
      metrics.add(metricFactory.apply(program));
    }
    return metrics.build();
  }
}
