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

import com.google.yul.ir.Node;
import com.google.yul.optimizer.StepSequence.Segment;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Runs the steps of a {@link StepSequence} over a tree, left to right. Bracketed groups are run
 * until the code size is stable.
 */
public final class PhaseOptimizer {
  private static final Logger logger = Logger.getLogger(PhaseOptimizer.class.getName());

  private final OptimizerContext context;
  private @Nullable CompilerPass validityCheck;

  public PhaseOptimizer(OptimizerContext context) {
    this.context = context;
  }

  /** Adds a checker to be run after every step. */
  public void setValidityCheck(CompilerPass validityCheck) {
    this.validityCheck = validityCheck;
  }

  public void process(StepSequence sequence, Node root) {
    for (Segment segment : sequence.getSegments()) {
      if (!segment.repeated()) {
        runAll(segment, root);
        continue;
      }
      int codeSize = CodeSize.codeSizeIncludingFunctions(root);
      for (int round = 1; round <= StepSequence.MAX_REPETITIONS; round++) {
        runAll(segment, root);
        int newCodeSize = CodeSize.codeSizeIncludingFunctions(root);
        if (newCodeSize == codeSize) {
          logger.fine("Group stable after " + round + " round(s)");
          break;
        }
        codeSize = newCodeSize;
      }
    }
  }

  private void runAll(Segment segment, Node root) {
    for (PassFactory step : segment.steps()) {
      run(step, root);
    }
  }

  private void run(PassFactory step, Node root) {
    String name = step.getName();
    logger.fine("Running pass " + name);
    step.create(context).process(root);
    if (validityCheck != null) {
      try {
        validityCheck.process(root);
      } catch (RuntimeException e) {
        throw new IllegalStateException("Validity check failed for " + name, e);
      }
    }
  }
}
