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

/** State shared by the steps of one optimisation run over a single tree. */
public final class OptimizerContext {
  private final NameDispenser nameDispenser;

  public OptimizerContext(NameDispenser nameDispenser) {
    this.nameDispenser = nameDispenser;
  }

  /** Creates a context whose fresh names avoid every identifier already used in {@code root}. */
  public static OptimizerContext forRoot(Node root) {
    return new OptimizerContext(new NameDispenser(NodeUtil.collectNames(root)));
  }

  public NameDispenser getNameDispenser() {
    return nameDispenser;
  }
}
