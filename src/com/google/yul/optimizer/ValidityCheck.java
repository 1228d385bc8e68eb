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

import com.google.yul.ir.Node;
import java.util.HashSet;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Re-analyzes a tree and checks that every name is still declared only once. Failures are
 * internal errors of the step that ran last.
 */
class ValidityCheck implements CompilerPass {
  private static final Logger logger = Logger.getLogger(ValidityCheck.class.getName());

  private final String sourceName;

  ValidityCheck(String sourceName) {
    this.sourceName = sourceName;
  }

  @Override
  public void process(Node root) {
    ErrorManager errors = new LoggerErrorManager(logger);
    if (!new ScopeAnalyzer(errors, sourceName).analyze(root)) {
      throw new IllegalStateException(errors.getErrors().get(0).format(CheckLevel.ERROR));
    }
    Set<String> declared = new HashSet<>();
    NodeTraversal.traverse(
        root,
        new NodeTraversal.AbstractPostOrderCallback() {
          @Override
          public void visit(NodeTraversal t, Node n, Node parent) {
            if (n.isName() && NodeUtil.isDeclarationName(n)) {
              checkState(declared.add(n.getString()), "Duplicate declaration of %s", n);
            }
          }
        });
  }
}
