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

import com.google.yul.ir.IR;
import com.google.yul.ir.Node;
import java.util.ArrayList;
import java.util.List;

/**
 * Brings the top-level block into the grouped shape: a single block holding all other statements,
 * followed by the function definitions in their original order.
 *
 * <p>Requires hoisted functions.
 */
class FunctionGrouper implements CompilerPass {

  @Override
  public void process(Node root) {
    if (isGrouped(root)) {
      return;
    }
    Node code = IR.block();
    List<Node> functions = new ArrayList<>();
    for (Node statement = root.getFirstChild(); statement != null; ) {
      Node next = statement.getNext();
      statement.detach();
      if (statement.isFunction()) {
        functions.add(statement);
      } else {
        code.addChildToBack(statement);
      }
      statement = next;
    }
    root.addChildToBack(code);
    for (Node function : functions) {
      root.addChildToBack(function);
    }
  }

  static boolean isGrouped(Node root) {
    if (!root.hasChildren() || !root.getFirstChild().isBlock()) {
      return false;
    }
    for (Node n = root.getSecondChild(); n != null; n = n.getNext()) {
      if (!n.isFunction()) {
        return false;
      }
    }
    return true;
  }
}
