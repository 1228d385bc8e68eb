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
import com.google.yul.optimizer.NodeTraversal.AbstractPostOrderCallback;

/**
 * Removes the statements of a block that follow a {@code break}, {@code continue}, {@code leave}
 * or a call to a terminating built-in such as {@code revert}. Function definitions are kept since
 * they are reachable through calls.
 */
class DeadCodeEliminator extends AbstractPostOrderCallback implements CompilerPass {

  @Override
  public void process(Node root) {
    NodeTraversal.traverse(root, this);
  }

  @Override
  public void visit(NodeTraversal t, Node n, Node parent) {
    if (!n.isBlock()) {
      return;
    }
    boolean unreachable = false;
    for (Node statement = n.getFirstChild(); statement != null; ) {
      Node next = statement.getNext();
      if (unreachable && !statement.isFunction()) {
        statement.detach();
      } else if (NodeUtil.isTerminatingStatement(statement)) {
        unreachable = true;
      }
      statement = next;
    }
  }
}
