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
import com.google.yul.optimizer.NodeTraversal.AbstractPostOrderCallback;

/**
 * Reverses {@link ForLoopConditionIntoBody}: a loop with a constant true condition whose body
 * starts with {@code if c { break }} takes {@code iszero(c)} as its condition, and the if is
 * removed. {@code if iszero(c) { break }} yields the condition {@code c}.
 */
class ForLoopConditionOutOfBody extends AbstractPostOrderCallback implements CompilerPass {

  @Override
  public void process(Node root) {
    NodeTraversal.traverse(root, this);
  }

  @Override
  public void visit(NodeTraversal t, Node n, Node parent) {
    if (!n.isFor()) {
      return;
    }
    Node condition = n.getSecondChild();
    if (!condition.isLiteral() || NodeUtil.getLiteralValue(condition).signum() == 0) {
      return;
    }
    Node first = n.getLastChild().getFirstChild();
    if (first == null
        || !first.isIf()
        || !first.getLastChild().hasOneChild()
        || !first.getLastChild().getFirstChild().isBreak()) {
      return;
    }
    Node breakCondition = first.getFirstChild().detach();
    Node newCondition =
        NodeUtil.isCallTo(breakCondition, "iszero")
            ? breakCondition.getSecondChild().detach()
            : IR.call("iszero", breakCondition).srcref(breakCondition);
    condition.replaceWith(newCondition);
    first.detach();
  }
}
