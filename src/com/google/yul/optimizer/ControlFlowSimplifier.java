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
 * Simplifies control flow structures without looking at literal values:
 *
 * <ul>
 *   <li>an {@code if} with an empty body is removed, or replaced by {@code pop(condition)} if
 *       evaluating the condition matters;
 *   <li>an empty default case is removed, as are empty cases of a switch without default;
 *   <li>a switch without cases is treated like an if with an empty body;
 *   <li>a switch with a single case becomes {@code if eq(value, expression) { ... }}, one with
 *       only a default case becomes {@code pop(expression)} followed by the default body;
 *   <li>a for loop whose body ends in {@code break} and contains no other break or continue of
 *       that loop becomes an {@code if};
 *   <li>a {@code leave} at the end of a function body is removed.
 * </ul>
 */
class ControlFlowSimplifier extends AbstractPostOrderCallback implements CompilerPass {

  @Override
  public void process(Node root) {
    NodeTraversal.traverse(root, this);
  }

  @Override
  public void visit(NodeTraversal t, Node n, Node parent) {
    switch (n.getToken()) {
      case IF:
        if (!n.getLastChild().hasChildren()) {
          discard(n, n.getFirstChild());
        }
        break;
      case SWITCH:
        simplifySwitch(n);
        break;
      case FOR:
        simplifyFor(n);
        break;
      case FUNCTION:
        {
          Node body = NodeUtil.getFunctionBody(n);
          if (body.hasChildren() && body.getLastChild().isLeave()) {
            body.getLastChild().detach();
          }
          break;
        }
      default:
        break;
    }
  }

  private static void simplifySwitch(Node switchNode) {
    Node last = switchNode.getLastChild();
    if (last.isDefaultCase() && !last.getFirstChild().hasChildren()) {
      last.detach();
    }
    if (!switchNode.getLastChild().isDefaultCase()) {
      for (Node c = switchNode.getSecondChild(); c != null; ) {
        Node next = c.getNext();
        if (!c.getLastChild().hasChildren()) {
          c.detach();
        }
        c = next;
      }
    }

    Node expression = switchNode.getFirstChild();
    if (switchNode.hasOneChild()) {
      discard(switchNode, expression);
    } else if (switchNode.hasXChildren(2)) {
      Node onlyCase = switchNode.getLastChild();
      if (onlyCase.isCase()) {
        Node condition =
            IR.call("eq", onlyCase.getFirstChild().detach(), expression.detach()).srcref(onlyCase);
        switchNode.replaceWith(IR.ifNode(condition, onlyCase.getLastChild().detach()));
      } else {
        Node body = onlyCase.getLastChild().detach();
        body.addChildToFront(IR.exprResult(IR.call("pop", expression.detach())));
        switchNode.replaceWith(body);
      }
    }
  }

  private static void simplifyFor(Node forNode) {
    Node body = forNode.getLastChild();
    if (forNode.getFirstChild().hasChildren()
        || !body.hasChildren()
        || !body.getLastChild().isBreak()) {
      return;
    }
    body.getLastChild().detach();
    if (jumpsToLoop(body)) {
      body.addChildToBack(IR.breakNode());
      return;
    }
    forNode.replaceWith(IR.ifNode(forNode.getSecondChild().detach(), body.detach()));
  }

  /** Whether there is a break or continue below {@code n} that belongs to the enclosing loop. */
  private static boolean jumpsToLoop(Node n) {
    for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
      if (child.isBreak() || child.isContinue()) {
        return true;
      }
      if (!child.isFor() && !child.isFunction() && jumpsToLoop(child)) {
        return true;
      }
    }
    return false;
  }

  /** Replaces {@code statement} by an evaluation of {@code expression} for its side effects. */
  private static void discard(Node statement, Node expression) {
    if (NodeUtil.isMovable(expression)) {
      statement.detach();
    } else {
      statement.replaceWith(IR.exprResult(IR.call("pop", expression.detach())));
    }
  }
}
