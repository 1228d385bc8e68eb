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
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Inlines a variable that is referenced exactly once into the statement right after its
 * declaration, undoing {@link ExpressionSplitter}. {@code let x := e  f(y, x)} becomes {@code
 * f(y, e)} if everything the statement evaluates before {@code x} is movable, so that evaluating
 * {@code e} later does not change the result.
 *
 * <p>Requires disambiguated names.
 */
class ExpressionJoiner extends AbstractPostOrderCallback implements CompilerPass {
  private Map<String, Integer> references;

  @Override
  public void process(Node root) {
    references = NodeUtil.countReferences(root);
    NodeTraversal.traverse(root, this);
  }

  @Override
  public void visit(NodeTraversal t, Node n, Node parent) {
    if (!n.isBlock()) {
      return;
    }
    Node statement = n.getFirstChild();
    while (statement != null) {
      Node next = statement.getNext();
      if (next != null && tryJoin(statement, next)) {
        // The statement before may now be joinable into the updated one.
        Node previous = next.getPrevious();
        statement = previous != null ? previous : next;
      } else {
        statement = next;
      }
    }
  }

  /** Joins {@code let} into {@code target}; returns whether it did. */
  private boolean tryJoin(Node let, Node target) {
    if (!let.isLet() || !let.hasXChildren(2) || NodeUtil.getLetValue(let) == null) {
      return false;
    }
    String name = let.getFirstChild().getString();
    if (references.getOrDefault(name, 0) != 1) {
      return false;
    }
    Node expression = getJoinableExpression(target);
    if (expression == null) {
      return false;
    }
    Node reference = new ReferenceFinder(name).find(expression);
    if (reference == null) {
      return false;
    }
    reference.replaceWith(NodeUtil.getLetValue(let).detach());
    let.detach();
    references.remove(name);
    return true;
  }

  private static @Nullable Node getJoinableExpression(Node statement) {
    switch (statement.getToken()) {
      case EXPR_RESULT:
      case IF:
      case SWITCH:
        return statement.getFirstChild();
      case LET:
        return NodeUtil.getLetValue(statement);
      case ASSIGN:
        return NodeUtil.getAssignedValue(statement);
      default:
        return null;
    }
  }

  /**
   * Searches an expression in evaluation order, right to left, for a reference that is evaluated
   * before anything that is not movable.
   */
  private static final class ReferenceFinder {
    private final String name;
    private boolean blocked = false;

    ReferenceFinder(String name) {
      this.name = name;
    }

    @Nullable Node find(Node n) {
      if (n.isName()) {
        return n.getString().equals(name) ? n : null;
      }
      if (!n.isCall()) {
        return null;
      }
      for (Node arg = n.getLastChild(); arg != n.getFirstChild(); arg = arg.getPrevious()) {
        Node found = find(arg);
        if (found != null || blocked) {
          return found;
        }
        if (!NodeUtil.isMovable(arg)) {
          blocked = true;
          return null;
        }
      }
      return null;
    }
  }
}
