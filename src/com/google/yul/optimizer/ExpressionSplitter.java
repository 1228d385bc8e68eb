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
import com.google.yul.optimizer.NodeTraversal.AbstractPreOrderCallback;
import java.util.ArrayList;
import java.util.List;

/**
 * Moves every function call argument that is not an identifier into a new variable declared just
 * before the statement, so that {@code f(a(), b())} becomes {@code let _1 := b() let _2 := a()
 * f(_2, _1)}. Arguments are outlined right to left, which keeps the evaluation order. Conditions
 * of if statements and switch expressions are outlined as well; for loop conditions are not,
 * since they are evaluated on every iteration.
 *
 * <p>Requires disambiguated names.
 */
class ExpressionSplitter implements CompilerPass {
  private final NameDispenser nameDispenser;

  ExpressionSplitter(NameDispenser nameDispenser) {
    this.nameDispenser = nameDispenser;
  }

  @Override
  public void process(Node root) {
    List<Node> blocks = new ArrayList<>();
    NodeTraversal.traverse(
        root,
        new AbstractPreOrderCallback() {
          @Override
          public boolean shouldTraverse(NodeTraversal t, Node n, Node parent) {
            if (n.isBlock()) {
              blocks.add(n);
            }
            return !n.getToken().isExpression();
          }
        });
    for (Node block : blocks) {
      for (Node statement = block.getFirstChild(); statement != null; ) {
        Node next = statement.getNext();
        splitStatement(statement);
        statement = next;
      }
    }
  }

  private void splitStatement(Node statement) {
    List<Node> prefix = new ArrayList<>();
    switch (statement.getToken()) {
      case EXPR_RESULT:
        outlineArguments(statement.getFirstChild(), prefix);
        break;
      case LET:
      case ASSIGN:
        {
          Node value = statement.getLastChild();
          if (value.isCall()) {
            outlineArguments(value, prefix);
          }
          break;
        }
      case IF:
      case SWITCH:
        outline(statement.getFirstChild(), prefix);
        break;
      default:
        break;
    }
    for (Node declaration : prefix) {
      declaration.insertBefore(statement);
    }
  }

  private void outlineArguments(Node call, List<Node> prefix) {
    for (Node arg = call.getLastChild(); arg != call.getFirstChild(); ) {
      Node previous = arg.getPrevious();
      outline(arg, prefix);
      arg = previous;
    }
  }

  private void outline(Node expression, List<Node> prefix) {
    if (expression.isName()) {
      return;
    }
    if (expression.isCall()) {
      outlineArguments(expression, prefix);
    }
    Node name = IR.name(nameDispenser.newName("")).srcref(expression);
    expression.replaceWith(name.cloneNode());
    prefix.add(IR.let(name, expression).srcref(expression));
  }
}
