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
import java.util.Map;
import java.util.logging.Logger;

/**
 * Removes function definitions that are never called, variable declarations whose variables are
 * never referenced and expression statements without side effects. A declaration of an unused
 * variable with a side-effecting value is reduced to {@code pop(value)}. Removing code can make
 * other code unused, so the pass repeats until nothing changes.
 *
 * <p>Requires disambiguated names.
 */
class UnusedPruner implements CompilerPass {
  private static final Logger logger = Logger.getLogger(UnusedPruner.class.getName());

  @Override
  public void process(Node root) {
    int rounds = 0;
    Pruner pruner;
    do {
      pruner = new Pruner(NodeUtil.countReferences(root));
      NodeTraversal.traverse(root, pruner);
      rounds++;
    } while (pruner.changed);
    logger.finest("Unused code pruned in " + rounds + " round(s)");
  }

  private static final class Pruner extends AbstractPostOrderCallback {
    private final Map<String, Integer> references;
    boolean changed = false;

    Pruner(Map<String, Integer> references) {
      this.references = references;
    }

    @Override
    public void visit(NodeTraversal t, Node n, Node parent) {
      switch (n.getToken()) {
        case FUNCTION:
          if (!isUsed(n.getFirstChild())) {
            remove(n);
          }
          break;
        case LET:
          visitLet(n);
          break;
        case EXPR_RESULT:
          if (NodeUtil.isSideEffectFree(n.getFirstChild())) {
            remove(n);
          }
          break;
        default:
          break;
      }
    }

    private void visitLet(Node let) {
      for (Node name : NodeUtil.getDeclaredNames(let)) {
        if (isUsed(name)) {
          return;
        }
      }
      Node value = NodeUtil.getLetValue(let);
      if (value == null || NodeUtil.isSideEffectFree(value)) {
        remove(let);
      } else if (NodeUtil.getDeclaredNames(let).size() == 1) {
        let.replaceWith(IR.exprResult(IR.call("pop", value.detach())).srcref(let));
        changed = true;
      }
    }

    private boolean isUsed(Node declaration) {
      return references.getOrDefault(declaration.getString(), 0) > 0;
    }

    private void remove(Node statement) {
      if (statement.getParent().isBlock()) {
        statement.detach();
        changed = true;
      }
    }
  }
}
