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
import java.math.BigInteger;

/**
 * Removes control flow whose outcome is fixed by a literal.
 *
 * <ul>
 *   <li>{@code if} with a non-zero literal condition becomes its body block, with zero it is
 *       removed.
 *   <li>{@code switch} on a literal becomes the body of the matching case, or of the default
 *       case, or is removed.
 *   <li>{@code for} with a zero literal condition becomes its init block.
 * </ul>
 */
class StructuralSimplifier extends AbstractPostOrderCallback implements CompilerPass {

  @Override
  public void process(Node root) {
    NodeTraversal.traverse(root, this);
  }

  @Override
  public void visit(NodeTraversal t, Node n, Node parent) {
    switch (n.getToken()) {
      case IF:
        {
          Node condition = n.getFirstChild();
          if (condition.isLiteral()) {
            if (isTrue(condition)) {
              n.replaceWith(n.getLastChild().detach());
            } else {
              n.detach();
            }
          }
          break;
        }
      case SWITCH:
        if (n.getFirstChild().isLiteral()) {
          simplifyConstantSwitch(n);
        }
        break;
      case FOR:
        {
          Node condition = n.getSecondChild();
          if (condition.isLiteral() && !isTrue(condition)) {
            n.replaceWith(n.getFirstChild().detach());
          }
          break;
        }
      default:
        break;
    }
  }

  private static void simplifyConstantSwitch(Node switchNode) {
    BigInteger value = NodeUtil.getLiteralValue(switchNode.getFirstChild());
    Node match = null;
    for (Node c = switchNode.getSecondChild(); c != null; c = c.getNext()) {
      if (c.isDefaultCase()
          || NodeUtil.getLiteralValue(c.getFirstChild()).equals(value)) {
        match = c;
        break;
      }
    }
    if (match == null) {
      switchNode.detach();
    } else {
      switchNode.replaceWith(match.getLastChild().detach());
    }
  }

  private static boolean isTrue(Node literal) {
    return NodeUtil.getLiteralValue(literal).signum() != 0;
  }
}
