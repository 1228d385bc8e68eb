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
import java.util.HashMap;
import java.util.Map;

/**
 * Redirects calls to a function that is equivalent to an earlier one to the earlier function.
 * Two functions are equivalent if their definitions are equal up to the names of parameters,
 * return variables and local variables. The redirected function is left for {@link UnusedPruner}.
 *
 * <p>Requires disambiguated names and hoisted functions.
 */
class EquivalentFunctionCombiner implements CompilerPass {

  @Override
  public void process(Node root) {
    Map<String, String> firstByShape = new HashMap<>();
    Map<String, String> replacements = new HashMap<>();
    for (Node function : root.children()) {
      if (!function.isFunction()) {
        continue;
      }
      String name = function.getFirstChild().getString();
      String shape = shapeOf(function);
      String first = firstByShape.putIfAbsent(shape, name);
      if (first != null) {
        replacements.put(name, first);
      }
    }
    if (replacements.isEmpty()) {
      return;
    }
    NodeTraversal.traverse(
        root,
        new AbstractPostOrderCallback() {
          @Override
          public void visit(NodeTraversal t, Node n, Node parent) {
            if (n.isCall()) {
              Node target = n.getFirstChild();
              String replacement = replacements.get(target.getString());
              if (replacement != null) {
                target.setString(replacement);
              }
            }
          }
        });
  }

  /**
   * Prints the definition with its own name left out and the names it declares replaced by their
   * index in order of declaration.
   */
  private static String shapeOf(Node function) {
    Map<String, String> localNames = new HashMap<>();
    StringBuilder sb = new StringBuilder();
    for (Node child = function.getSecondChild(); child != null; child = child.getNext()) {
      appendShape(child, localNames, sb);
    }
    return sb.toString();
  }

  private static void appendShape(Node n, Map<String, String> localNames, StringBuilder sb) {
    sb.append(n.getToken());
    if (n.isName()) {
      if (NodeUtil.isDeclarationName(n)) {
        localNames.put(n.getString(), "$" + localNames.size());
      }
      sb.append(' ').append(localNames.getOrDefault(n.getString(), n.getString()));
    } else if (n.isNumber() || n.isString()) {
      sb.append(' ').append(n.getString());
    }
    sb.append('(');
    for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
      appendShape(child, localNames, sb);
    }
    sb.append(')');
  }
}
