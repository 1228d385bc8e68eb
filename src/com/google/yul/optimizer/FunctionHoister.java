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
import com.google.yul.optimizer.NodeTraversal.AbstractPreOrderCallback;
import java.util.ArrayList;
import java.util.List;

/**
 * Moves every function definition, nested ones included, to the end of the top-level block. The
 * functions keep the order in which they appear in the source.
 *
 * <p>Requires disambiguated names.
 */
class FunctionHoister implements CompilerPass {

  @Override
  public void process(Node root) {
    List<Node> functions = new ArrayList<>();
    NodeTraversal.traverse(
        root,
        new AbstractPreOrderCallback() {
          @Override
          public boolean shouldTraverse(NodeTraversal t, Node n, Node parent) {
            if (n.isFunction()) {
              functions.add(n);
            }
            return !n.getToken().isExpression();
          }
        });
    for (Node function : functions) {
      function.detach();
      root.addChildToBack(function);
    }
  }
}
