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
 * Replaces every block nested directly in another block by its statements. Blocks that belong to
 * an if, switch case, for loop or function are kept.
 *
 * <p>Requires disambiguated names.
 */
class BlockFlattener extends AbstractPostOrderCallback implements CompilerPass {

  @Override
  public void process(Node root) {
    NodeTraversal.traverse(root, this);
  }

  @Override
  public void visit(NodeTraversal t, Node n, Node parent) {
    if (n.isBlock() && parent != null && parent.isBlock()) {
      n.replaceWithChildrenOf(n);
    }
  }
}
