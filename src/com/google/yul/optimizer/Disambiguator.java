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

import com.google.common.collect.ImmutableSet;
import com.google.yul.ir.Node;
import com.google.yul.optimizer.NodeTraversal.AbstractPreOrderCallback;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Renames declarations so that every name is declared exactly once in the whole program. The
 * first declaration of a name keeps it; later ones become {@code name_1}, {@code name_2} and so
 * on. References follow their declarations as resolved by {@link ScopeAnalyzer}.
 */
class Disambiguator extends AbstractPreOrderCallback implements CompilerPass {
  private final Map<Node, Node> references;
  private final NameDispenser nameDispenser = new NameDispenser(ImmutableSet.of());
  private final Map<Node, String> newNames = new IdentityHashMap<>();

  /**
   * @param references the reference to declaration map of the analysis of the tree about to be
   *     processed
   */
  Disambiguator(Map<Node, Node> references) {
    this.references = references;
  }

  @Override
  public void process(Node root) {
    NodeTraversal.traverse(root, this);
    for (Map.Entry<Node, Node> reference : references.entrySet()) {
      String newName = newNames.get(reference.getValue());
      if (newName != null) {
        reference.getKey().setString(newName);
      }
    }
    for (Map.Entry<Node, String> declaration : newNames.entrySet()) {
      declaration.getKey().setString(declaration.getValue());
    }
  }

  @Override
  public boolean shouldTraverse(NodeTraversal t, Node n, Node parent) {
    if (n.isName() && NodeUtil.isDeclarationName(n)) {
      String name = nameDispenser.newName(n.getString());
      if (!name.equals(n.getString())) {
        newNames.put(n, name);
      }
    }
    return true;
  }
}
