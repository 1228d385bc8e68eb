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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Removes function definitions that cannot be reached from the code outside of functions, even
 * when they call each other or themselves.
 *
 * <p>Requires disambiguated names.
 */
class CircularReferencesPruner implements CompilerPass {

  @Override
  public void process(Node root) {
    List<Node> functions = new ArrayList<>();
    Map<String, Set<String>> calls = new HashMap<>();
    Set<String> roots = new HashSet<>();
    collect(root, roots, functions, calls);

    Set<String> reachable = new HashSet<>();
    Deque<String> worklist = new ArrayDeque<>(roots);
    while (!worklist.isEmpty()) {
      String name = worklist.pop();
      if (reachable.add(name)) {
        worklist.addAll(calls.getOrDefault(name, Set.of()));
      }
    }

    for (Node function : functions) {
      if (!reachable.contains(function.getFirstChild().getString())) {
        function.detach();
      }
    }
  }

  /**
   * Records the names referenced in {@code n} into {@code names}. The names referenced in a
   * nested function definition go to a set of their own.
   */
  private static void collect(
      Node n, Set<String> names, List<Node> functions, Map<String, Set<String>> calls) {
    for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
      if (child.isFunction()) {
        functions.add(child);
        Set<String> referenced = new HashSet<>();
        calls.put(child.getFirstChild().getString(), referenced);
        collect(NodeUtil.getFunctionBody(child), referenced, functions, calls);
      } else if (child.isName()) {
        names.add(child.getString());
      } else {
        collect(child, names, functions, calls);
      }
    }
  }
}
