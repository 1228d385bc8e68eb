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

/**
 * Structural size of a Yul tree, the cost the step sequence search minimizes.
 *
 * <p>Every statement counts one except blocks, expression statements, assignments and variable
 * declarations. Every expression counts one except identifiers. The name of a called function and
 * the values of switch cases are not counted.
 */
public final class CodeSize {

  private CodeSize() {}

  /** The size of the tree, skipping function definitions entirely. */
  public static int codeSize(Node root) {
    return new Counter(false).count(root);
  }

  /** The size of the tree with function definitions counted like any other statement. */
  public static int codeSizeIncludingFunctions(Node root) {
    return new Counter(true).count(root);
  }

  private static final class Counter {
    private final boolean includeFunctions;

    Counter(boolean includeFunctions) {
      this.includeFunctions = includeFunctions;
    }

    int count(Node n) {
      switch (n.getToken()) {
        case FUNCTION:
          return includeFunctions ? 1 + countChildren(n) : 0;
        case BLOCK:
        case EXPR_RESULT:
        case ASSIGN:
        case LET:
        case PARAM_LIST:
        case RETURN_LIST:
        case DEFAULT_CASE:
          return countChildren(n);
        case CASE:
          return count(n.getLastChild());
        case CALL:
          {
            int size = 1;
            for (Node arg = n.getSecondChild(); arg != null; arg = arg.getNext()) {
              size += count(arg);
            }
            return size;
          }
        case NAME:
        case EMPTY:
          return 0;
        default:
          // Remaining statements and literals.
          return 1 + countChildren(n);
      }
    }

    private int countChildren(Node n) {
      int size = 0;
      for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
        size += count(child);
      }
      return size;
    }
  }
}
