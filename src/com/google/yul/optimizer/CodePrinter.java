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
 * CodePrinter prints out Yul code in either a "compact" or a "pretty" format.
 *
 * <p>The pretty format puts every statement on a line of its own, indented by nesting depth, with
 * the blocks of control structures and functions on the following line. The compact format is a
 * single line. Both parse back into the same tree.
 */
public final class CodePrinter {
  private static final String INDENT = "    ";

  private final boolean prettyPrint;
  private final StringBuilder sb = new StringBuilder();
  private int indent = 0;

  private CodePrinter(boolean prettyPrint) {
    this.prettyPrint = prettyPrint;
  }

  /** Configures and runs a {@link CodePrinter}. */
  public static final class Builder {
    private final Node root;
    private boolean prettyPrint = true;

    /**
     * Sets the root node from which to generate the source code.
     *
     * @param node The root node.
     */
    public Builder(Node node) {
      root = node;
    }

    /**
     * Sets whether pretty printing should be used.
     *
     * @param prettyPrint If true, pretty printing will be used.
     */
    public Builder setPrettyPrint(boolean prettyPrint) {
      this.prettyPrint = prettyPrint;
      return this;
    }

    /** Generates the source code and returns it. */
    public String build() {
      CodePrinter printer = new CodePrinter(prettyPrint);
      if (root.getToken().isExpression()) {
        printer.addExpression(root);
      } else {
        printer.addStatement(root);
      }
      return printer.sb.toString();
    }
  }

  private void addBlock(Node block) {
    if (!block.hasChildren()) {
      sb.append("{ }");
      return;
    }
    sb.append('{');
    indent++;
    for (Node statement : block.children()) {
      newlineOrSpace();
      addStatement(statement);
    }
    indent--;
    newlineOrSpace();
    sb.append('}');
  }

  /** Breaks the line in pretty mode, adds a space otherwise. */
  private void newlineOrSpace() {
    if (prettyPrint) {
      sb.append('\n');
      for (int i = 0; i < indent; i++) {
        sb.append(INDENT);
      }
    } else {
      sb.append(' ');
    }
  }

  private void addStatement(Node n) {
    switch (n.getToken()) {
      case BLOCK:
        addBlock(n);
        break;
      case FUNCTION:
        sb.append("function ").append(n.getFirstChild().getString()).append('(');
        addNameList(n.getSecondChild());
        sb.append(')');
        if (n.getChildAtIndex(2).hasChildren()) {
          sb.append(" -> ");
          addNameList(n.getChildAtIndex(2));
        }
        newlineOrSpace();
        addBlock(n.getLastChild());
        break;
      case LET:
        {
          sb.append("let ");
          addNameList(n);
          Node value = NodeUtil.getLetValue(n);
          if (value != null) {
            sb.append(" := ");
            addExpression(value);
          }
          break;
        }
      case ASSIGN:
        addNameList(n);
        sb.append(" := ");
        addExpression(n.getLastChild());
        break;
      case EXPR_RESULT:
        addExpression(n.getFirstChild());
        break;
      case IF:
        sb.append("if ");
        addExpression(n.getFirstChild());
        newlineOrSpace();
        addBlock(n.getLastChild());
        break;
      case SWITCH:
        sb.append("switch ");
        addExpression(n.getFirstChild());
        for (Node c = n.getSecondChild(); c != null; c = c.getNext()) {
          newlineOrSpace();
          if (c.isCase()) {
            sb.append("case ");
            addExpression(c.getFirstChild());
            sb.append(' ');
          } else {
            sb.append("default ");
          }
          addBlock(c.getLastChild());
        }
        break;
      case FOR:
        sb.append("for ");
        addBlock(n.getFirstChild());
        sb.append(' ');
        addExpression(n.getSecondChild());
        sb.append(' ');
        addBlock(n.getChildAtIndex(2));
        newlineOrSpace();
        addBlock(n.getLastChild());
        break;
      case BREAK:
        sb.append("break");
        break;
      case CONTINUE:
        sb.append("continue");
        break;
      case LEAVE:
        sb.append("leave");
        break;
      default:
        throw new IllegalStateException("Unexpected statement " + n);
    }
  }

  /**
   * Prints the names among the children of {@code n}, separated by commas. The value of a LET or
   * ASSIGN, its last child, is left out.
   */
  private void addNameList(Node n) {
    Node end = n.isLet() || n.isAssign() ? n.getLastChild() : null;
    for (Node name = n.getFirstChild(); name != end; name = name.getNext()) {
      if (name != n.getFirstChild()) {
        sb.append(", ");
      }
      sb.append(name.getString());
    }
  }

  private void addExpression(Node n) {
    switch (n.getToken()) {
      case CALL:
        {
          sb.append(n.getFirstChild().getString()).append('(');
          for (Node arg = n.getSecondChild(); arg != null; arg = arg.getNext()) {
            addExpression(arg);
            if (arg.getNext() != null) {
              sb.append(", ");
            }
          }
          sb.append(')');
          break;
        }
      case NAME:
      case NUMBER:
      case STRING:
        sb.append(n.getString());
        break;
      case TRUE:
        sb.append("true");
        break;
      case FALSE:
        sb.append("false");
        break;
      default:
        throw new IllegalStateException("Unexpected expression " + n);
    }
  }
}
