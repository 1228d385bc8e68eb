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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.yul.ir.Node;
import com.google.yul.optimizer.Builtins.BuiltinFunction;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Checks scoping, arity and literal rules of a Yul tree and resolves every identifier reference to
 * its declaration. Errors are reported to the injected {@link ErrorHandler}; analysis continues
 * after an error so that all problems of a program are reported together.
 *
 * <p>Variables are visible from their declaration to the end of the enclosing block but not
 * inside function bodies nested in it. Functions are visible in the whole block that declares
 * them. A declaration may not reuse any visible name.
 */
public final class ScopeAnalyzer {

  static final DiagnosticType DECLARATION_ERROR =
      DiagnosticType.error("YUL_DECLARATION_ERROR", "{0}");

  static final DiagnosticType TYPE_ERROR = DiagnosticType.error("YUL_TYPE_ERROR", "{0}");

  static final DiagnosticType SYNTAX_ERROR = DiagnosticType.error("YUL_SYNTAX_ERROR", "{0}");

  static final DiagnosticType SWITCH_WITH_ONLY_DEFAULT =
      DiagnosticType.warning(
          "YUL_SWITCH_WITH_ONLY_DEFAULT", "\"switch\" statement with only a default case.");

  /** Returned for expressions whose value count is unknown because of an earlier error. */
  private static final int UNKNOWN = -1;

  private static final class Scope {
    final @Nullable Scope parent;
    /** Variables of enclosing scopes are not visible from a function scope. */
    final boolean isFunctionScope;

    final Map<String, Node> variables = new HashMap<>();
    final Map<String, Node> functions = new HashMap<>();

    Scope(@Nullable Scope parent, boolean isFunctionScope) {
      this.parent = parent;
      this.isFunctionScope = isFunctionScope;
    }
  }

  private final ErrorHandler errorHandler;
  private final String sourceName;
  private final Map<Node, Node> references = new IdentityHashMap<>();

  private @Nullable Scope scope;
  private boolean inLoopBody;
  private boolean inFunction;
  private boolean success = true;

  public ScopeAnalyzer(ErrorHandler errorHandler, String sourceName) {
    this.errorHandler = errorHandler;
    this.sourceName = sourceName;
  }

  /**
   * Analyzes the tree rooted at the top-level block.
   *
   * @return whether no error was reported
   */
  public boolean analyze(Node root) {
    checkArgument(root.isBlock(), root);
    references.clear();
    success = true;
    scope = null;
    visitBlock(root);
    return success;
  }

  /**
   * Maps every referencing NAME node (values, assignment targets and call targets) to the NAME
   * node that declares it. Keys are compared by identity.
   */
  public Map<Node, Node> getReferences() {
    return Collections.unmodifiableMap(references);
  }

  private void visitBlock(Node block) {
    scope = new Scope(scope, false);
    for (Node statement : block.children()) {
      if (statement.isFunction()) {
        registerFunction(statement);
      }
    }
    for (Node statement : block.children()) {
      visitStatement(statement);
    }
    scope = scope.parent;
  }

  private void visitStatement(Node n) {
    switch (n.getToken()) {
      case BLOCK:
        visitBlock(n);
        break;
      case FUNCTION:
        visitFunction(n);
        break;
      case LET:
        visitLet(n);
        break;
      case ASSIGN:
        visitAssign(n);
        break;
      case EXPR_RESULT:
        {
          int count = visitExpression(n.getFirstChild());
          if (count > 0) {
            report(
                TYPE_ERROR,
                n,
                "Top-level expressions are not supposed to return values (this expression returns "
                    + count
                    + " value"
                    + (count == 1 ? "" : "s")
                    + "). Use ``pop()`` or assign them.");
          }
          break;
        }
      case IF:
        expectSingleValue(n.getFirstChild());
        visitBlock(n.getLastChild());
        break;
      case SWITCH:
        visitSwitch(n);
        break;
      case FOR:
        visitFor(n);
        break;
      case BREAK:
      case CONTINUE:
        if (!inLoopBody) {
          report(
              SYNTAX_ERROR,
              n,
              "Keyword \"" + (n.isBreak() ? "break" : "continue")
                  + "\" needs to be inside a for-loop body.");
        }
        break;
      case LEAVE:
        if (!inFunction) {
          report(SYNTAX_ERROR, n, "Keyword \"leave\" can only be used inside a function.");
        }
        break;
      default:
        throw new IllegalStateException("Unexpected statement " + n);
    }
  }

  private void registerFunction(Node function) {
    Node name = function.getFirstChild();
    if (checkDeclarable(name, "Function")) {
      scope.functions.put(name.getString(), function);
    }
  }

  private void visitFunction(Node function) {
    boolean wasInLoopBody = inLoopBody;
    boolean wasInFunction = inFunction;
    inLoopBody = false;
    inFunction = true;
    scope = new Scope(scope, true);
    for (Node param : function.getSecondChild().children()) {
      declareVariable(param);
    }
    for (Node ret : function.getChildAtIndex(2).children()) {
      declareVariable(ret);
    }
    visitBlock(NodeUtil.getFunctionBody(function));
    scope = scope.parent;
    inLoopBody = wasInLoopBody;
    inFunction = wasInFunction;
  }

  private void visitLet(Node let) {
    ImmutableList<Node> names = NodeUtil.getDeclaredNames(let);
    Node value = NodeUtil.getLetValue(let);
    if (value != null) {
      int count = visitExpression(value);
      if (count != UNKNOWN && count != names.size()) {
        report(
            TYPE_ERROR,
            let,
            "Variable count mismatch for declaration of \""
                + joinNames(names)
                + "\": "
                + names.size()
                + " variables and "
                + count
                + " values.");
      }
    }
    for (Node name : names) {
      declareVariable(name);
    }
  }

  private void visitAssign(Node assign) {
    Set<String> seen = new HashSet<>();
    List<Node> targets = new ArrayList<>();
    for (Node target = assign.getFirstChild();
        target != assign.getLastChild();
        target = target.getNext()) {
      targets.add(target);
      if (!seen.add(target.getString())) {
        report(
            DECLARATION_ERROR,
            target,
            "Variable "
                + target.getString()
                + " occurs multiple times on the left-hand side of the assignment.");
      }
      Node declaration = lookup(target.getString());
      if (declaration == null || declaration.isFunction()) {
        report(DECLARATION_ERROR, target, "Variable not found or variable not lvalue.");
      } else {
        references.put(target, declaration);
      }
    }
    int count = visitExpression(NodeUtil.getAssignedValue(assign));
    if (count != UNKNOWN && count != targets.size()) {
      report(
          TYPE_ERROR,
          assign,
          "Variable count for assignment to \""
              + joinNames(targets)
              + "\" does not match number of values ("
              + targets.size()
              + " vs. "
              + count
              + ")");
    }
  }

  private void visitSwitch(Node switchNode) {
    expectSingleValue(switchNode.getFirstChild());
    Node firstCase = switchNode.getSecondChild();
    if (firstCase != null && firstCase.getNext() == null && firstCase.isDefaultCase()) {
      errorHandler.report(
          SWITCH_WITH_ONLY_DEFAULT.level,
          YulError.make(sourceName, switchNode, SWITCH_WITH_ONLY_DEFAULT));
    }
    Set<BigInteger> values = new HashSet<>();
    for (Node c = switchNode.getSecondChild(); c != null; c = c.getNext()) {
      if (c.isCase()) {
        Node literal = c.getFirstChild();
        if (checkLiteral(literal) && !values.add(NodeUtil.getLiteralValue(literal))) {
          report(
              DECLARATION_ERROR, c, "Duplicate case \"" + literalSpelling(literal) + "\" defined.");
        }
      }
      visitBlock(c.getLastChild());
    }
  }

  private void visitFor(Node forNode) {
    Node init = forNode.getFirstChild();
    boolean wasInLoopBody = inLoopBody;
    inLoopBody = false;
    scope = new Scope(scope, false);
    for (Node statement : init.children()) {
      if (statement.isFunction()) {
        report(
            SYNTAX_ERROR, statement, "Functions cannot be defined inside a for-loop init block.");
      } else {
        visitStatement(statement);
      }
    }
    expectSingleValue(forNode.getSecondChild());
    visitBlock(forNode.getChildAtIndex(2));
    inLoopBody = true;
    visitBlock(forNode.getLastChild());
    inLoopBody = wasInLoopBody;
    scope = scope.parent;
  }

  private void expectSingleValue(Node expression) {
    int count = visitExpression(expression);
    if (count != UNKNOWN && count != 1) {
      report(
          TYPE_ERROR,
          expression,
          "Expected expression to evaluate to one value, but got " + count + " values instead.");
    }
  }

  /** Returns the number of values the expression yields. */
  private int visitExpression(Node n) {
    switch (n.getToken()) {
      case NAME:
        visitName(n);
        return 1;
      case NUMBER:
      case STRING:
      case TRUE:
      case FALSE:
        checkLiteral(n);
        return 1;
      case CALL:
        return visitCall(n);
      default:
        throw new IllegalStateException("Unexpected expression " + n);
    }
  }

  private void visitName(Node name) {
    String identifier = name.getString();
    Node declaration = lookup(identifier);
    if (declaration == null) {
      if (Builtins.isBuiltin(identifier)) {
        report(DECLARATION_ERROR, name, "Builtin function \"" + identifier + "\" must be called.");
      } else {
        report(DECLARATION_ERROR, name, "Identifier \"" + identifier + "\" not found.");
      }
    } else if (declaration.isFunction()) {
      report(DECLARATION_ERROR, name, "Function \"" + identifier + "\" must be called.");
    } else {
      references.put(name, declaration);
    }
  }

  private int visitCall(Node call) {
    // Arguments are evaluated right to left.
    int arguments = 0;
    for (Node arg = call.getLastChild(); arg != call.getFirstChild(); arg = arg.getPrevious()) {
      expectSingleValue(arg);
      arguments++;
    }

    Node target = call.getFirstChild();
    String name = target.getString();
    int parameters;
    int returns;
    BuiltinFunction builtin = Builtins.get(name);
    if (builtin != null) {
      parameters = builtin.parameterCount();
      returns = builtin.returnCount();
    } else {
      Node declaration = lookup(name);
      if (declaration == null) {
        report(DECLARATION_ERROR, target, "Function \"" + name + "\" not found.");
        return UNKNOWN;
      }
      if (!declaration.isFunction()) {
        report(TYPE_ERROR, target, "Attempt to call variable instead of function.");
        return UNKNOWN;
      }
      references.put(target, declaration.getFirstChild());
      parameters = declaration.getSecondChild().getChildCount();
      returns = declaration.getChildAtIndex(2).getChildCount();
    }
    if (parameters != arguments) {
      report(
          TYPE_ERROR,
          call,
          "Function \""
              + name
              + "\" expects "
              + parameters
              + " arguments but got "
              + arguments
              + ".");
    }
    return returns;
  }

  private boolean checkLiteral(Node literal) {
    if (literal.isNumber()) {
      if (NodeUtil.parseNumber(literal.getString()).bitLength() > 256) {
        report(TYPE_ERROR, literal, "Number literal too large (> 256 bits)");
        return false;
      }
    } else if (literal.isString()) {
      int length = NodeUtil.getStringBytes(literal).length;
      if (length > NodeUtil.MAX_STRING_BYTES) {
        report(
            TYPE_ERROR,
            literal,
            "String literal too long (" + length + " > " + NodeUtil.MAX_STRING_BYTES + ")");
        return false;
      }
    }
    return true;
  }

  private void declareVariable(Node name) {
    if (checkDeclarable(name, "Variable")) {
      scope.variables.put(name.getString(), name);
    }
  }

  private boolean checkDeclarable(Node name, String kind) {
    String identifier = name.getString();
    if (Builtins.isBuiltin(identifier)) {
      report(
          DECLARATION_ERROR,
          name,
          "Cannot use builtin function name \"" + identifier + "\" as identifier name.");
      return false;
    }
    if (lookup(identifier) != null) {
      report(
          DECLARATION_ERROR, name, kind + " name " + identifier + " already taken in this scope.");
      return false;
    }
    return true;
  }

  /**
   * Resolves a name visible from the current scope.
   *
   * @return the declaring NAME node of a variable or the FUNCTION node of a function
   */
  private @Nullable Node lookup(String name) {
    boolean variablesVisible = true;
    for (Scope s = scope; s != null; s = s.parent) {
      if (variablesVisible) {
        Node variable = s.variables.get(name);
        if (variable != null) {
          return variable;
        }
      }
      Node function = s.functions.get(name);
      if (function != null) {
        return function;
      }
      if (s.isFunctionScope) {
        variablesVisible = false;
      }
    }
    return null;
  }

  private static String joinNames(List<Node> names) {
    return Joiner.on(", ").join(names.stream().map(Node::getString).iterator());
  }

  private static String literalSpelling(Node literal) {
    switch (literal.getToken()) {
      case TRUE:
        return "true";
      case FALSE:
        return "false";
      default:
        return literal.getString();
    }
  }

  private void report(DiagnosticType type, Node n, String message) {
    if (type.level == CheckLevel.ERROR) {
      success = false;
    }
    errorHandler.report(type.level, YulError.make(sourceName, n, type, message));
  }
}
