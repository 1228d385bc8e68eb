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

package com.google.yul.ir;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import java.math.BigInteger;
import java.util.List;

/** An AST construction helper class */
public class IR {

  private IR() {}

  public static Node block() {
    return new Node(Token.BLOCK);
  }

  public static Node block(Node stmt) {
    checkState(mayBeStatement(stmt), "Block node cannot contain %s", stmt.getToken());
    return new Node(Token.BLOCK, stmt);
  }

  public static Node block(Node... stmts) {
    Node block = block();
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Block node cannot contain %s", stmt.getToken());
      block.addChildToBack(stmt);
    }
    return block;
  }

  public static Node block(List<Node> stmts) {
    Node block = block();
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Block node cannot contain %s", stmt.getToken());
      block.addChildToBack(stmt);
    }
    return block;
  }

  public static Node function(Node name, Node params, Node returns, Node body) {
    checkState(name.isName());
    checkState(params.getToken() == Token.PARAM_LIST);
    checkState(returns.getToken() == Token.RETURN_LIST);
    checkState(body.isBlock());
    Node function = new Node(Token.FUNCTION, name, params, returns);
    function.addChildToBack(body);
    return function;
  }

  public static Node paramList(Node... params) {
    return nameList(Token.PARAM_LIST, params);
  }

  public static Node returnList(Node... returns) {
    return nameList(Token.RETURN_LIST, returns);
  }

  private static Node nameList(Token token, Node... names) {
    Node list = new Node(token);
    for (Node name : names) {
      checkState(name.isName());
      list.addChildToBack(name);
    }
    return list;
  }

  /** Declaration without a value. */
  public static Node let(Node... names) {
    checkArgument(names.length > 0);
    Node let = new Node(Token.LET);
    for (Node name : names) {
      checkState(name.isName());
      let.addChildToBack(name);
    }
    let.addChildToBack(empty());
    return let;
  }

  public static Node let(Node name, Node value) {
    checkState(name.isName());
    checkState(mayBeExpression(value));
    return new Node(Token.LET, name, value);
  }

  public static Node assign(Node target, Node value) {
    checkState(target.isName());
    checkState(mayBeExpression(value));
    return new Node(Token.ASSIGN, target, value);
  }

  public static Node exprResult(Node call) {
    checkState(call.isCall(), call);
    return new Node(Token.EXPR_RESULT, call);
  }

  public static Node ifNode(Node cond, Node body) {
    checkState(mayBeExpression(cond));
    checkState(body.isBlock());
    return new Node(Token.IF, cond, body);
  }

  public static Node switchNode(Node expression, Node... cases) {
    checkState(mayBeExpression(expression));
    Node switchNode = new Node(Token.SWITCH, expression);
    for (Node caseNode : cases) {
      checkState(caseNode.isCase() || caseNode.isDefaultCase());
      switchNode.addChildToBack(caseNode);
    }
    return switchNode;
  }

  public static Node caseNode(Node value, Node body) {
    checkState(value.isLiteral());
    checkState(body.isBlock());
    return new Node(Token.CASE, value, body);
  }

  public static Node defaultCase(Node body) {
    checkState(body.isBlock());
    return new Node(Token.DEFAULT_CASE, body);
  }

  public static Node forNode(Node init, Node cond, Node post, Node body) {
    checkState(init.isBlock());
    checkState(mayBeExpression(cond));
    checkState(post.isBlock());
    checkState(body.isBlock());
    Node forNode = new Node(Token.FOR, init, cond, post);
    forNode.addChildToBack(body);
    return forNode;
  }

  public static Node breakNode() {
    return new Node(Token.BREAK);
  }

  public static Node continueNode() {
    return new Node(Token.CONTINUE);
  }

  public static Node leave() {
    return new Node(Token.LEAVE);
  }

  public static Node call(String target, Node... args) {
    Node call = new Node(Token.CALL, name(target));
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
      call.addChildToBack(arg);
    }
    return call;
  }

  public static Node name(String name) {
    checkArgument(!name.isEmpty());
    return Node.newString(Token.NAME, name);
  }

  public static Node number(String spelling) {
    return Node.newString(Token.NUMBER, spelling);
  }

  /** A number literal in canonical spelling: decimal below 2^32, hexadecimal above. */
  public static Node number(BigInteger value) {
    checkArgument(value.signum() >= 0, value);
    if (value.bitLength() <= 32) {
      return number(value.toString());
    }
    return number("0x" + value.toString(16));
  }

  public static Node number(long value) {
    return number(BigInteger.valueOf(value));
  }

  /** A string literal; {@code spelling} includes the quotes as written in source. */
  public static Node string(String spelling) {
    return Node.newString(Token.STRING, spelling);
  }

  public static Node empty() {
    return new Node(Token.EMPTY);
  }

  public static Node trueNode() {
    return new Node(Token.TRUE);
  }

  public static Node falseNode() {
    return new Node(Token.FALSE);
  }

  /** It isn't possible to always determine if a detached node is an expression, so just check. */
  static boolean mayBeExpression(Node n) {
    return n.getToken().isExpression();
  }

  static boolean mayBeStatement(Node n) {
    return n.getToken().isStatement();
  }
}
