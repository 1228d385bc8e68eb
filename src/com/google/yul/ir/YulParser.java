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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.yul.ir.TokenStream.Kind;
import org.jspecify.annotations.Nullable;

/**
 * Recursive descent parser for Yul blocks. Parsing stops at the first syntax error, which is
 * reported through the {@link ErrorReporter}.
 */
public final class YulParser {

  private final ErrorReporter errorReporter;

  private @Nullable TokenStream ts;
  private String sourceName = "";
  private Kind kind = Kind.ERROR;

  /** Thrown to unwind the recursion once an error has been reported. */
  private static final class ParserException extends RuntimeException {
    ParserException() {
      super(null, null, false, false);
    }
  }

  public YulParser(ErrorReporter errorReporter) {
    this.errorReporter = checkNotNull(errorReporter);
  }

  /**
   * Parses the whole stream, which is rewound first, as a single top-level block.
   *
   * @return the BLOCK node, or null if a syntax error was reported
   */
  public @Nullable Node parse(CharStream stream) {
    stream.reset();
    this.ts = new TokenStream(stream);
    this.sourceName = stream.getName();
    try {
      advance();
      Node block = parseBlock();
      if (kind != Kind.EOF) {
        reportError("Expected end of source but got '" + ts.getString() + "'");
      }
      return block;
    } catch (ParserException e) {
      return null;
    } finally {
      this.ts = null;
    }
  }

  private void advance() {
    kind = ts.next();
    if (kind == Kind.ERROR) {
      reportError(ts.getErrorMessage());
    }
  }

  private void expect(Kind expected, String spelling) {
    if (kind != expected) {
      reportError("Expected '" + spelling + "' but got " + describeCurrent());
    }
    advance();
  }

  private String describeCurrent() {
    return kind == Kind.EOF ? "end of source" : "'" + ts.getString() + "'";
  }

  private Node position(Node n, int lineno, int charno) {
    n.setLinenoCharno(lineno, charno);
    return n;
  }

  private Node parseBlock() {
    int lineno = ts.getLineno();
    int charno = ts.getCharno();
    expect(Kind.LBRACE, "{");
    Node block = position(IR.block(), lineno, charno);
    while (kind != Kind.RBRACE) {
      if (kind == Kind.EOF) {
        reportError("Expected '}' but got end of source");
      }
      block.addChildToBack(parseStatement());
    }
    advance();
    return block;
  }

  private Node parseStatement() {
    int lineno = ts.getLineno();
    int charno = ts.getCharno();
    switch (kind) {
      case LBRACE:
        return parseBlock();
      case FUNCTION:
        return parseFunction();
      case LET:
        return parseLet();
      case IF:
        {
          advance();
          Node condition = parseExpression();
          return position(IR.ifNode(condition, parseBlock()), lineno, charno);
        }
      case SWITCH:
        return parseSwitch();
      case FOR:
        {
          advance();
          Node init = parseBlock();
          Node condition = parseExpression();
          Node post = parseBlock();
          Node body = parseBlock();
          return position(IR.forNode(init, condition, post, body), lineno, charno);
        }
      case BREAK:
        advance();
        return position(IR.breakNode(), lineno, charno);
      case CONTINUE:
        advance();
        return position(IR.continueNode(), lineno, charno);
      case LEAVE:
        advance();
        return position(IR.leave(), lineno, charno);
      case IDENTIFIER:
        {
          Node name = parseName();
          if (kind == Kind.LPAREN) {
            return position(IR.exprResult(parseCallArguments(name)), lineno, charno);
          }
          if (kind == Kind.COMMA || kind == Kind.COLON_ASSIGN) {
            return parseAssignment(name);
          }
          reportError("Call or assignment expected.");
          return null;
        }
      default:
        reportError("Unexpected " + describeCurrent() + " at the start of a statement");
        return null;
    }
  }

  private Node parseFunction() {
    int lineno = ts.getLineno();
    int charno = ts.getCharno();
    advance();
    Node name = parseName();
    expect(Kind.LPAREN, "(");
    Node params = position(IR.paramList(), lineno, charno);
    if (kind != Kind.RPAREN) {
      parseNameList(params);
    }
    expect(Kind.RPAREN, ")");
    Node returns = position(IR.returnList(), lineno, charno);
    if (kind == Kind.ARROW) {
      advance();
      parseNameList(returns);
    }
    Node body = parseBlock();
    return position(IR.function(name, params, returns, body), lineno, charno);
  }

  private Node parseLet() {
    int lineno = ts.getLineno();
    int charno = ts.getCharno();
    advance();
    Node let = position(new Node(Token.LET), lineno, charno);
    parseNameList(let);
    if (kind == Kind.COLON_ASSIGN) {
      advance();
      let.addChildToBack(parseExpression());
    } else {
      let.addChildToBack(position(IR.empty(), lineno, charno));
    }
    return let;
  }

  private Node parseAssignment(Node firstTarget) {
    Node assign = new Node(Token.ASSIGN).srcref(firstTarget);
    assign.addChildToBack(firstTarget);
    while (kind == Kind.COMMA) {
      advance();
      assign.addChildToBack(parseName());
    }
    expect(Kind.COLON_ASSIGN, ":=");
    assign.addChildToBack(parseExpression());
    return assign;
  }

  private Node parseSwitch() {
    int lineno = ts.getLineno();
    int charno = ts.getCharno();
    advance();
    Node switchNode = position(IR.switchNode(parseExpression()), lineno, charno);
    while (kind == Kind.CASE) {
      int caseLineno = ts.getLineno();
      int caseCharno = ts.getCharno();
      advance();
      if (!isLiteral(kind)) {
        reportError("Literal expected but got " + describeCurrent());
      }
      Node value = parseExpression();
      switchNode.addChildToBack(position(IR.caseNode(value, parseBlock()), caseLineno, caseCharno));
    }
    if (kind == Kind.DEFAULT) {
      int defaultLineno = ts.getLineno();
      int defaultCharno = ts.getCharno();
      advance();
      switchNode.addChildToBack(
          position(IR.defaultCase(parseBlock()), defaultLineno, defaultCharno));
    }
    if (kind == Kind.CASE) {
      reportError("Case not allowed after default case.");
    }
    if (switchNode.hasOneChild()) {
      reportError("Switch statement without any cases.");
    }
    return switchNode;
  }

  private void parseNameList(Node list) {
    list.addChildToBack(parseName());
    while (kind == Kind.COMMA) {
      advance();
      list.addChildToBack(parseName());
    }
  }

  private Node parseName() {
    if (kind != Kind.IDENTIFIER) {
      reportError("Expected identifier but got " + describeCurrent());
    }
    Node name = position(IR.name(ts.getString()), ts.getLineno(), ts.getCharno());
    advance();
    return name;
  }

  private Node parseExpression() {
    int lineno = ts.getLineno();
    int charno = ts.getCharno();
    Node result;
    switch (kind) {
      case IDENTIFIER:
        {
          Node name = parseName();
          return kind == Kind.LPAREN ? parseCallArguments(name) : name;
        }
      case NUMBER:
        result = IR.number(ts.getString());
        break;
      case STRING:
        result = IR.string(ts.getString());
        break;
      case TRUE:
        result = IR.trueNode();
        break;
      case FALSE:
        result = IR.falseNode();
        break;
      default:
        reportError("Literal or identifier expected but got " + describeCurrent());
        return null;
    }
    advance();
    return position(result, lineno, charno);
  }

  private Node parseCallArguments(Node name) {
    Node call = new Node(Token.CALL, name).srcref(name);
    expect(Kind.LPAREN, "(");
    if (kind != Kind.RPAREN) {
      call.addChildToBack(parseExpression());
      while (kind == Kind.COMMA) {
        advance();
        call.addChildToBack(parseExpression());
      }
    }
    expect(Kind.RPAREN, ")");
    return call;
  }

  private static boolean isLiteral(Kind kind) {
    return kind == Kind.NUMBER || kind == Kind.STRING || kind == Kind.TRUE || kind == Kind.FALSE;
  }

  private void reportError(String message) {
    errorReporter.error(message, sourceName, ts.getLineno(), ts.getCharno());
    throw new ParserException();
  }
}
