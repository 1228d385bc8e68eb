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

import com.google.common.collect.ImmutableMap;

/**
 * Splits Yul source into lexical tokens. Whitespace and comments are skipped. The stream is
 * stateful: {@link #next()} advances and the accessors describe the token just read.
 */
final class TokenStream {

  /** Lexical token kinds. */
  enum Kind {
    LBRACE,
    RBRACE,
    LPAREN,
    RPAREN,
    COMMA,
    COLON_ASSIGN,
    ARROW,
    IDENTIFIER,
    NUMBER,
    STRING,
    LET,
    FUNCTION,
    IF,
    SWITCH,
    CASE,
    DEFAULT,
    FOR,
    BREAK,
    CONTINUE,
    LEAVE,
    TRUE,
    FALSE,
    EOF,
    ERROR
  }

  private static final ImmutableMap<String, Kind> KEYWORDS =
      ImmutableMap.<String, Kind>builder()
          .put("let", Kind.LET)
          .put("function", Kind.FUNCTION)
          .put("if", Kind.IF)
          .put("switch", Kind.SWITCH)
          .put("case", Kind.CASE)
          .put("default", Kind.DEFAULT)
          .put("for", Kind.FOR)
          .put("break", Kind.BREAK)
          .put("continue", Kind.CONTINUE)
          .put("leave", Kind.LEAVE)
          .put("true", Kind.TRUE)
          .put("false", Kind.FALSE)
          .buildOrThrow();

  private final CharStream stream;
  private int lineno = 1;
  private int lineStart = 0;

  private Kind kind = Kind.ERROR;
  private String string = "";
  private int tokenLineno;
  private int tokenCharno;
  private String errorMessage = "";

  TokenStream(CharStream stream) {
    this.stream = stream;
  }

  /** The source spelling of the current token. */
  String getString() {
    return string;
  }

  int getLineno() {
    return tokenLineno;
  }

  int getCharno() {
    return tokenCharno;
  }

  String getErrorMessage() {
    return errorMessage;
  }

  Kind next() {
    if (!skipWhitespaceAndComments()) {
      return kind;
    }
    tokenLineno = lineno;
    tokenCharno = stream.position() - lineStart;
    int start = stream.position();
    char c = stream.get();

    if (stream.isPastEndOfInput()) {
      string = "";
      return kind = Kind.EOF;
    }

    switch (c) {
      case '{':
        return single(Kind.LBRACE, start);
      case '}':
        return single(Kind.RBRACE, start);
      case '(':
        return single(Kind.LPAREN, start);
      case ')':
        return single(Kind.RPAREN, start);
      case ',':
        return single(Kind.COMMA, start);
      case ':':
        if (stream.get(1) == '=') {
          stream.advanceAndGet();
          return single(Kind.COLON_ASSIGN, start);
        }
        return error("Expected ':=' but found ':'");
      case '-':
        if (stream.get(1) == '>') {
          stream.advanceAndGet();
          return single(Kind.ARROW, start);
        }
        return error("Unexpected character '-'");
      case '"':
      case '\'':
        return scanString(c, start);
      default:
        break;
    }

    if (isDigit(c)) {
      return scanNumber(start);
    }
    if (isIdentifierStart(c)) {
      while (isIdentifierPart(stream.get())) {
        stream.advanceAndGet();
      }
      string = stream.substring(start, stream.position());
      return kind = KEYWORDS.getOrDefault(string, Kind.IDENTIFIER);
    }
    return error("Unexpected character '" + c + "'");
  }

  private Kind single(Kind k, int start) {
    stream.advanceAndGet();
    string = stream.substring(start, stream.position());
    return kind = k;
  }

  private Kind scanNumber(int start) {
    if (stream.get() == '0' && stream.get(1) == 'x') {
      stream.advanceAndGet();
      if (!isHexDigit(stream.advanceAndGet())) {
        return error("Invalid hex number literal");
      }
      while (isHexDigit(stream.get())) {
        stream.advanceAndGet();
      }
    } else {
      while (isDigit(stream.get())) {
        stream.advanceAndGet();
      }
    }
    if (isIdentifierPart(stream.get())) {
      return error("Invalid number literal");
    }
    string = stream.substring(start, stream.position());
    return kind = Kind.NUMBER;
  }

  private Kind scanString(char quote, int start) {
    for (char c = stream.advanceAndGet(); c != quote; c = stream.advanceAndGet()) {
      if (stream.isPastEndOfInput() || c == '\n') {
        return error("Unterminated string literal");
      }
      if (c == '\\') {
        stream.advanceAndGet();
      }
    }
    stream.advanceAndGet();
    string = stream.substring(start, stream.position());
    return kind = Kind.STRING;
  }

  private Kind error(String message) {
    errorMessage = message;
    string = "";
    return kind = Kind.ERROR;
  }

  /** Returns false if an unterminated comment was found. */
  private boolean skipWhitespaceAndComments() {
    while (!stream.isPastEndOfInput()) {
      char c = stream.get();
      if (c == '\n') {
        stream.advanceAndGet();
        lineno++;
        lineStart = stream.position();
      } else if (Character.isWhitespace(c)) {
        stream.advanceAndGet();
      } else if (c == '/' && stream.get(1) == '/') {
        while (!stream.isPastEndOfInput() && stream.get() != '\n') {
          stream.advanceAndGet();
        }
      } else if (c == '/' && stream.get(1) == '*') {
        tokenLineno = lineno;
        tokenCharno = stream.position() - lineStart;
        stream.advanceAndGet();
        stream.advanceAndGet();
        while (!(stream.get() == '*' && stream.get(1) == '/')) {
          if (stream.isPastEndOfInput()) {
            error("Unterminated comment");
            return false;
          }
          if (stream.get() == '\n') {
            lineno++;
            lineStart = stream.position() + 1;
          }
          stream.advanceAndGet();
        }
        stream.advanceAndGet();
        stream.advanceAndGet();
      } else {
        return true;
      }
    }
    return true;
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isHexDigit(char c) {
    return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
  }

  private static boolean isIdentifierStart(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '$';
  }

  private static boolean isIdentifierPart(char c) {
    return isIdentifierStart(c) || isDigit(c) || c == '.';
  }
}
