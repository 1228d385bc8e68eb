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

/**
 * The kinds of nodes that make up a Yul tree. The set is closed: every pass switches over it.
 *
 * <p>Shapes:
 *
 * <pre>
 * BLOCK        statement*
 * FUNCTION     NAME PARAM_LIST RETURN_LIST BLOCK
 * PARAM_LIST   NAME*
 * RETURN_LIST  NAME*
 * LET          NAME+ (expression | EMPTY)
 * ASSIGN       NAME+ expression
 * EXPR_RESULT  CALL
 * IF           expression BLOCK
 * SWITCH       expression CASE* DEFAULT_CASE?
 * CASE         literal BLOCK
 * DEFAULT_CASE BLOCK
 * FOR          BLOCK(init) expression BLOCK(post) BLOCK(body)
 * CALL         NAME expression*
 * </pre>
 */
public enum Token {
  BLOCK,
  FUNCTION,
  PARAM_LIST,
  RETURN_LIST,
  LET, // variable declaration
  ASSIGN, // := with one or more targets
  EXPR_RESULT, // expression statement
  IF,
  SWITCH,
  CASE,
  DEFAULT_CASE,
  FOR,
  BREAK,
  CONTINUE,
  LEAVE,

  CALL,
  NAME,
  NUMBER,
  STRING,
  TRUE,
  FALSE,

  EMPTY; // absent initial value of a LET

  /** Whether nodes of this kind may appear directly inside a {@link #BLOCK}. */
  public boolean isStatement() {
    switch (this) {
      case BLOCK:
      case FUNCTION:
      case LET:
      case ASSIGN:
      case EXPR_RESULT:
      case IF:
      case SWITCH:
      case FOR:
      case BREAK:
      case CONTINUE:
      case LEAVE:
        return true;
      default:
        return false;
    }
  }

  /** Whether nodes of this kind may be used as a value. */
  public boolean isExpression() {
    switch (this) {
      case CALL:
      case NAME:
      case NUMBER:
      case STRING:
      case TRUE:
      case FALSE:
        return true;
      default:
        return false;
    }
  }

  public boolean isLiteral() {
    return this == NUMBER || this == STRING || this == TRUE || this == FALSE;
  }
}
