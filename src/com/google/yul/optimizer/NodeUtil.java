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
import static com.google.common.base.Preconditions.checkState;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.yul.ir.Node;
import com.google.yul.optimizer.Builtins.BuiltinFunction;
import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/** NodeUtil contains generally useful AST utilities. */
public final class NodeUtil {

  /** Values are 256 bit words. */
  public static final BigInteger WORD_MODULUS = BigInteger.ONE.shiftLeft(256);

  public static final int MAX_STRING_BYTES = 32;

  private NodeUtil() {}

  // Literals

  /** The numeric value of a literal. Strings are left-aligned in a 32 byte word. */
  public static BigInteger getLiteralValue(Node literal) {
    switch (literal.getToken()) {
      case NUMBER:
        return parseNumber(literal.getString());
      case STRING:
        {
          byte[] bytes = getStringBytes(literal);
          checkState(bytes.length <= MAX_STRING_BYTES, "String too long: %s", literal);
          byte[] word = new byte[MAX_STRING_BYTES];
          System.arraycopy(bytes, 0, word, 0, bytes.length);
          return new BigInteger(1, word);
        }
      case TRUE:
        return BigInteger.ONE;
      case FALSE:
        return BigInteger.ZERO;
      default:
        throw new IllegalStateException("Not a literal: " + literal);
    }
  }

  public static BigInteger parseNumber(String spelling) {
    if (spelling.startsWith("0x")) {
      return new BigInteger(spelling.substring(2), 16);
    }
    return new BigInteger(spelling);
  }

  /** Decodes the escapes of a string literal. The spelling includes the quotes. */
  public static byte[] getStringBytes(Node string) {
    checkArgument(string.isString(), string);
    String spelling = string.getString();
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    for (int i = 1; i < spelling.length() - 1; i++) {
      char c = spelling.charAt(i);
      if (c != '\\') {
        out.writeBytes(String.valueOf(c).getBytes(UTF_8));
        continue;
      }
      char escaped = spelling.charAt(++i);
      switch (escaped) {
        case 'n':
          out.write('\n');
          break;
        case 'r':
          out.write('\r');
          break;
        case 't':
          out.write('\t');
          break;
        case 'x':
          out.write(Integer.parseInt(spelling.substring(i + 1, i + 3), 16));
          i += 2;
          break;
        case 'u':
          out.writeBytes(
              String.valueOf((char) Integer.parseInt(spelling.substring(i + 1, i + 5), 16))
                  .getBytes(UTF_8));
          i += 4;
          break;
        default:
          out.write(escaped);
          break;
      }
    }
    return out.toByteArray();
  }

  // Side effects

  /** Whether evaluating {@code n} can be skipped when its value is unused. */
  public static boolean isSideEffectFree(Node n) {
    if (!n.isCall()) {
      return true;
    }
    BuiltinFunction builtin = Builtins.get(n.getFirstChild().getString());
    if (builtin == null || !builtin.sideEffectFree()) {
      return false;
    }
    for (Node arg = n.getSecondChild(); arg != null; arg = arg.getNext()) {
      if (!isSideEffectFree(arg)) {
        return false;
      }
    }
    return true;
  }

  /** Whether {@code n} may be evaluated at a different point without changing its value. */
  public static boolean isMovable(Node n) {
    if (!n.isCall()) {
      return true;
    }
    BuiltinFunction builtin = Builtins.get(n.getFirstChild().getString());
    if (builtin == null || !builtin.movable()) {
      return false;
    }
    for (Node arg = n.getSecondChild(); arg != null; arg = arg.getNext()) {
      if (!isMovable(arg)) {
        return false;
      }
    }
    return true;
  }

  /** Whether control never reaches the statement following {@code statement}. */
  public static boolean isTerminatingStatement(Node statement) {
    switch (statement.getToken()) {
      case BREAK:
      case CONTINUE:
      case LEAVE:
        return true;
      case EXPR_RESULT:
        {
          BuiltinFunction builtin =
              Builtins.get(statement.getFirstChild().getFirstChild().getString());
          return builtin != null && builtin.terminating();
        }
      default:
        return false;
    }
  }

  // Declarations

  /** The NAME nodes declared by a LET. */
  public static ImmutableList<Node> getDeclaredNames(Node let) {
    checkArgument(let.isLet(), let);
    ImmutableList.Builder<Node> names = ImmutableList.builder();
    for (Node n = let.getFirstChild(); n != let.getLastChild(); n = n.getNext()) {
      names.add(n);
    }
    return names.build();
  }

  /** The initial value of a LET, or null if the variables start out as zero. */
  public static @Nullable Node getLetValue(Node let) {
    checkArgument(let.isLet(), let);
    Node value = let.getLastChild();
    return value.isEmpty() ? null : value;
  }

  /** The value assigned by an ASSIGN. */
  public static Node getAssignedValue(Node assign) {
    checkArgument(assign.isAssign(), assign);
    return assign.getLastChild();
  }

  public static Node getFunctionBody(Node function) {
    checkArgument(function.isFunction(), function);
    return function.getLastChild();
  }

  public static boolean isCallTo(Node n, String name) {
    return n.isCall() && n.getFirstChild().getString().equals(name);
  }

  /** Whether {@code name} declares a variable or function rather than referencing one. */
  public static boolean isDeclarationName(Node name) {
    checkArgument(name.isName(), name);
    Node parent = name.getParent();
    if (parent == null) {
      return false;
    }
    switch (parent.getToken()) {
      case PARAM_LIST:
      case RETURN_LIST:
        return true;
      case FUNCTION:
        return parent.getFirstChild() == name;
      case LET:
        return parent.getLastChild() != name;
      default:
        return false;
    }
  }

  /** Counts the references to each name below {@code root}, call targets included. */
  public static Map<String, Integer> countReferences(Node root) {
    Map<String, Integer> counts = new HashMap<>();
    countReferences(root, counts);
    return counts;
  }

  private static void countReferences(Node n, Map<String, Integer> counts) {
    if (n.isName() && !isDeclarationName(n)) {
      counts.merge(n.getString(), 1, Integer::sum);
    }
    for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
      countReferences(child, counts);
    }
  }

  /** All identifier spellings used below {@code root}. */
  public static Set<String> collectNames(Node root) {
    Set<String> names = new HashSet<>();
    collectNames(root, names);
    return names;
  }

  private static void collectNames(Node n, Set<String> names) {
    if (n.isName()) {
      names.add(n.getString());
    }
    for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
      collectNames(child, names);
    }
  }
}
