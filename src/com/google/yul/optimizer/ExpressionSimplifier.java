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

import static com.google.yul.optimizer.NodeUtil.WORD_MODULUS;

import com.google.common.collect.ImmutableList;
import com.google.yul.ir.IR;
import com.google.yul.ir.Node;
import com.google.yul.optimizer.NodeTraversal.AbstractPostOrderCallback;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Folds calls of arithmetic built-ins on literals into a literal, computing modulo 2^256 like the
 * EVM, and applies algebraic identities such as {@code add(x, 0) -> x}. An operand is only dropped
 * if evaluating it has no side effects.
 */
class ExpressionSimplifier extends AbstractPostOrderCallback implements CompilerPass {

  private static final BigInteger WORD_MAX = WORD_MODULUS.subtract(BigInteger.ONE);

  @Override
  public void process(Node root) {
    NodeTraversal.traverse(root, this);
  }

  @Override
  public void visit(NodeTraversal t, Node n, Node parent) {
    if (!n.isCall() || Builtins.get(n.getFirstChild().getString()) == null) {
      return;
    }
    Node replacement = fold(n);
    if (replacement == null) {
      replacement = applyIdentities(n);
    }
    if (replacement != null) {
      n.replaceWith(replacement.srcrefTreeIfMissing(n));
    }
  }

  private static @Nullable Node fold(Node call) {
    List<BigInteger> args = new ArrayList<>();
    for (Node arg = call.getSecondChild(); arg != null; arg = arg.getNext()) {
      if (!arg.isLiteral()) {
        return null;
      }
      args.add(NodeUtil.getLiteralValue(arg));
    }
    BigInteger result = evaluate(call.getFirstChild().getString(), args);
    return result == null ? null : IR.number(result);
  }

  /** Evaluates a built-in on word arguments; null for built-ins that are not pure arithmetic. */
  static @Nullable BigInteger evaluate(String builtin, List<BigInteger> args) {
    BigInteger a = args.isEmpty() ? null : args.get(0);
    BigInteger b = args.size() < 2 ? null : args.get(1);
    switch (builtin) {
      case "add":
        return word(a.add(b));
      case "sub":
        return word(a.subtract(b));
      case "mul":
        return word(a.multiply(b));
      case "div":
        return b.signum() == 0 ? BigInteger.ZERO : a.divide(b);
      case "sdiv":
        return b.signum() == 0 ? BigInteger.ZERO : word(signed(a).divide(signed(b)));
      case "mod":
        return b.signum() == 0 ? BigInteger.ZERO : a.mod(b);
      case "smod":
        return b.signum() == 0 ? BigInteger.ZERO : word(signed(a).remainder(signed(b)));
      case "exp":
        return a.modPow(b, WORD_MODULUS);
      case "not":
        return WORD_MAX.xor(a);
      case "lt":
        return bool(a.compareTo(b) < 0);
      case "gt":
        return bool(a.compareTo(b) > 0);
      case "slt":
        return bool(signed(a).compareTo(signed(b)) < 0);
      case "sgt":
        return bool(signed(a).compareTo(signed(b)) > 0);
      case "eq":
        return bool(a.equals(b));
      case "iszero":
        return bool(a.signum() == 0);
      case "and":
        return a.and(b);
      case "or":
        return a.or(b);
      case "xor":
        return a.xor(b);
      case "byte":
        return a.compareTo(BigInteger.valueOf(32)) >= 0
            ? BigInteger.ZERO
            : b.shiftRight(8 * (31 - a.intValueExact())).and(BigInteger.valueOf(0xff));
      case "shl":
        return a.compareTo(BigInteger.valueOf(256)) >= 0
            ? BigInteger.ZERO
            : word(b.shiftLeft(a.intValueExact()));
      case "shr":
        return a.compareTo(BigInteger.valueOf(256)) >= 0
            ? BigInteger.ZERO
            : b.shiftRight(a.intValueExact());
      case "sar":
        {
          int shift = a.compareTo(BigInteger.valueOf(256)) >= 0 ? 256 : a.intValueExact();
          return word(signed(b).shiftRight(shift));
        }
      case "signextend":
        {
          if (a.compareTo(BigInteger.valueOf(31)) >= 0) {
            return b;
          }
          int signBit = a.intValueExact() * 8 + 7;
          BigInteger mask = BigInteger.ONE.shiftLeft(signBit + 1).subtract(BigInteger.ONE);
          return b.testBit(signBit) ? b.or(WORD_MAX.xor(mask)) : b.and(mask);
        }
      case "addmod":
        return args.get(2).signum() == 0 ? BigInteger.ZERO : a.add(b).mod(args.get(2));
      case "mulmod":
        return args.get(2).signum() == 0 ? BigInteger.ZERO : a.multiply(b).mod(args.get(2));
      default:
        return null;
    }
  }

  private static @Nullable Node applyIdentities(Node call) {
    String builtin = call.getFirstChild().getString();
    ImmutableList<Node> args = arguments(call);
    switch (builtin) {
      case "add":
      case "or":
      case "xor":
        if (isValue(args.get(1), 0)) {
          return args.get(0).detach();
        }
        if (isValue(args.get(0), 0)) {
          return args.get(1).detach();
        }
        if (builtin.equals("xor") && isSameVariable(args.get(0), args.get(1))) {
          return IR.number(0);
        }
        return null;
      case "sub":
        if (isValue(args.get(1), 0)) {
          return args.get(0).detach();
        }
        if (isSameVariable(args.get(0), args.get(1))) {
          return IR.number(0);
        }
        return null;
      case "mul":
        if (isValue(args.get(1), 1)) {
          return args.get(0).detach();
        }
        if (isValue(args.get(0), 1)) {
          return args.get(1).detach();
        }
        return isZeroWithRemovableOperand(args) ? IR.number(0) : null;
      case "and":
        return isZeroWithRemovableOperand(args) ? IR.number(0) : null;
      case "div":
      case "sdiv":
        if (isValue(args.get(1), 1)) {
          return args.get(0).detach();
        }
        return isZeroWithRemovableOperand(args) ? IR.number(0) : null;
      case "mod":
      case "smod":
        if (isValue(args.get(1), 0) && NodeUtil.isSideEffectFree(args.get(0))) {
          return IR.number(0);
        }
        return null;
      case "shl":
      case "shr":
      case "sar":
        return isValue(args.get(0), 0) ? args.get(1).detach() : null;
      case "eq":
        return isSameVariable(args.get(0), args.get(1)) ? IR.number(1) : null;
      case "lt":
      case "gt":
        return isSameVariable(args.get(0), args.get(1)) ? IR.number(0) : null;
      case "not":
        return NodeUtil.isCallTo(args.get(0), "not") ? args.get(0).getSecondChild().detach() : null;
      case "iszero":
        {
          Node inner = args.get(0);
          if (NodeUtil.isCallTo(inner, "iszero")
              && NodeUtil.isCallTo(inner.getSecondChild(), "iszero")) {
            return inner.getSecondChild().detach();
          }
          return null;
        }
      default:
        return null;
    }
  }

  /** Whether one of two operands is zero and the other one can be dropped. */
  private static boolean isZeroWithRemovableOperand(ImmutableList<Node> args) {
    return (isValue(args.get(1), 0) && NodeUtil.isSideEffectFree(args.get(0)))
        || (isValue(args.get(0), 0) && NodeUtil.isSideEffectFree(args.get(1)));
  }

  private static ImmutableList<Node> arguments(Node call) {
    ImmutableList.Builder<Node> args = ImmutableList.builder();
    for (Node arg = call.getSecondChild(); arg != null; arg = arg.getNext()) {
      args.add(arg);
    }
    return args.build();
  }

  private static boolean isValue(Node n, long value) {
    return n.isLiteral() && NodeUtil.getLiteralValue(n).equals(BigInteger.valueOf(value));
  }

  private static boolean isSameVariable(Node a, Node b) {
    return a.isName() && b.isName() && a.getString().equals(b.getString());
  }

  private static BigInteger word(BigInteger value) {
    return value.mod(WORD_MODULUS);
  }

  private static BigInteger signed(BigInteger word) {
    return word.testBit(255) ? word.subtract(WORD_MODULUS) : word;
  }

  private static BigInteger bool(boolean value) {
    return value ? BigInteger.ONE : BigInteger.ZERO;
  }
}
