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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ExpressionSimplifierTest extends YulPassTestCase {

  private static final String MAX_WORD = "0x" + Strings.repeat("f", 64);

  @Override
  protected CompilerPass getProcessor(OptimizerContext context) {
    return new ExpressionSimplifier();
  }

  @Test
  public void testFoldArithmetic() {
    test("{ let a := add(1, 2) }", "{ let a := 3 }");
    test("{ let a := mul(add(1, 2), 4) }", "{ let a := 12 }");
    test("{ let a := sub(0, 1) }", "{ let a := " + MAX_WORD + " }");
    test("{ let a := add(" + MAX_WORD + ", 2) }", "{ let a := 1 }");
  }

  @Test
  public void testFoldDivisionByZero() {
    test("{ let a := div(7, 0) let b := mod(7, 0) }", "{ let a := 0 let b := 0 }");
  }

  @Test
  public void testFoldComparisons() {
    test("{ let a := lt(1, 2) let b := gt(1, 2) }", "{ let a := 1 let b := 0 }");
    test("{ let a := slt(" + MAX_WORD + ", 0) }", "{ let a := 1 }");
    test("{ let a := iszero(true) }", "{ let a := 0 }");
  }

  @Test
  public void testNonLiteralArgumentsAreNotFolded() {
    testSame("{ let x := mload(0) let a := add(x, 1) }");
  }

  @Test
  public void testStatefulBuiltinsAreNotFolded() {
    testSame("{ let a := mload(0) }");
  }

  @Test
  public void testNeutralOperands() {
    test("{ let x := mload(0) let a := add(x, 0) }", "{ let x := mload(0) let a := x }");
    test("{ let x := mload(0) let a := add(0, x) }", "{ let x := mload(0) let a := x }");
    test("{ let x := mload(0) let a := mul(1, x) }", "{ let x := mload(0) let a := x }");
    test("{ let x := mload(0) let a := div(x, 1) }", "{ let x := mload(0) let a := x }");
    test("{ let x := mload(0) let a := shl(0, x) }", "{ let x := mload(0) let a := x }");
  }

  @Test
  public void testAbsorbingOperands() {
    test("{ let a := mul(mload(0), 0) }", "{ let a := 0 }");
    test("{ let a := and(0, calldataload(4)) }", "{ let a := 0 }");
  }

  @Test
  public void testSideEffectsAreNotDropped() {
    testSame("{ let a := mul(f(), 0) function f() -> r { sstore(0, 1) } }");
  }

  @Test
  public void testSameVariable() {
    test("{ let x := mload(0) let a := sub(x, x) }", "{ let x := mload(0) let a := 0 }");
    test("{ let x := mload(0) let a := eq(x, x) }", "{ let x := mload(0) let a := 1 }");
    test("{ let x := mload(0) let a := lt(x, x) }", "{ let x := mload(0) let a := 0 }");
  }

  @Test
  public void testDoubleNegation() {
    test("{ let x := mload(0) let a := not(not(x)) }", "{ let x := mload(0) let a := x }");
    test(
        "{ let x := mload(0) let a := iszero(iszero(iszero(x))) }",
        "{ let x := mload(0) let a := iszero(x) }");
  }

  @Test
  public void testUserFunctionsAreIgnored() {
    testSame("{ let a := f(1, 0) function f(p, q) -> r { r := add(p, q) } }");
  }

  @Test
  public void testEvaluate() {
    BigInteger max = NodeUtil.WORD_MODULUS.subtract(BigInteger.ONE);
    assertThat(evaluate("exp", 2, 256)).isEqualTo(BigInteger.ZERO);
    assertThat(evaluate("exp", 2, 10)).isEqualTo(BigInteger.valueOf(1024));
    assertThat(evaluate("shl", 1, 1)).isEqualTo(BigInteger.TWO);
    assertThat(evaluate("shr", 256, 1)).isEqualTo(BigInteger.ZERO);
    assertThat(evaluate("byte", 31, 0x1234)).isEqualTo(BigInteger.valueOf(0x34));
    assertThat(evaluate("byte", 32, 0x1234)).isEqualTo(BigInteger.ZERO);
    assertThat(evaluate("not", 0)).isEqualTo(max);
    assertThat(evaluate("addmod", 5, 6, 7)).isEqualTo(BigInteger.valueOf(4));
    assertThat(evaluate("mulmod", 5, 6, 0)).isEqualTo(BigInteger.ZERO);
    assertThat(ExpressionSimplifier.evaluate("sar", ImmutableList.of(BigInteger.ONE, max)))
        .isEqualTo(max);
    assertThat(ExpressionSimplifier.evaluate("sdiv", ImmutableList.of(max, BigInteger.ONE)))
        .isEqualTo(max);
    assertThat(evaluate("signextend", 0, 0xff)).isEqualTo(max);
    assertThat(evaluate("signextend", 0, 0x7f)).isEqualTo(BigInteger.valueOf(0x7f));
    assertThat(ExpressionSimplifier.evaluate("gas", ImmutableList.of())).isNull();
  }

  private static BigInteger evaluate(String builtin, long... args) {
    ImmutableList.Builder<BigInteger> values = ImmutableList.builder();
    for (long arg : args) {
      values.add(BigInteger.valueOf(arg));
    }
    return ExpressionSimplifier.evaluate(builtin, values.build());
  }
}
