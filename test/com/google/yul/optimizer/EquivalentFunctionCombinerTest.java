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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class EquivalentFunctionCombinerTest extends YulPassTestCase {

  @Override
  protected CompilerPass getProcessor(OptimizerContext context) {
    return new EquivalentFunctionCombiner();
  }

  @Test
  public void testEquivalentFunctions() {
    test(
        lines(
            "{",
            "  let r := f(1)",
            "  let s := g(2)",
            "  function f(a) -> x { x := add(a, 1) }",
            "  function g(b) -> y { y := add(b, 1) }",
            "}"),
        lines(
            "{",
            "  let r := f(1)",
            "  let s := f(2)",
            "  function f(a) -> x { x := add(a, 1) }",
            "  function g(b) -> y { y := add(b, 1) }",
            "}"));
  }

  @Test
  public void testEquivalentFunctionsWithLocals() {
    test(
        lines(
            "{",
            "  f() g()",
            "  function f() { let t := 1 sstore(t, t) }",
            "  function g() { let u := 1 sstore(u, u) }",
            "}"),
        lines(
            "{",
            "  f() f()",
            "  function f() { let t := 1 sstore(t, t) }",
            "  function g() { let u := 1 sstore(u, u) }",
            "}"));
  }

  @Test
  public void testDifferentBodies() {
    testSame(
        lines(
            "{",
            "  let r := f(1)",
            "  let s := g(2)",
            "  function f(a) -> x { x := add(a, 1) }",
            "  function g(b) -> y { y := sub(b, 1) }",
            "}"));
  }

  @Test
  public void testDifferentLiterals() {
    testSame("{ f() g() function f() { sstore(0, 1) } function g() { sstore(0, 2) } }");
  }

  @Test
  public void testDifferentParameterOrder() {
    testSame(
        lines(
            "{",
            "  let r := f(1, 2)",
            "  let s := g(1, 2)",
            "  function f(a, b) -> x { x := sub(a, b) }",
            "  function g(c, d) -> y { y := sub(d, c) }",
            "}"));
  }

  @Test
  public void testCallsInsideFunctionsAreRedirected() {
    test(
        lines(
            "{",
            "  h()",
            "  function f() { sstore(0, 0) }",
            "  function g() { sstore(0, 0) }",
            "  function h() { g() }",
            "}"),
        lines(
            "{",
            "  h()",
            "  function f() { sstore(0, 0) }",
            "  function g() { sstore(0, 0) }",
            "  function h() { f() }",
            "}"));
  }
}
