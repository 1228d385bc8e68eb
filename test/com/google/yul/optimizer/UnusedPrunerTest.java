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
public final class UnusedPrunerTest extends YulPassTestCase {

  @Override
  protected CompilerPass getProcessor(OptimizerContext context) {
    return new UnusedPruner();
  }

  @Test
  public void testUnusedVariable() {
    test("{ let a := 1 sstore(0, 0) }", "{ sstore(0, 0) }");
    test("{ let a }", "{ }");
  }

  @Test
  public void testUsedVariable() {
    testSame("{ let a := 1 sstore(0, a) }");
  }

  @Test
  public void testRemovalCascades() {
    test("{ let a := 1 let b := a let c := b }", "{ }");
  }

  @Test
  public void testUnusedFunction() {
    test("{ function f() { } sstore(0, 1) }", "{ sstore(0, 1) }");
    test("{ function f() { g() } function g() { } }", "{ }");
  }

  @Test
  public void testSideEffectsAreKept() {
    test(
        "{ function f() -> r { sstore(0, 1) } let a := f() }",
        "{ function f() -> r { sstore(0, 1) } pop(f()) }");
  }

  @Test
  public void testMultiVariableDeclarationWithSideEffects() {
    testSame("{ function f() -> x, y { sstore(0, 1) } let a, b := f() }");
  }

  @Test
  public void testSideEffectFreeExpressionStatement() {
    test("{ pop(add(1, 2)) }", "{ }");
    test("{ pop(mload(0)) }", "{ }");
    testSame("{ pop(call(0, 0, 0, 0, 0, 0, 0)) }");
  }

  @Test
  public void testRecursiveFunctionIsKept() {
    // Only the reference count matters here; see CircularReferencesPruner.
    testSame("{ function f() { f() } }");
  }
}
