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
public final class ControlFlowSimplifierTest extends YulPassTestCase {

  @Override
  protected CompilerPass getProcessor(OptimizerContext context) {
    return new ControlFlowSimplifier();
  }

  @Test
  public void testEmptyIfWithMovableCondition() {
    test("{ let c := 1 if c { } }", "{ let c := 1 }");
    test("{ if lt(1, 2) { } }", "{ }");
  }

  @Test
  public void testEmptyIfWithSideEffects() {
    test(
        "{ if f() { } function f() -> r { sstore(0, 0) } }",
        "{ pop(f()) function f() -> r { sstore(0, 0) } }");
    test("{ if sload(0) { } }", "{ pop(sload(0)) }");
  }

  @Test
  public void testSingleCaseSwitch() {
    test(
        "{ let x := 1 switch x case 0 { sstore(0, 1) } }",
        "{ let x := 1 if eq(0, x) { sstore(0, 1) } }");
  }

  @Test
  public void testEmptyDefaultIsRemoved() {
    test(
        "{ let x := 1 switch x case 0 { sstore(0, 1) } case 1 { sstore(1, 1) } default { } }",
        "{ let x := 1 switch x case 0 { sstore(0, 1) } case 1 { sstore(1, 1) } }");
  }

  @Test
  public void testEmptyCasesWithDefaultAreKept() {
    testSame("{ let x := 1 switch x case 0 { } case 1 { } default { sstore(0, 1) } }");
  }

  @Test
  public void testEmptyCasesWithoutDefault() {
    test("{ let x := 1 switch x case 0 { } case 1 { } }", "{ let x := 1 }");
    test(
        "{ let x := 1 switch x case 0 { } case 1 { sstore(0, 1) } case 2 { } }",
        "{ let x := 1 if eq(1, x) { sstore(0, 1) } }");
  }

  @Test
  public void testDefaultOnlySwitch() {
    test(
        "{ let x := 1 switch x default { sstore(0, 1) } }",
        "{ let x := 1 { pop(x) sstore(0, 1) } }");
  }

  @Test
  public void testForEndingInBreak() {
    test(
        "{ let c := 1 for { } c { } { sstore(0, 1) break } }",
        "{ let c := 1 if c { sstore(0, 1) } }");
  }

  @Test
  public void testForWithOtherBreak() {
    testSame("{ let c := 1 for { } c { } { if c { break } sstore(0, 1) break } }");
    testSame("{ let c := 1 for { } c { } { if c { continue } sstore(0, 1) break } }");
  }

  @Test
  public void testBreakOfNestedLoopDoesNotCount() {
    test(
        "{ let c := 1 for { } c { } { for { } c { } { break } break } }",
        "{ let c := 1 if c { if c { } } }");
  }

  @Test
  public void testForWithoutTrailingBreak() {
    testSame("{ let c := 1 for { } c { } { sstore(0, 1) } }");
  }

  @Test
  public void testTrailingLeave() {
    test(
        "{ function f() { sstore(0, 1) leave } }", //
        "{ function f() { sstore(0, 1) } }");
    testSame("{ function f() { let c := 1 if c { leave } sstore(0, 1) } }");
  }
}
