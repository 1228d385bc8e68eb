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
public final class ForLoopInitRewriterTest extends YulPassTestCase {

  @Override
  protected CompilerPass getProcessor(OptimizerContext context) {
    return new ForLoopInitRewriter();
  }

  @Test
  public void testInitMovesBeforeLoop() {
    test(
        "{ for { let i := 0 } lt(i, 10) { i := add(i, 1) } { sstore(i, i) } }",
        "{ let i := 0 for { } lt(i, 10) { i := add(i, 1) } { sstore(i, i) } }");
  }

  @Test
  public void testPrecedingStatementsStay() {
    test(
        "{ let a := 1 for { let i := a let j := i } lt(i, j) { } { } sstore(a, a) }",
        "{ let a := 1 let i := a let j := i for { } lt(i, j) { } { } sstore(a, a) }");
  }

  @Test
  public void testNestedLoops() {
    test(
        lines(
            "{",
            "  for { let i := 0 } lt(i, 2) { i := add(i, 1) } {",
            "    for { let j := 0 } lt(j, 2) { j := add(j, 1) } { sstore(i, j) }",
            "  }",
            "}"),
        lines(
            "{",
            "  let i := 0",
            "  for { } lt(i, 2) { i := add(i, 1) } {",
            "    let j := 0",
            "    for { } lt(j, 2) { j := add(j, 1) } { sstore(i, j) }",
            "  }",
            "}"));
  }

  @Test
  public void testEmptyInit() {
    testSame("{ for { } 1 { } { break } }");
  }
}
