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
public final class ForLoopConditionIntoBodyTest extends YulPassTestCase {

  @Override
  protected CompilerPass getProcessor(OptimizerContext context) {
    return new ForLoopConditionIntoBody();
  }

  @Test
  public void testConditionMovesIntoBody() {
    test(
        "{ let c := 1 for { } lt(c, 2) { } { sstore(0, c) } }",
        "{ let c := 1 for { } 1 { } { if iszero(lt(c, 2)) { break } sstore(0, c) } }");
  }

  @Test
  public void testNegatedCondition() {
    test(
        "{ let c := 1 for { } iszero(c) { } { } }",
        "{ let c := 1 for { } 1 { } { if c { break } } }");
  }

  @Test
  public void testLiteralCondition() {
    testSame("{ for { } 1 { } { break } }");
  }
}
