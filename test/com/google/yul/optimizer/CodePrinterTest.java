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

import com.google.yul.ir.IR;
import com.google.yul.ir.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CodePrinterTest {

  @Test
  public void testCompact() {
    assertCompact("{ }");
    assertCompact("{ let a := 1 let b, c sstore(a, add(b, c)) }");
    assertCompact("{ let a := 1 a := 2 }");
    assertCompact("{ function f(a, b) -> x, y { x := a y := b } }");
    assertCompact("{ function f() { leave } }");
    assertCompact("{ let x := 1 switch x case 0 { } case \"a\" { pop(x) } default { } }");
    assertCompact("{ for { let i := 0 } lt(i, 0x10) { i := add(i, 1) } { continue break } }");
    assertCompact("{ if true { pop(false) } }");
  }

  @Test
  public void testCompactNormalizesWhitespace() {
    assertThat(compact("{let a:=1\n\n  if a{sstore(a,a)}}"))
        .isEqualTo("{ let a := 1 if a { sstore(a, a) } }");
  }

  @Test
  public void testPretty() {
    assertThat(pretty("{ let a := 1 if a { sstore(a, a) } }"))
        .isEqualTo(
            YulPassTestCase.lines(
                "{",
                "    let a := 1",
                "    if a",
                "    {",
                "        sstore(a, a)",
                "    }",
                "}"));
  }

  @Test
  public void testPrettyFunctionAndSwitch() {
    assertThat(pretty("{ function f(a) -> r { switch a case 0 { r := 1 } default { } } }"))
        .isEqualTo(
            YulPassTestCase.lines(
                "{",
                "    function f(a) -> r",
                "    {",
                "        switch a",
                "        case 0 {",
                "            r := 1",
                "        }",
                "        default { }",
                "    }",
                "}"));
  }

  @Test
  public void testPrettyOutputParses() {
    String source =
        "{ let x := 1 for { } lt(x, 3) { x := add(x, 1) } { if x { break } } function g() { } }";
    assertThat(compact(pretty(source))).isEqualTo(compact(source));
  }

  @Test
  public void testExpression() {
    Node call = IR.call("add", IR.name("a"), IR.number(2));
    assertThat(new CodePrinter.Builder(call).build()).isEqualTo("add(a, 2)");
  }

  private static void assertCompact(String source) {
    assertThat(compact(source)).isEqualTo(source);
  }

  private static String compact(String source) {
    return YulPassTestCase.print(YulPassTestCase.parse(source));
  }

  private static String pretty(String source) {
    return new CodePrinter.Builder(YulPassTestCase.parse(source)).setPrettyPrint(true).build();
  }
}
