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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonParser;
import com.google.yul.ir.CharStream;
import com.google.yul.ir.Node;
import com.google.yul.ir.Token;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ProgramTest {

  @Test
  public void testLoadRewindsTheStream() throws Exception {
    CharStream source = new CharStream("{\n    let x := 1\n    let y := 2\n}\n", "test");
    source.setPosition(5);

    Program program = Program.load(source);

    assertThat(CodeSize.codeSize(program.getAst())).isEqualTo(2);
  }

  @Test
  public void testLoadDisambiguates() throws Exception {
    Program program = load("{ { let x := 1 } { let x := 2 } }");

    Node parent = skipRedundantBlocks(program.getAst());
    assertThat(parent.getChildCount()).isEqualTo(2);
    Node declaration1 = parent.getFirstChild().getFirstChild();
    Node declaration2 = parent.getSecondChild().getFirstChild();
    assertThat(declaration1.getFirstChild().getString()).isEqualTo("x");
    assertThat(declaration2.getFirstChild().getString()).isNotEqualTo("x");
  }

  @Test
  public void testLoadGroupsAndHoistsFunctions() throws Exception {
    Program program =
        load(
            YulPassTestCase.lines(
                "{",
                "    function foo() -> result",
                "    {",
                "        result := 1",
                "    }",
                "    let x := 1",
                "    function bar(a) -> result",
                "    {",
                "        result := 2",
                "    }",
                "    let y := 2",
                "}"));

    Node root = program.getAst();
    assertThat(root.getChildCount()).isEqualTo(3);
    assertThat(root.getFirstChild().getToken()).isEqualTo(Token.BLOCK);
    assertThat(root.getSecondChild().getToken()).isEqualTo(Token.FUNCTION);
    assertThat(root.getLastChild().getToken()).isEqualTo(Token.FUNCTION);
    assertThat(root.getSecondChild().getFirstChild().getString()).isEqualTo("foo");
  }

  @Test
  public void testLoadRewritesForLoopInit() throws Exception {
    Program program = load("{ for { let i := 0 } true {} {} }");

    Node parent = skipRedundantBlocks(program.getAst());
    assertThat(parent.getFirstChild().getToken()).isEqualTo(Token.LET);
    assertThat(parent.getSecondChild().getToken()).isEqualTo(Token.FOR);
    assertThat(parent.getSecondChild().getFirstChild().hasChildren()).isFalse();
  }

  @Test
  public void testLoadFailsOnParseError() {
    InvalidProgramException e =
        assertThrows(InvalidProgramException.class, () -> load("invalid program\n"));
    assertThat(e.getErrors()).hasSize(1);
    assertThat(e.getErrors().get(0).type()).isEqualTo(Program.PARSE_ERROR);
  }

  @Test
  public void testLoadFailsOnAnalysisError() {
    // Parses fine but x is never declared.
    InvalidProgramException e =
        assertThrows(InvalidProgramException.class, () -> load("{\n    x := 1\n}\n"));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("test:2:4: ERROR - Variable not found or variable not lvalue.");
  }

  @Test
  public void testLoadReportsToErrorManager() {
    BasicErrorManager errorManager = new PrintStreamErrorManager(System.err);
    assertThrows(
        InvalidProgramException.class,
        () -> Program.load(new CharStream("{ x := 1 y := 2 }", "test"), errorManager));
    assertThat(errorManager.getErrorCount()).isEqualTo(2);
  }

  @Test
  public void testOptimise() throws Exception {
    Program program = load("{ { if 1 { let x := 1 } if 0 { let y := 2 } } }");

    Node before = skipRedundantBlocks(program.getAst());
    assertThat(before.getChildCount()).isEqualTo(2);
    assertThat(before.getFirstChild().getToken()).isEqualTo(Token.IF);

    program.optimise(
        ImmutableList.of(PassNames.STRUCTURAL_SIMPLIFIER, PassNames.BLOCK_FLATTENER));

    Node after = program.getAst();
    assertThat(after.getChildCount()).isEqualTo(1);
    assertThat(after.getFirstChild().getToken()).isEqualTo(Token.LET);
  }

  @Test
  public void testOptimiseWithAbbreviations() throws Exception {
    Program program = load("{ { if 1 { let x := 1 } if 0 { let y := 2 } } }");
    program.optimise("tf");
    assertThat(stripWhitespace(program.toString())).isEqualTo("{letx:=1}");
  }

  @Test
  public void testEmptySequenceLeavesProgramUnchanged() throws Exception {
    Program program = load("{ let a := add(1, 2) function f() { } }");
    String before = program.toString();
    program.optimise("");
    program.optimise(ImmutableList.of());
    assertThat(program.toString()).isEqualTo(before);
  }

  @Test
  public void testUnknownStepLeavesProgramUnchanged() throws Exception {
    Program program = load("{ { if 1 { let x := 1 } } }");
    String before = program.toString();
    assertThrows(
        UnknownStepException.class,
        () -> program.optimise(ImmutableList.of(PassNames.BLOCK_FLATTENER, "Inliner")));
    assertThrows(UnknownStepException.class, () -> program.optimise("fZ"));
    assertThat(program.toString()).isEqualTo(before);
  }

  @Test
  public void testToString() throws Exception {
    String source =
        YulPassTestCase.lines(
            "{",
            "    let factor := 13",
            "    {",
            "        if factor",
            "        {",
            "            let variable := add(1, 2)",
            "        }",
            "        let result := factor",
            "    }",
            "    let something := 6",
            "    let something_else := mul(something, factor)",
            "}");
    Program program = load(source);

    assertThat(stripWhitespace(program.toString())).isEqualTo(stripWhitespace("{" + source + "}"));
  }

  @Test
  public void testToStringParsesBack() throws Exception {
    Program program =
        load("{ let a := 1 for { } lt(a, 3) { a := add(a, 1) } { } function f(x) -> y { } }");
    Program reloaded = Program.load(new CharStream(program.toString(), "reloaded"));
    assertThat(reloaded.toString()).isEqualTo(program.toString());
  }

  @Test
  public void testToJson() throws Exception {
    Program program = load("{ let a := 3 if a { let abc := add(1, 2) } }");
    assertThat(JsonParser.parseString(program.toJson()).isJsonObject()).isTrue();
  }

  @Test
  public void testCodeSize() throws Exception {
    Program program = load("{ function foo() -> result { result := 15 } let a := 1 }");
    assertThat(program.codeSize())
        .isEqualTo(CodeSize.codeSizeIncludingFunctions(program.getAst()));
    assertThat(program.codeSize(false)).isEqualTo(1);
    assertThat(program.codeSize(true)).isEqualTo(3);
  }

  @Test
  public void testCodeSizeIgnoresFormatting() throws Exception {
    Program compact = load("{let a:=add(1,2) if a{sstore(a,a)}}");
    Program spread =
        load(
            YulPassTestCase.lines(
                "{", //
                "  let a := add(1, 2)",
                "  // check",
                "  if a",
                "  {",
                "    sstore(a, a)",
                "  }",
                "}"));
    assertThat(spread.codeSize()).isEqualTo(compact.codeSize());
  }

  @Test
  public void testFlatteningDoesNotIncreaseSize() throws Exception {
    Program program = load("{ { let a := 1 { let b := a } } function f() { { sstore(0, 0) } } }");
    int before = program.codeSize();
    program.optimise(ImmutableList.of(PassNames.BLOCK_FLATTENER));
    assertThat(program.codeSize()).isAtMost(before);
  }

  @Test
  public void testCloneIsIndependent() throws Exception {
    Program program = load("{ { if 1 { let x := 1 } } }");
    Program clone = program.cloneProgram();
    clone.optimise("tf");
    assertThat(stripWhitespace(clone.toString())).isEqualTo("{letx:=1}");
    assertThat(stripWhitespace(program.toString())).isEqualTo("{{if1{letx:=1}}}");
    assertThat(clone.getSourceName()).isEqualTo(program.getSourceName());
  }

  @Test
  public void testFullSequenceKeepsProgramValid() throws Exception {
    Program program =
        load(
            YulPassTestCase.lines(
                "{",
                "  let a := calldataload(0)",
                "  let b := add(a, mul(2, 3))",
                "  for { let i := 0 } lt(i, b) { i := add(i, 1) } {",
                "    if eq(i, 5) { continue }",
                "    sstore(i, f(a))",
                "  }",
                "  switch a",
                "  case 0 { sstore(0, g(1)) }",
                "  default { }",
                "  function f(x) -> y { y := add(x, 0) }",
                "  function g(x) -> y { y := add(x, 0) }",
                "  function unused() { unused() }",
                "}"));
    program.setValidityCheck(true);
    int before = program.codeSize();

    program.optimise("dhfoDgvIfn[xsjtu]lO[Dntu]");

    assertThat(program.codeSize()).isLessThan(before);
    Program.load(new CharStream(program.toString(), "optimized"));
  }

  private static Program load(String source) throws InvalidProgramException {
    return Program.load(new CharStream(source, "test"));
  }

  /** Descends into blocks that contain nothing but another block. */
  private static Node skipRedundantBlocks(Node block) {
    if (block.hasOneChild() && block.getFirstChild().isBlock()) {
      return skipRedundantBlocks(block.getFirstChild());
    }
    return block;
  }

  private static String stripWhitespace(String s) {
    return s.replaceAll("\\s+", "");
  }
}
