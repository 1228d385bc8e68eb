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

import com.google.common.collect.ImmutableList;
import com.google.yul.ir.Node;
import java.util.Map;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ScopeAnalyzerTest {

  private BasicErrorManager errorManager;

  @Test
  public void testValidPrograms() {
    testValid("{ }");
    testValid("{ let a := 1 let b, c sstore(a, add(b, c)) }");
    testValid("{ f() function f() { } }");
    testValid("{ function f(a) -> r { r := g(a) function g(b) -> s { s := b } } }");
    testValid("{ for { let i := 0 } lt(i, 10) { i := add(i, 1) } { if i { continue } break } }");
    testValid("{ let x := 1 switch x case 0 { } case \"a\" { } default { } }");
    testValid("{ function f() { let c := 1 if c { leave } } }");
    testValid("{ { let x := 1 } { let x := 2 } }");
  }

  @Test
  public void testAssignmentToUndeclaredVariable() {
    testError("{ x := 1 }", "Variable not found or variable not lvalue.");
  }

  @Test
  public void testAssignmentToFunction() {
    testError("{ f := 1 function f() { } }", "Variable not found or variable not lvalue.");
  }

  @Test
  public void testRepeatedAssignmentTarget() {
    testError(
        "{ let a, b function f() -> x, y { } a, a := f() }",
        "Variable a occurs multiple times on the left-hand side of the assignment.");
  }

  @Test
  public void testShadowing() {
    testError(
        "{ let x := 1 { let x := 2 } }", //
        "Variable name x already taken in this scope.");
    testError(
        "{ function f() { } { function f() { } } }",
        "Function name f already taken in this scope.");
  }

  @Test
  public void testVariablesAreNotVisibleInFunctions() {
    testError(
        "{ let x := 1 function f() -> r { r := x } }", //
        "Identifier \"x\" not found.");
  }

  @Test
  public void testFunctionsAreVisibleInNestedFunctions() {
    testValid("{ function f() { g() } function g() { } }");
    testValid("{ function f() { function g() { f() } } }");
  }

  @Test
  public void testVariableUsedBeforeDeclaration() {
    testError("{ let a := b let b := 1 }", "Identifier \"b\" not found.");
  }

  @Test
  public void testBuiltinNames() {
    testError(
        "{ let add := 1 }", //
        "Cannot use builtin function name \"add\" as identifier name.");
    testError("{ let x := add }", "Builtin function \"add\" must be called.");
  }

  @Test
  public void testFunctionUsedAsValue() {
    testError("{ let x := f function f() -> r { } }", "Function \"f\" must be called.");
  }

  @Test
  public void testCalls() {
    testError("{ g() }", "Function \"g\" not found.");
    testError("{ let f := 1 f() }", "Attempt to call variable instead of function.");
    testError("{ let a := add(1) }", "Function \"add\" expects 2 arguments but got 1.");
    testError(
        "{ let a := f(1) function f() -> r { } }", //
        "Function \"f\" expects 0 arguments but got 1.");
  }

  @Test
  public void testValueCounts() {
    testError(
        "{ let a, b := add(1, 2) }",
        "Variable count mismatch for declaration of \"a, b\": 2 variables and 1 values.");
    testError(
        "{ add(1, 2) }",
        "Top-level expressions are not supposed to return values (this expression returns 1"
            + " value). Use ``pop()`` or assign them.");
    testError(
        "{ let a := 0 a := f() function f() { } }",
        "Variable count for assignment to \"a\" does not match number of values (1 vs. 0)");
    testError(
        "{ if f() { } function f() { } }",
        "Expected expression to evaluate to one value, but got 0 values instead.");
    testError(
        "{ sstore(f(), 1) function f() -> a, b { } }",
        "Expected expression to evaluate to one value, but got 2 values instead.");
  }

  @Test
  public void testJumps() {
    testError("{ break }", "Keyword \"break\" needs to be inside a for-loop body.");
    testError("{ continue }", "Keyword \"continue\" needs to be inside a for-loop body.");
    testError(
        "{ for { } 1 { break } { } }", //
        "Keyword \"break\" needs to be inside a for-loop body.");
    testError(
        "{ for { } 1 { } { function f() { break } } }",
        "Keyword \"break\" needs to be inside a for-loop body.");
    testError("{ leave }", "Keyword \"leave\" can only be used inside a function.");
  }

  @Test
  public void testFunctionInForLoopInit() {
    testError(
        "{ for { function f() { } } 1 { } { } }",
        "Functions cannot be defined inside a for-loop init block.");
  }

  @Test
  public void testDuplicateCase() {
    testError(
        "{ let x := 1 switch x case 1 { } case 0x1 { } }", //
        "Duplicate case \"0x1\" defined.");
    testError(
        "{ let x := 1 switch x case true { } case 1 { } }", //
        "Duplicate case \"1\" defined.");
  }

  @Test
  public void testLiteralLimits() {
    testValid("{ let x := 0x" + "f".repeat(64) + " }");
    testError("{ let x := 0x1" + "0".repeat(64) + " }", "Number literal too large (> 256 bits)");
    testValid("{ let s := \"" + "a".repeat(32) + "\" }");
    testError("{ let s := \"" + "a".repeat(33) + "\" }", "String literal too long (33 > 32)");
  }

  @Test
  public void testAllErrorsAreReported() {
    assertThat(analyze("{ x := 1 y := 2 }")).hasSize(2);
  }

  @Test
  public void testErrorLocation() {
    ImmutableList<YulError> errors = analyze("{\n  let a := 1\n  b := a\n}");
    assertThat(errors).hasSize(1);
    YulError error = errors.get(0);
    assertThat(error.type()).isEqualTo(ScopeAnalyzer.DECLARATION_ERROR);
    assertThat(error.lineno()).isEqualTo(3);
    assertThat(error.charno()).isEqualTo(2);
    assertThat(error.format(CheckLevel.ERROR))
        .isEqualTo("input:3:2: ERROR - Variable not found or variable not lvalue.");
  }

  @Test
  public void testSwitchWithOnlyDefaultIsAWarning() {
    assertThat(analyze("{ let x := 1 switch x default { sstore(x, 1) } }")).isEmpty();
    assertThat(errorManager.getWarnings()).hasSize(1);
    assertThat(errorManager.getWarnings().get(0).toString())
        .isEqualTo(
            "YUL_SWITCH_WITH_ONLY_DEFAULT. input:1:13: WARNING - \"switch\" statement with only"
                + " a default case.");

    analyze("{ let x := 1 switch x case 0 { } default { } }");
    assertThat(errorManager.getWarnings()).isEmpty();
  }

  @Test
  public void testWarningsDoNotFailAnalysis() {
    Node root = YulPassTestCase.parse("{ switch 1 default { } }");
    BasicErrorManager errors = new PrintStreamErrorManager(System.err);
    assertThat(new ScopeAnalyzer(errors, "input").analyze(root)).isTrue();
    assertThat(errors.getWarningCount()).isEqualTo(1);
  }

  @Test
  public void testReferences() {
    Node root =
        YulPassTestCase.parse("{ let a := 1 sstore(a, f(a)) function f(p) -> r { r := p } }");
    ScopeAnalyzer analyzer = new ScopeAnalyzer(new PrintStreamErrorManager(System.err), "input");
    assertThat(analyzer.analyze(root)).isTrue();
    Map<Node, Node> references = analyzer.getReferences();

    Node declaration = root.getFirstChild().getFirstChild();
    Node call = root.getSecondChild().getFirstChild();
    Node function = root.getLastChild();
    assertThat(references.get(call.getSecondChild())).isSameInstanceAs(declaration);
    Node innerCall = call.getLastChild();
    assertThat(references.get(innerCall.getFirstChild()))
        .isSameInstanceAs(function.getFirstChild());
    assertThat(references.get(innerCall.getSecondChild())).isSameInstanceAs(declaration);

    Node assign = NodeUtil.getFunctionBody(function).getFirstChild();
    assertThat(references.get(assign.getFirstChild()))
        .isSameInstanceAs(function.getChildAtIndex(2).getFirstChild());
    assertThat(references.get(assign.getLastChild()))
        .isSameInstanceAs(function.getSecondChild().getFirstChild());
    // Builtin call targets have no declaration.
    assertThat(references).doesNotContainKey(call.getFirstChild());
  }

  private ImmutableList<YulError> analyze(String source) {
    errorManager = new PrintStreamErrorManager(System.err);
    new ScopeAnalyzer(errorManager, "input").analyze(YulPassTestCase.parse(source));
    return errorManager.getErrors();
  }

  private void testValid(String source) {
    assertThat(analyze(source)).isEmpty();
  }

  private void testError(String source, String description) {
    ImmutableList<YulError> errors = analyze(source);
    assertThat(errors).isNotEmpty();
    assertThat(errors.get(0).description()).isEqualTo(description);
  }
}
