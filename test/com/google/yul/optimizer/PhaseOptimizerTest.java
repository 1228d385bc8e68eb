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

import com.google.yul.ir.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class PhaseOptimizerTest {

  private int validityChecks = 0;

  @Test
  public void testStepsRunInOrder() {
    Node root = run("{ { if 1 { let x := 1 } if 0 { let y := 2 } } }", "tf");
    assertThat(YulPassTestCase.print(root)).isEqualTo("{ let x := 1 }");
  }

  @Test
  public void testOrderMatters() {
    // Flattening first leaves the block produced by the if behind.
    Node root = run("{ { if 1 { let x := 1 } } }", "ft");
    assertThat(YulPassTestCase.print(root)).isEqualTo("{ { let x := 1 } }");
  }

  @Test
  public void testEmptySequence() {
    Node root = run("{ { let x := 1 } }", "");
    assertThat(YulPassTestCase.print(root)).isEqualTo("{ { let x := 1 } }");
    assertThat(validityChecks).isEqualTo(0);
  }

  @Test
  public void testGroupStopsWhenStable() {
    run("{ let x := 1 }", "[f]");
    assertThat(validityChecks).isEqualTo(1);
  }

  @Test
  public void testGroupRepeatsWhileSizeChanges() {
    Node root = run("{ let a := 1 if 1 { let b := a } }", "[tu]");
    assertThat(YulPassTestCase.print(root)).isEqualTo("{ { } }");
    // The first round changes the size, the second one does not.
    assertThat(validityChecks).isEqualTo(4);
  }

  @Test
  public void testValidityCheckFailure() {
    Node root = YulPassTestCase.parse("{ if 1 { } }");
    PhaseOptimizer optimizer = new PhaseOptimizer(OptimizerContext.forRoot(root));
    optimizer.setValidityCheck(
        (n) -> {
          throw new IllegalStateException("broken");
        });
    IllegalStateException e =
        assertThrows(
            IllegalStateException.class,
            () -> optimizer.process(StepSequence.parse("t"), root));
    assertThat(e).hasMessageThat().isEqualTo("Validity check failed for StructuralSimplifier");
    assertThat(e).hasCauseThat().hasMessageThat().isEqualTo("broken");
  }

  private Node run(String source, String sequence) {
    Node root = YulPassTestCase.parse(source);
    PhaseOptimizer optimizer = new PhaseOptimizer(OptimizerContext.forRoot(root));
    optimizer.setValidityCheck((n) -> validityChecks++);
    optimizer.process(StepSequence.parse(sequence), root);
    return root;
  }
}
