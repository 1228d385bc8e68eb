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

package com.google.yul.phaser;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.yul.optimizer.OptimizerSteps;
import java.util.Random;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ChromosomeTest {

  @Test
  public void testOf() {
    Chromosome chromosome = Chromosome.of("fDx");
    assertThat(chromosome.getGenes()).isEqualTo("fDx");
    assertThat(chromosome.length()).isEqualTo(3);
    assertThat(chromosome.geneAt(1)).isEqualTo('D');
    assertThat(chromosome.getStepNames())
        .containsExactly("BlockFlattener", "DeadCodeEliminator", "ExpressionSplitter")
        .inOrder();
    assertThat(chromosome.toString()).isEqualTo("fDx");
  }

  @Test
  public void testEmpty() {
    Chromosome chromosome = Chromosome.of("");
    assertThat(chromosome.length()).isEqualTo(0);
    assertThat(chromosome.toStepSequence().isEmpty()).isTrue();
  }

  @Test
  public void testInvalidGenes() {
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> Chromosome.of("fZ"));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("Not an optimizer step abbreviation: 'Z' at position 1");
    assertThrows(IllegalArgumentException.class, () -> Chromosome.of("[f]"));
    assertThrows(IllegalArgumentException.class, () -> Chromosome.of("f u"));
  }

  @Test
  public void testOfStepNames() {
    assertThat(Chromosome.ofStepNames(ImmutableList.of("UnusedPruner", "BlockFlattener")))
        .isEqualTo(Chromosome.of("uf"));
    assertThrows(
        IllegalArgumentException.class,
        () -> Chromosome.ofStepNames(ImmutableList.of("Inliner")));
  }

  @Test
  public void testMakeRandom() {
    Chromosome chromosome = Chromosome.makeRandom(50, new Random(1));
    assertThat(chromosome.length()).isEqualTo(50);
    for (int i = 0; i < chromosome.length(); i++) {
      assertThat(Chromosome.isValidGene(chromosome.geneAt(i))).isTrue();
    }
    assertThat(Chromosome.makeRandom(50, new Random(1))).isEqualTo(chromosome);
    assertThat(Chromosome.makeRandom(0, new Random(1)).length()).isEqualTo(0);
  }

  @Test
  public void testRandomGeneCoversAllSteps() {
    Random random = new Random(7);
    StringBuilder seen = new StringBuilder();
    for (int i = 0; i < 2000; i++) {
      char gene = Chromosome.randomGene(random);
      if (seen.indexOf(String.valueOf(gene)) < 0) {
        seen.append(gene);
      }
    }
    assertThat(seen.length()).isEqualTo(OptimizerSteps.all().size());
  }

  @Test
  public void testEquality() {
    assertThat(Chromosome.of("tu")).isEqualTo(Chromosome.of("tu"));
    assertThat(Chromosome.of("tu").hashCode()).isEqualTo(Chromosome.of("tu").hashCode());
    assertThat(Chromosome.of("tu")).isNotEqualTo(Chromosome.of("ut"));
  }
}
