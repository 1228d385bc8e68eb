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
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class PopulationTest {

  @Test
  public void testOrdering() {
    Population population =
        new Population(
            ImmutableList.of(
                individual("fff", 3),
                individual("uuu", 1),
                individual("u", 1),
                individual("f", 1)));

    assertThat(population.chromosomes())
        .containsExactly(
            Chromosome.of("f"), Chromosome.of("u"), Chromosome.of("uuu"), Chromosome.of("fff"))
        .inOrder();
    assertThat(population.best().getChromosome()).isEqualTo(Chromosome.of("f"));
    assertThat(population.worst().getFitness()).isEqualTo(3);
    assertThat(population.get(2).getChromosome()).isEqualTo(Chromosome.of("uuu"));
  }

  @Test
  public void testOrderDoesNotDependOnInsertionOrder() {
    Population a = new Population(ImmutableList.of(individual("fu", 2), individual("uf", 2)));
    Population b = new Population(ImmutableList.of(individual("uf", 2), individual("fu", 2)));
    assertThat(a.chromosomes()).isEqualTo(b.chromosomes());
  }

  @Test
  public void testTop() {
    Population population =
        new Population(
            ImmutableList.of(individual("f", 1), individual("u", 2), individual("t", 3)));
    assertThat(population.top(2)).hasSize(2);
    assertThat(population.top(0)).containsExactly(population.best());
    assertThat(population.top(10)).hasSize(3);
  }

  @Test
  public void testMeanFitness() {
    Population population =
        new Population(ImmutableList.of(individual("f", 1), individual("u", 2)));
    assertThat(population.meanFitness()).isEqualTo(1.5);
    assertThat(population.size()).isEqualTo(2);
  }

  @Test
  public void testUnevaluatedIndividual() {
    assertThrows(
        IllegalStateException.class,
        () ->
            new Population(
                ImmutableList.of(individual("f", 1), new Individual(Chromosome.of("u")))));
  }

  @Test
  public void testEmpty() {
    assertThrows(IllegalArgumentException.class, () -> new Population(ImmutableList.of()));
  }

  static Individual individual(String genes, long fitness) {
    return new Individual(Chromosome.of(genes), fitness);
  }
}
