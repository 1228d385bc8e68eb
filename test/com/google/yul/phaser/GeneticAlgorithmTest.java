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
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class GeneticAlgorithmTest {

  private final Random random = new Random(17);

  /** Ten individuals; the fitness of each is its rank. */
  private final Population population = makePopulation(10);

  @Test
  public void testRandomAlgorithm() {
    RandomAlgorithm algorithm = new RandomAlgorithm(new RandomAlgorithm.Options(0.3, 2, 4));

    ImmutableList<Individual> survivors = algorithm.selectSurvivors(population);
    assertThat(survivors).containsExactlyElementsIn(population.top(3)).inOrder();

    ImmutableList<Chromosome> offspring = algorithm.breed(population, 7, random);
    assertThat(offspring).hasSize(7);
    for (Chromosome chromosome : offspring) {
      assertThat(chromosome.length()).isAtLeast(2);
      assertThat(chromosome.length()).isAtMost(4);
    }
  }

  @Test
  public void testEliteIsNeverEmpty() {
    RandomAlgorithm algorithm = new RandomAlgorithm(new RandomAlgorithm.Options(0, 1, 1));
    assertThat(algorithm.selectSurvivors(population)).containsExactly(population.best());
  }

  @Test
  public void testRandomAlgorithmOptions() {
    assertThrows(
        IllegalArgumentException.class, () -> new RandomAlgorithm.Options(0.5, 5, 4));
    assertThrows(
        IllegalArgumentException.class, () -> new RandomAlgorithm.Options(1.5, 1, 4));
  }

  @Test
  public void testGenerationalElitistWithExclusivePools() {
    GenerationalElitistWithExclusivePools algorithm =
        new GenerationalElitistWithExclusivePools(
            new GenerationalElitistWithExclusivePools.Options(0.2, 0.3, 1, 0.5, 0, 0.5));

    ImmutableList<Individual> survivors = algorithm.selectSurvivors(population);
    assertThat(survivors).hasSize(5);
    assertThat(survivors.get(0)).isSameInstanceAs(population.best());

    ImmutableList<Chromosome> offspring = algorithm.breed(population, 5, random);
    assertThat(offspring).hasSize(5);
    // Randomising mutants with a zero gene probability are copies of elite chromosomes.
    List<Chromosome> elite = chromosomes(survivors);
    assertThat(elite).contains(offspring.get(0));
    assertThat(elite).contains(offspring.get(1));
  }

  @Test
  public void testGenerationalElitistNeedsAnElite() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new GenerationalElitistWithExclusivePools.Options(0.5, 0.5, 1, 0.5, 0.1, 0.1));
  }

  @Test
  public void testClassicAlgorithmWithoutChanges() {
    ClassicGeneticAlgorithm algorithm =
        new ClassicGeneticAlgorithm(
            new ClassicGeneticAlgorithm.Options(
                0.2, 1, 0, 0, 0, Selections.tournament(1), Crossovers.fixedPoint(0)));

    assertThat(algorithm.selectSurvivors(population)).hasSize(2);

    List<Chromosome> all = chromosomes(population.getIndividuals());
    ImmutableList<Chromosome> even = algorithm.breed(population, 8, random);
    assertThat(even).hasSize(8);
    for (Chromosome chromosome : even) {
      assertThat(all).contains(chromosome);
    }
    assertThat(algorithm.breed(population, 7, random)).hasSize(7);
  }

  @Test
  public void testClassicAlgorithmMutates() {
    ClassicGeneticAlgorithm algorithm =
        new ClassicGeneticAlgorithm(
            new ClassicGeneticAlgorithm.Options(
                0.2, 0, 0, 1, 0, Selections.rouletteWheel(), Crossovers.randomPoint()));

    for (Chromosome chromosome : algorithm.breed(population, 8, random)) {
      assertThat(chromosome.length()).isEqualTo(0);
    }
  }

  @Test
  public void testClassicAlgorithmCrossesOver() {
    Population pair =
        new Population(
            ImmutableList.of(
                new Individual(Chromosome.of("ffff"), 0),
                new Individual(Chromosome.of("uuuu"), 0)));
    ClassicGeneticAlgorithm algorithm =
        new ClassicGeneticAlgorithm(
            new ClassicGeneticAlgorithm.Options(
                0.5, 1, 0, 0, 0, Selections.random(), Crossovers.fixedPoint(0.5)));

    for (Chromosome chromosome : algorithm.breed(pair, 20, random)) {
      assertThat(chromosome.getGenes()).isAnyOf("ffff", "uuuu", "ffuu", "uuff");
    }
  }

  private static Population makePopulation(int size) {
    Random random = new Random(3);
    List<Individual> individuals = new ArrayList<>();
    for (int i = 0; i < size; i++) {
      individuals.add(new Individual(Chromosome.makeRandom(3 + i, random), i));
    }
    return new Population(individuals);
  }

  private static List<Chromosome> chromosomes(List<Individual> individuals) {
    List<Chromosome> chromosomes = new ArrayList<>();
    for (Individual individual : individuals) {
      chromosomes.add(individual.getChromosome());
    }
    return chromosomes;
  }
}
