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

import com.google.common.collect.ImmutableList;
import com.google.yul.phaser.Crossover.Offspring;
import java.util.Random;

/**
 * The textbook algorithm: the elite survives and the rest of the generation is bred from parents
 * chosen by a {@link Selection}. Each pair of parents is crossed over with probability {@code
 * crossoverChance} and copied otherwise; every child is then mutated.
 */
public final class ClassicGeneticAlgorithm extends GeneticAlgorithm {

  /**
   * @param elitePoolSize fraction of the population that survives
   * @param mutationChance per gene probability of randomisation
   * @param deletionChance per gene probability of deletion
   * @param additionChance per position probability of inserting a gene
   */
  public record Options(
      double elitePoolSize,
      double crossoverChance,
      double mutationChance,
      double deletionChance,
      double additionChance,
      Selection selection,
      Crossover crossover) {
    public Options {
      Mutations.checkProbability(elitePoolSize);
      Mutations.checkProbability(crossoverChance);
      Mutations.checkProbability(mutationChance);
      Mutations.checkProbability(deletionChance);
      Mutations.checkProbability(additionChance);
    }
  }

  private final Options options;
  private final Mutation mutation;

  public ClassicGeneticAlgorithm(Options options) {
    this.options = options;
    this.mutation =
        Mutations.sequence(
            Mutations.geneRandomisation(options.mutationChance()),
            Mutations.geneDeletion(options.deletionChance()),
            Mutations.geneAddition(options.additionChance()));
  }

  @Override
  public ImmutableList<Individual> selectSurvivors(Population population) {
    return population.top(poolSize(population, options.elitePoolSize()));
  }

  @Override
  public ImmutableList<Chromosome> breed(Population population, int count, Random random) {
    ImmutableList.Builder<Chromosome> offspring = ImmutableList.builder();
    int bred = 0;
    while (bred < count) {
      ImmutableList<Individual> parents = options.selection().select(population, 2, random);
      Chromosome first = parents.get(0).getChromosome();
      Chromosome second = parents.get(1).getChromosome();
      if (random.nextDouble() < options.crossoverChance()) {
        Offspring children = options.crossover().cross(first, second, random);
        first = children.first();
        second = children.second();
      }
      offspring.add(mutation.mutate(first, random));
      bred++;
      if (bred < count) {
        offspring.add(mutation.mutate(second, random));
        bred++;
      }
    }
    return offspring.build();
  }
}
