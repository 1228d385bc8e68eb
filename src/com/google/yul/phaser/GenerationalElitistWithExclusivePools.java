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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.Random;

/**
 * Splits each new generation into three exclusive pools: the elite, which survives, mutants of
 * elite individuals and children of pairs of elite individuals.
 *
 * <p>A mutant has its genes randomised with probability {@code randomisationChance}; otherwise
 * genes are deleted or added, the choice between the two weighted by {@code
 * deletionVsAdditionChance}.
 */
public final class GenerationalElitistWithExclusivePools extends GeneticAlgorithm {

  /**
   * @param mutationPoolSize fraction of the population made of mutants
   * @param crossoverPoolSize fraction of the population made of crossover children
   * @param percentGenesToRandomise per gene probability used by a randomising mutation
   * @param percentGenesToAddOrDelete per gene probability used by a deleting or adding mutation
   */
  public record Options(
      double mutationPoolSize,
      double crossoverPoolSize,
      double randomisationChance,
      double deletionVsAdditionChance,
      double percentGenesToRandomise,
      double percentGenesToAddOrDelete) {
    public Options {
      Mutations.checkProbability(mutationPoolSize);
      Mutations.checkProbability(crossoverPoolSize);
      checkArgument(
          mutationPoolSize + crossoverPoolSize < 1, "The elite pool must not be empty");
      Mutations.checkProbability(randomisationChance);
      Mutations.checkProbability(deletionVsAdditionChance);
      Mutations.checkProbability(percentGenesToRandomise);
      Mutations.checkProbability(percentGenesToAddOrDelete);
    }

    public double elitePoolSize() {
      return 1 - mutationPoolSize - crossoverPoolSize;
    }
  }

  private final Options options;
  private final Mutation mutation;
  private final Crossover crossover = Crossovers.randomPoint();

  public GenerationalElitistWithExclusivePools(Options options) {
    this.options = options;
    this.mutation =
        Mutations.alternative(
            Mutations.geneRandomisation(options.percentGenesToRandomise()),
            Mutations.alternative(
                Mutations.geneDeletion(options.percentGenesToAddOrDelete()),
                Mutations.geneAddition(options.percentGenesToAddOrDelete()),
                options.deletionVsAdditionChance()),
            options.randomisationChance());
  }

  @Override
  public ImmutableList<Individual> selectSurvivors(Population population) {
    return population.top(poolSize(population, options.elitePoolSize()));
  }

  @Override
  public ImmutableList<Chromosome> breed(Population population, int count, Random random) {
    ImmutableList<Individual> elite = selectSurvivors(population);
    int mutants =
        Math.min(count, (int) Math.round(options.mutationPoolSize() * population.size()));
    ImmutableList.Builder<Chromosome> offspring = ImmutableList.builder();
    for (int i = 0; i < mutants; i++) {
      offspring.add(mutation.mutate(pick(elite, random), random));
    }
    for (int i = mutants; i < count; i++) {
      offspring.add(crossover.cross(pick(elite, random), pick(elite, random), random).first());
    }
    return offspring.build();
  }

  private static Chromosome pick(ImmutableList<Individual> pool, Random random) {
    return pool.get(random.nextInt(pool.size())).getChromosome();
  }
}
