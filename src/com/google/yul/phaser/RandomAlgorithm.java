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
 * Keeps the elite and replaces everything else with random chromosomes. Useful as a baseline for
 * the other algorithms.
 */
public final class RandomAlgorithm extends GeneticAlgorithm {

  /**
   * @param elitePoolSize fraction of the population that survives
   */
  public record Options(double elitePoolSize, int minChromosomeLength, int maxChromosomeLength) {
    public Options {
      Mutations.checkProbability(elitePoolSize);
      checkArgument(
          0 <= minChromosomeLength && minChromosomeLength <= maxChromosomeLength,
          "Bad chromosome length range: %s..%s",
          minChromosomeLength,
          maxChromosomeLength);
    }
  }

  private final Options options;

  public RandomAlgorithm(Options options) {
    this.options = options;
  }

  @Override
  public ImmutableList<Individual> selectSurvivors(Population population) {
    return population.top(poolSize(population, options.elitePoolSize()));
  }

  @Override
  public ImmutableList<Chromosome> breed(Population population, int count, Random random) {
    return randomChromosomes(
        count, options.minChromosomeLength(), options.maxChromosomeLength(), random);
  }

  /** Chromosomes with lengths drawn uniformly from {@code [minLength, maxLength]}. */
  public static ImmutableList<Chromosome> randomChromosomes(
      int count, int minLength, int maxLength, Random random) {
    ImmutableList.Builder<Chromosome> chromosomes = ImmutableList.builder();
    for (int i = 0; i < count; i++) {
      int length = minLength + random.nextInt(maxLength - minLength + 1);
      chromosomes.add(Chromosome.makeRandom(length, random));
    }
    return chromosomes.build();
  }
}
