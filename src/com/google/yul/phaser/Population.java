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
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * The evaluated individuals of one generation, best first. Individuals are ordered by fitness,
 * then by chromosome length and then by genes, so the order does not depend on the order in which
 * they were added.
 */
public final class Population {

  public static final Comparator<Individual> BEST_FIRST =
      Comparator.comparingLong(Individual::getFitness)
          .thenComparingInt((Individual i) -> i.getChromosome().length())
          .thenComparing((Individual i) -> i.getChromosome().getGenes());

  private final ImmutableList<Individual> individuals;

  /**
   * @throws IllegalStateException if an individual has not been evaluated
   */
  public Population(List<Individual> individuals) {
    checkArgument(!individuals.isEmpty(), "Empty population");
    List<Individual> sorted = new ArrayList<>(individuals);
    sorted.sort(BEST_FIRST);
    this.individuals = ImmutableList.copyOf(sorted);
  }

  public ImmutableList<Individual> getIndividuals() {
    return individuals;
  }

  public Individual get(int rank) {
    return individuals.get(rank);
  }

  public Individual best() {
    return individuals.get(0);
  }

  public Individual worst() {
    return individuals.get(individuals.size() - 1);
  }

  /** The best {@code count} individuals; at least one even when {@code count} is smaller. */
  public ImmutableList<Individual> top(int count) {
    return individuals.subList(0, Math.max(1, Math.min(count, individuals.size())));
  }

  public int size() {
    return individuals.size();
  }

  public ImmutableList<Chromosome> chromosomes() {
    ImmutableList.Builder<Chromosome> chromosomes = ImmutableList.builder();
    for (Individual individual : individuals) {
      chromosomes.add(individual.getChromosome());
    }
    return chromosomes.build();
  }

  public double meanFitness() {
    double sum = 0;
    for (Individual individual : individuals) {
      sum += individual.getFitness();
    }
    return sum / individuals.size();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Individual individual : individuals) {
      sb.append(individual).append('\n');
    }
    return sb.toString();
  }
}
