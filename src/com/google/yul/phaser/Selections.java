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

/** Factories for parent selection strategies. */
public final class Selections {

  private Selections() {}

  /** Every individual is equally likely to be picked. */
  public static Selection random() {
    return (population, count, random) -> {
      ImmutableList.Builder<Individual> selected = ImmutableList.builder();
      for (int i = 0; i < count; i++) {
        selected.add(population.get(random.nextInt(population.size())));
      }
      return selected.build();
    };
  }

  /**
   * Each pick is the best of {@code size} individuals drawn at random. Larger tournaments favour
   * fitter individuals more strongly.
   */
  public static Selection tournament(int size) {
    checkArgument(size >= 1, "Tournament size must be positive: %s", size);
    return (population, count, random) -> {
      ImmutableList.Builder<Individual> selected = ImmutableList.builder();
      for (int i = 0; i < count; i++) {
        // The population is sorted, so the lowest rank drawn wins.
        int winner = population.size();
        for (int j = 0; j < size; j++) {
          winner = Math.min(winner, random.nextInt(population.size()));
        }
        selected.add(population.get(winner));
      }
      return selected.build();
    };
  }

  /**
   * Fitness proportionate selection for a metric that is minimized: an individual's weight is its
   * distance to the worst fitness in the population, plus one.
   */
  public static Selection rouletteWheel() {
    return (population, count, random) -> {
      long worst = population.worst().getFitness();
      double[] cumulative = new double[population.size()];
      double total = 0;
      for (int i = 0; i < population.size(); i++) {
        total += worst - population.get(i).getFitness() + 1;
        cumulative[i] = total;
      }
      ImmutableList.Builder<Individual> selected = ImmutableList.builder();
      for (int i = 0; i < count; i++) {
        double point = random.nextDouble() * total;
        int index = 0;
        while (index < cumulative.length - 1 && cumulative[index] <= point) {
          index++;
        }
        selected.add(population.get(index));
      }
      return selected.build();
    };
  }
}
