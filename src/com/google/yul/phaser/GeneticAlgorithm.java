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
import java.util.Random;

/**
 * One strategy for turning a generation into the next one. A round first picks the survivors,
 * which move on unchanged with their fitness, and then breeds new chromosomes to fill the rest of
 * the generation.
 *
 * <p>The survivors always include the best individual, so the best fitness of a population never
 * gets worse from one generation to the next.
 */
public abstract class GeneticAlgorithm {

  /** The individuals carried over unchanged. Never empty; the best individual comes first. */
  public abstract ImmutableList<Individual> selectSurvivors(Population population);

  /** {@code count} new chromosomes derived from {@code population}. */
  public abstract ImmutableList<Chromosome> breed(Population population, int count, Random random);

  /** The number of individuals making up {@code fraction} of the population, at least one. */
  static int poolSize(Population population, double fraction) {
    return Math.max(1, (int) Math.round(fraction * population.size()));
  }
}
