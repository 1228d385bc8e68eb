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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * A chromosome with its fitness. The fitness is computed at most once per chromosome: it is set by
 * the evaluator and cleared whenever the chromosome is replaced.
 */
public final class Individual {

  private Chromosome chromosome;
  private long fitness;
  private boolean hasFitness;

  public Individual(Chromosome chromosome) {
    this.chromosome = checkNotNull(chromosome);
  }

  public Individual(Chromosome chromosome, long fitness) {
    this(chromosome);
    setFitness(fitness);
  }

  public Chromosome getChromosome() {
    return chromosome;
  }

  public void setChromosome(Chromosome chromosome) {
    this.chromosome = checkNotNull(chromosome);
    this.hasFitness = false;
  }

  public boolean hasFitness() {
    return hasFitness;
  }

  public long getFitness() {
    checkState(hasFitness, "Fitness of %s has not been evaluated", chromosome);
    return fitness;
  }

  @CanIgnoreReturnValue
  public Individual setFitness(long fitness) {
    checkState(!hasFitness, "Fitness of %s is already set", chromosome);
    this.fitness = fitness;
    this.hasFitness = true;
    return this;
  }

  @Override
  public String toString() {
    return hasFitness ? fitness + " " + chromosome : "? " + chromosome;
  }
}
