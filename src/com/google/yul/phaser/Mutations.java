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

/**
 * Factories for the mutations used by the genetic algorithms. Every mutation works on genes, so
 * its output is always a valid chromosome.
 */
public final class Mutations {

  private Mutations() {}

  /** Replaces each gene with a random one with the given probability. */
  public static Mutation geneRandomisation(double chance) {
    checkProbability(chance);
    return (chromosome, random) -> {
      StringBuilder sb = new StringBuilder(chromosome.length());
      for (int i = 0; i < chromosome.length(); i++) {
        char gene = chromosome.geneAt(i);
        sb.append(random.nextDouble() < chance ? Chromosome.randomGene(random) : gene);
      }
      return Chromosome.of(sb.toString());
    };
  }

  /** Removes each gene with the given probability. */
  public static Mutation geneDeletion(double chance) {
    checkProbability(chance);
    return (chromosome, random) -> {
      StringBuilder sb = new StringBuilder(chromosome.length());
      for (int i = 0; i < chromosome.length(); i++) {
        if (random.nextDouble() >= chance) {
          sb.append(chromosome.geneAt(i));
        }
      }
      return Chromosome.of(sb.toString());
    };
  }

  /**
   * Inserts a random gene before each existing gene and once more at the end, each with the given
   * probability.
   */
  public static Mutation geneAddition(double chance) {
    checkProbability(chance);
    return (chromosome, random) -> {
      StringBuilder sb = new StringBuilder(chromosome.length() * 2 + 1);
      for (int i = 0; i <= chromosome.length(); i++) {
        if (random.nextDouble() < chance) {
          sb.append(Chromosome.randomGene(random));
        }
        if (i < chromosome.length()) {
          sb.append(chromosome.geneAt(i));
        }
      }
      return Chromosome.of(sb.toString());
    };
  }

  /** Applies {@code first} with probability {@code firstChance}, otherwise {@code second}. */
  public static Mutation alternative(Mutation first, Mutation second, double firstChance) {
    checkProbability(firstChance);
    return (chromosome, random) ->
        random.nextDouble() < firstChance
            ? first.mutate(chromosome, random)
            : second.mutate(chromosome, random);
  }

  /** Applies all mutations one after another. */
  public static Mutation sequence(Mutation... mutations) {
    ImmutableList<Mutation> all = ImmutableList.copyOf(mutations);
    return (chromosome, random) -> {
      Chromosome result = chromosome;
      for (Mutation mutation : all) {
        result = mutation.mutate(result, random);
      }
      return result;
    };
  }

  static void checkProbability(double chance) {
    checkArgument(chance >= 0 && chance <= 1, "Not a probability: %s", chance);
  }
}
