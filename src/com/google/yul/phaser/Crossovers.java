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

import com.google.yul.phaser.Crossover.Offspring;
import java.util.Random;

/**
 * Factories for crossover operators. Parents may differ in length and so may the children.
 *
 * <p>With parents {@code A = a1 a2} and {@code B = b1 b2} cut into a head and a tail, a single
 * point crossover yields {@code a1 b2} and {@code b1 a2}.
 */
public final class Crossovers {

  private Crossovers() {}

  /** Cuts each parent at an independently chosen random point and swaps the tails. */
  public static Crossover randomPoint() {
    return (first, second, random) ->
        splice(
            first,
            random.nextInt(first.length() + 1),
            second,
            random.nextInt(second.length() + 1));
  }

  /** Cuts both parents at the same random point, which lies within the shorter one. */
  public static Crossover symmetricRandomPoint() {
    return (first, second, random) -> {
      int point = random.nextInt(Math.min(first.length(), second.length()) + 1);
      return splice(first, point, second, point);
    };
  }

  /** Cuts each parent at the same fraction of its length. */
  public static Crossover fixedPoint(double fraction) {
    Mutations.checkProbability(fraction);
    return (first, second, random) ->
        splice(
            first,
            (int) Math.round(fraction * first.length()),
            second,
            (int) Math.round(fraction * second.length()));
  }

  /**
   * Chooses two random points within the shorter parent and swaps the genes between them. The
   * children have the lengths of their parents.
   */
  public static Crossover randomTwoPoint() {
    return (first, second, random) -> {
      int limit = Math.min(first.length(), second.length()) + 1;
      int a = random.nextInt(limit);
      int b = random.nextInt(limit);
      int start = Math.min(a, b);
      int end = Math.max(a, b);
      String x = first.getGenes();
      String y = second.getGenes();
      return new Offspring(
          Chromosome.of(x.substring(0, start) + y.substring(start, end) + x.substring(end)),
          Chromosome.of(y.substring(0, start) + x.substring(start, end) + y.substring(end)));
    };
  }

  /**
   * Swaps each pair of genes at the same position with the given probability. The genes of the
   * longer parent past the end of the shorter one are moved as a whole, with the same probability.
   */
  public static Crossover uniform(double swapChance) {
    Mutations.checkProbability(swapChance);
    return (first, second, random) -> {
      int common = Math.min(first.length(), second.length());
      StringBuilder x = new StringBuilder();
      StringBuilder y = new StringBuilder();
      for (int i = 0; i < common; i++) {
        boolean swap = random.nextDouble() < swapChance;
        x.append(swap ? second.geneAt(i) : first.geneAt(i));
        y.append(swap ? first.geneAt(i) : second.geneAt(i));
      }
      String firstTail = first.getGenes().substring(common);
      String secondTail = second.getGenes().substring(common);
      if (random.nextDouble() < swapChance) {
        x.append(secondTail);
        y.append(firstTail);
      } else {
        x.append(firstTail);
        y.append(secondTail);
      }
      return new Offspring(Chromosome.of(x.toString()), Chromosome.of(y.toString()));
    };
  }

  private static Offspring splice(
      Chromosome first, int firstPoint, Chromosome second, int secondPoint) {
    checkArgument(firstPoint >= 0 && firstPoint <= first.length());
    checkArgument(secondPoint >= 0 && secondPoint <= second.length());
    String x = first.getGenes();
    String y = second.getGenes();
    return new Offspring(
        Chromosome.of(x.substring(0, firstPoint) + y.substring(secondPoint)),
        Chromosome.of(y.substring(0, secondPoint) + x.substring(firstPoint)));
  }
}
