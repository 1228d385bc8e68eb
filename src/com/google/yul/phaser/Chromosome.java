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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.yul.optimizer.OptimizerSteps;
import com.google.yul.optimizer.PassFactory;
import com.google.yul.optimizer.StepSequence;
import java.util.Random;

/**
 * A candidate step sequence under evolutionary search. The genes are step abbreviations, one
 * character per step; groups are never part of a chromosome.
 */
public final class Chromosome {

  private static final String ALL_GENES = OptimizerSteps.allAbbreviations();

  private final String genes;

  private Chromosome(String genes) {
    this.genes = genes;
  }

  /**
   * Creates a chromosome from a string of step abbreviations.
   *
   * @throws IllegalArgumentException if any character is not a registered abbreviation
   */
  public static Chromosome of(String genes) {
    checkNotNull(genes);
    for (int i = 0; i < genes.length(); i++) {
      checkArgument(
          isValidGene(genes.charAt(i)),
          "Not an optimizer step abbreviation: '%s' at position %s",
          genes.charAt(i),
          i);
    }
    return new Chromosome(genes);
  }

  /** Creates a chromosome running the named steps once each. */
  public static Chromosome ofStepNames(Iterable<String> names) {
    StringBuilder sb = new StringBuilder();
    for (String name : names) {
      PassFactory step = OptimizerSteps.forName(name);
      checkArgument(step != null, "Unknown optimizer step: %s", name);
      sb.append(step.getAbbreviation());
    }
    return new Chromosome(sb.toString());
  }

  public static Chromosome makeRandom(int length, Random random) {
    checkArgument(length >= 0, length);
    StringBuilder sb = new StringBuilder(length);
    for (int i = 0; i < length; i++) {
      sb.append(randomGene(random));
    }
    return new Chromosome(sb.toString());
  }

  /** A uniformly chosen registered step abbreviation. */
  public static char randomGene(Random random) {
    return ALL_GENES.charAt(random.nextInt(ALL_GENES.length()));
  }

  public static boolean isValidGene(char gene) {
    return ALL_GENES.indexOf(gene) >= 0;
  }

  public String getGenes() {
    return genes;
  }

  public char geneAt(int index) {
    return genes.charAt(index);
  }

  public int length() {
    return genes.length();
  }

  public ImmutableList<String> getStepNames() {
    return toStepSequence().getStepNames();
  }

  public StepSequence toStepSequence() {
    return StepSequence.parse(genes);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Chromosome && genes.equals(((Chromosome) o).genes);
  }

  @Override
  public int hashCode() {
    return genes.hashCode();
  }

  @Override
  public String toString() {
    return genes;
  }
}
