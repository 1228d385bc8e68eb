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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ParallelFitnessEvaluatorTest {

  private ParallelFitnessEvaluator evaluator;

  @After
  public void tearDown() {
    if (evaluator != null) {
      evaluator.close();
    }
  }

  @Test
  public void testAggregatesMetrics() {
    evaluator =
        new ParallelFitnessEvaluator(
            ImmutableList.of(c -> c.length(), c -> 10L * c.length()), FitnessAggregation.SUM, 3);
    ImmutableList<Individual> individuals =
        ImmutableList.of(
            new Individual(Chromosome.of("f")),
            new Individual(Chromosome.of("fDx")),
            new Individual(Chromosome.of("")));

    evaluator.evaluate(individuals);

    assertThat(individuals.get(0).getFitness()).isEqualTo(11);
    assertThat(individuals.get(1).getFitness()).isEqualTo(33);
    assertThat(individuals.get(2).getFitness()).isEqualTo(0);
  }

  @Test
  public void testSkipsEvaluatedIndividuals() {
    evaluator =
        new ParallelFitnessEvaluator(
            ImmutableList.of(c -> c.length()), FitnessAggregation.MAXIMUM, 1);
    Individual evaluated = new Individual(Chromosome.of("fu"), 99);
    Individual fresh = new Individual(Chromosome.of("fu"));

    evaluator.evaluate(ImmutableList.of(evaluated, fresh));

    assertThat(evaluated.getFitness()).isEqualTo(99);
    assertThat(fresh.getFitness()).isEqualTo(2);
  }

  @Test
  public void testRunsOnPoolThreads() {
    Set<String> threads = ConcurrentHashMap.newKeySet();
    evaluator =
        new ParallelFitnessEvaluator(
            ImmutableList.of(
                c -> {
                  threads.add(Thread.currentThread().getName());
                  return 0;
                }),
            FitnessAggregation.SUM,
            2);
    ImmutableList.Builder<Individual> individuals = ImmutableList.builder();
    for (int i = 0; i < 20; i++) {
      individuals.add(new Individual(Chromosome.of("f")));
    }

    evaluator.evaluate(individuals.build());

    assertThat(threads).isNotEmpty();
    for (String thread : threads) {
      assertThat(thread).startsWith("yul-phaser-fitness-");
    }
  }

  @Test
  public void testFailureIsRethrown() {
    evaluator =
        new ParallelFitnessEvaluator(
            ImmutableList.of(
                c -> {
                  throw new IllegalStateException("boom");
                }),
            FitnessAggregation.SUM,
            2);
    Individual individual = new Individual(Chromosome.of("f"));

    IllegalStateException e =
        assertThrows(
            IllegalStateException.class, () -> evaluator.evaluate(ImmutableList.of(individual)));
    assertThat(e).hasMessageThat().isEqualTo("boom");
    assertThat(individual.hasFitness()).isFalse();
  }

  @Test
  public void testInterruptDoesNotCutEvaluationShort() {
    evaluator =
        new ParallelFitnessEvaluator(
            ImmutableList.of(c -> c.length()), FitnessAggregation.SUM, 2);
    Individual individual = new Individual(Chromosome.of("fu"));

    Thread.currentThread().interrupt();
    try {
      evaluator.evaluate(ImmutableList.of(individual));
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }
    assertThat(individual.getFitness()).isEqualTo(2);
  }

  @Test
  public void testBadArguments() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new ParallelFitnessEvaluator(ImmutableList.of(), FitnessAggregation.SUM, 1));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new ParallelFitnessEvaluator(
                ImmutableList.of(c -> 0), FitnessAggregation.SUM, 0));
  }
}
