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
import static com.google.common.base.Throwables.throwIfUnchecked;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.Uninterruptibles;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;

/**
 * Computes the fitness of individuals on a fixed thread pool, one task per individual and program.
 * The scores of an individual are aggregated and stored once all of its tasks are done, and
 * {@link #evaluate} returns only when the whole batch is done.
 */
public final class ParallelFitnessEvaluator implements AutoCloseable {

  private final ImmutableList<FitnessMetric> metrics;
  private final FitnessAggregation aggregation;
  private final ListeningExecutorService executorService;

  public ParallelFitnessEvaluator(
      List<FitnessMetric> metrics, FitnessAggregation aggregation, int threads) {
    checkArgument(!metrics.isEmpty(), "No fitness metrics");
    checkArgument(threads >= 1, "Thread count must be positive: %s", threads);
    this.metrics = ImmutableList.copyOf(metrics);
    this.aggregation = aggregation;
    this.executorService =
        MoreExecutors.listeningDecorator(
            Executors.newFixedThreadPool(
                threads,
                new ThreadFactoryBuilder()
                    .setNameFormat("yul-phaser-fitness-%d")
                    .setDaemon(true)
                    .build()));
  }

  /**
   * Sets the fitness of every individual that has none. Interrupting the calling thread does not
   * cut the batch short; the interrupt status is kept for the caller to act on.
   */
  public void evaluate(List<Individual> individuals) {
    List<Individual> pending = new ArrayList<>();
    List<ListenableFuture<Long>> futures = new ArrayList<>();
    for (Individual individual : individuals) {
      if (individual.hasFitness()) {
        continue;
      }
      pending.add(individual);
      Chromosome chromosome = individual.getChromosome();
      for (FitnessMetric metric : metrics) {
        futures.add(executorService.submit(() -> metric.evaluate(chromosome)));
      }
    }

    List<Long> scores;
    try {
      scores = Uninterruptibles.getUninterruptibly(Futures.allAsList(futures));
    } catch (ExecutionException e) {
      throwIfUnchecked(e.getCause());
      throw new RuntimeException(e.getCause());
    }

    for (int i = 0; i < pending.size(); i++) {
      long[] values = new long[metrics.size()];
      for (int j = 0; j < values.length; j++) {
        values[j] = scores.get(i * values.length + j);
      }
      pending.get(i).setFitness(aggregation.aggregate(values));
    }
  }

  @Override
  public void close() {
    executorService.shutdownNow();
  }
}
