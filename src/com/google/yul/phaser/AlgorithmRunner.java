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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Drives a {@link GeneticAlgorithm} from an initial population until a stopping condition holds.
 *
 * <p>Each generation goes through {@link State#EVALUATED}, {@link State#SELECTED} and {@link
 * State#RECOMBINED} in turn. Stopping conditions are only checked once a generation has been
 * evaluated. The generation size stays that of the initial population.
 */
public final class AlgorithmRunner {
  private static final Logger logger = Logger.getLogger(AlgorithmRunner.class.getName());

  /** Where the runner is in its generational loop. */
  public enum State {
    INITIALIZED,
    EVALUATED,
    SELECTED,
    RECOMBINED,
    TERMINATED
  }

  /** Why a search ended. */
  public enum StopReason {
    ROUNDS,
    TIME_BUDGET,
    PLATEAU,
    INTERRUPTED
  }

  private final GeneticAlgorithm algorithm;
  private final ParallelFitnessEvaluator evaluator;
  private final SearchOptions options;
  private final Random random;
  private final Ticker ticker;

  private State state = State.INITIALIZED;

  public AlgorithmRunner(
      GeneticAlgorithm algorithm,
      ParallelFitnessEvaluator evaluator,
      SearchOptions options,
      Random random) {
    this(algorithm, evaluator, options, random, Ticker.systemTicker());
  }

  @VisibleForTesting
  AlgorithmRunner(
      GeneticAlgorithm algorithm,
      ParallelFitnessEvaluator evaluator,
      SearchOptions options,
      Random random,
      Ticker ticker) {
    this.algorithm = checkNotNull(algorithm);
    this.evaluator = checkNotNull(evaluator);
    this.options = checkNotNull(options);
    this.random = checkNotNull(random);
    this.ticker = checkNotNull(ticker);
  }

  public State getState() {
    return state;
  }

  /**
   * Runs the search. A runner can only be used once.
   *
   * @throws IOException if the population cannot be saved
   */
  public SearchResult run(List<Chromosome> initialChromosomes) throws IOException {
    checkState(state == State.INITIALIZED, "Runner already used");
    checkArgument(!initialChromosomes.isEmpty(), "Empty initial population");
    Stopwatch stopwatch = Stopwatch.createStarted(ticker);
    int generationSize = initialChromosomes.size();

    List<Individual> individuals = new ArrayList<>();
    for (Chromosome chromosome : initialChromosomes) {
      individuals.add(new Individual(chromosome));
    }
    Population population = evaluate(individuals);
    Individual best = population.best();
    int round = 0;
    int lastImprovement = 0;
    logRound(round, population);
    autosave(population, round);

    StopReason stopReason;
    while ((stopReason = stopReason(round, lastImprovement, stopwatch)) == null) {
      ImmutableList<Individual> survivors = algorithm.selectSurvivors(population);
      checkState(
          !survivors.isEmpty() && survivors.get(0) == population.best(),
          "%s did not keep the best individual",
          algorithm.getClass().getSimpleName());
      checkState(survivors.size() <= generationSize);
      state = State.SELECTED;

      ImmutableList<Chromosome> offspring =
          algorithm.breed(population, generationSize - survivors.size(), random);
      List<Individual> next = new ArrayList<>(survivors);
      for (Chromosome chromosome : offspring) {
        next.add(new Individual(chromosome));
      }
      state = State.RECOMBINED;

      population = evaluate(next);
      round++;
      if (population.best().getFitness() < best.getFitness()) {
        lastImprovement = round;
      }
      if (Population.BEST_FIRST.compare(population.best(), best) < 0) {
        best = population.best();
      }
      logRound(round, population);
      autosave(population, round);
    }

    state = State.TERMINATED;
    logger.info("Search stopped after " + round + " round(s): " + stopReason);
    return new SearchResult(best, round, stopReason, population, stopwatch.elapsed());
  }

  private Population evaluate(List<Individual> individuals) {
    evaluator.evaluate(individuals);
    state = State.EVALUATED;
    return new Population(individuals);
  }

  private @Nullable StopReason stopReason(int round, int lastImprovement, Stopwatch stopwatch) {
    if (Thread.currentThread().isInterrupted()) {
      return StopReason.INTERRUPTED;
    }
    if (options.getMaxRounds().isPresent() && round >= options.getMaxRounds().getAsInt()) {
      return StopReason.ROUNDS;
    }
    if (options.getTimeBudget().isPresent()
        && stopwatch.elapsed().compareTo(options.getTimeBudget().get()) >= 0) {
      return StopReason.TIME_BUDGET;
    }
    if (options.getPlateauRounds().isPresent()
        && round - lastImprovement >= options.getPlateauRounds().getAsInt()) {
      return StopReason.PLATEAU;
    }
    return null;
  }

  private void logRound(int round, Population population) {
    logger.info(
        String.format(
            "Round %d: best %d (%s), mean %.2f",
            round,
            population.best().getFitness(),
            population.best().getChromosome(),
            population.meanFitness()));
  }

  private void autosave(Population population, int round) throws IOException {
    Optional<Path> file = options.getAutosaveFile();
    if (file.isPresent()) {
      PopulationFile.write(file.get(), population, round);
    }
  }
}
