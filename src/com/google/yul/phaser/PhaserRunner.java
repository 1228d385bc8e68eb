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
import com.google.yul.optimizer.ErrorManager;
import com.google.yul.optimizer.InvalidProgramException;
import com.google.yul.optimizer.PrintStreamErrorManager;
import com.google.yul.optimizer.Program;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.spi.BooleanOptionHandler;

/**
 * Searches for the step sequence that makes a corpus of Yul programs smallest.
 *
 * <pre>
 * PhaserRunner --seed 1 --rounds 100 --algorithm CLASSIC a.yul b.yul
 * </pre>
 *
 * Prints the best chromosome found, its fitness and the number of rounds that ran. A corpus file
 * that cannot be loaded is reported once and ends the run before the search starts.
 */
public class PhaserRunner {
  private static final Logger logger = Logger.getLogger(PhaserRunner.class.getName());

  /** The genetic algorithms that can drive the search. */
  enum Algorithm {
    RANDOM,
    GEWEP,
    CLASSIC
  }

  /** Parent selection for the classic algorithm. */
  enum SelectionKind {
    TOURNAMENT,
    ROULETTE
  }

  /** The per program fitness metrics. */
  enum Metric {
    CODE_SIZE,
    RELATIVE_CODE_SIZE
  }

  private static class Flags {
    @Option(
        name = "--help",
        handler = BooleanOptionHandler.class,
        usage = "Displays this message on stdout and exit")
    private boolean displayHelp = false;

    @Option(
        name = "--seed",
        usage = "Seed for the random number generator. Defaults to the current time; the value"
            + " used is logged")
    private Long seed = null;

    @Option(name = "--rounds", usage = "The number of generations to breed")
    private Integer rounds = null;

    @Option(
        name = "--time-budget",
        usage = "Stop once this many seconds have passed. Checked between generations")
    private Integer timeBudget = null;

    @Option(
        name = "--plateau",
        usage = "Stop after this many generations without an improvement of the best fitness")
    private Integer plateau = null;

    @Option(name = "--population-size", usage = "The number of individuals in a generation")
    private int populationSize = 20;

    @Option(name = "--algorithm", usage = "The genetic algorithm: RANDOM, GEWEP or CLASSIC")
    private Algorithm algorithm = Algorithm.GEWEP;

    @Option(
        name = "--selection",
        usage = "Parent selection of the CLASSIC algorithm: TOURNAMENT or ROULETTE")
    private SelectionKind selection = SelectionKind.TOURNAMENT;

    @Option(name = "--tournament-size", usage = "The number of contestants in a tournament")
    private int tournamentSize = 3;

    @Option(name = "--metric", usage = "The fitness metric: CODE_SIZE or RELATIVE_CODE_SIZE")
    private Metric metric = Metric.RELATIVE_CODE_SIZE;

    @Option(
        name = "--metric-aggregator",
        usage = "How scores on the corpus programs are combined: SUM, AVERAGE, MINIMUM or"
            + " MAXIMUM")
    private FitnessAggregation metricAggregator = FitnessAggregation.AVERAGE;

    @Option(
        name = "--relative-metric-scale",
        usage = "Decimal digits kept by RELATIVE_CODE_SIZE")
    private int relativeMetricScale = 3;

    @Option(
        name = "--chromosome-repetitions",
        usage = "How many times a chromosome is applied to a program before it is measured")
    private int chromosomeRepetitions = 1;

    @Option(name = "--min-chromosome-length", usage = "Minimum length of random chromosomes")
    private int minChromosomeLength = 12;

    @Option(name = "--max-chromosome-length", usage = "Maximum length of random chromosomes")
    private int maxChromosomeLength = 30;

    @Option(
        name = "--population",
        usage =
            "A chromosome to include in the initial population. Can be repeated. Seeds count"
                + " towards --population-size")
    private List<String> population = new ArrayList<>();

    @Option(
        name = "--population-from-file",
        usage = "A population file whose chromosomes join the initial population. Can be"
            + " repeated")
    private List<String> populationFromFile = new ArrayList<>();

    @Option(
        name = "--population-autosave",
        usage = "A file the population is written to after every generation")
    private String populationAutosave = null;

    @Option(name = "--threads", usage = "The number of threads evaluating fitness")
    private int threads = Runtime.getRuntime().availableProcessors();

    @Option(
        name = "--show-initial-population",
        handler = BooleanOptionHandler.class,
        usage = "Prints the chromosomes of the initial population")
    private boolean showInitialPopulation = false;

    @Option(
        name = "--logging_level",
        usage = "The logging level (standard java.util.logging.Level values) for progress"
            + " messages")
    private String loggingLevel = Level.WARNING.getName();

    @Argument(metaVar = "FILE", usage = "The Yul programs making up the corpus")
    private List<String> corpus = new ArrayList<>();

    private final CmdLineParser parser = new CmdLineParser(this);
  }

  private final PrintStream out;
  private final PrintStream err;

  PhaserRunner(PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
  }

  /** Runs the search and returns the process exit status. */
  int run(String[] args) {
    Flags flags = new Flags();
    try {
      flags.parser.parseArgument(args);
      if (!flags.displayHelp) {
        checkFlags(flags);
      }
    } catch (CmdLineException e) {
      err.println(e.getMessage());
      flags.parser.printUsage(err);
      return 1;
    }
    if (flags.displayHelp) {
      flags.parser.printUsage(out);
      return 0;
    }
    try {
      Program.setLoggingLevel(Level.parse(flags.loggingLevel));
    } catch (IllegalArgumentException e) {
      err.println("Bad value for --logging_level: " + flags.loggingLevel);
      return 1;
    }

    long seed = flags.seed != null ? flags.seed : System.currentTimeMillis();
    logger.info("Random seed: " + seed);
    Random random = new Random(seed);

    List<Chromosome> initial = new ArrayList<>();
    try {
      for (String genes : flags.population) {
        initial.add(Chromosome.of(genes));
      }
      for (String file : flags.populationFromFile) {
        initial.addAll(PopulationFile.read(Paths.get(file)));
      }
    } catch (IllegalArgumentException | IOException e) {
      err.println("Invalid initial population: " + e.getMessage());
      return 1;
    }
    if (initial.size() > flags.populationSize) {
      err.println(
          "Invalid initial population: "
              + initial.size()
              + " chromosomes given but --population-size is "
              + flags.populationSize);
      return 1;
    }
    initial.addAll(
        RandomAlgorithm.randomChromosomes(
            flags.populationSize - initial.size(),
            flags.minChromosomeLength,
            flags.maxChromosomeLength,
            random));

    Corpus corpus;
    ErrorManager errorManager = new PrintStreamErrorManager(err);
    try {
      corpus = Corpus.load(toPaths(flags.corpus), errorManager);
    } catch (IOException e) {
      err.println("Cannot read corpus file: " + e.getMessage());
      return 1;
    } catch (InvalidProgramException e) {
      errorManager.generateReport();
      return 1;
    }
    if (errorManager.getWarningCount() > 0) {
      errorManager.generateReport();
    }

    if (flags.showInitialPopulation) {
      out.println("Initial population:");
      for (Chromosome chromosome : initial) {
        out.println(chromosome);
      }
    }

    SearchResult result;
    try (ParallelFitnessEvaluator evaluator =
        new ParallelFitnessEvaluator(
            corpus.metrics(metricFactory(flags)), flags.metricAggregator, flags.threads)) {
      AlgorithmRunner runner =
          new AlgorithmRunner(createAlgorithm(flags), evaluator, searchOptions(flags), random);
      result = runner.run(initial);
    } catch (IOException e) {
      err.println("Cannot save population: " + e.getMessage());
      return 1;
    }

    out.println("Best chromosome: " + result.best().getChromosome());
    out.println("Fitness: " + result.best().getFitness());
    out.println("Rounds: " + result.rounds());
    return 0;
  }

  private static void checkFlags(Flags flags) throws CmdLineException {
    if (flags.corpus.isEmpty()) {
      throw new CmdLineException(flags.parser, "Expected at least one corpus file");
    }
    if (flags.populationSize < 1) {
      throw new CmdLineException(flags.parser, "--population-size must be positive");
    }
    if (flags.minChromosomeLength < 0
        || flags.minChromosomeLength > flags.maxChromosomeLength) {
      throw new CmdLineException(
          flags.parser,
          "--min-chromosome-length must be between 0 and --max-chromosome-length");
    }
    if (flags.threads < 1 || flags.tournamentSize < 1 || flags.chromosomeRepetitions < 1) {
      throw new CmdLineException(
          flags.parser,
          "--threads, --tournament-size and --chromosome-repetitions must be positive");
    }
    if (flags.relativeMetricScale < 0 || flags.relativeMetricScale > 18) {
      throw new CmdLineException(flags.parser, "--relative-metric-scale must be in 0..18");
    }
    if ((flags.rounds != null && flags.rounds < 0)
        || (flags.timeBudget != null && flags.timeBudget < 0)
        || (flags.plateau != null && flags.plateau < 1)) {
      throw new CmdLineException(flags.parser, "Stopping conditions must not be negative");
    }
  }

  private static List<Path> toPaths(List<String> files) {
    List<Path> paths = new ArrayList<>();
    for (String file : files) {
      paths.add(Paths.get(file));
    }
    return paths;
  }

  private static Function<Program, FitnessMetric> metricFactory(Flags flags) {
    switch (flags.metric) {
      case CODE_SIZE:
        return program -> new ProgramSize(program, flags.chromosomeRepetitions);
      case RELATIVE_CODE_SIZE:
        return program ->
            new RelativeProgramSize(
                program, flags.chromosomeRepetitions, flags.relativeMetricScale);
    }
    throw new AssertionError(flags.metric);
  }

  private static GeneticAlgorithm createAlgorithm(Flags flags) {
    switch (flags.algorithm) {
      case RANDOM:
        return new RandomAlgorithm(
            new RandomAlgorithm.Options(
                0.5, flags.minChromosomeLength, flags.maxChromosomeLength));
      case GEWEP:
        return new GenerationalElitistWithExclusivePools(
            new GenerationalElitistWithExclusivePools.Options(
                0.25, 0.25, 0.9, 0.5, 0.1, 0.1));
      case CLASSIC:
        Selection selection =
            flags.selection == SelectionKind.TOURNAMENT
                ? Selections.tournament(flags.tournamentSize)
                : Selections.rouletteWheel();
        return new ClassicGeneticAlgorithm(
            new ClassicGeneticAlgorithm.Options(
                0.25, 0.75, 0.05, 0.05, 0.05, selection, Crossovers.randomPoint()));
    }
    throw new AssertionError(flags.algorithm);
  }

  private static SearchOptions searchOptions(Flags flags) {
    SearchOptions.Builder options = SearchOptions.builder();
    if (flags.rounds != null) {
      options.setMaxRounds(flags.rounds);
    }
    if (flags.timeBudget != null) {
      options.setTimeBudget(Duration.ofSeconds(flags.timeBudget));
    }
    if (flags.plateau != null) {
      options.setPlateauRounds(flags.plateau);
    }
    if (flags.populationAutosave != null) {
      options.setAutosaveFile(Paths.get(flags.populationAutosave));
    }
    return options.build();
  }

  public static void main(String[] args) {
    System.exit(new PhaserRunner(System.out, System.err).run(args));
  }
}
