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

package com.google.yul.optimizer;

import com.google.yul.ir.CharStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.spi.BooleanOptionHandler;

/**
 * Loads a Yul file, applies a step sequence to it and prints the result.
 *
 * <pre>
 * OptimizerRunner --steps 'dhfo[xsjtu]' program.yul
 * </pre>
 *
 * The step sequence is checked before the input is read.
 */
public class OptimizerRunner {

  private static class Flags {
    @Option(
        name = "--help",
        handler = BooleanOptionHandler.class,
        usage = "Displays this message on stdout and exit")
    private boolean displayHelp = false;

    @Option(
        name = "--steps",
        usage = "The optimizer steps to apply, as a sequence of step abbreviations. A bracketed"
            + " group is repeated until the code size stops changing")
    private String steps = "";

    @Option(
        name = "--json",
        handler = BooleanOptionHandler.class,
        usage = "Prints the optimized program as a JSON tree instead of Yul source")
    private boolean json = false;

    @Option(
        name = "--code_size",
        handler = BooleanOptionHandler.class,
        usage = "Prints the code size of the program before and after optimization")
    private boolean codeSize = false;

    @Option(
        name = "--logging_level",
        usage = "The logging level (standard java.util.logging.Level values) for progress"
            + " messages. Does not control errors in the Yul input")
    private String loggingLevel = Level.WARNING.getName();

    @Argument(metaVar = "FILE", usage = "The Yul file to optimize")
    private List<String> arguments = new ArrayList<>();

    private final CmdLineParser parser = new CmdLineParser(this);
  }

  private final PrintStream out;
  private final PrintStream err;

  OptimizerRunner(PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
  }

  /** Runs the optimizer and returns the process exit status. */
  int run(String[] args) {
    Flags flags = new Flags();
    try {
      flags.parser.parseArgument(args);
      if (!flags.displayHelp && flags.arguments.size() != 1) {
        throw new CmdLineException(flags.parser, "Expected exactly one input file");
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

    StepSequence sequence;
    try {
      sequence = StepSequence.parse(flags.steps);
    } catch (InvalidOptimizerStepException e) {
      err.println(e.getMessage());
      return 1;
    }

    ErrorManager errorManager = new PrintStreamErrorManager(err);
    Program program;
    try {
      program = Program.load(CharStream.fromFile(Paths.get(flags.arguments.get(0))), errorManager);
    } catch (IOException e) {
      err.println("Cannot read " + flags.arguments.get(0) + ": " + e.getMessage());
      return 1;
    } catch (InvalidProgramException e) {
      errorManager.generateReport();
      return 1;
    }
    if (errorManager.getWarningCount() > 0) {
      errorManager.generateReport();
    }

    int sizeBefore = program.codeSize();
    program.optimise(sequence);
    out.println(flags.json ? program.toJson() : program.toString());
    if (flags.codeSize) {
      out.println("Code size: " + sizeBefore + " -> " + program.codeSize());
    }
    return 0;
  }

  public static void main(String[] args) {
    System.exit(new OptimizerRunner(System.out, System.err).run(args));
  }
}
