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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.yul.ir.CharStream;
import com.google.yul.ir.Node;
import com.google.yul.ir.YulParser;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * A Yul program in normalized form, ready to be optimized.
 *
 * <p>{@link #load} parses and analyzes the source and then normalizes the tree: names are made
 * unique, function definitions are moved to the end of the top-level block, the remaining
 * top-level statements are grouped into one block and for loop init blocks are emptied. Steps
 * applied with {@link #optimise} rewrite the tree in place.
 */
public final class Program {
  private static final Logger logger = Logger.getLogger(Program.class.getName());

  /** Parent of every logger in the project. */
  private static final Logger rootLogger = Logger.getLogger("com.google.yul");

  static final DiagnosticType PARSE_ERROR = DiagnosticType.error("YUL_PARSE_ERROR", "{0}");

  private final Node root;
  private final String sourceName;
  private boolean validityCheck = false;

  private Program(Node root, String sourceName) {
    this.root = root;
    this.sourceName = sourceName;
  }

  /** Loads a program, logging any errors. */
  public static Program load(CharStream source) throws InvalidProgramException {
    ErrorManager errorManager = new LoggerErrorManager(logger);
    try {
      return load(source, errorManager);
    } catch (InvalidProgramException e) {
      errorManager.generateReport();
      throw e;
    }
  }

  /**
   * Loads a program. The stream is read from its beginning regardless of its current position.
   *
   * @param errorManager receives parse and analysis errors
   * @throws InvalidProgramException if the source does not parse or fails analysis
   */
  public static Program load(CharStream source, ErrorManager errorManager)
      throws InvalidProgramException {
    int errorsBefore = errorManager.getErrorCount();
    YulParser parser =
        new YulParser(
            (message, sourceName, line, lineOffset) ->
                errorManager.report(
                    CheckLevel.ERROR,
                    YulError.make(sourceName, line, lineOffset, PARSE_ERROR, message)));
    Node root = parser.parse(source);
    if (root == null) {
      throw invalidProgram(errorManager, errorsBefore);
    }

    ScopeAnalyzer analyzer = new ScopeAnalyzer(errorManager, source.getName());
    if (!analyzer.analyze(root)) {
      throw invalidProgram(errorManager, errorsBefore);
    }
    normalize(root, analyzer.getReferences());
    logger.fine("Loaded " + source.getName());
    return new Program(root, source.getName());
  }

  /** Sets the logging level for all com.google.yul packages. Null inherits the parent's level. */
  public static void setLoggingLevel(@Nullable Level level) {
    rootLogger.setLevel(level);
  }

  private static InvalidProgramException invalidProgram(ErrorManager errorManager, int skip) {
    List<YulError> errors = errorManager.getErrors();
    return new InvalidProgramException(
        ImmutableList.copyOf(errors.subList(skip, errors.size())));
  }

  private static void normalize(Node root, Map<Node, Node> references) {
    new Disambiguator(references).process(root);
    new FunctionHoister().process(root);
    new FunctionGrouper().process(root);
    new ForLoopInitRewriter().process(root);
  }

  /**
   * Enables re-analysis of the tree after every step. A step that breaks the tree then fails with
   * an {@link IllegalStateException}.
   */
  @CanIgnoreReturnValue
  public Program setValidityCheck(boolean validityCheck) {
    this.validityCheck = validityCheck;
    return this;
  }

  /**
   * Applies the named steps in order.
   *
   * @throws UnknownStepException if any name is not registered; the program is left unchanged
   */
  public void optimise(List<String> stepNames) {
    optimise(StepSequence.ofNames(stepNames));
  }

  /**
   * Applies a sequence of step abbreviations.
   *
   * @throws InvalidOptimizerStepException if the sequence is malformed; the program is left
   *     unchanged
   */
  public void optimise(String sequence) {
    optimise(StepSequence.parse(sequence));
  }

  public void optimise(StepSequence sequence) {
    PhaseOptimizer optimizer = new PhaseOptimizer(OptimizerContext.forRoot(root));
    if (validityCheck) {
      optimizer.setValidityCheck(new ValidityCheck(sourceName));
    }
    optimizer.process(sequence, root);
  }

  /** The code size including function definitions. */
  public int codeSize() {
    return CodeSize.codeSizeIncludingFunctions(root);
  }

  public int codeSize(boolean includeFunctions) {
    return includeFunctions ? CodeSize.codeSizeIncludingFunctions(root) : CodeSize.codeSize(root);
  }

  public String toJson() {
    return JsonAstConverter.toJson(root);
  }

  /** The top-level block. Changes to the tree change the program. */
  public Node getAst() {
    return root;
  }

  public String getSourceName() {
    return sourceName;
  }

  /** A deep copy that can be optimized independently of this program. */
  public Program cloneProgram() {
    return new Program(root.cloneTree(), sourceName).setValidityCheck(validityCheck);
  }

  /** The program as pretty-printed Yul source. */
  @Override
  public String toString() {
    return new CodePrinter.Builder(root).setPrettyPrint(true).build();
  }
}
