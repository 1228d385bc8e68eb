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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import org.jspecify.annotations.Nullable;

/** The catalog of optimizer steps, indexed by name and by abbreviation. */
public final class OptimizerSteps {

  static final PassFactory blockFlattener =
      PassFactory.builder()
          .setName(PassNames.BLOCK_FLATTENER)
          .setAbbreviation('f')
          .setInternalFactory((context) -> new BlockFlattener())
          .build();

  static final PassFactory circularReferencesPruner =
      PassFactory.builder()
          .setName(PassNames.CIRCULAR_REFERENCES_PRUNER)
          .setAbbreviation('l')
          .setInternalFactory((context) -> new CircularReferencesPruner())
          .build();

  static final PassFactory controlFlowSimplifier =
      PassFactory.builder()
          .setName(PassNames.CONTROL_FLOW_SIMPLIFIER)
          .setAbbreviation('n')
          .setInternalFactory((context) -> new ControlFlowSimplifier())
          .build();

  static final PassFactory deadCodeEliminator =
      PassFactory.builder()
          .setName(PassNames.DEAD_CODE_ELIMINATOR)
          .setAbbreviation('D')
          .setInternalFactory((context) -> new DeadCodeEliminator())
          .build();

  static final PassFactory equivalentFunctionCombiner =
      PassFactory.builder()
          .setName(PassNames.EQUIVALENT_FUNCTION_COMBINER)
          .setAbbreviation('v')
          .setInternalFactory((context) -> new EquivalentFunctionCombiner())
          .build();

  static final PassFactory expressionJoiner =
      PassFactory.builder()
          .setName(PassNames.EXPRESSION_JOINER)
          .setAbbreviation('j')
          .setInternalFactory((context) -> new ExpressionJoiner())
          .build();

  static final PassFactory expressionSimplifier =
      PassFactory.builder()
          .setName(PassNames.EXPRESSION_SIMPLIFIER)
          .setAbbreviation('s')
          .setInternalFactory((context) -> new ExpressionSimplifier())
          .build();

  static final PassFactory expressionSplitter =
      PassFactory.builder()
          .setName(PassNames.EXPRESSION_SPLITTER)
          .setAbbreviation('x')
          .setInternalFactory((context) -> new ExpressionSplitter(context.getNameDispenser()))
          .build();

  static final PassFactory forLoopConditionIntoBody =
      PassFactory.builder()
          .setName(PassNames.FOR_LOOP_CONDITION_INTO_BODY)
          .setAbbreviation('I')
          .setInternalFactory((context) -> new ForLoopConditionIntoBody())
          .build();

  static final PassFactory forLoopConditionOutOfBody =
      PassFactory.builder()
          .setName(PassNames.FOR_LOOP_CONDITION_OUT_OF_BODY)
          .setAbbreviation('O')
          .setInternalFactory((context) -> new ForLoopConditionOutOfBody())
          .build();

  static final PassFactory forLoopInitRewriter =
      PassFactory.builder()
          .setName(PassNames.FOR_LOOP_INIT_REWRITER)
          .setAbbreviation('o')
          .setInternalFactory((context) -> new ForLoopInitRewriter())
          .build();

  static final PassFactory functionGrouper =
      PassFactory.builder()
          .setName(PassNames.FUNCTION_GROUPER)
          .setAbbreviation('g')
          .setInternalFactory((context) -> new FunctionGrouper())
          .build();

  static final PassFactory functionHoister =
      PassFactory.builder()
          .setName(PassNames.FUNCTION_HOISTER)
          .setAbbreviation('h')
          .setInternalFactory((context) -> new FunctionHoister())
          .build();

  static final PassFactory structuralSimplifier =
      PassFactory.builder()
          .setName(PassNames.STRUCTURAL_SIMPLIFIER)
          .setAbbreviation('t')
          .setInternalFactory((context) -> new StructuralSimplifier())
          .build();

  static final PassFactory unusedPruner =
      PassFactory.builder()
          .setName(PassNames.UNUSED_PRUNER)
          .setAbbreviation('u')
          .setInternalFactory((context) -> new UnusedPruner())
          .build();

  static final PassFactory varDeclInitializer =
      PassFactory.builder()
          .setName(PassNames.VAR_DECL_INITIALIZER)
          .setAbbreviation('d')
          .setInternalFactory((context) -> new VarDeclInitializer())
          .build();

  private static final ImmutableList<PassFactory> ALL =
      ImmutableList.of(
          blockFlattener,
          circularReferencesPruner,
          controlFlowSimplifier,
          deadCodeEliminator,
          equivalentFunctionCombiner,
          expressionJoiner,
          expressionSimplifier,
          expressionSplitter,
          forLoopConditionIntoBody,
          forLoopConditionOutOfBody,
          forLoopInitRewriter,
          functionGrouper,
          functionHoister,
          structuralSimplifier,
          unusedPruner,
          varDeclInitializer);

  // uniqueIndex rejects duplicate names and abbreviations.
  private static final ImmutableMap<String, PassFactory> BY_NAME =
      Maps.uniqueIndex(ALL, PassFactory::getName);

  private static final ImmutableMap<Character, PassFactory> BY_ABBREVIATION =
      Maps.uniqueIndex(ALL, PassFactory::getAbbreviation);

  private OptimizerSteps() {}

  /** All registered steps in alphabetical order of their names. */
  public static ImmutableList<PassFactory> all() {
    return ALL;
  }

  /** The abbreviations of all steps, in the order of {@link #all()}. */
  public static String allAbbreviations() {
    StringBuilder sb = new StringBuilder();
    for (PassFactory step : ALL) {
      sb.append(step.getAbbreviation());
    }
    return sb.toString();
  }

  public static @Nullable PassFactory forName(String name) {
    return BY_NAME.get(name);
  }

  public static @Nullable PassFactory forAbbreviation(char abbreviation) {
    return BY_ABBREVIATION.get(abbreviation);
  }
}
