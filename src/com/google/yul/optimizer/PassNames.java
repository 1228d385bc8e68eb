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

/** Names of the optimizer steps. */
public final class PassNames {
  public static final String BLOCK_FLATTENER = "BlockFlattener";
  public static final String CIRCULAR_REFERENCES_PRUNER = "CircularReferencesPruner";
  public static final String CONTROL_FLOW_SIMPLIFIER = "ControlFlowSimplifier";
  public static final String DEAD_CODE_ELIMINATOR = "DeadCodeEliminator";
  public static final String EQUIVALENT_FUNCTION_COMBINER = "EquivalentFunctionCombiner";
  public static final String EXPRESSION_JOINER = "ExpressionJoiner";
  public static final String EXPRESSION_SIMPLIFIER = "ExpressionSimplifier";
  public static final String EXPRESSION_SPLITTER = "ExpressionSplitter";
  public static final String FOR_LOOP_CONDITION_INTO_BODY = "ForLoopConditionIntoBody";
  public static final String FOR_LOOP_CONDITION_OUT_OF_BODY = "ForLoopConditionOutOfBody";
  public static final String FOR_LOOP_INIT_REWRITER = "ForLoopInitRewriter";
  public static final String FUNCTION_GROUPER = "FunctionGrouper";
  public static final String FUNCTION_HOISTER = "FunctionHoister";
  public static final String STRUCTURAL_SIMPLIFIER = "StructuralSimplifier";
  public static final String UNUSED_PRUNER = "UnusedPruner";
  public static final String VAR_DECL_INITIALIZER = "VarDeclInitializer";

  private PassNames() {}
}
