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

import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/**
 * The built-in functions of the EVM flavour of Yul. Arguments of every call are evaluated right
 * to left.
 */
public final class Builtins {

  /**
   * A built-in function.
   *
   * @param sideEffectFree the call can be removed if its result is unused
   * @param movable the call can be reordered with respect to other movable code; implies
   *     side-effect free
   * @param terminating the call never returns control to the caller
   */
  public record BuiltinFunction(
      String name,
      int parameterCount,
      int returnCount,
      boolean sideEffectFree,
      boolean movable,
      boolean terminating) {}

  private static final ImmutableMap<String, BuiltinFunction> FUNCTIONS = buildTable();

  private Builtins() {}

  public static @Nullable BuiltinFunction get(String name) {
    return FUNCTIONS.get(name);
  }

  public static boolean isBuiltin(String name) {
    return FUNCTIONS.containsKey(name);
  }

  public static ImmutableMap<String, BuiltinFunction> all() {
    return FUNCTIONS;
  }

  private static ImmutableMap<String, BuiltinFunction> buildTable() {
    ImmutableMap.Builder<String, BuiltinFunction> table = ImmutableMap.builder();

    for (String name :
        new String[] {
          "add", "sub", "mul", "div", "sdiv", "mod", "smod", "exp", "lt", "gt", "slt", "sgt",
          "eq", "and", "or", "xor", "byte", "shl", "shr", "sar", "signextend"
        }) {
      movable(table, name, 2);
    }
    movable(table, "not", 1);
    movable(table, "iszero", 1);
    movable(table, "addmod", 3);
    movable(table, "mulmod", 3);
    movable(table, "calldataload", 1);
    movable(table, "blockhash", 1);
    for (String name :
        new String[] {
          "address", "origin", "caller", "callvalue", "calldatasize", "codesize", "gasprice",
          "coinbase", "timestamp", "number", "difficulty", "prevrandao", "gaslimit", "chainid",
          "basefee"
        }) {
      movable(table, name, 0);
    }
    table.put("pop", new BuiltinFunction("pop", 1, 0, true, true, false));

    // Readers of state that may change between two evaluations.
    for (String name : new String[] {"returndatasize", "selfbalance", "gas", "msize"}) {
      reader(table, name, 0);
    }
    for (String name : new String[] {"mload", "sload", "balance", "extcodesize", "extcodehash"}) {
      reader(table, name, 1);
    }
    reader(table, "keccak256", 2);

    effect(table, "mstore", 2, 0);
    effect(table, "mstore8", 2, 0);
    effect(table, "sstore", 2, 0);
    effect(table, "calldatacopy", 3, 0);
    effect(table, "codecopy", 3, 0);
    effect(table, "returndatacopy", 3, 0);
    effect(table, "extcodecopy", 4, 0);
    for (int topics = 0; topics <= 4; topics++) {
      effect(table, "log" + topics, 2 + topics, 0);
    }
    effect(table, "create", 3, 1);
    effect(table, "create2", 4, 1);
    effect(table, "call", 7, 1);
    effect(table, "callcode", 7, 1);
    effect(table, "delegatecall", 6, 1);
    effect(table, "staticcall", 6, 1);

    terminating(table, "stop", 0);
    terminating(table, "invalid", 0);
    terminating(table, "return", 2);
    terminating(table, "revert", 2);
    terminating(table, "selfdestruct", 1);
    return table.buildOrThrow();
  }

  private static void movable(
      ImmutableMap.Builder<String, BuiltinFunction> table, String name, int parameters) {
    table.put(name, new BuiltinFunction(name, parameters, 1, true, true, false));
  }

  private static void reader(
      ImmutableMap.Builder<String, BuiltinFunction> table, String name, int parameters) {
    table.put(name, new BuiltinFunction(name, parameters, 1, true, false, false));
  }

  private static void effect(
      ImmutableMap.Builder<String, BuiltinFunction> table, String name, int parameters, int rets) {
    table.put(name, new BuiltinFunction(name, parameters, rets, false, false, false));
  }

  private static void terminating(
      ImmutableMap.Builder<String, BuiltinFunction> table, String name, int parameters) {
    table.put(name, new BuiltinFunction(name, parameters, 0, false, false, true));
  }
}
