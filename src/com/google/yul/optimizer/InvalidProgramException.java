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

/** Thrown when Yul source fails to parse or analyze. */
public class InvalidProgramException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ImmutableList<YulError> errors;

  public InvalidProgramException(ImmutableList<YulError> errors) {
    super(errors.isEmpty() ? "Invalid program" : errors.get(0).format(CheckLevel.ERROR));
    this.errors = errors;
  }

  /** All errors reported for the program, in reporting order. */
  public ImmutableList<YulError> getErrors() {
    return errors;
  }
}
