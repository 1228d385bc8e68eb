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

/** Thrown when a step sequence does not follow the step sequence grammar. */
public class InvalidOptimizerStepException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String token;
  private final int position;

  /**
   * @param token the offending part of the sequence
   * @param position zero-based index of the token in the sequence
   */
  public InvalidOptimizerStepException(String message, String token, int position) {
    super(message + ": '" + token + "' at position " + position);
    this.token = token;
    this.position = position;
  }

  public String getToken() {
    return token;
  }

  public int getPosition() {
    return position;
  }
}
