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

package com.google.yul.ir;

/** This interface defines the protocol for reporting errors during parsing. */
public interface ErrorReporter {
  /**
   * Report an error.
   *
   * @param message a String describing the error
   * @param sourceName a String describing the source, such as a filename
   * @param line the one-based line number
   * @param lineOffset the zero-based column of the offending token
   */
  void error(String message, String sourceName, int line, int lineOffset);
}
