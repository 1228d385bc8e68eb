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

import static java.util.Objects.requireNonNull;

import com.google.yul.ir.Node;
import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/**
 * Parse or analysis error description.
 *
 * @param type A type of the error.
 * @param description Description of the error.
 * @param sourceName Name of the source
 * @param lineno One-indexed line number of the error location.
 * @param charno Zero-indexed character number of the error location.
 */
public record YulError(
    DiagnosticType type, String description, @Nullable String sourceName, int lineno, int charno)
    implements Serializable {
  public YulError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
  }

  /**
   * Creates a YulError with no source information
   *
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static YulError make(DiagnosticType type, String... arguments) {
    return new YulError(type, type.format(arguments), null, -1, -1);
  }

  /**
   * Creates a YulError at a given source location
   *
   * @param sourceName The source file name
   * @param lineno Line number with source file, or -1 if unknown
   * @param charno Column number within line, or -1 for whole line.
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static YulError make(
      String sourceName, int lineno, int charno, DiagnosticType type, String... arguments) {
    return new YulError(type, type.format(arguments), sourceName, lineno, charno);
  }

  /**
   * Creates a YulError from a source name and node position.
   *
   * @param sourceName The source file name
   * @param n Determines the line and char position
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static YulError make(
      String sourceName, Node n, DiagnosticType type, String... arguments) {
    return make(sourceName, n.getLineno(), n.getCharno(), type, arguments);
  }

  /** Formats as {@code source:line:column: ERROR - description}. */
  public String format(CheckLevel level) {
    StringBuilder b = new StringBuilder();
    if (sourceName != null) {
      b.append(sourceName);
      if (lineno > 0) {
        b.append(':').append(lineno);
        if (charno >= 0) {
          b.append(':').append(charno);
        }
      }
      b.append(": ");
    }
    b.append(level).append(" - ").append(description);
    return b.toString();
  }

  @Override
  public String toString() {
    return type.key + ". " + format(type.level);
  }
}
