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

import java.io.Serializable;
import java.text.MessageFormat;

/**
 * The kind of a diagnostic reported while loading a program. Two diagnostics of the same kind
 * share a key; the description is a {@link MessageFormat} pattern filled in per report.
 */
public final class DiagnosticType implements Comparable<DiagnosticType>, Serializable {
  private static final long serialVersionUID = 1;

  public final String key;

  public final String format;

  /** The level reports of this kind are filed at. */
  public final CheckLevel level;

  /** A diagnostic that makes the program invalid. */
  public static DiagnosticType error(String key, String format) {
    return new DiagnosticType(key, CheckLevel.ERROR, format);
  }

  /** A diagnostic that is reported but still lets the program load. */
  public static DiagnosticType warning(String key, String format) {
    return new DiagnosticType(key, CheckLevel.WARNING, format);
  }

  private DiagnosticType(String key, CheckLevel level, String format) {
    this.key = key;
    this.level = level;
    this.format = format;
  }

  String format(String... arguments) {
    return MessageFormat.format(format, (Object[]) arguments);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof DiagnosticType && ((DiagnosticType) other).key.equals(key);
  }

  @Override
  public int hashCode() {
    return key.hashCode();
  }

  @Override
  public int compareTo(DiagnosticType other) {
    return key.compareTo(other.key);
  }

  @Override
  public String toString() {
    return key + ": " + format;
  }
}
