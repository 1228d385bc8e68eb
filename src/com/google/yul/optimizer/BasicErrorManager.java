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
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * An error manager that collects diagnostics and generates a report sorted by source position
 * when {@link #generateReport()} is called. Subclasses decide where the report goes.
 */
public abstract class BasicErrorManager implements ErrorManager {

  private static final Comparator<YulError> BY_POSITION =
      Comparator.comparing((YulError e) -> e.sourceName() == null ? "" : e.sourceName())
          .thenComparingInt(YulError::lineno)
          .thenComparingInt(YulError::charno)
          .thenComparing(YulError::type);

  private final List<YulError> errors = new ArrayList<>();
  private final List<YulError> warnings = new ArrayList<>();

  @Override
  public synchronized void report(CheckLevel level, YulError error) {
    switch (level) {
      case ERROR:
        errors.add(error);
        break;
      case WARNING:
        warnings.add(error);
        break;
      case OFF:
        break;
    }
  }

  @Override
  public void generateReport() {
    List<YulError> sortedErrors = new ArrayList<>(getErrors());
    sortedErrors.sort(BY_POSITION);
    for (YulError error : sortedErrors) {
      println(CheckLevel.ERROR, error);
    }
    List<YulError> sortedWarnings = new ArrayList<>(getWarnings());
    sortedWarnings.sort(BY_POSITION);
    for (YulError warning : sortedWarnings) {
      println(CheckLevel.WARNING, warning);
    }
    printSummary();
  }

  /**
   * Print a message with a trailing new line. This method is called by the {@link
   * #generateReport()} method when generating messages.
   */
  public abstract void println(CheckLevel level, YulError error);

  /** Print the summary: number of errors and warnings. */
  protected abstract void printSummary();

  @Override
  public synchronized int getErrorCount() {
    return errors.size();
  }

  @Override
  public synchronized int getWarningCount() {
    return warnings.size();
  }

  @Override
  public synchronized ImmutableList<YulError> getErrors() {
    return ImmutableList.copyOf(errors);
  }

  @Override
  public synchronized ImmutableList<YulError> getWarnings() {
    return ImmutableList.copyOf(warnings);
  }
}
