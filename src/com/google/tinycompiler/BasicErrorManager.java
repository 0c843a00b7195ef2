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

package com.google.tinycompiler;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * An error manager that collects errors and warnings and replays them, in the order they were
 * reported, when the {@link #generateReport()} method is called.
 *
 * <p>This error manager does not produce any output, but subclasses can override the {@link
 * #println(CheckLevel, CompilerError)} method to generate custom output.
 */
public abstract class BasicErrorManager implements ErrorManager {
  private final List<CompilerError> errors = new ArrayList<>();
  private final List<CompilerError> warnings = new ArrayList<>();

  @Override
  public void report(CheckLevel level, CompilerError error) {
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
    for (CompilerError error : errors) {
      println(CheckLevel.ERROR, error);
    }
    for (CompilerError warning : warnings) {
      println(CheckLevel.WARNING, warning);
    }
    printSummary();
  }

  /**
   * Print a message with a trailing new line. This method is called by the
   * {@link #generateReport()} method when generating messages.
   */
  public abstract void println(CheckLevel level, CompilerError error);

  /**
   * Print the summary of the compilation - number of errors and warnings.
   */
  protected abstract void printSummary();

  @Override
  public int getErrorCount() {
    return errors.size();
  }

  @Override
  public int getWarningCount() {
    return warnings.size();
  }

  @Override
  public ImmutableList<CompilerError> getErrors() {
    return ImmutableList.copyOf(errors);
  }

  @Override
  public ImmutableList<CompilerError> getWarnings() {
    return ImmutableList.copyOf(warnings);
  }
}
