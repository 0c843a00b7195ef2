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

/**
 * The error manager is in charge of storing, organizing and displaying errors and warnings
 * reported during a compilation.
 */
public interface ErrorManager {

  /**
   * Reports an error. The level decides whether it counts as an error or a warning; errors and
   * warnings at {@link CheckLevel#OFF} are dropped.
   */
  void report(CheckLevel level, CompilerError error);

  /** Writes a report of everything reported so far to the manager's destination. */
  void generateReport();

  int getErrorCount();

  int getWarningCount();

  /** Errors in the order they were reported. */
  ImmutableList<CompilerError> getErrors();

  /** Warnings in the order they were reported. */
  ImmutableList<CompilerError> getWarnings();

  default boolean hasErrors() {
    return getErrorCount() > 0;
  }
}
