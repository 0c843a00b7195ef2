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

import java.io.PrintStream;

/**
 * An error manager that prints errors and warnings to the print stream
 * provided in addition to the functionality of the {@link BasicErrorManager}.
 */
public class PrintStreamErrorManager extends BasicErrorManager {
  private final PrintStream stream;

  /**
   * Creates an error manager.
   * @param stream the stream on which the errors and warnings should be
   *     printed. This class does not close the stream
   */
  public PrintStreamErrorManager(PrintStream stream) {
    this.stream = stream;
  }

  @Override
  public void println(CheckLevel level, CompilerError error) {
    stream.println(error.format(level));
  }

  @Override
  public void printSummary() {
    if (getErrorCount() + getWarningCount() > 0) {
      stream.format("%d error(s), %d warning(s)%n", getErrorCount(),
          getWarningCount());
    }
  }
}
