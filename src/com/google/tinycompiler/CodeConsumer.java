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

/**
 * Abstracted consumer of the CodeGenerator output.
 *
 * @see CodeGenerator
 * @see CodePrinter
 */
abstract class CodeConsumer {
  private boolean stopped = false;

  /**
   * Provides a means of interrupting the CodeGenerator. Returns false once {@link #stop} has been
   * called.
   */
  boolean continueProcessing() {
    return !stopped;
  }

  /** Stops processing; nothing appended afterwards is kept. */
  void stop() {
    stopped = true;
  }

  /**
   * Appends a string to the code.
   *
   * <p>Do not directly append newlines with this method. Instead use {@link #startNewLine}.
   */
  abstract void append(String str);

  void add(String newcode) {
    append(newcode);
  }

  void addIdentifier(String identifier) {
    add(identifier);
  }

  void listSeparator() {
    add(",");
  }

  /** Indicates the end of a statement. */
  void endStatement() {
    append(";");
  }

  /** Separates two statements. */
  void startNewLine() {}

  void endFile() {}
}
