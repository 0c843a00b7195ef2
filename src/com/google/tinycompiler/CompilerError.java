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

import static java.util.Objects.requireNonNull;

import com.google.tinycompiler.ast.Node;
import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/**
 * Compile error description.
 *
 * @param type A type of the error.
 * @param description Description of the error.
 * @param charno Zero-indexed character offset of the error in the source, or -1 if unknown.
 * @param node Node where the error occurred.
 * @param defaultLevel The level the error type is reported at.
 */
public record CompilerError(
    DiagnosticType type,
    String description,
    int charno,
    @Nullable Node node,
    CheckLevel defaultLevel)
    implements Serializable {
  public CompilerError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(defaultLevel, "defaultLevel");
  }

  private static final int DEFAULT_CHARNO = -1;

  /**
   * Creates a CompilerError with no source information
   *
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static CompilerError make(DiagnosticType type, String... arguments) {
    return new CompilerError(
        type, type.format(arguments), DEFAULT_CHARNO, null, type.level);
  }

  /**
   * Creates a CompilerError at a character offset of the source.
   *
   * @param charno Zero-indexed offset of the offending character
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static CompilerError make(int charno, DiagnosticType type, String... arguments) {
    return new CompilerError(type, type.format(arguments), charno, null, type.level);
  }

  /**
   * Creates a CompilerError for a node of a tree.
   *
   * @param n The offending node
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static CompilerError make(Node n, DiagnosticType type, String... arguments) {
    return new CompilerError(type, type.format(arguments), DEFAULT_CHARNO, n, type.level);
  }

  /** Formats this error for display, e.g. {@code ERROR - [TC_KEY] description}. */
  public String format(CheckLevel level) {
    StringBuilder sb = new StringBuilder();
    sb.append(level).append(" - [").append(type.key).append("] ").append(description);
    if (charno >= 0) {
      sb.append(" (at offset ").append(charno).append(')');
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return type.key + ". " + description + (charno >= 0 ? " at offset " + charno : "");
  }
}
