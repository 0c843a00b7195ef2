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

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Named groups of DiagnosticTypes, one per phase of the compilation.
 */
public final class DiagnosticGroups {

  private DiagnosticGroups() {}

  private static final Map<String, DiagnosticGroup> groupsByName = new LinkedHashMap<>();

  static DiagnosticGroup registerGroup(String name, DiagnosticType... types) {
    DiagnosticGroup group = new DiagnosticGroup(name, types);
    groupsByName.put(name, group);
    return group;
  }

  /** Characters the tokenizer cannot turn into tokens. */
  public static final DiagnosticGroup LEXING =
      DiagnosticGroups.registerGroup(
          "lexing", Tokenizer.UNRECOGNIZED_CHARACTER, Tokenizer.UNTERMINATED_STRING);

  /** Token sequences that do not form s-expressions. */
  public static final DiagnosticGroup PARSING =
      DiagnosticGroups.registerGroup(
          "parsing",
          Parser.UNEXPECTED_TOKEN,
          Parser.EXPECTED_CALLEE,
          Parser.UNEXPECTED_END_OF_INPUT,
          Parser.TOO_DEEPLY_NESTED);

  /**
   * Trees the traversal or the code generator cannot handle. Only hand-built trees produce these.
   */
  public static final DiagnosticGroup CODE_GENERATION =
      DiagnosticGroups.registerGroup(
          "codeGeneration",
          NodeTraversal.MALFORMED_TREE,
          CodeGenerator.MALFORMED_NODE,
          CodeGenerator.UNKNOWN_NODE);

  /** Find the diagnostic group registered under the given name. */
  public static @Nullable DiagnosticGroup forName(String name) {
    return groupsByName.get(name);
  }

  /** Get the registered diagnostic groups, indexed by name. */
  public static ImmutableMap<String, DiagnosticGroup> getRegisteredGroups() {
    return ImmutableMap.copyOf(groupsByName);
  }
}
