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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class DiagnosticGroupsTest {

  @Test
  public void testForName() {
    assertThat(DiagnosticGroups.forName("lexing")).isSameInstanceAs(DiagnosticGroups.LEXING);
    assertThat(DiagnosticGroups.forName("parsing")).isSameInstanceAs(DiagnosticGroups.PARSING);
    assertThat(DiagnosticGroups.forName("codeGeneration"))
        .isSameInstanceAs(DiagnosticGroups.CODE_GENERATION);
    assertThat(DiagnosticGroups.forName("linting")).isNull();
  }

  @Test
  public void testRegisteredGroupsInOrder() {
    assertThat(DiagnosticGroups.getRegisteredGroups().keySet())
        .containsExactly("lexing", "parsing", "codeGeneration")
        .inOrder();
  }

  @Test
  public void testGroupsDoNotOverlap() {
    assertThat(DiagnosticGroups.LEXING.getTypes())
        .containsExactly(Tokenizer.UNRECOGNIZED_CHARACTER, Tokenizer.UNTERMINATED_STRING);
    assertThat(DiagnosticGroups.PARSING.getTypes())
        .containsExactly(
            Parser.UNEXPECTED_TOKEN,
            Parser.EXPECTED_CALLEE,
            Parser.UNEXPECTED_END_OF_INPUT,
            Parser.TOO_DEEPLY_NESTED);
    assertThat(DiagnosticGroups.CODE_GENERATION.getTypes())
        .containsExactly(
            NodeTraversal.MALFORMED_TREE, CodeGenerator.MALFORMED_NODE, CodeGenerator.UNKNOWN_NODE);
  }

  @Test
  public void testMatchesByKey() {
    DiagnosticType sameKey = DiagnosticType.warning("TC_UNRECOGNIZED_CHARACTER", "other text");
    assertThat(DiagnosticGroups.LEXING.matches(sameKey)).isTrue();
    assertThat(DiagnosticGroups.PARSING.matches(sameKey)).isFalse();
  }

  @Test
  public void testMatchesError() {
    CompilerError error = CompilerError.make(3, Tokenizer.UNRECOGNIZED_CHARACTER, "%");
    assertThat(DiagnosticGroups.LEXING.matches(error)).isTrue();
    assertThat(error.description()).isEqualTo("I don't know what this character is: %");
    assertThat(error.format(CheckLevel.ERROR))
        .isEqualTo(
            "ERROR - [TC_UNRECOGNIZED_CHARACTER] I don't know what this character is: % (at offset 3)");
  }

  @Test
  public void testToString() {
    assertThat(DiagnosticGroups.PARSING.toString()).isEqualTo("DiagnosticGroup<parsing>");
  }
}
