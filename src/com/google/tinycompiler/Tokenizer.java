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

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.tinycompiler.parsing.Token;
import com.google.tinycompiler.parsing.TokenType;
import org.jspecify.annotations.Nullable;

/**
 * Splits s-expression source text into {@link Token}s.
 *
 * <p>Characters are classified in a fixed order: parentheses, whitespace, digits, a double quote
 * opening a string, ASCII letters. A byte order mark counts as whitespace. Digit and letter runs are consumed greedily. Strings have no escape
 * sequences and end at the next double quote.
 */
class Tokenizer {

  static final DiagnosticType UNRECOGNIZED_CHARACTER =
      DiagnosticType.error(
          "TC_UNRECOGNIZED_CHARACTER", "I don''t know what this character is: {0}");

  static final DiagnosticType UNTERMINATED_STRING =
      DiagnosticType.error("TC_UNTERMINATED_STRING", "Unterminated string literal");

  // Unicode whitespace and the byte order mark, but not NEL (U+0085).
  private static final CharMatcher WHITESPACE =
      CharMatcher.whitespace().or(CharMatcher.is('\uFEFF')).and(CharMatcher.isNot('\u0085'));
  private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');
  private static final CharMatcher LETTERS =
      CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('A', 'Z'));

  private final AbstractCompiler compiler;
  private final String source;
  private int current = 0;

  Tokenizer(AbstractCompiler compiler, String source) {
    this.compiler = compiler;
    this.source = source;
  }

  /**
   * Returns the tokens of the whole source, or null if a character could not be tokenized. The
   * problem has been reported to the compiler in that case.
   */
  @Nullable ImmutableList<Token> tokenize() {
    ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    while (current < source.length()) {
      char c = source.charAt(current);

      if (c == '(') {
        tokens.add(Token.openParen());
        current++;
      } else if (c == ')') {
        tokens.add(Token.closeParen());
        current++;
      } else if (WHITESPACE.matches(c)) {
        current++;
      } else if (DIGITS.matches(c)) {
        tokens.add(new Token(TokenType.NUMBER, consumeRun(DIGITS)));
      } else if (c == '"') {
        Token string = readString();
        if (string == null) {
          return null;
        }
        tokens.add(string);
      } else if (LETTERS.matches(c)) {
        tokens.add(new Token(TokenType.NAME, consumeRun(LETTERS)));
      } else {
        compiler.report(
            CompilerError.make(
                current,
                UNRECOGNIZED_CHARACTER,
                Character.toString(source.codePointAt(current))));
        return null;
      }
    }
    return tokens.build();
  }

  /** Consumes the longest run of characters matching {@code matcher} at the cursor. */
  private String consumeRun(CharMatcher matcher) {
    int start = current;
    while (current < source.length() && matcher.matches(source.charAt(current))) {
      current++;
    }
    return source.substring(start, current);
  }

  private @Nullable Token readString() {
    int openQuote = current;
    int closeQuote = source.indexOf('"', openQuote + 1);
    if (closeQuote < 0) {
      compiler.report(CompilerError.make(openQuote, UNTERMINATED_STRING));
      return null;
    }
    current = closeQuote + 1;
    return new Token(TokenType.STRING, source.substring(openQuote + 1, closeQuote));
  }
}
