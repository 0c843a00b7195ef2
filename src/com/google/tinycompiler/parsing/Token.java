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

package com.google.tinycompiler.parsing;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.Immutable;
import java.util.Objects;

/**
 * A lexical token. For a {@link TokenType#STRING} the value excludes the surrounding quotes; for
 * every other type it is the text exactly as it appeared in the source.
 */
@Immutable
public final class Token {
  public final TokenType type;
  public final String value;

  public Token(TokenType type, String value) {
    this.type = checkNotNull(type);
    this.value = checkNotNull(value);
  }

  public static Token openParen() {
    return new Token(TokenType.OPEN_PAREN, "(");
  }

  public static Token closeParen() {
    return new Token(TokenType.CLOSE_PAREN, ")");
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Token
        && ((Token) other).type == type
        && ((Token) other).value.equals(value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, value);
  }

  @Override
  public String toString() {
    return type + " " + value;
  }
}
