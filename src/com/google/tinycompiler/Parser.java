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
import com.google.tinycompiler.ast.IR;
import com.google.tinycompiler.ast.Node;
import com.google.tinycompiler.parsing.Token;
import com.google.tinycompiler.parsing.TokenType;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A recursive descent parser building the s-expression tree from {@link Token}s.
 *
 * <pre>
 * program    := expression*
 * expression := NUMBER | STRING | '(' NAME expression* ')'
 * </pre>
 *
 * <p>The grammar is LL(1) on the token type. Parsing stops at the first error; every method that
 * can fail returns null after reporting it.
 */
class Parser {

  static final DiagnosticType UNEXPECTED_TOKEN =
      DiagnosticType.error("TC_UNEXPECTED_TOKEN", "Unexpected {0} ''{1}'' at token {2}");

  static final DiagnosticType EXPECTED_CALLEE =
      DiagnosticType.error(
          "TC_EXPECTED_CALLEE",
          "Expected a function name after ''('' but found {0} ''{1}'' at token {2}");

  static final DiagnosticType UNEXPECTED_END_OF_INPUT =
      DiagnosticType.error("TC_UNEXPECTED_END_OF_INPUT", "Unexpected end of input, expected {0}");

  static final DiagnosticType TOO_DEEPLY_NESTED =
      DiagnosticType.error(
          "TC_TOO_DEEPLY_NESTED", "Calls are nested more than {0} deep at token {1}");

  /** Deepest call nesting accepted. Every later phase recurses once per level. */
  static final int MAX_NESTING_DEPTH = 1000;

  private final AbstractCompiler compiler;
  private final ImmutableList<Token> tokens;
  private int current = 0;

  Parser(AbstractCompiler compiler, List<Token> tokens) {
    this.compiler = compiler;
    this.tokens = ImmutableList.copyOf(tokens);
  }

  /** Returns the PROGRAM node, or null if the tokens do not form a program. */
  @Nullable Node parse() {
    Node program = IR.program();
    while (current < tokens.size()) {
      Node expression = walk(0);
      if (expression == null) {
        return null;
      }
      program.addChildToBack(expression);
    }
    return program;
  }

  /** Parses one expression found inside {@code depth} enclosing calls. */
  private @Nullable Node walk(int depth) {
    Token token = tokens.get(current);
    switch (token.type) {
      case NUMBER:
        current++;
        return IR.number(token.value);
      case STRING:
        current++;
        return IR.string(token.value);
      case OPEN_PAREN:
        current++;
        return parseCall(depth + 1);
      default:
        reportUnexpected(UNEXPECTED_TOKEN, token);
        return null;
    }
  }

  /** Parses the rest of a call; the cursor is just past its open paren. */
  private @Nullable Node parseCall(int depth) {
    if (depth > MAX_NESTING_DEPTH) {
      compiler.report(
          CompilerError.make(
              TOO_DEEPLY_NESTED,
              String.valueOf(MAX_NESTING_DEPTH),
              String.valueOf(current - 1)));
      return null;
    }
    if (current >= tokens.size()) {
      compiler.report(CompilerError.make(UNEXPECTED_END_OF_INPUT, "a function name after '('"));
      return null;
    }
    Token name = tokens.get(current);
    if (name.type != TokenType.NAME) {
      reportUnexpected(EXPECTED_CALLEE, name);
      return null;
    }
    current++;

    Node call = IR.sexpCall(name.value);
    while (true) {
      if (current >= tokens.size()) {
        compiler.report(
            CompilerError.make(
                UNEXPECTED_END_OF_INPUT, "')' to close the call to " + name.value));
        return null;
      }
      if (tokens.get(current).type == TokenType.CLOSE_PAREN) {
        current++;
        return call;
      }
      Node param = walk(depth);
      if (param == null) {
        return null;
      }
      call.addChildToBack(param);
    }
  }

  private void reportUnexpected(DiagnosticType type, Token token) {
    compiler.report(
        CompilerError.make(
            type, describe(token.type), token.value, String.valueOf(current)));
  }

  private static String describe(TokenType type) {
    switch (type) {
      case OPEN_PAREN:
        return "open paren";
      case CLOSE_PAREN:
        return "close paren";
      case NUMBER:
        return "number";
      case STRING:
        return "string";
      case NAME:
        return "name";
    }
    throw new AssertionError(type);
  }
}
