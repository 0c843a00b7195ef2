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

package com.google.tinycompiler.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import java.util.List;

/**
 * An AST construction helper class.
 *
 * <p>The s-expression tree uses {@link #program}, {@link #sexpCall}, {@link #number} and {@link
 * #string}. The call expression tree additionally uses {@link #call}, {@link #exprResult} and
 * {@link #name}.
 */
public class IR {

  private IR() {}

  public static Node program() {
    return new Node(Token.PROGRAM);
  }

  public static Node program(Node... stmts) {
    Node program = program();
    for (Node stmt : stmts) {
      checkState(!stmt.isProgram(), stmt);
      program.addChildToBack(stmt);
    }
    return program;
  }

  public static Node program(List<Node> stmts) {
    return program(stmts.toArray(new Node[0]));
  }

  /** A call in the s-expression tree: {@code (name params...)}. */
  public static Node sexpCall(String name, Node... params) {
    checkArgument(!name.isEmpty(), "A call must have a name");
    Node call = Node.newString(Token.CALL, name);
    for (Node param : params) {
      checkState(mayBeSexpParam(param), param);
      call.addChildToBack(param);
    }
    return call;
  }

  /** A call in the call expression tree: {@code callee(args...)}. */
  public static Node call(Node callee, Node... args) {
    checkState(callee.isName(), callee);
    Node call = new Node(Token.CALL, callee);
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
      call.addChildToBack(arg);
    }
    return call;
  }

  public static Node exprResult(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.EXPR_RESULT, expr);
  }

  public static Node name(String name) {
    checkArgument(!name.isEmpty(), "A name must not be empty");
    return Node.newString(Token.NAME, name);
  }

  /** A number literal. The digits are kept as written. */
  public static Node number(String digits) {
    return Node.newString(Token.NUMBER, digits);
  }

  /** A string literal. The value excludes the quotes. */
  public static Node string(String value) {
    return Node.newString(Token.STRING, value);
  }

  private static boolean mayBeSexpParam(Node n) {
    return n.isCall() || n.isNumber() || n.isString();
  }

  private static boolean mayBeExpression(Node n) {
    return n.isCall() || n.isName() || n.isNumber() || n.isString();
  }
}
