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

/**
 * The kinds of {@link Node} in both the s-expression tree built by the parser and the call
 * expression tree built by the transformer.
 */
public enum Token {
  /** The root of either tree. Its children are the top-level statements. */
  PROGRAM,

  /**
   * A call. In the s-expression tree the callee name is the node's string and the children are the
   * parameters; in the call expression tree the first child is the {@link #NAME} callee and the
   * remaining children are the arguments.
   */
  CALL,

  /** A call used as a statement. Has exactly one child. */
  EXPR_RESULT,

  NAME,

  NUMBER,

  STRING;

  /** Whether nodes of this kind never have children. */
  public boolean isLeaf() {
    switch (this) {
      case NAME:
      case NUMBER:
      case STRING:
        return true;
      default:
        return false;
    }
  }
}
