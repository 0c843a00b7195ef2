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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.tinycompiler.ast.IR;
import com.google.tinycompiler.ast.Node;
import com.google.tinycompiler.ast.Token;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.logging.Logger;

/**
 * Rewrites the s-expression tree into the call expression tree.
 *
 * <pre>
 * PROGRAM                    PROGRAM
 *   CALL add                   EXPR_RESULT
 *     NUMBER 2        =>         CALL
 *     CALL subtract                NAME add
 *       NUMBER 3                   NUMBER 2
 *       NUMBER 7                   CALL
 *                                    NAME subtract
 *                                    NUMBER 3
 *                                    NUMBER 7
 * </pre>
 *
 * <p>Top-level calls become statements; calls nested as arguments stay bare expressions. The
 * source tree is not modified.
 */
class Transformer {
  private static final Logger logger = Logger.getLogger(Transformer.class.getName());

  private final AbstractCompiler compiler;

  Transformer(AbstractCompiler compiler) {
    this.compiler = compiler;
  }

  /** Returns a new PROGRAM holding the call expression form of {@code sourceProgram}. */
  Node transform(Node sourceProgram) {
    checkArgument(sourceProgram.isProgram(), sourceProgram);
    Node targetProgram = IR.program();

    // The node whose children are being built is on top. Entering a call pushes the new target
    // call so that its parameters land in its arguments; leaving it pops.
    Deque<Node> openNodes = new ArrayDeque<>();
    openNodes.push(targetProgram);

    NodeVisitor visitor =
        NodeVisitor.builder()
            .enter(
                Token.NUMBER,
                (t, n, parent) -> openNodes.peek().addChildToBack(IR.number(n.getString())))
            .enter(
                Token.STRING,
                (t, n, parent) -> openNodes.peek().addChildToBack(IR.string(n.getString())))
            .enter(
                Token.CALL,
                (t, n, parent) -> {
                  Node call = IR.call(IR.name(n.getString()));
                  boolean isArgument = parent != null && parent.isCall();
                  openNodes.peek().addChildToBack(isArgument ? call : IR.exprResult(call));
                  openNodes.push(call);
                })
            .exit(Token.CALL, (t, n, parent) -> openNodes.pop())
            .build();

    NodeTraversal.traverse(compiler, sourceProgram, visitor);

    if (!compiler.hasErrors()) {
      checkState(openNodes.pop() == targetProgram && openNodes.isEmpty());
      logger.finest("Transformed " + targetProgram.getChildCount() + " statement(s)");
    }
    return targetProgram;
  }
}
