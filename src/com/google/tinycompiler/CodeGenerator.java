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

import com.google.tinycompiler.ast.Node;

/**
 * CodeGenerator generates code from a call expression tree, sending it to the specified
 * CodeConsumer.
 *
 * <p>Problems are reported to the compiler and stop the consumer, so a tree that cannot be printed
 * never yields partial code.
 */
class CodeGenerator {

  static final DiagnosticType MALFORMED_NODE =
      DiagnosticType.error("TC_MALFORMED_NODE", "Cannot generate code for {0}: {1}");

  static final DiagnosticType UNKNOWN_NODE =
      DiagnosticType.error("TC_UNKNOWN_NODE", "Cannot generate code for node kind {0}");

  private final AbstractCompiler compiler;
  private final CodeConsumer cc;

  CodeGenerator(AbstractCompiler compiler, CodeConsumer consumer) {
    this.compiler = compiler;
    this.cc = consumer;
  }

  void add(Node n) {
    if (!cc.continueProcessing()) {
      return;
    }
    if (n.getToken().isLeaf() && n.hasChildren()) {
      reportMalformed(n, "it cannot have children");
      return;
    }
    if (n.getToken().isLeaf() && !n.hasString()) {
      reportMalformed(n, "it has no text");
      return;
    }

    switch (n.getToken()) {
      case PROGRAM:
        for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
          if (c != n.getFirstChild()) {
            cc.startNewLine();
          }
          add(c);
        }
        break;

      case EXPR_RESULT:
        if (!n.hasOneChild()) {
          reportMalformed(n, "a statement holds exactly one expression");
          return;
        }
        add(n.getFirstChild());
        cc.endStatement();
        break;

      case CALL:
        {
          Node callee = n.getFirstChild();
          if (callee == null || !callee.isName()) {
            reportMalformed(n, "a call starts with the name of its callee");
            return;
          }
          add(callee);
          cc.add("(");
          for (Node arg = callee.getNext(); arg != null; arg = arg.getNext()) {
            if (arg != callee.getNext()) {
              cc.listSeparator();
            }
            add(arg);
          }
          cc.add(")");
          break;
        }

      case NAME:
        cc.addIdentifier(n.getString());
        break;

      case NUMBER:
        cc.add(n.getString());
        break;

      case STRING:
        cc.add("\"" + n.getString() + "\"");
        break;

      default:
        report(n, UNKNOWN_NODE, n.getToken().toString());
    }
  }

  private void reportMalformed(Node n, String reason) {
    report(n, MALFORMED_NODE, n.toString(), reason);
  }

  private void report(Node n, DiagnosticType type, String... arguments) {
    compiler.report(CompilerError.make(n, type, arguments));
    cc.stop();
  }
}
