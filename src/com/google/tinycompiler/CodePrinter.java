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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.tinycompiler.ast.Node;

/**
 * CodePrinter prints out code in either pretty format or compact format.
 *
 * @see CodeGenerator
 */
public final class CodePrinter {
  // There are two separate CodeConsumers, one for pretty-printing and
  // another for compact printing. They differ only in the spacing between
  // tokens.

  private abstract static class StringCodePrinter extends CodeConsumer {
    protected final StringBuilder code = new StringBuilder(1024);

    @Override
    void append(String str) {
      if (continueProcessing()) {
        code.append(str);
      }
    }

    @Override
    void startNewLine() {
      append("\n");
    }

    String getCode() {
      return code.toString();
    }
  }

  /** Prints {@code add(2,subtract(3,7));} */
  static class CompactCodePrinter extends StringCodePrinter {}

  /** Prints {@code add(2, subtract(3, 7));} */
  static class PrettyCodePrinter extends StringCodePrinter {
    @Override
    void listSeparator() {
      add(", ");
    }
  }

  private CodePrinter() {}

  public static final class Builder {
    private final AbstractCompiler compiler;
    private final Node root;
    private boolean prettyPrint;

    /**
     * Sets the root node from which to generate the source code.
     *
     * @param compiler The compiler that receives any errors.
     * @param node The root node.
     */
    public Builder(AbstractCompiler compiler, Node node) {
      this.compiler = checkNotNull(compiler);
      this.root = node;
    }

    /**
     * Sets the output options from compiler options.
     */
    @CanIgnoreReturnValue
    public Builder setCompilerOptions(CompilerOptions options) {
      this.prettyPrint = options.isPrettyPrint();
      return this;
    }

    /**
     * Sets whether pretty printing should be used.
     * @param prettyPrint If true, pretty printing will be used.
     */
    @CanIgnoreReturnValue
    public Builder setPrettyPrint(boolean prettyPrint) {
      this.prettyPrint = prettyPrint;
      return this;
    }

    /**
     * Generates the source code and returns it. If the tree cannot be printed the error is
     * reported to the compiler and the empty string is returned.
     */
    public String build() {
      if (root == null) {
        throw new IllegalStateException(
            "Cannot build without root node being specified");
      }

      return toSource(root, Format.fromPrettyPrint(prettyPrint), compiler);
    }
  }

  /**
   * Specifies a format for code generation.
   */
  public enum Format {
    COMPACT,
    PRETTY;

    static Format fromPrettyPrint(boolean prettyPrint) {
      return prettyPrint ? PRETTY : COMPACT;
    }
  }

  /** Converts a tree to code */
  private static String toSource(Node root, Format outputFormat, AbstractCompiler compiler) {
    StringCodePrinter printer =
        outputFormat == Format.COMPACT ? new CompactCodePrinter() : new PrettyCodePrinter();
    CodeGenerator cg = new CodeGenerator(compiler, printer);

    cg.add(root);
    printer.endFile();

    return printer.continueProcessing() ? printer.getCode() : "";
  }
}
