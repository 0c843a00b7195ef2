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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.tinycompiler.ast.Node;
import com.google.tinycompiler.parsing.Token;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Compiler translates s-expressions such as {@code (add 2 (subtract 3 7))} into C-like call
 * statements such as {@code add(2,subtract(3,7));}.
 *
 * <p>A Compiler runs the pipeline once: tokenize, parse, transform, generate. Each phase reports
 * problems through {@link #report} and the next phase only runs if nothing has been reported.
 * Create a new Compiler for every source.
 */
public class Compiler extends AbstractCompiler {

  /**
   * Logger for the whole com.google.tinycompiler domain - setting configuration for this logger
   * affects all loggers in other classes within the compiler.
   */
  public static final Logger logger = Logger.getLogger("com.google.tinycompiler");

  private CompilerOptions options = new CompilerOptions();

  private @Nullable ErrorManager errorManager;

  private boolean compiled = false;

  private @Nullable ImmutableList<Token> tokens;
  private @Nullable Node sourceRoot;
  private @Nullable Node targetRoot;
  private @Nullable String output;

  /** Creates a Compiler that reports errors to its logger. */
  public Compiler() {}

  /** Creates a Compiler that uses a custom error manager. */
  public Compiler(ErrorManager errorManager) {
    setErrorManager(errorManager);
  }

  /**
   * Sets the error manager.
   *
   * @param errorManager the error manager, it cannot be {@code null}
   */
  public void setErrorManager(ErrorManager errorManager) {
    checkNotNull(errorManager, "the error manager cannot be null");
    this.errorManager = errorManager;
  }

  /**
   * Initializes the compiler options. It's called as part of a normal compile() job. Public for the
   * callers that run the phases themselves.
   */
  public void initOptions(CompilerOptions options) {
    this.options = checkNotNull(options);
    if (errorManager == null) {
      setErrorManager(new LoggerErrorManager(logger));
    }
  }

  /** Compiles the source with default options. */
  public Result compile(String source) {
    return compile(source, new CompilerOptions());
  }

  /**
   * Compiles the source.
   *
   * <p>This is a convenience method to wrap up all the work of compilation, including generating
   * the error report.
   */
  public Result compile(String source, CompilerOptions options) {
    checkNotNull(source);
    // The compile method should only be called once.
    checkState(!compiled, "The compile method should only be called once");
    compiled = true;

    try {
      initOptions(options);
      tokenize(source);
      if (!hasErrors()) {
        parse();
      }
      if (!hasErrors()) {
        transform();
      }
      if (!hasErrors()) {
        generateCode();
      }
    } finally {
      generateReport();
    }
    return getResult();
  }

  private void tokenize(String source) {
    logger.fine("Tokenizing");
    tokens = new Tokenizer(this, source).tokenize();
    if (tokens != null) {
      logger.log(Level.FINE, "Read {0} token(s)", tokens.size());
    }
  }

  private void parse() {
    logger.fine("Parsing");
    sourceRoot = new Parser(this, checkNotNull(tokens)).parse();
  }

  private void transform() {
    logger.fine("Transforming");
    targetRoot = new Transformer(this).transform(checkNotNull(sourceRoot));
  }

  private void generateCode() {
    logger.fine("Generating code");
    output =
        new CodePrinter.Builder(this, checkNotNull(targetRoot))
            .setCompilerOptions(options)
            .build();
  }

  /**
   * Generates a report of all errors found during compilation.
   *
   * <p>Client code must call this method explicitly if it doesn't use {@link #compile}.
   */
  public void generateReport() {
    getErrorManager().generateReport();
  }

  /** Returns the result of the compilation. Errors discard any output. */
  public Result getResult() {
    ErrorManager em = getErrorManager();
    return new Result(em.getErrors(), em.getWarnings(), output);
  }

  @Override
  public void report(CompilerError error) {
    CheckLevel level = error.defaultLevel();
    if (level.isOn()) {
      getErrorManager().report(level, error);
    }
  }

  @Override
  public boolean hasErrors() {
    return getErrorManager().hasErrors();
  }

  @Override
  public ErrorManager getErrorManager() {
    if (errorManager == null) {
      setErrorManager(new LoggerErrorManager(logger));
    }
    return errorManager;
  }

  /** The tokens read from the source, or null if tokenizing did not complete. */
  public @Nullable ImmutableList<Token> getTokens() {
    return tokens;
  }

  /** The s-expression tree, or null if parsing did not complete. */
  public @Nullable Node getSourceRoot() {
    return sourceRoot;
  }

  /** The call expression tree, or null if the transformation did not run. */
  public @Nullable Node getTargetRoot() {
    return targetRoot;
  }

  /** Sets the logging level for the com.google.tinycompiler package. */
  public static void setLoggingLevel(Level level) {
    logger.setLevel(level);
  }
}
