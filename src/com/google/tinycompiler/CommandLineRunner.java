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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.io.CharStreams;
import com.google.common.io.Files;
import com.google.tinycompiler.ast.Node;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

/**
 * CommandLineRunner translates flags into a compilation per input and prints the results.
 *
 * <p>Inputs are taken from {@code --expr} strings, then from {@code --js} files and bare
 * arguments. With no inputs at all the source is read from standard input. Generated code goes to
 * stdout and errors to stderr; the exit status is the number of inputs that failed to compile.
 *
 * <pre>
 *   java -jar tiny-compiler.jar --expr '(add 2 (subtract 3 7))'
 *   add(2,subtract(3,7));
 * </pre>
 */
public class CommandLineRunner {

  private static class Flags {
    @Option(name = "--help", usage = "Displays this message on stdout and exit")
    private boolean displayHelp = false;

    @Option(name = "--print_tree", usage = "Prints out the parse tree instead of the code")
    private boolean printTree = false;

    @Option(name = "--pretty_print", usage = "Puts a space after each argument separator")
    private boolean prettyPrint = false;

    @Option(
        name = "--logging_level",
        usage =
            "The logging level (standard java.util.logging.Level"
                + " values) for Compiler progress. Does not control errors"
                + " in the code under compilation")
    private String loggingLevel = Level.WARNING.getName();

    @Option(
        name = "--expr",
        usage = "A source string to compile. You may specify multiple")
    private List<String> expr = new ArrayList<>();

    @Option(
        name = "--js",
        usage =
            "The source filename. You may specify multiple. The flag name is optional,"
                + " because args are interpreted as files by default")
    private List<String> js = new ArrayList<>();

    @Argument
    private List<String> arguments = new ArrayList<>();
  }

  /** One source to compile, and where it came from. */
  @VisibleForTesting
  record SourceInput(String name, String code) {}

  private final Flags flags = new Flags();
  private final CmdLineParser parser;
  private final InputStream in;
  private final PrintStream out;
  private final PrintStream err;
  private boolean isConfigValid;
  private int failedInputs = 0;

  public CommandLineRunner(String[] args) {
    this(args, System.in, System.out, System.err);
  }

  @VisibleForTesting
  CommandLineRunner(String[] args, InputStream in, PrintStream out, PrintStream err) {
    this.in = in;
    this.out = out;
    this.err = err;
    this.parser = new CmdLineParser(flags);

    try {
      parser.parseArgument(args);
      Level.parse(flags.loggingLevel);
      isConfigValid = true;
    } catch (CmdLineException | IllegalArgumentException e) {
      err.println(e.getMessage());
      isConfigValid = false;
    }

    if (!isConfigValid || flags.displayHelp) {
      printUsage(isConfigValid ? out : err);
    }
  }

  private void printUsage(PrintStream ps) {
    ps.println("Usage: tiny-compiler [options] [files...]");
    parser.printUsage(ps);
  }

  /** Whether the flags were valid and asked for a compilation. */
  public boolean shouldRunCompiler() {
    return isConfigValid && !flags.displayHelp;
  }

  /** Whether the flags were invalid or any input failed to compile. */
  public boolean hasErrors() {
    return !isConfigValid || failedInputs > 0;
  }

  /**
   * Compiles every input.
   *
   * @return the number of inputs that failed, capped at 127 to fit an exit status
   */
  @VisibleForTesting
  int doRun() throws IOException {
    Compiler.setLoggingLevel(Level.parse(flags.loggingLevel));
    CompilerOptions options = new CompilerOptions().setPrettyPrint(flags.prettyPrint);

    for (SourceInput input : createInputs()) {
      Compiler.logger.fine("Compiling " + input.name());
      Compiler compiler = new Compiler(new PrintStreamErrorManager(err));
      Result result = compiler.compile(input.code(), options);

      if (flags.printTree) {
        Node root = compiler.getSourceRoot();
        if (root != null) {
          root.appendStringTree(out);
        }
      } else if (result.success) {
        out.println(result.output);
      }
      if (!result.success) {
        failedInputs++;
      }
    }
    return Math.min(failedInputs, 0x7f);
  }

  @VisibleForTesting
  ImmutableList<SourceInput> createInputs() throws IOException {
    ImmutableList.Builder<SourceInput> inputs = ImmutableList.builder();
    for (String source : flags.expr) {
      inputs.add(new SourceInput("--expr", source));
    }
    List<String> files = new ArrayList<>(flags.js);
    files.addAll(flags.arguments);
    for (String filename : files) {
      inputs.add(new SourceInput(filename, Files.asCharSource(new File(filename), UTF_8).read()));
    }
    ImmutableList<SourceInput> result = inputs.build();
    if (result.isEmpty()) {
      return ImmutableList.of(
          new SourceInput("stdin", CharStreams.toString(new InputStreamReader(in, UTF_8))));
    }
    return result;
  }

  /**
   * Runs the compiler and exits the process with the number of failed inputs as the status.
   */
  public void run() {
    int result;
    try {
      result = doRun();
    } catch (IOException e) {
      err.println("ERROR - " + e.getMessage());
      result = -2;
    }
    System.exit(result);
  }

  /** Runs the compiler. */
  public static void main(String[] args) {
    CommandLineRunner runner = new CommandLineRunner(args);
    if (runner.shouldRunCompiler()) {
      runner.run();
    }
    if (runner.hasErrors()) {
      System.exit(-1);
    }
  }
}
