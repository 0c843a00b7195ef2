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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CompilerTest {

  private static Result compile(String source) {
    return new Compiler(new BlackHoleErrorManager()).compile(source);
  }

  private static void testSame(String source, String expected) {
    Result result = compile(source);
    assertThat(result.errors).isEmpty();
    assertThat(result.success).isTrue();
    assertThat(result.output).isEqualTo(expected);
  }

  private static CompilerError compileWithError(String source) {
    Result result = compile(source);
    assertThat(result.success).isFalse();
    assertThat(result.output).isNull();
    assertThat(result.errors).hasSize(1);
    return result.errors.get(0);
  }

  @Test
  public void testNestedCalls() {
    testSame("(add 2 (subtract 3 7))", "add(2,subtract(3,7));");
    testSame("(count 9 (add 2 6))", "count(9,add(2,6));");
    testSame("(sub 3 (mul 8 1))", "sub(3,mul(8,1));");
  }

  @Test
  public void testString() {
    testSame("(greet \"hi\")", "greet(\"hi\");");
  }

  @Test
  public void testTwoStatements() {
    testSame("(add 1 2)(sub 3 4)", "add(1,2);\nsub(3,4);");
    testSame("(add 1 2)\n\n  (sub 3 4)\n", "add(1,2);\nsub(3,4);");
  }

  @Test
  public void testEmptySource() {
    testSame("", "");
    testSame("   \n", "");
  }

  @Test
  public void testLiteralsRoundTrip() {
    testSame("(f 000123 \"a b  c\" \"\")", "f(000123,\"a b  c\",\"\");");
  }

  @Test
  public void testDeepNesting() {
    testSame("(a (b (c (d 1))))", "a(b(c(d(1))));");
  }

  @Test
  public void testOneStatementPerTopLevelCallWithBalancedParens() {
    String source = "(a 1 (b 2 (c)))  (d \"e\") (f (g (h 3) 4) 5)";
    Result result = compile(source);

    assertThat(result.success).isTrue();
    String output = result.output;
    assertThat(output.split("\n", -1)).asList()
        .containsExactly("a(1,b(2,c()));", "d(\"e\");", "f(g(h(3),4),5);")
        .inOrder();
    assertThat(CharMatcher.is('(').countIn(output)).isEqualTo(CharMatcher.is(')').countIn(output));
    assertThat(CharMatcher.is(';').countIn(output)).isEqualTo(3);
  }

  @Test
  public void testPrettyPrint() {
    Result result =
        new Compiler(new BlackHoleErrorManager())
            .compile("(add 2 (subtract 3 7))", new CompilerOptions().setPrettyPrint(true));
    assertThat(result.output).isEqualTo("add(2, subtract(3, 7));");
  }

  @Test
  public void testLexError() {
    CompilerError error = compileWithError("(add 1 $)");
    assertThat(DiagnosticGroups.LEXING.matches(error)).isTrue();
    assertThat(error.description()).contains("$");
    assertThat(error.charno()).isEqualTo(7);
  }

  @Test
  public void testUnterminatedStringIsLexError() {
    CompilerError error = compileWithError("(greet \"hi)");
    assertThat(DiagnosticGroups.LEXING.matches(error)).isTrue();
  }

  @Test
  public void testParseErrors() {
    for (String source : ImmutableList.of("(add 1 2", ")", "(1)", "()", "(add x)", "(")) {
      CompilerError error = compileWithError(source);
      assertThat(DiagnosticGroups.PARSING.matches(error)).isTrue();
    }
  }

  @Test
  public void testLexErrorStopsBeforeParsing() {
    Compiler compiler = new Compiler(new BlackHoleErrorManager());
    compiler.compile(") $");
    assertThat(compiler.getTokens()).isNull();
    assertThat(compiler.getSourceRoot()).isNull();
    assertThat(compiler.getErrorManager().getErrorCount()).isEqualTo(1);
  }

  @Test
  public void testTreesAreKept() {
    Compiler compiler = new Compiler(new BlackHoleErrorManager());
    compiler.compile("(f 1)");
    assertThat(compiler.getTokens()).hasSize(4);
    assertThat(compiler.getSourceRoot().toStringTree())
        .isEqualTo("PROGRAM\n    CALL f\n        NUMBER 1\n");
    assertThat(compiler.getTargetRoot().toStringTree())
        .isEqualTo("PROGRAM\n    EXPR_RESULT\n        CALL\n            NAME f\n            NUMBER 1\n");
  }

  @Test
  public void testCompileOnlyOnce() {
    Compiler compiler = new Compiler(new BlackHoleErrorManager());
    compiler.compile("(f)");
    assertThrows(IllegalStateException.class, () -> compiler.compile("(g)"));
  }

  @Test
  public void testDefaultErrorManagerLogs() {
    List<LogRecord> records = new ArrayList<>();
    Handler handler =
        new Handler() {
          @Override
          public void publish(LogRecord record) {
            records.add(record);
          }

          @Override
          public void flush() {}

          @Override
          public void close() {}
        };
    Compiler.logger.addHandler(handler);
    try {
      Result result = new Compiler().compile("(add 1 $)");
      assertThat(result.success).isFalse();
    } finally {
      Compiler.logger.removeHandler(handler);
    }

    assertThat(records).isNotEmpty();
    LogRecord error = records.get(0);
    assertThat(error.getLevel()).isEqualTo(Level.SEVERE);
    assertThat(error.getMessage()).startsWith("ERROR - [TC_UNRECOGNIZED_CHARACTER]");
  }

  @Test
  public void testIndependentCompilersRunInParallel() throws Exception {
    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      List<Future<Result>> futures = new ArrayList<>();
      for (int i = 0; i < 32; i++) {
        String source = "(f " + i + " (g " + i + "))";
        Callable<Result> task = () -> compile(source);
        futures.add(executor.submit(task));
      }
      for (int i = 0; i < futures.size(); i++) {
        assertThat(futures.get(i).get().output).isEqualTo("f(" + i + ",g(" + i + "));");
      }
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  public void testDeeplyNestedSourceIsRejected() {
    int depth = 20000;
    CompilerError error = compileWithError("(f ".repeat(depth) + "1" + ")".repeat(depth));
    assertThat(error.type()).isEqualTo(Parser.TOO_DEEPLY_NESTED);
    assertThat(DiagnosticGroups.PARSING.matches(error)).isTrue();
  }

  @Test
  public void testNestingAtTheLimitCompiles() {
    int depth = Parser.MAX_NESTING_DEPTH;
    Result result = compile("(f ".repeat(depth) + "1" + ")".repeat(depth));
    assertThat(result.success).isTrue();
    assertThat(result.output).isEqualTo("f(".repeat(depth) + "1" + ")".repeat(depth) + ";");
  }
}
