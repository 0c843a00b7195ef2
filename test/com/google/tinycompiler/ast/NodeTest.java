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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NodeTest {

  @Test
  public void testAddChildToBack() {
    Node call = new Node(Token.CALL);
    Node a = IR.name("a");
    Node b = IR.number("1");
    Node c = IR.string("s");
    call.addChildToBack(a);
    call.addChildToBack(b);
    call.addChildToBack(c);

    assertThat(call.getChildCount()).isEqualTo(3);
    assertThat(call.getFirstChild()).isSameInstanceAs(a);
    assertThat(call.getSecondChild()).isSameInstanceAs(b);
    assertThat(call.getLastChild()).isSameInstanceAs(c);
    assertThat(a.getNext()).isSameInstanceAs(b);
    assertThat(c.getNext()).isNull();
    assertThat(b.getParent()).isSameInstanceAs(call);
    assertThat(call.children()).containsExactly(a, b, c).inOrder();
  }

  @Test
  public void testCannotAddOwnedChild() {
    Node child = IR.number("1");
    IR.sexpCall("f", child);
    assertThrows(IllegalArgumentException.class, () -> IR.sexpCall("g", child));
  }

  @Test
  public void testEmptyNode() {
    Node program = IR.program();
    assertThat(program.hasChildren()).isFalse();
    assertThat(program.getChildCount()).isEqualTo(0);
    assertThat(program.getFirstChild()).isNull();
    assertThat(program.getLastChild()).isNull();
    assertThat(program.children()).isEmpty();
    assertThat(program.hasString()).isFalse();
    assertThrows(IllegalStateException.class, program::getString);
    assertThrows(IllegalStateException.class, program::getOnlyChild);
  }

  @Test
  public void testToString() {
    assertThat(IR.program().toString()).isEqualTo("PROGRAM");
    assertThat(IR.sexpCall("add").toString()).isEqualTo("CALL add");
    assertThat(IR.number("42").toString()).isEqualTo("NUMBER 42");
  }

  @Test
  public void testToStringTree() {
    Node program =
        IR.program(IR.exprResult(IR.call(IR.name("add"), IR.number("2"), IR.string("x"))));
    assertThat(program.toStringTree())
        .isEqualTo(
            "PROGRAM\n"
                + "    EXPR_RESULT\n"
                + "        CALL\n"
                + "            NAME add\n"
                + "            NUMBER 2\n"
                + "            STRING x\n");
  }

  @Test
  public void testIsEquivalentTo() {
    Node tree = IR.program(IR.sexpCall("add", IR.number("1"), IR.sexpCall("sub")));

    assertThat(tree.isEquivalentTo(
            IR.program(IR.sexpCall("add", IR.number("1"), IR.sexpCall("sub")))))
        .isTrue();
    assertThat(tree.isEquivalentTo(IR.program(IR.sexpCall("add", IR.number("1")))))
        .isFalse();
    assertThat(tree.isEquivalentTo(
            IR.program(IR.sexpCall("add", IR.number("01"), IR.sexpCall("sub")))))
        .isFalse();
    assertThat(IR.number("1").isEquivalentTo(IR.string("1"))).isFalse();
  }

  @Test
  public void testKindPredicates() {
    Node callee = IR.name("f");
    Node arg = IR.string("s");
    Node call = IR.call(callee, arg, IR.number("1"));
    Node statement = IR.exprResult(call);
    Node program = IR.program(statement);

    assertThat(program.isProgram()).isTrue();
    assertThat(statement.isExprResult()).isTrue();
    assertThat(call.isCall()).isTrue();
    assertThat(callee.isName()).isTrue();
    assertThat(arg.isString()).isTrue();
    assertThat(call.getLastChild().isNumber()).isTrue();

    assertThat(call.isExprResult()).isFalse();
    assertThat(statement.isCall()).isFalse();
    assertThat(arg.isName()).isFalse();
    assertThat(statement.getOnlyChild()).isSameInstanceAs(call);
  }

  @Test
  public void testLeafTokens() {
    assertThat(Token.NAME.isLeaf()).isTrue();
    assertThat(Token.NUMBER.isLeaf()).isTrue();
    assertThat(Token.STRING.isLeaf()).isTrue();
    assertThat(Token.CALL.isLeaf()).isFalse();
    assertThat(Token.PROGRAM.isLeaf()).isFalse();
    assertThat(Token.EXPR_RESULT.isLeaf()).isFalse();
  }

  @Test
  public void testIRPreconditions() {
    assertThrows(IllegalArgumentException.class, () -> IR.sexpCall(""));
    assertThrows(IllegalArgumentException.class, () -> IR.name(""));
    assertThrows(IllegalStateException.class, () -> IR.sexpCall("f", IR.name("x")));
    assertThrows(IllegalStateException.class, () -> IR.call(IR.number("1")));
    assertThrows(IllegalStateException.class, () -> IR.exprResult(IR.program()));
    assertThrows(IllegalStateException.class, () -> IR.program(IR.program()));
  }
}
