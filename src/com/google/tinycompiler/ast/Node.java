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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.errorprone.annotations.CheckReturnValue;
import java.io.IOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * This class implements the root of the intermediate representation.
 *
 * <p>Children are kept in a doubly linked list: {@code first.previous} is the last child, and the
 * last child's {@code next} is null.
 */
public class Node {

  private final Token token;

  /** The name or literal text; null for PROGRAM, EXPR_RESULT and call expression CALLs. */
  private final @Nullable String string;

  private @Nullable Node parent;
  private @Nullable Node first;
  private @Nullable Node next;
  private @Nullable Node previous;

  public Node(Token token) {
    this(token, (String) null);
  }

  public Node(Token token, Node... children) {
    this(token);
    for (Node child : children) {
      addChildToBack(child);
    }
  }

  private Node(Token token, @Nullable String string) {
    this.token = checkNotNull(token);
    this.string = string;
  }

  public static Node newString(Token token, String str) {
    return new Node(token, checkNotNull(str));
  }

  public final Token getToken() {
    return token;
  }

  /** Returns the name or literal text of this node. */
  public final String getString() {
    checkState(string != null, "%s has no string", token);
    return string;
  }

  public final boolean hasString() {
    return string != null;
  }

  public final boolean hasChildren() {
    return first != null;
  }

  public final boolean hasOneChild() {
    return first != null && first.next == null;
  }

  public final Node getOnlyChild() {
    checkState(hasOneChild(), "%s does not have exactly one child", this);
    return first;
  }

  public final @Nullable Node getFirstChild() {
    return first;
  }

  public final @Nullable Node getSecondChild() {
    return first != null ? first.next : null;
  }

  public final @Nullable Node getLastChild() {
    return first != null ? first.previous : null;
  }

  public final @Nullable Node getNext() {
    return next;
  }

  public final @Nullable Node getParent() {
    return parent;
  }

  public final int getChildCount() {
    int c = 0;
    for (Node n = first; n != null; n = n.next) {
      c++;
    }
    return c;
  }

  public final void addChildToBack(Node child) {
    checkArgument(
        child.parent == null,
        "Cannot add already-owned child node.\nChild: %s\nExisting parent: %s\nNew parent: %s",
        child,
        child.parent,
        this);
    checkArgument(child.next == null);
    checkArgument(child.previous == null);

    if (first == null) {
      // NOTE: child.next remains null
      child.previous = child;
      first = child;
    } else {
      Node last = first.previous;
      last.next = child;
      child.previous = last;
      first.previous = child;
    }

    child.parent = this;
  }

  /**
   * Returns an Iterable over the children, for use with the enhanced for loop.
   *
   * <p>Prefer {@code getFirstChild()}/{@code getNext()} when walking large trees.
   */
  public final Iterable<Node> children() {
    if (first == null) {
      return Collections.emptySet();
    }
    Node start = first;
    return () -> new SiblingNodeIterator(start);
  }

  private static final class SiblingNodeIterator implements Iterator<Node> {
    private @Nullable Node current;

    SiblingNodeIterator(Node start) {
      this.current = start;
    }

    @Override
    public boolean hasNext() {
      return current != null;
    }

    @Override
    public Node next() {
      if (current == null) {
        throw new NoSuchElementException();
      }
      Node n = current;
      current = n.next;
      return n;
    }
  }

  public final boolean isProgram() {
    return token == Token.PROGRAM;
  }

  public final boolean isCall() {
    return token == Token.CALL;
  }

  public final boolean isExprResult() {
    return token == Token.EXPR_RESULT;
  }

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isNumber() {
    return token == Token.NUMBER;
  }

  public final boolean isString() {
    return token == Token.STRING;
  }

  /** Returns true if this node and the subtree below it match {@code node} structurally. */
  public final boolean isEquivalentTo(Node node) {
    if (token != node.token || !Objects.equals(string, node.string)) {
      return false;
    }
    Node a = first;
    Node b = node.first;
    while (a != null && b != null) {
      if (!a.isEquivalentTo(b)) {
        return false;
      }
      a = a.next;
      b = b.next;
    }
    return a == null && b == null;
  }

  @Override
  public String toString() {
    return string == null ? token.toString() : token + " " + string;
  }

  /** Returns the subtree rooted here, one node per line, indented four spaces per level. */
  @CheckReturnValue
  public final String toStringTree() {
    try {
      StringBuilder s = new StringBuilder();
      appendStringTree(s);
      return s.toString();
    } catch (IOException e) {
      throw new RuntimeException("Should not happen\n" + e);
    }
  }

  public final void appendStringTree(Appendable appendable) throws IOException {
    toStringTreeHelper(this, 0, appendable);
  }

  private static void toStringTreeHelper(Node n, int level, Appendable sb) throws IOException {
    for (int i = 0; i != level; ++i) {
      sb.append("    ");
    }
    sb.append(n.toString());
    sb.append('\n');
    for (Node cursor = n.first; cursor != null; cursor = cursor.next) {
      toStringTreeHelper(cursor, level + 1, sb);
    }
  }
}
