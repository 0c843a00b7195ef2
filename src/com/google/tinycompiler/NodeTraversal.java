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
import org.jspecify.annotations.Nullable;

/**
 * NodeTraversal walks a tree depth first, left to right, telling a {@link Callback} about each node
 * before and after its children.
 *
 * <p>The traversal itself knows only which node kinds have children. What happens at each node is
 * entirely up to the callback; see {@link NodeVisitor} for one that dispatches on the node kind.
 */
public class NodeTraversal {

  static final DiagnosticType MALFORMED_TREE =
      DiagnosticType.error("TC_MALFORMED_TREE", "Malformed tree: {0} cannot have children");

  private final AbstractCompiler compiler;
  private final Callback callback;

  /** Contains the current node */
  private @Nullable Node currentNode;

  private boolean aborted = false;

  /** Callback for tree-based traversals */
  public interface Callback {
    /**
     * Visits a node in preorder (before its children).
     *
     * @param t The current traversal.
     * @param n The current node.
     * @param parent The parent of the current node, null for the root.
     */
    void enter(NodeTraversal t, Node n, @Nullable Node parent);

    /**
     * Visits a node in postorder (after its children).
     *
     * @param t The current traversal.
     * @param n The current node.
     * @param parent The parent of the current node, null for the root.
     */
    void exit(NodeTraversal t, Node n, @Nullable Node parent);
  }

  /** A single enter or exit action, as registered with a {@link NodeVisitor}. */
  @FunctionalInterface
  public interface NodeCallback {
    void call(NodeTraversal t, Node n, @Nullable Node parent);
  }

  /** Traverses using the callback, starting at {@code root}. */
  public static void traverse(AbstractCompiler compiler, Node root, Callback cb) {
    NodeTraversal.builder().setCompiler(compiler).setCallback(cb).traverse(root);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder */
  public static final class Builder {
    private Callback callback;
    private AbstractCompiler compiler;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder setCallback(Callback x) {
      this.callback = x;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setCompiler(AbstractCompiler x) {
      this.compiler = x;
      return this;
    }

    public NodeTraversal build() {
      return new NodeTraversal(this);
    }

    public void traverse(Node root) {
      this.build().traverse(root);
    }
  }

  private NodeTraversal(Builder builder) {
    this.compiler = checkNotNull(builder.compiler);
    this.callback = checkNotNull(builder.callback);
  }

  /** Traverses a parse tree recursively. */
  public void traverse(Node root) {
    traverseBranch(root, null);
  }

  private void traverseBranch(Node n, @Nullable Node parent) {
    if (aborted) {
      return;
    }
    currentNode = n;
    if (n.getToken().isLeaf() && n.hasChildren()) {
      report(n, MALFORMED_TREE, n.getToken().toString());
      return;
    }

    callback.enter(this, n, parent);

    for (Node child = n.getFirstChild(); child != null && !aborted; ) {
      // child could be replaced, in which case our child node
      // would no longer point to the true next
      Node next = child.getNext();
      traverseBranch(child, n);
      child = next;
    }

    if (aborted) {
      return;
    }
    currentNode = n;
    callback.exit(this, n, parent);
  }

  /**
   * Stops the traversal. No further callbacks are made, including the exits of the nodes that
   * are currently entered.
   */
  public void abort() {
    aborted = true;
  }

  public boolean isAborted() {
    return aborted;
  }

  public @Nullable Node getCurrentNode() {
    return currentNode;
  }

  /**
   * Reports a diagnostic for a node and aborts the traversal if it is an error.
   *
   * @param n Determines the node the error is attached to
   * @param diagnosticType The error type
   * @param arguments Arguments to be incorporated into the message
   */
  public void report(Node n, DiagnosticType diagnosticType, String... arguments) {
    compiler.report(CompilerError.make(n, diagnosticType, arguments));
    if (diagnosticType.level == CheckLevel.ERROR) {
      abort();
    }
  }
}
