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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.tinycompiler.NodeTraversal.NodeCallback;
import com.google.tinycompiler.ast.Node;
import com.google.tinycompiler.ast.Token;
import java.util.EnumMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A {@link NodeTraversal.Callback} made of per-{@link Token} enter and exit actions. Node kinds
 * without an action are walked through silently.
 *
 * <pre>
 * NodeVisitor visitor =
 *     NodeVisitor.builder()
 *         .enter(Token.CALL, (t, n, parent) -> ...)
 *         .exit(Token.CALL, (t, n, parent) -> ...)
 *         .build();
 * NodeTraversal.traverse(compiler, root, visitor);
 * </pre>
 */
public final class NodeVisitor implements NodeTraversal.Callback {
  private final ImmutableMap<Token, NodeCallback> enterCallbacks;
  private final ImmutableMap<Token, NodeCallback> exitCallbacks;

  private NodeVisitor(Map<Token, NodeCallback> enter, Map<Token, NodeCallback> exit) {
    this.enterCallbacks = Maps.immutableEnumMap(enter);
    this.exitCallbacks = Maps.immutableEnumMap(exit);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public void enter(NodeTraversal t, Node n, @Nullable Node parent) {
    NodeCallback cb = enterCallbacks.get(n.getToken());
    if (cb != null) {
      cb.call(t, n, parent);
    }
  }

  @Override
  public void exit(NodeTraversal t, Node n, @Nullable Node parent) {
    NodeCallback cb = exitCallbacks.get(n.getToken());
    if (cb != null) {
      cb.call(t, n, parent);
    }
  }

  /** Whether this visitor does anything for nodes of the given kind. */
  public boolean handles(Token token) {
    return enterCallbacks.containsKey(token) || exitCallbacks.containsKey(token);
  }

  /** Builder */
  public static final class Builder {
    private final Map<Token, NodeCallback> enter = new EnumMap<>(Token.class);
    private final Map<Token, NodeCallback> exit = new EnumMap<>(Token.class);

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder enter(Token token, NodeCallback cb) {
      checkState(!enter.containsKey(token), "Duplicate enter action for %s", token);
      enter.put(token, cb);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder exit(Token token, NodeCallback cb) {
      checkState(!exit.containsKey(token), "Duplicate exit action for %s", token);
      exit.put(token, cb);
      return this;
    }

    public NodeVisitor build() {
      return new NodeVisitor(enter, exit);
    }
  }
}
