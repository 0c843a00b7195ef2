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

import com.google.common.collect.ImmutableSet;

/**
 * Group a set of related diagnostic types together, so that callers can ask which phase of the
 * compilation an error came from.
 */
public class DiagnosticGroup {

  // The set of types represented by this group, hashed by key.
  private final ImmutableSet<DiagnosticType> types;

  // A human-readable name for the group.
  private final String name;

  /**
   * Create a group that matches all errors of the given types.
   */
  DiagnosticGroup(String name, DiagnosticType... types) {
    this.name = name;
    this.types = ImmutableSet.copyOf(types);
  }

  /**
   * Returns whether the given error's type matches a type
   * in this group.
   */
  public boolean matches(CompilerError error) {
    return matches(error.type());
  }

  /**
   * Returns whether the given type matches a type in this group.
   */
  public boolean matches(DiagnosticType type) {
    return types.contains(type);
  }

  /**
   * Returns an iterable over all the types in this group.
   */
  public Iterable<DiagnosticType> getTypes() {
    return types;
  }

  @Override
  public String toString() {
    return "DiagnosticGroup<" + name + ">";
  }
}
