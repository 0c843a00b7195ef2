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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.Serializable;

/**
 * Compiler options
 */
public class CompilerOptions implements Serializable {
  private static final long serialVersionUID = 1;

  /** Output in a more human-readable form: a space follows each argument separator. */
  private boolean prettyPrint = false;

  public CompilerOptions() {}

  @CanIgnoreReturnValue
  public CompilerOptions setPrettyPrint(boolean prettyPrint) {
    this.prettyPrint = prettyPrint;
    return this;
  }

  public boolean isPrettyPrint() {
    return prettyPrint;
  }

  @Override
  public String toString() {
    return "CompilerOptions{prettyPrint=" + prettyPrint + "}";
  }
}
