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

/**
 * An abstract compiler, to help remove the circular dependency of the phases on {@link Compiler}.
 */
public abstract class AbstractCompiler {

  /** Report an error or warning. */
  public abstract void report(CompilerError error);

  /** Whether any errors have been reported so far. */
  public abstract boolean hasErrors();

  public abstract ErrorManager getErrorManager();
}
