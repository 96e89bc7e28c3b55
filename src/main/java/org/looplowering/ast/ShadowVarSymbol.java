/*
 * Copyright 2025 The Retrospect Authors
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

package org.looplowering.ast;

import org.jspecify.annotations.Nullable;

/**
 * A per-task copy (or alias) of an outer variable, declared by a task intent such as {@code with
 * (ref x, + reduce sum)}. Lowering only transfers these declarations; their meaning is interpreted
 * by later passes.
 */
public final class ShadowVarSymbol extends Symbol {

  /** How the outer variable is made available to each task. */
  public enum Intent {
    REF,
    CONST_REF,
    IN,
    CONST_IN,
    REDUCE
  }

  public final Intent intent;

  /** The variable being shadowed; null if it has not been resolved yet. */
  private @Nullable Symbol outer;

  public ShadowVarSymbol(String name, Intent intent, @Nullable Symbol outer) {
    super(name);
    this.intent = intent;
    this.outer = outer;
  }

  public @Nullable Symbol outer() {
    return outer;
  }

  /** Redirects the shadowed variable according to {@code map}. */
  void remapOuter(SymbolMap map) {
    if (outer != null) {
      outer = map.getOrSelf(outer);
    }
  }

  @Override
  protected Symbol copyInner() {
    return new ShadowVarSymbol(name, intent, outer);
  }
}
