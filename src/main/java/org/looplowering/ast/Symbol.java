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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.EnumSet;
import org.jspecify.annotations.Nullable;

/**
 * A named entity that can be declared (by a {@link DefExpr}) and referenced (by a {@link SymExpr}).
 * Symbols are compared by identity.
 */
public abstract class Symbol extends BaseAst {
  public final String name;

  private final EnumSet<Flag> flags = EnumSet.noneOf(Flag.class);

  /** The DefExpr that declares this symbol, or null if it has not been declared. */
  @Nullable DefExpr defPoint;

  protected Symbol(String name) {
    this.name = name;
  }

  @CanIgnoreReturnValue
  public Symbol addFlag(Flag flag) {
    flags.add(flag);
    return this;
  }

  public void removeFlag(Flag flag) {
    flags.remove(flag);
  }

  public boolean hasFlag(Flag flag) {
    return flags.contains(flag);
  }

  public @Nullable DefExpr defPoint() {
    return defPoint;
  }

  /**
   * Returns a new, undeclared symbol with the same name and flags as this one; used when copying
   * the DefExpr that declares this symbol.
   */
  public final Symbol copy() {
    Symbol result = copyInner();
    result.flags.addAll(flags);
    return result;
  }

  /** Creates the subclass-specific part of {@link #copy}. */
  protected abstract Symbol copyInner();

  @Override
  public String toString() {
    return name;
  }
}
