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

import com.google.common.base.Preconditions;

/** A reference to a resolved {@link Symbol}. */
public final class SymExpr extends Expr {
  private Symbol symbol;

  public SymExpr(Symbol symbol) {
    this.symbol = Preconditions.checkNotNull(symbol);
  }

  public Symbol symbol() {
    return symbol;
  }

  /** Redirects this reference; used when remapping symbols after a copy. */
  public void setSymbol(Symbol symbol) {
    this.symbol = Preconditions.checkNotNull(symbol);
  }

  @Override
  protected SymExpr copyInner(SymbolMap map) {
    // References are remapped afterwards by SymbolMap.updateSymbols(), which also handles
    // references that precede the declaration they refer to.
    return new SymExpr(symbol);
  }

  @Override
  public SymExpr copy(SymbolMap map) {
    return (SymExpr) super.copy(map);
  }

  @Override
  public void accept(AstVisitor visitor) {
    visitor.visitSymExpr(this);
  }

  @Override
  public void emit(CodeEmitter emitter) {
    emitter.append(symbol.name);
  }

  @Override
  public String toString() {
    return symbol.name;
  }
}
