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

/** The declaration of a {@link Symbol}; for a {@link LabelSymbol}, marks the label's position. */
public final class DefExpr extends Expr {
  private final Symbol sym;

  public DefExpr(Symbol sym) {
    Preconditions.checkArgument(sym.defPoint == null, "%s is already declared", sym);
    this.sym = sym;
    sym.defPoint = this;
  }

  public Symbol sym() {
    return sym;
  }

  @Override
  protected DefExpr copyInner(SymbolMap map) {
    Symbol newSym = sym.copy();
    map.put(sym, newSym);
    return new DefExpr(newSym);
  }

  @Override
  public DefExpr copy(SymbolMap map) {
    return (DefExpr) super.copy(map);
  }

  @Override
  public void accept(AstVisitor visitor) {
    if (visitor.enterDefExpr(this)) {
      visitor.exitDefExpr(this);
    }
  }

  @Override
  public void verify() {
    InternalCompilerError.check(sym.defPoint == this, this, "symbol %s has another defPoint", sym);
  }

  @Override
  public void emit(CodeEmitter emitter) {
    if (sym instanceof LabelSymbol) {
      emitter.append(sym.name).append(":");
    } else {
      emitter.append("var ").append(sym.name).append(";");
    }
  }

  @Override
  public String toString() {
    return "def " + sym.name;
  }
}
