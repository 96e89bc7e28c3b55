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

/**
 * A reference by name that has not yet been resolved to a Symbol; in particular, the callee of
 * calls to library functions such as the iterator protocol.
 */
public final class UnresolvedSymExpr extends Expr {
  public final String name;

  public UnresolvedSymExpr(String name) {
    this.name = Preconditions.checkNotNull(name);
  }

  @Override
  protected UnresolvedSymExpr copyInner(SymbolMap map) {
    return new UnresolvedSymExpr(name);
  }

  @Override
  public void accept(AstVisitor visitor) {
    visitor.visitUnresolvedSymExpr(this);
  }

  @Override
  public void emit(CodeEmitter emitter) {
    emitter.append(name);
  }

  @Override
  public String toString() {
    return name;
  }
}
