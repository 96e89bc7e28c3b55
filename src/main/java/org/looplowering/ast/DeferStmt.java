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
import org.jspecify.annotations.Nullable;

/**
 * Registers a cleanup action with the enclosing {@link BlockStmt}. The action runs when control
 * leaves that block by any path (falling off the end, a goto out of the block, a return, or a
 * propagated error), after any DeferStmts registered later in the same block.
 */
public final class DeferStmt extends Expr {
  private @Nullable BlockStmt body;

  /** Creates a DeferStmt whose action is the single statement {@code cleanup}. */
  public DeferStmt(Expr cleanup) {
    this(new BlockStmt(cleanup));
  }

  public DeferStmt(BlockStmt body) {
    this.body = adopt(Preconditions.checkNotNull(body));
  }

  /** The cleanup action. */
  public BlockStmt body() {
    return body;
  }

  @Override
  protected void replaceChild(Expr oldAst, @Nullable Expr newAst) {
    InternalCompilerError.check(oldAst == body, this, "%s is not a child", oldAst.describe());
    body = (BlockStmt) adoptNullable(newAst);
  }

  @Override
  protected DeferStmt copyInner(SymbolMap map) {
    return new DeferStmt(body.copyInner(map));
  }

  @Override
  public void accept(AstVisitor visitor) {
    if (visitor.enterDeferStmt(this)) {
      body.accept(visitor);
      visitor.exitDeferStmt(this);
    }
  }

  @Override
  public void verify() {
    InternalCompilerError.check(body != null, this, "DeferStmt has no body");
    verifyChild(body);
  }

  @Override
  public Expr getFirstExpr() {
    return body.getFirstExpr();
  }

  @Override
  public void emit(CodeEmitter emitter) {
    emitter.append("defer ");
    body.emit(emitter);
  }

  @Override
  public String toString() {
    return "defer" + body;
  }
}
