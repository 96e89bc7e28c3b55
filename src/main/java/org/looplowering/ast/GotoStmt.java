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
 * A transfer of control: to a label ({@code break} and {@code continue}), or out of the enclosing
 * function ({@code return}, which has no label).
 */
public final class GotoStmt extends Expr {

  /** The kinds of transfer. */
  public enum GotoTag {
    BREAK("break"),
    CONTINUE("continue"),
    RETURN("return");

    final String printName;

    GotoTag(String printName) {
      this.printName = printName;
    }
  }

  public final GotoTag tag;

  private @Nullable SymExpr label;

  private GotoStmt(GotoTag tag, @Nullable SymExpr label) {
    this.tag = tag;
    this.label = adoptNullable(label);
  }

  public static GotoStmt breakTo(LabelSymbol label) {
    return new GotoStmt(GotoTag.BREAK, new SymExpr(label));
  }

  public static GotoStmt continueTo(LabelSymbol label) {
    return new GotoStmt(GotoTag.CONTINUE, new SymExpr(label));
  }

  public static GotoStmt returnFromFunction() {
    return new GotoStmt(GotoTag.RETURN, null);
  }

  /** The label this goto transfers control to; null for {@code return}. */
  public @Nullable LabelSymbol target() {
    return (label == null) ? null : (LabelSymbol) label.symbol();
  }

  @Override
  protected void replaceChild(Expr oldAst, @Nullable Expr newAst) {
    InternalCompilerError.check(oldAst == label, this, "%s is not a child", oldAst.describe());
    Preconditions.checkArgument(newAst == null || newAst instanceof SymExpr);
    label = (SymExpr) adoptNullable(newAst);
  }

  @Override
  protected GotoStmt copyInner(SymbolMap map) {
    return new GotoStmt(tag, (label == null) ? null : label.copyInner(map));
  }

  @Override
  public void accept(AstVisitor visitor) {
    if (visitor.enterGotoStmt(this)) {
      if (label != null) {
        label.accept(visitor);
      }
      visitor.exitGotoStmt(this);
    }
  }

  @Override
  public void verify() {
    InternalCompilerError.check(
        (tag == GotoTag.RETURN) == (label == null), this, "%s has wrong label", tag);
    InternalCompilerError.check(
        label == null || label.symbol() instanceof LabelSymbol, this, "target is not a label");
    verifyChild(label);
  }

  @Override
  public Expr getFirstExpr() {
    return (label == null) ? this : label;
  }

  @Override
  public void emit(CodeEmitter emitter) {
    emitter.append(tag.printName);
    if (label != null) {
      emitter.append(" ").append(label.symbol().name);
    }
    emitter.append(";");
  }

  @Override
  public String toString() {
    return (label == null) ? tag.printName : tag.printName + " " + label;
  }
}
