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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.looplowering.util.StringUtil;

/**
 * A call. A CallExpr either applies a {@link PrimitiveTag} to its actuals or calls its base
 * expression (usually an {@link UnresolvedSymExpr} naming a function) with them; exactly one of
 * {@link #primitive()} and {@link #baseExpr()} is non-null for a well-formed call.
 */
public final class CallExpr extends Expr {
  private @Nullable Expr baseExpr;
  private @Nullable PrimitiveTag primitive;
  private final List<Expr> actuals = new ArrayList<>();

  /** Creates a call to the function with the given name. */
  public CallExpr(String name, Expr... actuals) {
    this(new UnresolvedSymExpr(name), actuals);
  }

  /** Creates a call of {@code baseExpr}. */
  public CallExpr(Expr baseExpr, Expr... actuals) {
    this.baseExpr = adopt(baseExpr);
    for (Expr actual : actuals) {
      insertAtTail(actual);
    }
  }

  /** Creates a primitive operation. */
  public CallExpr(PrimitiveTag primitive, Expr... actuals) {
    this.primitive = Preconditions.checkNotNull(primitive);
    for (Expr actual : actuals) {
      insertAtTail(actual);
    }
  }

  /** Returns {@code move(lhs, rhs)}. */
  public static CallExpr move(Symbol lhs, Expr rhs) {
    return new CallExpr(PrimitiveTag.MOVE, new SymExpr(lhs), rhs);
  }

  public @Nullable Expr baseExpr() {
    return baseExpr;
  }

  /** Makes this a call of {@code newBase}; clears any primitive. */
  public void setBaseExpr(Expr newBase) {
    if (baseExpr != null) {
      baseExpr.remove();
    }
    primitive = null;
    baseExpr = adopt(newBase);
  }

  public @Nullable PrimitiveTag primitive() {
    return primitive;
  }

  /**
   * Sets (or, if {@code primitive} is null, clears) this call's primitive. A call whose primitive
   * has been cleared must be given a base expression before it is otherwise used.
   */
  public void setPrimitive(@Nullable PrimitiveTag primitive) {
    if (primitive != null && baseExpr != null) {
      baseExpr.remove();
    }
    this.primitive = primitive;
  }

  public boolean isPrimitive(PrimitiveTag tag) {
    return primitive == tag;
  }

  /** True if this calls a function with the given name. */
  public boolean isNamed(String name) {
    if (baseExpr instanceof UnresolvedSymExpr unresolved) {
      return unresolved.name.equals(name);
    } else if (baseExpr instanceof SymExpr symExpr) {
      return symExpr.symbol().name.equals(name);
    }
    return false;
  }

  public int numActuals() {
    return actuals.size();
  }

  /** Returns the actual at (zero-based) position {@code i}. */
  public Expr get(int i) {
    return actuals.get(i);
  }

  /** Returns the only actual; there must be exactly one. */
  public Expr only() {
    Preconditions.checkState(actuals.size() == 1, "%s has %s actuals", describe(), actuals.size());
    return actuals.get(0);
  }

  /** An unmodifiable view of the actuals. */
  public List<Expr> actuals() {
    return Collections.unmodifiableList(actuals);
  }

  @CanIgnoreReturnValue
  public CallExpr insertAtTail(Expr actual) {
    actuals.add(adopt(actual));
    return this;
  }

  @Override
  protected void replaceChild(Expr oldAst, @Nullable Expr newAst) {
    if (oldAst == baseExpr) {
      baseExpr = adoptNullable(newAst);
      return;
    }
    int i = indexOf(oldAst);
    if (newAst == null) {
      actuals.remove(i);
    } else {
      actuals.set(i, adopt(newAst));
    }
  }

  @Override
  protected void insertChildBefore(Expr child, Expr newExpr) {
    actuals.add(indexOf(child), adopt(newExpr));
  }

  private int indexOf(Expr child) {
    for (int i = 0; i < actuals.size(); i++) {
      if (actuals.get(i) == child) {
        return i;
      }
    }
    throw InternalCompilerError.fatal(this, "%s is not an actual", child.describe());
  }

  @Override
  protected CallExpr copyInner(SymbolMap map) {
    CallExpr result =
        (primitive != null) ? new CallExpr(primitive) : new CallExpr(baseExpr.copyInner(map));
    for (Expr actual : actuals) {
      result.insertAtTail(actual.copyInner(map));
    }
    return result;
  }

  @Override
  public CallExpr copy(SymbolMap map) {
    return (CallExpr) super.copy(map);
  }

  @Override
  public void accept(AstVisitor visitor) {
    if (visitor.enterCallExpr(this)) {
      if (baseExpr != null) {
        baseExpr.accept(visitor);
      }
      for (Expr actual : List.copyOf(actuals)) {
        actual.accept(visitor);
      }
      visitor.exitCallExpr(this);
    }
  }

  @Override
  public void verify() {
    InternalCompilerError.check(
        (primitive == null) != (baseExpr == null), this, "call must have a base or a primitive");
    verifyChild(baseExpr);
    actuals.forEach(this::verifyChild);
  }

  @Override
  public Expr getFirstExpr() {
    if (baseExpr != null) {
      return baseExpr.getFirstExpr();
    } else if (!actuals.isEmpty()) {
      return actuals.get(0).getFirstExpr();
    }
    return this;
  }

  @Override
  public Expr getNextExpr(Expr child) {
    int next = (child == baseExpr) ? 0 : indexOf(child) + 1;
    return (next < actuals.size()) ? actuals.get(next).getFirstExpr() : this;
  }

  @Override
  public void emit(CodeEmitter emitter) {
    if (primitive == PrimitiveTag.MOVE) {
      get(0).emit(emitter);
      emitter.append(" = ");
      get(1).emit(emitter);
      return;
    }
    if (primitive != null) {
      emitter.append(primitive.printName);
    } else {
      baseExpr.emit(emitter);
    }
    emitter.append("(");
    for (int i = 0; i < actuals.size(); i++) {
      if (i != 0) {
        emitter.append(", ");
      }
      actuals.get(i).emit(emitter);
    }
    emitter.append(")");
  }

  @Override
  public String toString() {
    String callee =
        (primitive != null) ? "'" + primitive.printName + "'" : String.valueOf(baseExpr);
    return StringUtil.joinElements(callee + "(", ", ", ")", actuals);
  }
}
