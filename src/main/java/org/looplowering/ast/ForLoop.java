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
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The canonical form of every iterator-driven loop ({@code for}, {@code foreach}, {@code coforall},
 * and the serial loops that {@code forall} is lowered to) after desugaring.
 *
 * <p>A ForLoop refers to two variables declared just before it: the <i>iterator</i>, which holds
 * the state returned by the iteration source's iterator protocol (a tuple of such states for a
 * zippered loop), and the <i>index</i>, which holds the current element. The loop body begins by
 * destructuring the index into the user's loop variables, and ends with the loop's continue label.
 *
 * <p>A ForLoop is not executable as it stands: a later pass must rewrite it in terms of the
 * iterator's own implementation. Reaching {@link #emit} is therefore an internal error.
 *
 * <p>Unlike other loops a ForLoop never has a condition; its (legacy) {@code blockInfo} slot must
 * remain empty, and {@link #verify} checks that it does.
 */
public final class ForLoop extends LoopStmt {
  private @Nullable SymExpr index;

  private @Nullable SymExpr iterator;

  private boolean zippered;

  private boolean loweredFromParallel;

  private boolean forExpression;

  /** DefExprs of the {@link ShadowVarSymbol}s declared by the loop's task intents, in order. */
  private final List<DefExpr> shadowVariables = new ArrayList<>();

  private ImmutableList<LoopAttribute> attributes = ImmutableList.of();

  /**
   * Creates a ForLoop whose body is {@code initBody}.
   *
   * @param zippered true if the iterator is a tuple of per-source iterators
   * @param loweredFromParallel true if this loop is the serial form of a {@code forall}
   * @param forExpression true if the loop produces a value (e.g. {@code [for i in 1..n do i*i]})
   */
  public ForLoop(
      VarSymbol index,
      VarSymbol iterator,
      @Nullable BlockStmt initBody,
      boolean zippered,
      boolean loweredFromParallel,
      boolean forExpression) {
    super(initBody);
    this.index = adopt(new SymExpr(index));
    this.iterator = adopt(new SymExpr(iterator));
    this.zippered = zippered;
    this.loweredFromParallel = loweredFromParallel;
    this.forExpression = forExpression;
  }

  /** Used by {@link #copyInner}, which fills in the fields. */
  private ForLoop() {
    super(null);
  }

  /** The reference to the variable holding the current element. */
  public @Nullable SymExpr indexGet() {
    return index;
  }

  /** The reference to the variable holding the iterator state. */
  public @Nullable SymExpr iteratorGet() {
    return iterator;
  }

  public boolean zipperedGet() {
    return zippered;
  }

  /** True if this loop is the serial form of a {@code forall}. */
  public boolean isLoweredFromParallel() {
    return loweredFromParallel;
  }

  /** True if this loop produces a value. */
  public boolean isForExpression() {
    return forExpression;
  }

  /**
   * True if each iteration of this loop runs as a separate task (i.e. this is a {@code coforall}).
   * Such loops are represented as ForLoops whose index has {@link Flag#TASK_PARALLEL_INDEX_VAR}.
   */
  public boolean isTaskParallelLoop() {
    return index != null && index.symbol().hasFlag(Flag.TASK_PARALLEL_INDEX_VAR);
  }

  /** True if {@code sym} is the variable this loop assigns its current element to. */
  public boolean isInductionVar(Symbol sym) {
    return index != null && sym == index.symbol();
  }

  /** The declarations made by this loop's task intents, in their original order. */
  public List<DefExpr> shadowVariables() {
    return Collections.unmodifiableList(shadowVariables);
  }

  /** Appends a task intent declaration; {@code def} must declare a {@link ShadowVarSymbol}. */
  public void addShadowVariable(DefExpr def) {
    Preconditions.checkArgument(
        def.sym() instanceof ShadowVarSymbol, "%s is not a shadow var", def);
    shadowVariables.add(adopt(def));
  }

  public ImmutableList<LoopAttribute> attributes() {
    return attributes;
  }

  /** Sets the backend hints attached to this loop. */
  public void setAdditionalAttributes(List<LoopAttribute> attributes) {
    this.attributes = ImmutableList.copyOf(attributes);
  }

  /** ForLoops have no condition; reaching this is an internal error. */
  @Override
  public @Nullable CallExpr blockInfoGet() {
    throw InternalCompilerError.fatal(this, "ForLoop: unexpected call to blockInfoGet()");
  }

  /** ForLoops have no condition; reaching this is an internal error. */
  @Override
  public @Nullable CallExpr blockInfoSet(@Nullable CallExpr expr) {
    throw InternalCompilerError.fatal(this, "ForLoop: unexpected call to blockInfoSet()");
  }

  /** Dead ForLoops are removed by iterator lowering, never by this method. */
  @Override
  public boolean deadBlockCleanup() {
    throw InternalCompilerError.fatal(this, "ForLoop: deadBlockCleanup() is unreachable");
  }

  @Override
  protected void replaceChild(Expr oldAst, @Nullable Expr newAst) {
    if (oldAst == index) {
      index = adoptSymExpr(newAst);
    } else if (oldAst == iterator) {
      iterator = adoptSymExpr(newAst);
    } else if (oldAst instanceof DefExpr def && shadowVariables.contains(def)) {
      InternalCompilerError.check(newAst == null, this, "shadow variables can only be removed");
      shadowVariables.remove(def);
    } else {
      super.replaceChild(oldAst, newAst);
    }
  }

  /** The index and iterator may only be replaced by another symbol reference, or removed. */
  private @Nullable SymExpr adoptSymExpr(@Nullable Expr newAst) {
    InternalCompilerError.check(
        newAst == null || newAst instanceof SymExpr,
        this,
        "replacement %s is not a SymExpr",
        newAst);
    return (SymExpr) adoptNullable(newAst);
  }

  @Override
  protected ForLoop copyInner(SymbolMap map) {
    ForLoop result = new ForLoop();
    result.index = (index == null) ? null : result.adopt(index.copyInner(map));
    result.iterator = (iterator == null) ? null : result.adopt(iterator.copyInner(map));
    result.zippered = zippered;
    result.loweredFromParallel = loweredFromParallel;
    result.forExpression = forExpression;
    result.attributes = attributes;
    for (DefExpr def : shadowVariables) {
      result.shadowVariables.add(result.adopt(def.copyInner(map)));
    }
    copyContentsInto(result, map);
    copyLoopStateInto(result);
    return result;
  }

  @Override
  public ForLoop copy(SymbolMap map) {
    return (ForLoop) super.copy(map);
  }

  /** Returns a copy of this loop's body, as a new BlockStmt. */
  public BlockStmt copyBody() {
    return copyBody(new SymbolMap());
  }

  /**
   * Returns a copy of this loop's body, as a new BlockStmt; symbols declared in the body are
   * recorded in {@code map}, and references in the copy are remapped through it.
   */
  public BlockStmt copyBody(SymbolMap map) {
    BlockStmt result = new BlockStmt(blockTag);
    for (Expr stmt : body()) {
      result.insertAtTail(stmt.copyInner(map));
    }
    map.updateSymbols(result);
    return result;
  }

  /**
   * Inserts a copy of this loop's body before {@code beforeHere}, followed by a new label that
   * takes the place of {@code continueSym} in the copy; used when unrolling, with {@code
   * iteration} distinguishing the copies.
   */
  public void copyBodyHelper(
      Expr beforeHere, long iteration, SymbolMap map, LabelSymbol continueSym) {
    LabelSymbol continueLabel = new LabelSymbol("_continueLabel" + iteration);
    DefExpr defContinueLabel = new DefExpr(continueLabel);
    beforeHere.insertBefore(defContinueLabel);
    map.put(continueSym, continueLabel);
    defContinueLabel.insertBefore(copyBody(map));
  }

  @Override
  public void accept(AstVisitor visitor) {
    if (visitor.enterForLoop(this)) {
      acceptBody(visitor);
      if (index != null) {
        index.accept(visitor);
      }
      if (iterator != null) {
        iterator.accept(visitor);
      }
      if (useList != null) {
        useList.accept(visitor);
      }
      if (byrefVars != null) {
        byrefVars.accept(visitor);
      }
      for (DefExpr def : List.copyOf(shadowVariables)) {
        def.accept(visitor);
      }
      visitor.exitForLoop(this);
    }
  }

  @Override
  public void verify() {
    super.verify();
    if (blockInfo != null) {
      throw InternalCompilerError.fatal(this, "ForLoop.verify: blockInfo is not null");
    }
    if (index == null) {
      throw InternalCompilerError.fatal(this, "ForLoop.verify: index is null");
    }
    if (iterator == null) {
      throw InternalCompilerError.fatal(this, "ForLoop.verify: iterator is null");
    }
    if (useList != null) {
      throw InternalCompilerError.fatal(this, "ForLoop.verify: useList is not null");
    }
    if (byrefVars != null) {
      throw InternalCompilerError.fatal(this, "ForLoop.verify: byrefVars is not null");
    }
    verifyChild(index);
    verifyChild(iterator);
    shadowVariables.forEach(this::verifyChild);
  }

  /** The evaluation order is index, iterator, then the body. */
  @Override
  public Expr getFirstExpr() {
    if (index != null) {
      return index;
    } else if (iterator != null) {
      return iterator;
    } else if (head() != null) {
      return head().getFirstExpr();
    }
    return this;
  }

  @Override
  public Expr getNextExpr(Expr child) {
    if (child == index && iterator != null) {
      return iterator;
    } else if (child == index || child == iterator) {
      return (head() != null) ? head().getFirstExpr() : this;
    } else if (child instanceof DefExpr def && shadowVariables.contains(def)) {
      return this;
    }
    return super.getNextExpr(child);
  }

  @Override
  public void emit(CodeEmitter emitter) {
    throw InternalCompilerError.fatal(this, "ForLoop.emit: this should be unreachable");
  }

  @Override
  String printPrefix() {
    StringBuilder sb = new StringBuilder("for");
    if (zippered) {
      sb.append(" zip");
    }
    if (orderIndependent) {
      sb.append(" unordered");
    }
    if (isTaskParallelLoop()) {
      sb.append(" tasks");
    }
    return sb.append("(").append(index).append(" in ").append(iterator).append(")").toString();
  }
}
