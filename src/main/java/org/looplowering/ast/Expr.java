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
import org.jspecify.annotations.Nullable;

/**
 * A node in the program tree. Statements are Exprs too, so a single parent pointer and a single set
 * of editing operations ({@link #remove}, {@link #replace}, {@link #insertBefore}) serve for both.
 *
 * <p>Each Expr has at most one parent; an Expr must be removed from its current parent before it
 * can be added to another.
 */
public abstract class Expr extends BaseAst {

  /** The node that contains this one, or null if this node is not in a tree. */
  @Nullable Expr parentExpr;

  public final @Nullable Expr parentExpr() {
    return parentExpr;
  }

  /** Makes {@code child} a child of this node; it must not currently have a parent. */
  @CanIgnoreReturnValue
  final <T extends Expr> T adopt(T child) {
    Preconditions.checkArgument(
        child.parentExpr == null, "%s is already in a tree", child.describe());
    child.parentExpr = this;
    return child;
  }

  /** Like {@link #adopt}, but allows null. */
  final <T extends Expr> @Nullable T adoptNullable(@Nullable T child) {
    return (child == null) ? null : adopt(child);
  }

  /** Detaches this node from its parent and returns it. */
  @CanIgnoreReturnValue
  public final Expr remove() {
    Expr parent = parentExpr;
    Preconditions.checkState(parent != null, "%s is not in a tree", describe());
    parent.replaceChild(this, null);
    parentExpr = null;
    return this;
  }

  /**
   * Replaces this node with {@code newExpr} in its parent; {@code newExpr} must not currently have
   * a parent. After this call this node is no longer in a tree.
   */
  public final void replace(Expr newExpr) {
    Expr parent = parentExpr;
    Preconditions.checkState(parent != null, "%s is not in a tree", describe());
    Preconditions.checkArgument(
        newExpr.parentExpr == null, "%s is already in a tree", newExpr.describe());
    parent.replaceChild(this, newExpr);
    parentExpr = null;
  }

  /** Inserts {@code newExpr} immediately before this node in its parent's list of children. */
  public final void insertBefore(Expr newExpr) {
    Expr parent = parentExpr;
    Preconditions.checkState(parent != null, "%s is not in a tree", describe());
    parent.insertChildBefore(this, newExpr);
  }

  /**
   * Replaces {@code oldAst} (which must be a child of this node) with {@code newAst}. If {@code
   * newAst} is null the child is removed. Implementations are responsible for setting the parent
   * pointer of {@code newAst}; {@link #remove} and {@link #replace} clear the parent pointer of
   * {@code oldAst}.
   */
  protected void replaceChild(Expr oldAst, @Nullable Expr newAst) {
    throw InternalCompilerError.fatal(this, "replaceChild: %s is not a child", oldAst.describe());
  }

  /**
   * Inserts {@code newExpr} before {@code child} in this node's list of children. Only nodes that
   * hold a list of children support this.
   */
  protected void insertChildBefore(Expr child, Expr newExpr) {
    throw InternalCompilerError.fatal(this, "insertBefore: children are not a list");
  }

  /**
   * Returns a deep copy of this subtree. Symbols declared in the subtree are copied, and references
   * to them within the copy are updated to refer to the copies.
   */
  public Expr copy() {
    return copy(new SymbolMap());
  }

  /**
   * Returns a deep copy of this subtree. Each symbol declared in the subtree is copied and recorded
   * in {@code map}; after copying, every symbol reference in the copy is remapped through {@code
   * map}, so callers can also pre-populate {@code map} to redirect references to symbols declared
   * outside the subtree.
   */
  public Expr copy(SymbolMap map) {
    Expr result = copyInner(map);
    map.updateSymbols(result);
    return result;
  }

  /**
   * Returns a copy of this subtree without remapping symbol references; symbols declared in the
   * subtree are copied and recorded in {@code map}. Used by {@link #copy(SymbolMap)} and
   * recursively by the copyInner methods of parent nodes.
   */
  protected abstract Expr copyInner(SymbolMap map);

  /** Calls the appropriate methods of {@code visitor} on this node and its children. */
  public abstract void accept(AstVisitor visitor);

  /**
   * Checks the structural invariants of this node and (recursively) its children; throws an {@link
   * InternalCompilerError} if one is violated.
   */
  public void verify() {}

  /**
   * Returns the first node of this subtree in evaluation order. For leaves this is the node itself.
   */
  public Expr getFirstExpr() {
    return this;
  }

  /**
   * Given one of this node's children, returns the node that follows it in evaluation order: the
   * first node of the next child, or this node if {@code child} is the last one.
   */
  public Expr getNextExpr(Expr child) {
    return this;
  }

  /**
   * Returns the node that follows this one in evaluation order, or null if this node is the root
   * of its tree.
   */
  public final @Nullable Expr nextInEvaluationOrder() {
    return (parentExpr == null) ? null : parentExpr.getNextExpr(this);
  }

  /** Renders this node as code. */
  public abstract void emit(CodeEmitter emitter);

  /** Verifies that {@code child} is non-null, has this node as its parent, and is valid. */
  final void verifyChild(@Nullable Expr child) {
    if (child != null) {
      InternalCompilerError.check(
          child.parentExpr == this, child, "parent is not %s", describe());
      child.verify();
    }
  }
}
