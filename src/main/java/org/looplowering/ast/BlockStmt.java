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
 * An ordered sequence of statements, which is also a scope: {@link DeferStmt}s in the sequence run
 * when control leaves the block.
 *
 * <p>BlockStmt also carries three legacy slots ({@code blockInfo}, {@code useList}, and {@code
 * byrefVars}) that older loop representations used for a loop condition and for scope metadata.
 * They are kept so that verification can detect trees that still use them.
 */
public class BlockStmt extends Expr {

  /** Distinguishes blocks that are evaluated differently from ordinary scopes. */
  public enum BlockTag {
    NORMAL,

    /** A block that does not introduce a scope. */
    SCOPELESS,

    /**
     * A block that is only evaluated for the types of the expressions it contains; it produces no
     * code.
     */
    TYPE
  }

  private final List<Expr> body = new ArrayList<>();

  BlockTag blockTag;

  /** Legacy loop condition; see the class comment. */
  @Nullable CallExpr blockInfo;

  /** Legacy scope metadata; see the class comment. */
  @Nullable CallExpr useList;

  /** Legacy scope metadata; see the class comment. */
  @Nullable CallExpr byrefVars;

  public BlockStmt() {
    this(null, BlockTag.NORMAL);
  }

  public BlockStmt(BlockTag blockTag) {
    this(null, blockTag);
  }

  /** Creates a block whose only statement (if {@code initBody} is non-null) is {@code initBody}. */
  public BlockStmt(@Nullable Expr initBody) {
    this(initBody, BlockTag.NORMAL);
  }

  public BlockStmt(@Nullable Expr initBody, BlockTag blockTag) {
    this.blockTag = Preconditions.checkNotNull(blockTag);
    if (initBody != null) {
      insertAtTail(initBody);
    }
  }

  public BlockTag blockTag() {
    return blockTag;
  }

  /** An unmodifiable view of this block's statements. */
  public List<Expr> body() {
    return Collections.unmodifiableList(body);
  }

  public int length() {
    return body.size();
  }

  public @Nullable Expr head() {
    return body.isEmpty() ? null : body.get(0);
  }

  public @Nullable Expr tail() {
    return body.isEmpty() ? null : body.get(body.size() - 1);
  }

  @CanIgnoreReturnValue
  public BlockStmt insertAtTail(Expr stmt) {
    body.add(adopt(stmt));
    return this;
  }

  @CanIgnoreReturnValue
  public BlockStmt insertAtHead(Expr stmt) {
    body.add(0, adopt(stmt));
    return this;
  }

  /** Returns the legacy loop condition; see the class comment. */
  public @Nullable CallExpr blockInfoGet() {
    return blockInfo;
  }

  /** Sets the legacy loop condition and returns the previous value. */
  @CanIgnoreReturnValue
  public @Nullable CallExpr blockInfoSet(@Nullable CallExpr expr) {
    CallExpr prev = blockInfo;
    if (prev != null) {
      prev.parentExpr = null;
    }
    blockInfo = adoptNullable(expr);
    return prev;
  }

  /** True for subclasses that represent loops. */
  public boolean isLoop() {
    return false;
  }

  /**
   * Removes this block if it can be shown to be dead; returns true if it was removed. Plain blocks
   * are never removed by this method.
   */
  public boolean deadBlockCleanup() {
    return false;
  }

  @Override
  protected void replaceChild(Expr oldAst, @Nullable Expr newAst) {
    if (oldAst == blockInfo) {
      blockInfo = (CallExpr) adoptNullable(newAst);
    } else if (oldAst == useList) {
      useList = (CallExpr) adoptNullable(newAst);
    } else if (oldAst == byrefVars) {
      byrefVars = (CallExpr) adoptNullable(newAst);
    } else {
      int i = indexOf(oldAst);
      if (newAst == null) {
        body.remove(i);
      } else {
        body.set(i, adopt(newAst));
      }
    }
  }

  @Override
  protected void insertChildBefore(Expr child, Expr newExpr) {
    body.add(indexOf(child), adopt(newExpr));
  }

  final int indexOf(Expr child) {
    for (int i = 0; i < body.size(); i++) {
      if (body.get(i) == child) {
        return i;
      }
    }
    throw InternalCompilerError.fatal(this, "%s is not in this block", child.describe());
  }

  /** Copies this block's statements (and legacy slots) into {@code result}. */
  final void copyContentsInto(BlockStmt result, SymbolMap map) {
    for (Expr stmt : body) {
      result.insertAtTail(stmt.copyInner(map));
    }
    if (blockInfo != null) {
      result.blockInfo = result.adopt(blockInfo.copyInner(map));
    }
    if (useList != null) {
      result.useList = result.adopt(useList.copyInner(map));
    }
    if (byrefVars != null) {
      result.byrefVars = result.adopt(byrefVars.copyInner(map));
    }
  }

  @Override
  protected BlockStmt copyInner(SymbolMap map) {
    BlockStmt result = new BlockStmt(blockTag);
    copyContentsInto(result, map);
    return result;
  }

  @Override
  public BlockStmt copy(SymbolMap map) {
    return (BlockStmt) super.copy(map);
  }

  /** Visits each statement in order. */
  final void acceptBody(AstVisitor visitor) {
    for (Expr stmt : List.copyOf(body)) {
      stmt.accept(visitor);
    }
  }

  @Override
  public void accept(AstVisitor visitor) {
    if (visitor.enterBlockStmt(this)) {
      acceptBody(visitor);
      if (blockInfo != null) {
        blockInfo.accept(visitor);
      }
      if (useList != null) {
        useList.accept(visitor);
      }
      if (byrefVars != null) {
        byrefVars.accept(visitor);
      }
      visitor.exitBlockStmt(this);
    }
  }

  @Override
  public void verify() {
    body.forEach(this::verifyChild);
    verifyChild(blockInfo);
    verifyChild(useList);
    verifyChild(byrefVars);
  }

  @Override
  public Expr getFirstExpr() {
    return body.isEmpty() ? this : body.get(0).getFirstExpr();
  }

  @Override
  public Expr getNextExpr(Expr child) {
    int next = indexOf(child) + 1;
    return (next < body.size()) ? body.get(next).getFirstExpr() : this;
  }

  @Override
  public void emit(CodeEmitter emitter) {
    if (blockTag == BlockTag.TYPE) {
      return;
    }
    emitter.append("{");
    emitter.indent();
    for (Expr stmt : body) {
      emitter.statement(stmt);
    }
    emitter.outdent();
    emitter.newLine().append("}");
  }

  /** Returns the prefix used by {@link #toString} to identify this kind of block. */
  String printPrefix() {
    return switch (blockTag) {
      case NORMAL -> "";
      case SCOPELESS -> "scopeless";
      case TYPE -> "type";
    };
  }

  @Override
  public String toString() {
    return StringUtil.joinElements(printPrefix() + "{", "; ", "}", body);
  }
}
