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

/**
 * A visitor for walking a tree with {@link Expr#accept}. For each kind of node with children there
 * is a pair of methods: if {@code enterX} returns false the node's children (and {@code exitX}) are
 * skipped. Leaves have a single {@code visitX} method.
 *
 * <p>The default implementations visit everything and do nothing else, so implementations need
 * only override the methods for the nodes they care about.
 */
public interface AstVisitor {
  default boolean enterBlockStmt(BlockStmt node) {
    return true;
  }

  default void exitBlockStmt(BlockStmt node) {}

  /** Called for {@link ForLoop}s instead of {@link #enterBlockStmt}. */
  default boolean enterForLoop(ForLoop node) {
    return true;
  }

  default void exitForLoop(ForLoop node) {}

  default boolean enterCallExpr(CallExpr node) {
    return true;
  }

  default void exitCallExpr(CallExpr node) {}

  default boolean enterDefExpr(DefExpr node) {
    return true;
  }

  default void exitDefExpr(DefExpr node) {}

  default boolean enterDeferStmt(DeferStmt node) {
    return true;
  }

  default void exitDeferStmt(DeferStmt node) {}

  default boolean enterGotoStmt(GotoStmt node) {
    return true;
  }

  default void exitGotoStmt(GotoStmt node) {}

  default void visitSymExpr(SymExpr node) {}

  default void visitUnresolvedSymExpr(UnresolvedSymExpr node) {}

  default void visitLiteral(Literal node) {}
}
