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

import org.jspecify.annotations.Nullable;

/**
 * A block whose statements are executed repeatedly. Each loop has a pair of labels: {@code break}
 * statements in the body go to the break label (which follows the loop), and {@code continue}
 * statements go to the continue label (the last statement of the body).
 */
public abstract class LoopStmt extends BlockStmt {
  @Nullable LabelSymbol breakLabel;

  @Nullable LabelSymbol continueLabel;

  /** True if the order of iterations has no observable effect, so they may be reordered. */
  boolean orderIndependent;

  /** The label the user wrote on the loop (e.g. for {@code break outer}), if any. */
  @Nullable String userLabel;

  protected LoopStmt(@Nullable BlockStmt initBody) {
    super(initBody, BlockTag.NORMAL);
  }

  @Override
  public final boolean isLoop() {
    return true;
  }

  public @Nullable LabelSymbol breakLabelGet() {
    return breakLabel;
  }

  public void breakLabelSet(@Nullable LabelSymbol label) {
    breakLabel = label;
  }

  public @Nullable LabelSymbol continueLabelGet() {
    return continueLabel;
  }

  public void continueLabelSet(@Nullable LabelSymbol label) {
    continueLabel = label;
  }

  public boolean isOrderIndependent() {
    return orderIndependent;
  }

  public void orderIndependentSet(boolean orderIndependent) {
    this.orderIndependent = orderIndependent;
  }

  public @Nullable String userLabel() {
    return userLabel;
  }

  public void userLabelSet(@Nullable String userLabel) {
    this.userLabel = userLabel;
  }

  /** Copies the loop-level state (labels, order independence, user label) into {@code result}. */
  final void copyLoopStateInto(LoopStmt result) {
    result.breakLabel = breakLabel;
    result.continueLabel = continueLabel;
    result.orderIndependent = orderIndependent;
    result.userLabel = userLabel;
  }

  /** Redirects this loop's labels according to {@code map}. */
  final void remapLabels(SymbolMap map) {
    if (breakLabel != null) {
      breakLabel = (LabelSymbol) map.getOrSelf(breakLabel);
    }
    if (continueLabel != null) {
      continueLabel = (LabelSymbol) map.getOrSelf(continueLabel);
    }
  }
}
