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

package org.looplowering.lower;

import com.google.common.base.Preconditions;
import com.google.common.flogger.FluentLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.looplowering.ast.CallExpr;
import org.looplowering.ast.Expr;

/**
 * Replaces iteration over simple anonymous ranges with calls to direct iterators that take the
 * range's bounds (and stride or count) as arguments, which avoids constructing a range object.
 *
 * <p>Only three forms are handled: {@code low..high}, {@code low..high by stride}, and {@code
 * low..#count}. For example {@code for i in 1..n}, {@code for i in lo..hi by 2}, and each range in
 * {@code zip(1..10 by 2, A)} are replaced; {@code 1..}, {@code 1..10 by 2 by 2}, {@code 1..10 align
 * 2}, {@code (1..10)#2}, {@code 1..#10 by 2}, and {@code r} (for a range variable {@code r}) are
 * left unchanged.
 *
 * <p>Recognition depends on the names and argument order of the range-building functions (see
 * {@link RangeShape#classify}), since nothing has been resolved this early. Anything not recognized
 * is left as it is, which is always correct, just slower.
 */
public final class RangeIteratorOptimizer {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final LoweringOptions options;

  public RangeIteratorOptimizer(LoweringOptions options) {
    this.options = Preconditions.checkNotNull(options);
  }

  /**
   * If {@code iteratorExpr} is a recognized range, replaces it (in its parent) with the equivalent
   * direct iterator call and returns true; otherwise leaves it unchanged and returns false. Does
   * nothing if {@link LoweringOptions#noOptimizeRangeIteration} is set.
   */
  @CanIgnoreReturnValue
  public boolean tryToReplaceWithDirectRangeIterator(Expr iteratorExpr) {
    if (options.noOptimizeRangeIteration) {
      return false;
    }
    Preconditions.checkArgument(
        iteratorExpr.parentExpr() != null, "%s is not in a tree", iteratorExpr.describe());
    RangeShape shape = RangeShape.classify(iteratorExpr);
    if (shape instanceof RangeShape.Recognized recognized) {
      CallExpr direct = recognized.buildDirectIterator();
      iteratorExpr.replace(direct);
      logger.atFine().log("replaced range iteration with %s", direct);
      return true;
    }
    logger.atFine().log(
        "not replacing %s: %s", iteratorExpr, ((RangeShape.Unrecognized) shape).reason());
    return false;
  }
}
