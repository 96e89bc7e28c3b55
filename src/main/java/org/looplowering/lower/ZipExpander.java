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
import java.util.List;
import org.looplowering.ast.CallExpr;
import org.looplowering.ast.Expr;
import org.looplowering.ast.InternalCompilerError;
import org.looplowering.ast.PrimitiveTag;
import org.looplowering.ast.UnresolvedSymExpr;

/**
 * Rewrites the iteration source of a zippered loop into an expression that produces the loop's
 * iterator: a tuple with an iterator for each zipped source.
 */
public final class ZipExpander {

  private final RangeIteratorOptimizer rangeOptimizer;

  public ZipExpander(RangeIteratorOptimizer rangeOptimizer) {
    this.rangeOptimizer = Preconditions.checkNotNull(rangeOptimizer);
  }

  /**
   * Returns an expression that evaluates to the iterator for a zippered loop over {@code
   * iteratorExpr}, which must not be in a tree. If {@code iteratorExpr} is a {@code zip(...)}
   * primitive it is rewritten in place and returned; otherwise it is wrapped in a call to {@code
   * _getIteratorZip}.
   */
  public Expr expand(Expr iteratorExpr) {
    Preconditions.checkArgument(iteratorExpr.parentExpr() == null);
    if (iteratorExpr instanceof CallExpr zipExpr && zipExpr.isPrimitive(PrimitiveTag.ZIP)) {
      return expandZip(zipExpr);
    }
    // An older form of zippered loop, whose source is any expression yielding a tuple; the ranges
    // in a literal tuple are still optimized, but the call itself is left alone.
    CallExpr result = new CallExpr(WellKnownNames.GET_ITERATOR_ZIP, iteratorExpr);
    if (iteratorExpr instanceof CallExpr call && call.isNamed(WellKnownNames.BUILD_TUPLE)) {
      for (Expr actual : List.copyOf(call.actuals())) {
        rangeOptimizer.tryToReplaceWithDirectRangeIterator(actual);
      }
    }
    return result;
  }

  /**
   * Changes {@code zip(a, b, c, ...)} into {@code _buildTuple(_getIterator(a), _getIterator(b),
   * _getIterator(c), ...)}, with the special cases
   *
   * <ul>
   *   <li>{@code zip(a)} becomes {@code _getIterator(a)}; and
   *   <li>{@code zip(...t)} becomes {@code _getIteratorZip(t)}, which needs no tuple beyond the one
   *       the user wrote.
   * </ul>
   */
  private CallExpr expandZip(CallExpr zipExpr) {
    int numSources = zipExpr.numActuals();
    InternalCompilerError.check(numSources >= 1, zipExpr, "zip() has no arguments");
    if (numSources == 1) {
      Expr zipArg = zipExpr.only();
      if (zipArg instanceof CallExpr spread && spread.isPrimitive(PrimitiveTag.TUPLE_EXPAND)) {
        zipExpr.setBaseExpr(new UnresolvedSymExpr(WellKnownNames.GET_ITERATOR_ZIP));
        Expr tupleArg = spread.only().remove();
        spread.replace(tupleArg);
      } else {
        zipExpr.setBaseExpr(new UnresolvedSymExpr(WellKnownNames.GET_ITERATOR));
        rangeOptimizer.tryToReplaceWithDirectRangeIterator(zipArg);
      }
    } else {
      zipExpr.setBaseExpr(new UnresolvedSymExpr(WellKnownNames.BUILD_TUPLE));
      for (Expr arg : List.copyOf(zipExpr.actuals())) {
        CallExpr getIterator = new CallExpr(WellKnownNames.GET_ITERATOR);
        arg.replace(getIterator);
        getIterator.insertAtTail(arg);
        rangeOptimizer.tryToReplaceWithDirectRangeIterator(arg);
      }
    }
    return zipExpr;
  }
}
