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

import org.looplowering.ast.CallExpr;
import org.looplowering.ast.Expr;

/**
 * The classification of an iteration source by {@link #classify}: one of the three anonymous range
 * forms that have a direct iterator, or {@link Unrecognized}.
 *
 * <p>Classification is purely syntactic and does not modify the tree; the operands recorded in a
 * {@link Recognized} shape are the original subtrees, which {@link Recognized#buildDirectIterator}
 * detaches.
 */
public sealed interface RangeShape {

  /** A shape that has a direct iterator. */
  sealed interface Recognized extends RangeShape {
    /**
     * Returns a call to the direct iterator for this range, moving the range's operands into it.
     * Leaves the original range expression without its operands, so the caller must replace it.
     */
    CallExpr buildDirectIterator();
  }

  /** {@code low..high} */
  record Bounded(Expr low, Expr high) implements Recognized {
    @Override
    public CallExpr buildDirectIterator() {
      return new CallExpr(WellKnownNames.DIRECT_RANGE_ITER, low.remove(), high.remove());
    }
  }

  /** {@code low..high by stride} */
  record StridedBounded(Expr low, Expr high, Expr stride) implements Recognized {
    @Override
    public CallExpr buildDirectIterator() {
      return new CallExpr(
          WellKnownNames.DIRECT_STRIDED_RANGE_ITER, low.remove(), high.remove(), stride.remove());
    }
  }

  /** {@code low..#count} */
  record CountedLowBounded(Expr low, Expr count) implements Recognized {
    @Override
    public CallExpr buildDirectIterator() {
      return new CallExpr(WellKnownNames.DIRECT_COUNTED_RANGE_ITER, low.remove(), count.remove());
    }
  }

  /** Anything else; {@code reason} is for logging. */
  record Unrecognized(String reason) implements RangeShape {}

  /** Classifies {@code iteratorExpr}. Never modifies it. */
  static RangeShape classify(Expr iteratorExpr) {
    if (!(iteratorExpr instanceof CallExpr call)) {
      return new Unrecognized("not an anonymous range");
    }
    CallExpr range;
    Expr stride = null;
    Expr count = null;
    if (call.isNamed(WellKnownNames.BY) || call.isNamed(WellKnownNames.COUNT)) {
      if (call.numActuals() != 2 || !(call.get(0) instanceof CallExpr operand)) {
        return new Unrecognized("operand is not an anonymous range");
      }
      range = operand;
      if (call.isNamed(WellKnownNames.BY)) {
        stride = call.get(1);
      } else {
        count = call.get(1);
      }
    } else {
      range = call;
    }
    boolean fullyBounded = range.isNamed(WellKnownNames.BOUNDED_RANGE) && range.numActuals() == 2;
    boolean lowBounded =
        range.isNamed(WellKnownNames.LOW_BOUNDED_RANGE) && range.numActuals() == 1;
    if (fullyBounded && count == null) {
      return (stride == null)
          ? new Bounded(range.get(0), range.get(1))
          : new StridedBounded(range.get(0), range.get(1), stride);
    } else if (lowBounded && count != null) {
      return new CountedLowBounded(range.get(0), count);
    } else if (fullyBounded) {
      return new Unrecognized("counted bounded range");
    } else if (lowBounded) {
      return new Unrecognized((stride == null) ? "unbounded range" : "strided unbounded range");
    }
    return new Unrecognized("not an anonymous range");
  }
}
