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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.util.function.Supplier;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.looplowering.ast.CallExpr;
import org.looplowering.ast.Expr;
import org.looplowering.ast.Literal;
import org.looplowering.ast.SymExpr;
import org.looplowering.ast.VarSymbol;

@RunWith(TestParameterInjector.class)
public class RangeIteratorOptimizerTest {

  private LoweringOptions options;
  private RangeIteratorOptimizer optimizer;

  @Before
  public void setup() {
    options = new LoweringOptions();
    optimizer = new RangeIteratorOptimizer(options);
  }

  static CallExpr bounded(long low, long high) {
    return new CallExpr(WellKnownNames.BOUNDED_RANGE, Literal.of(low), Literal.of(high));
  }

  static CallExpr lowBounded(long low) {
    return new CallExpr(WellKnownNames.LOW_BOUNDED_RANGE, Literal.of(low));
  }

  static CallExpr by(Expr range, long stride) {
    return new CallExpr(WellKnownNames.BY, range, Literal.of(stride));
  }

  static CallExpr count(Expr range, long count) {
    return new CallExpr(WellKnownNames.COUNT, range, Literal.of(count));
  }

  /** Optimizes {@code source} as the argument of a call, and returns the resulting argument. */
  private Expr optimizeInPlace(Expr source, boolean expectChange) {
    CallExpr holder = new CallExpr(WellKnownNames.GET_ITERATOR, source);
    assertThat(optimizer.tryToReplaceWithDirectRangeIterator(source)).isEqualTo(expectChange);
    return holder.only();
  }

  @Test
  public void boundedRange() {
    Expr result = optimizeInPlace(bounded(1, 10), true);
    assertThat(result.toString()).isEqualTo("directRangeIterate(1, 10)");
    result.parentExpr().verify();
  }

  @Test
  public void stridedBoundedRange() {
    Expr result = optimizeInPlace(by(bounded(1, 10), 2), true);
    assertThat(result.toString()).isEqualTo("directStridedRangeIterate(1, 10, 2)");
  }

  @Test
  public void countedLowBoundedRange() {
    Expr result = optimizeInPlace(count(lowBounded(1), 10), true);
    assertThat(result.toString()).isEqualTo("directCountedRangeIterate(1, 10)");
  }

  @Test
  public void operandsAreMovedNotCopied() {
    VarSymbol n = new VarSymbol("n");
    SymExpr high = new SymExpr(n);
    CallExpr range =
        new CallExpr(WellKnownNames.BOUNDED_RANGE, new CallExpr("f", Literal.of(0)), high);
    Expr result = optimizeInPlace(range, true);
    assertThat(((CallExpr) result).get(1)).isSameInstanceAs(high);
    assertThat(high.parentExpr()).isSameInstanceAs(result);
    assertThat(range.parentExpr()).isNull();
  }

  /** Iteration sources that must be left alone. */
  enum DeclinedShape {
    UNBOUNDED(() -> lowBounded(1)),
    STRIDED_UNBOUNDED(() -> by(lowBounded(1), 2)),
    DOUBLY_STRIDED(() -> by(by(bounded(1, 10), 2), 2)),
    ALIGNED(() -> new CallExpr("align", bounded(1, 10), Literal.of(2))),
    COUNTED_BOUNDED(() -> count(bounded(1, 10), 2)),
    COUNTED_THEN_STRIDED(() -> by(count(lowBounded(1), 10), 2)),
    STRIDED_THEN_COUNTED(() -> count(by(bounded(1, 10), 2), 3)),
    RANGE_VARIABLE(() -> new SymExpr(new VarSymbol("r"))),
    WRONG_ARITY(() -> new CallExpr(WellKnownNames.BOUNDED_RANGE, Literal.of(1))),
    OTHER_CALL(() -> new CallExpr("myIter", Literal.of(1), Literal.of(10))),
    LITERAL(() -> Literal.of(7));

    final Supplier<Expr> source;

    DeclinedShape(Supplier<Expr> source) {
      this.source = source;
    }
  }

  @Test
  public void declinedShapesAreUnchanged(@TestParameter DeclinedShape shape) {
    Expr source = shape.source.get();
    String before = source.toString();
    Expr result = optimizeInPlace(source, false);
    assertThat(result).isSameInstanceAs(source);
    assertThat(result.toString()).isEqualTo(before);
  }

  @Test
  public void disabledLeavesInputUnchanged() {
    options.noOptimizeRangeIteration = true;
    CallExpr source = by(bounded(1, 10), 2);
    String before = source.toString();
    Expr result = optimizeInPlace(source, false);
    assertThat(result).isSameInstanceAs(source);
    assertThat(result.toString()).isEqualTo(before);

    // The switch is read on every call.
    options.noOptimizeRangeIteration = false;
    assertThat(optimizer.tryToReplaceWithDirectRangeIterator(source)).isTrue();
  }

  @Test
  public void sourceMustBeInTree() {
    assertThrows(
        IllegalArgumentException.class,
        () -> optimizer.tryToReplaceWithDirectRangeIterator(bounded(1, 10)));
  }

  @Test
  public void classifyIsPure() {
    CallExpr source = count(lowBounded(3), 4);
    RangeShape shape = RangeShape.classify(source);
    assertThat(shape).isInstanceOf(RangeShape.CountedLowBounded.class);
    assertThat(source.toString()).isEqualTo("#(lowBoundedRange(3), 4)");
    assertThat(((RangeShape.Unrecognized) RangeShape.classify(lowBounded(1))).reason())
        .isEqualTo("unbounded range");
  }
}
