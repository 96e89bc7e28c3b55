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
import static org.looplowering.lower.RangeIteratorOptimizerTest.bounded;
import static org.looplowering.lower.RangeIteratorOptimizerTest.by;

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.looplowering.ast.CallExpr;
import org.looplowering.ast.Expr;
import org.looplowering.ast.InternalCompilerError;
import org.looplowering.ast.PrimitiveTag;
import org.looplowering.ast.SymExpr;
import org.looplowering.ast.VarSymbol;

@RunWith(JUnit4.class)
public class ZipExpanderTest {

  private final VarSymbol a = new VarSymbol("A");
  private final VarSymbol b = new VarSymbol("B");
  private final VarSymbol c = new VarSymbol("C");

  private LoweringOptions options;
  private ZipExpander expander;

  @Before
  public void setup() {
    options = new LoweringOptions();
    expander = new ZipExpander(new RangeIteratorOptimizer(options));
  }

  private static CallExpr zip(Expr... sources) {
    return new CallExpr(PrimitiveTag.ZIP, sources);
  }

  @Test
  public void singleSource() {
    Expr result = expander.expand(zip(new SymExpr(a)));
    assertThat(result.toString()).isEqualTo("_getIterator(A)");
    result.verify();
  }

  @Test
  public void singleRangeIsOptimized() {
    Expr result = expander.expand(zip(bounded(1, 10)));
    assertThat(result.toString()).isEqualTo("_getIterator(directRangeIterate(1, 10))");
  }

  @Test
  public void spreadTuple() {
    Expr result =
        expander.expand(zip(new CallExpr(PrimitiveTag.TUPLE_EXPAND, new SymExpr(a))));
    assertThat(result.toString()).isEqualTo("_getIteratorZip(A)");
    assertThat(((CallExpr) result).only()).isInstanceOf(SymExpr.class);
    result.verify();
  }

  @Test
  public void multipleSourcesInOrder() {
    Expr result = expander.expand(zip(new SymExpr(a), new SymExpr(b), new SymExpr(c)));
    assertThat(result.toString())
        .isEqualTo("_buildTuple(_getIterator(A), _getIterator(B), _getIterator(C))");
    result.verify();
  }

  @Test
  public void eachSourceIsOptimized() {
    Expr result = expander.expand(zip(by(bounded(1, 10), 2), new SymExpr(a), bounded(0, 4)));
    assertThat(result.toString())
        .isEqualTo(
            "_buildTuple(_getIterator(directStridedRangeIterate(1, 10, 2)), _getIterator(A),"
                + " _getIterator(directRangeIterate(0, 4)))");
  }

  @Test
  public void noOptimizationWhenDisabled() {
    options.noOptimizeRangeIteration = true;
    Expr result = expander.expand(zip(bounded(1, 10), new SymExpr(a)));
    assertThat(result.toString())
        .isEqualTo("_buildTuple(_getIterator(boundedRange(1, 10)), _getIterator(A))");
  }

  @Test
  public void emptyZipIsFatal() {
    assertThrows(InternalCompilerError.class, () -> expander.expand(zip()));
  }

  @Test
  public void legacyTupleSource() {
    CallExpr tuple =
        new CallExpr(WellKnownNames.BUILD_TUPLE, bounded(1, 3), new SymExpr(a), bounded(2, 5));
    Expr result = expander.expand(tuple);
    // The tuple is kept as it is, but the ranges in it are still optimized.
    assertThat(result.toString())
        .isEqualTo(
            "_getIteratorZip(_buildTuple(directRangeIterate(1, 3), A,"
                + " directRangeIterate(2, 5)))");
    assertThat(((CallExpr) result).only()).isSameInstanceAs(tuple);
  }

  @Test
  public void legacyOtherSource() {
    Expr result = expander.expand(new SymExpr(a));
    assertThat(result.toString()).isEqualTo("_getIteratorZip(A)");
  }

  @Test
  public void sourceMustNotBeInTree() {
    SymExpr source = new SymExpr(a);
    CallExpr unused = new CallExpr("f", source);
    assertThrows(IllegalArgumentException.class, () -> expander.expand(source));
  }
}
