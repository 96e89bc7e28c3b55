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

import static com.google.common.flogger.LazyArgs.lazy;

import com.google.common.base.Preconditions;
import com.google.common.flogger.FluentLogger;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.looplowering.ast.BlockStmt;
import org.looplowering.ast.BlockStmt.BlockTag;
import org.looplowering.ast.CallExpr;
import org.looplowering.ast.DefExpr;
import org.looplowering.ast.DeferStmt;
import org.looplowering.ast.Expr;
import org.looplowering.ast.Flag;
import org.looplowering.ast.ForLoop;
import org.looplowering.ast.InternalCompilerError;
import org.looplowering.ast.LabelSymbol;
import org.looplowering.ast.LoopAttribute;
import org.looplowering.ast.SymExpr;
import org.looplowering.ast.VarSymbol;

/**
 * Desugars the parser's iterator-driven loops into {@link ForLoop}s. Each of the loop flavors is
 * lowered to the same statement sequence:
 *
 * <pre>
 * {
 *   def _indexOfInterest;
 *   def _iterator;
 *   move(_iterator, _getIterator(source));   // or a zippered form, see ZipExpander
 *   defer { _freeIterator(_iterator) }
 *   type { move(_indexOfInterest, iteratorIndex(_iterator)) }
 *   for (_indexOfInterest in _iterator) {
 *     ...bind the user's index variables from _indexOfInterest...
 *     { ...body... }
 *     _continueLabel:
 *   }
 *   _breakLabel:
 * }
 * </pre>
 *
 * <p>The type block is only evaluated to determine the index's type; the ForLoop itself stands for
 * repeated evaluation of it. Iterator lowering later rewrites the ForLoop using the iterator's
 * implementation.
 */
public final class ForLoopBuilder {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final LoweringOptions options;
  private final TempAllocator temps;
  private final IndexDestructurer destructurer;
  private final RangeIteratorOptimizer rangeOptimizer;
  private final ZipExpander zipExpander;

  public ForLoopBuilder(
      LoweringOptions options, TempAllocator temps, IndexDestructurer destructurer) {
    this.options = Preconditions.checkNotNull(options);
    this.temps = Preconditions.checkNotNull(temps);
    this.destructurer = Preconditions.checkNotNull(destructurer);
    this.rangeOptimizer = new RangeIteratorOptimizer(options);
    this.zipExpander = new ZipExpander(rangeOptimizer);
  }

  /** Returns a builder using the global options and the default collaborators. */
  public static ForLoopBuilder withDefaults() {
    return new ForLoopBuilder(
        LoweringOptions.global(), new UniqueTempAllocator(), new SimpleIndexDestructurer());
  }

  /** Lowers {@code for indices in iteratorExpr do body}. */
  public BlockStmt buildForLoop(
      @Nullable Expr indices,
      Expr iteratorExpr,
      BlockStmt body,
      boolean zippered,
      boolean isForExpr,
      List<LoopAttribute> attributes) {
    return build(
        LoopConfig.serial(zippered, isForExpr, attributes), indices, iteratorExpr, null, body);
  }

  /** Lowers {@code foreach indices in iteratorExpr with (intents) do body}. */
  public BlockStmt buildForeachLoop(
      @Nullable Expr indices,
      Expr iteratorExpr,
      @Nullable CallExpr intents,
      BlockStmt body,
      boolean zippered,
      boolean isForExpr,
      List<LoopAttribute> attributes) {
    return build(
        LoopConfig.vectorizable(zippered, isForExpr, attributes),
        indices,
        iteratorExpr,
        intents,
        body);
  }

  /** Lowers {@code coforall indices in iteratorExpr do body}. */
  public BlockStmt buildCoforallLoop(
      @Nullable Expr indices,
      Expr iteratorExpr,
      BlockStmt body,
      boolean zippered,
      List<LoopAttribute> attributes) {
    return build(LoopConfig.taskParallel(zippered, attributes), indices, iteratorExpr, null, body);
  }

  /** Lowers the serial loop that a {@code forall} has been converted to. */
  public BlockStmt buildLoweredForallLoop(
      @Nullable Expr indices,
      Expr iteratorExpr,
      BlockStmt body,
      boolean zippered,
      boolean isForExpr,
      List<LoopAttribute> attributes) {
    return build(
        LoopConfig.loweredParallel(zippered, isForExpr, attributes),
        indices,
        iteratorExpr,
        null,
        body);
  }

  /**
   * Lowers a loop with the given configuration.
   *
   * @param indices the user's index pattern, or null if the loop has no index
   * @param iteratorExpr the iteration source; must not be in a tree
   * @param intents a call whose actuals are the DefExprs of the loop's task intents, or null; the
   *     DefExprs are moved to the new loop, leaving {@code intents} empty
   * @param body the loop body; must not be in a tree
   * @return a new block containing the lowered loop
   */
  public BlockStmt build(
      LoopConfig config,
      @Nullable Expr indices,
      Expr iteratorExpr,
      @Nullable CallExpr intents,
      BlockStmt body) {
    Preconditions.checkNotNull(iteratorExpr);
    Preconditions.checkNotNull(body);
    VarSymbol index = temps.newTemp(WellKnownNames.INDEX_OF_INTEREST);
    VarSymbol iterator = temps.newTemp(WellKnownNames.ITERATOR);
    ForLoop loop =
        new ForLoop(
            index,
            iterator,
            body,
            config.zippered(),
            config.loweredFromParallel(),
            config.forExpression());
    LabelSymbol continueLabel = new LabelSymbol(WellKnownNames.CONTINUE_LABEL);
    LabelSymbol breakLabel = new LabelSymbol(WellKnownNames.BREAK_LABEL);
    BlockStmt result = new BlockStmt();

    iterator.addFlag(Flag.EXPR_TEMP);
    loop.setAdditionalAttributes(config.attributes());
    if (config.orderIndependent()) {
      loop.orderIndependentSet(true);
    }

    CallExpr iterInit = CallExpr.move(iterator, acquireIterator(iteratorExpr, config.zippered()));

    index.addFlag(Flag.INDEX_OF_INTEREST);
    CallExpr iterMove =
        CallExpr.move(index, new CallExpr(WellKnownNames.ITERATOR_INDEX, new SymExpr(iterator)));

    if (indices == null) {
      indices = new DefExpr(new VarSymbol(WellKnownNames.ELIDED_INDEX));
    }
    destructurer.checkIndices(indices);
    destructurer.destructure(loop, indices, new SymExpr(index), config.taskParallel());

    if (config.taskParallel()) {
      index.addFlag(Flag.TASK_PARALLEL_INDEX_VAR);
    }

    loop.continueLabelSet(continueLabel);
    loop.breakLabelSet(breakLabel);

    if (intents != null) {
      while (intents.numActuals() > 0) {
        Expr intent = intents.get(0).remove();
        InternalCompilerError.check(
            intent instanceof DefExpr, intent, "task intent is not a declaration");
        loop.addShadowVariable((DefExpr) intent);
      }
    }

    loop.insertAtTail(new DefExpr(continueLabel));

    result.insertAtTail(new DefExpr(index));
    result.insertAtTail(new DefExpr(iterator));
    result.insertAtTail(iterInit);
    result.insertAtTail(
        new DeferStmt(new CallExpr(WellKnownNames.FREE_ITERATOR, new SymExpr(iterator))));
    result.insertAtTail(new BlockStmt(iterMove, BlockTag.TYPE));
    result.insertAtTail(loop);
    result.insertAtTail(new DefExpr(breakLabel));

    if (options.verbose) {
      logger.atFine().log("lowered %s:\n%s", loop.describe(), lazy(result::toString));
    }
    return result;
  }

  /**
   * Returns the expression that initializes the loop's iterator. For an unzippered loop every
   * source (including a tuple) is treated the same way.
   */
  private Expr acquireIterator(Expr iteratorExpr, boolean zippered) {
    if (zippered) {
      return zipExpander.expand(iteratorExpr);
    }
    CallExpr getIterator = new CallExpr(WellKnownNames.GET_ITERATOR, iteratorExpr);
    rangeOptimizer.tryToReplaceWithDirectRangeIterator(iteratorExpr);
    return getIterator;
  }
}
