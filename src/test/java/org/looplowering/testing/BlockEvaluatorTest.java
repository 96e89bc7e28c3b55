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


package org.looplowering.testing;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.looplowering.ast.BlockStmt;
import org.looplowering.ast.BlockStmt.BlockTag;
import org.looplowering.ast.CallExpr;
import org.looplowering.ast.DefExpr;
import org.looplowering.ast.DeferStmt;
import org.looplowering.ast.GotoStmt;
import org.looplowering.ast.LabelSymbol;
import org.looplowering.ast.Literal;
import org.looplowering.ast.PrimitiveTag;
import org.looplowering.ast.SymExpr;
import org.looplowering.ast.VarSymbol;
import org.looplowering.testing.BlockEvaluator.Outcome;

@RunWith(JUnit4.class)
public class BlockEvaluatorTest {

  private final List<Object> log = new ArrayList<>();
  private final BlockEvaluator evaluator = new BlockEvaluator();

  @Before
  public void setup() {
    evaluator.define(
        "log",
        args -> {
          log.addAll(args);
          return null;
        });
  }

  private static CallExpr log(String message) {
    return new CallExpr("log", Literal.of(message));
  }

  @Test
  public void movesAndCalls() {
    VarSymbol x = new VarSymbol("x");
    evaluator.define("plus1", args -> (Long) args.get(0) + 1);
    BlockStmt block = new BlockStmt(new DefExpr(x));
    block.insertAtTail(CallExpr.move(x, new CallExpr("plus1", Literal.of(41))));
    block.insertAtTail(new CallExpr("log", new SymExpr(x)));

    assertThat(evaluator.run(block)).isEqualTo(Outcome.NORMAL);
    assertThat(log).containsExactly(42L);
    assertThat(evaluator.valueOf(x)).isEqualTo(42L);
  }

  @Test
  public void deferredActionsRunInReverseOrder() {
    BlockStmt block = new BlockStmt(new DeferStmt(log("first")));
    block.insertAtTail(new DeferStmt(log("second")));
    block.insertAtTail(log("body"));

    evaluator.run(block);
    assertThat(log).containsExactly("body", "second", "first").inOrder();
  }

  @Test
  public void deferredActionsRunOnGotoOutOfBlock() {
    LabelSymbol out = new LabelSymbol("out");
    BlockStmt inner = new BlockStmt(new DeferStmt(log("cleanup")));
    inner.insertAtTail(GotoStmt.breakTo(out));
    inner.insertAtTail(log("skipped"));
    BlockStmt outer = new BlockStmt(inner);
    outer.insertAtTail(log("skipped too"));
    outer.insertAtTail(new DefExpr(out));
    outer.insertAtTail(log("after"));

    evaluator.run(outer);
    assertThat(log).containsExactly("cleanup", "after").inOrder();
  }

  @Test
  public void deferredActionNotYetReachedDoesNotRun() {
    BlockStmt block = new BlockStmt(GotoStmt.returnFromFunction());
    block.insertAtTail(new DeferStmt(log("unreached")));

    assertThat(evaluator.run(block)).isEqualTo(Outcome.RETURNED);
    assertThat(log).isEmpty();
  }

  @Test
  public void typeBlocksAreSkipped() {
    BlockStmt block = new BlockStmt(new BlockStmt(log("type"), BlockTag.TYPE));
    block.insertAtTail(new BlockStmt(log("normal")));

    evaluator.run(block);
    assertThat(log).containsExactly("normal");
  }

  @Test
  public void tupleIndexing() {
    VarSymbol t = new VarSymbol("t");
    evaluator.set(t, List.of("a", "b"));
    BlockStmt block =
        new BlockStmt(new CallExpr("log", new CallExpr(new SymExpr(t), Literal.of(1))));

    evaluator.run(block);
    assertThat(log).containsExactly("b");
  }

  @Test
  public void errors() {
    VarSymbol unset = new VarSymbol("unset");
    assertThrows(
        IllegalStateException.class,
        () -> evaluator.run(new BlockStmt(new CallExpr("undefined"))));
    assertThrows(
        IllegalStateException.class,
        () -> evaluator.run(new BlockStmt(new CallExpr("log", new SymExpr(unset)))));
    assertThrows(
        IllegalStateException.class,
        () -> evaluator.run(new BlockStmt(GotoStmt.breakTo(new LabelSymbol("nowhere")))));
    assertThrows(
        IllegalStateException.class,
        () -> evaluator.run(new BlockStmt(new CallExpr(PrimitiveTag.ZIP, Literal.of(1)))));
  }
}
