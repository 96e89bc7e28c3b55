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

import java.util.ArrayList;
import java.util.List;
import org.looplowering.ast.CallExpr;
import org.looplowering.ast.DefExpr;
import org.looplowering.ast.Expr;
import org.looplowering.ast.Flag;
import org.looplowering.ast.ForLoop;
import org.looplowering.ast.Literal;
import org.looplowering.ast.SymExpr;
import org.looplowering.ast.Symbol;
import org.looplowering.ast.UnresolvedSymExpr;
import org.looplowering.ast.VarSymbol;

/**
 * An IndexDestructurer for index patterns built from
 *
 * <ul>
 *   <li>a {@link DefExpr} of a {@link VarSymbol}, which is bound to the source;
 *   <li>an {@link UnresolvedSymExpr}, which declares a new variable with that name (or, if the name
 *       is {@code _}, binds nothing); and
 *   <li>a call to {@code _buildTuple} of patterns, whose i-th element is bound to element i of the
 *       source.
 * </ul>
 */
public final class SimpleIndexDestructurer implements IndexDestructurer {

  @Override
  public void checkIndices(Expr indices) {
    if (indices instanceof DefExpr def) {
      if (!(def.sym() instanceof VarSymbol)) {
        throw new CompileError(indices, "invalid index variable " + def.sym());
      }
    } else if (indices instanceof CallExpr call && call.isNamed(WellKnownNames.BUILD_TUPLE)) {
      if (call.numActuals() == 0) {
        throw new CompileError(indices, "empty tuple is not a valid index");
      }
      call.actuals().forEach(this::checkIndices);
    } else if (!(indices instanceof UnresolvedSymExpr)) {
      throw new CompileError(indices, "invalid index expression");
    }
  }

  @Override
  public void destructure(ForLoop loop, Expr indices, SymExpr source, boolean taskParallel) {
    List<Expr> stmts = new ArrayList<>();
    bind(indices, source, taskParallel, stmts);
    for (int i = stmts.size() - 1; i >= 0; i--) {
      loop.insertAtHead(stmts.get(i));
    }
  }

  /** Appends to {@code stmts} the statements that bind {@code pattern} from {@code source}. */
  private static void bind(Expr pattern, Expr source, boolean taskParallel, List<Expr> stmts) {
    if (pattern.parentExpr() != null) {
      pattern.remove();
    }
    if (pattern instanceof DefExpr def) {
      declare(def, taskParallel, stmts);
      stmts.add(CallExpr.move(def.sym(), source));
    } else if (pattern instanceof UnresolvedSymExpr name) {
      if (!name.name.equals(WellKnownNames.BLANK_INDEX)) {
        DefExpr def = new DefExpr(new VarSymbol(name.name));
        declare(def, taskParallel, stmts);
        stmts.add(CallExpr.move(def.sym(), source));
      }
    } else {
      CallExpr tuple = (CallExpr) pattern;
      List<Expr> elements = List.copyOf(tuple.actuals());
      for (int i = 0; i < elements.size(); i++) {
        bind(elements.get(i), new CallExpr(source.copy(), Literal.of(i)), taskParallel, stmts);
      }
    }
  }

  private static void declare(DefExpr def, boolean taskParallel, List<Expr> stmts) {
    Symbol sym = def.sym();
    sym.addFlag(Flag.INDEX_VAR);
    if (taskParallel) {
      sym.addFlag(Flag.TASK_PARALLEL_INDEX_VAR);
    }
    stmts.add(def);
  }
}
