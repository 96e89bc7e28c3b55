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

import org.looplowering.ast.Expr;
import org.looplowering.ast.ForLoop;
import org.looplowering.ast.SymExpr;

/**
 * Binds the user's loop variables from the loop's current element. The index pattern may be a
 * single name or declaration, or a (possibly nested) tuple of them.
 */
public interface IndexDestructurer {
  /**
   * Checks that {@code indices} is a valid index pattern; throws a {@link CompileError} if it is
   * not.
   */
  void checkIndices(Expr indices);

  /**
   * Adds the declarations and assignments that bind the variables of {@code indices} from {@code
   * source} to the beginning of {@code loop}'s body, so that each iteration gets fresh bindings.
   * Takes ownership of {@code indices} and {@code source}.
   *
   * @param taskParallel true if the loop's iterations run as separate tasks, in which case the
   *     loop variables are task-local
   */
  void destructure(ForLoop loop, Expr indices, SymExpr source, boolean taskParallel);
}
