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

import org.jspecify.annotations.Nullable;
import org.looplowering.ast.Expr;

/** A problem with the user's program, to be reported to the user. */
public class CompileError extends RuntimeException {

  /** The expression the error refers to, if any. */
  private final transient @Nullable Expr where;

  public CompileError(@Nullable Expr where, String message) {
    super(message);
    this.where = where;
  }

  public @Nullable Expr where() {
    return where;
  }
}
