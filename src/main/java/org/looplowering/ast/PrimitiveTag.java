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

package org.looplowering.ast;

/** The built-in operations a {@link CallExpr} may perform instead of calling a function. */
public enum PrimitiveTag {
  /** {@code move(lhs, rhs)}: stores the value of rhs in the variable referenced by lhs. */
  MOVE("move"),

  /** {@code zip(a, b, ...)}: the iteration source of a zippered loop, as produced by the parser. */
  ZIP("zip"),

  /** {@code expandTuple(t)}: the {@code ...t} syntax that spreads a tuple into its elements. */
  TUPLE_EXPAND("expandTuple");

  public final String printName;

  PrimitiveTag(String printName) {
    this.printName = printName;
  }
}
