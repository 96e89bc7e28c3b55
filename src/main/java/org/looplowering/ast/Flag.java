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

/** Properties that may be attached to a {@link Symbol}. */
public enum Flag {
  /** A compiler-introduced variable. */
  TEMP,

  /** A temporary that holds the value of an expression (such as an iterator) for its lifetime. */
  EXPR_TEMP,

  /** The scratch variable that holds a loop's current element before destructuring. */
  INDEX_OF_INTEREST,

  /** A user-visible loop index variable. */
  INDEX_VAR,

  /**
   * An index variable of a loop whose iterations each run as a separate task; bindings of these
   * variables are task-local.
   */
  TASK_PARALLEL_INDEX_VAR
}
