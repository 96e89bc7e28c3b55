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

import org.looplowering.ast.VarSymbol;

/** Creates the compiler-introduced variables that loop lowering needs. */
public interface TempAllocator {
  /**
   * Returns a new, undeclared variable with {@link org.looplowering.ast.Flag#TEMP} whose name is
   * based on {@code baseName} and differs from every other name this allocator has returned.
   */
  VarSymbol newTemp(String baseName);
}
