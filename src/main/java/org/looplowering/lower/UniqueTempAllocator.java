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

import java.util.HashMap;
import java.util.Map;
import org.looplowering.ast.Flag;
import org.looplowering.ast.VarSymbol;

/**
 * A TempAllocator that returns {@code baseName} itself the first time it is requested, and {@code
 * baseName} followed by a sequence number ({@code 2}, {@code 3}, ...) on subsequent requests.
 */
public final class UniqueTempAllocator implements TempAllocator {
  private final Map<String, Integer> counts = new HashMap<>();

  @Override
  public VarSymbol newTemp(String baseName) {
    int n = counts.merge(baseName, 1, Integer::sum);
    VarSymbol result = new VarSymbol((n == 1) ? baseName : baseName + n);
    result.addFlag(Flag.TEMP);
    return result;
  }
}
