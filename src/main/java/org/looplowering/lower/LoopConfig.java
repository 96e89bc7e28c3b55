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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.looplowering.ast.LoopAttribute;

/**
 * The properties that distinguish the flavors of loop that {@link ForLoopBuilder} produces. The
 * static factory methods return the combinations that the parser uses.
 *
 * @param taskParallel each iteration runs as a separate task ({@code coforall})
 * @param orderIndependent the order of iterations is not observable ({@code foreach}, and the
 *     serial form of {@code forall})
 * @param zippered the iteration source is a {@code zip(...)} of several sources
 * @param loweredFromParallel the loop is the serial form of a {@code forall}
 * @param forExpression the loop produces a value
 * @param attributes backend hints to attach to the loop
 */
public record LoopConfig(
    boolean taskParallel,
    boolean orderIndependent,
    boolean zippered,
    boolean loweredFromParallel,
    boolean forExpression,
    ImmutableList<LoopAttribute> attributes) {

  public LoopConfig {
    Preconditions.checkNotNull(attributes);
  }

  /** A {@code for} loop. */
  public static LoopConfig serial(
      boolean zippered, boolean forExpression, List<LoopAttribute> attributes) {
    return new LoopConfig(
        false, false, zippered, false, forExpression, ImmutableList.copyOf(attributes));
  }

  /** A {@code foreach} loop. */
  public static LoopConfig vectorizable(
      boolean zippered, boolean forExpression, List<LoopAttribute> attributes) {
    return new LoopConfig(
        false, true, zippered, false, forExpression, ImmutableList.copyOf(attributes));
  }

  /** A {@code coforall} loop. */
  public static LoopConfig taskParallel(boolean zippered, List<LoopAttribute> attributes) {
    return new LoopConfig(true, false, zippered, false, false, ImmutableList.copyOf(attributes));
  }

  /** The serial loop that a {@code forall} is lowered to. */
  public static LoopConfig loweredParallel(
      boolean zippered, boolean forExpression, List<LoopAttribute> attributes) {
    return new LoopConfig(
        false, true, zippered, true, forExpression, ImmutableList.copyOf(attributes));
  }
}
