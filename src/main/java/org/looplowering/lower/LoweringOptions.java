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

/**
 * Settings that affect loop lowering. {@link #global()} returns the process-wide instance, which is
 * initialized from system properties; tests and embedders may also create their own.
 */
public final class LoweringOptions {

  private static final LoweringOptions GLOBAL = fromSystemProperties();

  /**
   * If true, iteration over simple anonymous ranges is not replaced by direct range iterators. Read
   * each time the optimizer runs, so it may be changed between loops.
   */
  public boolean noOptimizeRangeIteration;

  /** If true, each lowered loop is logged (at FINE). */
  public boolean verbose;

  /** Returns the process-wide options. */
  public static LoweringOptions global() {
    return GLOBAL;
  }

  /**
   * Returns a new LoweringOptions initialized from the system properties {@code
   * looplowering.noOptimizeRangeIteration} and {@code looplowering.verbose}.
   */
  public static LoweringOptions fromSystemProperties() {
    LoweringOptions options = new LoweringOptions();
    options.noOptimizeRangeIteration = Boolean.getBoolean("looplowering.noOptimizeRangeIteration");
    options.verbose = Boolean.getBoolean("looplowering.verbose");
    return options;
  }
}
