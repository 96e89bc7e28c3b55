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

import com.google.common.base.Strings;
import com.google.common.flogger.FluentLogger;
import org.jspecify.annotations.Nullable;

/**
 * Thrown when a tree invariant is found to be violated. These indicate a bug in the compiler (in
 * the pass that built the tree, or in the pass that should have rewritten it), never a problem with
 * the user's program, and are not expected to be caught.
 */
public final class InternalCompilerError extends Error {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** The node that was found to be malformed, if known. */
  private final transient @Nullable BaseAst node;

  private InternalCompilerError(String message, @Nullable BaseAst node) {
    super(message);
    this.node = node;
  }

  public @Nullable BaseAst node() {
    return node;
  }

  /**
   * Returns a new InternalCompilerError with a message built from {@code format} and {@code args}
   * (using {@code %s} placeholders) and identifying {@code node}. Callers should throw the result.
   */
  public static InternalCompilerError fatal(
      @Nullable BaseAst node, String format, @Nullable Object... args) {
    String message = Strings.lenientFormat(format, args);
    if (node != null) {
      message = message + " [" + node.describe() + "]";
    }
    logger.atSevere().log("internal error: %s", message);
    return new InternalCompilerError(message, node);
  }

  /** Throws an InternalCompilerError if {@code condition} is false. */
  public static void check(
      boolean condition, @Nullable BaseAst node, String format, @Nullable Object... args) {
    if (!condition) {
      throw fatal(node, format, args);
    }
  }
}
