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

import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * Renders a fully lowered tree as block-structured code. This is the last step that sees the tree,
 * so it must never be given a node (such as {@link ForLoop}) that an earlier pass was supposed to
 * rewrite away; such nodes throw an {@link InternalCompilerError} from their {@link Expr#emit}.
 */
public final class CodeEmitter {
  private static final String INDENT = "  ";

  private final StringBuilder out = new StringBuilder();

  private int depth;

  /** Returns the code for {@code root}. */
  public static String emit(Expr root) {
    CodeEmitter emitter = new CodeEmitter();
    root.emit(emitter);
    return emitter.out.toString();
  }

  @CanIgnoreReturnValue
  public CodeEmitter append(String s) {
    out.append(s);
    return this;
  }

  /** Starts a new line at the current indentation. */
  @CanIgnoreReturnValue
  public CodeEmitter newLine() {
    out.append('\n');
    for (int i = 0; i < depth; i++) {
      out.append(INDENT);
    }
    return this;
  }

  public void indent() {
    ++depth;
  }

  public void outdent() {
    assert depth > 0;
    --depth;
  }

  /**
   * Emits {@code stmt} on a new line. Statements that produce no code (such as type blocks) leave
   * no blank line behind.
   */
  public void statement(Expr stmt) {
    int mark = out.length();
    newLine();
    int start = out.length();
    stmt.emit(this);
    if (out.length() == start) {
      out.setLength(mark);
    } else if (stmt instanceof CallExpr) {
      out.append(";");
    }
  }
}
