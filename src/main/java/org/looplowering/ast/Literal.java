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

import com.google.common.base.Preconditions;
import org.looplowering.util.StringUtil;

/** An integer or string constant. */
public final class Literal extends Expr {
  private final Object value;

  private Literal(Object value) {
    this.value = value;
  }

  public static Literal of(long value) {
    return new Literal(value);
  }

  public static Literal of(String value) {
    return new Literal(Preconditions.checkNotNull(value));
  }

  /** Returns a Long or a String. */
  public Object value() {
    return value;
  }

  @Override
  protected Literal copyInner(SymbolMap map) {
    return new Literal(value);
  }

  @Override
  public void accept(AstVisitor visitor) {
    visitor.visitLiteral(this);
  }

  @Override
  public void emit(CodeEmitter emitter) {
    emitter.append(toString());
  }

  @Override
  public String toString() {
    return (value instanceof String s) ? StringUtil.escape(s) : value.toString();
  }
}
