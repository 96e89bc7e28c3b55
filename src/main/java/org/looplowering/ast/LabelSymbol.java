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

/**
 * A position in a statement list that a {@link GotoStmt} may transfer control to; the position is
 * that of the DefExpr declaring the label.
 */
public final class LabelSymbol extends Symbol {

  public LabelSymbol(String name) {
    super(name);
  }

  @Override
  protected Symbol copyInner() {
    return new LabelSymbol(name);
  }
}
