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

import java.util.IdentityHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A rename table from symbols to their replacements, used when copying subtrees. Copying a {@link
 * DefExpr} records the new symbol here; callers may also add entries to redirect references to
 * symbols declared outside the copied subtree.
 */
public final class SymbolMap {
  private final Map<Symbol, Symbol> map = new IdentityHashMap<>();

  public void put(Symbol from, Symbol to) {
    map.put(from, to);
  }

  public @Nullable Symbol get(Symbol from) {
    return map.get(from);
  }

  /** Returns the replacement for {@code from}, or {@code from} itself if it has none. */
  public Symbol getOrSelf(Symbol from) {
    return map.getOrDefault(from, from);
  }

  public boolean containsKey(Symbol from) {
    return map.containsKey(from);
  }

  public int size() {
    return map.size();
  }

  /**
   * Redirects every symbol reference in the given subtree (including the labels of any loops it
   * contains and the outer variables of their task intents) according to this map.
   */
  public void updateSymbols(Expr root) {
    if (map.isEmpty()) {
      return;
    }
    root.accept(
        new AstVisitor() {
          @Override
          public boolean enterForLoop(ForLoop node) {
            node.remapLabels(SymbolMap.this);
            for (DefExpr def : node.shadowVariables()) {
              ((ShadowVarSymbol) def.sym()).remapOuter(SymbolMap.this);
            }
            return true;
          }

          @Override
          public void visitSymExpr(SymExpr node) {
            Symbol replacement = map.get(node.symbol());
            if (replacement != null) {
              node.setSymbol(replacement);
            }
          }
        });
  }
}
