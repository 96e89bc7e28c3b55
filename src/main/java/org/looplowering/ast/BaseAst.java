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

import java.util.concurrent.atomic.AtomicInteger;

/**
 * The common superclass of tree nodes ({@link Expr}) and the symbols they declare and reference
 * ({@link Symbol}). Each instance is assigned an id when it is created; ids are never reused, so
 * they can be used to identify a node in diagnostics even after it has been copied or removed.
 */
public abstract class BaseAst {

  private static final AtomicInteger nextId = new AtomicInteger(1);

  /** A process-unique identifier for this node. */
  public final int id = nextId.getAndIncrement();

  /** Returns a short description of this node's kind and id, e.g. {@code "ForLoop#42"}. */
  public String describe() {
    return getClass().getSimpleName() + "#" + id;
  }
}
