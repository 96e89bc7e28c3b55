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

/**
 * A hint attached to a loop for the benefit of the backend (for example {@code
 * ("vectorize.enable", true)}). Attributes are carried unchanged through lowering and copying.
 */
public record LoopAttribute(String key, Object value) {
  public LoopAttribute {
    Preconditions.checkNotNull(key);
    Preconditions.checkNotNull(value);
  }

  @Override
  public String toString() {
    return key + "=" + value;
  }
}
