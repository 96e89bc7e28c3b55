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
 * Names of the library functions that lowered loops call, and of the range-building functions the
 * parser emits for range literals. Matching on these names is the only way to recognize these
 * constructs this early in compilation.
 */
public final class WellKnownNames {

  private WellKnownNames() {}

  /** Returns the iterator state for an iterable value. */
  public static final String GET_ITERATOR = "_getIterator";

  /** Returns a tuple of iterator states for a tuple of iterable values. */
  public static final String GET_ITERATOR_ZIP = "_getIteratorZip";

  /** Releases an iterator state returned by {@link #GET_ITERATOR} or {@link #GET_ITERATOR_ZIP}. */
  public static final String FREE_ITERATOR = "_freeIterator";

  /** Returns the current element of an iterator state. */
  public static final String ITERATOR_INDEX = "iteratorIndex";

  /** Builds a tuple from its arguments. */
  public static final String BUILD_TUPLE = "_buildTuple";

  /** {@code low..high} */
  public static final String BOUNDED_RANGE = "boundedRange";

  /** {@code low..} */
  public static final String LOW_BOUNDED_RANGE = "lowBoundedRange";

  /** {@code range by stride} */
  public static final String BY = "by";

  /** {@code range # count} */
  public static final String COUNT = "#";

  /** {@code directRangeIterate(low, high)} iterates {@code low..high} without building a range. */
  public static final String DIRECT_RANGE_ITER = "directRangeIterate";

  /** {@code directStridedRangeIterate(low, high, stride)} iterates {@code low..high by stride}. */
  public static final String DIRECT_STRIDED_RANGE_ITER = "directStridedRangeIterate";

  /** {@code directCountedRangeIterate(low, count)} iterates {@code low..#count}. */
  public static final String DIRECT_COUNTED_RANGE_ITER = "directCountedRangeIterate";

  /** The scratch variable that receives the current element. */
  public static final String INDEX_OF_INTEREST = "_indexOfInterest";

  /** The scratch variable that receives the iterator state. */
  public static final String ITERATOR = "_iterator";

  /** The loop variable substituted when the user's loop has no index. */
  public static final String ELIDED_INDEX = "_elidedIdx";

  /** An index pattern element that binds nothing. */
  public static final String BLANK_INDEX = "_";

  public static final String CONTINUE_LABEL = "_continueLabel";

  public static final String BREAK_LABEL = "_breakLabel";
}
