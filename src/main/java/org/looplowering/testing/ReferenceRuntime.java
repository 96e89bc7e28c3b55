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


package org.looplowering.testing;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.jspecify.annotations.Nullable;
import org.looplowering.lower.WellKnownNames;

/**
 * Definitions of the functions that lowered loops call: the iterator protocol, the range builders
 * that the parser emits for range literals, and the direct range iterators. Integers are
 * represented as Longs, tuples as Lists, and iterator states as {@link Iterator}s.
 *
 * <p>Counts of iterator acquisitions and releases are kept so that tests can check that every
 * iterator is released.
 */
public final class ReferenceRuntime {

  /**
   * An integer range {@code low..high by stride}; {@code high} is null for a range with no upper
   * bound. Ranges with a positive stride are iterated up from {@code low}; those with a negative
   * stride down from {@code high}.
   */
  public record Range(long low, @Nullable Long high, long stride) implements Iterable<Long> {
    public Range {
      Preconditions.checkArgument(stride != 0, "stride must not be zero");
      Preconditions.checkArgument(
          stride > 0 || high != null, "unbounded range can't have a negative stride");
    }

    public static Range bounded(long low, long high) {
      return new Range(low, high, 1);
    }

    public static Range lowBounded(long low) {
      return new Range(low, null, 1);
    }

    /** {@code this by newStride} */
    public Range by(long newStride) {
      return new Range(low, high, Math.multiplyExact(stride, newStride));
    }

    /** {@code this # count}: the first {@code count} elements of this range, in iteration order. */
    public Range count(long count) {
      Preconditions.checkArgument(count >= 0, "negative count %s", count);
      long offset = Math.multiplyExact(count - 1, stride);
      if (stride > 0) {
        long last = Math.addExact(low, offset);
        Preconditions.checkArgument(
            high == null || last <= high, "count %s exceeds the size of %s", count, this);
        return new Range(low, last, stride);
      }
      long first = Math.addExact(high, offset);
      Preconditions.checkArgument(first >= low, "count %s exceeds the size of %s", count, this);
      return new Range(first, high, stride);
    }

    @Override
    public Iterator<Long> iterator() {
      return new Iterator<Long>() {
        long next = (stride > 0) ? low : high;
        boolean done = (stride > 0) ? (high != null && low > high) : high < low;

        @Override
        public boolean hasNext() {
          return !done;
        }

        @Override
        public Long next() {
          if (done) {
            throw new NoSuchElementException();
          }
          long result = next;
          done = !hasSuccessor(result);
          if (!done) {
            next = result + stride;
          }
          return result;
        }
      };
    }

    /** True if {@code value + stride} is in this range; never overflows. */
    private boolean hasSuccessor(long value) {
      if (stride > 0) {
        return value <= Long.MAX_VALUE - stride && (high == null || value + stride <= high);
      }
      return value >= Long.MIN_VALUE - stride && value + stride >= low;
    }

    @Override
    public String toString() {
      String result = low + ".." + ((high == null) ? "" : high);
      return (stride == 1) ? result : result + " by " + stride;
    }
  }

  private int acquired;

  private int released;

  private int directIterators;

  /** The number of iterator states returned so far. */
  public int acquired() {
    return acquired;
  }

  /** The number of calls to {@code _freeIterator} so far. */
  public int released() {
    return released;
  }

  /** The number of direct range iterators created so far. */
  public int directIterators() {
    return directIterators;
  }

  /** Defines this runtime's functions in {@code evaluator}. */
  public void install(BlockEvaluator evaluator) {
    evaluator
        .define(
            WellKnownNames.BOUNDED_RANGE, args -> Range.bounded(longArg(args, 0), longArg(args, 1)))
        .define(WellKnownNames.LOW_BOUNDED_RANGE, args -> Range.lowBounded(longArg(args, 0)))
        .define(WellKnownNames.BY, args -> rangeArg(args, 0).by(longArg(args, 1)))
        .define(WellKnownNames.COUNT, args -> rangeArg(args, 0).count(longArg(args, 1)))
        .define(
            WellKnownNames.DIRECT_RANGE_ITER,
            args -> direct(Range.bounded(longArg(args, 0), longArg(args, 1))))
        .define(
            WellKnownNames.DIRECT_STRIDED_RANGE_ITER,
            args -> direct(Range.bounded(longArg(args, 0), longArg(args, 1)).by(longArg(args, 2))))
        .define(
            WellKnownNames.DIRECT_COUNTED_RANGE_ITER,
            args -> direct(Range.lowBounded(longArg(args, 0)).count(longArg(args, 1))))
        .define(
            WellKnownNames.BUILD_TUPLE, args -> Collections.unmodifiableList(new ArrayList<>(args)))
        .define(WellKnownNames.GET_ITERATOR, args -> getIterator(args.get(0)))
        .define(WellKnownNames.GET_ITERATOR_ZIP, this::getIteratorZip)
        .define(
            WellKnownNames.FREE_ITERATOR,
            args -> {
              ++released;
              return null;
            });
  }

  private Iterator<?> direct(Range range) {
    ++directIterators;
    return range.iterator();
  }

  /** Returns an iterator over a range, a tuple, or the values of a direct iterator. */
  private Iterator<?> getIterator(@Nullable Object iterable) {
    Iterator<?> result;
    if (iterable instanceof Iterator<?> it) {
      result = it;
    } else if (iterable instanceof Iterable<?> values) {
      result = values.iterator();
    } else {
      throw new IllegalArgumentException("not iterable: " + iterable);
    }
    ++acquired;
    return result;
  }

  /** Given a tuple of iterables, returns a tuple of their iterators. */
  private List<Iterator<?>> getIteratorZip(List<@Nullable Object> args) {
    Object tuple = args.get(0);
    Preconditions.checkArgument(tuple instanceof List, "zip of a non-tuple %s", tuple);
    List<Iterator<?>> result = new ArrayList<>();
    for (Object iterable : (List<?>) tuple) {
      result.add(getIterator(iterable));
    }
    return Collections.unmodifiableList(result);
  }

  private static long longArg(List<@Nullable Object> args, int i) {
    Object arg = args.get(i);
    Preconditions.checkArgument(arg instanceof Long, "argument %s is not an integer: %s", i, arg);
    return (Long) arg;
  }

  private static Range rangeArg(List<@Nullable Object> args, int i) {
    Object arg = args.get(i);
    Preconditions.checkArgument(arg instanceof Range, "argument %s is not a range: %s", i, arg);
    return (Range) arg;
  }
}
