/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.kernelise.eval;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.kernelise.type.PrimitiveType;

/**
 * Value of an array.
 *
 * <p>A one-dimensional array holds boxed scalars; an array of higher rank
 * holds one {@code ArrayValue} per row. Arrays are mutable, so that an
 * in-place update is visible through every variable that refers to the
 * array.
 */
public class ArrayValue {
  private final Object[] elements;

  private ArrayValue(Object[] elements) {
    this.elements = elements;
  }

  /** Creates an array with the given elements (or rows). */
  public static ArrayValue of(List<?> elements) {
    final Object[] array = elements.toArray();
    for (Object element : array) {
      requireNonNull(element, "element");
    }
    return new ArrayValue(array);
  }

  /** Creates an array with the given elements (or rows). */
  public static ArrayValue of(Object... elements) {
    return of(Arrays.asList(elements));
  }

  /** Creates a one-dimensional array of {@code i32} values. */
  public static ArrayValue ofInts(int... values) {
    final Object[] array = new Object[values.length];
    for (int i = 0; i < values.length; i++) {
      array[i] = values[i];
    }
    return new ArrayValue(array);
  }

  /** Creates an array of a given shape whose elements are all the zero value
   * of {@code elementType}. */
  public static ArrayValue scratch(PrimitiveType elementType,
      List<Integer> dims) {
    checkArgument(!dims.isEmpty(), "scratch needs a dimension");
    final int size = dims.get(0);
    checkArgument(size >= 0, "negative dimension %s", size);
    final Object[] array = new Object[size];
    for (int i = 0; i < size; i++) {
      array[i] = dims.size() == 1
          ? elementType.zero
          : scratch(elementType, dims.subList(1, dims.size()));
    }
    return new ArrayValue(array);
  }

  /** Creates an array of {@code n} copies of a value. */
  public static ArrayValue replicate(int n, Object value) {
    final Object[] array = new Object[n];
    for (int i = 0; i < n; i++) {
      array[i] = copyOf(value);
    }
    return new ArrayValue(array);
  }

  /** Returns a deep copy of a value, or the value itself if it is a
   * scalar. */
  public static Object copyOf(Object value) {
    return value instanceof ArrayValue ? ((ArrayValue) value).copy() : value;
  }

  /** Returns the number of elements (or rows). */
  public int size() {
    return elements.length;
  }

  /** Returns the element (or row) at position {@code i}. */
  public Object get(int i) {
    checkElementIndex(i, elements.length);
    return elements[i];
  }

  /** Overwrites the element (or row) at position {@code i}. */
  public void set(int i, Object value) {
    checkElementIndex(i, elements.length);
    elements[i] = requireNonNull(value);
  }

  /** Returns a deep copy of this array. */
  public ArrayValue copy() {
    final Object[] array = new Object[elements.length];
    for (int i = 0; i < elements.length; i++) {
      array[i] = copyOf(elements[i]);
    }
    return new ArrayValue(array);
  }

  /** Returns a new array containing rows {@code offset}, {@code offset +
   * stride}, ... of this array; rows are shared, not copied. */
  public ArrayValue slice(int offset, int num, int stride) {
    final Object[] array = new Object[num];
    for (int i = 0; i < num; i++) {
      array[i] = get(offset + i * stride);
    }
    return new ArrayValue(array);
  }

  /** Reads the value at {@code slice}. Each element of {@code slice} is
   * either an {@link Integer} index or a {@link Range}. */
  public Object read(List<?> slice) {
    return read(this, slice, 0);
  }

  private static Object read(Object value, List<?> slice, int k) {
    if (k == slice.size()) {
      return value;
    }
    final ArrayValue array = (ArrayValue) value;
    final Object dim = slice.get(k);
    if (dim instanceof Integer) {
      return read(array.get((Integer) dim), slice, k + 1);
    }
    final Range range = (Range) dim;
    final Object[] rows = new Object[range.num];
    for (int i = 0; i < range.num; i++) {
      rows[i] = read(array.get(range.offset + i * range.stride), slice,
          k + 1);
    }
    return new ArrayValue(rows);
  }

  /** Overwrites the part of this array at {@code slice} with {@code value}.
   * The value must have the shape of the slice. */
  public void write(List<?> slice, Object value) {
    checkArgument(!slice.isEmpty(), "empty slice");
    write(this, slice, 0, value);
  }

  private static void write(ArrayValue array, List<?> slice, int k,
      Object value) {
    final Object dim = slice.get(k);
    final boolean last = k == slice.size() - 1;
    if (dim instanceof Integer) {
      final int i = (Integer) dim;
      if (last) {
        array.set(i, copyOf(value));
      } else {
        write((ArrayValue) array.get(i), slice, k + 1, value);
      }
      return;
    }
    final Range range = (Range) dim;
    final ArrayValue values = (ArrayValue) value;
    checkArgument(values.size() == range.num,
        "cannot write %s rows into a slice of %s", values.size(), range.num);
    for (int i = 0; i < range.num; i++) {
      final int j = range.offset + i * range.stride;
      if (last) {
        array.set(j, copyOf(values.get(i)));
      } else {
        write((ArrayValue) array.get(j), slice, k + 1, values.get(i));
      }
    }
  }

  /** Converts this array to a list; rows become nested lists. */
  public List<Object> toList() {
    final ImmutableList.Builder<Object> b = ImmutableList.builder();
    for (Object element : elements) {
      b.add(element instanceof ArrayValue
          ? ((ArrayValue) element).toList()
          : element);
    }
    return b.build();
  }

  @Override
  public int hashCode() {
    return Arrays.deepHashCode(elements);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ArrayValue
        && Arrays.deepEquals(elements, ((ArrayValue) o).elements);
  }

  @Override
  public String toString() {
    return Arrays.toString(elements);
  }

  /** Slice of one dimension: {@code num} positions starting at
   * {@code offset}, {@code stride} apart. */
  public static class Range {
    public final int offset;
    public final int num;
    public final int stride;

    public Range(int offset, int num, int stride) {
      checkArgument(num >= 0, "negative length %s", num);
      this.offset = offset;
      this.num = num;
      this.stride = stride;
    }

    @Override
    public String toString() {
      return offset + ":+" + num + "*" + stride;
    }
  }
}

// End ArrayValue.java
