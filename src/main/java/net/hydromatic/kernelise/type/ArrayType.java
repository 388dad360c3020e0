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
package net.hydromatic.kernelise.type;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.kernelise.ast.Core;

/**
 * Array type.
 *
 * <p>For example, {@code [n][3]i32} has element type {@code i32} and shape
 * {@code [n, 3]}; with the uniqueness flag set it renders as
 * {@code *[n][3]i32}.
 */
public class ArrayType implements Type {
  public final PrimitiveType elementType;
  public final ImmutableList<Core.SubExp> shape;
  public final boolean unique;

  private ArrayType(PrimitiveType elementType,
      ImmutableList<Core.SubExp> shape, boolean unique) {
    this.elementType = requireNonNull(elementType);
    this.shape = requireNonNull(shape);
    this.unique = unique;
    checkArgument(!shape.isEmpty(), "array type must have a dimension");
  }

  /** Creates an ArrayType. */
  public static ArrayType of(PrimitiveType elementType,
      List<? extends Core.SubExp> shape, boolean unique) {
    return new ArrayType(elementType, ImmutableList.copyOf(shape), unique);
  }

  @Override
  public PrimitiveType elementType() {
    return elementType;
  }

  @Override
  public List<Core.SubExp> shape() {
    return shape;
  }

  @Override
  public boolean unique() {
    return unique;
  }

  @Override
  public ArrayType withUniqueness(boolean unique) {
    return unique == this.unique ? this
        : new ArrayType(elementType, shape, unique);
  }

  @Override
  public Type rowType() {
    return shape.size() == 1
        ? elementType
        : new ArrayType(elementType, shape.subList(1, shape.size()), false);
  }

  @Override
  public Core.SubExp outerSize() {
    return shape.get(0);
  }

  @Override
  public ArrayType setOuterSize(Core.SubExp dim) {
    return new ArrayType(elementType,
        Types.prepend(dim, shape.subList(1, shape.size())), unique);
  }

  @Override
  public int hashCode() {
    return Objects.hash(elementType, shape, unique);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ArrayType
        && elementType == ((ArrayType) o).elementType
        && shape.equals(((ArrayType) o).shape)
        && unique == ((ArrayType) o).unique;
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    if (unique) {
      b.append('*');
    }
    shape.forEach(d -> b.append('[').append(d).append(']'));
    return b.append(elementType).toString();
  }
}

// End ArrayType.java
