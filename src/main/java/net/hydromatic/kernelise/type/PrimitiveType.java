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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.kernelise.ast.Core;

/** Primitive (scalar) type. */
public enum PrimitiveType implements Type {
  BOOL("bool", false),
  I32("i32", 0),
  I64("i64", 0L),
  F32("f32", 0F),
  F64("f64", 0D);

  /** Name of the type, as it appears in rendered IR. */
  public final String moniker;

  /** Value that {@code scratch} fills new arrays with. */
  public final Object zero;

  PrimitiveType(String moniker, Object zero) {
    this.moniker = moniker;
    this.zero = zero;
  }

  /** Returns whether this is an integral type. */
  public boolean isInteger() {
    return this == I32 || this == I64;
  }

  /** Returns whether this is a floating-point type. */
  public boolean isFloat() {
    return this == F32 || this == F64;
  }

  /** Returns whether {@code value} is a valid value of this type. */
  public boolean isValid(Object value) {
    return zero.getClass().isInstance(value);
  }

  @Override
  public PrimitiveType elementType() {
    return this;
  }

  @Override
  public List<Core.SubExp> shape() {
    return ImmutableList.of();
  }

  @Override
  public boolean unique() {
    return false;
  }

  @Override
  public PrimitiveType withUniqueness(boolean unique) {
    return this;
  }

  @Override
  public Type rowType() {
    throw new IllegalArgumentException("primitive type " + this
        + " has no rows");
  }

  @Override
  public Core.SubExp outerSize() {
    throw new IllegalArgumentException("primitive type " + this
        + " has no dimensions");
  }

  @Override
  public Type setOuterSize(Core.SubExp dim) {
    throw new IllegalArgumentException("primitive type " + this
        + " has no dimensions");
  }

  @Override
  public String toString() {
    return moniker;
  }
}

// End PrimitiveType.java
