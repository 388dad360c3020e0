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

import java.util.List;
import net.hydromatic.kernelise.ast.Core;

/**
 * Type of a value: a {@link PrimitiveType} or an {@link ArrayType}.
 *
 * <p>Array dimensions are {@link Core.SubExp sub-expressions}: constants,
 * variables in scope, or {@link Core.Ext existential} placeholders (the latter
 * only in lambda return types).
 */
public interface Type {
  /** Returns the primitive type of the elements; a primitive type returns
   * itself. */
  PrimitiveType elementType();

  /** Returns the dimensions, outermost first; empty for a primitive type. */
  List<Core.SubExp> shape();

  /** Returns the number of dimensions. */
  default int rank() {
    return shape().size();
  }

  /** Returns whether values of this type may be consumed (updated in
   * place). */
  boolean unique();

  /** Returns a copy of this type with a given uniqueness. */
  Type withUniqueness(boolean unique);

  /** Returns the type of an array whose rows have this type and whose outer
   * dimension is {@code dim}. */
  default ArrayType arrayOfRow(Core.SubExp dim) {
    return ArrayType.of(elementType(), Types.prepend(dim, shape()), false);
  }

  /** Returns the type of a row of this array type. */
  Type rowType();

  /** Returns the outer dimension of this array type. */
  Core.SubExp outerSize();

  /** Returns a copy of this array type with a different outer dimension. */
  Type setOuterSize(Core.SubExp dim);

  /** Returns whether no dimension is {@link Core.Ext existential}. */
  default boolean hasStaticShape() {
    return shape().stream().noneMatch(d -> d instanceof Core.Ext);
  }
}

// End Type.java
