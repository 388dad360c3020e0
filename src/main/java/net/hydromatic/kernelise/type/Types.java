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

/** Utilities for {@link Type}. */
public abstract class Types {
  private Types() {}

  /** Prepends a dimension to a shape. */
  static ImmutableList<Core.SubExp> prepend(Core.SubExp dim,
      List<Core.SubExp> shape) {
    return ImmutableList.<Core.SubExp>builder().add(dim).addAll(shape)
        .build();
  }

  /** Returns whether every type in a list has a static shape. */
  public static boolean hasStaticShapes(List<? extends Type> types) {
    return types.stream().allMatch(Type::hasStaticShape);
  }

  /** Returns the type of the value obtained by indexing a value of type
   * {@code type} with {@code slice}.
   *
   * <p>Fixed dimensions are removed; sliced dimensions take the slice's
   * length; dimensions beyond the slice are kept. */
  public static Type sliceType(Type type, List<Core.DimIndex> slice) {
    final ImmutableList.Builder<Core.SubExp> dims = ImmutableList.builder();
    final List<Core.SubExp> shape = type.shape();
    for (int i = 0; i < shape.size(); i++) {
      if (i >= slice.size()) {
        dims.add(shape.get(i));
      } else if (slice.get(i) instanceof Core.DimSlice) {
        dims.add(((Core.DimSlice) slice.get(i)).num);
      }
    }
    final ImmutableList<Core.SubExp> newShape = dims.build();
    return newShape.isEmpty()
        ? type.elementType()
        : ArrayType.of(type.elementType(), newShape, false);
  }
}

// End Types.java
