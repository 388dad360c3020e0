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
package net.hydromatic.kernelise.compile;

import static com.google.common.base.Strings.lenientFormat;
import static net.hydromatic.kernelise.ast.CoreBuilder.core;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.kernelise.ast.Core;
import net.hydromatic.kernelise.ast.CoreNode;
import net.hydromatic.kernelise.type.Type;

/** Helpers for the passes in this package. */
public abstract class Compiles {
  private Compiles() {}

  /**
   * Throws a {@link CompileException} naming {@code node} (usually the
   * statement being lowered) if {@code condition} is false.
   *
   * <p>The message is formatted as by {@link
   * com.google.common.base.Preconditions#checkArgument(boolean, String,
   * Object...)}.
   */
  public static void check(boolean condition, CoreNode node,
      String template, Object... args) {
    if (!condition) {
      throw new CompileException(lenientFormat(template, args), node);
    }
  }

  /** Binds a new uninitialized array of each of the given types, and returns
   * references to them. */
  static List<Core.Var> resultArrays(Binder binder,
      List<? extends Type> types) {
    final ImmutableList.Builder<Core.Var> b = ImmutableList.builder();
    for (Type type : types) {
      b.add(
          binder.letExp("result",
              core.scratch(type.elementType(), type.shape())));
    }
    return b.build();
  }

  /** Binds each of a list of params to the {@code i}th row of the
   * corresponding array. */
  static void bindRows(Binder binder, Core.Certificates certificates,
      List<Core.Param> params, List<Core.Var> arrays, Core.SubExp i) {
    for (int k = 0; k < params.size(); k++) {
      final Core.Var array = arrays.get(k);
      binder.letBind(core.pattern(core.patElem(params.get(k))),
          core.index(certificates, array, core.rowSlice(array.type(), i)));
    }
  }

  /** Binds each of a list of params to a value. */
  static void bindParams(Binder binder, List<Core.Param> params,
      List<? extends Core.SubExp> values) {
    for (int k = 0; k < params.size(); k++) {
      binder.letBind(core.pattern(core.patElem(params.get(k))),
          core.subExp(values.get(k)));
    }
  }

  /** Returns a list of merge variables, one per pair of param and initial
   * value. */
  static List<Core.Merge> merges(List<Core.Param> params,
      List<? extends Core.SubExp> inits) {
    final ImmutableList.Builder<Core.Merge> b = ImmutableList.builder();
    for (int k = 0; k < params.size(); k++) {
      b.add(core.merge(params.get(k), inits.get(k)));
    }
    return b.build();
  }

  /** Concatenates two lists. */
  static <E> List<E> concat(List<? extends E> list0,
      List<? extends E> list1) {
    return ImmutableList.<E>builder().addAll(list0).addAll(list1).build();
  }
}

// End Compiles.java
