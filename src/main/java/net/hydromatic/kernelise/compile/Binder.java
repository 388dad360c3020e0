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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.kernelise.ast.CoreBuilder.core;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.kernelise.ast.Core;
import net.hydromatic.kernelise.type.Type;

/**
 * Accumulates statements for a body under construction.
 *
 * <p>Statements are appended in order and never removed. A pass that needs to
 * build a nested body (the branch of a conditional, the body of a loop)
 * creates a {@link #nest() nested} binder, which shares this binder's
 * {@link NameGenerator}, and collects its statements into a {@link Core.Body}
 * when it is done.
 */
public class Binder {
  public final NameGenerator nameGenerator;
  private final List<Core.Stm> stms = new ArrayList<>();

  /** Creates a Binder. */
  public Binder(NameGenerator nameGenerator) {
    this.nameGenerator = requireNonNull(nameGenerator);
  }

  /** Creates an empty binder that shares this binder's name generator. */
  public Binder nest() {
    return new Binder(nameGenerator);
  }

  /** Appends a statement. */
  public void add(Core.Stm stm) {
    stms.add(requireNonNull(stm));
  }

  /** Appends a list of statements. */
  public void addAll(List<Core.Stm> stms) {
    stms.forEach(this::add);
  }

  /** Creates a parameter with a fresh name. */
  public Core.Param newParam(String base, Type type) {
    return core.param(nameGenerator.fresh(base), type);
  }

  /** Creates a parameter with a fresh name, with the same base and type as
   * an existing parameter. */
  public Core.Param newParamLike(Core.Param param) {
    return core.param(nameGenerator.freshLike(param.name), param.type);
  }

  /** Appends a statement that binds a pattern to an expression. */
  public void letBind(Core.Pattern pattern, Core.Exp exp) {
    add(core.stm(pattern, exp));
  }

  /** Binds a single-valued expression to a fresh variable, and returns a
   * reference to the variable. */
  public Core.Var letExp(String base, Core.Exp exp) {
    final List<Type> types = exp.types();
    checkArgument(types.size() == 1, "expression has %s values: %s",
        types.size(), exp);
    final Core.Param param = newParam(base, types.get(0));
    letBind(core.pattern(core.patElem(param)), exp);
    return core.var(param);
  }

  /** Binds a fresh variable to {@code source} with the value of {@code exp}
   * written, in place, at {@code slice}; returns a reference to the fresh
   * variable. */
  public Core.Var letInPlace(String base, Core.Certificates certificates,
      Core.Var source, List<Core.DimIndex> slice, Core.Exp exp) {
    final Core.Param param = newParam(base, source.type());
    letBind(core.pattern(core.inPlace(param, certificates, source, slice)),
        exp);
    return core.var(param);
  }

  /** Returns the statements appended so far. */
  public List<Core.Stm> stms() {
    return ImmutableList.copyOf(stms);
  }

  /** Returns a body consisting of the statements appended so far and a given
   * result. */
  public Core.Body body(List<? extends Core.SubExp> result) {
    return core.body(stms, result);
  }
}

// End Binder.java
