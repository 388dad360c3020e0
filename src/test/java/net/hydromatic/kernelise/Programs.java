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
package net.hydromatic.kernelise;

import static net.hydromatic.kernelise.ast.CoreBuilder.core;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.kernelise.ast.BinaryOp;
import net.hydromatic.kernelise.ast.Core;
import net.hydromatic.kernelise.ast.Name;
import net.hydromatic.kernelise.compile.NameGenerator;
import net.hydromatic.kernelise.eval.EvalEnvs;
import net.hydromatic.kernelise.eval.Evaluator;
import net.hydromatic.kernelise.eval.Prop;
import net.hydromatic.kernelise.type.ArrayType;
import net.hydromatic.kernelise.type.PrimitiveType;
import net.hydromatic.kernelise.type.Type;

/** Builds small programs for tests.
 *
 * <p>Each instance has its own {@link NameGenerator}, starting at 0, so that
 * the names in a test are predictable. */
public class Programs {
  public final NameGenerator nameGenerator = new NameGenerator();

  /** Creates a parameter with a fresh name. */
  public Core.Param param(String base, Type type) {
    return core.param(nameGenerator.fresh(base), type);
  }

  /** Creates a one-dimensional array type. */
  public static ArrayType arrayOf(PrimitiveType elementType,
      Core.SubExp dim) {
    return ArrayType.of(elementType, ImmutableList.of(dim), false);
  }

  /** Creates a statement that binds one variable. */
  public static Core.Stm let(Core.Param param, Core.Exp exp) {
    return core.stm(core.pattern(core.patElem(param)), exp);
  }

  /** Creates a statement that binds several variables. */
  public static Core.Stm let(List<Core.Param> params, Core.Exp exp) {
    return core.stm(core.varPattern(params), exp);
  }

  /** Creates a body. */
  public static Core.Body body(List<Core.Stm> stms,
      Core.SubExp... result) {
    return core.body(stms, ImmutableList.copyOf(result));
  }

  /** Creates a lambda {@code fn {x, y} => x op y}. */
  public Core.Lambda binaryLambda(BinaryOp binaryOp, PrimitiveType type) {
    final Core.Param x = param("x", type);
    final Core.Param y = param("y", type);
    final Core.Param z = param("z", type);
    return core.lambda(ImmutableList.of(x, y),
        body(
            ImmutableList.of(
                let(z, core.binOp(binaryOp, core.var(x), core.var(y)))),
            core.var(z)),
        ImmutableList.of(type));
  }

  /** Creates a lambda {@code fn {x} => x op c}. */
  public Core.Lambda unaryLambda(BinaryOp binaryOp, Core.Constant c) {
    final Core.Param x = param("x", c.type);
    final Core.Param y = param("y", c.type);
    return core.lambda(ImmutableList.of(x),
        body(ImmutableList.of(let(y, core.binOp(binaryOp, core.var(x), c))),
            core.var(y)),
        ImmutableList.of(c.type));
  }

  /** Creates a sum {@code redomap} over an {@code i32} array. */
  public Core.Redomap sum(Core.SubExp width, Core.SubExp neutral,
      Core.Var array) {
    return core.reduce(Core.Certificates.EMPTY, width,
        Core.Commutativity.COMMUTATIVE,
        binaryLambda(BinaryOp.ADD, PrimitiveType.I32),
        ImmutableList.of(neutral), ImmutableList.of(array));
  }

  /** Evaluates a body with the given values of its free variables. */
  public static List<Object> eval(Core.Body body, int chunkSize,
      Map<Core.Param, Object> inputs) {
    final ImmutableMap.Builder<Name, Object> values = ImmutableMap.builder();
    inputs.forEach((param, value) -> values.put(param.name, value));
    return Evaluator.of(ImmutableMap.of(Prop.CHUNK_SIZE, chunkSize))
        .evalBody(EvalEnvs.of(values.build()), body);
  }
}

// End Programs.java
