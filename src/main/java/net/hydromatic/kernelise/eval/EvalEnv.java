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

import java.util.List;
import net.hydromatic.kernelise.ast.Core;
import net.hydromatic.kernelise.ast.Name;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Evaluation environment.
 *
 * <p>Maps each variable that is in scope to its value: a boxed scalar
 * ({@link Boolean}, {@link Integer}, {@link Long}, {@link Float},
 * {@link Double}) or an {@link ArrayValue}. Environments are immutable;
 * binding a variable creates a new environment.
 */
public interface EvalEnv {
  /** Returns the value of {@code name} if bound, null if not. */
  @Nullable Object getOpt(Name name);

  /** Returns the value of {@code name}; throws if not bound. */
  default Object get(Name name) {
    final Object value = getOpt(name);
    if (value == null) {
      throw new IllegalArgumentException("variable " + name
          + " is not bound");
    }
    return value;
  }

  /** Returns the value of a sub-expression. */
  default Object value(Core.SubExp subExp) {
    if (subExp instanceof Core.Constant) {
      return ((Core.Constant) subExp).value;
    }
    if (subExp instanceof Core.Var) {
      return get(((Core.Var) subExp).name());
    }
    throw new IllegalArgumentException("cannot evaluate " + subExp);
  }

  /**
   * Creates an environment that has the same content as this one, plus the
   * binding (name, value).
   */
  default EvalEnv bind(Name name, Object value) {
    return new EvalEnvs.SubEvalEnv(this, name, value);
  }

  /** Creates an environment that has the same content as this one, plus a
   * binding for each of a list of parameters. */
  default EvalEnv bindAll(List<Core.Param> params, List<?> values) {
    if (params.size() != values.size()) {
      throw new IllegalArgumentException("cannot bind " + values.size()
          + " values to " + params);
    }
    EvalEnv env = this;
    for (int i = 0; i < params.size(); i++) {
      env = env.bind(params.get(i).name, values.get(i));
    }
    return env;
  }
}

// End EvalEnv.java
