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

import static java.util.Objects.requireNonNull;

import java.util.Map;
import net.hydromatic.kernelise.ast.Name;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Implementations of {@link EvalEnv}. */
public abstract class EvalEnvs {
  private EvalEnvs() {}

  /** Returns an empty environment. */
  public static EvalEnv empty() {
    return EmptyEvalEnv.INSTANCE;
  }

  /** Creates an environment that contains the given bindings. */
  public static EvalEnv of(Map<Name, ?> valueMap) {
    EvalEnv env = empty();
    for (Map.Entry<Name, ?> entry : valueMap.entrySet()) {
      env = env.bind(entry.getKey(), entry.getValue());
    }
    return env;
  }

  /** Environment that binds nothing. */
  private static class EmptyEvalEnv implements EvalEnv {
    static final EvalEnv INSTANCE = new EmptyEvalEnv();

    @Override
    public @Nullable Object getOpt(Name name) {
      return null;
    }
  }

  /** Evaluation environment that inherits from a parent environment and adds
   * one binding. */
  static class SubEvalEnv implements EvalEnv {
    private final EvalEnv parentEnv;
    private final Name name;
    private final Object value;

    SubEvalEnv(EvalEnv parentEnv, Name name, Object value) {
      this.parentEnv = requireNonNull(parentEnv);
      this.name = requireNonNull(name);
      this.value = requireNonNull(value);
    }

    @Override
    public String toString() {
      return name + ", ...";
    }

    @Override
    public @Nullable Object getOpt(Name name) {
      for (SubEvalEnv e = this;;) {
        if (name.equals(e.name)) {
          return e.value;
        }
        if (!(e.parentEnv instanceof SubEvalEnv)) {
          return e.parentEnv.getOpt(name);
        }
        e = (SubEvalEnv) e.parentEnv;
      }
    }
  }
}

// End EvalEnvs.java
