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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.kernelise.ast.Core;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on a rewritten statement,
   * then calls the underlying tracer.
   */
  public static Tracer withOnRewrite(Tracer tracer,
      BiConsumer<Sequentializer.Rule, Core.Stm> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onRewrite(Sequentializer.Rule rule, Core.Stm stm) {
        consumer.accept(rule, stm);
        super.onRewrite(rule, stm);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on a statement that went
   * to the fallback, then calls the underlying tracer.
   */
  public static Tracer withOnFallback(Tracer tracer,
      Consumer<Core.Stm> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onFallback(Core.Stm stm) {
        consumer.accept(stm);
        super.onFallback(stm);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on a sequentialized body,
   * then calls the underlying tracer.
   */
  public static Tracer withOnBody(Tracer tracer,
      Consumer<Core.Body> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onBody(Core.Body body) {
        consumer.accept(body);
        super.onBody(body);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onRewrite(Sequentializer.Rule rule, Core.Stm stm) {}

    @Override
    public void onFallback(Core.Stm stm) {}

    @Override
    public void onBody(Core.Body body) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onRewrite(Sequentializer.Rule rule, Core.Stm stm) {
      tracer.onRewrite(rule, stm);
    }

    @Override
    public void onFallback(Core.Stm stm) {
      tracer.onFallback(stm);
    }

    @Override
    public void onBody(Core.Body body) {
      tracer.onBody(body);
    }
  }
}

// End Tracers.java
