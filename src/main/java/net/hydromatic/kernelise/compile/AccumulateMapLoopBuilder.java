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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.kernelise.ast.Core;

/** Builds a single-step loop that accumulates values and writes "map-out"
 * values into arrays. */
public interface AccumulateMapLoopBuilder {
  /**
   * Builds the parts of a loop over {@code [0, width)} that applies
   * {@code lambda} once per iteration.
   *
   * <p>The first {@code accInit.size()} parameters of the lambda are bound
   * to the accumulators; the remaining parameters are bound to the
   * {@code i}th row of each of {@code arrays}. (If {@code arrays} is empty, the
   * caller must bind the remaining parameters itself.) The lambda's first
   * results are the new accumulators; the remaining results are written, in
   * place, at index {@code i} of each of {@code mapoutArrays}.
   *
   * <p>Statements that the loop needs outside its body are appended to
   * {@code binder}.
   */
  AccumulateMapLoop accumulateMapLoop(Binder binder,
      Core.Certificates certificates, Core.SubExp width, Core.Lambda lambda,
      List<? extends Core.SubExp> accInit, List<Core.Var> arrays,
      List<Core.Var> mapoutArrays);

  /** Parts of an accumulate-map loop. */
  class AccumulateMapLoop {
    /** Loop variables: the accumulators followed by the map-out arrays. */
    public final ImmutableList<Core.Merge> merge;
    /** Induction variable. */
    public final Core.Param i;
    public final Core.Body body;

    public AccumulateMapLoop(List<Core.Merge> merge, Core.Param i,
        Core.Body body) {
      this.merge = ImmutableList.copyOf(merge);
      this.i = requireNonNull(i);
      this.body = requireNonNull(body);
    }
  }
}

// End AccumulateMapLoopBuilder.java
