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

import static com.google.common.collect.ImmutableSet.toImmutableSet;

import com.google.common.collect.ImmutableSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.kernelise.ast.Core;
import net.hydromatic.kernelise.ast.Name;
import net.hydromatic.kernelise.ast.Visitor;

/**
 * Consumption analysis.
 *
 * <p>A variable is consumed if it, or a variable that aliases it, is the
 * source of an in-place update, is the initial value of a unique loop
 * variable, or is passed to a nested combinator or grouped stream whose lambda
 * consumes the corresponding parameter.
 *
 * <p>A variable aliases another if it is bound to it directly
 * ({@code let y = x}), to an index or slice of it, or is the result of an
 * in-place update of it.
 */
public class ConsumptionAnalyzer implements ConsumptionOracle {
  public static final ConsumptionAnalyzer INSTANCE = new ConsumptionAnalyzer();

  private ConsumptionAnalyzer() {}

  @Override
  public Set<Name> consumedParams(Core.Lambda lambda) {
    final Set<Name> consumed = consumedIn(lambda.body);
    return lambda.params.stream()
        .map(p -> p.name)
        .filter(consumed::contains)
        .collect(toImmutableSet());
  }

  /** Returns the names consumed by a body, including names that are bound
   * outside it. */
  public Set<Name> consumedIn(Core.Body body) {
    final Finder finder = new Finder();
    body.accept(finder);
    return ImmutableSet.copyOf(finder.consumed);
  }

  /** Visitor that walks a body, tracking aliases and consumption. */
  private class Finder extends Visitor {
    final Map<Name, Set<Name>> aliases = new HashMap<>();
    final Set<Name> consumed = new LinkedHashSet<>();

    /** Returns the variables that a sub-expression may share storage
     * with, including itself. */
    Set<Name> roots(Core.SubExp subExp) {
      if (!(subExp instanceof Core.Var)) {
        return ImmutableSet.of();
      }
      final Name name = ((Core.Var) subExp).name();
      final Set<Name> roots = aliases.get(name);
      return roots != null ? roots : ImmutableSet.of(name);
    }

    void alias(Name name, Set<Name> roots) {
      aliases.put(name,
          ImmutableSet.<Name>builder().add(name).addAll(roots).build());
    }

    void consume(Core.SubExp subExp) {
      consumed.addAll(roots(subExp));
    }

    /** Consumes each argument whose parameter is consumed by a lambda. */
    void consumeArgs(Set<Name> consumedParams, List<Core.Param> params,
        List<? extends Core.SubExp> args) {
      for (int i = 0; i < params.size() && i < args.size(); i++) {
        if (consumedParams.contains(params.get(i).name)) {
          consume(args.get(i));
        }
      }
    }

    @Override
    protected void visit(Core.Stm stm) {
      super.visit(stm);
      final Set<Name> expRoots;
      switch (stm.exp.op) {
      case SUB_EXP:
        expRoots = roots(((Core.SubExpOp) stm.exp).subExp);
        break;
      case INDEX:
        expRoots = roots(((Core.Index) stm.exp).array);
        break;
      default:
        expRoots = ImmutableSet.of();
      }
      for (Core.PatElem patElem : stm.pattern.elements) {
        if (patElem.bindage instanceof Core.BindInPlace) {
          alias(patElem.name(),
              roots(((Core.BindInPlace) patElem.bindage).source));
        } else if (!expRoots.isEmpty()) {
          alias(patElem.name(), expRoots);
        }
      }
    }

    @Override
    protected void visit(Core.BindInPlace bindInPlace) {
      consume(bindInPlace.source);
      super.visit(bindInPlace);
    }

    @Override
    protected void visit(Core.Merge merge) {
      if (merge.param.type.unique()) {
        consume(merge.init);
      } else {
        alias(merge.param.name, roots(merge.init));
      }
      super.visit(merge);
    }

    @Override
    protected void visit(Core.Map map) {
      visitSoac(map);
      consumeArgs(consumedParams(map.lambda), map.lambda.params, map.arrays);
    }

    @Override
    protected void visit(Core.Redomap redomap) {
      visitSoac(redomap);
      redomap.neutral.forEach(this::accept);
      consumeArgs(consumedParams(redomap.foldLambda),
          redomap.foldLambda.params,
          Compiles.concat(redomap.neutral, redomap.arrays));
    }

    @Override
    protected void visit(Core.Scan scan) {
      visitSoac(scan);
      scan.neutral.forEach(this::accept);
      consumeArgs(consumedParams(scan.lambda), scan.lambda.params,
          Compiles.concat(scan.neutral, scan.arrays));
    }

    @Override
    protected void visit(Core.Filter filter) {
      visitSoac(filter);
      consumeArgs(consumedParams(filter.lambda), filter.lambda.params,
          filter.arrays);
    }

    @Override
    protected void visit(Core.Stream stream) {
      visitSoac(stream);
      stream.form.accumulators.forEach(this::accept);
      final List<Core.Param> params = stream.lambda.params;
      consumeArgs(consumedParams(stream.lambda),
          params.subList(Math.min(1, params.size()), params.size()),
          Compiles.concat(stream.form.accumulators, stream.arrays));
    }

    @Override
    protected void visit(Core.GroupStream groupStream) {
      groupStream.width.accept(this);
      groupStream.maxChunk.accept(this);
      groupStream.accumulators.forEach(this::accept);
      groupStream.arrays.forEach(this::accept);
      final Core.GroupStreamLambda lambda = groupStream.lambda;
      final Set<Name> consumedInBody = consumedIn(lambda.body);
      consumeArgs(consumedInBody,
          Compiles.concat(lambda.accParams, lambda.arrParams),
          Compiles.concat(groupStream.accumulators, groupStream.arrays));
    }
  }
}

// End ConsumptionAnalyzer.java
