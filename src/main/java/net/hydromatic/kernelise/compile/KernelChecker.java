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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.kernelise.ast.Core;
import net.hydromatic.kernelise.ast.CoreNode;
import net.hydromatic.kernelise.ast.Name;
import net.hydromatic.kernelise.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Checks the output of sequentialization.
 *
 * <p>Verifies that every variable is bound before it is used, that no
 * variable is bound twice on the same path, that every pattern has as many
 * elements as its expression has values, and that no combinator remains.
 */
public class KernelChecker {
  /** If true, report the first problem by throwing; if false, only collect
   * the names that are used but not bound. */
  private final boolean strict;
  private final Set<Name> unbound = new LinkedHashSet<>();
  private @Nullable CoreNode context;

  private KernelChecker(boolean strict) {
    this.strict = strict;
  }

  /** Checks a sequentialized body, given the names that are bound outside
   * it. Throws {@link CompileException} if the body is not valid. */
  public static void check(Core.Body body, Set<Name> outerNames) {
    final KernelChecker checker = new KernelChecker(true);
    checker.context = body;
    checker.body(body, outerNames);
  }

  /** Returns the names that are used in a body but not bound by it, in
   * order of first use. */
  public static Set<Name> freeNames(Core.Body body) {
    final KernelChecker checker = new KernelChecker(false);
    checker.body(body, ImmutableSet.of());
    return ImmutableSet.copyOf(checker.unbound);
  }

  private void problem(String template, Object... args) {
    if (strict) {
      throw new CompileException(lenientFormat(template, args),
          requireNonNull(context, "context"));
    }
  }

  private void use(Core.SubExp subExp, Set<Name> scope) {
    if (subExp instanceof Core.Var) {
      final Name name = ((Core.Var) subExp).name();
      if (!scope.contains(name)) {
        unbound.add(name);
        problem("%s is used before it is bound", name);
      }
    }
  }

  private void useAll(List<? extends Core.SubExp> subExps, Set<Name> scope) {
    subExps.forEach(subExp -> use(subExp, scope));
  }

  private void type(Type type, Set<Name> scope) {
    type.shape().forEach(dim -> use(dim, scope));
  }

  private void slice(List<Core.DimIndex> slice, Set<Name> scope) {
    for (Core.DimIndex dimIndex : slice) {
      if (dimIndex instanceof Core.DimFix) {
        use(((Core.DimFix) dimIndex).i, scope);
      } else {
        final Core.DimSlice dimSlice = (Core.DimSlice) dimIndex;
        use(dimSlice.offset, scope);
        use(dimSlice.num, scope);
        use(dimSlice.stride, scope);
      }
    }
  }

  /** Adds parameters to a scope, then checks their types. */
  private void bind(List<Core.Param> params, Set<Name> scope) {
    for (Core.Param param : params) {
      if (!scope.add(param.name)) {
        problem("%s is bound more than once", param.name);
      }
    }
    params.forEach(param -> type(param.type, scope));
  }

  private void body(Core.Body body, Set<Name> outerScope) {
    final Set<Name> scope = new HashSet<>(outerScope);
    for (Core.Stm stm : body.stms) {
      final CoreNode previous = context;
      context = stm;
      exp(stm.exp, scope);
      if (stm.pattern.size() != stm.exp.types().size()) {
        problem("pattern has %s elements but expression has %s values",
            stm.pattern.size(), stm.exp.types().size());
      }
      for (Core.PatElem patElem : stm.pattern.elements) {
        if (patElem.bindage instanceof Core.BindInPlace) {
          final Core.BindInPlace bindInPlace =
              (Core.BindInPlace) patElem.bindage;
          use(bindInPlace.source, scope);
          slice(bindInPlace.slice, scope);
        }
      }
      final List<Core.Param> params = new ArrayList<>();
      stm.pattern.elements.forEach(patElem -> params.add(patElem.param));
      bind(params, scope);
      context = previous;
    }
    useAll(body.result, scope);
  }

  private void lambda(Core.Lambda lambda, Set<Name> outerScope) {
    final Set<Name> scope = new HashSet<>(outerScope);
    bind(lambda.params, scope);
    body(lambda.body, scope);
  }

  private void exp(Core.Exp exp, Set<Name> scope) {
    switch (exp.op) {
    case SUB_EXP:
      use(((Core.SubExpOp) exp).subExp, scope);
      break;

    case COPY:
      use(((Core.Copy) exp).array, scope);
      break;

    case INDEX:
      final Core.Index index = (Core.Index) exp;
      use(index.array, scope);
      slice(index.slice, scope);
      break;

    case SCRATCH:
      useAll(((Core.Scratch) exp).dims, scope);
      break;

    case BIN_OP:
      final Core.BinOp binOp = (Core.BinOp) exp;
      use(binOp.x, scope);
      use(binOp.y, scope);
      break;

    case CMP_OP:
      final Core.CmpOp cmpOp = (Core.CmpOp) exp;
      use(cmpOp.x, scope);
      use(cmpOp.y, scope);
      break;

    case IOTA:
      use(((Core.Iota) exp).n, scope);
      break;

    case REPLICATE:
      final Core.Replicate replicate = (Core.Replicate) exp;
      use(replicate.n, scope);
      use(replicate.value, scope);
      break;

    case IF:
      final Core.If anIf = (Core.If) exp;
      use(anIf.condition, scope);
      body(anIf.ifTrue, scope);
      body(anIf.ifFalse, scope);
      break;

    case DO_LOOP:
      final Core.DoLoop doLoop = (Core.DoLoop) exp;
      useAll(doLoop.inits(), scope);
      final Set<Name> loopScope = new HashSet<>(scope);
      bind(doLoop.params(), loopScope);
      if (doLoop.form instanceof Core.ForLoop) {
        final Core.ForLoop forLoop = (Core.ForLoop) doLoop.form;
        use(forLoop.bound, scope);
        bind(ImmutableList.of(forLoop.i), loopScope);
      } else {
        final Name condition = ((Core.WhileLoop) doLoop.form).condition;
        if (!loopScope.contains(condition)) {
          unbound.add(condition);
          problem("loop condition %s is not a loop variable", condition);
        }
      }
      body(doLoop.body, loopScope);
      break;

    case MAP:
    case REDOMAP:
    case SCAN:
    case FILTER:
    case STREAM:
      problem("combinator remains after sequentialization");
      final Core.Soac soac = (Core.Soac) exp;
      use(soac.width, scope);
      useAll(soac.arrays, scope);
      if (soac instanceof Core.Redomap) {
        useAll(((Core.Redomap) soac).neutral, scope);
      } else if (soac instanceof Core.Scan) {
        useAll(((Core.Scan) soac).neutral, scope);
      } else if (soac instanceof Core.Stream) {
        useAll(((Core.Stream) soac).form.accumulators, scope);
      }
      soac.lambdas().forEach(lambda -> lambda(lambda, scope));
      break;

    case GROUP_STREAM:
      final Core.GroupStream groupStream = (Core.GroupStream) exp;
      use(groupStream.width, scope);
      use(groupStream.maxChunk, scope);
      useAll(groupStream.accumulators, scope);
      useAll(groupStream.arrays, scope);
      final Core.GroupStreamLambda lambda = groupStream.lambda;
      final Set<Name> streamScope = new HashSet<>(scope);
      bind(ImmutableList.of(lambda.chunkSize, lambda.chunkOffset),
          streamScope);
      bind(lambda.accParams, streamScope);
      bind(lambda.arrParams, streamScope);
      body(lambda.body, streamScope);
      break;

    default:
      throw new AssertionError("unknown expression " + exp.op);
    }
  }
}

// End KernelChecker.java
