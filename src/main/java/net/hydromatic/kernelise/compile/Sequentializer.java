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
import static net.hydromatic.kernelise.ast.CoreBuilder.core;
import static net.hydromatic.kernelise.compile.Compiles.check;
import static net.hydromatic.kernelise.compile.Compiles.concat;
import static net.hydromatic.kernelise.compile.Compiles.resultArrays;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.kernelise.ast.Core;
import net.hydromatic.kernelise.ast.Name;
import net.hydromatic.kernelise.eval.Prop;
import net.hydromatic.kernelise.type.PrimitiveType;
import net.hydromatic.kernelise.type.Type;
import net.hydromatic.kernelise.type.Types;

/**
 * Sequentializes a region of a program so that it can run inside a single
 * parallel worker.
 *
 * <p>Every combinator in the region is replaced by a loop. Fold-and-maps,
 * sequential streams and counting loops become {@link Core.GroupStream
 * grouped streams}; conditionals are kept but their branches are
 * sequentialized; everything else is handed to a {@link Fallback}.
 *
 * <p>Each statement is replaced by statements that bind the same pattern.
 */
public class Sequentializer {
  private final NameGenerator nameGenerator;
  private final Map<Prop, Object> props;
  private final Tracer tracer;
  private final ConsumptionOracle oracle;
  private final Fallback fallback;
  private final GroupStreams groupStreams;

  /** Special-case rules. Statements that match none of them go to the
   * fallback. */
  public enum Rule {
    /** Fold-and-map whose results are only accumulators. */
    REDOMAP,
    /** Sequential stream whose result types have known shapes. */
    SEQUENTIAL_STREAM,
    /** Loop over an {@code i32} induction variable. */
    FOR_LOOP,
    /** Conditional. */
    IF
  }

  private Sequentializer(NameGenerator nameGenerator,
      Map<Prop, Object> props, Tracer tracer, ConsumptionOracle oracle,
      Fallback fallback, AccumulateMapLoopBuilder loopBuilder) {
    this.nameGenerator = requireNonNull(nameGenerator);
    this.props = ImmutableMap.copyOf(props);
    this.tracer = requireNonNull(tracer);
    this.oracle = requireNonNull(oracle);
    this.fallback = requireNonNull(fallback);
    this.groupStreams = new GroupStreams(loopBuilder);
  }

  /** Creates a Sequentializer that uses {@link ConsumptionAnalyzer} and
   * {@link FirstOrderTransform}. */
  public static Sequentializer of(NameGenerator nameGenerator,
      Map<Prop, Object> props, Tracer tracer) {
    final FirstOrderTransform firstOrderTransform =
        FirstOrderTransform.of(ConsumptionAnalyzer.INSTANCE);
    return of(nameGenerator, props, tracer, ConsumptionAnalyzer.INSTANCE,
        firstOrderTransform, firstOrderTransform);
  }

  /** Creates a Sequentializer with given collaborators. */
  public static Sequentializer of(NameGenerator nameGenerator,
      Map<Prop, Object> props, Tracer tracer, ConsumptionOracle oracle,
      Fallback fallback, AccumulateMapLoopBuilder loopBuilder) {
    return new Sequentializer(nameGenerator, props, tracer, oracle, fallback,
        loopBuilder);
  }

  /**
   * Sequentializes a body.
   *
   * <p>If {@link Prop#VALIDATE} is set, checks the result with
   * {@link KernelChecker}.
   */
  public Core.Body lowerBody(Core.Body body) {
    final Binder binder = new Binder(nameGenerator);
    lowerStms(binder, body.stms);
    final Core.Body loweredBody = binder.body(body.result);
    if (Prop.VALIDATE.booleanValue(props)) {
      KernelChecker.check(loweredBody, KernelChecker.freeNames(body));
    }
    tracer.onBody(loweredBody);
    return loweredBody;
  }

  /** Sequentializes a lambda; its parameters and return types are
   * unchanged. */
  public Core.Lambda lowerLambda(Core.Lambda lambda) {
    return lowerLambda(new Binder(nameGenerator), lambda);
  }

  /** Sequentializes a list of statements, appending the results to a
   * binder. */
  public void lowerStms(Binder binder, List<Core.Stm> stms) {
    stms.forEach(stm -> lowerStm(binder, stm));
  }

  /** Sequentializes a statement, appending the results to a binder. */
  public void lowerStm(Binder binder, Core.Stm stm) {
    switch (stm.exp.op) {
    case REDOMAP:
      final Core.Redomap redomap = (Core.Redomap) stm.exp;
      if (stm.pattern.size() == redomap.neutral.size()) {
        lowerRedomap(binder, stm, redomap);
        return;
      }
      break;

    case STREAM:
      final Core.Stream stream = (Core.Stream) stm.exp;
      if (stream.form instanceof Core.Sequential
          && Types.hasStaticShapes(stream.lambda.returnTypes)) {
        lowerSequentialStream(binder, stm, stream);
        return;
      }
      break;

    case DO_LOOP:
      final Core.DoLoop doLoop = (Core.DoLoop) stm.exp;
      if (doLoop.form instanceof Core.ForLoop
          && ((Core.ForLoop) doLoop.form).intType() == PrimitiveType.I32) {
        lowerForLoop(binder, stm, doLoop, (Core.ForLoop) doLoop.form);
        return;
      }
      break;

    case IF:
      final Core.If anIf = (Core.If) stm.exp;
      tracer.onRewrite(Rule.IF, stm);
      binder.letBind(stm.pattern,
          anIf.copy(lowerBody(binder, anIf.ifTrue),
              lowerBody(binder, anIf.ifFalse)));
      return;

    default:
      // No special case
      break;
    }
    if (Prop.TRACE_FALLBACK.booleanValue(props)) {
      tracer.onFallback(stm);
    }
    fallback.lowerGeneric(binder, stm);
  }

  private Core.Body lowerBody(Binder binder, Core.Body body) {
    final Binder b = binder.nest();
    lowerStms(b, body.stms);
    return b.body(body.result);
  }

  private Core.Lambda lowerLambda(Binder binder, Core.Lambda lambda) {
    return lambda.copy(lambda.params, lowerBody(binder, lambda.body));
  }

  /** Lowers a fold-and-map that has no map-out results to a grouped stream
   * whose chunk size is chosen by the backend. Each chunk is folded by an
   * inner grouped stream of chunk size 1. */
  private void lowerRedomap(Binder binder, Core.Stm stm,
      Core.Redomap redomap) {
    final Core.Lambda foldLambda = redomap.foldLambda;
    final int accCount = redomap.neutral.size();
    check(foldLambda.params.size() >= accCount, stm,
        "fold lambda has %s parameters but there are %s accumulators",
        foldLambda.params.size(), accCount);
    final List<Core.Param> accParams = foldLambda.params.subList(0, accCount);
    final List<Core.Param> elemParams =
        foldLambda.params.subList(accCount, foldLambda.params.size());
    check(elemParams.size() == redomap.arrays.size(), stm,
        "fold lambda has %s element parameters but there are %s arrays",
        elemParams.size(), redomap.arrays.size());
    tracer.onRewrite(Rule.REDOMAP, stm);

    final Core.Param chunkSize =
        binder.newParam("chunk_size", PrimitiveType.I32);
    final Core.Param chunkOffset =
        binder.newParam("chunk_offset", PrimitiveType.I32);
    final List<Core.Param> chunkParams = new ArrayList<>();
    for (Core.Param elemParam : elemParams) {
      chunkParams.add(
          binder.newParam(elemParam.name.base + "_chunk",
              elemParam.type.arrayOfRow(core.var(chunkSize))));
    }
    final List<Core.Param> chunkAccParams = new ArrayList<>();
    accParams.forEach(p -> chunkAccParams.add(binder.newParamLike(p)));
    final List<Core.PatElem> redomapPatElems = new ArrayList<>();
    final List<Core.Var> redomapResult = new ArrayList<>();
    for (Core.PatElem patElem : stm.pattern.elements) {
      final Core.Param param =
          binder.newParam(patElem.name().base, patElem.type());
      redomapPatElems.add(core.patElem(param));
      redomapResult.add(core.var(param));
    }

    final Binder b = binder.nest();
    groupStreams.groupStreamMapAccum(b, redomapPatElems,
        redomap.certificates, core.var(chunkSize),
        lowerLambda(b, foldLambda), core.vars(chunkAccParams),
        core.vars(chunkParams));

    final List<Core.SubExp> accInit =
        copyUnconsumed(binder, "groupstream_mapaccum_copy", foldLambda,
            accParams, redomap.neutral);
    binder.letBind(stm.pattern,
        core.groupStream(redomap.width, redomap.width,
            core.groupStreamLambda(chunkSize, chunkOffset, chunkAccParams,
                chunkParams, b.body(redomapResult)),
            accInit, redomap.arrays));
  }

  /** Lowers a sequential stream to a grouped stream. Each map-out chunk is
   * written into the slice of its result array that the chunk covers. */
  private void lowerSequentialStream(Binder binder, Core.Stm stm,
      Core.Stream stream) {
    final Core.Lambda lambda = stream.lambda;
    final List<Core.SubExp> accs = stream.form.accumulators;
    final int accCount = accs.size();
    check(lambda.params.size() == 1 + accCount + stream.arrays.size(), stm,
        "stream lambda has %s parameters; expected a chunk size, "
            + "%s accumulators and %s arrays",
        lambda.params.size(), accCount, stream.arrays.size());
    check(lambda.returnTypes.size() >= accCount, stm,
        "stream lambda returns %s values but there are %s accumulators",
        lambda.returnTypes.size(), accCount);
    check(lambda.body.result.size() == lambda.returnTypes.size(), stm,
        "stream lambda body has %s results but %s return types",
        lambda.body.result.size(), lambda.returnTypes.size());
    tracer.onRewrite(Rule.SEQUENTIAL_STREAM, stm);

    final Core.Param chunkOffset =
        binder.newParam("streamseq_chunk_offset", PrimitiveType.I32);
    final Core.Param chunkSize = lambda.params.get(0);
    final List<Core.Param> accParams = lambda.params.subList(1, 1 + accCount);
    final List<Core.Param> arrParams =
        lambda.params.subList(1 + accCount, lambda.params.size());
    final List<Type> mapoutTypes = new ArrayList<>();
    for (Type type
        : lambda.returnTypes.subList(accCount, lambda.returnTypes.size())) {
      mapoutTypes.add(type.setOuterSize(stream.width).withUniqueness(true));
    }
    final List<Core.Var> mapoutArrays = resultArrays(binder, mapoutTypes);
    final List<Core.Param> outParams = new ArrayList<>();
    for (Type type : mapoutTypes) {
      outParams.add(binder.newParam("redomap_outarr", type));
    }

    final Binder b = binder.nest();
    lowerStms(b, lambda.body.stms);
    final List<Core.SubExp> result = lambda.body.result;
    final ImmutableList.Builder<Core.SubExp> newResult =
        ImmutableList.builder();
    newResult.addAll(result.subList(0, accCount));
    for (int k = 0; k < outParams.size(); k++) {
      final Core.Param outParam = outParams.get(k);
      final List<Core.DimIndex> slice =
          core.fullSlice(outParam.type,
              ImmutableList.of(
                  core.dimSlice(core.var(chunkOffset), core.var(chunkSize),
                      core.intLiteral(1))));
      newResult.add(
          b.letInPlace("mapout_res", stream.certificates,
              core.var(outParam), slice,
              core.subExp(result.get(accCount + k))));
    }

    final List<Core.SubExp> accInit =
        copyUnconsumed(binder, "streamseq_acc_copy", lambda, accParams, accs);
    binder.letBind(stm.pattern,
        core.groupStream(stream.width, stream.width,
            core.groupStreamLambda(chunkSize, chunkOffset,
                concat(accParams, outParams), arrParams,
                b.body(newResult.build())),
            concat(accInit, mapoutArrays), stream.arrays));
  }

  /** Lowers a counting loop to a grouped stream of chunk size 1 whose
   * accumulators are the loop variables. */
  private void lowerForLoop(Binder binder, Core.Stm stm, Core.DoLoop doLoop,
      Core.ForLoop forLoop) {
    check(doLoop.body.result.size() == doLoop.params().size(), stm,
        "loop body has %s results but there are %s loop variables",
        doLoop.body.result.size(), doLoop.params().size());
    tracer.onRewrite(Rule.FOR_LOOP, stm);
    final Core.Param dummyChunkSize =
        binder.newParam("dummy_chunk_size", PrimitiveType.I32);
    final Core.Body body = lowerBody(binder, doLoop.body);
    binder.letBind(stm.pattern,
        core.groupStream(forLoop.bound, core.intLiteral(1),
            core.groupStreamLambda(dummyChunkSize, forLoop.i,
                doLoop.params(), ImmutableList.of(), body),
            doLoop.inits(), ImmutableList.of()));
  }

  /** Returns the initial values of accumulators, copying each variable whose
   * parameter is not consumed by {@code lambda}.
   *
   * <p>A grouped stream overwrites its accumulators, so a value that is not
   * already consumed must not be shared with the caller. */
  private List<Core.SubExp> copyUnconsumed(Binder binder, String base,
      Core.Lambda lambda, List<Core.Param> accParams,
      List<? extends Core.SubExp> inits) {
    final Set<Name> consumed = oracle.consumedParams(lambda);
    final ImmutableList.Builder<Core.SubExp> b = ImmutableList.builder();
    for (int k = 0; k < inits.size(); k++) {
      final Core.SubExp init = inits.get(k);
      if (init instanceof Core.Var
          && !consumed.contains(accParams.get(k).name)) {
        b.add(binder.letExp(base, core.copy((Core.Var) init)));
      } else {
        b.add(init);
      }
    }
    return b.build();
  }
}

// End Sequentializer.java
