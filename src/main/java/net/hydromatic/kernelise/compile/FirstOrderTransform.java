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
import static net.hydromatic.kernelise.compile.Compiles.bindParams;
import static net.hydromatic.kernelise.compile.Compiles.bindRows;
import static net.hydromatic.kernelise.compile.Compiles.check;
import static net.hydromatic.kernelise.compile.Compiles.concat;
import static net.hydromatic.kernelise.compile.Compiles.merges;
import static net.hydromatic.kernelise.compile.Compiles.resultArrays;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import net.hydromatic.kernelise.ast.BinaryOp;
import net.hydromatic.kernelise.ast.Core;
import net.hydromatic.kernelise.ast.Name;
import net.hydromatic.kernelise.type.PrimitiveType;
import net.hydromatic.kernelise.type.Type;

/**
 * Converts combinators into sequential loops.
 *
 * <p>Every combinator becomes a {@link Core.DoLoop} over
 * {@code [0, width)}: a map writes each result into a fresh array, a
 * fold-and-map carries its accumulators as loop variables, a scan carries both
 * its accumulators and its output arrays, and a filter compacts the elements
 * it keeps into a buffer and copies the filled prefix. A stream is run as a
 * single chunk that covers the whole input.
 *
 * <p>Conditionals, loops and grouped streams are kept, but their bodies are
 * transformed. Other statements are copied unchanged.
 */
public class FirstOrderTransform implements Fallback, AccumulateMapLoopBuilder {
  private final ConsumptionOracle oracle;

  private FirstOrderTransform(ConsumptionOracle oracle) {
    this.oracle = requireNonNull(oracle);
  }

  /** Creates a FirstOrderTransform. */
  public static FirstOrderTransform of(ConsumptionOracle oracle) {
    return new FirstOrderTransform(oracle);
  }

  @Override
  public void lowerGeneric(Binder binder, Core.Stm stm) {
    switch (stm.exp.op) {
    case MAP:
      lowerMap(binder, stm, (Core.Map) stm.exp);
      break;

    case REDOMAP:
      lowerRedomap(binder, stm, (Core.Redomap) stm.exp);
      break;

    case SCAN:
      lowerScan(binder, stm, (Core.Scan) stm.exp);
      break;

    case FILTER:
      lowerFilter(binder, stm, (Core.Filter) stm.exp);
      break;

    case STREAM:
      lowerStream(binder, stm, (Core.Stream) stm.exp);
      break;

    case IF:
      final Core.If anIf = (Core.If) stm.exp;
      binder.letBind(stm.pattern,
          anIf.copy(lowerBody(binder, anIf.ifTrue),
              lowerBody(binder, anIf.ifFalse)));
      break;

    case DO_LOOP:
      final Core.DoLoop doLoop = (Core.DoLoop) stm.exp;
      binder.letBind(stm.pattern,
          doLoop.copy(lowerBody(binder, doLoop.body)));
      break;

    case GROUP_STREAM:
      final Core.GroupStream groupStream = (Core.GroupStream) stm.exp;
      final Core.GroupStreamLambda lambda = groupStream.lambda;
      binder.letBind(stm.pattern,
          core.groupStream(groupStream.width, groupStream.maxChunk,
              core.groupStreamLambda(lambda.chunkSize, lambda.chunkOffset,
                  lambda.accParams, lambda.arrParams,
                  lowerBody(binder, lambda.body)),
              groupStream.accumulators, groupStream.arrays));
      break;

    default:
      binder.add(stm);
    }
  }

  /** Transforms every statement in a body. */
  public Core.Body lowerBody(Binder binder, Core.Body body) {
    final Binder b = binder.nest();
    body.stms.forEach(stm -> lowerGeneric(b, stm));
    return b.body(body.result);
  }

  private Core.Lambda lowerLambda(Binder binder, Core.Lambda lambda) {
    return lambda.copy(lambda.params, lowerBody(binder, lambda.body));
  }

  private void lowerMap(Binder binder, Core.Stm stm, Core.Map map) {
    final Core.Lambda lambda = lowerLambda(binder, map.lambda);
    check(lambda.params.size() == map.arrays.size(), stm,
        "map lambda has %s parameters but there are %s arrays",
        lambda.params.size(), map.arrays.size());
    check(lambda.body.result.size() == stm.pattern.size(), stm,
        "map lambda has %s results but pattern has %s elements",
        lambda.body.result.size(), stm.pattern.size());
    final List<Core.Var> outArrays =
        resultArrays(binder, stm.pattern.types());
    final Core.Param i = binder.newParam("i", PrimitiveType.I32);
    final List<Core.Param> outParams = new ArrayList<>();
    for (Core.Var outArray : outArrays) {
      outParams.add(
          binder.newParam("map_outarr", outArray.type().withUniqueness(true)));
    }
    final Binder b = binder.nest();
    bindRows(b, map.certificates, lambda.params, map.arrays, core.var(i));
    b.addAll(lambda.body.stms);
    final List<Core.SubExp> result =
        writeRows(b, map.certificates, "map_outarr", outParams,
            lambda.body.result, i);
    binder.letBind(stm.pattern,
        core.doLoop(merges(outParams, outArrays),
            core.forLoop(i, map.width), b.body(result)));
  }

  private void lowerRedomap(Binder binder, Core.Stm stm,
      Core.Redomap redomap) {
    final Core.Lambda foldLambda = lowerLambda(binder, redomap.foldLambda);
    final int accCount = redomap.neutral.size();
    check(foldLambda.params.size() == accCount + redomap.arrays.size(),
        stm, "fold lambda has %s parameters; expected %s accumulators and "
            + "%s arrays",
        foldLambda.params.size(), accCount, redomap.arrays.size());
    check(foldLambda.body.result.size() == stm.pattern.size(), stm,
        "fold lambda has %s results but pattern has %s elements",
        foldLambda.body.result.size(), stm.pattern.size());
    final List<Type> types = stm.pattern.types();
    final List<Core.Var> mapoutArrays =
        resultArrays(binder, types.subList(accCount, types.size()));
    final AccumulateMapLoop loop =
        accumulateMapLoop(binder, redomap.certificates, redomap.width,
            foldLambda, redomap.neutral, redomap.arrays, mapoutArrays);
    binder.letBind(stm.pattern,
        core.doLoop(loop.merge, core.forLoop(loop.i, redomap.width),
            loop.body));
  }

  private void lowerScan(Binder binder, Core.Stm stm, Core.Scan scan) {
    final Core.Lambda lambda = lowerLambda(binder, scan.lambda);
    final int accCount = scan.neutral.size();
    check(lambda.params.size() == accCount + scan.arrays.size(), stm,
        "scan lambda has %s parameters; expected %s accumulators and "
            + "%s arrays",
        lambda.params.size(), accCount, scan.arrays.size());
    check(lambda.body.result.size() == accCount
            && stm.pattern.size() == accCount, stm,
        "scan with %s accumulators has %s results and %s pattern elements",
        accCount, lambda.body.result.size(), stm.pattern.size());
    final List<Core.Param> accParams = lambda.params.subList(0, accCount);
    final List<Core.Var> outArrays =
        resultArrays(binder, stm.pattern.types());
    final Core.Param i = binder.newParam("i", PrimitiveType.I32);
    final List<Core.Param> accMerge = new ArrayList<>();
    for (Core.Param accParam : accParams) {
      accMerge.add(binder.newParam("scanacc", accParam.type));
    }
    final List<Core.Param> outMerge = new ArrayList<>();
    for (Core.Var outArray : outArrays) {
      outMerge.add(
          binder.newParam("scan_outarr", outArray.type().withUniqueness(true)));
    }

    final Binder b = binder.nest();
    bindParams(b, accParams, core.vars(accMerge));
    bindRows(b, scan.certificates,
        lambda.params.subList(accCount, lambda.params.size()), scan.arrays,
        core.var(i));
    b.addAll(lambda.body.stms);
    final List<Core.SubExp> written =
        writeRows(b, scan.certificates, "scan_outarr", outMerge,
            lambda.body.result, i);

    // The loop also returns the final accumulators, which nobody uses.
    final List<Core.PatElem> patElems = new ArrayList<>();
    for (Core.Param accParam : accMerge) {
      patElems.add(core.patElem(binder.newParamLike(accParam)));
    }
    patElems.addAll(stm.pattern.elements);
    binder.letBind(core.pattern(patElems),
        core.doLoop(
            concat(merges(accMerge, scan.neutral),
                merges(outMerge, outArrays)),
            core.forLoop(i, scan.width),
            b.body(concat(lambda.body.result, written))));
  }

  private void lowerFilter(Binder binder, Core.Stm stm,
      Core.Filter filter) {
    final Core.Lambda lambda = lowerLambda(binder, filter.lambda);
    check(filter.arrays.size() == 1 && lambda.params.size() == 1, stm,
        "filter must have one array and a lambda with one parameter");
    check(lambda.body.result.size() == 1, stm,
        "filter lambda must have one result");
    check(stm.pattern.size() == 2, stm,
        "filter pattern must have two elements");
    final Core.Certificates certificates = filter.certificates;
    final Core.Var array = filter.arrays.get(0);
    final Type bufType =
        array.type().setOuterSize(filter.width).withUniqueness(true);
    final Core.Var buf =
        binder.letExp("filter_buf",
            core.scratch(bufType.elementType(), bufType.shape()));

    final Core.Param i = binder.newParam("i", PrimitiveType.I32);
    final Core.Param count = binder.newParam("filter_count", PrimitiveType.I32);
    final Core.Param bufMerge = binder.newParam("filter_buf", bufType);

    final Binder b = binder.nest();
    bindRows(b, certificates, lambda.params, filter.arrays, core.var(i));
    b.addAll(lambda.body.stms);

    // If the element passes, write it at the current count.
    final Binder t = b.nest();
    final Core.Var buf2 =
        t.letInPlace("filter_buf", certificates, core.var(bufMerge),
            core.rowSlice(bufType, core.var(count)),
            core.subExp(core.var(lambda.params.get(0))));
    final Core.Var count2 =
        t.letExp("filter_count",
            core.binOp(BinaryOp.ADD, core.var(count), core.intLiteral(1)));
    final Core.Param count3 = b.newParam("filter_count", PrimitiveType.I32);
    final Core.Param buf3 = b.newParam("filter_buf", bufType);
    b.letBind(core.varPattern(ImmutableList.of(count3, buf3)),
        core.ifThenElse(lambda.body.result.get(0),
            t.body(ImmutableList.of(count2, buf2)),
            core.body(ImmutableList.of(),
                ImmutableList.of(core.var(count), core.var(bufMerge))),
            ImmutableList.of(PrimitiveType.I32, bufType)));

    final Core.PatElem countElem = stm.pattern.elements.get(0);
    final Core.Param filled = binder.newParam("filter_buf", bufType);
    binder.letBind(core.pattern(countElem, core.patElem(filled)),
        core.doLoop(
            ImmutableList.of(core.merge(count, core.intLiteral(0)),
                core.merge(bufMerge, buf)),
            core.forLoop(i, filter.width),
            b.body(ImmutableList.of(core.var(count3), core.var(buf3)))));
    final Core.Var prefix =
        binder.letExp("filter_prefix",
            core.index(certificates, core.var(filled),
                core.fullSlice(bufType,
                    ImmutableList.of(
                        core.dimSlice(core.intLiteral(0),
                            core.var(countElem.param), core.intLiteral(1))))));
    binder.letBind(core.pattern(stm.pattern.elements.get(1)),
        core.copy(prefix));
  }

  private void lowerStream(Binder binder, Core.Stm stm, Core.Stream stream) {
    final Core.Lambda lambda = lowerLambda(binder, stream.lambda);
    final List<Core.SubExp> accs = stream.form.accumulators;
    check(lambda.params.size() == 1 + accs.size() + stream.arrays.size(),
        stm, "stream lambda has %s parameters; expected a chunk size, "
            + "%s accumulators and %s arrays",
        lambda.params.size(), accs.size(), stream.arrays.size());
    check(lambda.body.result.size() == stm.pattern.size(), stm,
        "stream lambda has %s results but pattern has %s elements",
        lambda.body.result.size(), stm.pattern.size());
    // One chunk covers the whole input.
    bindParams(binder, lambda.params.subList(0, 1),
        ImmutableList.of(stream.width));
    bindParams(binder, lambda.params.subList(1, 1 + accs.size()), accs);
    bindParams(binder,
        lambda.params.subList(1 + accs.size(), lambda.params.size()),
        stream.arrays);
    binder.addAll(lambda.body.stms);
    for (int k = 0; k < stm.pattern.size(); k++) {
      binder.letBind(core.pattern(stm.pattern.elements.get(k)),
          core.subExp(lambda.body.result.get(k)));
    }
  }

  @Override
  public AccumulateMapLoop accumulateMapLoop(Binder binder,
      Core.Certificates certificates, Core.SubExp width, Core.Lambda lambda,
      List<? extends Core.SubExp> accInit, List<Core.Var> arrays,
      List<Core.Var> mapoutArrays) {
    final int accCount = accInit.size();
    checkArgument(lambda.params.size() >= accCount,
        "lambda has fewer parameters than accumulators");
    checkArgument(arrays.isEmpty()
            || lambda.params.size() == accCount + arrays.size(),
        "lambda has %s parameters; expected %s accumulators and %s arrays",
        lambda.params.size(), accCount, arrays.size());
    checkArgument(lambda.body.result.size() == accCount + mapoutArrays.size(),
        "lambda has %s results; expected %s accumulators and %s map-outs",
        lambda.body.result.size(), accCount, mapoutArrays.size());

    final Set<Name> consumed = oracle.consumedParams(lambda);
    final Core.Param i = binder.newParam("i", PrimitiveType.I32);
    final List<Core.Param> accParams = lambda.params.subList(0, accCount);
    final List<Core.Param> accMerge = new ArrayList<>();
    for (Core.Param accParam : accParams) {
      final Type type = consumed.contains(accParam.name)
          ? accParam.type.withUniqueness(true)
          : accParam.type;
      accMerge.add(binder.newParam("acc", type));
    }
    final List<Core.Param> outMerge = new ArrayList<>();
    for (Core.Var mapoutArray : mapoutArrays) {
      outMerge.add(
          binder.newParam("redomap_outarr",
              mapoutArray.type().withUniqueness(true)));
    }

    final Binder b = binder.nest();
    bindParams(b, accParams, core.vars(accMerge));
    if (!arrays.isEmpty()) {
      bindRows(b, certificates,
          lambda.params.subList(accCount, lambda.params.size()), arrays,
          core.var(i));
    }
    b.addAll(lambda.body.stms);
    final List<Core.SubExp> result = lambda.body.result;
    final List<Core.SubExp> written =
        writeRows(b, certificates, "redomap_outarr", outMerge,
            result.subList(accCount, result.size()), i);
    return new AccumulateMapLoop(
        concat(merges(accMerge, accInit), merges(outMerge, mapoutArrays)),
        i, b.body(concat(result.subList(0, accCount), written)));
  }

  /** Writes each value into row {@code i} of the corresponding array, and
   * returns the updated arrays. */
  private static List<Core.SubExp> writeRows(Binder binder,
      Core.Certificates certificates, String base, List<Core.Param> arrays,
      List<Core.SubExp> values, Core.Param i) {
    final ImmutableList.Builder<Core.SubExp> b = ImmutableList.builder();
    for (int k = 0; k < arrays.size(); k++) {
      final Core.Param array = arrays.get(k);
      b.add(
          binder.letInPlace(base, certificates, core.var(array),
              core.rowSlice(array.type, core.var(i)),
              core.subExp(values.get(k))));
    }
    return b.build();
  }
}

// End FirstOrderTransform.java
