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
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.kernelise.ast.Core;
import net.hydromatic.kernelise.type.PrimitiveType;
import net.hydromatic.kernelise.type.Type;

/**
 * Builds grouped streams that run a single-element body one element at a
 * time.
 *
 * <p>Both builders reuse a body that was written for one element, and adapt
 * it to the chunked calling convention of {@link Core.GroupStream}: each
 * element parameter becomes a chunk-shaped array parameter, and the body
 * starts by reading row 0 of each chunk into the original parameter. That is
 * only correct if every chunk has one element, so the grouped streams that
 * these builders emit always have a maximum chunk size of 1.
 */
public class GroupStreams {
  private final AccumulateMapLoopBuilder loopBuilder;

  /** Creates a GroupStreams. */
  public GroupStreams(AccumulateMapLoopBuilder loopBuilder) {
    this.loopBuilder = requireNonNull(loopBuilder);
  }

  /**
   * Binds {@code patElems} to a grouped stream that folds {@code foldLambda}
   * over {@code arrays}.
   *
   * <p>The first {@code accInit.size()} parameters of the lambda are
   * accumulators, and the rest are elements of {@code arrays}. The lambda's
   * results beyond the accumulators are "map-out" values, written into fresh
   * arrays of length {@code width}; {@code patElems} receives the final
   * accumulators followed by those arrays.
   */
  public void groupStreamMapAccum(Binder binder, List<Core.PatElem> patElems,
      Core.Certificates certificates, Core.SubExp width,
      Core.Lambda foldLambda, List<? extends Core.SubExp> accInit,
      List<Core.Var> arrays) {
    final int accCount = accInit.size();
    check(foldLambda.params.size() == accCount + arrays.size(), foldLambda,
        "fold lambda has %s parameters; expected %s accumulators and %s "
            + "arrays",
        foldLambda.params.size(), accCount, arrays.size());
    check(foldLambda.returnTypes.size() >= accCount, foldLambda,
        "fold lambda returns %s values but there are %s accumulators",
        foldLambda.returnTypes.size(), accCount);
    check(patElems.size() == foldLambda.returnTypes.size(), foldLambda,
        "pattern has %s elements but fold lambda returns %s values",
        patElems.size(), foldLambda.returnTypes.size());

    final List<Type> returnTypes = foldLambda.returnTypes;
    final List<Type> mapoutTypes = new ArrayList<>();
    for (Type type : returnTypes.subList(accCount, returnTypes.size())) {
      mapoutTypes.add(type.arrayOfRow(width));
    }
    final List<Core.Var> mapoutArrays = resultArrays(binder, mapoutTypes);

    // Build the loop from a lambda that has only the accumulator
    // parameters; the element parameters are bound below.
    final Core.Lambda accLambda =
        core.lambda(foldLambda.params.subList(0, accCount), foldLambda.body,
            returnTypes);
    final AccumulateMapLoopBuilder.AccumulateMapLoop loop =
        loopBuilder.accumulateMapLoop(binder, certificates, width, accLambda,
            accInit, ImmutableList.of(), mapoutArrays);

    final Core.Param dummyChunkSize =
        binder.newParam("groupstream_mapaccum_dummy_chunk_size",
            PrimitiveType.I32);
    final List<Core.Param> elemParams =
        foldLambda.params.subList(accCount, foldLambda.params.size());
    final List<Core.Param> chunkedParams =
        chunkedParams(binder, elemParams, dummyChunkSize);
    final Core.Body body =
        core.body(
            concat(readFirstRows(certificates, elemParams, chunkedParams),
                loop.body.stms),
            loop.body.result);

    final List<Core.Param> accParams = new ArrayList<>();
    loop.merge.forEach(merge -> accParams.add(merge.param));
    binder.letBind(core.pattern(patElems),
        core.groupStream(width, core.intLiteral(1),
            core.groupStreamLambda(dummyChunkSize, loop.i, accParams,
                chunkedParams, body),
            concat(accInit, mapoutArrays), arrays));
  }

  /**
   * Binds {@code pattern} to a grouped stream that applies a single-element
   * body to each element of {@code arrays}, as a map would.
   *
   * <p>{@code params} are bound to the elements of {@code arrays}, and the
   * {@code k}th result of {@code body} is written into row {@code i} of the
   * array bound to the {@code k}th element of {@code pattern}.
   */
  public void mapIsh(Binder binder, Core.Pattern pattern,
      Core.Certificates certificates, Core.SubExp width,
      List<Core.Param> params, Core.Body body, List<Core.Var> arrays) {
    check(params.size() == arrays.size(), body,
        "%s parameters but %s arrays", params.size(), arrays.size());
    check(body.result.size() == pattern.size(), body,
        "body has %s results but pattern has %s elements",
        body.result.size(), pattern.size());

    final Core.Param i = binder.newParam("i", PrimitiveType.I32);
    final List<Core.Var> outArrays = resultArrays(binder, pattern.types());
    final List<Core.Param> outParams = new ArrayList<>();
    for (Core.PatElem patElem : pattern.elements) {
      outParams.add(
          binder.newParam(patElem.name().base + "_out",
              patElem.type().withUniqueness(true)));
    }
    final Core.Param dummyChunkSize =
        binder.newParam("dummy_chunk_size", PrimitiveType.I32);
    final List<Core.Param> chunkedParams =
        chunkedParams(binder, params, dummyChunkSize);

    final List<Core.Stm> stms =
        new ArrayList<>(readFirstRows(certificates, params, chunkedParams));
    stms.addAll(body.stms);
    final List<Core.SubExp> result = new ArrayList<>();
    for (int k = 0; k < outParams.size(); k++) {
      final Core.Param outParam = outParams.get(k);
      final Core.Param outParamNew =
          binder.newParam(outParam.name.base + "_new", outParam.type);
      stms.add(
          core.stm(
              core.pattern(
                  core.inPlace(outParamNew, Core.Certificates.EMPTY,
                      core.var(outParam),
                      core.rowSlice(outParam.type, core.var(i)))),
              core.subExp(body.result.get(k))));
      result.add(core.var(outParamNew));
    }

    binder.letBind(pattern,
        core.groupStream(width, core.intLiteral(1),
            core.groupStreamLambda(dummyChunkSize, i, outParams,
                chunkedParams, core.body(stms, result)),
            outArrays, arrays));
  }

  /** Creates, for each element parameter, a parameter that holds a chunk of
   * such elements. */
  private static List<Core.Param> chunkedParams(Binder binder,
      List<Core.Param> params, Core.Param chunkSize) {
    final ImmutableList.Builder<Core.Param> b = ImmutableList.builder();
    for (Core.Param param : params) {
      b.add(
          binder.newParam(param.name.base + "_chunked",
              param.type.arrayOfRow(core.var(chunkSize))));
    }
    return b.build();
  }

  /** Creates statements that bind each element parameter to row 0 of the
   * corresponding chunk. */
  private static List<Core.Stm> readFirstRows(Core.Certificates certificates,
      List<Core.Param> params, List<Core.Param> chunkedParams) {
    final ImmutableList.Builder<Core.Stm> b = ImmutableList.builder();
    for (int k = 0; k < params.size(); k++) {
      final Core.Param chunked = chunkedParams.get(k);
      b.add(
          core.stm(core.pattern(core.patElem(params.get(k))),
              core.index(certificates, core.var(chunked),
                  core.rowSlice(chunked.type, core.intLiteral(0)))));
    }
    return b.build();
  }
}

// End GroupStreams.java
