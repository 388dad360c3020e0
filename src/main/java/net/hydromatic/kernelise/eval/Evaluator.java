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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.kernelise.ast.Core;

/**
 * Interpreter for the intermediate representation.
 *
 * <p>Evaluates both the combinators of the input and the grouped streams and
 * loops of the output, so that a program can be checked by running it before
 * and after a transformation.
 *
 * <p>An in-place binding writes into the source array and binds the same
 * array object, so the effect of a missing copy is observable.
 */
public class Evaluator {
  private final Map<Prop, Object> props;

  private Evaluator(Map<Prop, Object> props) {
    this.props = ImmutableMap.copyOf(props);
  }

  /** Creates an Evaluator. */
  public static Evaluator of(Map<Prop, Object> props) {
    return new Evaluator(props);
  }

  /** Evaluates a body, and returns the values of its result. */
  public List<Object> evalBody(EvalEnv env, Core.Body body) {
    EvalEnv env2 = env;
    for (Core.Stm stm : body.stms) {
      env2 = evalStm(env2, stm);
    }
    return values(env2, body.result);
  }

  /** Evaluates a statement, and returns an environment that also contains
   * the variables bound by its pattern. */
  public EvalEnv evalStm(EvalEnv env, Core.Stm stm) {
    final List<Object> values = evalExp(env, stm.exp);
    checkArgument(values.size() == stm.pattern.size(),
        "pattern has %s elements but expression has %s values: %s",
        stm.pattern.size(), values.size(), stm);
    EvalEnv env2 = env;
    for (int i = 0; i < values.size(); i++) {
      final Core.PatElem patElem = stm.pattern.elements.get(i);
      Object value = values.get(i);
      if (patElem.bindage instanceof Core.BindInPlace) {
        final Core.BindInPlace bindInPlace =
            (Core.BindInPlace) patElem.bindage;
        final ArrayValue source = (ArrayValue) env.value(bindInPlace.source);
        source.write(slice(env, bindInPlace.slice), value);
        value = source;
      }
      env2 = env2.bind(patElem.name(), value);
    }
    return env2;
  }

  /** Applies a lambda to arguments. */
  public List<Object> apply(EvalEnv env, Core.Lambda lambda,
      List<?> args) {
    return evalBody(env.bindAll(lambda.params, args), lambda.body);
  }

  /** Evaluates an expression, and returns its values. */
  public List<Object> evalExp(EvalEnv env, Core.Exp exp) {
    switch (exp.op) {
    case SUB_EXP:
      return ImmutableList.of(env.value(((Core.SubExpOp) exp).subExp));

    case COPY:
      return ImmutableList.of(
          ArrayValue.copyOf(env.value(((Core.Copy) exp).array)));

    case INDEX:
      final Core.Index index = (Core.Index) exp;
      final ArrayValue array = (ArrayValue) env.value(index.array);
      return ImmutableList.of(array.read(slice(env, index.slice)));

    case SCRATCH:
      final Core.Scratch scratch = (Core.Scratch) exp;
      final List<Integer> dims = new ArrayList<>();
      scratch.dims.forEach(dim -> dims.add(intValue(env, dim)));
      return ImmutableList.of(ArrayValue.scratch(scratch.elementType, dims));

    case BIN_OP:
      final Core.BinOp binOp = (Core.BinOp) exp;
      return ImmutableList.of(
          Codes.binOp(binOp.binaryOp, env.value(binOp.x),
              env.value(binOp.y)));

    case CMP_OP:
      final Core.CmpOp cmpOp = (Core.CmpOp) exp;
      return ImmutableList.of(
          Codes.compare(cmpOp.compareOp, env.value(cmpOp.x),
              env.value(cmpOp.y)));

    case IOTA:
      final int n = intValue(env, ((Core.Iota) exp).n);
      final int[] ints = new int[n];
      for (int i = 0; i < n; i++) {
        ints[i] = i;
      }
      return ImmutableList.of(ArrayValue.ofInts(ints));

    case REPLICATE:
      final Core.Replicate replicate = (Core.Replicate) exp;
      return ImmutableList.of(
          ArrayValue.replicate(intValue(env, replicate.n),
              env.value(replicate.value)));

    case IF:
      final Core.If anIf = (Core.If) exp;
      return (Boolean) env.value(anIf.condition)
          ? evalBody(env, anIf.ifTrue)
          : evalBody(env, anIf.ifFalse);

    case DO_LOOP:
      return evalDoLoop(env, (Core.DoLoop) exp);

    case MAP:
      return evalMap(env, (Core.Map) exp);

    case REDOMAP:
      return evalRedomap(env, (Core.Redomap) exp);

    case SCAN:
      return evalScan(env, (Core.Scan) exp);

    case FILTER:
      return evalFilter(env, (Core.Filter) exp);

    case STREAM:
      return evalStream(env, (Core.Stream) exp);

    case GROUP_STREAM:
      return evalGroupStream(env, (Core.GroupStream) exp);

    default:
      throw new AssertionError("unknown expression " + exp.op);
    }
  }

  private List<Object> evalDoLoop(EvalEnv env, Core.DoLoop doLoop) {
    List<Object> values = values(env, doLoop.inits());
    if (doLoop.form instanceof Core.ForLoop) {
      final Core.ForLoop forLoop = (Core.ForLoop) doLoop.form;
      final int bound = intValue(env, forLoop.bound);
      for (int i = 0; i < bound; i++) {
        final EvalEnv env2 =
            env.bindAll(doLoop.params(), values).bind(forLoop.i.name, i);
        values = evalBody(env2, doLoop.body);
      }
    } else {
      final Core.WhileLoop whileLoop = (Core.WhileLoop) doLoop.form;
      for (;;) {
        final EvalEnv env2 = env.bindAll(doLoop.params(), values);
        if (!(Boolean) env2.get(whileLoop.condition)) {
          break;
        }
        values = evalBody(env2, doLoop.body);
      }
    }
    return values;
  }

  private List<Object> evalMap(EvalEnv env, Core.Map map) {
    final int width = intValue(env, map.width);
    final List<ArrayValue> arrays = arrays(env, map.arrays);
    final Rows results = new Rows(map.lambda.returnTypes.size());
    for (int i = 0; i < width; i++) {
      results.add(apply(env, map.lambda, row(arrays, i)));
    }
    return results.toArrays();
  }

  private List<Object> evalRedomap(EvalEnv env, Core.Redomap redomap) {
    final int width = intValue(env, redomap.width);
    final List<ArrayValue> arrays = arrays(env, redomap.arrays);
    final int accCount = redomap.neutral.size();
    List<Object> accs = values(env, redomap.neutral);
    final Rows mapouts =
        new Rows(redomap.foldLambda.returnTypes.size() - accCount);
    for (int i = 0; i < width; i++) {
      final List<Object> args = new ArrayList<>(accs);
      args.addAll(row(arrays, i));
      final List<Object> results = apply(env, redomap.foldLambda, args);
      accs = results.subList(0, accCount);
      mapouts.add(results.subList(accCount, results.size()));
    }
    return ImmutableList.builder().addAll(accs).addAll(mapouts.toArrays())
        .build();
  }

  private List<Object> evalScan(EvalEnv env, Core.Scan scan) {
    final int width = intValue(env, scan.width);
    final List<ArrayValue> arrays = arrays(env, scan.arrays);
    List<Object> accs = values(env, scan.neutral);
    final Rows results = new Rows(accs.size());
    for (int i = 0; i < width; i++) {
      final List<Object> args = new ArrayList<>(accs);
      args.addAll(row(arrays, i));
      accs = apply(env, scan.lambda, args);
      results.add(accs);
    }
    return results.toArrays();
  }

  private List<Object> evalFilter(EvalEnv env, Core.Filter filter) {
    final int width = intValue(env, filter.width);
    final ArrayValue array = (ArrayValue) env.value(filter.arrays.get(0));
    final List<Object> kept = new ArrayList<>();
    for (int i = 0; i < width; i++) {
      final Object element = array.get(i);
      final List<Object> results =
          apply(env, filter.lambda, ImmutableList.of(element));
      if ((Boolean) results.get(0)) {
        kept.add(ArrayValue.copyOf(element));
      }
    }
    return ImmutableList.of(kept.size(), ArrayValue.of(kept));
  }

  /** Evaluates a stream. A sequential stream is split into chunks of
   * {@link Prop#CHUNK_SIZE}; a parallel stream is one chunk. */
  private List<Object> evalStream(EvalEnv env, Core.Stream stream) {
    final int width = intValue(env, stream.width);
    final List<ArrayValue> arrays = arrays(env, stream.arrays);
    final int accCount = stream.form.accumulators.size();
    final int chunk = stream.form instanceof Core.Sequential
        ? Math.max(1, Prop.CHUNK_SIZE.intValue(props))
        : Math.max(1, width);
    List<Object> accs = values(env, stream.form.accumulators);
    final List<List<Object>> mapouts = new ArrayList<>();
    for (int k = accCount; k < stream.lambda.returnTypes.size(); k++) {
      mapouts.add(new ArrayList<>());
    }
    for (int offset = 0; offset < width; offset += chunk) {
      final int size = Math.min(chunk, width - offset);
      final List<Object> args = new ArrayList<>();
      args.add(size);
      args.addAll(accs);
      args.addAll(window(arrays, offset, size));
      final List<Object> results = apply(env, stream.lambda, args);
      accs = results.subList(0, accCount);
      for (int k = 0; k < mapouts.size(); k++) {
        final ArrayValue part = (ArrayValue) results.get(accCount + k);
        for (int i = 0; i < part.size(); i++) {
          mapouts.get(k).add(part.get(i));
        }
      }
    }
    final ImmutableList.Builder<Object> b = ImmutableList.builder();
    b.addAll(accs);
    mapouts.forEach(mapout -> b.add(ArrayValue.of(mapout)));
    return b.build();
  }

  /** Evaluates a grouped stream. The chunk size is {@link Prop#CHUNK_SIZE},
   * but no more than the grouped stream's maximum. */
  private List<Object> evalGroupStream(EvalEnv env,
      Core.GroupStream groupStream) {
    final int width = intValue(env, groupStream.width);
    final int maxChunk = intValue(env, groupStream.maxChunk);
    final int chunk =
        Math.max(1, Math.min(Prop.CHUNK_SIZE.intValue(props), maxChunk));
    final List<ArrayValue> arrays = arrays(env, groupStream.arrays);
    final Core.GroupStreamLambda lambda = groupStream.lambda;
    List<Object> accs = values(env, groupStream.accumulators);
    for (int offset = 0; offset < width; offset += chunk) {
      final int size = Math.min(chunk, width - offset);
      final EvalEnv env2 = env.bind(lambda.chunkSize.name, size)
          .bind(lambda.chunkOffset.name, offset)
          .bindAll(lambda.accParams, accs)
          .bindAll(lambda.arrParams, window(arrays, offset, size));
      accs = evalBody(env2, lambda.body);
    }
    return accs;
  }

  private static List<Object> values(EvalEnv env,
      List<? extends Core.SubExp> subExps) {
    final List<Object> list = new ArrayList<>();
    subExps.forEach(subExp -> list.add(env.value(subExp)));
    return list;
  }

  private static int intValue(EvalEnv env, Core.SubExp subExp) {
    return ((Number) env.value(subExp)).intValue();
  }

  private static List<ArrayValue> arrays(EvalEnv env, List<Core.Var> vars) {
    final List<ArrayValue> list = new ArrayList<>();
    vars.forEach(var -> list.add((ArrayValue) env.value(var)));
    return list;
  }

  /** Returns the {@code i}th row of each array. */
  private static List<Object> row(List<ArrayValue> arrays, int i) {
    final List<Object> list = new ArrayList<>();
    arrays.forEach(array -> list.add(array.get(i)));
    return list;
  }

  /** Returns rows {@code [offset, offset + size)} of each array. */
  private static List<Object> window(List<ArrayValue> arrays, int offset,
      int size) {
    final List<Object> list = new ArrayList<>();
    arrays.forEach(array -> list.add(array.slice(offset, size, 1)));
    return list;
  }

  /** Converts a slice into a list of {@link Integer} and
   * {@link ArrayValue.Range} values. */
  private static List<Object> slice(EvalEnv env,
      List<Core.DimIndex> slice) {
    final List<Object> list = new ArrayList<>();
    for (Core.DimIndex dimIndex : slice) {
      if (dimIndex instanceof Core.DimFix) {
        list.add(intValue(env, ((Core.DimFix) dimIndex).i));
      } else {
        final Core.DimSlice dimSlice = (Core.DimSlice) dimIndex;
        list.add(
            new ArrayValue.Range(intValue(env, dimSlice.offset),
                intValue(env, dimSlice.num), intValue(env, dimSlice.stride)));
      }
    }
    return list;
  }

  /** Collects the results of each iteration of an element-wise operation,
   * and assembles them into arrays. */
  private static class Rows {
    final List<List<Object>> columns = new ArrayList<>();

    Rows(int count) {
      for (int i = 0; i < count; i++) {
        columns.add(new ArrayList<>());
      }
    }

    void add(List<Object> values) {
      for (int i = 0; i < columns.size(); i++) {
        columns.get(i).add(ArrayValue.copyOf(values.get(i)));
      }
    }

    List<Object> toArrays() {
      final List<Object> list = new ArrayList<>();
      columns.forEach(column -> list.add(ArrayValue.of(column)));
      return list;
    }
  }
}

// End Evaluator.java
