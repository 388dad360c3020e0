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
import static net.hydromatic.kernelise.Programs.arrayOf;
import static net.hydromatic.kernelise.Programs.body;
import static net.hydromatic.kernelise.Programs.eval;
import static net.hydromatic.kernelise.Programs.let;
import static net.hydromatic.kernelise.ast.CoreBuilder.core;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.startsWith;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.kernelise.Programs;
import net.hydromatic.kernelise.ast.BinaryOp;
import net.hydromatic.kernelise.ast.CompareOp;
import net.hydromatic.kernelise.ast.Core;
import net.hydromatic.kernelise.ast.CoreNode;
import net.hydromatic.kernelise.ast.Op;
import net.hydromatic.kernelise.eval.ArrayValue;
import net.hydromatic.kernelise.eval.Prop;
import net.hydromatic.kernelise.type.PrimitiveType;
import org.junit.jupiter.api.Test;

/** Tests for {@link Sequentializer}. */
public class SequentializerTest {
  private static final Core.Certificates NO_CERTS = Core.Certificates.EMPTY;

  /** Lowers a body with default properties, recording the rules that
   * fire. */
  private static Core.Body lower(Programs p, Core.Body body,
      List<Sequentializer.Rule> rules) {
    final Tracer tracer =
        Tracers.withOnRewrite(Tracers.empty(),
            (rule, stm) -> rules.add(rule));
    return Sequentializer.of(p.nameGenerator, ImmutableMap.of(), tracer)
        .lowerBody(body);
  }

  /** Sum of {@code [1..8]} becomes a grouped stream of trip count 8 whose
   * chunk size the backend chooses. */
  @Test void testReduce() {
    final Programs p = new Programs();
    final Core.Param xs =
        p.param("xs", arrayOf(PrimitiveType.I32, core.intLiteral(8)));
    final Core.Param sum = p.param("sum", PrimitiveType.I32);
    final Core.Stm stm =
        let(sum, p.sum(core.intLiteral(8), core.intLiteral(0), core.var(xs)));
    final Core.Body body = body(ImmutableList.of(stm), core.var(sum));

    final List<Sequentializer.Rule> rules = new ArrayList<>();
    final Core.Body lowered = lower(p, body, rules);
    assertThat(rules, hasToString("[REDOMAP]"));
    assertThat(lowered.stms, hasSize(1));
    final Core.Stm loweredStm = lowered.stms.get(0);
    assertThat(loweredStm.pattern, is(stm.pattern));
    assertThat(loweredStm.exp.op, is(Op.GROUP_STREAM));
    final Core.GroupStream groupStream = (Core.GroupStream) loweredStm.exp;
    assertThat(groupStream.width, hasToString("8i32"));
    assertThat(groupStream.maxChunk, is(groupStream.width));
    assertThat(groupStream.accumulators, hasToString("[0i32]"));
    assertThat(groupStream.lambda.accParams, hasSize(1));
    assertThat(groupStream.arrays, is(ImmutableList.of(core.var(xs))));
    assertThat(lowered.result, is(body.result));

    // The body of each chunk is a grouped stream of chunk size 1.
    final Core.Stm innerStm = groupStream.lambda.body.stms.get(0);
    assertThat(innerStm.exp.op, is(Op.GROUP_STREAM));
    assertThat(((Core.GroupStream) innerStm.exp).maxChunk,
        hasToString("1i32"));

    final Map<Core.Param, Object> inputs =
        ImmutableMap.of(xs, ArrayValue.ofInts(1, 2, 3, 4, 5, 6, 7, 8));
    assertThat(eval(body, 1, inputs), hasToString("[36]"));
    assertThat(eval(lowered, 1, inputs), hasToString("[36]"));
    assertThat(eval(lowered, 3, inputs), hasToString("[36]"));
    assertThat(eval(lowered, 8, inputs), hasToString("[36]"));
  }

  /** Loop {@code for i < 5} that adds {@code i} to an accumulator that
   * starts at 10 becomes a grouped stream of chunk size 1 whose offset is
   * the induction variable. */
  @Test void testForLoop() {
    final Programs p = new Programs();
    final Core.Param acc = p.param("acc", PrimitiveType.I32);
    final Core.Param i = p.param("i", PrimitiveType.I32);
    final Core.Param acc2 = p.param("acc2", PrimitiveType.I32);
    final Core.Param r = p.param("r", PrimitiveType.I32);
    final Core.Body loopBody =
        body(
            ImmutableList.of(
                let(acc2,
                    core.binOp(BinaryOp.ADD, core.var(acc), core.var(i)))),
            core.var(acc2));
    final Core.Stm stm =
        let(r,
            core.doLoop(
                ImmutableList.of(core.merge(acc, core.intLiteral(10))),
                core.forLoop(i, core.intLiteral(5)), loopBody));
    final Core.Body body = body(ImmutableList.of(stm), core.var(r));

    final List<Sequentializer.Rule> rules = new ArrayList<>();
    final Core.Body lowered = lower(p, body, rules);
    assertThat(rules, hasToString("[FOR_LOOP]"));
    assertThat(lowered,
        hasToString("{let {r_3: i32} = group_stream(5i32, 1i32, "
            + "fn dummy_chunk_size_4 i_1 {acc_0: i32} {} => "
            + "{let {acc2_2: i32} = (acc_0 + i_1); in {acc2_2}}, "
            + "{10i32}, {}); in {r_3}}"));
    final Core.GroupStream groupStream =
        (Core.GroupStream) lowered.stms.get(0).exp;
    assertThat(groupStream.lambda.chunkOffset, sameInstance(i));
    assertThat(groupStream.lambda.accParams, is(ImmutableList.of(acc)));

    assertThat(eval(body, 1, ImmutableMap.of()), hasToString("[20]"));
    assertThat(eval(lowered, 1, ImmutableMap.of()), hasToString("[20]"));
    assertThat(eval(lowered, 4, ImmutableMap.of()), hasToString("[20]"));
  }

  /** A loop over an {@code i64} induction variable is not special-cased. */
  @Test void testForLoopI64() {
    final Programs p = new Programs();
    final Core.Param acc = p.param("acc", PrimitiveType.I64);
    final Core.Param i = p.param("i", PrimitiveType.I64);
    final Core.Param r = p.param("r", PrimitiveType.I64);
    final Core.Stm stm =
        let(r,
            core.doLoop(
                ImmutableList.of(core.merge(acc, core.longLiteral(1))),
                core.forLoop(i, core.longLiteral(3)),
                body(ImmutableList.of(), core.var(i))));
    final List<Sequentializer.Rule> rules = new ArrayList<>();
    final Core.Body lowered =
        lower(p, body(ImmutableList.of(stm), core.var(r)), rules);
    assertThat(rules, empty());
    assertThat(lowered.stms.get(0).exp.op, is(Op.DO_LOOP));
    assertThat(eval(lowered, 1, ImmutableMap.of()), hasToString("[2]"));
  }

  /** An initial accumulator that is a variable, and whose parameter the
   * fold lambda does not consume, is copied. */
  @Test void testUnconsumedAccumulatorIsCopied() {
    final Programs p = new Programs();
    final Core.Param xs =
        p.param("xs", arrayOf(PrimitiveType.I32, core.intLiteral(4)));
    final Core.Param init = p.param("init", PrimitiveType.I32);
    final Core.Param sum = p.param("sum", PrimitiveType.I32);
    final Core.Stm stm =
        let(sum, p.sum(core.intLiteral(4), core.var(init), core.var(xs)));
    final Core.Body body = body(ImmutableList.of(stm), core.var(sum));

    final Core.Body lowered = lower(p, body, new ArrayList<>());
    assertThat(lowered.stms, hasSize(2));
    final Core.Stm copyStm = lowered.stms.get(0);
    assertThat(copyStm.exp, hasToString("copy(" + init.name + ")"));
    final Core.Param copy = copyStm.pattern.elements.get(0).param;
    assertThat(copy.name.base, is("groupstream_mapaccum_copy"));
    final Core.GroupStream groupStream =
        (Core.GroupStream) lowered.stms.get(1).exp;
    assertThat(groupStream.accumulators.get(0),
        is((Core.SubExp) core.var(copy)));

    final Map<Core.Param, Object> inputs =
        ImmutableMap.of(xs, ArrayValue.ofInts(1, 2, 3, 4), init, 100);
    assertThat(eval(lowered, 2, inputs), hasToString("[110]"));
  }

  /** An initial accumulator whose parameter is consumed is passed through
   * unchanged. */
  @Test void testConsumedAccumulatorIsNotCopied() {
    final Programs p = new Programs();
    final Core.Param xs =
        p.param("xs", arrayOf(PrimitiveType.I32, core.intLiteral(4)));
    final Core.Param init = p.param("init", PrimitiveType.I32);
    final Core.Param sum = p.param("sum", PrimitiveType.I32);
    final Core.Stm stm =
        let(sum, p.sum(core.intLiteral(4), core.var(init), core.var(xs)));
    final Core.Body body = body(ImmutableList.of(stm), core.var(sum));

    final ConsumptionOracle everything = lambda ->
        lambda.params.stream().map(param -> param.name)
            .collect(toImmutableSet());
    final FirstOrderTransform firstOrderTransform =
        FirstOrderTransform.of(everything);
    final Core.Body lowered =
        Sequentializer.of(p.nameGenerator, ImmutableMap.of(),
                Tracers.empty(), everything, firstOrderTransform,
                firstOrderTransform)
            .lowerBody(body);
    assertThat(lowered.stms, hasSize(1));
    final Core.GroupStream groupStream =
        (Core.GroupStream) lowered.stms.get(0).exp;
    assertThat(groupStream.accumulators.get(0),
        is((Core.SubExp) core.var(init)));
  }

  /** A sequential stream with an accumulator and a map-out result becomes a
   * grouped stream that writes each map-out chunk into a slice of a result
   * array. Every chunk size gives the same result, so the slices cover the
   * whole array. */
  @Test void testSequentialStream() {
    final Programs p = new Programs();
    final Core.Param xs =
        p.param("xs", arrayOf(PrimitiveType.I32, core.intLiteral(8)));
    final Core.Param chunk = p.param("chunk", PrimitiveType.I32);
    final Core.Param acc = p.param("acc", PrimitiveType.I32);
    final Core.Param xsChunk =
        p.param("xs_chunk", arrayOf(PrimitiveType.I32, core.var(chunk)));
    final Core.Param s = p.param("s", PrimitiveType.I32);
    final Core.Param ys =
        p.param("ys", arrayOf(PrimitiveType.I32, core.var(chunk)));
    final Core.Lambda lambda =
        core.lambda(ImmutableList.of(chunk, acc, xsChunk),
            body(
                ImmutableList.of(
                    let(s,
                        p.sum(core.var(chunk), core.var(acc),
                            core.var(xsChunk))),
                    let(ys,
                        core.map(NO_CERTS, core.var(chunk),
                            p.unaryLambda(BinaryOp.MUL, core.intLiteral(2)),
                            ImmutableList.of(core.var(xsChunk))))),
                core.var(s), core.var(ys)),
            ImmutableList.of(PrimitiveType.I32,
                arrayOf(PrimitiveType.I32, core.var(chunk))));
    final Core.Param total = p.param("total", PrimitiveType.I32);
    final Core.Param doubled =
        p.param("doubled", arrayOf(PrimitiveType.I32, core.intLiteral(8)));
    final Core.Stm stm =
        let(ImmutableList.of(total, doubled),
            core.stream(NO_CERTS, core.intLiteral(8),
                core.sequential(ImmutableList.of(core.intLiteral(0))),
                lambda, ImmutableList.of(core.var(xs))));
    final Core.Body body =
        body(ImmutableList.of(stm), core.var(total), core.var(doubled));

    final List<Sequentializer.Rule> rules = new ArrayList<>();
    final Core.Body lowered = lower(p, body, rules);
    assertThat(rules, hasToString("[SEQUENTIAL_STREAM, REDOMAP]"));
    assertThat(lowered.stms, hasSize(2));
    assertThat(lowered.stms.get(0).exp.op, is(Op.SCRATCH));
    final Core.Stm loweredStm = lowered.stms.get(1);
    assertThat(loweredStm.pattern, is(stm.pattern));
    final Core.GroupStream groupStream = (Core.GroupStream) loweredStm.exp;
    assertThat(groupStream.maxChunk, is(groupStream.width));
    assertThat(groupStream.lambda.chunkSize, sameInstance(chunk));
    assertThat(groupStream.lambda.chunkOffset.name.base,
        is("streamseq_chunk_offset"));
    assertThat(groupStream.lambda.accParams, hasSize(2));
    assertThat(groupStream.lambda.accParams.get(1).name.base,
        is("redomap_outarr"));
    assertThat(groupStream.lambda.arrParams,
        is(ImmutableList.of(xsChunk)));

    final Map<Core.Param, Object> inputs =
        ImmutableMap.of(xs, ArrayValue.ofInts(1, 2, 3, 4, 5, 6, 7, 8));
    final String expected = "[36, [2, 4, 6, 8, 10, 12, 14, 16]]";
    assertThat(eval(body, 3, inputs), hasToString(expected));
    for (int chunkSize = 1; chunkSize <= 9; chunkSize++) {
      assertThat(eval(lowered, chunkSize, inputs), hasToString(expected));
    }
  }

  /** Builds a sequential stream that sums {@code xs} starting from a
   * variable initial accumulator. */
  private static Core.Stm sumStream(Programs p, Core.Param total,
      Core.Param init, Core.Param xs) {
    final Core.Param chunk = p.param("chunk", PrimitiveType.I32);
    final Core.Param acc = p.param("acc", PrimitiveType.I32);
    final Core.Param xsChunk =
        p.param("xs_chunk", arrayOf(PrimitiveType.I32, core.var(chunk)));
    final Core.Param s = p.param("s", PrimitiveType.I32);
    final Core.Lambda lambda =
        core.lambda(ImmutableList.of(chunk, acc, xsChunk),
            body(
                ImmutableList.of(
                    let(s,
                        p.sum(core.var(chunk), core.var(acc),
                            core.var(xsChunk)))),
                core.var(s)),
            ImmutableList.of(PrimitiveType.I32));
    return let(total,
        core.stream(NO_CERTS, core.intLiteral(4),
            core.sequential(ImmutableList.of(core.var(init))),
            lambda, ImmutableList.of(core.var(xs))));
  }

  /** A sequential stream whose initial accumulator is a variable that the
   * stream lambda does not consume gets a copy of that variable. */
  @Test void testUnconsumedStreamAccumulatorIsCopied() {
    final Programs p = new Programs();
    final Core.Param xs =
        p.param("xs", arrayOf(PrimitiveType.I32, core.intLiteral(4)));
    final Core.Param init = p.param("init", PrimitiveType.I32);
    final Core.Param total = p.param("total", PrimitiveType.I32);
    final Core.Stm stm = sumStream(p, total, init, xs);
    final Core.Body body = body(ImmutableList.of(stm), core.var(total));

    final List<Sequentializer.Rule> rules = new ArrayList<>();
    final Core.Body lowered = lower(p, body, rules);
    assertThat(rules, hasToString("[SEQUENTIAL_STREAM, REDOMAP]"));
    assertThat(lowered.stms, hasSize(2));
    final Core.Stm copyStm = lowered.stms.get(0);
    assertThat(copyStm.exp, hasToString("copy(" + init.name + ")"));
    final Core.Param copy = copyStm.pattern.elements.get(0).param;
    assertThat(copy.name.base, is("streamseq_acc_copy"));
    final Core.GroupStream groupStream =
        (Core.GroupStream) lowered.stms.get(1).exp;
    assertThat(groupStream.accumulators.get(0),
        is((Core.SubExp) core.var(copy)));

    final Map<Core.Param, Object> inputs =
        ImmutableMap.of(xs, ArrayValue.ofInts(1, 2, 3, 4), init, 100);
    assertThat(eval(body, 3, inputs), hasToString("[110]"));
    assertThat(eval(lowered, 1, inputs), hasToString("[110]"));
    assertThat(eval(lowered, 3, inputs), hasToString("[110]"));
  }

  /** A sequential stream whose accumulator parameter is consumed uses its
   * initial accumulator unchanged. */
  @Test void testConsumedStreamAccumulatorIsNotCopied() {
    final Programs p = new Programs();
    final Core.Param xs =
        p.param("xs", arrayOf(PrimitiveType.I32, core.intLiteral(4)));
    final Core.Param init = p.param("init", PrimitiveType.I32);
    final Core.Param total = p.param("total", PrimitiveType.I32);
    final Core.Stm stm = sumStream(p, total, init, xs);
    final Core.Body body = body(ImmutableList.of(stm), core.var(total));

    final ConsumptionOracle everything = lambda ->
        lambda.params.stream().map(param -> param.name)
            .collect(toImmutableSet());
    final FirstOrderTransform firstOrderTransform =
        FirstOrderTransform.of(everything);
    final Core.Body lowered =
        Sequentializer.of(p.nameGenerator, ImmutableMap.of(),
                Tracers.empty(), everything, firstOrderTransform,
                firstOrderTransform)
            .lowerBody(body);
    assertThat(lowered.stms, hasSize(1));
    final Core.GroupStream groupStream =
        (Core.GroupStream) lowered.stms.get(0).exp;
    assertThat(groupStream.accumulators,
        is(ImmutableList.<Core.SubExp>of(core.var(init))));

    final Map<Core.Param, Object> inputs =
        ImmutableMap.of(xs, ArrayValue.ofInts(1, 2, 3, 4), init, 100);
    assertThat(eval(lowered, 2, inputs), hasToString("[110]"));
  }

  /** A stream with a parallel form goes to the fallback. */
  @Test void testParallelStream() {
    final Programs p = new Programs();
    final Core.Param xs =
        p.param("xs", arrayOf(PrimitiveType.I32, core.intLiteral(3)));
    final Core.Param chunk = p.param("chunk", PrimitiveType.I32);
    final Core.Param acc = p.param("acc", PrimitiveType.I32);
    final Core.Param xsChunk =
        p.param("xs_chunk", arrayOf(PrimitiveType.I32, core.var(chunk)));
    final Core.Param s = p.param("s", PrimitiveType.I32);
    final Core.Lambda lambda =
        core.lambda(ImmutableList.of(chunk, acc, xsChunk),
            body(
                ImmutableList.of(
                    let(s,
                        p.sum(core.var(chunk), core.var(acc),
                            core.var(xsChunk)))),
                core.var(s)),
            ImmutableList.of(PrimitiveType.I32));
    final Core.Param total = p.param("total", PrimitiveType.I32);
    final Core.Stm stm =
        let(total,
            core.stream(NO_CERTS, core.intLiteral(3),
                core.parallel(Core.Commutativity.COMMUTATIVE,
                    p.binaryLambda(BinaryOp.ADD, PrimitiveType.I32),
                    ImmutableList.of(core.intLiteral(0))),
                lambda, ImmutableList.of(core.var(xs))));
    final Core.Body body = body(ImmutableList.of(stm), core.var(total));

    final List<Core.Stm> fallbacks = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnFallback(Tracers.empty(), fallbacks::add);
    final Core.Body lowered =
        Sequentializer.of(p.nameGenerator, ImmutableMap.of(), tracer)
            .lowerBody(body);
    assertThat(fallbacks, hasSize(1));
    assertThat(fallbacks.get(0), sameInstance(stm));
    final Map<Core.Param, Object> inputs =
        ImmutableMap.of(xs, ArrayValue.ofInts(4, 5, 6));
    assertThat(eval(lowered, 2, inputs), hasToString("[15]"));
  }

  /** Both branches of a conditional are lowered. */
  @Test void testIf() {
    final Programs p = new Programs();
    final Core.Param cond = p.param("cond", PrimitiveType.BOOL);
    final Core.Param xs =
        p.param("xs", arrayOf(PrimitiveType.I32, core.intLiteral(3)));
    final Core.Param a = p.param("a", PrimitiveType.I32);
    final Core.Param b = p.param("b", PrimitiveType.I32);
    final Core.Param r = p.param("r", PrimitiveType.I32);
    final Core.Body ifTrue =
        body(
            ImmutableList.of(
                let(a,
                    p.sum(core.intLiteral(3), core.intLiteral(0),
                        core.var(xs)))),
            core.var(a));
    final Core.Body ifFalse =
        body(
            ImmutableList.of(
                let(b,
                    core.binOp(BinaryOp.SUB, core.intLiteral(0),
                        core.intLiteral(1)))),
            core.var(b));
    final Core.Stm stm =
        let(r,
            core.ifThenElse(core.var(cond), ifTrue, ifFalse,
                ImmutableList.of(PrimitiveType.I32)));
    final Core.Body body = body(ImmutableList.of(stm), core.var(r));

    final List<Sequentializer.Rule> rules = new ArrayList<>();
    final Core.Body lowered = lower(p, body, rules);
    assertThat(rules, hasToString("[IF, REDOMAP]"));
    assertThat(lowered.stms, hasSize(1));
    final Core.If anIf = (Core.If) lowered.stms.get(0).exp;
    assertThat(anIf.condition, is((Core.SubExp) core.var(cond)));
    assertThat(anIf.returnTypes, hasToString("[i32]"));
    assertThat(anIf.ifTrue.stms.get(0).exp.op, is(Op.GROUP_STREAM));
    assertThat(anIf.ifFalse.stms.get(0), sameInstance(ifFalse.stms.get(0)));

    final ArrayValue xsValue = ArrayValue.ofInts(1, 2, 3);
    assertThat(eval(lowered, 1, ImmutableMap.of(cond, true, xs, xsValue)),
        hasToString("[6]"));
    assertThat(eval(lowered, 1, ImmutableMap.of(cond, false, xs, xsValue)),
        hasToString("[-1]"));
  }

  /** Every statement that matches no rule reaches the fallback exactly
   * once. */
  @Test void testFallbackExactlyOnce() {
    final Programs p = new Programs();
    final Core.Var xs =
        core.var(p.param("xs", arrayOf(PrimitiveType.I32, core.intLiteral(4))));
    final Core.SubExp four = core.intLiteral(4);
    final List<Core.Stm> stms = new ArrayList<>();

    // map
    final Core.Param ys = p.param("ys", arrayOf(PrimitiveType.I32, four));
    stms.add(
        let(ys,
            core.map(NO_CERTS, four,
                p.unaryLambda(BinaryOp.MUL, core.intLiteral(2)),
                ImmutableList.of(xs))));

    // scan
    final Core.Param zs = p.param("zs", arrayOf(PrimitiveType.I32, four));
    stms.add(
        let(zs,
            core.scan(NO_CERTS, four,
                p.binaryLambda(BinaryOp.ADD, PrimitiveType.I32),
                ImmutableList.of(core.intLiteral(0)), ImmutableList.of(xs))));

    // filter
    final Core.Param x = p.param("x", PrimitiveType.I32);
    final Core.Param keep = p.param("keep", PrimitiveType.BOOL);
    final Core.Lambda predicate =
        core.lambda(ImmutableList.of(x),
            body(
                ImmutableList.of(
                    let(keep,
                        core.cmpOp(CompareOp.GT, core.var(x),
                            core.intLiteral(2)))),
                core.var(keep)),
            ImmutableList.of(PrimitiveType.BOOL));
    final Core.Param n = p.param("n", PrimitiveType.I32);
    final Core.Param ws =
        p.param("ws", arrayOf(PrimitiveType.I32, core.var(n)));
    stms.add(
        let(ImmutableList.of(n, ws),
            core.filter(NO_CERTS, four, predicate, xs)));

    // fold-and-map with a map-out result
    final Core.Param acc = p.param("acc", PrimitiveType.I32);
    final Core.Param e = p.param("e", PrimitiveType.I32);
    final Core.Param acc2 = p.param("acc2", PrimitiveType.I32);
    final Core.Param sq = p.param("sq", PrimitiveType.I32);
    final Core.Lambda fold =
        core.lambda(ImmutableList.of(acc, e),
            body(
                ImmutableList.of(
                    let(acc2,
                        core.binOp(BinaryOp.ADD, core.var(acc), core.var(e))),
                    let(sq,
                        core.binOp(BinaryOp.MUL, core.var(e), core.var(e)))),
                core.var(acc2), core.var(sq)),
            ImmutableList.of(PrimitiveType.I32, PrimitiveType.I32));
    final Core.Param t = p.param("t", PrimitiveType.I32);
    final Core.Param us = p.param("us", arrayOf(PrimitiveType.I32, four));
    stms.add(
        let(ImmutableList.of(t, us),
            core.redomap(NO_CERTS, four, Core.Commutativity.COMMUTATIVE,
                p.binaryLambda(BinaryOp.ADD, PrimitiveType.I32), fold,
                ImmutableList.of(core.intLiteral(0)), ImmutableList.of(xs))));

    // basic operation
    final Core.Param k = p.param("k", PrimitiveType.I32);
    stms.add(
        let(k,
            core.binOp(BinaryOp.ADD, core.intLiteral(1),
                core.intLiteral(2))));

    // while loop
    final Core.Param go = p.param("go", PrimitiveType.BOOL);
    final Core.Param j = p.param("j", PrimitiveType.I32);
    final Core.Param j2 = p.param("j2", PrimitiveType.I32);
    final Core.Param go2 = p.param("go2", PrimitiveType.BOOL);
    final Core.Param g = p.param("g", PrimitiveType.BOOL);
    final Core.Param jj = p.param("jj", PrimitiveType.I32);
    stms.add(
        let(ImmutableList.of(g, jj),
            core.doLoop(
                ImmutableList.of(core.merge(go, core.boolLiteral(true)),
                    core.merge(j, core.intLiteral(0))),
                core.whileLoop(go.name),
                body(
                    ImmutableList.of(
                        let(j2,
                            core.binOp(BinaryOp.ADD, core.var(j),
                                core.intLiteral(1))),
                        let(go2,
                            core.cmpOp(CompareOp.LT, core.var(j2),
                                core.intLiteral(3)))),
                    core.var(go2), core.var(j2)))));

    final Core.Body body =
        body(stms, core.var(ys), core.var(zs), core.var(n), core.var(ws),
            core.var(t), core.var(us), core.var(k), core.var(jj));

    final List<Core.Stm> fallbackStms = new ArrayList<>();
    final List<Core.Stm> tracedStms = new ArrayList<>();
    final List<Sequentializer.Rule> rules = new ArrayList<>();
    final FirstOrderTransform firstOrderTransform =
        FirstOrderTransform.of(ConsumptionAnalyzer.INSTANCE);
    final Fallback fallback = (binder, stm) -> {
      fallbackStms.add(stm);
      firstOrderTransform.lowerGeneric(binder, stm);
    };
    final Tracer tracer =
        Tracers.withOnRewrite(
            Tracers.withOnFallback(Tracers.empty(), tracedStms::add),
            (rule, stm) -> rules.add(rule));
    final Core.Body lowered =
        Sequentializer.of(p.nameGenerator, ImmutableMap.of(), tracer,
                ConsumptionAnalyzer.INSTANCE, fallback, firstOrderTransform)
            .lowerBody(body);

    assertThat(rules, empty());
    assertThat(fallbackStms, hasSize(stms.size()));
    assertThat(tracedStms, hasSize(stms.size()));
    for (int i = 0; i < stms.size(); i++) {
      assertThat(fallbackStms.get(i), sameInstance(stms.get(i)));
      assertThat(tracedStms.get(i), sameInstance(stms.get(i)));
    }

    final Map<Core.Param, Object> inputs =
        ImmutableMap.of(xs.param, ArrayValue.ofInts(1, 2, 3, 4));
    final String expected = "[[2, 4, 6, 8], [1, 3, 6, 10], 2, [3, 4], "
        + "10, [1, 4, 9, 16], 3, 3]";
    assertThat(eval(body, 1, inputs), hasToString(expected));
    assertThat(eval(lowered, 1, inputs), hasToString(expected));
  }

  /** If {@link Prop#TRACE_FALLBACK} is false, the tracer is not told about
   * statements that go to the fallback. */
  @Test void testTraceFallbackOff() {
    final Programs p = new Programs();
    final Core.Param k = p.param("k", PrimitiveType.I32);
    final Core.Stm stm =
        let(k,
            core.binOp(BinaryOp.ADD, core.intLiteral(1),
                core.intLiteral(2)));
    final Core.Body body = body(ImmutableList.of(stm), core.var(k));

    final List<Core.Stm> fallbacks = new ArrayList<>();
    final List<Core.Body> bodies = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnBody(
            Tracers.withOnFallback(Tracers.empty(), fallbacks::add),
            bodies::add);
    final Core.Body lowered =
        Sequentializer.of(p.nameGenerator,
                ImmutableMap.of(Prop.TRACE_FALLBACK, false), tracer)
            .lowerBody(body);
    assertThat(fallbacks, empty());
    assertThat(bodies, hasSize(1));
    assertThat(bodies.get(0), sameInstance(lowered));
    assertThat(lowered.stms.get(0), sameInstance(stm));
  }

  /** A fold-and-map whose lambda does not match its arrays is an internal
   * error that names the statement. */
  @Test void testMalformedRedomap() {
    final Programs p = new Programs();
    final Core.Param xs =
        p.param("xs", arrayOf(PrimitiveType.I32, core.intLiteral(3)));
    final Core.Param a = p.param("a", PrimitiveType.I32);
    final Core.Param b = p.param("b", PrimitiveType.I32);
    final Core.Stm stm =
        let(ImmutableList.of(a, b),
            core.reduce(NO_CERTS, core.intLiteral(3),
                Core.Commutativity.COMMUTATIVE,
                p.binaryLambda(BinaryOp.ADD, PrimitiveType.I32),
                ImmutableList.of(core.intLiteral(0), core.intLiteral(0)),
                ImmutableList.of(core.var(xs))));
    final Core.Body body =
        body(ImmutableList.of(stm), core.var(a), core.var(b));

    final Sequentializer sequentializer =
        Sequentializer.of(p.nameGenerator, ImmutableMap.of(),
            Tracers.empty());
    final CompileException e =
        assertThrows(CompileException.class,
            () -> sequentializer.lowerBody(body));
    assertThat(e.node(), sameInstance((CoreNode) stm));
    assertThat(e.getMessage(),
        is("fold lambda has 0 element parameters but there are 1 arrays"));
    assertThat(e.describeTo(new StringBuilder()).toString(),
        startsWith("Internal error: fold lambda has 0 element parameters"));
  }

  /** A sequential stream whose lambda has too few parameters is an internal
   * error. */
  @Test void testMalformedStream() {
    final Programs p = new Programs();
    final Core.Param xs =
        p.param("xs", arrayOf(PrimitiveType.I32, core.intLiteral(3)));
    final Core.Param chunk = p.param("chunk", PrimitiveType.I32);
    final Core.Param xsChunk =
        p.param("xs_chunk", arrayOf(PrimitiveType.I32, core.var(chunk)));
    final Core.Lambda lambda =
        core.lambda(ImmutableList.of(chunk, xsChunk),
            body(ImmutableList.of(), core.var(chunk)),
            ImmutableList.of(PrimitiveType.I32));
    final Core.Param total = p.param("total", PrimitiveType.I32);
    final Core.Stm stm =
        let(total,
            core.stream(NO_CERTS, core.intLiteral(3),
                core.sequential(ImmutableList.of(core.intLiteral(0))),
                lambda, ImmutableList.of(core.var(xs))));

    final Binder binder = new Binder(p.nameGenerator);
    final Sequentializer sequentializer =
        Sequentializer.of(p.nameGenerator, ImmutableMap.of(),
            Tracers.empty());
    final CompileException e =
        assertThrows(CompileException.class,
            () -> sequentializer.lowerStm(binder, stm));
    assertThat(e.node(), sameInstance((CoreNode) stm));
    assertThat(e.getMessage(),
        startsWith("stream lambda has 2 parameters; expected a chunk size, "
            + "1 accumulators and 1 arrays"));
    assertThat(binder.stms(), empty());

    // The lambda declares an accumulator and a map-out result, but its body
    // returns only the accumulator.
    final Core.Param acc = p.param("acc", PrimitiveType.I32);
    final Core.Lambda lambda2 =
        core.lambda(ImmutableList.of(chunk, acc, xsChunk),
            body(ImmutableList.of(), core.var(acc)),
            ImmutableList.of(PrimitiveType.I32,
                arrayOf(PrimitiveType.I32, core.var(chunk))));
    final Core.Param ys =
        p.param("ys", arrayOf(PrimitiveType.I32, core.intLiteral(3)));
    final Core.Stm stm2 =
        let(ImmutableList.of(total, ys),
            core.stream(NO_CERTS, core.intLiteral(3),
                core.sequential(ImmutableList.of(core.intLiteral(0))),
                lambda2, ImmutableList.of(core.var(xs))));
    final List<Sequentializer.Rule> rules = new ArrayList<>();
    final Sequentializer sequentializer2 =
        Sequentializer.of(p.nameGenerator, ImmutableMap.of(),
            Tracers.withOnRewrite(Tracers.empty(),
                (rule, s) -> rules.add(rule)));
    final CompileException e2 =
        assertThrows(CompileException.class,
            () -> sequentializer2.lowerStm(binder, stm2));
    assertThat(e2.node(), sameInstance((CoreNode) stm2));
    assertThat(e2.getMessage(),
        is("stream lambda body has 1 results but 2 return types"));
    assertThat(binder.stms(), empty());
    assertThat(rules, empty());
  }

  /** A counting loop whose body returns more values than there are loop
   * variables is an internal error that names the statement. */
  @Test void testMalformedForLoop() {
    final Programs p = new Programs();
    final Core.Param acc = p.param("acc", PrimitiveType.I32);
    final Core.Param i = p.param("i", PrimitiveType.I32);
    final Core.Param r = p.param("r", PrimitiveType.I32);
    final Core.Stm stm =
        let(r,
            core.doLoop(
                ImmutableList.of(core.merge(acc, core.intLiteral(10))),
                core.forLoop(i, core.intLiteral(5)),
                body(ImmutableList.of(), core.var(acc), core.var(i))));

    final Binder binder = new Binder(p.nameGenerator);
    final List<Sequentializer.Rule> rules = new ArrayList<>();
    final Sequentializer sequentializer =
        Sequentializer.of(p.nameGenerator, ImmutableMap.of(),
            Tracers.withOnRewrite(Tracers.empty(),
                (rule, s) -> rules.add(rule)));
    final CompileException e =
        assertThrows(CompileException.class,
            () -> sequentializer.lowerStm(binder, stm));
    assertThat(e.node(), sameInstance((CoreNode) stm));
    assertThat(e.getMessage(),
        is("loop body has 2 results but there are 1 loop variables"));
    assertThat(binder.stms(), empty());
    assertThat(rules, empty());
  }

  /** The output of {@link Sequentializer#lowerBody} binds every variable
   * before it is used. */
  @Test void testOrdering() {
    final Programs p = new Programs();
    final Core.Param xs =
        p.param("xs", arrayOf(PrimitiveType.I32, core.intLiteral(5)));
    final Core.Param init = p.param("init", PrimitiveType.I32);
    final Core.Param s1 = p.param("s1", PrimitiveType.I32);
    final Core.Param s2 = p.param("s2", PrimitiveType.I32);
    final Core.Body body =
        body(
            ImmutableList.of(
                let(s1,
                    p.sum(core.intLiteral(5), core.var(init),
                        core.var(xs))),
                let(s2,
                    p.sum(core.intLiteral(5), core.var(s1), core.var(xs)))),
            core.var(s2));
    final Core.Body lowered =
        Sequentializer.of(p.nameGenerator,
                ImmutableMap.of(Prop.VALIDATE, false), Tracers.empty())
            .lowerBody(body);
    KernelChecker.check(lowered, ImmutableSet.of(xs.name, init.name));

    // Two copies and two grouped streams, each copy just before the
    // grouped stream that uses it
    assertThat(lowered.stms, hasSize(4));
    assertThat(lowered.stms.get(0).exp.op, is(Op.COPY));
    assertThat(lowered.stms.get(1).exp.op, is(Op.GROUP_STREAM));
    assertThat(lowered.stms.get(2).exp.op, is(Op.COPY));
    assertThat(lowered.stms.get(3).exp.op, is(Op.GROUP_STREAM));

    final Map<Core.Param, Object> inputs =
        ImmutableMap.of(xs, ArrayValue.ofInts(1, 2, 3, 4, 5), init, 1);
    assertThat(eval(lowered, 2, inputs), hasToString("[31]"));
  }

  /** Lowering a lambda keeps its parameters and return types. */
  @Test void testLowerLambda() {
    final Programs p = new Programs();
    final Core.Param xs =
        p.param("xs", arrayOf(PrimitiveType.I32, core.intLiteral(2)));
    final Core.Param s = p.param("s", PrimitiveType.I32);
    final Core.Lambda lambda =
        core.lambda(ImmutableList.of(xs),
            body(
                ImmutableList.of(
                    let(s,
                        p.sum(core.intLiteral(2), core.intLiteral(0),
                            core.var(xs)))),
                core.var(s)),
            ImmutableList.of(PrimitiveType.I32));
    final Core.Lambda lowered =
        Sequentializer.of(p.nameGenerator, ImmutableMap.of(),
                Tracers.empty())
            .lowerLambda(lambda);
    assertThat(lowered.params, is(lambda.params));
    assertThat(lowered.returnTypes, is(lambda.returnTypes));
    assertThat(lowered.body.stms.get(0).exp.op, is(Op.GROUP_STREAM));
  }
}

// End SequentializerTest.java
