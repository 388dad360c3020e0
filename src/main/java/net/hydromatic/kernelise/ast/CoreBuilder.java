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
package net.hydromatic.kernelise.ast;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.kernelise.type.PrimitiveType;
import net.hydromatic.kernelise.type.Type;

/** Builds IR nodes. */
public enum CoreBuilder {
  /**
   * The singleton instance of the CORE builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  core;

  private final Core.Constant trueLiteral =
      new Core.Constant(PrimitiveType.BOOL, true);

  private final Core.Constant falseLiteral =
      new Core.Constant(PrimitiveType.BOOL, false);

  // atoms

  /** Creates a constant. */
  public Core.Constant constant(PrimitiveType type, Object value) {
    if (type == PrimitiveType.BOOL) {
      return boolLiteral((Boolean) value);
    }
    return new Core.Constant(type, value);
  }

  /** Creates a {@code bool} constant. */
  public Core.Constant boolLiteral(boolean b) {
    return b ? trueLiteral : falseLiteral;
  }

  /** Creates an {@code i32} constant. */
  public Core.Constant intLiteral(int i) {
    return new Core.Constant(PrimitiveType.I32, i);
  }

  /** Creates an {@code i64} constant. */
  public Core.Constant longLiteral(long i) {
    return new Core.Constant(PrimitiveType.I64, i);
  }

  /** Creates an existential dimension. */
  public Core.Ext ext(int i) {
    return new Core.Ext(i);
  }

  public Core.Param param(Name name, Type type) {
    return new Core.Param(name, type);
  }

  public Core.Var var(Core.Param param) {
    return new Core.Var(param);
  }

  /** Creates a reference to each of a list of params. */
  public List<Core.Var> vars(List<Core.Param> params) {
    final ImmutableList.Builder<Core.Var> b = ImmutableList.builder();
    params.forEach(p -> b.add(var(p)));
    return b.build();
  }

  public Core.Certificates certificates(List<Name> names) {
    return names.isEmpty()
        ? Core.Certificates.EMPTY
        : new Core.Certificates(ImmutableList.copyOf(names));
  }

  // slices

  public Core.DimFix dimFix(Core.SubExp i) {
    return new Core.DimFix(i);
  }

  public Core.DimSlice dimSlice(Core.SubExp offset, Core.SubExp num,
      Core.SubExp stride) {
    return new Core.DimSlice(offset, num, stride);
  }

  /** Creates a slice that starts with {@code prefix} and selects every row of
   * the remaining dimensions of {@code type}. */
  public List<Core.DimIndex> fullSlice(Type type,
      List<? extends Core.DimIndex> prefix) {
    final List<Core.DimIndex> list = new ArrayList<>(prefix);
    final List<Core.SubExp> shape = type.shape();
    for (int i = prefix.size(); i < shape.size(); i++) {
      list.add(dimSlice(intLiteral(0), shape.get(i), intLiteral(1)));
    }
    return ImmutableList.copyOf(list);
  }

  /** Creates a slice that selects one row of an array of type
   * {@code type}. */
  public List<Core.DimIndex> rowSlice(Type type, Core.SubExp i) {
    return fullSlice(type, ImmutableList.of(dimFix(i)));
  }

  // patterns

  public Core.PatElem patElem(Core.Param param) {
    return new Core.PatElem(param, Core.BindVar.INSTANCE);
  }

  /** Creates a pattern element that binds {@code param} to {@code source}
   * updated in place at {@code slice}. */
  public Core.PatElem inPlace(Core.Param param,
      Core.Certificates certificates, Core.Var source,
      List<? extends Core.DimIndex> slice) {
    return new Core.PatElem(param,
        new Core.BindInPlace(certificates, source,
            ImmutableList.copyOf(slice)));
  }

  public Core.Pattern pattern(List<Core.PatElem> elements) {
    return new Core.Pattern(ImmutableList.copyOf(elements));
  }

  public Core.Pattern pattern(Core.PatElem... elements) {
    return new Core.Pattern(ImmutableList.copyOf(elements));
  }

  /** Creates a pattern that freshly binds each of a list of params. */
  public Core.Pattern varPattern(List<Core.Param> params) {
    final ImmutableList.Builder<Core.PatElem> b = ImmutableList.builder();
    params.forEach(p -> b.add(patElem(p)));
    return new Core.Pattern(b.build());
  }

  // statements

  public Core.Stm stm(Core.Pattern pattern, Core.Exp exp) {
    return new Core.Stm(pattern, exp);
  }

  public Core.Body body(List<Core.Stm> stms,
      List<? extends Core.SubExp> result) {
    return new Core.Body(ImmutableList.copyOf(stms),
        ImmutableList.copyOf(result));
  }

  public Core.Lambda lambda(List<Core.Param> params, Core.Body body,
      List<? extends Type> returnTypes) {
    return new Core.Lambda(ImmutableList.copyOf(params), body,
        ImmutableList.copyOf(returnTypes));
  }

  // basic operations

  public Core.SubExpOp subExp(Core.SubExp subExp) {
    return new Core.SubExpOp(subExp);
  }

  public Core.Copy copy(Core.Var array) {
    return new Core.Copy(array);
  }

  public Core.Index index(Core.Certificates certificates, Core.Var array,
      List<? extends Core.DimIndex> slice) {
    return new Core.Index(certificates, array, ImmutableList.copyOf(slice));
  }

  public Core.Scratch scratch(PrimitiveType elementType,
      List<? extends Core.SubExp> dims) {
    return new Core.Scratch(elementType, ImmutableList.copyOf(dims));
  }

  public Core.BinOp binOp(BinaryOp binaryOp, Core.SubExp x, Core.SubExp y) {
    return new Core.BinOp(binaryOp, x, y);
  }

  public Core.CmpOp cmpOp(CompareOp compareOp, Core.SubExp x,
      Core.SubExp y) {
    return new Core.CmpOp(compareOp, x, y);
  }

  public Core.Iota iota(Core.SubExp n) {
    return new Core.Iota(n);
  }

  public Core.Replicate replicate(Core.SubExp n, Core.SubExp value) {
    return new Core.Replicate(n, value);
  }

  // control flow

  public Core.If ifThenElse(Core.SubExp condition, Core.Body ifTrue,
      Core.Body ifFalse, List<? extends Type> returnTypes) {
    return new Core.If(condition, ifTrue, ifFalse,
        ImmutableList.copyOf(returnTypes));
  }

  public Core.Merge merge(Core.Param param, Core.SubExp init) {
    return new Core.Merge(param, init);
  }

  public Core.ForLoop forLoop(Core.Param i, Core.SubExp bound) {
    return new Core.ForLoop(i, bound);
  }

  public Core.WhileLoop whileLoop(Name condition) {
    return new Core.WhileLoop(condition);
  }

  public Core.DoLoop doLoop(List<Core.Merge> merge, Core.LoopForm form,
      Core.Body body) {
    return new Core.DoLoop(ImmutableList.copyOf(merge), form, body);
  }

  // combinators

  public Core.Map map(Core.Certificates certificates, Core.SubExp width,
      Core.Lambda lambda, List<Core.Var> arrays) {
    return new Core.Map(certificates, width, lambda,
        ImmutableList.copyOf(arrays));
  }

  public Core.Redomap redomap(Core.Certificates certificates,
      Core.SubExp width, Core.Commutativity commutativity,
      Core.Lambda reduceLambda, Core.Lambda foldLambda,
      List<? extends Core.SubExp> neutral, List<Core.Var> arrays) {
    return new Core.Redomap(certificates, width, commutativity, reduceLambda,
        foldLambda, ImmutableList.copyOf(neutral),
        ImmutableList.copyOf(arrays));
  }

  /** Creates a reduction; that is, a {@link Core.Redomap} whose fold lambda
   * is the same as its reduce lambda. */
  public Core.Redomap reduce(Core.Certificates certificates,
      Core.SubExp width, Core.Commutativity commutativity,
      Core.Lambda lambda, List<? extends Core.SubExp> neutral,
      List<Core.Var> arrays) {
    return redomap(certificates, width, commutativity, lambda, lambda,
        neutral, arrays);
  }

  public Core.Scan scan(Core.Certificates certificates, Core.SubExp width,
      Core.Lambda lambda, List<? extends Core.SubExp> neutral,
      List<Core.Var> arrays) {
    return new Core.Scan(certificates, width, lambda,
        ImmutableList.copyOf(neutral), ImmutableList.copyOf(arrays));
  }

  public Core.Filter filter(Core.Certificates certificates,
      Core.SubExp width, Core.Lambda lambda, Core.Var array) {
    return new Core.Filter(certificates, width, lambda,
        ImmutableList.of(array));
  }

  public Core.Sequential sequential(List<? extends Core.SubExp> accumulators) {
    return new Core.Sequential(ImmutableList.copyOf(accumulators));
  }

  public Core.Parallel parallel(Core.Commutativity commutativity,
      Core.Lambda reduceLambda, List<? extends Core.SubExp> accumulators) {
    return new Core.Parallel(commutativity, reduceLambda,
        ImmutableList.copyOf(accumulators));
  }

  public Core.Stream stream(Core.Certificates certificates, Core.SubExp width,
      Core.StreamForm form, Core.Lambda lambda, List<Core.Var> arrays) {
    return new Core.Stream(certificates, width, form, lambda,
        ImmutableList.copyOf(arrays));
  }

  // kernel constructs

  public Core.GroupStreamLambda groupStreamLambda(Core.Param chunkSize,
      Core.Param chunkOffset, List<Core.Param> accParams,
      List<Core.Param> arrParams, Core.Body body) {
    return new Core.GroupStreamLambda(chunkSize, chunkOffset,
        ImmutableList.copyOf(accParams), ImmutableList.copyOf(arrParams),
        body);
  }

  public Core.GroupStream groupStream(Core.SubExp width, Core.SubExp maxChunk,
      Core.GroupStreamLambda lambda, List<? extends Core.SubExp> accumulators,
      List<Core.Var> arrays) {
    return new Core.GroupStream(width, maxChunk, lambda,
        ImmutableList.copyOf(accumulators), ImmutableList.copyOf(arrays));
  }
}

// End CoreBuilder.java
