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

/** Visits IR trees.
 *
 * <p>The default implementation of each method visits the node's children in
 * evaluation order: for a statement, the expression before the pattern, so
 * that a sub-class sees uses before the definitions that they reach. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends CoreNode> void accept(E e) {
    e.accept(this);
  }

  // atoms

  protected void visit(Core.Param param) {
    param.type.shape().forEach(this::accept);
  }

  protected void visit(Core.Var var) {}

  protected void visit(Core.Constant constant) {}

  protected void visit(Core.Ext ext) {}

  // slices and patterns

  protected void visit(Core.DimFix dimFix) {
    dimFix.i.accept(this);
  }

  protected void visit(Core.DimSlice dimSlice) {
    dimSlice.offset.accept(this);
    dimSlice.num.accept(this);
    dimSlice.stride.accept(this);
  }

  protected void visit(Core.BindVar bindVar) {}

  protected void visit(Core.BindInPlace bindInPlace) {
    bindInPlace.source.accept(this);
    bindInPlace.slice.forEach(this::accept);
  }

  protected void visit(Core.PatElem patElem) {
    patElem.bindage.accept(this);
    patElem.param.accept(this);
  }

  protected void visit(Core.Pattern pattern) {
    pattern.elements.forEach(this::accept);
  }

  // statements

  protected void visit(Core.Stm stm) {
    stm.exp.accept(this);
    stm.pattern.accept(this);
  }

  protected void visit(Core.Body body) {
    body.stms.forEach(this::accept);
    body.result.forEach(this::accept);
  }

  protected void visit(Core.Lambda lambda) {
    lambda.params.forEach(this::accept);
    lambda.body.accept(this);
  }

  // basic operations

  protected void visit(Core.SubExpOp subExpOp) {
    subExpOp.subExp.accept(this);
  }

  protected void visit(Core.Copy copy) {
    copy.array.accept(this);
  }

  protected void visit(Core.Index index) {
    index.array.accept(this);
    index.slice.forEach(this::accept);
  }

  protected void visit(Core.Scratch scratch) {
    scratch.dims.forEach(this::accept);
  }

  protected void visit(Core.BinOp binOp) {
    binOp.x.accept(this);
    binOp.y.accept(this);
  }

  protected void visit(Core.CmpOp cmpOp) {
    cmpOp.x.accept(this);
    cmpOp.y.accept(this);
  }

  protected void visit(Core.Iota iota) {
    iota.n.accept(this);
  }

  protected void visit(Core.Replicate replicate) {
    replicate.n.accept(this);
    replicate.value.accept(this);
  }

  // control flow

  protected void visit(Core.If anIf) {
    anIf.condition.accept(this);
    anIf.ifTrue.accept(this);
    anIf.ifFalse.accept(this);
  }

  protected void visit(Core.Merge merge) {
    merge.init.accept(this);
    merge.param.accept(this);
  }

  protected void visit(Core.ForLoop forLoop) {
    forLoop.bound.accept(this);
    forLoop.i.accept(this);
  }

  protected void visit(Core.WhileLoop whileLoop) {}

  protected void visit(Core.DoLoop doLoop) {
    doLoop.merge.forEach(this::accept);
    doLoop.form.accept(this);
    doLoop.body.accept(this);
  }

  // combinators

  protected void visitSoac(Core.Soac soac) {
    soac.width.accept(this);
    soac.arrays.forEach(this::accept);
  }

  protected void visit(Core.Map map) {
    visitSoac(map);
    map.lambda.accept(this);
  }

  protected void visit(Core.Redomap redomap) {
    visitSoac(redomap);
    redomap.neutral.forEach(this::accept);
    redomap.reduceLambda.accept(this);
    redomap.foldLambda.accept(this);
  }

  protected void visit(Core.Scan scan) {
    visitSoac(scan);
    scan.neutral.forEach(this::accept);
    scan.lambda.accept(this);
  }

  protected void visit(Core.Filter filter) {
    visitSoac(filter);
    filter.lambda.accept(this);
  }

  protected void visit(Core.Sequential sequential) {
    sequential.accumulators.forEach(this::accept);
  }

  protected void visit(Core.Parallel parallel) {
    parallel.accumulators.forEach(this::accept);
    parallel.reduceLambda.accept(this);
  }

  protected void visit(Core.Stream stream) {
    visitSoac(stream);
    stream.form.accept(this);
    stream.lambda.accept(this);
  }

  // kernel constructs

  protected void visit(Core.GroupStreamLambda lambda) {
    lambda.chunkSize.accept(this);
    lambda.chunkOffset.accept(this);
    lambda.accParams.forEach(this::accept);
    lambda.arrParams.forEach(this::accept);
    lambda.body.accept(this);
  }

  protected void visit(Core.GroupStream groupStream) {
    groupStream.width.accept(this);
    groupStream.maxChunk.accept(this);
    groupStream.accumulators.forEach(this::accept);
    groupStream.arrays.forEach(this::accept);
    groupStream.lambda.accept(this);
  }
}

// End Visitor.java
