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

/** Sub-types of {@link CoreNode}. */
public enum Op {
  // atoms
  VAR(Category.ATOM),
  CONSTANT(Category.ATOM),
  EXT(Category.ATOM),
  PARAM(Category.ATOM),

  // slices and bindings
  DIM_FIX(Category.MISC),
  DIM_SLICE(Category.MISC),
  BIND_VAR(Category.MISC),
  BIND_IN_PLACE(Category.MISC),
  PAT_ELEM(Category.MISC),
  PATTERN(Category.MISC),
  STM(Category.MISC),
  BODY(Category.MISC),
  LAMBDA(Category.MISC),
  MERGE(Category.MISC),
  FOR_LOOP(Category.MISC),
  WHILE_LOOP(Category.MISC),
  SEQUENTIAL(Category.MISC),
  PARALLEL(Category.MISC),
  GROUP_STREAM_LAMBDA(Category.MISC),

  // basic operations
  SUB_EXP(Category.BASIC),
  COPY(Category.BASIC),
  INDEX(Category.BASIC),
  SCRATCH(Category.BASIC),
  BIN_OP(Category.BASIC),
  CMP_OP(Category.BASIC),
  IOTA(Category.BASIC),
  REPLICATE(Category.BASIC),

  // control flow
  IF(Category.CONTROL),
  DO_LOOP(Category.CONTROL),

  // second-order array combinators; occur only before sequentialization
  MAP(Category.SOAC),
  REDOMAP(Category.SOAC),
  SCAN(Category.SOAC),
  FILTER(Category.SOAC),
  STREAM(Category.SOAC),

  /** Chunked sequential loop; occurs only after sequentialization. */
  GROUP_STREAM(Category.KERNEL);

  public final Category category;

  Op(Category category) {
    this.category = category;
  }

  /** Returns whether this is a combinator, which must not survive
   * sequentialization. */
  public boolean isSoac() {
    return category == Category.SOAC;
  }

  /** Returns whether this is an expression that binds a pattern. */
  public boolean isExp() {
    return category == Category.BASIC
        || category == Category.CONTROL
        || category == Category.SOAC
        || category == Category.KERNEL;
  }

  /** Broad classification of an {@link Op}. */
  public enum Category {
    ATOM, MISC, BASIC, CONTROL, SOAC, KERNEL
  }
}

// End Op.java
