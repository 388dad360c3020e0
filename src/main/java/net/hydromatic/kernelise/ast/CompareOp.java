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

/** Comparison operators. */
public enum CompareOp {
  EQ("=="),
  NE("!="),
  LT("<"),
  LE("<="),
  GT(">"),
  GE(">=");

  public final String symbol;

  CompareOp(String symbol) {
    this.symbol = symbol;
  }

  /** Returns whether a comparison result ({@code Integer.compare}
   * convention) satisfies this operator. */
  public boolean test(int c) {
    switch (this) {
    case EQ:
      return c == 0;
    case NE:
      return c != 0;
    case LT:
      return c < 0;
    case LE:
      return c <= 0;
    case GT:
      return c > 0;
    case GE:
      return c >= 0;
    default:
      throw new AssertionError(this);
    }
  }
}

// End CompareOp.java
