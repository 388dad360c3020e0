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

import net.hydromatic.kernelise.ast.CoreNode;

/**
 * Internal compiler error.
 *
 * <p>Thrown when the input to a pass violates a precondition that earlier
 * passes are supposed to guarantee, for example when a combinator claims more
 * accumulators than its lambda has parameters. The compilation cannot
 * continue.
 */
public class CompileException extends RuntimeException {
  private final CoreNode node;

  public CompileException(String message, CoreNode node) {
    super(message);
    this.node = requireNonNull(node);
  }

  /** Returns the statement (or other node) that caused the error. */
  public CoreNode node() {
    return node;
  }

  @Override
  public String toString() {
    return super.toString() + " in " + node;
  }

  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Internal error: ")
        .append(getMessage())
        .append(" in ")
        .append(node);
  }
}

// End CompileException.java
