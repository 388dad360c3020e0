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

import static java.util.Objects.requireNonNull;

/** Node of the intermediate representation. */
public abstract class CoreNode {
  public final Op op;

  protected CoreNode(Op op) {
    this.op = requireNonNull(op);
  }

  /**
   * Converts this node into a string.
   *
   * <p>The purpose of this string is debugging and testing. Derived classes
   * should override {@link #unparse(CoreWriter)}, not this method.
   */
  @Override
  public final String toString() {
    return unparse(new CoreWriter()).toString();
  }

  /** Writes this node to a writer. */
  abstract CoreWriter unparse(CoreWriter w);

  /** Accepts a visitor, calling the {@link Visitor#visit} method appropriate
   * to the type of this node. */
  public abstract void accept(Visitor visitor);
}

// End CoreNode.java
