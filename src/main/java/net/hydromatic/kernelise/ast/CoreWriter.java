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

import java.util.List;

/** Context for writing an IR node out as a string. */
public class CoreWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public CoreWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends an object (such as a {@link Name} or a type) to the output. */
  public CoreWriter append(Object o) {
    b.append(o);
    return this;
  }

  /** Appends a node to the output. */
  public CoreWriter append(CoreNode node) {
    return node.unparse(this);
  }

  /** Appends a list of nodes or objects, separated by commas and enclosed in
   * {@code open} and {@code close}. */
  public CoreWriter list(String open, List<?> list, String close) {
    append(open);
    for (int i = 0; i < list.size(); i++) {
      if (i > 0) {
        append(", ");
      }
      final Object o = list.get(i);
      if (o instanceof CoreNode) {
        append((CoreNode) o);
      } else {
        append(o);
      }
    }
    return append(close);
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End CoreWriter.java
