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

import static com.google.common.base.Preconditions.checkArgument;

import net.hydromatic.kernelise.ast.Name;

/**
 * Generates unique names.
 *
 * <p>One generator is shared, by handle, by every pass that runs over a
 * compilation unit. It never hands out the same discriminator twice. Tests
 * create their own generator so that the naming sequence is fixed.
 */
public class NameGenerator {
  private int id;

  /** Creates a NameGenerator whose first discriminator is 0. */
  public NameGenerator() {
    this(0);
  }

  /** Creates a NameGenerator whose first discriminator is {@code start}. */
  public NameGenerator(int start) {
    checkArgument(start >= 0, "negative start %s", start);
    this.id = start;
  }

  /** Generates a name with a given base that is unique in this program. */
  public Name fresh(String base) {
    return new Name(base, id++);
  }

  /** Generates a new name with the same base as an existing name. */
  public Name freshLike(Name name) {
    return fresh(name.base);
  }

  /** Returns the discriminator that the next call to {@link #fresh} will
   * use. */
  public int peek() {
    return id;
  }
}

// End NameGenerator.java
