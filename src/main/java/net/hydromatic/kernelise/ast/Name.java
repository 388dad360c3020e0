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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.Ordering;

/**
 * Globally unique variable name.
 *
 * <p>A name consists of a readable base (such as "acc" or "chunk_size") and an
 * integer discriminator allocated by a {@link
 * net.hydromatic.kernelise.compile.NameGenerator}. Two names are equal if and
 * only if their discriminators are equal; the base is for humans only.
 */
public final class Name implements Comparable<Name> {
  /** Ordering that compares names by their discriminator. */
  public static final Ordering<Name> ORDERING = Ordering.natural();

  public final String base;
  public final int tag;

  /** Creates a Name. Call {@code NameGenerator.fresh} rather than this. */
  public Name(String base, int tag) {
    this.base = requireNonNull(base, "base");
    this.tag = tag;
    checkArgument(!base.isEmpty(), "empty name");
    checkArgument(tag >= 0, "negative tag %s", tag);
  }

  @Override
  public int hashCode() {
    return Integer.hashCode(tag);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this || obj instanceof Name && ((Name) obj).tag == tag;
  }

  @Override
  public int compareTo(Name o) {
    return Integer.compare(tag, o.tag);
  }

  @Override
  public String toString() {
    return base + "_" + tag;
  }
}

// End Name.java
