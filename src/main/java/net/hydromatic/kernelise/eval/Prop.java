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
package net.hydromatic.kernelise.eval;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property.
 *
 * <p>Values are held in a {@code Map<Prop, Object>} that the caller passes to
 * {@link net.hydromatic.kernelise.compile.Sequentializer} and
 * {@link Evaluator}; a property that is absent from the map has its default
 * value.
 */
public enum Prop {
  /**
   * Integer property "chunkSize" is the number of elements that the evaluator
   * processes per iteration of a grouped stream whose granularity is chosen by
   * the backend. A grouped stream whose maximum chunk is 1 always uses 1.
   * Default is 1.
   */
  CHUNK_SIZE("chunkSize", Integer.class, 1),

  /**
   * Boolean property "traceFallback" controls whether the tracer is told
   * about each statement that has no special case and is lowered by the
   * fallback. Default is true.
   */
  TRACE_FALLBACK("traceFallback", Boolean.class, true),

  /**
   * Boolean property "validate" controls whether the output of
   * sequentialization is checked: that statements are in dependency order,
   * and that no combinator remains. Default is true.
   */
  VALIDATE("validate", Boolean.class, true);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    Object o = map.get(this);
    return this.<Boolean>typeValue(o);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    Object o = map.get(this);
    return this.<Integer>typeValue(o);
  }

  /**
   * Returns a value read from a map, or the default if the map has none.
   * Throws if the value is not of this property's type.
   */
  @SuppressWarnings("unchecked")
  private <T> T typeValue(@Nullable Object o) {
    if (o == null) {
      return (T) defaultValue;
    }
    checkArgument(type.isInstance(o),
        "value %s for property %s must have type %s", o, camelName, type);
    return (T) o;
  }
}

// End Prop.java
