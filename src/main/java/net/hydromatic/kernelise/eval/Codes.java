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

import net.hydromatic.kernelise.ast.BinaryOp;
import net.hydromatic.kernelise.ast.CompareOp;

/** Implementations of scalar operators. */
@SuppressWarnings({"rawtypes", "unchecked"})
public abstract class Codes {
  private Codes() {}

  /** Applies a binary operator to two scalars of the same type. Integer
   * division and modulo round towards negative infinity. */
  public static Object binOp(BinaryOp binaryOp, Object x, Object y) {
    if (x instanceof Integer) {
      final int a = (Integer) x;
      final int b = (Integer) y;
      switch (binaryOp) {
      case ADD:
        return a + b;
      case SUB:
        return a - b;
      case MUL:
        return a * b;
      case DIV:
        return Math.floorDiv(a, b);
      case MOD:
        return Math.floorMod(a, b);
      case MIN:
        return Math.min(a, b);
      case MAX:
        return Math.max(a, b);
      default:
        break;
      }
    } else if (x instanceof Long) {
      final long a = (Long) x;
      final long b = (Long) y;
      switch (binaryOp) {
      case ADD:
        return a + b;
      case SUB:
        return a - b;
      case MUL:
        return a * b;
      case DIV:
        return Math.floorDiv(a, b);
      case MOD:
        return Math.floorMod(a, b);
      case MIN:
        return Math.min(a, b);
      case MAX:
        return Math.max(a, b);
      default:
        break;
      }
    } else if (x instanceof Float) {
      final float a = (Float) x;
      final float b = (Float) y;
      switch (binaryOp) {
      case ADD:
        return a + b;
      case SUB:
        return a - b;
      case MUL:
        return a * b;
      case DIV:
        return a / b;
      case MOD:
        return a % b;
      case MIN:
        return Math.min(a, b);
      case MAX:
        return Math.max(a, b);
      default:
        break;
      }
    } else if (x instanceof Double) {
      final double a = (Double) x;
      final double b = (Double) y;
      switch (binaryOp) {
      case ADD:
        return a + b;
      case SUB:
        return a - b;
      case MUL:
        return a * b;
      case DIV:
        return a / b;
      case MOD:
        return a % b;
      case MIN:
        return Math.min(a, b);
      case MAX:
        return Math.max(a, b);
      default:
        break;
      }
    } else if (x instanceof Boolean) {
      switch (binaryOp) {
      case AND:
        return (Boolean) x && (Boolean) y;
      case OR:
        return (Boolean) x || (Boolean) y;
      default:
        break;
      }
    }
    throw new IllegalArgumentException("cannot apply " + binaryOp + " to "
        + x + " and " + y);
  }

  /** Compares two scalars of the same type. */
  public static boolean compare(CompareOp compareOp, Object x, Object y) {
    final int c = ((Comparable) x).compareTo(y);
    return compareOp.test(c);
  }
}

// End Codes.java
