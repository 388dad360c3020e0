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

import net.hydromatic.kernelise.ast.Core;

/** Called on various events during sequentialization. */
public interface Tracer {
  /** Called when a statement is rewritten by one of the special-case
   * rules. */
  void onRewrite(Sequentializer.Rule rule, Core.Stm stm);

  /** Called when a statement has no special case and is handed to the
   * fallback. */
  void onFallback(Core.Stm stm);

  /** Called with each top-level body after it has been sequentialized. */
  void onBody(Core.Body body);
}

// End Tracer.java
