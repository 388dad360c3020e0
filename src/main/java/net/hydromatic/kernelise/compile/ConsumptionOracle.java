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

import java.util.Set;
import net.hydromatic.kernelise.ast.Core;
import net.hydromatic.kernelise.ast.Name;

/** Reports which parameters of a lambda are consumed; that is, updated in
 * place while the lambda executes. */
public interface ConsumptionOracle {
  /** Returns the names of the parameters of {@code lambda} that are consumed
   * by its body. The result depends only on the lambda. */
  Set<Name> consumedParams(Core.Lambda lambda);
}

// End ConsumptionOracle.java
