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
package net.hydromatic.pil.eval;

import net.hydromatic.pil.ast.Identity;

/** Called on various events during witness generation. */
public interface Tracer {
  /** Called with the result of processing an identity on a row. */
  void onIdentity(long row, Identity identity, EvalValue value);

  /** Called with the result of asking the oracle for a column. */
  void onQuery(long row, String column, EvalValue value);

  /** Called after each pass over a row, if property
   * {@link Prop#TRACE_PASSES} is set. */
  void onPass(long row, int pass, boolean progress);

  /** Called when every column of a row is known. */
  void onRowComplete(long row);

  /** Called with an error thrown while processing a row, before it is
   * rethrown or collected. */
  void onError(long row, EvalException e);
}

// End Tracer.java
