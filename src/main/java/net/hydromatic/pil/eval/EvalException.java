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

import static java.util.Objects.requireNonNull;

/** Exception thrown when evaluation fails with an {@link EvalError}. */
public class EvalException extends RuntimeException {
  public final EvalError error;

  public EvalException(EvalError error) {
    super(error.message());
    this.error = requireNonNull(error);
  }

  /** Returns whether the error should abort the whole generation. */
  public boolean isFatal() {
    return error.isFatal();
  }
}

// End EvalException.java
