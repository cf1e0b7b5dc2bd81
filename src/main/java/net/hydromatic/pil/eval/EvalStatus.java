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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Whether an evaluation resolved everything it could, or why not. */
public final class EvalStatus {
  public static final EvalStatus COMPLETE = new EvalStatus(null);

  private final @Nullable IncompleteCause cause;

  private EvalStatus(@Nullable IncompleteCause cause) {
    this.cause = cause;
  }

  public static EvalStatus incomplete(IncompleteCause cause) {
    return new EvalStatus(requireNonNull(cause));
  }

  public boolean isComplete() {
    return cause == null;
  }

  /** Returns the cause of an incomplete status. */
  public IncompleteCause cause() {
    checkState(cause != null, "status is complete");
    return cause;
  }

  /** Combines two statuses. The result is complete only if both are;
   * otherwise it carries the causes of every incomplete input. */
  public EvalStatus combine(EvalStatus other) {
    if (cause == null) {
      return other;
    }
    if (other.cause == null) {
      return this;
    }
    return incomplete(cause.combine(other.cause));
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(cause);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof EvalStatus
            && Objects.equals(cause, ((EvalStatus) o).cause);
  }

  @Override
  public String toString() {
    return cause == null ? "Complete" : "Incomplete(" + cause + ")";
  }
}

// End EvalStatus.java
