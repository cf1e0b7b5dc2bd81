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

import org.checkerframework.checker.nullness.qual.Nullable;

/** Read-only store of what is known about the bits of columns. */
public interface BitConstraintSet {
  /** Returns the bit constraint of a column, or null if nothing is
   * known. */
  @Nullable BitConstraint bitConstraint(int columnId);
}

// End BitConstraintSet.java
