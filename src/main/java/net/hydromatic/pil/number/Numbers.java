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
package net.hydromatic.pil.number;

import static com.google.common.base.Preconditions.checkArgument;

import java.math.BigInteger;

/**
 * Utilities for arbitrary-precision numbers and degrees.
 *
 * <p>Numbers are computed with arbitrary precision ({@link BigInteger}) and
 * converted to a {@link FieldElement} once column values are generated.
 * Degrees and indices into columns are {@code long}.
 */
public class Numbers {
  private Numbers() {}

  /** Converts a non-negative number to a degree. */
  public static long abstractToDegree(BigInteger input) {
    checkArgument(input.signum() >= 0, "negative degree %s", input);
    checkArgument(input.bitLength() < Long.SIZE, "degree too large: %s",
        input);
    return input.longValueExact();
  }

  public static boolean isZero(BigInteger x) {
    return x.signum() == 0;
  }

  /** Returns whether a degree is a power of two. */
  public static boolean isPowerOfTwo(long degree) {
    return degree > 0 && (degree & (degree - 1)) == 0;
  }
}

// End Numbers.java
