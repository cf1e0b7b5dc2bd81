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
import static java.util.Objects.requireNonNull;

import java.math.BigInteger;

/**
 * Element of the prime field in which column values live.
 *
 * <p>The modulus is the "Goldilocks" prime, 2<sup>64</sup> - 2<sup>32</sup>
 * + 1. Values are held in canonical form, {@code 0 <= value < MODULUS}.
 */
public final class FieldElement implements Comparable<FieldElement> {
  /** The field modulus. */
  public static final BigInteger MODULUS =
      BigInteger.ONE
          .shiftLeft(64)
          .subtract(BigInteger.ONE.shiftLeft(32))
          .add(BigInteger.ONE);

  /** Number of bits needed to represent any element. */
  public static final int BITS = MODULUS.bitLength();

  public static final FieldElement ZERO = new FieldElement(BigInteger.ZERO);
  public static final FieldElement ONE = new FieldElement(BigInteger.ONE);

  private final BigInteger value;

  private FieldElement(BigInteger value) {
    this.value = requireNonNull(value);
  }

  /** Creates a field element from an integer, reducing it modulo the
   * prime; negative values wrap around. */
  public static FieldElement of(BigInteger value) {
    final BigInteger v = value.mod(MODULUS);
    if (v.signum() == 0) {
      return ZERO;
    }
    if (v.equals(BigInteger.ONE)) {
      return ONE;
    }
    return new FieldElement(v);
  }

  /** Creates a field element from a {@code long}. */
  public static FieldElement of(long value) {
    return of(BigInteger.valueOf(value));
  }

  /** Returns the canonical integer representative. */
  public BigInteger toBigInteger() {
    return value;
  }

  /** Returns the value as a row index or degree.
   *
   * @throws IllegalArgumentException if it does not fit in a {@code long} */
  public long toDegree() {
    return Numbers.abstractToDegree(value);
  }

  public boolean isZero() {
    return value.signum() == 0;
  }

  public boolean isOne() {
    return value.equals(BigInteger.ONE);
  }

  /** Returns whether the canonical value is a power of two. */
  public boolean isPowerOfTwo() {
    return value.signum() > 0 && value.bitCount() == 1;
  }

  public FieldElement plus(FieldElement o) {
    return of(value.add(o.value));
  }

  public FieldElement minus(FieldElement o) {
    return of(value.subtract(o.value));
  }

  public FieldElement times(FieldElement o) {
    return of(value.multiply(o.value));
  }

  public FieldElement negate() {
    return of(value.negate());
  }

  /** Returns the multiplicative inverse.
   *
   * @throws ArithmeticException if this is zero */
  public FieldElement inverse() {
    if (isZero()) {
      throw new ArithmeticException("division by zero");
    }
    return of(value.modInverse(MODULUS));
  }

  public FieldElement divide(FieldElement o) {
    return times(o.inverse());
  }

  /** Raises this element to a non-negative integer power. */
  public FieldElement pow(BigInteger exponent) {
    checkArgument(exponent.signum() >= 0, "negative exponent %s", exponent);
    return of(value.modPow(exponent, MODULUS));
  }

  @Override
  public int compareTo(FieldElement o) {
    return value.compareTo(o.value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof FieldElement && value.equals(((FieldElement) o).value);
  }

  @Override
  public String toString() {
    return value.toString();
  }
}

// End FieldElement.java
