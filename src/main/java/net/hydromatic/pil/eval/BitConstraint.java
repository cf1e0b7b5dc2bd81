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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.math.BigInteger;
import net.hydromatic.pil.number.FieldElement;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Knowledge about the bits of a value: only the bits in {@link #mask()} may
 * be set.
 *
 * <p>For example, a boolean column has constraint {@code 0x1}, and a byte
 * column {@code 0xff}.
 */
public final class BitConstraint {
  private final BigInteger mask;

  private BitConstraint(BigInteger mask) {
    this.mask = requireNonNull(mask);
    checkArgument(mask.signum() >= 0, "negative mask %s", mask);
  }

  /** Creates a constraint that allows bits 0 to {@code maxBit},
   * inclusive. */
  public static BitConstraint fromMaxBit(int maxBit) {
    checkArgument(maxBit >= 0 && maxBit < FieldElement.BITS,
        "bit out of range: %s", maxBit);
    return fromMask(
        BigInteger.ONE.shiftLeft(maxBit + 1).subtract(BigInteger.ONE));
  }

  public static BitConstraint fromMask(BigInteger mask) {
    return new BitConstraint(mask);
  }

  public static BitConstraint fromMask(long mask) {
    return fromMask(BigInteger.valueOf(mask));
  }

  /** Creates a constraint that allows exactly the bits set in a value. */
  public static BitConstraint fromValue(FieldElement value) {
    return fromMask(value.toBigInteger());
  }

  public BigInteger mask() {
    return mask;
  }

  /** Returns the constraint on {@code factor * x}, where {@code x} satisfies
   * this constraint, or null if that cannot be expressed.
   *
   * <p>It can be expressed if the factor is a power of two and the shifted
   * mask still fits in a field element without wrapping. */
  public @Nullable BitConstraint multiple(FieldElement factor) {
    if (!factor.isPowerOfTwo()) {
      return null;
    }
    final BigInteger shifted =
        mask.shiftLeft(factor.toBigInteger().getLowestSetBit());
    if (shifted.compareTo(FieldElement.MODULUS) >= 0) {
      return null;
    }
    return new BitConstraint(shifted);
  }

  /** Returns the constraint that holds if both this and another hold. */
  public BitConstraint conjunction(BitConstraint other) {
    return new BitConstraint(mask.and(other.mask));
  }

  /** Returns the constraint that allows the bits of either constraint. */
  public BitConstraint disjunction(BitConstraint other) {
    return new BitConstraint(mask.or(other.mask));
  }

  /** Returns whether no bit may be set in both this and another
   * constraint. */
  public boolean isDisjoint(BitConstraint other) {
    return mask.and(other.mask).signum() == 0;
  }

  @Override
  public int hashCode() {
    return mask.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof BitConstraint && mask.equals(((BitConstraint) o).mask);
  }

  @Override
  public String toString() {
    return "0x" + mask.toString(16);
  }
}

// End BitConstraint.java
