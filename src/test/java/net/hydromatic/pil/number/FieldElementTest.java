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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigInteger;
import org.junit.jupiter.api.Test;

/** Tests {@link FieldElement} and {@link Numbers}. */
public class FieldElementTest {
  /** Tests that values are reduced modulo the prime, and that negative
   * values wrap around. */
  @Test void testOf() {
    assertThat(FieldElement.MODULUS,
        hasToString("18446744069414584321"));
    assertThat(FieldElement.BITS, is(64));
    assertThat(FieldElement.of(-1), hasToString("18446744069414584320"));
    assertThat(FieldElement.of(FieldElement.MODULUS), is(FieldElement.ZERO));
    assertThat(FieldElement.of(FieldElement.MODULUS.add(BigInteger.ONE)),
        is(FieldElement.ONE));
    assertThat(FieldElement.of(7).isZero(), is(false));
    assertThat(FieldElement.of(0).isZero(), is(true));
  }

  @Test void testArithmetic() {
    final FieldElement three = FieldElement.of(3);
    final FieldElement five = FieldElement.of(5);
    assertThat(three.plus(five), is(FieldElement.of(8)));
    assertThat(three.minus(five), is(FieldElement.of(-2)));
    assertThat(three.times(five), is(FieldElement.of(15)));
    assertThat(three.negate().plus(three), is(FieldElement.ZERO));
    assertThat(five.divide(three).times(three), is(five));
    assertThat(FieldElement.of(2).pow(BigInteger.TEN),
        is(FieldElement.of(1024)));
    assertThat(FieldElement.of(-1).times(FieldElement.of(-1)),
        is(FieldElement.ONE));
  }

  /** Tests that division by zero throws. */
  @Test void testInverseOfZero() {
    final ArithmeticException e =
        assertThrows(ArithmeticException.class,
            () -> FieldElement.ZERO.inverse());
    assertThat(e.getMessage(), is("division by zero"));
  }

  @Test void testPowerOfTwo() {
    assertThat(FieldElement.of(1).isPowerOfTwo(), is(true));
    assertThat(FieldElement.of(64).isPowerOfTwo(), is(true));
    assertThat(FieldElement.of(6).isPowerOfTwo(), is(false));
    assertThat(FieldElement.ZERO.isPowerOfTwo(), is(false));
    assertThat(FieldElement.of(-1).isPowerOfTwo(), is(false));
  }

  /** Tests conversion to a degree, and that large values are rejected. */
  @Test void testToDegree() {
    assertThat(FieldElement.of(1024).toDegree(), is(1024L));
    assertThrows(IllegalArgumentException.class,
        () -> FieldElement.of(-1).toDegree());
    assertThat(Numbers.isPowerOfTwo(1024), is(true));
    assertThat(Numbers.isPowerOfTwo(1000), is(false));
  }

  @Test void testCompare() {
    assertThat(FieldElement.of(2).compareTo(FieldElement.of(3)) < 0,
        is(true));
    assertThat(FieldElement.of(-1).compareTo(FieldElement.of(3)) > 0,
        is(true));
  }
}

// End FieldElementTest.java
