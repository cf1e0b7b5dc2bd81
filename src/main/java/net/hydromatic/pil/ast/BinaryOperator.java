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
package net.hydromatic.pil.ast;

/** Binary operators, with their precedence. */
public enum BinaryOperator {
  ADD(" + ", 8),
  SUB(" - ", 8),
  MUL(" * ", 9),
  DIV(" / ", 9),
  MOD(" % ", 9),
  POW(" ** ", 10, false),
  BINARY_AND(" & ", 6),
  BINARY_XOR(" ^ ", 5),
  BINARY_OR(" | ", 4),
  SHL(" << ", 7),
  SHR(" >> ", 7),
  LOGICAL_AND(" && ", 2),
  LOGICAL_OR(" || ", 1),
  LESS(" < ", 3),
  LESS_EQUAL(" <= ", 3),
  EQUAL(" == ", 3),
  NOT_EQUAL(" != ", 3),
  GREATER_EQUAL(" >= ", 3),
  GREATER(" > ", 3);

  /** Padded name, e.g. " + ". */
  public final String padded;
  /** Left precedence. */
  public final int left;
  /** Right precedence. */
  public final int right;

  BinaryOperator(String padded, int precedence) {
    this(padded, precedence, true);
  }

  BinaryOperator(String padded, int precedence, boolean leftAssociative) {
    this.padded = padded;
    this.left = precedence * 2 + (leftAssociative ? 0 : 1);
    this.right = precedence * 2 + (leftAssociative ? 1 : 0);
  }

  /** Returns whether this operator compares its operands and yields 0 or
   * 1. */
  public boolean isComparison() {
    switch (this) {
    case LESS:
    case LESS_EQUAL:
    case EQUAL:
    case NOT_EQUAL:
    case GREATER_EQUAL:
    case GREATER:
      return true;
    default:
      return false;
    }
  }
}

// End BinaryOperator.java
