/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.suppierk.ledger.domain;

import java.io.Serializable;
import java.math.BigDecimal;

/**
 * Exact monetary quantity stored as a whole number of minor units (e.g. cents).
 *
 * <p>All arithmetic is performed on {@code long}s with overflow detection, hence there is no
 * rounding drift. Conversion from decimal representations is exact as well: values with more
 * fractional digits than {@link #SCALE} are rejected rather than rounded.
 *
 * @param minorUnits amount of minor units, may be negative
 */
public record Money(long minorUnits) implements Comparable<Money>, Serializable {
  /** Number of fractional digits in a major unit. */
  public static final int SCALE = 2;

  public static final Money ZERO = new Money(0L);

  /**
   * @param minorUnits amount of minor units
   * @return a new instance of {@link Money}
   */
  public static Money ofMinorUnits(final long minorUnits) {
    return new Money(minorUnits);
  }

  /**
   * @param amount in major units, e.g. {@code 12.34}
   * @return a new instance of {@link Money}
   * @throws IllegalArgumentException if amount is {@code null}
   * @throws ArithmeticException if amount has more than {@link #SCALE} fractional digits or does
   *     not fit into {@code long}
   */
  public static Money of(final BigDecimal amount) {
    if (amount == null) {
      throw new IllegalArgumentException("Amount cannot be null");
    }

    return new Money(amount.movePointRight(SCALE).longValueExact());
  }

  /**
   * @param amount in major units, e.g. {@code "12.34"}
   * @return a new instance of {@link Money}
   * @see #of(BigDecimal)
   */
  public static Money of(final String amount) {
    if (amount == null) {
      throw new IllegalArgumentException("Amount cannot be null");
    }

    return of(new BigDecimal(amount));
  }

  /**
   * @param other to add
   * @return the sum of both amounts
   * @throws ArithmeticException on overflow
   */
  public Money plus(final Money other) {
    return new Money(Math.addExact(minorUnits, other.minorUnits));
  }

  /**
   * @param other to subtract
   * @return the difference of both amounts
   * @throws ArithmeticException on overflow
   */
  public Money minus(final Money other) {
    return new Money(Math.subtractExact(minorUnits, other.minorUnits));
  }

  public boolean isPositive() {
    return minorUnits > 0L;
  }

  public boolean isNegative() {
    return minorUnits < 0L;
  }

  /**
   * @return this amount in major units with {@link #SCALE} fractional digits
   */
  public BigDecimal toBigDecimal() {
    return BigDecimal.valueOf(minorUnits, SCALE);
  }

  /** {@inheritDoc} */
  @Override
  public int compareTo(final Money other) {
    return Long.compare(minorUnits, other.minorUnits);
  }

  /**
   * @return plain decimal representation, e.g. {@code 12.34}
   */
  @Override
  public String toString() {
    return toBigDecimal().toPlainString();
  }
}
