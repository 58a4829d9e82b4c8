package com.monthledger.ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Canonical money values: trailing zeros dropped, never a negative scale, so that
 * {@code 850}, {@code 850.00} and {@code 8.5E+2} all serialize as {@code 850}.
 * Values outside the finite double range collapse to zero and fractions are capped at
 * {@value #MAX_SCALE} digits.
 */
public final class Amounts {
  public static final int MAX_SCALE = 10;

  private Amounts() {
  }

  public static BigDecimal canonical(BigDecimal value) {
    if (value == null || value.signum() == 0) {
      return BigDecimal.ZERO;
    }
    if (!Double.isFinite(value.doubleValue())) {
      return BigDecimal.ZERO;
    }
    // magnitude below the last kept fraction digit
    if (value.precision() - value.scale() < -MAX_SCALE) {
      return BigDecimal.ZERO;
    }
    BigDecimal bounded = value.scale() > MAX_SCALE ? value.setScale(MAX_SCALE, RoundingMode.HALF_UP) : value;
    if (bounded.signum() == 0) {
      return BigDecimal.ZERO;
    }
    BigDecimal stripped = bounded.stripTrailingZeros();
    return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
  }
}
