package com.flamingo.ai.studyplanner.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Decimal rounding for hour values. */
public final class Rounding {

  private Rounding() {}

  /** Rounds half-up to {@code places} decimals. */
  public static double round(double value, int places) {
    return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
  }
}
