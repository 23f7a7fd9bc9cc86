package com.trending.tracker.crawl.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Turns the counters rendered on the trending page ({@code "1,234"}, {@code "2.3k"}) into integers.
 * Anything that cannot be read as a non-negative number yields 0.
 */
public final class CountParser {
  private static final BigDecimal THOUSAND = BigDecimal.valueOf(1_000L);
  private static final BigDecimal MILLION = BigDecimal.valueOf(1_000_000L);
  private static final BigDecimal INT_MAX = BigDecimal.valueOf(Integer.MAX_VALUE);

  private CountParser() {}

  public static int parse(String text) {
    if (text == null) {
      return 0;
    }
    String value = text.replace(",", "").trim().toLowerCase(Locale.ROOT);
    if (value.isEmpty()) {
      return 0;
    }
    BigDecimal multiplier = BigDecimal.ONE;
    if (value.endsWith("k")) {
      multiplier = THOUSAND;
      value = value.substring(0, value.length() - 1).trim();
    } else if (value.endsWith("m")) {
      multiplier = MILLION;
      value = value.substring(0, value.length() - 1).trim();
    }
    // Counters never use exponent notation; "1e999999999" would expand into a huge integer.
    if (value.isEmpty() || value.indexOf('e') >= 0) {
      return 0;
    }
    BigDecimal number;
    try {
      number = new BigDecimal(value);
    } catch (NumberFormatException e) {
      return 0;
    }
    BigDecimal scaled = number.multiply(multiplier).setScale(0, RoundingMode.DOWN);
    if (scaled.signum() < 0) {
      return 0;
    }
    if (scaled.compareTo(INT_MAX) > 0) {
      return Integer.MAX_VALUE;
    }
    return scaled.intValue();
  }
}
