/*
 * Copyright © 2022,2023 James Crawford
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
 *
 */

package io.jslex;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Conversions between numeric literal text and double values.
 *
 * <p>{@link #doubleToString(double)} renders a double the way ECMAScript's
 * Number::toString does: the shortest sequence of decimal digits that reads back
 * as the same double, in plain notation for decimal exponents in the range
 * [-6, 21) and in exponential notation otherwise.</p>
 */
public final class NumberConversions {
  private static final int MAX_SIGNIFICANT_DIGITS = 17;

  private NumberConversions() {}

  /**
   * Parse numeric literal text. Accepts decimal literals (with optional fraction and
   * exponent), hex ({@code 0x}), octal ({@code 0o}), binary ({@code 0b}) and legacy
   * implicit octal literals ({@code 017}).
   * @param literal  the literal text
   * @return the value or NaN if the text is not a numeric literal
   */
  public static double stringToDouble(CharSequence literal) {
    String text = literal.toString();
    if (text.isEmpty()) {
      return Double.NaN;
    }
    if (text.length() > 1 && text.charAt(0) == '0') {
      switch (text.charAt(1)) {
        case 'x': case 'X': return parseRadix(text.substring(2), 16);
        case 'o': case 'O': return parseRadix(text.substring(2), 8);
        case 'b': case 'B': return parseRadix(text.substring(2), 2);
      }
      if (isImplicitOctal(text)) {
        return parseRadix(text.substring(1), 8);
      }
    }
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      // Double.parseDouble() also accepts things like "NaN", "0x1p3" and "1d" which are not literals
      if (!(CharPredicates.isDecimalDigit(c) || c == '.' || c == 'e' || c == 'E' || c == '+' || c == '-')) {
        return Double.NaN;
      }
    }
    try {
      return Double.parseDouble(text);
    }
    catch (NumberFormatException e) {
      return Double.NaN;
    }
  }

  /**
   * Render a double as its canonical ECMAScript string.
   * @param value  the value
   * @return the canonical string
   */
  public static String doubleToString(double value) {
    if (Double.isNaN(value)) {
      return "NaN";
    }
    if (value == 0) {
      return "0";                // Includes -0
    }
    if (value < 0) {
      return "-" + doubleToString(-value);
    }
    if (Double.isInfinite(value)) {
      return "Infinity";
    }

    BigDecimal shortest = shortestRepresentation(value);
    String     digits   = shortest.unscaledValue().toString();
    int        k        = digits.length();
    int        n        = k - shortest.scale();    // Position of decimal point relative to digits

    StringBuilder sb = new StringBuilder();
    if (k <= n && n <= 21) {
      sb.append(digits);
      sb.append("0".repeat(n - k));
    }
    else
    if (0 < n && n <= 21) {
      sb.append(digits, 0, n).append('.').append(digits, n, k);
    }
    else
    if (-6 < n && n <= 0) {
      sb.append("0.").append("0".repeat(-n)).append(digits);
    }
    else {
      int exponent = n - 1;
      sb.append(digits.charAt(0));
      if (k > 1) {
        sb.append('.').append(digits, 1, k);
      }
      sb.append('e').append(exponent < 0 ? '-' : '+').append(Math.abs(exponent));
    }
    return sb.toString();
  }

  /**
   * Find the fewest significant digits that still read back as the same double.
   * Rounding the exact binary value half-even at each precision gives the closest
   * candidate for that number of digits.
   */
  private static BigDecimal shortestRepresentation(double value) {
    BigDecimal exact = new BigDecimal(value);
    for (int precision = 1; precision < MAX_SIGNIFICANT_DIGITS; precision++) {
      BigDecimal rounded = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
      if (rounded.doubleValue() == value) {
        return rounded.stripTrailingZeros();
      }
    }
    return exact.round(new MathContext(MAX_SIGNIFICANT_DIGITS, RoundingMode.HALF_EVEN)).stripTrailingZeros();
  }

  private static boolean isImplicitOctal(String text) {
    for (int i = 1; i < text.length(); i++) {
      if (!CharPredicates.isOctalDigit(text.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  private static double parseRadix(String digits, int radix) {
    if (digits.isEmpty()) {
      return Double.NaN;
    }
    try {
      if (digits.length() <= 12) {
        return Long.parseLong(digits, radix);
      }
      // BigInteger.doubleValue() rounds to nearest so long literals still give the correct double
      return new BigInteger(digits, radix).doubleValue();
    }
    catch (NumberFormatException e) {
      return Double.NaN;
    }
  }
}
