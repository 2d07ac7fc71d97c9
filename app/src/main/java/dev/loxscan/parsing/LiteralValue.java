package dev.loxscan.parsing;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;

// The value carried by STRING and NUMBER tokens: either the text between the
// quotes or a double. Other tokens carry no literal at all (null).
public final class LiteralValue {
  private final String text;
  private final double number;

  private LiteralValue(String text, double number) {
    this.text = text;
    this.number = number;
  }

  public static LiteralValue text(String text) {
    return new LiteralValue(Objects.requireNonNull(text), 0.0);
  }

  public static LiteralValue number(double number) {
    return new LiteralValue(/* text: */ null, number);
  }

  public boolean isText() { return text != null; }

  public boolean isNumber() { return text == null; }

  public String asText() {
    if (!isText())
      throw new IllegalStateException("not a text literal: " + this);
    return text;
  }

  public double asNumber() {
    if (!isNumber())
      throw new IllegalStateException("not a number literal: " + this);
    return number;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other)
      return true;
    if (!(other instanceof LiteralValue))
      return false;
    LiteralValue that = (LiteralValue)other;
    if (isText())
      return text.equals(that.text);
    return that.isNumber() &&
        Double.compare(number, that.number) == 0;
  }

  @Override
  public int hashCode() {
    return isText() ? text.hashCode() : Double.hashCode(number);
  }

  @Override
  public String toString() {
    return isText() ? text : formatNumber(number);
  }

  // Renders `value` in plain decimal form: integral values lose the
  // trailing ".0" (123.0 -> "123") and exponents are never used. The digits
  // are the fewest that still parse back to `value` (1e23 -> "1000...0", not
  // the "9999...9" Double.toString gives before JDK 19).
  static String formatNumber(double value) {
    if (Double.isNaN(value))
      return "NaN";
    if (Double.isInfinite(value))
      return value > 0 ? "inf" : "-inf";
    if (value == 0.0)
      return (1 / value) < 0 ? "-0" : "0";

    BigDecimal exact = new BigDecimal(value);
    BigDecimal shortest = exact;
    // 17 significant digits always round-trip a double
    for (int precision = 1; precision <= 17; precision++) {
      BigDecimal candidate =
          exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
      if (candidate.doubleValue() == value) {
        shortest = candidate;
        break;
      }
    }
    return shortest.stripTrailingZeros().toPlainString();
  }
}
