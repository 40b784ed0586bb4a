package com.verlumen.evolution.core;

/** Total-order comparison of fitness values that refuses to order NaN. */
public final class Fitness {
  /**
   * Compares two fitness values. Numerically equal values, including {@code 0.0} and {@code -0.0},
   * compare as equal.
   *
   * @throws NonComparableFitnessException if either value is NaN
   */
  public static int compare(double left, double right) {
    checkComparable(left);
    checkComparable(right);
    return left == right ? 0 : Double.compare(left, right);
  }

  /**
   * Returns {@code value} if it can be ordered against other fitness values.
   *
   * @throws NonComparableFitnessException if {@code value} is NaN
   */
  public static double checkComparable(double value) {
    if (Double.isNaN(value)) {
      throw new NonComparableFitnessException("Fitness value is not comparable: " + value);
    }
    return value;
  }

  private Fitness() {}
}
