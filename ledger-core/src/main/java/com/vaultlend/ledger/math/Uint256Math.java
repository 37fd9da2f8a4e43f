package com.vaultlend.ledger.math;

import java.math.BigInteger;

/**
 * Checked unsigned 256-bit arithmetic over {@link BigInteger}.
 *
 * Every result is range-checked; leaving [0, 2^256-1] raises {@link ArithmeticException}
 * instead of wrapping.
 */
public final class Uint256Math {

  public static final BigInteger MAX = BigInteger.TWO.pow(256).subtract(BigInteger.ONE);

  private Uint256Math() {
  }

  public static boolean inRange(BigInteger value) {
    return value != null && value.signum() >= 0 && value.compareTo(MAX) <= 0;
  }

  public static BigInteger require(BigInteger value) {
    if (value == null) {
      throw new ArithmeticException("uint256 value is null");
    }
    if (value.signum() < 0) {
      throw new ArithmeticException("uint256 underflow: " + value);
    }
    if (value.compareTo(MAX) > 0) {
      throw new ArithmeticException("uint256 overflow");
    }
    return value;
  }

  public static BigInteger add(BigInteger a, BigInteger b) {
    return require(require(a).add(require(b)));
  }

  public static BigInteger sub(BigInteger a, BigInteger b) {
    return require(require(a).subtract(require(b)));
  }

  public static BigInteger mul(BigInteger a, BigInteger b) {
    return require(require(a).multiply(require(b)));
  }

  public static BigInteger mul(BigInteger a, long b) {
    return mul(a, BigInteger.valueOf(b));
  }

  /**
   * Integer division rounding toward zero.
   */
  public static BigInteger div(BigInteger a, BigInteger b) {
    if (require(b).signum() == 0) {
      throw new ArithmeticException("uint256 division by zero");
    }
    return require(a).divide(b);
  }

  public static BigInteger div(BigInteger a, long b) {
    return div(a, BigInteger.valueOf(b));
  }

  /**
   * {@code a - b}, floored at zero.
   */
  public static BigInteger subFloor(BigInteger a, BigInteger b) {
    BigInteger left = require(a);
    BigInteger right = require(b);
    return left.compareTo(right) > 0 ? left.subtract(right) : BigInteger.ZERO;
  }
}
