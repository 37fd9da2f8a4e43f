package com.vaultlend.ledger.domain;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Cross-asset aggregate for one account.
 *
 * The totals are denormalized sums of the per-asset ledger entries and move in lockstep with them.
 * {@code active} is derived: an account is active while it holds any deposit or borrow.
 */
public record UserPosition(
    BigInteger totalDeposited,
    BigInteger totalBorrowed,
    Instant lastUpdateTime,
    boolean active
) {

  public static final UserPosition EMPTY = new UserPosition(BigInteger.ZERO, BigInteger.ZERO, null, false);

  /**
   * Position with new totals; the active flag is recomputed from them.
   */
  public UserPosition update(BigInteger totalDeposited, BigInteger totalBorrowed, Instant now) {
    boolean stillActive = totalDeposited.signum() > 0 || totalBorrowed.signum() > 0;
    return new UserPosition(totalDeposited, totalBorrowed, now, stillActive);
  }
}
