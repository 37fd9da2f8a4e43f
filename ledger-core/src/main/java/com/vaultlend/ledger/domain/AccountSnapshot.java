package com.vaultlend.ledger.domain;

import java.math.BigInteger;
import java.util.Map;

/**
 * Read-only view of an account: aggregate position, non-zero per-asset balances, current ratio and nonce.
 */
public record AccountSnapshot(
    String account,
    UserPosition position,
    Map<String, BigInteger> deposits,
    Map<String, BigInteger> borrows,
    BigInteger collateralizationRatio,
    boolean ratioInfinite,
    boolean liquidatable,
    BigInteger nonce
) {
}
