package com.vaultlend.ledger.domain;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Lending market for a single asset.
 *
 * Totals mirror the per-account balances held by the position ledger:
 * - totalSupply equals the sum of every account's deposit in this asset
 * - totalBorrow equals the sum of every account's borrow in this asset
 *
 * Rates are annual, in basis points, and stored for reporting only.
 */
public record Market(
    String asset,
    BigInteger totalSupply,
    BigInteger totalBorrow,
    int supplyRate,
    int borrowRate,
    int collateralFactor,      // basis points of deposit value usable as collateral
    boolean active,
    Instant createdAt
) {

  public static Market open(String asset, int collateralFactor, int supplyRate, int borrowRate, Instant now) {
    return new Market(asset, BigInteger.ZERO, BigInteger.ZERO, supplyRate, borrowRate, collateralFactor, true, now);
  }

  public Market withParameters(int collateralFactor, int supplyRate, int borrowRate) {
    return new Market(asset, totalSupply, totalBorrow, supplyRate, borrowRate, collateralFactor, active, createdAt);
  }

  public Market withTotalSupply(BigInteger totalSupply) {
    return new Market(asset, totalSupply, totalBorrow, supplyRate, borrowRate, collateralFactor, active, createdAt);
  }

  public Market withTotalBorrow(BigInteger totalBorrow) {
    return new Market(asset, totalSupply, totalBorrow, supplyRate, borrowRate, collateralFactor, active, createdAt);
  }
}
