package com.vaultlend.ledger.risk;

import com.vaultlend.ledger.config.LedgerProperties;
import com.vaultlend.ledger.domain.Market;
import com.vaultlend.ledger.math.Uint256Math;
import com.vaultlend.ledger.position.PositionLedger;
import com.vaultlend.ledger.registry.MarketRegistry;

import java.math.BigInteger;

/**
 * Collateralization ratio of an account and the safety gates built on it.
 *
 * <pre>
 * collateralValue = sum over active markets of deposit * collateralFactor / 10000
 * borrowValue     = sum over active markets of borrow
 * ratio           = collateralValue * 10000 / borrowValue    (INFINITE when borrowValue == 0)
 * </pre>
 *
 * Read-only. The current ratio and every simulated post-operation ratio go through the same
 * {@link #accumulate} pass so the two can never disagree on how value is counted.
 */
public class CollateralizationCalculator {

  public static final BigInteger BASIS_POINTS = BigInteger.valueOf(10_000);

  /**
   * Ratio reported for an account with nothing borrowed.
   */
  public static final BigInteger INFINITE = Uint256Math.MAX;

  private final MarketRegistry registry;
  private final PositionLedger ledger;
  private final LedgerProperties.Risk risk;

  public CollateralizationCalculator(MarketRegistry registry, PositionLedger ledger, LedgerProperties.Risk risk) {
    this.registry = registry;
    this.ledger = ledger;
    this.risk = risk;
  }

  public static boolean isInfinite(BigInteger ratio) {
    return INFINITE.equals(ratio);
  }

  public BigInteger collateralizationRatio(String account) {
    return accumulate(account, Adjustment.NONE).ratio();
  }

  public boolean canWithdraw(String account, String asset, BigInteger amount) {
    if (isInfinite(collateralizationRatio(account))) {
      return true;
    }
    return isSafe(accumulate(account, new Adjustment(asset, amount, BigInteger.ZERO)).ratio());
  }

  /**
   * Approves immediately while nothing is borrowed; the ratio after that first borrow is not checked.
   */
  public boolean canBorrow(String account, String asset, BigInteger amount) {
    if (isInfinite(collateralizationRatio(account))) {
      return true;
    }
    return isSafe(accumulate(account, new Adjustment(asset, BigInteger.ZERO, amount)).ratio());
  }

  public boolean isLiquidatable(String account) {
    return !isSafe(collateralizationRatio(account));
  }

  /**
   * Collateral value of one deposit: {@code deposit * collateralFactor / 10000}.
   */
  public static BigInteger weightedValue(BigInteger deposit, int collateralFactor) {
    return Uint256Math.div(Uint256Math.mul(deposit, collateralFactor), BASIS_POINTS);
  }

  public Valuation valuation(String account) {
    return accumulate(account, Adjustment.NONE);
  }

  private boolean isSafe(BigInteger ratio) {
    return isInfinite(ratio) || ratio.compareTo(BigInteger.valueOf(risk.liquidationThresholdBps())) >= 0;
  }

  private Valuation accumulate(String account, Adjustment adjustment) {
    BigInteger collateralValue = BigInteger.ZERO;
    BigInteger borrowValue = BigInteger.ZERO;
    for (Market market : registry.activeMarkets()) {
      String asset = market.asset();
      BigInteger deposit = ledger.deposit(account, asset);
      BigInteger borrow = ledger.borrow(account, asset);
      if (asset.equals(adjustment.asset())) {
        deposit = Uint256Math.subFloor(deposit, adjustment.depositReduction());
        borrow = Uint256Math.add(borrow, adjustment.borrowIncrease());
      }
      collateralValue = Uint256Math.add(collateralValue, weightedValue(deposit, market.collateralFactor()));
      borrowValue = Uint256Math.add(borrowValue, borrow);
    }
    return new Valuation(collateralValue, borrowValue);
  }

  private record Adjustment(String asset, BigInteger depositReduction, BigInteger borrowIncrease) {
    static final Adjustment NONE = new Adjustment(null, BigInteger.ZERO, BigInteger.ZERO);
  }

  public record Valuation(BigInteger collateralValue, BigInteger borrowValue) {

    public BigInteger ratio() {
      if (borrowValue.signum() == 0) {
        return INFINITE;
      }
      return Uint256Math.div(Uint256Math.mul(collateralValue, BASIS_POINTS), borrowValue);
    }
  }
}
