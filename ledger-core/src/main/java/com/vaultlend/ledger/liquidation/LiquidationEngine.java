package com.vaultlend.ledger.liquidation;

import com.vaultlend.ledger.config.LedgerProperties;
import com.vaultlend.ledger.custody.AssetCustody;
import com.vaultlend.ledger.domain.Market;
import com.vaultlend.ledger.error.LedgerError;
import com.vaultlend.ledger.error.LedgerException;
import com.vaultlend.ledger.math.Uint256Math;
import com.vaultlend.ledger.position.PositionLedger;
import com.vaultlend.ledger.registry.MarketRegistry;
import com.vaultlend.ledger.risk.CollateralizationCalculator;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Optional;

/**
 * Repays part of an unsafe account's borrow on its behalf and hands the liquidator collateral plus a penalty bonus.
 *
 * Collateral is always seized from a single asset: the one with the highest weighted value
 * ({@code deposit * collateralFactor / 10000}), earliest-registered winning ties. If that asset
 * alone cannot cover the seize amount the liquidation is rejected, even when the account's
 * collateral spread over several assets would.
 */
@Slf4j
public class LiquidationEngine {

  private final MarketRegistry registry;
  private final PositionLedger ledger;
  private final CollateralizationCalculator calculator;
  private final AssetCustody custody;
  private final LedgerProperties.Risk risk;

  public LiquidationEngine(
      MarketRegistry registry,
      PositionLedger ledger,
      CollateralizationCalculator calculator,
      AssetCustody custody,
      LedgerProperties.Risk risk
  ) {
    this.registry = registry;
    this.ledger = ledger;
    this.calculator = calculator;
    this.custody = custody;
    this.risk = risk;
  }

  /**
   * {@code amount * (10000 + penalty) / 10000}.
   */
  public BigInteger seizeAmount(BigInteger amount) {
    BigInteger multiplier = CollateralizationCalculator.BASIS_POINTS.add(BigInteger.valueOf(risk.liquidationPenaltyBps()));
    return Uint256Math.div(Uint256Math.mul(amount, multiplier), CollateralizationCalculator.BASIS_POINTS);
  }

  /**
   * Active market holding the account's most valuable collateral, if any has positive weighted value.
   */
  public Optional<String> bestCollateralAsset(String account) {
    String best = null;
    BigInteger bestValue = BigInteger.ZERO;
    for (Market market : registry.activeMarkets()) {
      BigInteger deposit = ledger.deposit(account, market.asset());
      if (deposit.signum() <= 0) {
        continue;
      }
      BigInteger value = CollateralizationCalculator.weightedValue(deposit, market.collateralFactor());
      if (value.compareTo(bestValue) > 0) {
        best = market.asset();
        bestValue = value;
      }
    }
    return Optional.ofNullable(best);
  }

  /**
   * Validates and executes a liquidation. Must run inside the pool's atomic unit; a failure part-way
   * relies on the caller's rollback for the ledger; a repayment already pulled is refunded.
   */
  public LiquidationResult liquidate(String liquidator, String account, String asset, BigInteger amount, Instant now) {
    if (amount == null || amount.signum() <= 0 || !Uint256Math.inRange(amount)) {
      throw LedgerException.of(LedgerError.INVALID_AMOUNT, "liquidation amount must be positive, got %s", amount);
    }
    BigInteger outstanding = ledger.borrow(account, asset);
    if (outstanding.compareTo(amount) < 0) {
      throw LedgerException.of(LedgerError.INSUFFICIENT_BORROW_TO_LIQUIDATE,
          "account %s borrows %s of %s, cannot liquidate %s", account, outstanding, asset, amount);
    }
    BigInteger ratio = calculator.collateralizationRatio(account);
    if (!calculator.isLiquidatable(account)) {
      throw LedgerException.of(LedgerError.NOT_LIQUIDATABLE, "account %s is healthy (ratio=%s)", account, ratio);
    }

    BigInteger seize = seizeAmount(amount);
    String collateralAsset = bestCollateralAsset(account)
        .orElseThrow(() -> LedgerException.of(LedgerError.NO_COLLATERAL, "account %s has no collateral", account));
    BigInteger collateral = ledger.deposit(account, collateralAsset);
    if (collateral.compareTo(seize) < 0) {
      throw LedgerException.of(LedgerError.INSUFFICIENT_COLLATERAL,
          "best collateral %s holds %s, seize needs %s", collateralAsset, collateral, seize);
    }

    custody.pull(asset, liquidator, amount);
    ledger.debitBorrow(account, asset, amount, now);
    ledger.debitDeposit(account, collateralAsset, seize, now);
    try {
      custody.push(collateralAsset, liquidator, seize);
    } catch (RuntimeException e) {
      refund(liquidator, asset, amount, e);
      throw e;
    }

    log.info("liquidated (account={}, liquidator={}, repaid={} {}, seized={} {}, ratioBefore={})",
        account, liquidator, amount, asset, seize, collateralAsset, ratio);
    return new LiquidationResult(liquidator, account, asset, amount, collateralAsset, seize, ratio);
  }

  /**
   * Custody sits outside the ledger journal, so a repayment already pulled is sent back when the
   * collateral payout fails.
   */
  private void refund(String liquidator, String asset, BigInteger amount, RuntimeException cause) {
    log.warn("collateral payout failed, refunding repayment (liquidator={}, amount={} {}): {}",
        liquidator, amount, asset, cause.getMessage());
    try {
      custody.push(asset, liquidator, amount);
    } catch (RuntimeException refundFailure) {
      log.error("repayment refund failed (liquidator={}, amount={} {})", liquidator, amount, asset, refundFailure);
      cause.addSuppressed(refundFailure);
    }
  }
}
