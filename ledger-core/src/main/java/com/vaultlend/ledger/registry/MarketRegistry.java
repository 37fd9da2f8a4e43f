package com.vaultlend.ledger.registry;

import com.vaultlend.ledger.config.LedgerProperties;
import com.vaultlend.ledger.domain.Market;
import com.vaultlend.ledger.error.LedgerError;
import com.vaultlend.ledger.error.LedgerException;
import com.vaultlend.ledger.state.LedgerState;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Asset to market mapping plus the append-only list of supported assets.
 *
 * Callers pass normalized asset addresses; ownership checks happen in the pool.
 */
@Slf4j
public class MarketRegistry {

  private final LedgerState state;
  private final LedgerProperties.Risk risk;

  public MarketRegistry(LedgerState state, LedgerProperties.Risk risk) {
    this.state = state;
    this.risk = risk;
  }

  public Market addMarket(String asset, int collateralFactor, int supplyRate, int borrowRate, Instant now) {
    requireCollateralFactor(collateralFactor);
    requireRates(supplyRate, borrowRate);
    Optional<Market> existing = state.market(asset);
    if (existing.isPresent() && existing.get().active()) {
      throw LedgerException.of(LedgerError.MARKET_EXISTS, "market already exists for %s", asset);
    }
    Market market = Market.open(asset, collateralFactor, supplyRate, borrowRate, now);
    state.putMarket(market);
    state.appendSupportedAsset(asset);
    log.info("market added (asset={}, collateralFactor={}, supplyRate={}, borrowRate={})",
        asset, collateralFactor, supplyRate, borrowRate);
    return market;
  }

  public Market updateMarket(String asset, int collateralFactor, int supplyRate, int borrowRate) {
    Market current = requireActive(asset);
    requireCollateralFactor(collateralFactor);
    requireRates(supplyRate, borrowRate);
    Market updated = current.withParameters(collateralFactor, supplyRate, borrowRate);
    state.putMarket(updated);
    log.info("market updated (asset={}, collateralFactor={}->{}, supplyRate={}, borrowRate={})",
        asset, current.collateralFactor(), collateralFactor, supplyRate, borrowRate);
    return updated;
  }

  public Market requireActive(String asset) {
    return state.market(asset)
        .filter(Market::active)
        .orElseThrow(() -> LedgerException.of(LedgerError.MARKET_INACTIVE, "no active market for %s", asset));
  }

  public Optional<Market> market(String asset) {
    return state.market(asset);
  }

  /**
   * Active markets in registry order.
   */
  public List<Market> activeMarkets() {
    List<Market> out = new ArrayList<>();
    for (String asset : state.supportedAssets()) {
      state.market(asset).filter(Market::active).ifPresent(out::add);
    }
    return out;
  }

  /**
   * All markets in registry order.
   */
  public List<Market> markets() {
    List<Market> out = new ArrayList<>();
    for (String asset : state.supportedAssets()) {
      state.market(asset).ifPresent(out::add);
    }
    return out;
  }

  public List<String> supportedAssets() {
    return List.copyOf(state.supportedAssets());
  }

  public void putMarket(Market market) {
    state.putMarket(market);
  }

  private void requireCollateralFactor(int collateralFactor) {
    if (collateralFactor < 0 || collateralFactor > risk.maxCollateralFactorBps()) {
      throw LedgerException.of(LedgerError.INVALID_COLLATERAL_FACTOR,
          "collateral factor %d outside [0, %d]", collateralFactor, risk.maxCollateralFactorBps());
    }
  }

  // unsigned basis points
  private static void requireRates(int supplyRate, int borrowRate) {
    if (supplyRate < 0 || borrowRate < 0) {
      throw LedgerException.of(LedgerError.INVALID_RATE,
          "rates must be non-negative, got supplyRate=%d borrowRate=%d", supplyRate, borrowRate);
    }
  }
}
