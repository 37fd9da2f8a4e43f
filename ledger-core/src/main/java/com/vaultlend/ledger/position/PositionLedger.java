package com.vaultlend.ledger.position;

import com.vaultlend.ledger.domain.Market;
import com.vaultlend.ledger.domain.UserPosition;
import com.vaultlend.ledger.math.Uint256Math;
import com.vaultlend.ledger.registry.MarketRegistry;
import com.vaultlend.ledger.state.LedgerState;

import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-account accounting.
 *
 * Each credit/debit moves three figures together: the (account, asset) balance, the account's
 * cross-asset total and the market total. Callers check sufficiency before debiting; a debit
 * that would go negative still fails in {@link Uint256Math}.
 */
public class PositionLedger {

  private final LedgerState state;
  private final MarketRegistry registry;

  public PositionLedger(LedgerState state, MarketRegistry registry) {
    this.state = state;
    this.registry = registry;
  }

  public BigInteger deposit(String account, String asset) {
    return state.deposit(account, asset);
  }

  public BigInteger borrow(String account, String asset) {
    return state.borrow(account, asset);
  }

  public UserPosition user(String account) {
    return state.user(account);
  }

  public void creditDeposit(String account, String asset, BigInteger amount, Instant now) {
    Market market = market(asset);
    state.setDeposit(account, asset, Uint256Math.add(state.deposit(account, asset), amount));
    UserPosition user = state.user(account);
    state.putUser(account, user.update(Uint256Math.add(user.totalDeposited(), amount), user.totalBorrowed(), now));
    registry.putMarket(market.withTotalSupply(Uint256Math.add(market.totalSupply(), amount)));
  }

  public void debitDeposit(String account, String asset, BigInteger amount, Instant now) {
    Market market = market(asset);
    state.setDeposit(account, asset, Uint256Math.sub(state.deposit(account, asset), amount));
    UserPosition user = state.user(account);
    state.putUser(account, user.update(Uint256Math.sub(user.totalDeposited(), amount), user.totalBorrowed(), now));
    registry.putMarket(market.withTotalSupply(Uint256Math.sub(market.totalSupply(), amount)));
  }

  public void creditBorrow(String account, String asset, BigInteger amount, Instant now) {
    Market market = market(asset);
    state.setBorrow(account, asset, Uint256Math.add(state.borrow(account, asset), amount));
    UserPosition user = state.user(account);
    state.putUser(account, user.update(user.totalDeposited(), Uint256Math.add(user.totalBorrowed(), amount), now));
    registry.putMarket(market.withTotalBorrow(Uint256Math.add(market.totalBorrow(), amount)));
  }

  public void debitBorrow(String account, String asset, BigInteger amount, Instant now) {
    Market market = market(asset);
    state.setBorrow(account, asset, Uint256Math.sub(state.borrow(account, asset), amount));
    UserPosition user = state.user(account);
    state.putUser(account, user.update(user.totalDeposited(), Uint256Math.sub(user.totalBorrowed(), amount), now));
    registry.putMarket(market.withTotalBorrow(Uint256Math.sub(market.totalBorrow(), amount)));
  }

  private Market market(String asset) {
    return registry.market(asset)
        .orElseThrow(() -> new IllegalStateException("no market for " + asset));
  }

  /**
   * Non-zero deposits of an account, in registry order.
   */
  public Map<String, BigInteger> depositsOf(String account) {
    Map<String, BigInteger> out = new LinkedHashMap<>();
    for (String asset : state.supportedAssets()) {
      BigInteger amount = state.deposit(account, asset);
      if (amount.signum() > 0) {
        out.put(asset, amount);
      }
    }
    return out;
  }

  /**
   * Non-zero borrows of an account, in registry order.
   */
  public Map<String, BigInteger> borrowsOf(String account) {
    Map<String, BigInteger> out = new LinkedHashMap<>();
    for (String asset : state.supportedAssets()) {
      BigInteger amount = state.borrow(account, asset);
      if (amount.signum() > 0) {
        out.put(asset, amount);
      }
    }
    return out;
  }

  public BigInteger nonce(String account) {
    return state.nonce(account);
  }

  public void incrementNonce(String account) {
    state.setNonce(account, Uint256Math.add(state.nonce(account), BigInteger.ONE));
  }
}
