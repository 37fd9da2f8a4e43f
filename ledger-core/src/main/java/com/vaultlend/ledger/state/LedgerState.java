package com.vaultlend.ledger.state;

import com.vaultlend.ledger.domain.Market;
import com.vaultlend.ledger.domain.PositionKey;
import com.vaultlend.ledger.domain.UserPosition;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Mutable store behind one lending pool.
 *
 * Writes made inside {@link #atomically(Supplier)} are journaled; if the unit of work throws,
 * the journal is replayed in reverse and the store is left exactly as it was before the call.
 * Not thread-safe: callers serialize access (see {@code LendingPool}).
 */
public class LedgerState {

  private final Map<String, Market> markets = new HashMap<>();
  private final List<String> supportedAssets = new ArrayList<>();
  private final Map<String, UserPosition> users = new HashMap<>();
  private final Map<PositionKey, BigInteger> deposits = new LinkedHashMap<>();
  private final Map<PositionKey, BigInteger> borrows = new LinkedHashMap<>();
  private final Map<String, BigInteger> nonces = new HashMap<>();

  private Deque<Runnable> undoLog;

  public <T> T atomically(Supplier<T> work) {
    if (undoLog != null) {
      // nested unit: joins the enclosing one
      return work.get();
    }
    undoLog = new ArrayDeque<>();
    try {
      T result = work.get();
      undoLog = null;
      return result;
    } catch (RuntimeException | Error e) {
      rollback();
      throw e;
    }
  }

  public boolean inTransaction() {
    return undoLog != null;
  }

  private void rollback() {
    Deque<Runnable> log = undoLog;
    undoLog = null;
    while (!log.isEmpty()) {
      log.pop().run();
    }
  }

  private <K, V> void journaledPut(Map<K, V> map, K key, V value) {
    if (undoLog != null) {
      boolean existed = map.containsKey(key);
      V previous = map.get(key);
      undoLog.push(() -> {
        if (existed) {
          map.put(key, previous);
        } else {
          map.remove(key);
        }
      });
    }
    map.put(key, value);
  }

  // markets

  public Optional<Market> market(String asset) {
    return Optional.ofNullable(markets.get(asset));
  }

  public void putMarket(Market market) {
    journaledPut(markets, market.asset(), market);
  }

  public List<String> supportedAssets() {
    return Collections.unmodifiableList(supportedAssets);
  }

  /**
   * Appends the asset unless it is already listed.
   */
  public void appendSupportedAsset(String asset) {
    if (supportedAssets.contains(asset)) {
      return;
    }
    supportedAssets.add(asset);
    if (undoLog != null) {
      undoLog.push(() -> supportedAssets.remove(supportedAssets.size() - 1));
    }
  }

  // accounts

  public UserPosition user(String account) {
    return users.getOrDefault(account, UserPosition.EMPTY);
  }

  public void putUser(String account, UserPosition position) {
    journaledPut(users, account, position);
  }

  public BigInteger deposit(String account, String asset) {
    return deposits.getOrDefault(new PositionKey(account, asset), BigInteger.ZERO);
  }

  public void setDeposit(String account, String asset, BigInteger amount) {
    journaledPut(deposits, new PositionKey(account, asset), amount);
  }

  public BigInteger borrow(String account, String asset) {
    return borrows.getOrDefault(new PositionKey(account, asset), BigInteger.ZERO);
  }

  public void setBorrow(String account, String asset, BigInteger amount) {
    journaledPut(borrows, new PositionKey(account, asset), amount);
  }

  public Map<PositionKey, BigInteger> deposits() {
    return Collections.unmodifiableMap(deposits);
  }

  public Map<PositionKey, BigInteger> borrows() {
    return Collections.unmodifiableMap(borrows);
  }

  // signed-authorization nonces

  public BigInteger nonce(String account) {
    return nonces.getOrDefault(account, BigInteger.ZERO);
  }

  public void setNonce(String account, BigInteger nonce) {
    journaledPut(nonces, account, nonce);
  }
}
