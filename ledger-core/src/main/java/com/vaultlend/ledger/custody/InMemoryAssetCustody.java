package com.vaultlend.ledger.custody;

import com.vaultlend.ledger.domain.PositionKey;
import com.vaultlend.ledger.math.Uint256Math;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory token balance book standing in for real asset contracts.
 *
 * The pool's own holdings are kept under {@link #custodian()}. A pull needs the payer to hold the
 * amount; a push needs custody to hold it.
 */
@Slf4j
public class InMemoryAssetCustody implements AssetCustody {

  private final String custodian;
  private final ConcurrentMap<PositionKey, BigInteger> balances = new ConcurrentHashMap<>();

  public InMemoryAssetCustody(String custodian) {
    this.custodian = custodian;
  }

  public String custodian() {
    return custodian;
  }

  /**
   * Credits an external holder, e.g. from configured seed balances.
   */
  public void credit(String holder, String asset, BigInteger amount) {
    balances.merge(new PositionKey(holder, asset), Uint256Math.require(amount), Uint256Math::add);
  }

  public BigInteger balanceOf(String holder, String asset) {
    return balances.getOrDefault(new PositionKey(holder, asset), BigInteger.ZERO);
  }

  public BigInteger custodyBalance(String asset) {
    return balanceOf(custodian, asset);
  }

  /**
   * Non-zero balances of one holder, keyed by asset.
   */
  public Map<String, BigInteger> balancesOf(String holder) {
    Map<String, BigInteger> out = new TreeMap<>();
    balances.forEach((key, amount) -> {
      if (key.account().equals(holder) && amount.signum() > 0) {
        out.put(key.asset(), amount);
      }
    });
    return out;
  }

  @Override
  public synchronized void pull(String asset, String from, BigInteger amount) {
    move(asset, from, custodian, amount);
  }

  @Override
  public synchronized void push(String asset, String to, BigInteger amount) {
    move(asset, custodian, to, amount);
  }

  private void move(String asset, String from, String to, BigInteger amount) {
    PositionKey source = new PositionKey(from, asset);
    BigInteger available = balances.getOrDefault(source, BigInteger.ZERO);
    if (available.compareTo(amount) < 0) {
      throw new CustodyException("insufficient balance (asset=" + asset + ", holder=" + from
          + ", available=" + available + ", requested=" + amount + ")");
    }
    balances.put(source, Uint256Math.sub(available, amount));
    balances.merge(new PositionKey(to, asset), amount, Uint256Math::add);
    log.debug("custody transfer (asset={}, from={}, to={}, amount={})", asset, from, to, amount);
  }
}
