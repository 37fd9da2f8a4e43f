package com.vaultlend.ledger.events;

public final class LedgerEventTypes {

  public static final String MARKET_ADDED = "ledger.market.added";
  public static final String MARKET_UPDATED = "ledger.market.updated";
  public static final String RATES_UPDATED = "ledger.market.rates-updated";
  public static final String DEPOSIT = "ledger.deposit";
  public static final String WITHDRAW = "ledger.withdraw";
  public static final String BORROW = "ledger.borrow";
  public static final String REPAY = "ledger.repay";
  public static final String LIQUIDATE = "ledger.liquidate";
  public static final String PAUSED = "ledger.paused";
  public static final String UNPAUSED = "ledger.unpaused";
  public static final String ASSET_RECOVERED = "ledger.asset-recovered";

  private LedgerEventTypes() {
  }
}
