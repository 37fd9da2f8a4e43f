package com.vaultlend.ledger.events.payload;

import com.vaultlend.ledger.events.LedgerEvent;
import com.vaultlend.ledger.events.LedgerEventTypes;

import java.time.Instant;

public record MarketAddedEvent(
    String asset,
    int collateralFactor,
    int supplyRate,
    int borrowRate,
    Instant occurredAt
) implements LedgerEvent {

  @Override
  public String type() {
    return LedgerEventTypes.MARKET_ADDED;
  }
}
