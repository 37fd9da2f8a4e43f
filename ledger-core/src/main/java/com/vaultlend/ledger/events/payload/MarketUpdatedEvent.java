package com.vaultlend.ledger.events.payload;

import com.vaultlend.ledger.events.LedgerEvent;
import com.vaultlend.ledger.events.LedgerEventTypes;

import java.time.Instant;

public record MarketUpdatedEvent(
    String asset,
    int collateralFactor,
    Instant occurredAt
) implements LedgerEvent {

  @Override
  public String type() {
    return LedgerEventTypes.MARKET_UPDATED;
  }
}
