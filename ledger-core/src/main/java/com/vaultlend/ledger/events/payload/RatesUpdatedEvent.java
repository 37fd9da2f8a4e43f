package com.vaultlend.ledger.events.payload;

import com.vaultlend.ledger.events.LedgerEvent;
import com.vaultlend.ledger.events.LedgerEventTypes;

import java.time.Instant;

public record RatesUpdatedEvent(
    String asset,
    int supplyRate,
    int borrowRate,
    Instant occurredAt
) implements LedgerEvent {

  @Override
  public String type() {
    return LedgerEventTypes.RATES_UPDATED;
  }
}
