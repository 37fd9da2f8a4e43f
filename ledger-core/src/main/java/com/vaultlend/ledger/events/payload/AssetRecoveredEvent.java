package com.vaultlend.ledger.events.payload;

import com.vaultlend.ledger.events.LedgerEvent;
import com.vaultlend.ledger.events.LedgerEventTypes;

import java.math.BigInteger;
import java.time.Instant;

public record AssetRecoveredEvent(
    String asset,
    String to,
    BigInteger amount,
    Instant occurredAt
) implements LedgerEvent {

  @Override
  public String type() {
    return LedgerEventTypes.ASSET_RECOVERED;
  }
}
