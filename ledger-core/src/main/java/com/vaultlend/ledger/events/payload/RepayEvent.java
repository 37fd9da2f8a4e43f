package com.vaultlend.ledger.events.payload;

import com.vaultlend.ledger.events.LedgerEvent;
import com.vaultlend.ledger.events.LedgerEventTypes;

import java.math.BigInteger;
import java.time.Instant;

public record RepayEvent(
    String account,
    String asset,
    BigInteger amount,
    Instant occurredAt
) implements LedgerEvent {

  @Override
  public String type() {
    return LedgerEventTypes.REPAY;
  }
}
