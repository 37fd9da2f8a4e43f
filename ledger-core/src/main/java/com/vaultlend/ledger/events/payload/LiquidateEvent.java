package com.vaultlend.ledger.events.payload;

import com.vaultlend.ledger.events.LedgerEvent;
import com.vaultlend.ledger.events.LedgerEventTypes;

import java.math.BigInteger;
import java.time.Instant;

public record LiquidateEvent(
    String liquidator,
    String account,
    String borrowAsset,
    BigInteger repayAmount,
    String collateralAsset,
    BigInteger seizedAmount,
    Instant occurredAt
) implements LedgerEvent {

  @Override
  public String type() {
    return LedgerEventTypes.LIQUIDATE;
  }
}
