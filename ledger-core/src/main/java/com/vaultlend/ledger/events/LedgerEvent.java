package com.vaultlend.ledger.events;

import java.time.Instant;

/**
 * Notification emitted by a committed ledger operation.
 */
public interface LedgerEvent {

  String type();

  Instant occurredAt();
}
