package com.vaultlend.ledger.events;

public interface LedgerEventPublisher {

  void publish(LedgerEvent event);
}
