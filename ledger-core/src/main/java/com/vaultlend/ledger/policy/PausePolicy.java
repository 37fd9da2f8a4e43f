package com.vaultlend.ledger.policy;

public interface PausePolicy {

  /**
   * @throws com.vaultlend.ledger.error.LedgerException with {@code PROTOCOL_PAUSED} while paused
   */
  void requireUnpaused();

  boolean isPaused();
}
