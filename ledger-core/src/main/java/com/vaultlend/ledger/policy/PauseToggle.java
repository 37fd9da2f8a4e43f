package com.vaultlend.ledger.policy;

/**
 * Flips the emergency stop. Callers check ownership first.
 */
public interface PauseToggle {

  /**
   * @return false if the protocol was already in the requested state
   */
  boolean set(boolean paused);
}
