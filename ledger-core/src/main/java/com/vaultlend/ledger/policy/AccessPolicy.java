package com.vaultlend.ledger.policy;

/**
 * Gates privileged operations (market management, pause, asset recovery).
 */
public interface AccessPolicy {

  /**
   * @throws com.vaultlend.ledger.error.LedgerException with {@code UNAUTHORIZED} when the caller is not privileged
   */
  void requireOwner(String caller);

  String owner();
}
