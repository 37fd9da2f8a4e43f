package com.vaultlend.ledger.policy;

import com.vaultlend.ledger.domain.Addresses;
import com.vaultlend.ledger.error.LedgerError;
import com.vaultlend.ledger.error.LedgerException;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class SingleOwnerAccessPolicy implements AccessPolicy {

  private final String owner;

  public SingleOwnerAccessPolicy(String owner) {
    this.owner = Addresses.normalize(owner);
  }

  @Override
  public void requireOwner(String caller) {
    if (caller == null || !Addresses.isValid(caller) || !owner.equals(Addresses.normalize(caller))) {
      log.warn("rejected privileged call (caller={})", caller);
      throw LedgerException.of(LedgerError.UNAUTHORIZED, "caller %s is not the owner", caller);
    }
  }

  @Override
  public String owner() {
    return owner;
  }
}
