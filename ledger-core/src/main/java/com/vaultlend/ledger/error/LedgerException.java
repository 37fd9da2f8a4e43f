package com.vaultlend.ledger.error;

import lombok.Getter;

/**
 * Aborts a ledger operation. The operation that raised it leaves no state change behind.
 */
@Getter
public class LedgerException extends RuntimeException {

  private final LedgerError error;

  public LedgerException(LedgerError error, String message) {
    super(error.name() + ": " + message);
    this.error = error;
  }

  public static LedgerException of(LedgerError error, String format, Object... args) {
    return new LedgerException(error, String.format(format, args));
  }
}
