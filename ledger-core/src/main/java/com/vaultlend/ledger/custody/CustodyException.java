package com.vaultlend.ledger.custody;

public class CustodyException extends RuntimeException {

  public CustodyException(String message) {
    super(message);
  }

  public CustodyException(String message, Throwable cause) {
    super(message, cause);
  }
}
