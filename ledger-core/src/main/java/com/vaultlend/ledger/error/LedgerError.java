package com.vaultlend.ledger.error;

public enum LedgerError {
  // input validation
  INVALID_AMOUNT(Category.VALIDATION),
  INVALID_ASSET(Category.VALIDATION),
  INVALID_COLLATERAL_FACTOR(Category.VALIDATION),
  INVALID_RATE(Category.VALIDATION),

  // state conflict
  MARKET_EXISTS(Category.CONFLICT),
  MARKET_INACTIVE(Category.CONFLICT),

  // insufficiency
  INSUFFICIENT_DEPOSIT(Category.INSUFFICIENT),
  INSUFFICIENT_BORROW(Category.INSUFFICIENT),
  INSUFFICIENT_LIQUIDITY(Category.INSUFFICIENT),
  INSUFFICIENT_COLLATERAL(Category.INSUFFICIENT),
  INSUFFICIENT_BORROW_TO_LIQUIDATE(Category.INSUFFICIENT),

  // safety gates
  UNSAFE_WITHDRAWAL(Category.SAFETY),
  UNSAFE_BORROW(Category.SAFETY),
  NOT_LIQUIDATABLE(Category.SAFETY),
  NO_COLLATERAL(Category.SAFETY),

  // authorization
  INVALID_NONCE(Category.AUTHORIZATION),
  SIGNATURE_EXPIRED(Category.AUTHORIZATION),
  INVALID_SIGNATURE(Category.AUTHORIZATION),
  UNAUTHORIZED(Category.AUTHORIZATION),

  // operational
  PROTOCOL_PAUSED(Category.OPERATIONAL),
  REENTRANT_CALL(Category.OPERATIONAL);

  private final Category category;

  LedgerError(Category category) {
    this.category = category;
  }

  public Category category() {
    return category;
  }

  public enum Category {
    VALIDATION,
    CONFLICT,
    INSUFFICIENT,
    SAFETY,
    AUTHORIZATION,
    OPERATIONAL
  }
}
