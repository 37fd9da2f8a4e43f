package com.vaultlend.ledger.service.web;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigInteger;

/**
 * Request bodies of the ledger endpoints. Amounts are raw integer units.
 */
public final class LedgerRequests {

  private LedgerRequests() {
  }

  public record AmountRequest(
      @NotBlank String asset,
      @NotNull BigInteger amount
  ) {
  }

  public record SignedDepositRequest(
      @NotBlank String asset,
      @NotNull BigInteger amount,
      @NotNull @PositiveOrZero BigInteger nonce,
      @NotNull @PositiveOrZero BigInteger deadline,
      @NotBlank String signature
  ) {
  }

  public record LiquidateRequest(
      @NotBlank String account,
      @NotBlank String asset,
      @NotNull BigInteger amount
  ) {
  }

  public record MarketRequest(
      @NotBlank String asset,
      @NotNull Integer collateralFactor,
      @NotNull @PositiveOrZero Integer supplyRate,
      @NotNull @PositiveOrZero Integer borrowRate
  ) {
  }

  public record MarketParametersRequest(
      @NotNull Integer collateralFactor,
      @NotNull @PositiveOrZero Integer supplyRate,
      @NotNull @PositiveOrZero Integer borrowRate
  ) {
  }

  public record RecoverRequest(
      @NotBlank String asset,
      @NotBlank String to,
      @NotNull BigInteger amount
  ) {
  }

  public record CreditRequest(
      @NotBlank String holder,
      @NotBlank String asset,
      @NotNull @PositiveOrZero BigInteger amount
  ) {
  }
}
