package com.vaultlend.ledger.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

@Validated
@ConfigurationProperties(prefix="ledger")
public record LedgerProperties(
    /**
     * Privileged identity allowed to manage markets, pause the pool and recover assets.
     */
    String owner,
    @Valid Risk risk,
    /**
     * Markets created by the owner at startup, in registry order.
     */
    @Valid List<MarketSeed> markets,
    @Valid Simulation simulation
) {

  public static final String DEFAULT_OWNER = "0x00000000000000000000000000000000000000aa";

  public LedgerProperties {
    if (owner == null || owner.isBlank()) {
      owner = DEFAULT_OWNER;
    }
    if (risk == null) {
      risk = Risk.defaults();
    }
    markets = markets == null ? List.of() : markets.stream().filter(Objects::nonNull).toList();
    if (simulation == null) {
      simulation = new Simulation(null, null, null);
    }
  }

  public record Risk(
      /**
       * Minimum collateralization ratio (bp) a position must keep; below it the position is liquidatable.
       */
      @NotNull @Min(0) Integer liquidationThresholdBps,
      /**
       * Bonus (bp) on top of the repaid amount that a liquidator seizes.
       */
      @NotNull @Min(0) Integer liquidationPenaltyBps,
      /**
       * Upper bound for a market's collateral factor (bp).
       */
      @NotNull @Min(0) @Max(10_000) Integer maxCollateralFactorBps
  ) {
    public Risk {
      if (liquidationThresholdBps == null) {
        liquidationThresholdBps = 8_000;
      }
      if (liquidationPenaltyBps == null) {
        liquidationPenaltyBps = 500;
      }
      if (maxCollateralFactorBps == null) {
        maxCollateralFactorBps = 10_000;
      }
    }

    public static Risk defaults() {
      return new Risk(null, null, null);
    }
  }

  public record MarketSeed(
      @NotNull String asset,
      @NotNull @Min(0) @Max(10_000) Integer collateralFactor,
      @NotNull @PositiveOrZero Integer supplyRate,
      @NotNull @PositiveOrZero Integer borrowRate
  ) {
    public MarketSeed {
      if (supplyRate == null) {
        supplyRate = 0;
      }
      if (borrowRate == null) {
        borrowRate = 0;
      }
    }
  }

  public record Simulation(
      /**
       * When enabled, custody is an in-memory balance book seeded from {@code balances}. When disabled
       * the host must supply its own custody, otherwise startup fails.
       */
      @NotNull Boolean enabled,
      /**
       * Address under which the book keeps the pool's own holdings.
       */
      String custodian,
      /**
       * Starting balances for the in-memory book.
       */
      @Valid List<SeedBalance> balances
  ) {
    public static final String DEFAULT_CUSTODIAN = "0x00000000000000000000000000000000000000cc";

    public Simulation {
      if (enabled == null) {
        enabled = true;
      }
      if (custodian == null || custodian.isBlank()) {
        custodian = DEFAULT_CUSTODIAN;
      }
      balances = balances == null ? List.of() : balances.stream().filter(Objects::nonNull).toList();
    }
  }

  public record SeedBalance(
      @NotNull String holder,
      @NotNull String asset,
      @NotNull @PositiveOrZero BigInteger amount
  ) {
  }
}
