package com.vaultlend.ledger.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

class LedgerPropertiesBindingTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(TestConfig.class);

  @Test
  void bindsNestedRecordsFromRelaxedProperties() {
    runner.withPropertyValues(
        "ledger.owner=0x00000000000000000000000000000000000000ee",
        "ledger.risk.liquidation-threshold-bps=7500",
        "ledger.risk.liquidation-penalty-bps=800",
        "ledger.markets[0].asset=0x0000000000000000000000000000000000001001",
        "ledger.markets[0].collateral-factor=8000",
        "ledger.markets[0].supply-rate=300",
        "ledger.markets[0].borrow-rate=500",
        "ledger.simulation.balances[0].holder=0x00000000000000000000000000000000000000a1",
        "ledger.simulation.balances[0].asset=0x0000000000000000000000000000000000001001",
        "ledger.simulation.balances[0].amount=1000000000000000000000"
    ).run(context -> {
      LedgerProperties properties = context.getBean(LedgerProperties.class);

      assertThat(properties.owner()).isEqualTo("0x00000000000000000000000000000000000000ee");
      assertThat(properties.risk().liquidationThresholdBps()).isEqualTo(7_500);
      assertThat(properties.risk().liquidationPenaltyBps()).isEqualTo(800);
      assertThat(properties.risk().maxCollateralFactorBps()).isEqualTo(10_000);

      LedgerProperties.MarketSeed seed = properties.markets().get(0);
      assertThat(seed.collateralFactor()).isEqualTo(8_000);
      assertThat(seed.supplyRate()).isEqualTo(300);
      assertThat(seed.borrowRate()).isEqualTo(500);

      assertThat(properties.simulation().enabled()).isTrue();
      assertThat(properties.simulation().balances().get(0).amount())
          .isEqualTo(new BigInteger("1000000000000000000000"));
    });
  }

  @Test
  void defaultsApplyWhenNothingIsConfigured() {
    runner.run(context -> {
      LedgerProperties properties = context.getBean(LedgerProperties.class);

      assertThat(properties.owner()).isEqualTo(LedgerProperties.DEFAULT_OWNER);
      assertThat(properties.risk()).isEqualTo(LedgerProperties.Risk.defaults());
      assertThat(properties.risk().liquidationThresholdBps()).isEqualTo(8_000);
      assertThat(properties.risk().liquidationPenaltyBps()).isEqualTo(500);
      assertThat(properties.markets()).isEmpty();
      assertThat(properties.simulation().balances()).isEmpty();
      assertThat(properties.simulation().custodian()).isEqualTo(LedgerProperties.Simulation.DEFAULT_CUSTODIAN);
    });
  }

  @Test
  void rejectsCollateralFactorCapAboveOneHundredPercent() {
    runner.withPropertyValues("ledger.risk.max-collateral-factor-bps=20000")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration(proxyBeanMethods=false)
  @EnableConfigurationProperties(LedgerProperties.class)
  static class TestConfig {
  }
}
