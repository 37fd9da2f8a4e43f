package com.vaultlend.ledger.service.config;

import com.vaultlend.ledger.config.LedgerProperties;
import com.vaultlend.ledger.custody.AssetCustody;
import com.vaultlend.ledger.custody.InMemoryAssetCustody;
import com.vaultlend.ledger.domain.Addresses;
import com.vaultlend.ledger.events.InMemoryLedgerEventLog;
import com.vaultlend.ledger.policy.PauseSwitch;
import com.vaultlend.ledger.policy.SingleOwnerAccessPolicy;
import com.vaultlend.ledger.pool.LendingPool;
import com.vaultlend.ledger.service.metrics.MeteredLedgerEventPublisher;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires one lending pool. Custody is the in-memory book while {@code ledger.simulation.enabled} is on;
 * with simulation off the host registers its own {@link AssetCustody} bean.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
public class LedgerConfiguration {

  @Bean
  public Clock ledgerClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnProperty(prefix = "ledger.simulation", name = "enabled", havingValue = "true", matchIfMissing = true)
  public InMemoryAssetCustody assetCustody(LedgerProperties properties) {
    String custodian = Addresses.normalize(properties.simulation().custodian());
    log.info("in-memory custody book (custodian={})", custodian);
    return new InMemoryAssetCustody(custodian);
  }

  @Bean
  public SingleOwnerAccessPolicy accessPolicy(LedgerProperties properties) {
    return new SingleOwnerAccessPolicy(properties.owner());
  }

  @Bean
  public PauseSwitch pauseSwitch() {
    return new PauseSwitch();
  }

  @Bean
  public InMemoryLedgerEventLog ledgerEventLog() {
    return new InMemoryLedgerEventLog();
  }

  @Bean
  public LendingPool lendingPool(
      LedgerProperties properties,
      ObjectProvider<AssetCustody> custodyProvider,
      SingleOwnerAccessPolicy accessPolicy,
      PauseSwitch pauseSwitch,
      InMemoryLedgerEventLog eventLog,
      MeterRegistry meterRegistry,
      Clock clock
  ) {
    AssetCustody custody = custodyProvider.getIfUnique();
    if (custody == null) {
      throw new IllegalStateException(
          "no unique AssetCustody bean; register one or set ledger.simulation.enabled=true");
    }
    LedgerProperties.Risk risk = properties.risk();
    log.info("lending pool configured (owner={}, custody={}, liquidationThresholdBps={}, liquidationPenaltyBps={})",
        accessPolicy.owner(), custody.getClass().getSimpleName(),
        risk.liquidationThresholdBps(), risk.liquidationPenaltyBps());
    return new LendingPool(
        risk,
        custody,
        accessPolicy,
        pauseSwitch,
        pauseSwitch,
        new MeteredLedgerEventPublisher(eventLog, meterRegistry),
        clock
    );
  }

  @Bean
  public LedgerBootstrap ledgerBootstrap(
      LedgerProperties properties,
      LendingPool pool,
      ObjectProvider<InMemoryAssetCustody> custodyBook
  ) {
    return new LedgerBootstrap(properties, pool, custodyBook.getIfAvailable());
  }
}
