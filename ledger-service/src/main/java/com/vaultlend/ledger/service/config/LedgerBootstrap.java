package com.vaultlend.ledger.service.config;

import com.vaultlend.ledger.config.LedgerProperties;
import com.vaultlend.ledger.custody.InMemoryAssetCustody;
import com.vaultlend.ledger.domain.Addresses;
import com.vaultlend.ledger.pool.LendingPool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

/**
 * Opens the configured markets as the owner and credits the simulation seed balances.
 *
 * A bad market seed fails startup. The custody book is null when simulation is off.
 */
@Slf4j
public class LedgerBootstrap implements ApplicationRunner {

  private final LedgerProperties properties;
  private final LendingPool pool;
  private final InMemoryAssetCustody custody;

  public LedgerBootstrap(LedgerProperties properties, LendingPool pool, InMemoryAssetCustody custody) {
    this.properties = properties;
    this.pool = pool;
    this.custody = custody;
  }

  @Override
  public void run(ApplicationArguments args) {
    for (LedgerProperties.MarketSeed seed : properties.markets()) {
      pool.addMarket(pool.owner(), seed.asset(), seed.collateralFactor(), seed.supplyRate(), seed.borrowRate());
    }
    log.info("markets bootstrapped (count={})", properties.markets().size());
    LedgerProperties.Simulation simulation = properties.simulation();
    if (!simulation.enabled() || custody == null) {
      return;
    }
    for (LedgerProperties.SeedBalance balance : simulation.balances()) {
      custody.credit(Addresses.normalize(balance.holder()), Addresses.normalize(balance.asset()), balance.amount());
    }
    log.info("simulation balances seeded (count={})", simulation.balances().size());
  }
}
