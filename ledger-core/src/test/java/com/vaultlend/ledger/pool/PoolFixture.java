package com.vaultlend.ledger.pool;

import com.vaultlend.ledger.config.LedgerProperties;
import com.vaultlend.ledger.custody.AssetCustody;
import com.vaultlend.ledger.custody.InMemoryAssetCustody;
import com.vaultlend.ledger.events.InMemoryLedgerEventLog;
import com.vaultlend.ledger.policy.PausePolicy;
import com.vaultlend.ledger.policy.PauseSwitch;
import com.vaultlend.ledger.policy.SingleOwnerAccessPolicy;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Shared wiring for pool-level tests: an in-memory custody book, an event log and a fixed clock.
 */
public class PoolFixture {

  public static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

  public static final String OWNER = "0x00000000000000000000000000000000000000aa";
  public static final String CUSTODIAN = "0x00000000000000000000000000000000000000cc";
  public static final String ALICE = "0x00000000000000000000000000000000000000a1";
  public static final String BOB = "0x00000000000000000000000000000000000000b2";
  public static final String CAROL = "0x00000000000000000000000000000000000000c3";

  public static final String USDC = "0x0000000000000000000000000000000000001001";
  public static final String WETH = "0x0000000000000000000000000000000000001002";
  public static final String WBTC = "0x0000000000000000000000000000000000001003";

  public final Clock clock;
  public final InMemoryAssetCustody book = new InMemoryAssetCustody(CUSTODIAN);
  public final InMemoryLedgerEventLog events = new InMemoryLedgerEventLog();
  public final PauseSwitch pauseSwitch = new PauseSwitch();
  public final LendingPool pool;

  public PoolFixture() {
    this(Clock.fixed(NOW, ZoneId.of("UTC")), null);
  }

  public PoolFixture(Clock clock, AssetCustody custody) {
    this(clock, custody, null);
  }

  /**
   * @param pausePolicy gate consulted by the operations; {@link #pauseSwitch} when null
   */
  public PoolFixture(Clock clock, AssetCustody custody, PausePolicy pausePolicy) {
    this.clock = clock;
    this.pool = new LendingPool(
        LedgerProperties.Risk.defaults(),
        custody == null ? book : custody,
        new SingleOwnerAccessPolicy(OWNER),
        pausePolicy == null ? pauseSwitch : pausePolicy,
        pauseSwitch,
        events,
        clock
    );
  }

  public PoolFixture withMarket(String asset, int collateralFactor) {
    pool.addMarket(OWNER, asset, collateralFactor, 300, 500);
    return this;
  }

  public PoolFixture fund(String holder, String asset, long amount) {
    book.credit(holder, asset, BigInteger.valueOf(amount));
    return this;
  }

  public static BigInteger units(long amount) {
    return BigInteger.valueOf(amount);
  }

  /**
   * Market totals equal the per-account sums, and account totals equal their per-asset sums.
   */
  public void assertLedgerConsistent(List<String> accounts) {
    List<String> assets = pool.supportedAssets();
    for (String asset : assets) {
      BigInteger deposits = BigInteger.ZERO;
      BigInteger borrows = BigInteger.ZERO;
      for (String account : accounts) {
        deposits = deposits.add(pool.deposit(account, asset));
        borrows = borrows.add(pool.borrow(account, asset));
      }
      assertThat(pool.market(asset).orElseThrow().totalSupply()).as("totalSupply of %s", asset).isEqualTo(deposits);
      assertThat(pool.market(asset).orElseThrow().totalBorrow()).as("totalBorrow of %s", asset).isEqualTo(borrows);
    }
    for (String account : accounts) {
      BigInteger deposited = BigInteger.ZERO;
      BigInteger borrowed = BigInteger.ZERO;
      for (String asset : assets) {
        deposited = deposited.add(pool.deposit(account, asset));
        borrowed = borrowed.add(pool.borrow(account, asset));
      }
      assertThat(pool.user(account).totalDeposited()).as("totalDeposited of %s", account).isEqualTo(deposited);
      assertThat(pool.user(account).totalBorrowed()).as("totalBorrowed of %s", account).isEqualTo(borrowed);
      assertThat(pool.user(account).active()).isEqualTo(deposited.signum() > 0 || borrowed.signum() > 0);
    }
  }
}
