package com.vaultlend.ledger.pool;

import com.vaultlend.ledger.auth.SignedAuthorization;
import com.vaultlend.ledger.auth.SignedAuthorizationVerifier;
import com.vaultlend.ledger.config.LedgerProperties;
import com.vaultlend.ledger.custody.AssetCustody;
import com.vaultlend.ledger.domain.AccountSnapshot;
import com.vaultlend.ledger.domain.Addresses;
import com.vaultlend.ledger.domain.Market;
import com.vaultlend.ledger.domain.UserPosition;
import com.vaultlend.ledger.error.LedgerError;
import com.vaultlend.ledger.error.LedgerException;
import com.vaultlend.ledger.events.LedgerEvent;
import com.vaultlend.ledger.events.LedgerEventPublisher;
import com.vaultlend.ledger.events.payload.AssetRecoveredEvent;
import com.vaultlend.ledger.events.payload.BorrowEvent;
import com.vaultlend.ledger.events.payload.DepositEvent;
import com.vaultlend.ledger.events.payload.LiquidateEvent;
import com.vaultlend.ledger.events.payload.MarketAddedEvent;
import com.vaultlend.ledger.events.payload.MarketUpdatedEvent;
import com.vaultlend.ledger.events.payload.PausedEvent;
import com.vaultlend.ledger.events.payload.RatesUpdatedEvent;
import com.vaultlend.ledger.events.payload.RepayEvent;
import com.vaultlend.ledger.events.payload.UnpausedEvent;
import com.vaultlend.ledger.events.payload.WithdrawEvent;
import com.vaultlend.ledger.liquidation.LiquidationEngine;
import com.vaultlend.ledger.liquidation.LiquidationResult;
import com.vaultlend.ledger.math.Uint256Math;
import com.vaultlend.ledger.policy.AccessPolicy;
import com.vaultlend.ledger.policy.PausePolicy;
import com.vaultlend.ledger.policy.PauseToggle;
import com.vaultlend.ledger.position.PositionLedger;
import com.vaultlend.ledger.registry.MarketRegistry;
import com.vaultlend.ledger.risk.CollateralizationCalculator;
import com.vaultlend.ledger.state.LedgerState;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Entry points of the lending pool: deposit, withdraw, borrow, repay, liquidate, signed deposit,
 * market administration and read-only queries.
 *
 * Execution model:
 * - every entry point runs under one lock, so operations are totally ordered
 * - a mutating entry point is one atomic unit; any exception rolls back every write it made
 * - events are buffered and published only after the unit commits
 * - a mutating entry point reached again from inside another (e.g. from a custody callback) is rejected
 */
@Slf4j
public class LendingPool {

  private final LedgerState state;
  private final MarketRegistry registry;
  private final PositionLedger ledger;
  private final CollateralizationCalculator calculator;
  private final LiquidationEngine liquidationEngine;
  private final SignedAuthorizationVerifier verifier;
  private final AssetCustody custody;
  private final AccessPolicy access;
  private final PausePolicy pausePolicy;
  private final PauseToggle pauseToggle;
  private final LedgerEventPublisher events;
  private final Clock clock;

  private final ReentrantLock lock = new ReentrantLock();
  private boolean entered;

  public LendingPool(
      @NonNull LedgerProperties.Risk risk,
      @NonNull AssetCustody custody,
      @NonNull AccessPolicy access,
      @NonNull PausePolicy pausePolicy,
      @NonNull PauseToggle pauseToggle,
      @NonNull LedgerEventPublisher events,
      @NonNull Clock clock
  ) {
    this.state = new LedgerState();
    this.registry = new MarketRegistry(state, risk);
    this.ledger = new PositionLedger(state, registry);
    this.calculator = new CollateralizationCalculator(registry, ledger, risk);
    this.liquidationEngine = new LiquidationEngine(registry, ledger, calculator, custody, risk);
    this.verifier = new SignedAuthorizationVerifier();
    this.custody = custody;
    this.access = access;
    this.pausePolicy = pausePolicy;
    this.pauseToggle = pauseToggle;
    this.events = events;
    this.clock = clock;
  }

  // ---------------------------------------------------------------------------------------------
  // market administration

  public Market addMarket(String caller, String asset, int collateralFactor, int supplyRate, int borrowRate) {
    return execute(pending -> {
      access.requireOwner(caller);
      String assetId = requireAsset(asset);
      Instant now = clock.instant();
      Market market = registry.addMarket(assetId, collateralFactor, supplyRate, borrowRate, now);
      pending.add(new MarketAddedEvent(assetId, collateralFactor, supplyRate, borrowRate, now));
      return market;
    });
  }

  public Market updateMarket(String caller, String asset, int collateralFactor, int supplyRate, int borrowRate) {
    return execute(pending -> {
      access.requireOwner(caller);
      String assetId = requireAsset(asset);
      Instant now = clock.instant();
      Market market = registry.updateMarket(assetId, collateralFactor, supplyRate, borrowRate);
      pending.add(new MarketUpdatedEvent(assetId, collateralFactor, now));
      pending.add(new RatesUpdatedEvent(assetId, supplyRate, borrowRate, now));
      return market;
    });
  }

  public void pause(String caller) {
    execute(pending -> {
      access.requireOwner(caller);
      if (!pauseToggle.set(true)) {
        throw new LedgerException(LedgerError.PROTOCOL_PAUSED, "protocol is already paused");
      }
      log.warn("protocol paused by {}", caller);
      pending.add(new PausedEvent(Addresses.normalize(caller), clock.instant()));
      return null;
    });
  }

  public void unpause(String caller) {
    execute(pending -> {
      access.requireOwner(caller);
      if (!pauseToggle.set(false)) {
        throw new IllegalStateException("protocol is not paused");
      }
      log.warn("protocol unpaused by {}", caller);
      pending.add(new UnpausedEvent(Addresses.normalize(caller), clock.instant()));
      return null;
    });
  }

  /**
   * Owner-only transfer out of custody that bypasses the ledger. Works while paused.
   */
  public void recoverAsset(String caller, String asset, String to, BigInteger amount) {
    execute(pending -> {
      access.requireOwner(caller);
      String assetId = requireAsset(asset);
      String recipient = Addresses.normalize(to);
      requireAmount(amount);
      custody.push(assetId, recipient, amount);
      log.warn("asset recovered (asset={}, to={}, amount={})", assetId, recipient, amount);
      pending.add(new AssetRecoveredEvent(assetId, recipient, amount, clock.instant()));
      return null;
    });
  }

  // ---------------------------------------------------------------------------------------------
  // operation handlers

  public void deposit(String caller, String asset, BigInteger amount) {
    execute(pending -> {
      pausePolicy.requireUnpaused();
      doDeposit(Addresses.normalize(caller), requireAsset(asset), amount, false, pending);
      return null;
    });
  }

  /**
   * Deposit authorized by an off-chain signature of the submitting account. The account's nonce
   * advances only if the whole deposit succeeds.
   */
  public void depositWithSignature(String caller, String asset, BigInteger amount, SignedAuthorization authorization) {
    execute(pending -> {
      pausePolicy.requireUnpaused();
      String account = Addresses.normalize(caller);
      String assetId = requireAsset(asset);
      requireAmount(amount);
      verifier.verify(account, assetId, amount, authorization, ledger.nonce(account), clock.instant());
      doDeposit(account, assetId, amount, true, pending);
      ledger.incrementNonce(account);
      return null;
    });
  }

  public void withdraw(String caller, String asset, BigInteger amount) {
    execute(pending -> {
      pausePolicy.requireUnpaused();
      String account = Addresses.normalize(caller);
      String assetId = requireAsset(asset);
      registry.requireActive(assetId);
      requireAmount(amount);
      BigInteger deposited = ledger.deposit(account, assetId);
      if (deposited.compareTo(amount) < 0) {
        throw LedgerException.of(LedgerError.INSUFFICIENT_DEPOSIT,
            "deposit of %s in %s is %s, requested %s", account, assetId, deposited, amount);
      }
      if (!calculator.canWithdraw(account, assetId, amount)) {
        throw LedgerException.of(LedgerError.UNSAFE_WITHDRAWAL,
            "withdrawing %s %s leaves %s under-collateralized", amount, assetId, account);
      }
      Instant now = clock.instant();
      ledger.debitDeposit(account, assetId, amount, now);
      custody.push(assetId, account, amount);
      log.debug("withdraw (account={}, asset={}, amount={})", account, assetId, amount);
      pending.add(new WithdrawEvent(account, assetId, amount, now));
      return null;
    });
  }

  public void borrow(String caller, String asset, BigInteger amount) {
    execute(pending -> {
      pausePolicy.requireUnpaused();
      String account = Addresses.normalize(caller);
      String assetId = requireAsset(asset);
      Market market = registry.requireActive(assetId);
      requireAmount(amount);
      if (market.totalSupply().compareTo(amount) < 0) {
        throw LedgerException.of(LedgerError.INSUFFICIENT_LIQUIDITY,
            "market %s supplies %s, requested %s", assetId, market.totalSupply(), amount);
      }
      if (!calculator.canBorrow(account, assetId, amount)) {
        throw LedgerException.of(LedgerError.UNSAFE_BORROW,
            "borrowing %s %s leaves %s under-collateralized", amount, assetId, account);
      }
      Instant now = clock.instant();
      ledger.creditBorrow(account, assetId, amount, now);
      custody.push(assetId, account, amount);
      log.debug("borrow (account={}, asset={}, amount={})", account, assetId, amount);
      pending.add(new BorrowEvent(account, assetId, amount, now));
      return null;
    });
  }

  public void repay(String caller, String asset, BigInteger amount) {
    execute(pending -> {
      pausePolicy.requireUnpaused();
      String account = Addresses.normalize(caller);
      String assetId = requireAsset(asset);
      registry.requireActive(assetId);
      requireAmount(amount);
      BigInteger borrowed = ledger.borrow(account, assetId);
      if (borrowed.compareTo(amount) < 0) {
        throw LedgerException.of(LedgerError.INSUFFICIENT_BORROW,
            "borrow of %s in %s is %s, repaying %s", account, assetId, borrowed, amount);
      }
      Instant now = clock.instant();
      custody.pull(assetId, account, amount);
      ledger.debitBorrow(account, assetId, amount, now);
      log.debug("repay (account={}, asset={}, amount={})", account, assetId, amount);
      pending.add(new RepayEvent(account, assetId, amount, now));
      return null;
    });
  }

  public LiquidationResult liquidate(String caller, String account, String asset, BigInteger amount) {
    return execute(pending -> {
      pausePolicy.requireUnpaused();
      String liquidator = Addresses.normalize(caller);
      String target = Addresses.normalize(account);
      String assetId = requireAsset(asset);
      Instant now = clock.instant();
      LiquidationResult result = liquidationEngine.liquidate(liquidator, target, assetId, amount, now);
      pending.add(new LiquidateEvent(liquidator, target, assetId, result.repaidAmount(),
          result.collateralAsset(), result.seizedAmount(), now));
      return result;
    });
  }

  private void doDeposit(String account, String asset, BigInteger amount, boolean signed, List<LedgerEvent> pending) {
    registry.requireActive(asset);
    requireAmount(amount);
    Instant now = clock.instant();
    custody.pull(asset, account, amount);
    ledger.creditDeposit(account, asset, amount, now);
    log.debug("deposit (account={}, asset={}, amount={}, signed={})", account, asset, amount, signed);
    pending.add(new DepositEvent(account, asset, amount, signed, now));
  }

  // ---------------------------------------------------------------------------------------------
  // queries

  public BigInteger collateralizationRatio(String account) {
    return read(() -> calculator.collateralizationRatio(Addresses.normalize(account)));
  }

  public boolean canWithdraw(String account, String asset, BigInteger amount) {
    requireAmount(amount);
    return read(() -> calculator.canWithdraw(Addresses.normalize(account), requireAsset(asset), amount));
  }

  public boolean canBorrow(String account, String asset, BigInteger amount) {
    requireAmount(amount);
    return read(() -> calculator.canBorrow(Addresses.normalize(account), requireAsset(asset), amount));
  }

  public boolean isLiquidatable(String account) {
    return read(() -> calculator.isLiquidatable(Addresses.normalize(account)));
  }

  public Optional<Market> market(String asset) {
    return read(() -> registry.market(Addresses.normalize(asset)));
  }

  public List<Market> markets() {
    return read(registry::markets);
  }

  public List<String> supportedAssets() {
    return read(registry::supportedAssets);
  }

  public UserPosition user(String account) {
    return read(() -> ledger.user(Addresses.normalize(account)));
  }

  public BigInteger deposit(String account, String asset) {
    return read(() -> ledger.deposit(Addresses.normalize(account), Addresses.normalize(asset)));
  }

  public BigInteger borrow(String account, String asset) {
    return read(() -> ledger.borrow(Addresses.normalize(account), Addresses.normalize(asset)));
  }

  public BigInteger nonce(String account) {
    return read(() -> ledger.nonce(Addresses.normalize(account)));
  }

  public AccountSnapshot accountSnapshot(String account) {
    return read(() -> {
      String id = Addresses.normalize(account);
      BigInteger ratio = calculator.collateralizationRatio(id);
      return new AccountSnapshot(
          id,
          ledger.user(id),
          ledger.depositsOf(id),
          ledger.borrowsOf(id),
          ratio,
          CollateralizationCalculator.isInfinite(ratio),
          calculator.isLiquidatable(id),
          ledger.nonce(id)
      );
    });
  }

  public boolean isPaused() {
    return pausePolicy.isPaused();
  }

  public String owner() {
    return access.owner();
  }

  // ---------------------------------------------------------------------------------------------

  private <T> T execute(Function<List<LedgerEvent>, T> operation) {
    lock.lock();
    try {
      if (entered) {
        throw new LedgerException(LedgerError.REENTRANT_CALL, "ledger operation already in progress");
      }
      entered = true;
      try {
        List<LedgerEvent> pending = new ArrayList<>();
        T result = state.atomically(() -> operation.apply(pending));
        publish(pending);
        return result;
      } finally {
        entered = false;
      }
    } finally {
      lock.unlock();
    }
  }

  private <T> T read(Supplier<T> query) {
    lock.lock();
    try {
      return query.get();
    } finally {
      lock.unlock();
    }
  }

  private void publish(List<LedgerEvent> pending) {
    for (LedgerEvent event : pending) {
      try {
        events.publish(event);
      } catch (RuntimeException e) {
        // the operation has committed; a failing observer must not undo it
        log.warn("event publish failed (type={}): {}", event.type(), e.toString());
      }
    }
  }

  private static String requireAsset(String asset) {
    if (!Addresses.isValid(asset)) {
      throw LedgerException.of(LedgerError.INVALID_ASSET, "malformed asset identifier %s", asset);
    }
    String id = Addresses.normalize(asset);
    if (Addresses.isZero(id)) {
      throw new LedgerException(LedgerError.INVALID_ASSET, "asset is the zero address");
    }
    return id;
  }

  private static void requireAmount(BigInteger amount) {
    if (amount == null || amount.signum() <= 0 || !Uint256Math.inRange(amount)) {
      throw LedgerException.of(LedgerError.INVALID_AMOUNT, "amount must be positive, got %s", amount);
    }
  }
}
