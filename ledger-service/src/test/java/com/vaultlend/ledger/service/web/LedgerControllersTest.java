package com.vaultlend.ledger.service.web;

import com.vaultlend.ledger.config.LedgerProperties;
import com.vaultlend.ledger.custody.InMemoryAssetCustody;
import com.vaultlend.ledger.events.InMemoryLedgerEventLog;
import com.vaultlend.ledger.policy.PauseSwitch;
import com.vaultlend.ledger.policy.SingleOwnerAccessPolicy;
import com.vaultlend.ledger.pool.LendingPool;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.mock.env.MockEnvironment;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class LedgerControllersTest {

  private static final String OWNER = "0x00000000000000000000000000000000000000aa";
  private static final String CUSTODIAN = "0x00000000000000000000000000000000000000cc";
  private static final String ALICE = "0x00000000000000000000000000000000000000a1";
  private static final String BOB = "0x00000000000000000000000000000000000000b2";
  private static final String USDC = "0x0000000000000000000000000000000000001001";
  private static final String WETH = "0x0000000000000000000000000000000000001002";

  private InMemoryAssetCustody custody;
  private InMemoryLedgerEventLog eventLog;
  private SimpleMeterRegistry meterRegistry;
  private LendingPool pool;
  private MockMvc mvc;

  @BeforeEach
  void setUp() {
    custody = new InMemoryAssetCustody(CUSTODIAN);
    eventLog = new InMemoryLedgerEventLog();
    meterRegistry = new SimpleMeterRegistry();
    PauseSwitch pauseSwitch = new PauseSwitch();
    pool = new LendingPool(
        LedgerProperties.Risk.defaults(),
        custody,
        new SingleOwnerAccessPolicy(OWNER),
        pauseSwitch,
        pauseSwitch,
        eventLog,
        Clock.fixed(Instant.parse("2024-01-15T10:00:00Z"), ZoneId.of("UTC"))
    );
    pool.addMarket(OWNER, USDC, 8_000, 300, 500);
    pool.addMarket(OWNER, WETH, 7_500, 200, 400);
    custody.credit(ALICE, USDC, BigInteger.valueOf(10_000));
    custody.credit(BOB, WETH, BigInteger.valueOf(10_000));

    LedgerProperties properties = new LedgerProperties(OWNER, null, List.of(), null);
    mvc = MockMvcBuilders.standaloneSetup(
            new LendingController(pool),
            new MarketController(pool),
            new AccountController(pool),
            new AdminController(pool),
            new EventController(eventLog),
            new SimulationController(custody),
            new LedgerStatusController(properties, new MockEnvironment(), pool, eventLog)
        )
        .setControllerAdvice(new LedgerExceptionHandler(meterRegistry))
        .build();
  }

  @Test
  void depositReturnsUpdatedSnapshot() throws Exception {
    mvc.perform(post("/api/ledger/deposit")
            .header(LendingController.ACCOUNT_HEADER, ALICE)
            .contentType(MediaType.APPLICATION_JSON)
            .content(amount(USDC, 1_000)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.account").value(ALICE))
        .andExpect(jsonPath("$.position.totalDeposited").value(1_000))
        .andExpect(jsonPath("$.position.active").value(true))
        .andExpect(jsonPath("$.ratioInfinite").value(true));

    assertThat(custody.balanceOf(ALICE, USDC)).isEqualTo(BigInteger.valueOf(9_000));
    assertThat(custody.custodyBalance(USDC)).isEqualTo(BigInteger.valueOf(1_000));
  }

  @Test
  void borrowAgainstCollateralAndReadRatio() throws Exception {
    pool.deposit(ALICE, USDC, BigInteger.valueOf(1_000));
    pool.deposit(BOB, WETH, BigInteger.valueOf(5_000));

    mvc.perform(post("/api/ledger/borrow")
            .header(LendingController.ACCOUNT_HEADER, ALICE)
            .contentType(MediaType.APPLICATION_JSON)
            .content(amount(WETH, 500)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.position.totalBorrowed").value(500));

    mvc.perform(get("/api/ledger/accounts/{account}/ratio", ALICE))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.collateralizationRatio").value(16_000))
        .andExpect(jsonPath("$.infinite").value(false))
        .andExpect(jsonPath("$.liquidatable").value(false));

    mvc.perform(get("/api/ledger/accounts/{account}/can-borrow", ALICE)
            .param("asset", WETH)
            .param("amount", "501"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.allowed").value(false));
  }

  @Test
  void unsafeWithdrawalMapsToUnprocessableEntity() throws Exception {
    pool.deposit(ALICE, USDC, BigInteger.valueOf(1_000));
    pool.deposit(BOB, WETH, BigInteger.valueOf(5_000));
    pool.borrow(ALICE, WETH, BigInteger.valueOf(800));

    mvc.perform(post("/api/ledger/withdraw")
            .header(LendingController.ACCOUNT_HEADER, ALICE)
            .contentType(MediaType.APPLICATION_JSON)
            .content(amount(USDC, 300)))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("UNSAFE_WITHDRAWAL"));

    assertThat(meterRegistry.counter(LedgerExceptionHandler.REJECTIONS_METER, "code", "UNSAFE_WITHDRAWAL").count())
        .isEqualTo(1.0);
  }

  @Test
  void invalidAmountMapsToBadRequest() throws Exception {
    mvc.perform(post("/api/ledger/deposit")
            .header(LendingController.ACCOUNT_HEADER, ALICE)
            .contentType(MediaType.APPLICATION_JSON)
            .content(amount(USDC, 0)))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("INVALID_AMOUNT"));
  }

  @Test
  void missingAccountHeaderIsBadRequest() throws Exception {
    mvc.perform(post("/api/ledger/deposit")
            .contentType(MediaType.APPLICATION_JSON)
            .content(amount(USDC, 10)))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
  }

  @Test
  void malformedAccountIsBadRequest() throws Exception {
    mvc.perform(get("/api/ledger/accounts/{account}", "alice"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("INVALID_ACCOUNT"));
  }

  @Test
  void transferFailureMapsToUnprocessableEntity() throws Exception {
    mvc.perform(post("/api/ledger/deposit")
            .header(LendingController.ACCOUNT_HEADER, BOB)
            .contentType(MediaType.APPLICATION_JSON)
            .content(amount(USDC, 10)))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("TRANSFER_FAILED"));
  }

  @Test
  void marketAdministrationIsOwnerOnly() throws Exception {
    String body = "{\"asset\":\"0x0000000000000000000000000000000000001003\","
        + "\"collateralFactor\":6000,\"supplyRate\":100,\"borrowRate\":300}";

    mvc.perform(post("/api/ledger/markets")
            .header(LendingController.ACCOUNT_HEADER, ALICE)
            .contentType(MediaType.APPLICATION_JSON)
            .content(body))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));

    mvc.perform(post("/api/ledger/markets")
            .header(LendingController.ACCOUNT_HEADER, OWNER)
            .contentType(MediaType.APPLICATION_JSON)
            .content(body))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.collateralFactor").value(6_000))
        .andExpect(jsonPath("$.active").value(true));

    mvc.perform(get("/api/ledger/markets/assets"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(3))
        .andExpect(jsonPath("$[2]").value("0x0000000000000000000000000000000000001003"));
  }

  @Test
  void updateMarketAndRejectDuplicate() throws Exception {
    mvc.perform(put("/api/ledger/markets/{asset}", WETH)
            .header(LendingController.ACCOUNT_HEADER, OWNER)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"collateralFactor\":5000,\"supplyRate\":250,\"borrowRate\":450}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.collateralFactor").value(5_000))
        .andExpect(jsonPath("$.borrowRate").value(450));

    mvc.perform(post("/api/ledger/markets")
            .header(LendingController.ACCOUNT_HEADER, OWNER)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"asset\":\"" + USDC + "\",\"collateralFactor\":6000,\"supplyRate\":0,\"borrowRate\":0}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("MARKET_EXISTS"));
  }

  @Test
  void unknownMarketIsNotFound() throws Exception {
    mvc.perform(get("/api/ledger/markets/{asset}", "0x0000000000000000000000000000000000009999"))
        .andExpect(status().isNotFound());
  }

  @Test
  void pausedPoolRejectsOperationsWithLocked() throws Exception {
    mvc.perform(post("/api/ledger/admin/pause").header(LendingController.ACCOUNT_HEADER, OWNER))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.paused").value(true));

    mvc.perform(post("/api/ledger/deposit")
            .header(LendingController.ACCOUNT_HEADER, ALICE)
            .contentType(MediaType.APPLICATION_JSON)
            .content(amount(USDC, 10)))
        .andExpect(status().isLocked())
        .andExpect(jsonPath("$.code").value("PROTOCOL_PAUSED"));

    mvc.perform(post("/api/ledger/admin/unpause").header(LendingController.ACCOUNT_HEADER, OWNER))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.paused").value(false));

    mvc.perform(post("/api/ledger/admin/unpause").header(LendingController.ACCOUNT_HEADER, OWNER))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("ILLEGAL_STATE"));
  }

  @Test
  void liquidationEndpointReturnsResult() throws Exception {
    pool.deposit(ALICE, USDC, BigInteger.valueOf(1_000));
    pool.deposit(BOB, WETH, BigInteger.valueOf(5_000));
    pool.borrow(ALICE, WETH, BigInteger.valueOf(900));
    pool.updateMarket(OWNER, USDC, 3_000, 0, 0);
    custody.credit(BOB, WETH, BigInteger.valueOf(900));

    mvc.perform(post("/api/ledger/liquidate")
            .header(LendingController.ACCOUNT_HEADER, BOB)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"account\":\"" + ALICE + "\",\"asset\":\"" + WETH + "\",\"amount\":900}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.collateralAsset").value(USDC))
        .andExpect(jsonPath("$.repaidAmount").value(900))
        .andExpect(jsonPath("$.seizedAmount").value(945));

    assertThat(custody.balanceOf(BOB, USDC)).isEqualTo(BigInteger.valueOf(945));
  }

  @Test
  void eventsArePagedWithTypes() throws Exception {
    pool.deposit(ALICE, USDC, BigInteger.valueOf(10));

    // two market additions from setUp, then the deposit
    mvc.perform(get("/api/ledger/events").param("offset", "2").param("limit", "10"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(3))
        .andExpect(jsonPath("$.events.length()").value(1))
        .andExpect(jsonPath("$.events[0].type").value("ledger.deposit"))
        .andExpect(jsonPath("$.events[0].payload.amount").value(10))
        .andExpect(jsonPath("$.events[0].payload.signed").value(false));
  }

  @Test
  void simulationCreditAndBalances() throws Exception {
    mvc.perform(post("/api/ledger/sim/credit")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"holder\":\"" + ALICE + "\",\"asset\":\"" + WETH + "\",\"amount\":42}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$['" + WETH + "']").value(42));

    mvc.perform(get("/api/ledger/sim/balances/{holder}", ALICE))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$['" + USDC + "']").value(10_000));
  }

  @Test
  void statusReportsPoolState() throws Exception {
    mvc.perform(get("/api/ledger/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.owner").value(OWNER))
        .andExpect(jsonPath("$.paused").value(false))
        .andExpect(jsonPath("$.liquidationThresholdBps").value(8_000))
        .andExpect(jsonPath("$.supportedAssets.length()").value(2))
        .andExpect(jsonPath("$.eventCount").value(2))
        .andExpect(jsonPath("$.simulationEnabled").value(true));
  }

  @Test
  void nonceStartsAtZero() throws Exception {
    mvc.perform(get("/api/ledger/accounts/{account}/nonce", ALICE))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.nonce").value(0));
  }

  private static String amount(String asset, long amount) {
    return "{\"asset\":\"" + asset + "\",\"amount\":" + amount + "}";
  }
}
