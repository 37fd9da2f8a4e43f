package com.vaultlend.ledger.service.web;

import com.vaultlend.ledger.config.LedgerProperties;
import com.vaultlend.ledger.events.InMemoryLedgerEventLog;
import com.vaultlend.ledger.pool.LendingPool;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.core.env.Environment;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
public class LedgerStatusController {

  private final @NonNull LedgerProperties properties;
  private final @NonNull Environment environment;
  private final @NonNull LendingPool pool;
  private final @NonNull InMemoryLedgerEventLog eventLog;

  @GetMapping("/status")
  public ResponseEntity<LedgerStatusResponse> status() {
    LedgerProperties.Risk risk = properties.risk();
    return ResponseEntity.ok(new LedgerStatusResponse(
        environment.getActiveProfiles(),
        pool.owner(),
        pool.isPaused(),
        risk.liquidationThresholdBps(),
        risk.liquidationPenaltyBps(),
        pool.supportedAssets(),
        eventLog.size(),
        properties.simulation().enabled()
    ));
  }

  public record LedgerStatusResponse(
      String[] activeProfiles,
      String owner,
      boolean paused,
      int liquidationThresholdBps,
      int liquidationPenaltyBps,
      List<String> supportedAssets,
      int eventCount,
      boolean simulationEnabled
  ) {
  }
}
