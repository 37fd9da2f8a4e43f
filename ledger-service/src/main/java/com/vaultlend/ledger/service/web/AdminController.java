package com.vaultlend.ledger.service.web;

import com.vaultlend.ledger.pool.LendingPool;
import com.vaultlend.ledger.service.web.LedgerRequests.RecoverRequest;
import jakarta.validation.Valid;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import static com.vaultlend.ledger.service.web.LendingController.ACCOUNT_HEADER;

@RestController
@RequestMapping("/api/ledger/admin")
@Validated
@RequiredArgsConstructor
public class AdminController {

  private final @NonNull LendingPool pool;

  @PostMapping("/pause")
  public ResponseEntity<PauseResponse> pause(@RequestHeader(ACCOUNT_HEADER) String caller) {
    pool.pause(caller);
    return ResponseEntity.ok(new PauseResponse(pool.isPaused()));
  }

  @PostMapping("/unpause")
  public ResponseEntity<PauseResponse> unpause(@RequestHeader(ACCOUNT_HEADER) String caller) {
    pool.unpause(caller);
    return ResponseEntity.ok(new PauseResponse(pool.isPaused()));
  }

  @PostMapping("/recover")
  public ResponseEntity<Void> recover(
      @RequestHeader(ACCOUNT_HEADER) String caller,
      @Valid @RequestBody RecoverRequest request
  ) {
    pool.recoverAsset(caller, request.asset(), request.to(), request.amount());
    return ResponseEntity.noContent().build();
  }

  public record PauseResponse(boolean paused) {
  }
}
