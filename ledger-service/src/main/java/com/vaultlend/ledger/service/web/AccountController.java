package com.vaultlend.ledger.service.web;

import com.vaultlend.ledger.domain.AccountSnapshot;
import com.vaultlend.ledger.pool.LendingPool;
import com.vaultlend.ledger.risk.CollateralizationCalculator;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;

/**
 * Read-only account views.
 */
@RestController
@RequestMapping("/api/ledger/accounts/{account}")
@RequiredArgsConstructor
public class AccountController {

  private final @NonNull LendingPool pool;

  @GetMapping
  public ResponseEntity<AccountSnapshot> snapshot(@PathVariable String account) {
    return ResponseEntity.ok(pool.accountSnapshot(account));
  }

  @GetMapping("/ratio")
  public ResponseEntity<RatioResponse> ratio(@PathVariable String account) {
    BigInteger ratio = pool.collateralizationRatio(account);
    return ResponseEntity.ok(new RatioResponse(
        ratio,
        CollateralizationCalculator.isInfinite(ratio),
        pool.isLiquidatable(account)
    ));
  }

  @GetMapping("/nonce")
  public ResponseEntity<NonceResponse> nonce(@PathVariable String account) {
    return ResponseEntity.ok(new NonceResponse(pool.nonce(account)));
  }

  @GetMapping("/can-withdraw")
  public ResponseEntity<CheckResponse> canWithdraw(
      @PathVariable String account,
      @RequestParam String asset,
      @RequestParam BigInteger amount
  ) {
    return ResponseEntity.ok(new CheckResponse(pool.canWithdraw(account, asset, amount)));
  }

  @GetMapping("/can-borrow")
  public ResponseEntity<CheckResponse> canBorrow(
      @PathVariable String account,
      @RequestParam String asset,
      @RequestParam BigInteger amount
  ) {
    return ResponseEntity.ok(new CheckResponse(pool.canBorrow(account, asset, amount)));
  }

  public record RatioResponse(BigInteger collateralizationRatio, boolean infinite, boolean liquidatable) {
  }

  public record NonceResponse(BigInteger nonce) {
  }

  public record CheckResponse(boolean allowed) {
  }
}
