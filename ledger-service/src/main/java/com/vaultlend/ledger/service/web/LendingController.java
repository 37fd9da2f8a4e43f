package com.vaultlend.ledger.service.web;

import com.vaultlend.ledger.auth.SignedAuthorization;
import com.vaultlend.ledger.domain.AccountSnapshot;
import com.vaultlend.ledger.liquidation.LiquidationResult;
import com.vaultlend.ledger.pool.LendingPool;
import com.vaultlend.ledger.service.web.LedgerRequests.AmountRequest;
import com.vaultlend.ledger.service.web.LedgerRequests.LiquidateRequest;
import com.vaultlend.ledger.service.web.LedgerRequests.SignedDepositRequest;
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

/**
 * Account operations. The acting account is taken from the {@value #ACCOUNT_HEADER} header; each
 * call answers with the caller's snapshot after the operation.
 */
@RestController
@RequestMapping("/api/ledger")
@Validated
@RequiredArgsConstructor
public class LendingController {

  public static final String ACCOUNT_HEADER = "X-Account";

  private final @NonNull LendingPool pool;

  @PostMapping("/deposit")
  public ResponseEntity<AccountSnapshot> deposit(
      @RequestHeader(ACCOUNT_HEADER) String caller,
      @Valid @RequestBody AmountRequest request
  ) {
    pool.deposit(caller, request.asset(), request.amount());
    return ResponseEntity.ok(pool.accountSnapshot(caller));
  }

  @PostMapping("/deposit/signed")
  public ResponseEntity<AccountSnapshot> depositWithSignature(
      @RequestHeader(ACCOUNT_HEADER) String caller,
      @Valid @RequestBody SignedDepositRequest request
  ) {
    SignedAuthorization authorization = new SignedAuthorization(request.nonce(), request.deadline(), request.signature());
    pool.depositWithSignature(caller, request.asset(), request.amount(), authorization);
    return ResponseEntity.ok(pool.accountSnapshot(caller));
  }

  @PostMapping("/withdraw")
  public ResponseEntity<AccountSnapshot> withdraw(
      @RequestHeader(ACCOUNT_HEADER) String caller,
      @Valid @RequestBody AmountRequest request
  ) {
    pool.withdraw(caller, request.asset(), request.amount());
    return ResponseEntity.ok(pool.accountSnapshot(caller));
  }

  @PostMapping("/borrow")
  public ResponseEntity<AccountSnapshot> borrow(
      @RequestHeader(ACCOUNT_HEADER) String caller,
      @Valid @RequestBody AmountRequest request
  ) {
    pool.borrow(caller, request.asset(), request.amount());
    return ResponseEntity.ok(pool.accountSnapshot(caller));
  }

  @PostMapping("/repay")
  public ResponseEntity<AccountSnapshot> repay(
      @RequestHeader(ACCOUNT_HEADER) String caller,
      @Valid @RequestBody AmountRequest request
  ) {
    pool.repay(caller, request.asset(), request.amount());
    return ResponseEntity.ok(pool.accountSnapshot(caller));
  }

  @PostMapping("/liquidate")
  public ResponseEntity<LiquidationResult> liquidate(
      @RequestHeader(ACCOUNT_HEADER) String caller,
      @Valid @RequestBody LiquidateRequest request
  ) {
    return ResponseEntity.ok(pool.liquidate(caller, request.account(), request.asset(), request.amount()));
  }
}
