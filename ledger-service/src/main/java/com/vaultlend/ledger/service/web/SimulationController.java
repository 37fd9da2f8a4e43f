package com.vaultlend.ledger.service.web;

import com.vaultlend.ledger.custody.InMemoryAssetCustody;
import com.vaultlend.ledger.domain.Addresses;
import com.vaultlend.ledger.service.web.LedgerRequests.CreditRequest;
import jakarta.validation.Valid;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.Map;

/**
 * Balance book of the simulated custody: wallet balances outside the pool and a faucet.
 */
@Slf4j
@RestController
@RequestMapping("/api/ledger/sim")
@Validated
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "ledger.simulation", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SimulationController {

  private final @NonNull InMemoryAssetCustody custody;

  @GetMapping("/balances/{holder}")
  public ResponseEntity<Map<String, BigInteger>> balances(@PathVariable String holder) {
    return ResponseEntity.ok(custody.balancesOf(Addresses.normalize(holder)));
  }

  @GetMapping("/custody")
  public ResponseEntity<Map<String, BigInteger>> custodyBalances() {
    return ResponseEntity.ok(custody.balancesOf(custody.custodian()));
  }

  @PostMapping("/credit")
  public ResponseEntity<Map<String, BigInteger>> credit(@Valid @RequestBody CreditRequest request) {
    String holder = Addresses.normalize(request.holder());
    custody.credit(holder, Addresses.normalize(request.asset()), request.amount());
    log.info("sim credit (holder={}, asset={}, amount={})", holder, request.asset(), request.amount());
    return ResponseEntity.ok(custody.balancesOf(holder));
  }
}
