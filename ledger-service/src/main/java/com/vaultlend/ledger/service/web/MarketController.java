package com.vaultlend.ledger.service.web;

import com.vaultlend.ledger.domain.Market;
import com.vaultlend.ledger.pool.LendingPool;
import com.vaultlend.ledger.service.web.LedgerRequests.MarketParametersRequest;
import com.vaultlend.ledger.service.web.LedgerRequests.MarketRequest;
import jakarta.validation.Valid;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

import static com.vaultlend.ledger.service.web.LendingController.ACCOUNT_HEADER;

@RestController
@RequestMapping("/api/ledger/markets")
@Validated
@RequiredArgsConstructor
public class MarketController {

  private final @NonNull LendingPool pool;

  @GetMapping
  public ResponseEntity<List<Market>> markets() {
    return ResponseEntity.ok(pool.markets());
  }

  @GetMapping("/{asset}")
  public ResponseEntity<Market> market(@PathVariable String asset) {
    return pool.market(asset)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  @GetMapping("/assets")
  public ResponseEntity<List<String>> supportedAssets() {
    return ResponseEntity.ok(pool.supportedAssets());
  }

  @PostMapping
  public ResponseEntity<Market> addMarket(
      @RequestHeader(ACCOUNT_HEADER) String caller,
      @Valid @RequestBody MarketRequest request
  ) {
    Market market = pool.addMarket(caller, request.asset(), request.collateralFactor(),
        request.supplyRate(), request.borrowRate());
    return ResponseEntity.status(HttpStatus.CREATED).body(market);
  }

  @PutMapping("/{asset}")
  public ResponseEntity<Market> updateMarket(
      @RequestHeader(ACCOUNT_HEADER) String caller,
      @PathVariable String asset,
      @Valid @RequestBody MarketParametersRequest request
  ) {
    return ResponseEntity.ok(pool.updateMarket(caller, asset, request.collateralFactor(),
        request.supplyRate(), request.borrowRate()));
  }
}
