package com.vaultlend.ledger.service.web;

import com.vaultlend.ledger.events.InMemoryLedgerEventLog;
import com.vaultlend.ledger.events.LedgerEvent;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/ledger/events")
@RequiredArgsConstructor
public class EventController {

  private static final int MAX_LIMIT = 500;

  private final @NonNull InMemoryLedgerEventLog eventLog;

  @GetMapping
  public ResponseEntity<EventPage> events(
      @RequestParam(name = "offset", defaultValue = "0") int offset,
      @RequestParam(name = "limit", defaultValue = "100") int limit
  ) {
    List<EventEnvelope> page = eventLog.page(offset, Math.min(limit, MAX_LIMIT)).stream()
        .map(EventEnvelope::of)
        .toList();
    return ResponseEntity.ok(new EventPage(eventLog.size(), Math.max(0, offset), page));
  }

  public record EventPage(int total, int offset, List<EventEnvelope> events) {
  }

  public record EventEnvelope(String type, LedgerEvent payload) {

    static EventEnvelope of(LedgerEvent event) {
      return new EventEnvelope(event.type(), event);
    }
  }
}
