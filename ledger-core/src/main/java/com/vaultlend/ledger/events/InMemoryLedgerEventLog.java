package com.vaultlend.ledger.events;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only event log kept in memory.
 */
@Slf4j
public class InMemoryLedgerEventLog implements LedgerEventPublisher {

  private final List<LedgerEvent> events = new CopyOnWriteArrayList<>();

  @Override
  public void publish(LedgerEvent event) {
    events.add(event);
    log.debug("event {} {}", event.type(), event);
  }

  public List<LedgerEvent> events() {
    return List.copyOf(events);
  }

  public <T extends LedgerEvent> List<T> eventsOf(Class<T> type) {
    return events.stream().filter(type::isInstance).map(type::cast).toList();
  }

  /**
   * Events after the first {@code offset} entries, at most {@code limit}.
   */
  public List<LedgerEvent> page(int offset, int limit) {
    List<LedgerEvent> snapshot = List.copyOf(events);
    int from = Math.min(Math.max(0, offset), snapshot.size());
    int to = Math.min(snapshot.size(), from + Math.max(0, limit));
    return snapshot.subList(from, to);
  }

  public int size() {
    return events.size();
  }
}
