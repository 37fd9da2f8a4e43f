package com.vaultlend.ledger.service.metrics;

import com.vaultlend.ledger.events.LedgerEvent;
import com.vaultlend.ledger.events.LedgerEventPublisher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;

/**
 * Counts committed ledger events per type before handing them on.
 */
public class MeteredLedgerEventPublisher implements LedgerEventPublisher {

  public static final String OPERATIONS_METER = "ledger.operations";

  private final LedgerEventPublisher delegate;
  private final MeterRegistry meterRegistry;

  public MeteredLedgerEventPublisher(@NonNull LedgerEventPublisher delegate, @NonNull MeterRegistry meterRegistry) {
    this.delegate = delegate;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void publish(LedgerEvent event) {
    Counter.builder(OPERATIONS_METER)
        .description("Committed ledger operations by event type")
        .tag("type", event.type())
        .register(meterRegistry)
        .increment();
    delegate.publish(event);
  }
}
