package com.vaultlend.ledger.policy;

import com.vaultlend.ledger.error.LedgerError;
import com.vaultlend.ledger.error.LedgerException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process emergency-stop flag, both the gate the pool consults and the toggle it flips.
 */
public class PauseSwitch implements PausePolicy, PauseToggle {

  private final AtomicBoolean paused = new AtomicBoolean(false);

  @Override
  public void requireUnpaused() {
    if (paused.get()) {
      throw new LedgerException(LedgerError.PROTOCOL_PAUSED, "protocol is paused");
    }
  }

  @Override
  public boolean isPaused() {
    return paused.get();
  }

  @Override
  public boolean set(boolean value) {
    return paused.compareAndSet(!value, value);
  }
}
