package com.github.adamzv.proton.adapters.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import sun.misc.Signal;
import sun.misc.SignalHandler;

@Component
public class SignalInterruptTrap implements InterruptTrap {

  private static final Logger log = LoggerFactory.getLogger(SignalInterruptTrap.class);

  private static final String INT = "INT";

  @Override
  public Registration install(Runnable onInterrupt) {
    Signal signal;
    SignalHandler previous;
    try {
      signal = new Signal(INT);
      previous = Signal.handle(signal, received -> onInterrupt.run());
    } catch (IllegalArgumentException ex) {
      // Unknown on this platform, or reserved by the JVM (-Xrs).
      log.warn("interrupt_trap_unavailable signal={} message={}", INT, ex.getMessage());
      return () -> { };
    }
    return () -> Signal.handle(signal, previous);
  }

  @Override
  public void exitNormally() {
    System.exit(0);
  }
}
