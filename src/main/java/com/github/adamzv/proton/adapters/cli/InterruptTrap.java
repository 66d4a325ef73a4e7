package com.github.adamzv.proton.adapters.cli;

/**
 * Takes over the terminal interrupt (Ctrl+C) while a command runs, so that it ends the command instead
 * of killing the process with a failure status.
 */
public interface InterruptTrap {

  /**
   * Routes interrupts to {@code onInterrupt} until the returned registration is closed.
   */
  Registration install(Runnable onInterrupt);

  /**
   * Exits the process with status 0, running shutdown hooks. Used when the interrupted command cannot
   * be stopped cooperatively.
   */
  void exitNormally();

  interface Registration extends AutoCloseable {

    @Override
    void close();
  }
}
