package com.github.adamzv.proton.application;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

public final class CancellationSignal {

  @FunctionalInterface
  public interface Registration extends AutoCloseable {
    @Override
    void close();
  }

  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

  public boolean cancel() {
    if (!cancelled.compareAndSet(false, true)) {
      return false;
    }
    listeners.forEach(Runnable::run);
    return true;
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  public Registration onCancel(Runnable listener) {
    listeners.add(listener);
    if (cancelled.get() && listeners.remove(listener)) {
      listener.run();
    }
    return () -> listeners.remove(listener);
  }
}
