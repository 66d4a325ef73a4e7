package com.github.adamzv.proton.application;

import com.github.adamzv.proton.domain.ProblemException;
import com.github.adamzv.proton.domain.TaskState;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

public final class ConsumptionRun {

  private static final Duration ERROR_POLL_INTERVAL = Duration.ofMillis(100);

  private final CancellationSignal cancellation;
  private final BlockingQueue<ProblemException> errors;
  private final Map<Integer, TaskState> states;
  private final CompletableFuture<Void> completion;

  ConsumptionRun(
      CancellationSignal cancellation,
      BlockingQueue<ProblemException> errors,
      Map<Integer, TaskState> states,
      CompletableFuture<Void> completion) {
    this.cancellation = cancellation;
    this.errors = errors;
    this.states = states;
    this.completion = completion;
  }

  public void cancel() {
    cancellation.cancel();
  }

  public boolean isCancelled() {
    return cancellation.isCancelled();
  }

  public boolean isDone() {
    return completion.isDone();
  }

  public BlockingQueue<ProblemException> errors() {
    return errors;
  }

  public Map<Integer, TaskState> states() {
    return Map.copyOf(states);
  }

  /**
   * Completes normally once every task is terminal, whatever the task outcomes were.
   */
  public CompletableFuture<Void> completion() {
    return completion;
  }

  /**
   * Blocks until every task is terminal, handing each fatal error to {@code onError} as soon as it
   * is reported.
   *
   * @return every error reported during the run
   */
  public List<ProblemException> awaitCompletion(Consumer<ProblemException> onError) throws InterruptedException {
    List<ProblemException> reported = new ArrayList<>();
    while (!completion.isDone()) {
      ProblemException error = errors.poll(ERROR_POLL_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
      if (error != null) {
        reported.add(error);
        onError.accept(error);
      }
    }
    ProblemException remaining;
    while ((remaining = errors.poll()) != null) {
      reported.add(remaining);
      onError.accept(remaining);
    }
    return List.copyOf(reported);
  }

  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    try {
      completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return true;
    } catch (TimeoutException ex) {
      return false;
    } catch (ExecutionException ex) {
      // task failures are recorded on the error queue, never on the completion future
      return true;
    }
  }
}
