package cardsdk.attestation;

import java.util.concurrent.CompletableFuture;

/**
 * Holds at most one pending online verification. Each {@link #dispatch} starts a new
 * generation; completions from earlier generations are dropped, so a slow first attempt
 * can never complete the result of a retry.
 */
final class OnlineResultSlot {

  private long generation;
  private CompletableFuture<VerificationRecord> source;
  private CompletableFuture<VerificationRecord> result;
  private boolean closed;

  /** Replaces the pending lookup with {@code lookup} and returns the new generation. */
  synchronized long dispatch(CompletableFuture<VerificationRecord> lookup) {
    if (closed) {
      throw new IllegalStateException("Online verification slot is closed");
    }
    long current = ++generation;
    cancelPending();
    CompletableFuture<VerificationRecord> target = new CompletableFuture<>();
    source = lookup;
    result = target;
    lookup.whenComplete((record, error) -> deliver(current, target, record, error));
    return current;
  }

  /** Result of the latest dispatch. */
  synchronized CompletableFuture<VerificationRecord> current() {
    if (result == null) {
      throw new IllegalStateException("Nothing dispatched");
    }
    return result;
  }

  synchronized long generation() {
    return generation;
  }

  synchronized boolean isCurrent(long candidate) {
    return !closed && candidate == generation;
  }

  /** Cancels the pending lookup; nothing is delivered afterwards. */
  synchronized void close() {
    closed = true;
    cancelPending();
  }

  private void cancelPending() {
    if (source != null && !source.isDone()) {
      source.cancel(false);
    }
    if (result != null && !result.isDone()) {
      result.cancel(false);
    }
  }

  private synchronized void deliver(long from,
                                    CompletableFuture<VerificationRecord> target,
                                    VerificationRecord record,
                                    Throwable error) {
    if (closed || from != generation) {
      return;
    }
    if (error != null) {
      target.completeExceptionally(error);
    } else {
      target.complete(record);
    }
  }
}
