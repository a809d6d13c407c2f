package org.example.crowdledger.service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Journal of one workflow invocation.
 *
 * <p>Each mutation registers its compensation with {@link #onRollback(Runnable)} right after it is
 * applied, and each event is queued with {@link #emit(Runnable)}. On failure {@link
 * #rollback(RuntimeException)} runs the compensations newest first; on success {@link #commit()}
 * publishes the queued events in order. A unit is used once.
 */
final class UnitOfWork {
  private final Deque<Runnable> compensations = new ArrayDeque<>();
  private final List<Runnable> events = new ArrayList<>();
  private boolean finished;

  void onRollback(Runnable compensation) {
    requireOpen();
    compensations.push(compensation);
  }

  void emit(Runnable publish) {
    requireOpen();
    events.add(publish);
  }

  /** Publishes the queued events. Compensations are dropped. */
  void commit() {
    requireOpen();
    finished = true;
    compensations.clear();
    for (Runnable r : events) r.run();
  }

  /**
   * Undoes every registered mutation, newest first, and drops the queued events.
   *
   * <p>A compensation that throws does not stop the others; its exception is attached to {@code
   * cause} as suppressed and reported on {@code System.err}.
   *
   * @param cause the failure that aborted the workflow
   */
  void rollback(RuntimeException cause) {
    requireOpen();
    finished = true;
    events.clear();
    while (!compensations.isEmpty()) {
      Runnable r = compensations.pop();
      try {
        r.run();
      } catch (RuntimeException e) {
        cause.addSuppressed(e);
        System.err.println("Rollback step failed: " + e.getMessage());
      }
    }
  }

  int pendingCompensations() {
    return compensations.size();
  }

  private void requireOpen() {
    if (finished) throw new IllegalStateException("Unit of work already finished");
  }
}
