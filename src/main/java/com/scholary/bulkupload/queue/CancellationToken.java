package com.scholary.bulkupload.queue;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-attempt signal that tells an upload function to stop.
 *
 * <p>Each attempt gets its own token, so aborting one upload never affects another. The token is
 * cancelled at most once; the first reason wins.
 */
public final class CancellationToken {

  private static final Logger LOGGER = LoggerFactory.getLogger(CancellationToken.class);

  /** Why a token was cancelled. */
  public enum Reason {
    /** The caller cancelled or removed the file. */
    CANCELLED,
    /** The attempt exceeded its timeout. */
    TIMED_OUT,
    /** The whole queue was cleared or closed. */
    CLEARED
  }

  private final AtomicReference<Reason> reason = new AtomicReference<>();
  private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

  public boolean isCancelled() {
    return reason.get() != null;
  }

  /** The cancellation reason, or null while the token is live. */
  public Reason reason() {
    return reason.get();
  }

  /** True when the caller asked for the abort, as opposed to a timeout. */
  public boolean isExplicitlyCancelled() {
    Reason current = reason.get();
    return current == Reason.CANCELLED || current == Reason.CLEARED;
  }

  /**
   * Cancel the token and run registered callbacks.
   *
   * @return false if the token had already been cancelled
   */
  public boolean cancel(Reason cancelReason) {
    if (!reason.compareAndSet(null, cancelReason)) {
      return false;
    }
    for (Runnable callback : callbacks) {
      // Whoever removes the callback runs it, so a racing onCancel cannot run it twice
      if (!callbacks.remove(callback)) {
        continue;
      }
      try {
        callback.run();
      } catch (RuntimeException e) {
        LOGGER.warn("Cancellation callback failed: {}", e.getMessage(), e);
      }
    }
    return true;
  }

  /**
   * Register a callback to run on cancellation. Runs immediately if already cancelled.
   *
   * <p>Callbacks run on the cancelling thread and must be quick, e.g. closing a stream.
   */
  public void onCancel(Runnable callback) {
    callbacks.add(callback);
    if (isCancelled() && callbacks.remove(callback)) {
      callback.run();
    }
  }

  /** Throw {@link CancellationException} if the token has been cancelled. */
  public void throwIfCancelled() {
    Reason current = reason.get();
    if (current != null) {
      throw new CancellationException("Upload aborted: " + current);
    }
  }
}
