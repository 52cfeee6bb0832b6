package com.scholary.tts.streamer.protocol;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Closes a response body that is still being read when a deadline passes.
 *
 * <p>{@code java.net.http} request timeouts stop at the response headers, so a server that stalls
 * mid-body would otherwise block a reader forever. Closing the body makes the blocked read fail;
 * the reader then checks {@link #isExpired()} to tell a deadline from any other I/O failure.
 *
 * <p>Closing the deadline cancels it. A deadline that fires after being closed does nothing.
 */
public final class ReadDeadline implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ReadDeadline.class);

  private static final ScheduledExecutorService TIMER =
      Executors.newSingleThreadScheduledExecutor(
          runnable -> {
            Thread thread = new Thread(runnable, "read-deadline");
            thread.setDaemon(true);
            return thread;
          });

  private final Closeable body;
  private final Duration timeout;
  private ScheduledFuture<?> task;
  private boolean closed;
  private boolean expired;

  private ReadDeadline(Closeable body, Duration timeout) {
    this.body = body;
    this.timeout = timeout;
  }

  /**
   * Start counting down.
   *
   * @param body what to close when the deadline passes
   * @param timeout time left; zero or negative expires straight away
   */
  public static ReadDeadline start(Closeable body, Duration timeout) {
    ReadDeadline deadline = new ReadDeadline(body, timeout);
    deadline.schedule();
    return deadline;
  }

  public synchronized boolean isExpired() {
    return expired;
  }

  @Override
  public synchronized void close() {
    closed = true;
    if (task != null) {
      task.cancel(false);
    }
  }

  private synchronized void schedule() {
    task = TIMER.schedule(this::expire, Math.max(0, timeout.toNanos()), TimeUnit.NANOSECONDS);
  }

  private void expire() {
    synchronized (this) {
      if (closed) {
        return;
      }
      expired = true;
    }
    LOGGER.warn("Read deadline of {} passed, closing response body", timeout);
    try {
      body.close();
    } catch (IOException e) {
      LOGGER.debug("Closing expired response body failed: {}", e.getMessage());
    }
  }
}
