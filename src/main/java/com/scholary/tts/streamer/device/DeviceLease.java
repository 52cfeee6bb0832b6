package com.scholary.tts.streamer.device;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;

/**
 * Exclusive hold on one accelerator, released by {@link #close()}.
 *
 * <p>Intended for try-with-resources so the device is released on success, failure and
 * interruption alike. Closing twice is a no-op.
 */
public final class DeviceLease implements AutoCloseable {

  private final int deviceIndex;
  private final Lock lock;
  private final long acquiredAtNanos;
  private final DeviceLockRegistry registry;
  private final AtomicBoolean released = new AtomicBoolean(false);

  DeviceLease(int deviceIndex, Lock lock, DeviceLockRegistry registry) {
    this.deviceIndex = deviceIndex;
    this.lock = lock;
    this.registry = registry;
    this.acquiredAtNanos = System.nanoTime();
  }

  public int deviceIndex() {
    return deviceIndex;
  }

  /** Time this lease has been held so far, in milliseconds. */
  public long heldMillis() {
    return (System.nanoTime() - acquiredAtNanos) / 1_000_000;
  }

  public boolean isReleased() {
    return released.get();
  }

  @Override
  public void close() {
    if (released.compareAndSet(false, true)) {
      long heldMs = heldMillis();
      lock.unlock();
      registry.onReleased(deviceIndex, heldMs);
    }
  }
}
