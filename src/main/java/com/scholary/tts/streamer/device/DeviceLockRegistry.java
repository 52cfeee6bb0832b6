package com.scholary.tts.streamer.device;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One mutual-exclusion lock per accelerator.
 *
 * <p>Model state on a GPU cannot be shared by two generations at once, so a request holds the
 * device for the whole generation. Devices are independent: holding device 0 never blocks device
 * 1.
 *
 * <p>{@link #acquire(int)} waits without a timeout. A busy device makes callers queue for as long
 * as the current generation runs, in whatever order the underlying lock hands it out. Callers that
 * need liveness guarantees can use {@link #tryAcquire(int, Duration)} instead.
 *
 * <p>Leases are not re-entrant: a thread holding a lease must not acquire the same device again.
 */
public class DeviceLockRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(DeviceLockRegistry.class);

  private final List<ReentrantLock> locks;

  public DeviceLockRegistry(int deviceCount) {
    if (deviceCount <= 0) {
      throw new IllegalArgumentException("deviceCount must be positive: " + deviceCount);
    }
    List<ReentrantLock> created = new ArrayList<>(deviceCount);
    for (int i = 0; i < deviceCount; i++) {
      created.add(new ReentrantLock());
    }
    this.locks = List.copyOf(created);
    LOGGER.info("Initialized device locks: devices={}", deviceCount);
  }

  /**
   * Acquire exclusive use of a device, blocking until it is free.
   *
   * @param deviceIndex the accelerator index
   * @return a lease that must be closed to release the device
   * @throws IllegalArgumentException if the device index is not configured
   * @throws IllegalStateException if the calling thread is interrupted while waiting
   */
  public DeviceLease acquire(int deviceIndex) {
    ReentrantLock lock = lockFor(deviceIndex);
    if (lock.isHeldByCurrentThread()) {
      throw new IllegalStateException("Device " + deviceIndex + " already held by this thread");
    }
    long start = System.nanoTime();
    if (lock.isLocked()) {
      LOGGER.debug(
          "Device {} busy, waiting (queued={})", deviceIndex, lock.getQueueLength() + 1);
    }
    try {
      lock.lockInterruptibly();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for device " + deviceIndex, e);
    }
    LOGGER.debug(
        "Acquired device {} after {}ms", deviceIndex, (System.nanoTime() - start) / 1_000_000);
    return new DeviceLease(deviceIndex, lock, this);
  }

  /**
   * Acquire a device, waiting at most {@code timeout}.
   *
   * @return the lease, or empty if the device stayed busy for the whole timeout
   */
  public Optional<DeviceLease> tryAcquire(int deviceIndex, Duration timeout) {
    ReentrantLock lock = lockFor(deviceIndex);
    if (lock.isHeldByCurrentThread()) {
      throw new IllegalStateException("Device " + deviceIndex + " already held by this thread");
    }
    try {
      if (lock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
        LOGGER.debug("Acquired device {} within {}", deviceIndex, timeout);
        return Optional.of(new DeviceLease(deviceIndex, lock, this));
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for device " + deviceIndex, e);
    }
    LOGGER.warn("Device {} still busy after {}", deviceIndex, timeout);
    return Optional.empty();
  }

  /** True if some thread currently holds the device. */
  public boolean isBusy(int deviceIndex) {
    return lockFor(deviceIndex).isLocked();
  }

  public int deviceCount() {
    return locks.size();
  }

  void onReleased(int deviceIndex, long heldMs) {
    LOGGER.debug("Released device {} after {}ms", deviceIndex, heldMs);
  }

  private ReentrantLock lockFor(int deviceIndex) {
    if (deviceIndex < 0 || deviceIndex >= locks.size()) {
      throw new IllegalArgumentException(
          String.format("Unknown device %d (configured devices: %d)", deviceIndex, locks.size()));
    }
    return locks.get(deviceIndex);
  }
}
