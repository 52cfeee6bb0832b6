package com.scholary.tts.streamer.client;

/**
 * Places decoded buffers back to back on the sink's clock.
 *
 * <p>Each buffer starts where the previous one ends, or now if playback has already caught up, so
 * chunks play without gaps or overlap.
 */
public class PlaybackScheduler {

  private final AudioClock clock;
  private double nextStartTime;

  public PlaybackScheduler(AudioClock clock) {
    this.clock = clock;
  }

  /**
   * Reserve the next slot of {@code durationSeconds}.
   *
   * @return when the buffer should start playing
   */
  public synchronized double scheduleNext(double durationSeconds) {
    double start = Math.max(clock.currentTime(), nextStartTime);
    nextStartTime = start + durationSeconds;
    return start;
  }

  /** Forget the cursor; the next buffer starts at the clock's current time. */
  public synchronized void reset() {
    nextStartTime = 0;
  }

  public synchronized double nextStartTime() {
    return nextStartTime;
  }
}
