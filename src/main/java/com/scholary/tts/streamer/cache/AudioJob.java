package com.scholary.tts.streamer.cache;

import java.time.Instant;
import java.util.Objects;

/**
 * A finished generation: 16-bit mono PCM samples plus the rate they were produced at.
 *
 * <p>Immutable. The sample array is copied on the way in and on every read, so callers can never
 * modify what the cache holds.
 */
public final class AudioJob {

  private final String jobId;
  private final short[] samples;
  private final int sampleRate;
  private final Instant createdAt;

  public AudioJob(String jobId, short[] samples, int sampleRate, Instant createdAt) {
    this.jobId = Objects.requireNonNull(jobId, "jobId");
    this.samples = Objects.requireNonNull(samples, "samples").clone();
    this.sampleRate = sampleRate;
    this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
  }

  public String getJobId() {
    return jobId;
  }

  /** Returns a copy of the samples. */
  public short[] getSamples() {
    return samples.clone();
  }

  public int getSampleCount() {
    return samples.length;
  }

  public int getSampleRate() {
    return sampleRate;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public double getDurationSeconds() {
    return sampleRate == 0 ? 0.0 : (double) samples.length / sampleRate;
  }
}
