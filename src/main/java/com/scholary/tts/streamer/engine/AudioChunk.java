package com.scholary.tts.streamer.engine;

/**
 * A block of float samples in [-1.0, 1.0] produced by an engine, with the rate it was produced at.
 */
public record AudioChunk(float[] samples, int sampleRate) {

  public AudioChunk {
    if (samples == null) {
      throw new IllegalArgumentException("samples must not be null");
    }
    if (sampleRate <= 0) {
      throw new IllegalArgumentException("sampleRate must be positive: " + sampleRate);
    }
  }

  public double durationSeconds() {
    return (double) samples.length / sampleRate;
  }
}
