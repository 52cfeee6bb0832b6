package com.scholary.tts.streamer.client;

import java.net.URI;
import java.time.Duration;

/**
 * Settings for {@link StreamingSpeechClient}.
 *
 * @param baseUrl server root, e.g. {@code http://localhost:8080}
 * @param chunkThresholdBytes PCM bytes to buffer before scheduling a buffer for playback
 * @param maxDuration upper bound on one generation request, from send to last byte; a body still
 *     arriving when it runs out is closed and the call fails with an {@code HttpTimeoutException}
 * @param connectTimeout TCP connect timeout
 */
public record ClientOptions(
    URI baseUrl, int chunkThresholdBytes, Duration maxDuration, Duration connectTimeout) {

  public static final int DEFAULT_CHUNK_THRESHOLD_BYTES = 4800;

  // Provide defaults
  public ClientOptions {
    if (baseUrl == null) {
      throw new IllegalArgumentException("baseUrl is required");
    }
    if (chunkThresholdBytes <= 0) {
      chunkThresholdBytes = DEFAULT_CHUNK_THRESHOLD_BYTES;
    }
    if (maxDuration == null) {
      maxDuration = Duration.ofMinutes(10);
    }
    if (connectTimeout == null) {
      connectTimeout = Duration.ofSeconds(10);
    }
  }

  public static ClientOptions of(URI baseUrl) {
    return new ClientOptions(baseUrl, DEFAULT_CHUNK_THRESHOLD_BYTES, null, null);
  }
}
