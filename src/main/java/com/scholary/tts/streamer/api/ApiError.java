package com.scholary.tts.streamer.api;

import java.time.Instant;

/**
 * Error body returned by every REST endpoint.
 *
 * <p>Clients read only {@code error}; the timestamp is for correlating with server logs.
 */
public record ApiError(String error, Instant timestamp) {

  public static ApiError of(String error) {
    return new ApiError(error, Instant.now());
  }
}
