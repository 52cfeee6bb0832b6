package com.scholary.tts.streamer.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the streaming delivery pipeline.
 *
 * <p>Controls the target sample rate, how many accelerators are guarded by device locks, the
 * result cache bounds, request limits and the worker pool that runs streaming responses.
 */
@ConfigurationProperties(prefix = "streaming")
@Validated
public record StreamingProperties(
    @Positive int sampleRate,
    @Positive int deviceCount,
    @Valid @NotNull CacheProperties cache,
    @Valid @NotNull LimitProperties limits,
    @Valid @NotNull AsyncProperties async) {

  public record CacheProperties(@NotNull Duration ttl, @Positive int maxEntries) {}

  public record LimitProperties(@Positive int maxTextLength, @Positive int maxInstructLength) {}

  public record AsyncProperties(
      @Positive int executorThreads, @Positive int queueSize, @NotNull Duration timeout) {}
}
