package com.scholary.tts.streamer.engine;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the inference server client.
 *
 * <p>These control how we connect to the model server, which accelerator it runs on and how large
 * the chunks it is read in are. Timeouts are in seconds; {@code readTimeout} applies to the
 * response headers and again to every block read from the body.
 */
@ConfigurationProperties(prefix = "inference")
@Validated
public record InferenceProperties(
    @NotBlank String baseUrl,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries,
    @PositiveOrZero int deviceIndex,
    @Positive int chunkSamples) {}
