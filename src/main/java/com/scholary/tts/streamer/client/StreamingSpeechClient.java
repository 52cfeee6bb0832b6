package com.scholary.tts.streamer.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.tts.streamer.api.SynthesisMode;
import com.scholary.tts.streamer.api.SynthesisRequest;
import com.scholary.tts.streamer.protocol.ReadDeadline;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for the streaming generation endpoint that plays audio while it arrives.
 *
 * <p>Only the newest call to {@link #generate} may play. Starting a generation discards whatever
 * the previous one still had scheduled and resets the playback cursor; the older call keeps
 * draining its response so the connection ends cleanly, ignores the bytes and ends with a {@link
 * CancellationException}.
 */
public class StreamingSpeechClient implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(StreamingSpeechClient.class);

  private final ClientOptions options;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final AudioSink sink;
  private final PlaybackScheduler scheduler;
  private final AtomicLong generation = new AtomicLong();
  private final Object playbackLock = new Object();

  public StreamingSpeechClient(ClientOptions options, AudioSink sink, ObjectMapper objectMapper) {
    this.options = options;
    this.sink = sink;
    this.objectMapper = objectMapper;
    this.scheduler = new PlaybackScheduler(sink);
    this.httpClient = HttpClient.newBuilder().connectTimeout(options.connectTimeout()).build();
  }

  /** Client that plays through the default Java Sound output. */
  public static StreamingSpeechClient withSpeakers(ClientOptions options) {
    return new StreamingSpeechClient(options, new JavaSoundAudioSink(), new ObjectMapper());
  }

  /**
   * Generate speech, playing it as it streams in.
   *
   * @return the job id and the complete PCM once the stream has ended
   * @throws GenerationFailedException if the server rejected the request or reported a failure
   * @throws StreamProtocolException if the response is not a valid audio stream
   * @throws CancellationException if a newer generation was started before this one ended
   * @throws HttpTimeoutException if the response has not ended within {@code maxDuration}
   * @throws IOException if the connection fails
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public DecodedAudio generate(SynthesisMode mode, SynthesisRequest request)
      throws IOException, InterruptedException {
    long myGeneration;
    synchronized (playbackLock) {
      myGeneration = generation.incrementAndGet();
      sink.discardScheduled();
      scheduler.reset();
    }

    HttpRequest httpRequest =
        HttpRequest.newBuilder()
            .uri(resolve("/api/tts/" + mode.pathValue() + "/stream"))
            .timeout(options.maxDuration())
            .header("Content-Type", "application/json")
            .header("Accept", "audio/wav")
            .POST(BodyPublishers.ofByteArray(objectMapper.writeValueAsBytes(request)))
            .build();

    LOGGER.debug("Starting generation {}: mode={}", myGeneration, mode.pathValue());
    long startNanos = System.nanoTime();
    HttpResponse<InputStream> response =
        httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofInputStream());

    if (response.statusCode() / 100 != 2) {
      String body;
      try (InputStream in = response.body()) {
        body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
      }
      throw new GenerationFailedException(errorMessage(response.statusCode(), body));
    }

    StreamDecoder decoder = new StreamDecoder(options.chunkThresholdBytes(), scheduler, sink);
    Duration remaining = options.maxDuration().minusNanos(System.nanoTime() - startNanos);
    try (InputStream in = response.body();
        ReadDeadline deadline = ReadDeadline.start(in, remaining)) {
      try {
        readBody(in, decoder, myGeneration);
      } catch (IOException e) {
        if (deadline.isExpired()) {
          throw timedOut(e);
        }
        throw e;
      }
      if (deadline.isExpired()) {
        throw timedOut(null);
      }
    }

    synchronized (playbackLock) {
      if (generation.get() != myGeneration) {
        LOGGER.debug("Generation {} superseded, result dropped", myGeneration);
        throw new CancellationException("Superseded by a newer generation");
      }
      DecodedAudio audio = decoder.finish();
      LOGGER.info(
          "Generation finished: jobId={}, duration={}s",
          audio.jobId(),
          String.format("%.2f", audio.durationSeconds()));
      return audio;
    }
  }

  private void readBody(InputStream in, StreamDecoder decoder, long myGeneration)
      throws IOException {
    byte[] block = new byte[8192];
    int read;
    while ((read = in.read(block)) != -1) {
      synchronized (playbackLock) {
        if (generation.get() == myGeneration) {
          decoder.feed(block, 0, read);
        }
      }
    }
  }

  private HttpTimeoutException timedOut(IOException cause) {
    HttpTimeoutException timeout =
        new HttpTimeoutException(
            "Generation did not finish within " + options.maxDuration().toSeconds() + "s");
    if (cause != null) {
      timeout.initCause(cause);
    }
    return timeout;
  }

  /**
   * Fetch a finished generation as a complete WAV file.
   *
   * @return the file, or empty if the server no longer has it
   * @throws IOException if the request fails or the server answers with an unexpected status
   */
  public Optional<byte[]> download(String jobId) throws IOException, InterruptedException {
    HttpRequest httpRequest =
        HttpRequest.newBuilder()
            .uri(resolve("/api/tts/download/" + jobId))
            .timeout(options.maxDuration())
            .GET()
            .build();
    HttpResponse<byte[]> response =
        httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
    if (response.statusCode() == 404) {
      return Optional.empty();
    }
    if (response.statusCode() != 200) {
      throw new IOException(
          errorMessage(
              response.statusCode(), new String(response.body(), StandardCharsets.UTF_8)));
    }
    return Optional.of(response.body());
  }

  /** Stop playback and release the audio output. */
  @Override
  public void close() {
    synchronized (playbackLock) {
      generation.incrementAndGet();
      sink.discardScheduled();
    }
    sink.close();
  }

  private URI resolve(String path) {
    return options.baseUrl().resolve(path);
  }

  private String errorMessage(int status, String body) {
    try {
      JsonNode error = objectMapper.readTree(body).path("error");
      if (error.isTextual() && !error.asText().isBlank()) {
        return error.asText();
      }
    } catch (JsonProcessingException e) {
      LOGGER.debug("Error body is not JSON: {}", e.getOriginalMessage());
    }
    return "Generation failed with HTTP " + status;
  }
}
