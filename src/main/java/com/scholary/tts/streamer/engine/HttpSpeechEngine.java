package com.scholary.tts.streamer.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.tts.streamer.api.SynthesisMode;
import com.scholary.tts.streamer.api.SynthesisRequest;
import com.scholary.tts.streamer.config.StreamingProperties;
import com.scholary.tts.streamer.protocol.PcmCodec;
import com.scholary.tts.streamer.protocol.ReadDeadline;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for a model inference server that streams generated speech.
 *
 * <p>The server answers {@code POST /api/v1/tts/{mode}/stream} with a body of raw little-endian
 * float32 samples and the sample rate in the {@code X-Sample-Rate} header. The body is read in
 * blocks of {@code inference.chunkSamples} samples, each handed on as one {@link AudioChunk} as
 * soon as it has arrived.
 *
 * <p>{@code inference.readTimeout} bounds both the wait for the response headers and each block
 * read from the body, so a server that stops sending mid-generation fails it instead of holding the
 * device indefinitely.
 *
 * <p>Only opening the stream is retried. Once samples have been handed out, a failure ends the
 * generation: the caller has already forwarded those samples and cannot take them back.
 */
@Component
public class HttpSpeechEngine implements SpeechEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpSpeechEngine.class);

  static final String SAMPLE_RATE_HEADER = "X-Sample-Rate";

  private final HttpClient httpClient;
  private final InferenceProperties properties;
  private final ObjectMapper objectMapper;
  private final int targetSampleRate;

  public HttpSpeechEngine(
      InferenceProperties properties,
      StreamingProperties streamingProperties,
      ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.targetSampleRate = streamingProperties.sampleRate();

    // Build HTTP client with configured timeouts
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized inference client: baseUrl={}, device={}",
        properties.baseUrl(),
        properties.deviceIndex());
  }

  @Override
  public String name() {
    return "inference-http";
  }

  @Override
  public int deviceIndex() {
    return properties.deviceIndex();
  }

  @Override
  public ChunkSource open(SynthesisMode mode, SynthesisRequest request) {
    return new HttpChunkSource(mode, request);
  }

  /**
   * Open the sample stream, retrying transient failures.
   *
   * @throws SynthesisException if the stream cannot be opened after retries
   */
  private HttpResponse<InputStream> openStream(SynthesisMode mode, SynthesisRequest request) {
    int attempt = 0;
    Exception lastException = null;

    while (attempt < properties.maxRetries()) {
      try {
        return attemptOpen(mode, request);
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          // Exponential backoff with jitter
          long backoffMs = (long) (Math.pow(2, attempt) * 1000 + Math.random() * 1000);
          LOGGER.warn(
              "Inference attempt {} failed, retrying in {}ms: {}",
              attempt,
              backoffMs,
              e.getMessage());
          try {
            Thread.sleep(backoffMs);
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new SynthesisException("Generation interrupted", ie);
          }
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new SynthesisException("Generation interrupted", e);
      }
    }

    throw new SynthesisException(
        String.format("Inference server unavailable after %d attempts", properties.maxRetries()),
        lastException);
  }

  private HttpResponse<InputStream> attemptOpen(SynthesisMode mode, SynthesisRequest request)
      throws IOException, InterruptedException {

    HttpRequest httpRequest =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/api/v1/tts/" + mode.pathValue() + "/stream"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "application/json")
            .header("Accept", "application/octet-stream")
            .POST(BodyPublishers.ofByteArray(buildBody(request)))
            .build();

    LOGGER.debug("Opening inference stream at {}", httpRequest.uri());

    HttpResponse<InputStream> response =
        httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofInputStream());

    if (response.statusCode() != 200) {
      String body;
      try (InputStream in = response.body()) {
        body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
      }
      throw new IOException(
          String.format("Inference server returned status %d: %s", response.statusCode(), body));
    }
    return response;
  }

  private byte[] buildBody(SynthesisRequest request) throws JsonProcessingException {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("text", request.text());
    body.put("language", request.language());
    body.put("speaker", request.speaker());
    body.put("instruct", request.instruct());
    body.put("refAudioIds", request.refAudioIds());
    body.put("refTexts", request.refTexts());
    body.put("fast", request.fast());
    body.put("sampleRate", targetSampleRate);
    return objectMapper.writeValueAsBytes(body);
  }

  private static int parseSampleRate(HttpResponse<InputStream> response) {
    String value =
        response
            .headers()
            .firstValue(SAMPLE_RATE_HEADER)
            .orElseThrow(
                () -> new SynthesisException("Inference response has no " + SAMPLE_RATE_HEADER));
    try {
      int sampleRate = Integer.parseInt(value.trim());
      if (sampleRate <= 0) {
        throw new SynthesisException("Inference server reported sample rate " + sampleRate);
      }
      return sampleRate;
    } catch (NumberFormatException e) {
      throw new SynthesisException("Unparseable " + SAMPLE_RATE_HEADER + ": " + value, e);
    }
  }

  /** Reads one generation's samples lazily; the request is only sent on the first pull. */
  private final class HttpChunkSource implements ChunkSource {

    private final SynthesisMode mode;
    private final SynthesisRequest request;
    private final byte[] block;
    private InputStream body;
    private int sampleRate;
    private int chunksRead;
    private boolean finished;

    HttpChunkSource(SynthesisMode mode, SynthesisRequest request) {
      this.mode = mode;
      this.request = request;
      this.block = new byte[properties.chunkSamples() * 4];
    }

    @Override
    public Optional<AudioChunk> next() throws IOException {
      if (finished) {
        return Optional.empty();
      }
      if (body == null) {
        HttpResponse<InputStream> response = openStream(mode, request);
        body = response.body();
        sampleRate = parseSampleRate(response);
        LOGGER.info("Inference stream opened: mode={}, sampleRate={}", mode, sampleRate);
      }

      int read = readBlock();
      if (read == 0) {
        finished = true;
        LOGGER.debug("Inference stream finished after {} chunks", chunksRead);
        return Optional.empty();
      }
      if (read % 4 != 0) {
        LOGGER.warn("Dropping {} trailing bytes of a partial float sample", read % 4);
      }
      float[] samples = PcmCodec.fromFloat32LittleEndian(block, read);
      if (samples.length == 0) {
        finished = true;
        return Optional.empty();
      }
      chunksRead++;
      return Optional.of(new AudioChunk(samples, sampleRate));
    }

    /** Read the next block, giving up if the server sends nothing for a whole read timeout. */
    private int readBlock() throws IOException {
      try (ReadDeadline deadline =
          ReadDeadline.start(body, Duration.ofSeconds(properties.readTimeout()))) {
        int read;
        try {
          read = body.readNBytes(block, 0, block.length);
        } catch (IOException e) {
          if (deadline.isExpired()) {
            throw stalled(e);
          }
          throw e;
        }
        if (deadline.isExpired()) {
          throw stalled(null);
        }
        return read;
      }
    }

    private SynthesisException stalled(IOException cause) {
      return new SynthesisException(
          String.format(
              "Inference server sent no audio for %ds after %d chunks",
              properties.readTimeout(), chunksRead),
          cause);
    }

    @Override
    public void close() throws IOException {
      finished = true;
      if (body != null) {
        body.close();
      }
    }
  }
}
