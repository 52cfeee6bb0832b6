package com.scholary.tts.streamer.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.tts.streamer.api.SynthesisMode;
import com.scholary.tts.streamer.api.SynthesisRequest;
import com.scholary.tts.streamer.client.AudioSink;
import com.scholary.tts.streamer.client.ClientOptions;
import com.scholary.tts.streamer.client.DecodedAudio;
import com.scholary.tts.streamer.client.GenerationFailedException;
import com.scholary.tts.streamer.client.StreamingSpeechClient;
import com.scholary.tts.streamer.engine.AudioChunk;
import com.scholary.tts.streamer.engine.ChunkSource;
import com.scholary.tts.streamer.engine.SpeechEngine;
import com.scholary.tts.streamer.engine.SynthesisException;
import java.net.URI;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * End-to-end test pairing the running server with {@link StreamingSpeechClient}.
 *
 * <p>The inference server is replaced by an in-process engine whose behaviour is chosen by the
 * request text, so no model or container is needed.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class StreamingRoundTripIntegrationTest {

  private static final int SAMPLE_RATE = 24000;
  private static final int CHUNK_SAMPLES = 2400;

  @LocalServerPort private int port;

  @Autowired private ScriptedEngine engine;

  private CountingSink sink;
  private StreamingSpeechClient client;

  @BeforeEach
  void setUp() {
    engine.gate = new CountDownLatch(0);
    sink = new CountingSink();
    client =
        new StreamingSpeechClient(
            ClientOptions.of(URI.create("http://localhost:" + port)), sink, new ObjectMapper());
  }

  @AfterEach
  void tearDown() {
    client.close();
  }

  @Test
  void streamedAudioMatchesDownload() throws Exception {
    DecodedAudio audio =
        client.generate(SynthesisMode.CUSTOM, SynthesisRequest.custom("three chunks", "Ryan"));

    assertThat(audio.sampleRate()).isEqualTo(SAMPLE_RATE);
    assertThat(audio.pcm()).hasSize(3 * CHUNK_SAMPLES * 2);
    assertThat(sink.buffers.get()).isGreaterThanOrEqualTo(1);

    Optional<byte[]> download = client.download(audio.jobId());
    assertThat(download).isPresent();
    assertThat(download.get()).isEqualTo(audio.toWav());
  }

  @Test
  void failureMidStreamSurfacesServerMessage() {
    assertThatThrownBy(
            () -> client.generate(SynthesisMode.CUSTOM, SynthesisRequest.custom("fail", "Ryan")))
        .isInstanceOf(GenerationFailedException.class)
        .hasMessage("CUDA out of memory");
  }

  @Test
  void emptyGenerationFailsWithNothingPlayed() {
    assertThatThrownBy(
            () -> client.generate(SynthesisMode.CUSTOM, SynthesisRequest.custom("empty", "Ryan")))
        .isInstanceOf(GenerationFailedException.class)
        .hasMessage("No audio was generated");
    assertThat(sink.buffers.get()).isZero();
  }

  @Test
  void invalidRequestIsRejectedWithJsonError() {
    assertThatThrownBy(
            () -> client.generate(SynthesisMode.CUSTOM, SynthesisRequest.custom("hello", null)))
        .isInstanceOf(GenerationFailedException.class)
        .hasMessage("Speaker is required");
  }

  @Test
  void unknownJobCannotBeDownloaded() throws Exception {
    assertThat(client.download("5d1c2b3a-4e5f-4a6b-8c7d-9e0f1a2b3c4d")).isEmpty();
  }

  @Test
  void newerGenerationCancelsOlderOne() throws Exception {
    engine.gate = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      Future<DecodedAudio> older =
          executor.submit(
              () -> client.generate(SynthesisMode.CUSTOM, SynthesisRequest.custom("slow", "Ryan")));
      awaitBuffers(1);

      Future<DecodedAudio> newer =
          executor.submit(
              () ->
                  client.generate(
                      SynthesisMode.CUSTOM, SynthesisRequest.custom("three chunks", "Ryan")));
      awaitDiscard();
      engine.gate.countDown();

      assertThatThrownBy(() -> older.get(10, TimeUnit.SECONDS))
          .hasCauseInstanceOf(CancellationException.class);
      assertThat(newer.get(10, TimeUnit.SECONDS).pcm()).hasSize(3 * CHUNK_SAMPLES * 2);
    } finally {
      engine.gate.countDown();
      executor.shutdownNow();
    }
  }

  private void awaitBuffers(int count) throws InterruptedException {
    long deadline = System.currentTimeMillis() + 10_000;
    while (sink.buffers.get() < count && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }
    assertThat(sink.buffers.get()).isGreaterThanOrEqualTo(count);
  }

  private void awaitDiscard() throws InterruptedException {
    long deadline = System.currentTimeMillis() + 10_000;
    // one discard per generate call
    while (sink.discards.get() < 2 && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }
    assertThat(sink.discards.get()).isGreaterThanOrEqualTo(2);
  }

  @TestConfiguration
  static class FakeEngineConfig {

    @Bean
    @Primary
    ScriptedEngine scriptedEngine() {
      return new ScriptedEngine();
    }
  }

  /** Engine whose output depends on the request text. */
  static class ScriptedEngine implements SpeechEngine {

    volatile CountDownLatch gate = new CountDownLatch(0);

    @Override
    public String name() {
      return "scripted";
    }

    @Override
    public int deviceIndex() {
      return 0;
    }

    @Override
    public ChunkSource open(SynthesisMode mode, SynthesisRequest request) {
      String text = request.text();
      CountDownLatch waitFor = gate;
      AtomicInteger produced = new AtomicInteger();
      return () -> {
        int index = produced.getAndIncrement();
        if ("empty".equals(text)) {
          return Optional.empty();
        }
        if ("fail".equals(text) && index == 1) {
          throw new SynthesisException("CUDA out of memory");
        }
        if ("slow".equals(text) && index == 1) {
          try {
            waitFor.await(10, TimeUnit.SECONDS);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SynthesisException("Interrupted", e);
          }
        }
        return index < 3 ? Optional.of(chunk(index)) : Optional.empty();
      };
    }

    private static AudioChunk chunk(int index) {
      float[] samples = new float[CHUNK_SAMPLES];
      for (int i = 0; i < samples.length; i++) {
        double t = (double) (index * CHUNK_SAMPLES + i) / SAMPLE_RATE;
        samples[i] = (float) (0.5 * Math.sin(2 * Math.PI * 220 * t));
      }
      return new AudioChunk(samples, SAMPLE_RATE);
    }
  }

  /** Sink that only counts what it is asked to do. */
  static class CountingSink implements AudioSink {

    final AtomicInteger buffers = new AtomicInteger();
    final AtomicInteger discards = new AtomicInteger();

    @Override
    public double currentTime() {
      return 0;
    }

    @Override
    public void play(float[] samples, int sampleRate, double startTime) {
      buffers.incrementAndGet();
    }

    @Override
    public void discardScheduled() {
      discards.incrementAndGet();
    }

    @Override
    public void close() {}
  }
}
