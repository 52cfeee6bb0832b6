package com.scholary.tts.streamer.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.tts.streamer.api.SynthesisMode;
import com.scholary.tts.streamer.api.SynthesisRequest;
import com.scholary.tts.streamer.protocol.StreamMarkers;
import com.scholary.tts.streamer.protocol.WavHeader;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StreamingSpeechClientTest {

  private static final String JOB_ID = "7c9e6679-7425-40de-944b-e07fc1f90ae7";

  private final CountDownLatch releaseStalled = new CountDownLatch(1);
  private final RecordingAudioSink sink = new RecordingAudioSink();

  private HttpServer server;
  private ExecutorService serverExecutor;
  private StreamingSpeechClient client;

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    serverExecutor = Executors.newCachedThreadPool();
    server.setExecutor(serverExecutor);

    // header straight away, then nothing until the test ends
    server.createContext(
        "/api/tts/custom/stream",
        exchange -> {
          exchange.sendResponseHeaders(200, 0);
          try (OutputStream out = exchange.getResponseBody()) {
            out.write(WavHeader.streaming(24000).toBytes());
            out.flush();
            releaseStalled.await(10, TimeUnit.SECONDS);
            out.write(StreamMarkers.error("late"));
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
        });
    server.createContext(
        "/api/tts/design/stream",
        exchange -> {
          exchange.sendResponseHeaders(200, 0);
          try (OutputStream out = exchange.getResponseBody()) {
            out.write(WavHeader.streaming(24000).toBytes());
            out.write(new byte[9600]);
            out.write(StreamMarkers.jobId(JOB_ID));
          }
        });
    server.createContext(
        "/api/tts/clone/stream",
        exchange -> {
          byte[] body =
              "{\"error\":\"At least one reference audio is required\"}"
                  .getBytes(StandardCharsets.UTF_8);
          exchange.getResponseHeaders().add("Content-Type", "application/json");
          exchange.sendResponseHeaders(400, body.length);
          try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
          }
        });
    server.start();

    ClientOptions options =
        new ClientOptions(
            URI.create("http://127.0.0.1:" + server.getAddress().getPort()),
            4800,
            Duration.ofSeconds(1),
            Duration.ofSeconds(2));
    client = new StreamingSpeechClient(options, sink, new ObjectMapper());
  }

  @AfterEach
  void tearDown() {
    releaseStalled.countDown();
    client.close();
    server.stop(0);
    serverExecutor.shutdownNow();
  }

  @Test
  void stalledBodyFailsOnceMaxDurationRunsOut() {
    long start = System.nanoTime();

    assertThatThrownBy(
            () -> client.generate(SynthesisMode.CUSTOM, SynthesisRequest.custom("Hi", "Ryan")))
        .isInstanceOf(HttpTimeoutException.class)
        .hasMessageContaining("within 1s");

    long elapsedMs = (System.nanoTime() - start) / 1_000_000;
    assertThat(elapsedMs).isLessThan(4000);
  }

  @Test
  void completeStreamWithinMaxDurationIsDecoded() throws Exception {
    DecodedAudio audio =
        client.generate(SynthesisMode.DESIGN, SynthesisRequest.design("Hi", "calm narrator"));

    assertThat(audio.jobId()).isEqualTo(JOB_ID);
    assertThat(audio.sampleRate()).isEqualTo(24000);
    assertThat(audio.pcm()).hasSize(9600);
    assertThat(sink.played()).isNotEmpty();
  }

  @Test
  void rejectedRequestReportsServerMessage() {
    SynthesisRequest request = new SynthesisRequest("Hi", null, null, null, null, null, null);

    assertThatThrownBy(() -> client.generate(SynthesisMode.CLONE, request))
        .isInstanceOf(GenerationFailedException.class)
        .hasMessage("At least one reference audio is required");
  }
}
