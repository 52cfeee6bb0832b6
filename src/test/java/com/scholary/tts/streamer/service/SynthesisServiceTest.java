package com.scholary.tts.streamer.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.tts.streamer.api.SynthesisMode;
import com.scholary.tts.streamer.api.SynthesisRequest;
import com.scholary.tts.streamer.cache.AudioJob;
import com.scholary.tts.streamer.cache.InMemoryResultCache;
import com.scholary.tts.streamer.device.DeviceLockRegistry;
import com.scholary.tts.streamer.engine.AudioChunk;
import com.scholary.tts.streamer.engine.ChunkSource;
import com.scholary.tts.streamer.engine.SpeechEngine;
import com.scholary.tts.streamer.engine.SynthesisException;
import com.scholary.tts.streamer.streaming.AudioStreamEncoder;
import com.scholary.tts.streamer.streaming.StreamOutcome;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SynthesisServiceTest {

  private static final SynthesisRequest REQUEST = SynthesisRequest.custom("Hello", "Vivian");

  @Mock private SpeechEngine engine;

  private DeviceLockRegistry deviceLocks;
  private InMemoryResultCache cache;
  private SynthesisService service;

  @BeforeEach
  void setUp() {
    deviceLocks = new DeviceLockRegistry(1);
    cache = new InMemoryResultCache(10, Duration.ofHours(1), Clock.systemUTC());
    service =
        new SynthesisService(engine, deviceLocks, new AudioStreamEncoder(cache), cache);
    lenient().when(engine.deviceIndex()).thenReturn(0);
    lenient().when(engine.name()).thenReturn("fake");
  }

  @Test
  void streamCachesResultAndReleasesDevice() throws IOException {
    AtomicBoolean closed = new AtomicBoolean();
    ChunkSource chunks = ChunkSource.of(List.of(new AudioChunk(new float[] {0.5f}, 24000)));
    when(engine.open(SynthesisMode.CUSTOM, REQUEST))
        .thenReturn(
            new ChunkSource() {
              @Override
              public Optional<AudioChunk> next() throws IOException {
                assertThat(deviceLocks.isBusy(0)).isTrue();
                return chunks.next();
              }

              @Override
              public void close() {
                closed.set(true);
              }
            });
    ByteArrayOutputStream out = new ByteArrayOutputStream();

    StreamOutcome outcome = service.stream(SynthesisMode.CUSTOM, REQUEST, out);

    assertThat(outcome.isCompleted()).isTrue();
    assertThat(service.findJob(outcome.jobId())).isPresent();
    assertThat(closed).isTrue();
    assertThat(deviceLocks.isBusy(0)).isFalse();
  }

  @Test
  void engineRefusingToStartEndsStreamWithErrorMarker() throws IOException {
    when(engine.open(any(), any())).thenThrow(new SynthesisException("Model not loaded"));
    ByteArrayOutputStream out = new ByteArrayOutputStream();

    StreamOutcome outcome = service.stream(SynthesisMode.CUSTOM, REQUEST, out);

    assertThat(outcome.isCompleted()).isFalse();
    assertThat(out.toString(StandardCharsets.UTF_8)).isEqualTo("<!--ERROR:Model not loaded-->");
    assertThat(deviceLocks.isBusy(0)).isFalse();
  }

  @Test
  void disconnectedClientReleasesDevice() throws IOException {
    when(engine.open(any(), any()))
        .thenReturn(ChunkSource.of(List.of(new AudioChunk(new float[] {0.1f}, 24000))));
    OutputStream broken =
        new OutputStream() {
          @Override
          public void write(int b) throws IOException {
            throw new IOException("Broken pipe");
          }
        };

    assertThatThrownBy(() -> service.stream(SynthesisMode.CUSTOM, REQUEST, broken))
        .isInstanceOf(IOException.class)
        .hasMessage("Broken pipe");
    assertThat(deviceLocks.isBusy(0)).isFalse();
    assertThat(cache.size()).isZero();
  }

  @Test
  void synthesizeReturnsCachedJob() {
    when(engine.open(SynthesisMode.DESIGN, REQUEST))
        .thenReturn(ChunkSource.of(List.of(new AudioChunk(new float[] {0.5f, -0.5f}, 16000))));

    AudioJob job = service.synthesize(SynthesisMode.DESIGN, REQUEST);

    assertThat(job.getSampleRate()).isEqualTo(16000);
    assertThat(job.getSampleCount()).isEqualTo(2);
    assertThat(service.findJob(job.getJobId())).isPresent();
    verify(engine).open(SynthesisMode.DESIGN, REQUEST);
  }

  @Test
  void synthesizeWrapsReadFailures() {
    when(engine.open(any(), any()))
        .thenReturn(
            () -> {
              throw new IOException("connection reset");
            });

    assertThatThrownBy(() -> service.synthesize(SynthesisMode.CLONE, REQUEST))
        .isInstanceOf(SynthesisException.class)
        .hasMessageContaining("connection reset");
    assertThat(deviceLocks.isBusy(0)).isFalse();
  }

  @Test
  void unknownJobIsEmpty() {
    assertThat(service.findJob("2b1e6a0c-9f4d-4c3b-8e7a-5d6f7a8b9c0d")).isEmpty();
  }
}
