package com.scholary.tts.streamer.service;

import com.scholary.tts.streamer.api.SynthesisMode;
import com.scholary.tts.streamer.api.SynthesisRequest;
import com.scholary.tts.streamer.cache.AudioJob;
import com.scholary.tts.streamer.cache.ResultCache;
import com.scholary.tts.streamer.device.DeviceLease;
import com.scholary.tts.streamer.device.DeviceLockRegistry;
import com.scholary.tts.streamer.engine.ChunkSource;
import com.scholary.tts.streamer.engine.SpeechEngine;
import com.scholary.tts.streamer.engine.SynthesisException;
import com.scholary.tts.streamer.logging.StreamEventLogger;
import com.scholary.tts.streamer.streaming.AudioStreamEncoder;
import com.scholary.tts.streamer.streaming.StreamOutcome;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs generations on the engine's device and hands finished results to the cache.
 *
 * <p>A generation holds its device lease from the first chunk pull until the source is closed, so
 * only one generation runs per accelerator while others wait on the lock. The lease is released
 * on every exit path, including a client that disconnects mid-stream.
 */
@Service
public class SynthesisService {

  private static final Logger LOGGER = LoggerFactory.getLogger(SynthesisService.class);
  private final StreamEventLogger eventLogger = new StreamEventLogger(LOGGER);

  private final SpeechEngine engine;
  private final DeviceLockRegistry deviceLocks;
  private final AudioStreamEncoder encoder;
  private final ResultCache resultCache;

  public SynthesisService(
      SpeechEngine engine,
      DeviceLockRegistry deviceLocks,
      AudioStreamEncoder encoder,
      ResultCache resultCache) {
    this.engine = engine;
    this.deviceLocks = deviceLocks;
    this.encoder = encoder;
    this.resultCache = resultCache;
  }

  /**
   * Generate speech and stream it to {@code out} as it is produced.
   *
   * @return how the stream ended; generation failures end up here, not as exceptions
   * @throws IOException if writing to {@code out} fails
   */
  public StreamOutcome stream(SynthesisMode mode, SynthesisRequest request, OutputStream out)
      throws IOException {
    long waitStart = System.nanoTime();
    try (DeviceLease lease = deviceLocks.acquire(engine.deviceIndex())) {
      eventLogger.logStreamStarted(
          engine.name(), lease.deviceIndex(), (System.nanoTime() - waitStart) / 1_000_000);
      try (ChunkSource source = openOrFail(mode, request)) {
        return encoder.stream(source, out);
      }
    }
  }

  /**
   * Generate speech in one piece.
   *
   * @return the cached job
   * @throws SynthesisException if the generation fails
   */
  public AudioJob synthesize(SynthesisMode mode, SynthesisRequest request) {
    long waitStart = System.nanoTime();
    try (DeviceLease lease = deviceLocks.acquire(engine.deviceIndex())) {
      eventLogger.logStreamStarted(
          engine.name(), lease.deviceIndex(), (System.nanoTime() - waitStart) / 1_000_000);
      try (ChunkSource source = engine.open(mode, request)) {
        AudioJob job = encoder.render(source);
        LOGGER.info(
            "Generation completed: jobId={}, duration={}s",
            job.getJobId(),
            String.format("%.2f", job.getDurationSeconds()));
        return job;
      }
    } catch (IOException e) {
      throw new SynthesisException("Generation failed: " + e.getMessage(), e);
    }
  }

  /** An engine that refuses to start still has to end the stream with an error marker. */
  private ChunkSource openOrFail(SynthesisMode mode, SynthesisRequest request) {
    try {
      return engine.open(mode, request);
    } catch (SynthesisException e) {
      return () -> {
        throw e;
      };
    }
  }

  /** Look up a finished generation for download or replay. */
  public Optional<AudioJob> findJob(String jobId) {
    return resultCache.get(jobId);
  }
}
