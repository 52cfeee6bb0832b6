package com.scholary.tts.streamer.streaming;

import com.scholary.tts.streamer.cache.AudioJob;
import com.scholary.tts.streamer.cache.JobIds;
import com.scholary.tts.streamer.cache.ResultCache;
import com.scholary.tts.streamer.engine.AudioChunk;
import com.scholary.tts.streamer.engine.ChunkSource;
import com.scholary.tts.streamer.engine.SynthesisException;
import com.scholary.tts.streamer.logging.StreamEventLogger;
import com.scholary.tts.streamer.protocol.PcmCodec;
import com.scholary.tts.streamer.protocol.StreamFrame;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Turns a {@link ChunkSource} into a WAV byte stream whose length is unknown until it ends.
 *
 * <p>The header goes out with the first chunk, once the sample rate is known. Every chunk is
 * converted to 16-bit PCM, written and flushed straight away, and also kept so the whole result
 * can be cached when the source is exhausted. The stream then ends with a job-id marker, or with
 * an error marker if the source failed.
 *
 * <p>Headers are committed before the outcome is known, so an error marker is the only way a
 * failure can reach the client.
 */
@Component
public class AudioStreamEncoder {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioStreamEncoder.class);
  private final StreamEventLogger eventLogger = new StreamEventLogger(LOGGER);

  static final String NO_AUDIO_MESSAGE = "No audio was generated";

  private final ResultCache resultCache;
  private final Supplier<String> jobIdGenerator;

  @Autowired
  public AudioStreamEncoder(ResultCache resultCache) {
    this(resultCache, JobIds::newId);
  }

  public AudioStreamEncoder(ResultCache resultCache, Supplier<String> jobIdGenerator) {
    this.resultCache = resultCache;
    this.jobIdGenerator = jobIdGenerator;
  }

  /**
   * Stream a generation to {@code out}.
   *
   * <p>Failures of the source are written to the stream as an error marker and reported in the
   * returned outcome, never thrown.
   *
   * @param source the generation to forward
   * @param out the response body
   * @return how the stream ended
   * @throws IOException only if writing to {@code out} fails
   */
  public StreamOutcome stream(ChunkSource source, OutputStream out) throws IOException {
    long start = System.nanoTime();
    SampleBuffer samples = new SampleBuffer();
    int sampleRate = 0;
    int chunks = 0;

    while (true) {
      Optional<AudioChunk> next;
      try {
        next = source.next();
      } catch (IOException | RuntimeException e) {
        return fail(out, e, sampleRate, chunks, samples.size(), start);
      }
      if (next.isEmpty()) {
        break;
      }

      AudioChunk chunk = next.get();
      if (chunks == 0) {
        sampleRate = chunk.sampleRate();
        write(out, StreamFrame.header(sampleRate));
        eventLogger.logHeaderSent(sampleRate);
      } else if (chunk.sampleRate() != sampleRate) {
        SynthesisException mismatch = rateChanged(sampleRate, chunk.sampleRate());
        return fail(out, mismatch, sampleRate, chunks, samples.size(), start);
      }

      short[] pcm = PcmCodec.toInt16(chunk.samples());
      samples.append(pcm);
      write(out, StreamFrame.PcmChunk.of(pcm));
      chunks++;
    }

    if (chunks == 0) {
      return fail(out, new SynthesisException(NO_AUDIO_MESSAGE), sampleRate, 0, 0, start);
    }

    String jobId = jobIdGenerator.get();
    resultCache.put(jobId, samples.toArray(), sampleRate);
    write(out, new StreamFrame.JobIdMarker(jobId));

    long elapsedMs = (System.nanoTime() - start) / 1_000_000;
    eventLogger.logStreamCompleted(jobId, chunks, samples.size(), sampleRate, elapsedMs);
    return StreamOutcome.completed(jobId, sampleRate, chunks, samples.size());
  }

  /**
   * Pull a whole generation without streaming it, cache it and return it.
   *
   * @throws SynthesisException if the source fails, yields nothing, or changes sample rate
   * @throws IOException if reading from the source fails
   */
  public AudioJob render(ChunkSource source) throws IOException {
    SampleBuffer samples = new SampleBuffer();
    int sampleRate = 0;
    Optional<AudioChunk> next;
    while ((next = source.next()).isPresent()) {
      AudioChunk chunk = next.get();
      if (sampleRate == 0) {
        sampleRate = chunk.sampleRate();
      } else if (chunk.sampleRate() != sampleRate) {
        throw rateChanged(sampleRate, chunk.sampleRate());
      }
      samples.append(PcmCodec.toInt16(chunk.samples()));
    }
    if (sampleRate == 0) {
      throw new SynthesisException(NO_AUDIO_MESSAGE);
    }
    return resultCache.put(jobIdGenerator.get(), samples.toArray(), sampleRate);
  }

  private StreamOutcome fail(
      OutputStream out, Exception cause, int sampleRate, int chunks, long samples, long start)
      throws IOException {
    String message = describe(cause);
    boolean headerSent = chunks > 0;
    long elapsedMs = (System.nanoTime() - start) / 1_000_000;
    eventLogger.logStreamFailed(
        headerSent, chunks, cause.getClass().getSimpleName(), message, elapsedMs);
    LOGGER.debug("Generation failure detail", cause);

    write(out, new StreamFrame.ErrorMarker(message));
    return StreamOutcome.failed(message, sampleRate, chunks, samples);
  }

  private static SynthesisException rateChanged(int from, int to) {
    return new SynthesisException(
        String.format("Sample rate changed mid-stream from %d to %d", from, to));
  }

  private static String describe(Exception cause) {
    String message = cause.getMessage();
    return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
  }

  private static void write(OutputStream out, StreamFrame frame) throws IOException {
    out.write(frame.toBytes());
    out.flush();
  }

  /** Growable short array holding every sample sent so far. */
  private static final class SampleBuffer {

    private short[] data = new short[8192];
    private int size;

    void append(short[] samples) {
      if (size + samples.length > data.length) {
        data = Arrays.copyOf(data, Math.max(data.length * 2, size + samples.length));
      }
      System.arraycopy(samples, 0, data, size, samples.length);
      size += samples.length;
    }

    int size() {
      return size;
    }

    short[] toArray() {
      return Arrays.copyOf(data, size);
    }
  }
}
