package com.scholary.tts.streamer.client;

import com.scholary.tts.streamer.protocol.PcmCodec;
import com.scholary.tts.streamer.protocol.StreamMarkers;
import com.scholary.tts.streamer.protocol.StreamMarkers.Marker;
import com.scholary.tts.streamer.protocol.WavHeader;
import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes one streaming WAV response into scheduled playback and a rebuilt PCM artifact.
 *
 * <p>Bytes arrive in arbitrary pieces through {@link #feed}. Until a header has been read the
 * decoder also watches for an error marker sent instead of a header, which fails the stream with
 * nothing played. After the header, whenever at least {@code chunkThresholdBytes} of PCM are
 * buffered, the largest even-length prefix is converted and scheduled. Bytes from a marker prefix
 * onwards, complete or still arriving, are never treated as PCM. {@link #finish} reads the terminal
 * marker from what is left.
 *
 * <p>Not thread-safe: one decoder per stream, fed from one thread.
 */
public class StreamDecoder {

  private static final Logger LOGGER = LoggerFactory.getLogger(StreamDecoder.class);

  /** How many leading bytes are searched for an error marker sent instead of a header. */
  public static final int PROBE_WINDOW_BYTES = 512;

  public static final int MIN_SAMPLE_RATE = 4000;
  public static final int MAX_SAMPLE_RATE = 192000;

  private static final byte[] RIFF = {'R', 'I', 'F', 'F'};

  private final int chunkThresholdBytes;
  private final PlaybackScheduler scheduler;
  private final AudioSink sink;
  private final ByteArrayOutputStream artifact = new ByteArrayOutputStream();

  private byte[] buffer = new byte[8192];
  private int buffered;
  private DecoderState state = DecoderState.AWAITING_HEADER;
  private int sampleRate;
  private int scheduledBuffers;

  public StreamDecoder(int chunkThresholdBytes, PlaybackScheduler scheduler, AudioSink sink) {
    if (chunkThresholdBytes < 2) {
      throw new IllegalArgumentException("chunkThresholdBytes must be at least 2");
    }
    this.chunkThresholdBytes = chunkThresholdBytes;
    this.scheduler = scheduler;
    this.sink = sink;
  }

  /**
   * Consume the next piece of the response body.
   *
   * @throws GenerationFailedException if the server sent an error marker instead of a header
   * @throws StreamProtocolException if the stream does not open with a usable WAV header
   * @throws IllegalStateException if the decoder has already terminated
   */
  public void feed(byte[] bytes, int offset, int length) {
    if (state == DecoderState.TERMINATED) {
      throw new IllegalStateException("Decoder already terminated");
    }
    append(bytes, offset, length);

    if (state == DecoderState.AWAITING_HEADER) {
      readHeader();
    }
    if (state == DecoderState.STREAMING) {
      int usable = usablePcmBytes();
      if (usable >= chunkThresholdBytes) {
        schedule(usable);
      }
    }
  }

  public void feed(byte[] bytes) {
    feed(bytes, 0, bytes.length);
  }

  /**
   * End of the response body: schedule the final PCM and read the terminal marker.
   *
   * @return the job id, sample rate and full PCM of the stream
   * @throws GenerationFailedException if the stream ended with an error marker, even when audio was
   *     already played
   * @throws StreamProtocolException if the stream ended without a header or a terminal marker
   */
  public DecodedAudio finish() {
    if (state == DecoderState.TERMINATED) {
      throw new IllegalStateException("Decoder already terminated");
    }
    DecoderState previous = state;
    state = DecoderState.TERMINATED;

    Optional<Marker> marker = StreamMarkers.findLast(buffer, buffered);
    if (marker.isPresent() && marker.get().kind() == StreamMarkers.Kind.ERROR) {
      LOGGER.debug("Stream ended with error marker after {} buffers", scheduledBuffers);
      throw new GenerationFailedException(marker.get().value());
    }
    if (previous == DecoderState.AWAITING_HEADER) {
      throw new StreamProtocolException("Stream ended before a WAV header was received");
    }
    if (marker.isEmpty()) {
      throw new StreamProtocolException("Stream ended without a job id marker");
    }

    int pcmBytes = marker.get().start() & ~1;
    if (pcmBytes > 0) {
      schedule(pcmBytes);
    }
    return new DecodedAudio(marker.get().value(), sampleRate, artifact.toByteArray());
  }

  public DecoderState state() {
    return state;
  }

  public int scheduledBufferCount() {
    return scheduledBuffers;
  }

  /** Sample rate from the header, 0 until it has been read. */
  public int sampleRate() {
    return sampleRate;
  }

  private void readHeader() {
    if (!startsWith(RIFF)) {
      probeForErrorMarker();
      return;
    }
    if (buffered < WavHeader.SIZE) {
      return;
    }

    if (!WavHeader.hasValidMagic(buffer, buffered)) {
      throw reject("Stream does not start with a RIFF/WAVE header");
    }
    WavHeader header = WavHeader.parse(buffer, buffered);
    if (header.channels() != WavHeader.CHANNELS
        || header.bitsPerSample() != WavHeader.BITS_PER_SAMPLE) {
      throw reject(
          String.format(
              "Unsupported format: %d channels, %d bits",
              header.channels(), header.bitsPerSample()));
    }
    if (header.sampleRate() < MIN_SAMPLE_RATE || header.sampleRate() > MAX_SAMPLE_RATE) {
      throw reject("Implausible sample rate " + header.sampleRate());
    }

    sampleRate = header.sampleRate();
    consume(WavHeader.SIZE);
    state = DecoderState.STREAMING;
    LOGGER.debug("Stream header read: sampleRate={}", sampleRate);
  }

  private void probeForErrorMarker() {
    int window = Math.min(buffered, PROBE_WINDOW_BYTES);
    Optional<Marker> marker = StreamMarkers.findFirst(buffer, window);
    if (marker.isPresent() && marker.get().kind() == StreamMarkers.Kind.ERROR) {
      state = DecoderState.TERMINATED;
      throw new GenerationFailedException(marker.get().value());
    }
    boolean mayStillBeMarker =
        buffered < PROBE_WINDOW_BYTES && StreamMarkers.startsLikeErrorMarker(buffer, buffered);
    boolean mayStillBeHeader = buffered < RIFF.length && startsWithPartial(RIFF);
    if (!mayStillBeMarker && !mayStillBeHeader) {
      throw reject("Stream does not start with a RIFF/WAVE header");
    }
  }

  /** Even number of buffered bytes that are certainly PCM. */
  private int usablePcmBytes() {
    int markerStart = StreamMarkers.indexOfMarkerStart(buffer, buffered);
    if (markerStart >= 0) {
      return markerStart & ~1;
    }
    return (buffered - StreamMarkers.partialPrefixLength(buffer, buffered)) & ~1;
  }

  private void schedule(int pcmBytes) {
    float[] samples = PcmCodec.toFloat(buffer, 0, pcmBytes);
    double duration = (double) samples.length / sampleRate;
    double startTime = scheduler.scheduleNext(duration);
    sink.play(samples, sampleRate, startTime);
    artifact.write(buffer, 0, pcmBytes);
    scheduledBuffers++;
    consume(pcmBytes);
  }

  private StreamProtocolException reject(String message) {
    state = DecoderState.TERMINATED;
    return new StreamProtocolException(message);
  }

  private boolean startsWith(byte[] prefix) {
    return buffered >= prefix.length && startsWithPartial(prefix);
  }

  private boolean startsWithPartial(byte[] prefix) {
    int n = Math.min(buffered, prefix.length);
    for (int i = 0; i < n; i++) {
      if (buffer[i] != prefix[i]) {
        return false;
      }
    }
    return true;
  }

  private void append(byte[] bytes, int offset, int length) {
    if (buffered + length > buffer.length) {
      buffer = Arrays.copyOf(buffer, Math.max(buffer.length * 2, buffered + length));
    }
    System.arraycopy(bytes, offset, buffer, buffered, length);
    buffered += length;
  }

  private void consume(int count) {
    System.arraycopy(buffer, count, buffer, 0, buffered - count);
    buffered -= count;
  }
}
