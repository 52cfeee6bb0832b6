package com.scholary.tts.streamer.client;

/**
 * Output that plays buffers at scheduled times on its own clock.
 *
 * <p>Implementations must accept {@link #play} calls faster than real time and queue the buffers;
 * the decoder never waits for playback.
 */
public interface AudioSink extends AudioClock, AutoCloseable {

  /**
   * Queue mono samples in {@code [-1, 1)} to start playing at {@code startTime}.
   *
   * @param startTime position on this sink's clock, never earlier than {@link #currentTime()} at
   *     the time of scheduling
   */
  void play(float[] samples, int sampleRate, double startTime);

  /** Drop every buffer queued but not yet played. */
  void discardScheduled();

  @Override
  void close();
}
