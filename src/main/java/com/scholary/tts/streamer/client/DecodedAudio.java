package com.scholary.tts.streamer.client;

import com.scholary.tts.streamer.protocol.WavWriter;

/**
 * Everything a finished stream delivered.
 *
 * @param jobId id to download or replay the audio from the server's cache
 * @param sampleRate sample rate from the stream header
 * @param pcm every PCM byte received, little-endian 16-bit mono
 */
public record DecodedAudio(String jobId, int sampleRate, byte[] pcm) {

  /** Rebuild a playable WAV file with a header that states the real length. */
  public byte[] toWav() {
    return WavWriter.wrap(pcm, sampleRate);
  }

  public double durationSeconds() {
    return pcm.length / 2.0 / sampleRate;
  }
}
