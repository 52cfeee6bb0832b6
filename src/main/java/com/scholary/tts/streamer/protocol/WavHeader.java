package com.scholary.tts.streamer.protocol;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * The canonical 44-byte RIFF/WAVE header for PCM audio.
 *
 * <p>Layout (little-endian):
 *
 * <pre>
 *  0  "RIFF"          4  riff size        8  "WAVE"
 * 12  "fmt "         16  16 (fmt size)   20  1 (PCM)     22  channels
 * 24  sample rate    28  byte rate       32  block align 34  bits per sample
 * 36  "data"         40  data size
 * </pre>
 *
 * <p>A streaming header does not know its length yet, so the riff size is {@code 0xFFFFFFFF} and
 * the data size is {@code 0xFFFFFFFF - 36}.
 */
public record WavHeader(int sampleRate, int channels, int bitsPerSample, long dataSize) {

  public static final int SIZE = 44;
  public static final int SAMPLE_RATE_OFFSET = 24;
  public static final int CHANNELS = 1;
  public static final int BITS_PER_SAMPLE = 16;

  /** Riff size of a stream whose length is not known up front. */
  public static final long UNKNOWN_SIZE = 0xFFFFFFFFL;

  /** Data size of a stream whose length is not known up front. */
  public static final long UNKNOWN_DATA_SIZE = UNKNOWN_SIZE - 36;

  private static final byte[] RIFF = ascii("RIFF");
  private static final byte[] WAVE = ascii("WAVE");
  private static final byte[] FMT = ascii("fmt ");
  private static final byte[] DATA = ascii("data");
  private static final short FORMAT_PCM = 1;

  public int byteRate() {
    return sampleRate * channels * bitsPerSample / 8;
  }

  public int blockAlign() {
    return channels * bitsPerSample / 8;
  }

  public boolean isStreaming() {
    return dataSize == UNKNOWN_DATA_SIZE;
  }

  /** Header for a mono 16-bit stream of unknown length. */
  public static WavHeader streaming(int sampleRate) {
    return new WavHeader(sampleRate, CHANNELS, BITS_PER_SAMPLE, UNKNOWN_DATA_SIZE);
  }

  /** Header for a mono 16-bit file whose PCM payload is exactly {@code dataBytes} long. */
  public static WavHeader forData(int sampleRate, long dataBytes) {
    return new WavHeader(sampleRate, CHANNELS, BITS_PER_SAMPLE, dataBytes);
  }

  /** Serialize to the 44-byte wire layout. */
  public byte[] toBytes() {
    long riffSize = isStreaming() ? UNKNOWN_SIZE : 36 + dataSize;
    ByteBuffer buffer = ByteBuffer.allocate(SIZE).order(ByteOrder.LITTLE_ENDIAN);
    buffer.put(RIFF);
    buffer.putInt((int) riffSize);
    buffer.put(WAVE);
    buffer.put(FMT);
    buffer.putInt(16);
    buffer.putShort(FORMAT_PCM);
    buffer.putShort((short) channels);
    buffer.putInt(sampleRate);
    buffer.putInt(byteRate());
    buffer.putShort((short) blockAlign());
    buffer.putShort((short) bitsPerSample);
    buffer.put(DATA);
    buffer.putInt((int) dataSize);
    return buffer.array();
  }

  /**
   * Check the RIFF, WAVE, fmt and data identifiers at their fixed offsets.
   *
   * @param bytes buffer starting at the header
   * @param length number of valid bytes in {@code bytes}
   */
  public static boolean hasValidMagic(byte[] bytes, int length) {
    return length >= SIZE
        && regionEquals(bytes, 0, RIFF)
        && regionEquals(bytes, 8, WAVE)
        && regionEquals(bytes, 12, FMT)
        && regionEquals(bytes, 36, DATA);
  }

  /**
   * Read a header from the first 44 bytes of {@code bytes}.
   *
   * @throws IllegalArgumentException if fewer than 44 bytes are available or the magic is wrong
   */
  public static WavHeader parse(byte[] bytes, int length) {
    if (length < SIZE) {
      throw new IllegalArgumentException("WAV header needs " + SIZE + " bytes, got " + length);
    }
    if (!hasValidMagic(bytes, length)) {
      throw new IllegalArgumentException("Missing RIFF/WAVE identifiers");
    }
    ByteBuffer buffer = ByteBuffer.wrap(bytes, 0, SIZE).order(ByteOrder.LITTLE_ENDIAN);
    int channels = Short.toUnsignedInt(buffer.getShort(22));
    int sampleRate = buffer.getInt(SAMPLE_RATE_OFFSET);
    int bitsPerSample = Short.toUnsignedInt(buffer.getShort(34));
    long dataSize = Integer.toUnsignedLong(buffer.getInt(40));
    return new WavHeader(sampleRate, channels, bitsPerSample, dataSize);
  }

  private static boolean regionEquals(byte[] bytes, int offset, byte[] expected) {
    for (int i = 0; i < expected.length; i++) {
      if (bytes[offset + i] != expected[i]) {
        return false;
      }
    }
    return true;
  }

  private static byte[] ascii(String s) {
    return s.getBytes(StandardCharsets.US_ASCII);
  }
}
