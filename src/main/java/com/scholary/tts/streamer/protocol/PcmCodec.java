package com.scholary.tts.streamer.protocol;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/** Conversions between float samples, 16-bit PCM and little-endian bytes. */
public final class PcmCodec {

  /** Scale for non-negative samples when encoding; 1.0 maps to 32767. */
  public static final float ENCODE_SCALE = 32767f;

  /** Scale for negative samples when encoding, and for decoding; -1.0 and -32768 correspond. */
  public static final float DECODE_SCALE = 32768f;

  private PcmCodec() {}

  /**
   * Encode one float sample as a rounded int16, clamped to the int16 range.
   *
   * <p>Negative samples scale by 32768 so that the full range maps onto int16: 1.0 encodes as
   * 32767 and -1.0 as -32768. NaN encodes as 0.
   */
  public static short toInt16(float sample) {
    double scale = sample < 0 ? DECODE_SCALE : ENCODE_SCALE;
    long scaled = Math.round((double) sample * scale);
    if (scaled > Short.MAX_VALUE) {
      return Short.MAX_VALUE;
    }
    if (scaled < Short.MIN_VALUE) {
      return Short.MIN_VALUE;
    }
    return (short) scaled;
  }

  public static short[] toInt16(float[] samples) {
    short[] out = new short[samples.length];
    for (int i = 0; i < samples.length; i++) {
      out[i] = toInt16(samples[i]);
    }
    return out;
  }

  public static byte[] toLittleEndianBytes(short[] samples) {
    ByteBuffer buffer = ByteBuffer.allocate(samples.length * 2).order(ByteOrder.LITTLE_ENDIAN);
    buffer.asShortBuffer().put(samples);
    return buffer.array();
  }

  /**
   * Read 16-bit little-endian samples.
   *
   * @param length byte count, must be even
   */
  public static short[] fromLittleEndianBytes(byte[] bytes, int offset, int length) {
    if ((length & 1) != 0) {
      throw new IllegalArgumentException("PCM byte length must be even: " + length);
    }
    short[] out = new short[length / 2];
    ByteBuffer.wrap(bytes, offset, length).order(ByteOrder.LITTLE_ENDIAN).asShortBuffer().get(out);
    return out;
  }

  /** Decode 16-bit samples to floats as {@code sample / 32768}. */
  public static float[] toFloat(short[] samples) {
    float[] out = new float[samples.length];
    for (int i = 0; i < samples.length; i++) {
      out[i] = samples[i] / DECODE_SCALE;
    }
    return out;
  }

  /**
   * Inverse of {@link #toFloat(short[])}: scales by 32768 and clamps, so decoded samples come back
   * unchanged.
   */
  public static short[] requantize(float[] samples) {
    short[] out = new short[samples.length];
    for (int i = 0; i < samples.length; i++) {
      long scaled = Math.round((double) samples[i] * DECODE_SCALE);
      out[i] = (short) Math.max(Short.MIN_VALUE, Math.min(Short.MAX_VALUE, scaled));
    }
    return out;
  }

  /** Decode little-endian 16-bit PCM bytes straight to floats. */
  public static float[] toFloat(byte[] bytes, int offset, int length) {
    return toFloat(fromLittleEndianBytes(bytes, offset, length));
  }

  /** Read little-endian IEEE-754 float32 samples; a trailing partial sample is ignored. */
  public static float[] fromFloat32LittleEndian(byte[] bytes, int length) {
    float[] out = new float[length / 4];
    ByteBuffer.wrap(bytes, 0, out.length * 4)
        .order(ByteOrder.LITTLE_ENDIAN)
        .asFloatBuffer()
        .get(out);
    return out;
  }
}
