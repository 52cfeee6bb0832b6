package com.scholary.tts.streamer.protocol;

/**
 * Builds complete, length-correct WAV files for download and replay.
 *
 * <p>Format: mono, 16-bit signed PCM, little-endian, at the given sample rate.
 */
public final class WavWriter {

  private WavWriter() {}

  public static byte[] write(short[] samples, int sampleRate) {
    return wrap(PcmCodec.toLittleEndianBytes(samples), sampleRate);
  }

  /** Prefix raw PCM bytes with a header declaring their exact length. */
  public static byte[] wrap(byte[] pcm, int sampleRate) {
    byte[] header = WavHeader.forData(sampleRate, pcm.length).toBytes();
    byte[] wav = new byte[header.length + pcm.length];
    System.arraycopy(header, 0, wav, 0, header.length);
    System.arraycopy(pcm, 0, wav, header.length, pcm.length);
    return wav;
  }
}
