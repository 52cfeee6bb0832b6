package com.scholary.tts.streamer.protocol;

/**
 * One unit written to a streaming response.
 *
 * <p>A stream is {@code Header PcmChunk* (JobIdMarker | ErrorMarker)}. A generation that fails
 * before its first chunk writes only an {@link ErrorMarker}.
 */
public interface StreamFrame {

  byte[] toBytes();

  static StreamFrame header(int sampleRate) {
    return new Header(WavHeader.streaming(sampleRate));
  }

  record Header(WavHeader header) implements StreamFrame {
    @Override
    public byte[] toBytes() {
      return header.toBytes();
    }
  }

  record PcmChunk(byte[] bytes) implements StreamFrame {
    public static PcmChunk of(short[] samples) {
      return new PcmChunk(PcmCodec.toLittleEndianBytes(samples));
    }

    @Override
    public byte[] toBytes() {
      return bytes;
    }
  }

  record ErrorMarker(String message) implements StreamFrame {
    @Override
    public byte[] toBytes() {
      return StreamMarkers.error(message);
    }
  }

  record JobIdMarker(String jobId) implements StreamFrame {
    @Override
    public byte[] toBytes() {
      return StreamMarkers.jobId(jobId);
    }
  }
}
