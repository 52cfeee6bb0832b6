package com.scholary.tts.streamer.client;

/** The server's byte stream does not follow the streaming WAV format. Not retryable. */
public class StreamProtocolException extends RuntimeException {

  public StreamProtocolException(String message) {
    super(message);
  }
}
