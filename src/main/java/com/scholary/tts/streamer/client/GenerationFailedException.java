package com.scholary.tts.streamer.client;

/**
 * The server reported that generation failed, either as an HTTP error or as an error marker at the
 * end of the stream.
 */
public class GenerationFailedException extends RuntimeException {

  public GenerationFailedException(String message) {
    super(message);
  }
}
