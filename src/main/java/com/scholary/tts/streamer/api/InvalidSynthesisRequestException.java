package com.scholary.tts.streamer.api;

/** Thrown when a generation request is rejected before any work starts. */
public class InvalidSynthesisRequestException extends RuntimeException {

  public InvalidSynthesisRequestException(String message) {
    super(message);
  }
}
