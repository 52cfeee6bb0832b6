package com.scholary.tts.streamer.engine;

/**
 * Exception thrown when a speech engine fails to generate audio.
 *
 * <p>This could be due to the inference server being unreachable, rejecting the request, or
 * failing partway through a generation.
 */
public class SynthesisException extends RuntimeException {

  public SynthesisException(String message) {
    super(message);
  }

  public SynthesisException(String message, Throwable cause) {
    super(message, cause);
  }
}
