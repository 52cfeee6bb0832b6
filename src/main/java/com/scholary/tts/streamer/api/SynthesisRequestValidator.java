package com.scholary.tts.streamer.api;

import com.scholary.tts.streamer.cache.JobIds;
import com.scholary.tts.streamer.config.StreamingProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Checks the parts of a {@link SynthesisRequest} that depend on the mode or on configured limits.
 *
 * <p>Runs before a streaming response is committed, so a bad request still gets a 400 with a JSON
 * body instead of a broken audio stream.
 */
@Component
public class SynthesisRequestValidator {

  private final int maxTextLength;
  private final int maxInstructLength;

  @Autowired
  public SynthesisRequestValidator(StreamingProperties properties) {
    this(properties.limits().maxTextLength(), properties.limits().maxInstructLength());
  }

  public SynthesisRequestValidator(int maxTextLength, int maxInstructLength) {
    this.maxTextLength = maxTextLength;
    this.maxInstructLength = maxInstructLength;
  }

  /**
   * Validate a request for the given mode.
   *
   * @throws InvalidSynthesisRequestException with a client-facing message on the first violation
   */
  public void validate(SynthesisMode mode, SynthesisRequest request) {
    if (request == null) {
      throw new InvalidSynthesisRequestException("Invalid JSON");
    }
    String text = request.text();
    if (text == null || text.isBlank()) {
      throw new InvalidSynthesisRequestException("text is required");
    }
    if (text.length() > maxTextLength) {
      throw new InvalidSynthesisRequestException(
          "text exceeds maximum length of " + maxTextLength + " characters");
    }
    String instruct = request.instruct();
    if (instruct != null && instruct.length() > maxInstructLength) {
      throw new InvalidSynthesisRequestException(
          "Instruction exceeds maximum length of " + maxInstructLength + " characters");
    }

    if (mode == SynthesisMode.CLONE) {
      validateClone(request);
    } else if (mode == SynthesisMode.CUSTOM) {
      if (request.speaker() == null || request.speaker().isBlank()) {
        throw new InvalidSynthesisRequestException("Speaker is required");
      }
    } else if (instruct == null || instruct.isBlank()) {
      throw new InvalidSynthesisRequestException("Voice design instruction is required");
    }
  }

  private void validateClone(SynthesisRequest request) {
    if (request.refAudioIds().isEmpty()) {
      throw new InvalidSynthesisRequestException("At least one reference audio is required");
    }
    for (String audioId : request.refAudioIds()) {
      if (!JobIds.isValid(audioId)) {
        throw new InvalidSynthesisRequestException("Invalid audio ID: " + audioId);
      }
    }
  }
}
