package com.scholary.tts.streamer.api;

import jakarta.validation.constraints.NotBlank;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Request for generating speech.
 *
 * <p>Which fields matter depends on the mode: clone needs reference audio ids (with optional
 * transcripts), custom needs a speaker, design needs a voice instruction. Mode-specific rules and
 * length limits are checked by {@link SynthesisRequestValidator}.
 */
public record SynthesisRequest(
    @NotBlank(message = "text is required") String text,
    String language,
    String speaker,
    String instruct,
    List<String> refAudioIds,
    List<String> refTexts,
    Boolean fast) {

  // Provide defaults
  public SynthesisRequest {
    if (language == null || language.isBlank()) {
      language = "English";
    }
    // lists may hold nulls: a clone sample without a transcript
    refAudioIds = copyOf(refAudioIds);
    refTexts = copyOf(refTexts);
    if (fast == null) {
      fast = false;
    }
  }

  private static List<String> copyOf(List<String> values) {
    return values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
  }

  public static SynthesisRequest custom(String text, String speaker) {
    return new SynthesisRequest(text, null, speaker, null, null, null, null);
  }

  public static SynthesisRequest design(String text, String instruct) {
    return new SynthesisRequest(text, null, null, instruct, null, null, null);
  }
}
