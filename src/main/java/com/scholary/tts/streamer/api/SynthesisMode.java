package com.scholary.tts.streamer.api;

import java.util.Locale;

/**
 * Voice mode for speech generation.
 *
 * <ul>
 *   <li>CLONE: Imitate the voice of one or more uploaded reference recordings
 *   <li>CUSTOM: Use one of the engine's preset speakers, optionally with a style instruction
 *   <li>DESIGN: Describe the voice in words and let the engine build it
 * </ul>
 */
public enum SynthesisMode {
  CLONE,
  CUSTOM,
  DESIGN;

  /** Lower-case form used in URL paths. */
  public String pathValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Resolve a mode from its URL path segment.
   *
   * @throws InvalidSynthesisRequestException if the segment names no mode
   */
  public static SynthesisMode fromPath(String value) {
    for (SynthesisMode mode : values()) {
      if (mode.pathValue().equals(value)) {
        return mode;
      }
    }
    throw new InvalidSynthesisRequestException("Unknown mode: " + value);
  }
}
