package com.scholary.tts.streamer.engine;

import com.scholary.tts.streamer.api.SynthesisMode;
import com.scholary.tts.streamer.api.SynthesisRequest;

/**
 * A text-to-speech engine bound to one accelerator.
 *
 * <p>This abstraction keeps the delivery pipeline independent of where inference runs (a local
 * model server, a remote one, a test double).
 */
public interface SpeechEngine {

  /** Short name used in logs. */
  String name();

  /** Index of the accelerator this engine's model state lives on. */
  int deviceIndex();

  /**
   * Start a generation.
   *
   * <p>Implementations should defer the actual work to {@link ChunkSource#next()} so that failures
   * surface while the caller holds the device.
   *
   * @param mode the voice mode
   * @param request the validated request
   * @return a lazy chunk source; the caller must close it
   */
  ChunkSource open(SynthesisMode mode, SynthesisRequest request);
}
