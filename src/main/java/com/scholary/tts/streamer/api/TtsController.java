package com.scholary.tts.streamer.api;

import com.scholary.tts.streamer.cache.AudioJob;
import com.scholary.tts.streamer.logging.StreamEventLogger;
import com.scholary.tts.streamer.service.SynthesisService;
import com.scholary.tts.streamer.streaming.StreamOutcome;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

/**
 * REST API for speech generation.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Streaming generation: audio is sent as it is produced, ending with a job id marker
 *   <li>One-shot generation: the whole WAV in one response
 *   <li>Download of a finished generation while it is still cached
 *   <li>The preset speakers and languages a request may name
 * </ul>
 */
@RestController
@RequestMapping("/api/tts")
@Tag(name = "TTS", description = "Speech generation with streaming delivery")
public class TtsController {

  private static final Logger LOGGER = LoggerFactory.getLogger(TtsController.class);

  static final List<String> LANGUAGES =
      List.of(
          "Chinese",
          "English",
          "Japanese",
          "Korean",
          "German",
          "French",
          "Russian",
          "Portuguese",
          "Spanish",
          "Italian",
          "Auto");

  static final List<Speaker> SPEAKERS =
      List.of(
          new Speaker("Vivian", "Bright, slightly edgy young female voice", "Chinese"),
          new Speaker("Serena", "Warm, gentle young female voice", "Chinese"),
          new Speaker("Uncle_Fu", "Seasoned male voice with a low, mellow timbre", "Chinese"),
          new Speaker(
              "Dylan",
              "Youthful Beijing male voice with clear, natural timbre",
              "Chinese (Beijing)"),
          new Speaker(
              "Eric",
              "Lively Chengdu male voice with slightly husky brightness",
              "Chinese (Sichuan)"),
          new Speaker("Ryan", "Dynamic male voice with strong rhythmic drive", "English"),
          new Speaker("Aiden", "Sunny American male voice with clear midrange", "English"),
          new Speaker(
              "Ono_Anna", "Playful Japanese female voice with light, nimble timbre", "Japanese"),
          new Speaker("Sohee", "Warm Korean female voice with rich emotion", "Korean"));

  private final SynthesisService synthesisService;
  private final SynthesisRequestValidator validator;

  public TtsController(SynthesisService synthesisService, SynthesisRequestValidator validator) {
    this.synthesisService = synthesisService;
    this.validator = validator;
  }

  /**
   * Generate speech and stream it while it is produced.
   *
   * <p>The body is a WAV header with unknown sizes, raw 16-bit PCM as each chunk is generated, and
   * a trailing {@code <!--JOB_ID:...-->} marker. A failure during generation ends the body with
   * {@code <!--ERROR:...-->} instead; the status is already 200 by then.
   */
  @PostMapping("/{mode}/stream")
  @Operation(
      summary = "Stream generated speech",
      description =
          "Streams a WAV whose length is unknown up front. "
              + "The stream ends with a job id marker on success or an error marker on failure. "
              + "Invalid requests are rejected with 400 before any audio is sent.")
  public ResponseEntity<StreamingResponseBody> stream(
      @PathVariable String mode, @Valid @RequestBody SynthesisRequest request) {
    SynthesisMode synthesisMode = SynthesisMode.fromPath(mode);
    validator.validate(synthesisMode, request);

    String requestId = UUID.randomUUID().toString();
    LOGGER.info(
        "Stream request: requestId={}, mode={}, textLength={}",
        requestId,
        synthesisMode.pathValue(),
        request.text().length());

    StreamingResponseBody body =
        out -> {
          try {
            StreamEventLogger.setRequestContext(requestId, synthesisMode.pathValue());
            StreamOutcome outcome = synthesisService.stream(synthesisMode, request, out);
            LOGGER.debug("Stream ended: requestId={}, status={}", requestId, outcome.status());
          } finally {
            StreamEventLogger.clearRequestContext();
          }
        };

    return ResponseEntity.ok()
        .contentType(AudioResponses.AUDIO_WAV)
        .cacheControl(CacheControl.noCache())
        .body(body);
  }

  /** Generate speech and return it as one WAV file. */
  @PostMapping("/{mode}")
  @Operation(
      summary = "Generate speech",
      description = "Returns the whole WAV once generation finishes, with its job id in X-Job-Id.")
  public ResponseEntity<byte[]> synthesize(
      @PathVariable String mode, @Valid @RequestBody SynthesisRequest request) {
    SynthesisMode synthesisMode = SynthesisMode.fromPath(mode);
    validator.validate(synthesisMode, request);

    String requestId = UUID.randomUUID().toString();
    try {
      StreamEventLogger.setRequestContext(requestId, synthesisMode.pathValue());
      LOGGER.info(
          "Generate request: mode={}, textLength={}",
          synthesisMode.pathValue(),
          request.text().length());

      AudioJob job = synthesisService.synthesize(synthesisMode, request);
      return AudioResponses.wav(job, AudioResponses.inlineDisposition());
    } finally {
      StreamEventLogger.clearRequestContext();
    }
  }

  /** Download a finished generation as a WAV attachment. */
  @GetMapping("/download/{jobId}")
  @Operation(
      summary = "Download generated audio",
      description = "Returns 404 once the job has expired or been evicted from the cache.")
  public ResponseEntity<byte[]> download(@PathVariable String jobId) {
    AudioJob job = AudioResponses.requireJob(synthesisService, jobId);
    LOGGER.info("Download: jobId={}, duration={}s", jobId, job.getDurationSeconds());
    return AudioResponses.wav(job, AudioResponses.downloadDisposition(jobId));
  }

  /** List the preset speakers available in custom mode. */
  @GetMapping("/speakers")
  @Operation(summary = "List preset speakers")
  public List<Speaker> speakers() {
    return SPEAKERS;
  }

  /** List the languages the engine accepts. */
  @GetMapping("/languages")
  @Operation(summary = "List supported languages")
  public List<String> languages() {
    return LANGUAGES;
  }
}
