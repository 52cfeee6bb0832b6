package com.scholary.tts.streamer.api;

import com.scholary.tts.streamer.cache.AudioJob;
import com.scholary.tts.streamer.service.SynthesisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Replay of recent generations, served from the same cache as downloads. */
@RestController
@RequestMapping("/api/history")
@Tag(name = "History", description = "Replay of recently generated audio")
public class HistoryController {

  private final SynthesisService synthesisService;

  public HistoryController(SynthesisService synthesisService) {
    this.synthesisService = synthesisService;
  }

  @GetMapping("/audio/{audioId}")
  @Operation(summary = "Play back generated audio")
  public ResponseEntity<byte[]> audio(@PathVariable String audioId) {
    AudioJob job = AudioResponses.requireJob(synthesisService, audioId);
    return AudioResponses.wav(job, AudioResponses.inlineDisposition());
  }
}
