package com.scholary.tts.streamer.api;

import com.scholary.tts.streamer.cache.AudioJob;
import com.scholary.tts.streamer.cache.JobIds;
import com.scholary.tts.streamer.protocol.WavWriter;
import com.scholary.tts.streamer.service.SynthesisService;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

/** Builds WAV responses for cached jobs. */
final class AudioResponses {

  static final MediaType AUDIO_WAV = MediaType.parseMediaType("audio/wav");
  static final String JOB_ID_HEADER = "X-Job-Id";

  private AudioResponses() {}

  /**
   * Look up a cached job by an id taken from the URL.
   *
   * @throws InvalidSynthesisRequestException if the id is not a job id
   * @throws AudioNotFoundException if nothing (or only an expired entry) is cached under it
   */
  static AudioJob requireJob(SynthesisService service, String jobId) {
    if (!JobIds.isValid(jobId)) {
      throw new InvalidSynthesisRequestException("Invalid job ID");
    }
    return service.findJob(jobId).orElseThrow(() -> new AudioNotFoundException(jobId));
  }

  static ResponseEntity<byte[]> wav(AudioJob job, ContentDisposition disposition) {
    byte[] body = WavWriter.write(job.getSamples(), job.getSampleRate());
    return ResponseEntity.ok()
        .contentType(AUDIO_WAV)
        .contentLength(body.length)
        .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
        .header(JOB_ID_HEADER, job.getJobId())
        .body(body);
  }

  static ContentDisposition downloadDisposition(String jobId) {
    return ContentDisposition.attachment()
        .filename("generated_" + jobId.substring(0, 8) + ".wav")
        .build();
  }

  static ContentDisposition inlineDisposition() {
    return ContentDisposition.inline().filename("output.wav").build();
  }
}
