package com.scholary.tts.streamer.api;

/** Thrown when a job id is well-formed but its audio is not cached, or has expired. */
public class AudioNotFoundException extends RuntimeException {

  private final String jobId;

  public AudioNotFoundException(String jobId) {
    super("Audio not found or expired");
    this.jobId = jobId;
  }

  public String getJobId() {
    return jobId;
  }
}
