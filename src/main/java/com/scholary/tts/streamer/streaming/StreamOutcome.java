package com.scholary.tts.streamer.streaming;

/**
 * How one stream ended.
 *
 * @param status completed with a job id, or failed with an error marker
 * @param jobId the cached job, null on failure
 * @param error the message written in the error marker, null on success
 * @param sampleRate the stream's sample rate, 0 if no header was sent
 * @param chunks number of PCM chunks written
 * @param samples number of samples written
 */
public record StreamOutcome(
    Status status, String jobId, String error, int sampleRate, int chunks, long samples) {

  public enum Status {
    COMPLETED,
    FAILED
  }

  public static StreamOutcome completed(String jobId, int sampleRate, int chunks, long samples) {
    return new StreamOutcome(Status.COMPLETED, jobId, null, sampleRate, chunks, samples);
  }

  public static StreamOutcome failed(String error, int sampleRate, int chunks, long samples) {
    return new StreamOutcome(Status.FAILED, null, error, sampleRate, chunks, samples);
  }

  public boolean isCompleted() {
    return status == Status.COMPLETED;
  }

  public boolean headerSent() {
    return chunks > 0;
  }
}
