package com.scholary.tts.streamer.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Logs generation lifecycle events with structured fields so one stream can be followed from
 * its request to its job id or error.
 */
public class StreamEventLogger {

  private final Logger logger;

  public StreamEventLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log that a generation holds its device and is about to pull chunks. */
  public void logStreamStarted(String engine, int deviceIndex, long waitedMs) {
    try {
      MDC.put("event_type", "stream_started");
      MDC.put("engine", engine);
      MDC.put("device", String.valueOf(deviceIndex));
      MDC.put("lockWaitMs", String.valueOf(waitedMs));

      logger.info(
          "Stream started: engine={}, device={}, lockWait={}ms", engine, deviceIndex, waitedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log the header being written, which commits the response. */
  public void logHeaderSent(int sampleRate) {
    try {
      MDC.put("event_type", "header_sent");
      MDC.put("sampleRate", String.valueOf(sampleRate));

      logger.debug("Stream header sent: sampleRate={}", sampleRate);
    } finally {
      clearEventFields();
    }
  }

  /** Log a successful generation. */
  public void logStreamCompleted(
      String jobId, int chunks, long samples, int sampleRate, long elapsedMs) {
    try {
      MDC.put("event_type", "stream_completed");
      MDC.put("jobId", jobId);
      MDC.put("chunks", String.valueOf(chunks));
      MDC.put("samples", String.valueOf(samples));
      MDC.put("sampleRate", String.valueOf(sampleRate));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "Stream completed: jobId={}, chunks={}, audio={}s, elapsed={}ms",
          jobId,
          chunks,
          String.format("%.2f", sampleRate == 0 ? 0.0 : (double) samples / sampleRate),
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a generation that ended with an error marker. */
  public void logStreamFailed(
      boolean headerSent, int chunks, String errorType, String message, long elapsedMs) {
    try {
      MDC.put("event_type", "stream_failed");
      MDC.put("headerSent", String.valueOf(headerSent));
      MDC.put("chunks", String.valueOf(chunks));
      MDC.put("errorType", errorType);
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.error(
          "Stream failed: headerSent={}, chunks={}, error={}, message={}",
          headerSent,
          chunks,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Set request context in MDC. */
  public static void setRequestContext(String requestId, String mode) {
    MDC.put("requestId", requestId);
    MDC.put("mode", mode);
  }

  /** Clear request context from MDC. */
  public static void clearRequestContext() {
    MDC.remove("requestId");
    MDC.remove("mode");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("engine");
    MDC.remove("device");
    MDC.remove("lockWaitMs");
    MDC.remove("sampleRate");
    MDC.remove("jobId");
    MDC.remove("chunks");
    MDC.remove("samples");
    MDC.remove("elapsedMs");
    MDC.remove("headerSent");
    MDC.remove("errorType");
  }
}
