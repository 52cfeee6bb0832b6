package com.scholary.tts.streamer.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * In-band terminal markers appended after the last PCM byte of a stream.
 *
 * <p>{@code <!--JOB_ID:<id>-->} ends a successful stream; {@code <!--ERROR:<message>-->} ends a
 * failed one. Markers are plain text following binary PCM, so a consumer finds them by scanning the
 * tail of the stream as text. PCM that happens to contain a marker-shaped byte sequence is
 * indistinguishable from a real marker; the framing does not guard against it.
 */
public final class StreamMarkers {

  public static final String JOB_ID_PREFIX = "<!--JOB_ID:";
  public static final String ERROR_PREFIX = "<!--ERROR:";
  public static final String SUFFIX = "-->";

  private static final byte[] JOB_ID_PREFIX_BYTES =
      JOB_ID_PREFIX.getBytes(StandardCharsets.US_ASCII);
  private static final byte[] ERROR_PREFIX_BYTES =
      ERROR_PREFIX.getBytes(StandardCharsets.US_ASCII);

  // ISO-8859-1 keeps byte offsets and char offsets identical
  private static final Pattern MARKER =
      Pattern.compile("<!--(JOB_ID|ERROR):(.*?)-->", Pattern.DOTALL);

  private StreamMarkers() {}

  public enum Kind {
    JOB_ID,
    ERROR
  }

  /**
   * A marker located in a byte buffer.
   *
   * @param kind job id or error
   * @param value the id or the message
   * @param start offset of the first marker byte
   * @param end offset just past the last marker byte
   */
  public record Marker(Kind kind, String value, int start, int end) {}

  public static byte[] jobId(String jobId) {
    return (JOB_ID_PREFIX + jobId + SUFFIX).getBytes(StandardCharsets.US_ASCII);
  }

  public static byte[] error(String message) {
    return (ERROR_PREFIX + sanitize(message) + SUFFIX).getBytes(StandardCharsets.UTF_8);
  }

  /** Strip anything that would end the marker early or break it across lines. */
  public static String sanitize(String message) {
    if (message == null || message.isBlank()) {
      return "Generation failed";
    }
    return message.replace("\r", " ").replace("\n", " ").replace(SUFFIX, "- ->").trim();
  }

  /** Find the first complete marker in {@code bytes[0, length)}. */
  public static Optional<Marker> findFirst(byte[] bytes, int length) {
    Matcher matcher = MARKER.matcher(latin1(bytes, length));
    if (matcher.find()) {
      return Optional.of(toMarker(bytes, matcher));
    }
    return Optional.empty();
  }

  /** Find the last complete marker in {@code bytes[0, length)}. */
  public static Optional<Marker> findLast(byte[] bytes, int length) {
    Matcher matcher = MARKER.matcher(latin1(bytes, length));
    Marker last = null;
    while (matcher.find()) {
      last = toMarker(bytes, matcher);
    }
    return Optional.ofNullable(last);
  }

  /**
   * Offset of the first complete marker prefix ({@code <!--JOB_ID:} or {@code <!--ERROR:}), or -1.
   */
  public static int indexOfMarkerStart(byte[] bytes, int length) {
    int jobId = indexOf(bytes, length, JOB_ID_PREFIX_BYTES);
    int error = indexOf(bytes, length, ERROR_PREFIX_BYTES);
    if (jobId < 0) {
      return error;
    }
    if (error < 0) {
      return jobId;
    }
    return Math.min(jobId, error);
  }

  /**
   * Length of the longest tail of {@code bytes[0, length)} that could be the beginning of a marker
   * prefix still being received, or 0.
   */
  public static int partialPrefixLength(byte[] bytes, int length) {
    int longest = Math.max(JOB_ID_PREFIX_BYTES.length, ERROR_PREFIX_BYTES.length) - 1;
    for (int n = Math.min(longest, length); n > 0; n--) {
      if (tailMatches(bytes, length, JOB_ID_PREFIX_BYTES, n)
          || tailMatches(bytes, length, ERROR_PREFIX_BYTES, n)) {
        return n;
      }
    }
    return 0;
  }

  /** True if the buffer opens with an error marker prefix, complete or still arriving. */
  public static boolean startsLikeErrorMarker(byte[] bytes, int length) {
    int n = Math.min(length, ERROR_PREFIX_BYTES.length);
    if (n == 0) {
      return false;
    }
    for (int i = 0; i < n; i++) {
      if (bytes[i] != ERROR_PREFIX_BYTES[i]) {
        return false;
      }
    }
    return true;
  }

  private static boolean tailMatches(byte[] bytes, int length, byte[] prefix, int n) {
    if (n > prefix.length) {
      return false;
    }
    int offset = length - n;
    for (int i = 0; i < n; i++) {
      if (bytes[offset + i] != prefix[i]) {
        return false;
      }
    }
    return true;
  }

  private static int indexOf(byte[] bytes, int length, byte[] needle) {
    outer:
    for (int i = 0; i <= length - needle.length; i++) {
      for (int j = 0; j < needle.length; j++) {
        if (bytes[i + j] != needle[j]) {
          continue outer;
        }
      }
      return i;
    }
    return -1;
  }

  private static Marker toMarker(byte[] bytes, Matcher matcher) {
    Kind kind = Kind.valueOf(matcher.group(1));
    int valueStart = matcher.start(2);
    String value =
        new String(bytes, valueStart, matcher.end(2) - valueStart, StandardCharsets.UTF_8);
    return new Marker(kind, value, matcher.start(), matcher.end());
  }

  private static String latin1(byte[] bytes, int length) {
    return new String(bytes, 0, length, StandardCharsets.ISO_8859_1);
  }
}
