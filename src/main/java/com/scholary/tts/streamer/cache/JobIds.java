package com.scholary.tts.streamer.cache;

import java.util.UUID;
import java.util.regex.Pattern;

/** Job and audio ids are lower-case UUID strings; anything else is rejected before lookup. */
public final class JobIds {

  private static final Pattern ID_PATTERN =
      Pattern.compile("^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$");

  private JobIds() {}

  public static String newId() {
    return UUID.randomUUID().toString();
  }

  public static boolean isValid(String id) {
    return id != null && ID_PATTERN.matcher(id).matches();
  }
}
