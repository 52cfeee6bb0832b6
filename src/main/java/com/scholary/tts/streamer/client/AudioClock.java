package com.scholary.tts.streamer.client;

/** Playback time source, in seconds. */
public interface AudioClock {

  double currentTime();
}
