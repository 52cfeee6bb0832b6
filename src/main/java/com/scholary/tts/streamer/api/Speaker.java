package com.scholary.tts.streamer.api;

/**
 * A preset voice for custom mode.
 *
 * @param name the value to send as {@code speaker}
 * @param description how the voice sounds
 * @param language the language the voice is native to
 */
public record Speaker(String name, String description, String language) {}
