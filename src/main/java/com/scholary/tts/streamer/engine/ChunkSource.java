package com.scholary.tts.streamer.engine;

import java.io.Closeable;
import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * A finite, ordered, single-pass sequence of audio chunks from one generation.
 *
 * <p>Generation is lazy: work happens as {@link #next()} is called. The sample rate is the same for
 * every chunk of one source. {@code next()} may fail at any point, including after it has already
 * returned chunks.
 */
public interface ChunkSource extends Closeable {

  /**
   * Pull the next chunk.
   *
   * @return the chunk, or empty once the generation has finished
   * @throws IOException if reading from the engine fails
   * @throws SynthesisException if the engine reports a generation failure
   */
  Optional<AudioChunk> next() throws IOException;

  @Override
  default void close() throws IOException {}

  /** A source over chunks that already exist. */
  static ChunkSource of(List<AudioChunk> chunks) {
    Iterator<AudioChunk> iterator = List.copyOf(chunks).iterator();
    return () -> iterator.hasNext() ? Optional.of(iterator.next()) : Optional.empty();
  }
}
