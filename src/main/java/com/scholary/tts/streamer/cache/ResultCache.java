package com.scholary.tts.streamer.cache;

import java.time.Instant;
import java.util.Optional;

/**
 * Store of finished generations keyed by job id, so a result can be downloaded or replayed after
 * its stream has ended.
 *
 * <p>Entries are bounded both by age (TTL) and by count. Lookups of expired entries behave as if
 * the entry had never existed.
 */
public interface ResultCache {

  /**
   * Store a finished job, timestamped {@code now}.
   *
   * <p>Overwrites any entry with the same id. Afterwards every entry older than the TTL is removed,
   * then the oldest-inserted entries are removed until the cache is within capacity.
   *
   * @param jobId the job id
   * @param samples 16-bit PCM samples
   * @param sampleRate the sample rate of {@code samples}
   * @param now the insertion time
   * @return the stored job
   */
  AudioJob put(String jobId, short[] samples, int sampleRate, Instant now);

  /**
   * Look up a job as of {@code now}.
   *
   * @return the job, or empty if absent or older than the TTL (an expired entry is removed)
   */
  Optional<AudioJob> get(String jobId, Instant now);

  /** {@link #put(String, short[], int, Instant)} at the current time. */
  AudioJob put(String jobId, short[] samples, int sampleRate);

  /** {@link #get(String, Instant)} at the current time. */
  Optional<AudioJob> get(String jobId);

  /** Number of entries currently held, expired ones included until they are swept. */
  int size();
}
