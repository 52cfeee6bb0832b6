package com.scholary.tts.streamer.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory {@link ResultCache} with a fixed TTL and a maximum entry count.
 *
 * <p>Eviction is by insertion order, not by access: once the cache is over capacity the job that
 * was stored first goes first, no matter how often it was read. Expired entries are swept on every
 * insert, and an expired entry found by a lookup is removed on the spot.
 *
 * <p>All access goes through one lock, held only for the duration of a single lookup or an insert
 * plus its sweep.
 */
public class InMemoryResultCache implements ResultCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryResultCache.class);

  private final int maxEntries;
  private final Duration ttl;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();
  private final LinkedHashMap<String, AudioJob> entries = new LinkedHashMap<>();

  private long hits;
  private long misses;
  private long expirations;
  private long evictions;

  public InMemoryResultCache(int maxEntries, Duration ttl, Clock clock) {
    if (maxEntries <= 0) {
      throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
    }
    if (ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("ttl must be positive: " + ttl);
    }
    this.maxEntries = maxEntries;
    this.ttl = ttl;
    this.clock = clock;

    LOGGER.info("Initialized result cache: maxEntries={}, ttl={}", maxEntries, ttl);
  }

  @Override
  public AudioJob put(String jobId, short[] samples, int sampleRate, Instant now) {
    AudioJob job = new AudioJob(jobId, samples, sampleRate, now);
    lock.lock();
    try {
      // remove first so an overwrite counts as the newest insertion
      entries.remove(jobId);
      entries.put(jobId, job);
      int expired = sweepExpired(now);
      int evicted = evictOverCapacity();
      if (expired > 0 || evicted > 0) {
        LOGGER.debug(
            "Cache sweep after put: expired={}, evicted={}, size={}",
            expired,
            evicted,
            entries.size());
      }
    } finally {
      lock.unlock();
    }
    LOGGER.debug(
        "Cached job: jobId={}, samples={}, sampleRate={}", jobId, samples.length, sampleRate);
    return job;
  }

  @Override
  public Optional<AudioJob> get(String jobId, Instant now) {
    lock.lock();
    try {
      AudioJob job = entries.get(jobId);
      if (job == null) {
        misses++;
        LOGGER.debug("Cache miss: jobId={}", jobId);
        return Optional.empty();
      }
      if (isExpired(job, now)) {
        entries.remove(jobId);
        expirations++;
        misses++;
        LOGGER.debug("Cache entry expired: jobId={}, createdAt={}", jobId, job.getCreatedAt());
        return Optional.empty();
      }
      hits++;
      LOGGER.debug("Cache hit: jobId={}", jobId);
      return Optional.of(job);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public AudioJob put(String jobId, short[] samples, int sampleRate) {
    return put(jobId, samples, sampleRate, clock.instant());
  }

  @Override
  public Optional<AudioJob> get(String jobId) {
    return get(jobId, clock.instant());
  }

  @Override
  public int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Get cache statistics for monitoring.
   *
   * @return cache stats
   */
  public String getStats() {
    lock.lock();
    try {
      long lookups = hits + misses;
      double hitRate = lookups == 0 ? 0.0 : (double) hits / lookups;
      return String.format(
          "ResultCache[size=%d, hitRate=%.2f%%, expirations=%d, evictions=%d]",
          entries.size(), hitRate * 100, expirations, evictions);
    } finally {
      lock.unlock();
    }
  }

  private boolean isExpired(AudioJob job, Instant now) {
    return Duration.between(job.getCreatedAt(), now).compareTo(ttl) > 0;
  }

  private int sweepExpired(Instant now) {
    int removed = 0;
    Iterator<Map.Entry<String, AudioJob>> it = entries.entrySet().iterator();
    while (it.hasNext()) {
      if (isExpired(it.next().getValue(), now)) {
        it.remove();
        removed++;
      }
    }
    expirations += removed;
    return removed;
  }

  private int evictOverCapacity() {
    int removed = 0;
    Iterator<String> it = entries.keySet().iterator();
    while (entries.size() > maxEntries && it.hasNext()) {
      it.next();
      it.remove();
      removed++;
    }
    evictions += removed;
    return removed;
  }
}
