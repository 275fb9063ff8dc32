package com.scholary.meeting.handler.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.scholary.meeting.handler.transcript.Turn;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory implementation of ChunkResultCache using Caffeine.
 *
 * <p>Entries expire after a configurable time so abandoned meetings do not hold memory forever.
 * Size is bounded; oldest entries are evicted first. Results that age out must be resubmitted or
 * read from the object store.
 */
public class InMemoryChunkResultCache implements ChunkResultCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryChunkResultCache.class);

  private final Cache<String, List<Turn>> cache;

  public InMemoryChunkResultCache(long maxSize, Duration ttl) {
    this.cache =
        Caffeine.newBuilder().maximumSize(maxSize).expireAfterWrite(ttl).recordStats().build();

    LOGGER.info("Initialized chunk result cache: maxSize={}, ttl={}", maxSize, ttl);
  }

  @Override
  public void put(String meetingId, int chunkIndex, List<Turn> turns) {
    String cacheKey = ChunkResultCache.generateKey(meetingId, chunkIndex);
    cache.put(cacheKey, List.copyOf(turns));
    LOGGER.debug("Cached chunk result: key={}, turns={}", cacheKey, turns.size());
  }

  @Override
  public Optional<List<Turn>> get(String meetingId, int chunkIndex) {
    String cacheKey = ChunkResultCache.generateKey(meetingId, chunkIndex);
    List<Turn> turns = cache.getIfPresent(cacheKey);
    LOGGER.debug("Chunk result {} for {}", turns == null ? "absent" : "found", cacheKey);
    return Optional.ofNullable(turns);
  }

  @Override
  public void evictMeeting(String meetingId) {
    String prefix = ChunkResultCache.generateMeetingPrefix(meetingId);
    List<String> keys =
        cache.asMap().keySet().stream().filter(k -> k.startsWith(prefix)).toList();
    cache.invalidateAll(keys);
    LOGGER.info(
        "Evicted {} chunk results for meeting {}: {}", keys.size(), meetingId, describe());
  }

  private String describe() {
    CacheStats stats = cache.stats();
    return String.format(
        "%d results held, %.1f%% hit rate, %d expired or evicted",
        cache.estimatedSize(), stats.hitRate() * 100, stats.evictionCount());
  }
}
