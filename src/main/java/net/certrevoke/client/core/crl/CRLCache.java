package net.certrevoke.client.core.crl;

import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import net.certrevoke.client.log.RevokeLogger;
import net.certrevoke.client.log.RevokeLoggerFactory;

/**
 * Source key to CRL map. Every access holds the supplied lock, which is shared with the checker
 * configuration, and nothing slow ever runs under it. Entries are replaced wholesale.
 */
class CRLCache {
  private static final RevokeLogger logger = RevokeLoggerFactory.getLogger(CRLCache.class);

  private final Map<String, CRLCacheEntry> cache = new HashMap<>();
  private final Lock lock;

  CRLCache(Lock lock) {
    this.lock = lock;
  }

  /**
   * @return the entry for the key if it is still usable at {@code now}; an expired entry is removed
   *     and null returned
   */
  CRLCacheEntry getValid(String sourceKey, Instant now) {
    lock.lock();
    try {
      CRLCacheEntry entry = cache.get(sourceKey);
      if (entry == null) {
        return null;
      }
      if (entry.isCrlExpired(now)) {
        logger.debug(
            "Evicting expired CRL for {}, next update was {}",
            sourceKey,
            entry.getRevocationList().getNextUpdate());
        cache.remove(sourceKey);
        return null;
      }
      return entry;
    } finally {
      lock.unlock();
    }
  }

  void put(String sourceKey, CRLCacheEntry entry) {
    lock.lock();
    try {
      cache.put(sourceKey, entry);
    } finally {
      lock.unlock();
    }
  }

  void remove(String sourceKey) {
    lock.lock();
    try {
      cache.remove(sourceKey);
    } finally {
      lock.unlock();
    }
  }

  boolean contains(String sourceKey) {
    lock.lock();
    try {
      return cache.containsKey(sourceKey);
    } finally {
      lock.unlock();
    }
  }

  int size() {
    lock.lock();
    try {
      return cache.size();
    } finally {
      lock.unlock();
    }
  }

  /** Removes every entry that is no longer usable at {@code now}. */
  int cleanup(Instant now) {
    lock.lock();
    try {
      int removedCount = 0;
      Iterator<Map.Entry<String, CRLCacheEntry>> it = cache.entrySet().iterator();
      while (it.hasNext()) {
        Map.Entry<String, CRLCacheEntry> entry = it.next();
        if (entry.getValue().isCrlExpired(now)) {
          logger.debug("Removing expired CRL cache entry for {}", entry.getKey());
          it.remove();
          removedCount++;
        }
      }
      if (removedCount > 0) {
        logger.debug("Removed {} expired entries from CRL cache", removedCount);
      }
      return removedCount;
    } finally {
      lock.unlock();
    }
  }
}
