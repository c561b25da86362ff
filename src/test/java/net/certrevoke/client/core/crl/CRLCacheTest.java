package net.certrevoke.client.core.crl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.concurrent.locks.ReentrantLock;
import net.certrevoke.client.category.TestTags;
import net.certrevoke.client.core.CertificateGeneratorUtil;
import net.certrevoke.client.core.cert.CertificateParser;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag(TestTags.CORE)
class CRLCacheTest {
  private static final String FRESH_URL = "http://ca.test/fresh.crl";
  private static final String STALE_URL = "http://ca.test/stale.crl";

  private static CertificateGeneratorUtil certGen;

  private ReentrantLock lock;
  private CRLCache cache;
  private Instant now;
  private CRLCacheEntry freshEntry;
  private CRLCacheEntry staleEntry;

  @BeforeAll
  static void setUpClass() {
    certGen = new CertificateGeneratorUtil();
  }

  @BeforeEach
  void setUp() throws Exception {
    lock = new ReentrantLock();
    cache = new CRLCache(lock);
    now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
    freshEntry = entry(FRESH_URL, now.plus(1, ChronoUnit.HOURS));
    staleEntry = entry(STALE_URL, now.plus(1, ChronoUnit.MINUTES));
  }

  private CRLCacheEntry entry(String url, Instant nextUpdate) throws Exception {
    byte[] crl =
        certGen.generateCRL(Date.from(now.minus(1, ChronoUnit.HOURS)), Date.from(nextUpdate));
    return new CRLCacheEntry(new RevocationList(url, CertificateParser.parseCrl(crl)), now);
  }

  @Test
  void shouldReturnValidEntry() {
    cache.put(FRESH_URL, freshEntry);

    assertSame(freshEntry, cache.getValid(FRESH_URL, now));
    assertEquals(now, freshEntry.getDownloadTime());
  }

  @Test
  void shouldEvictEntryOnceNextUpdateIsReached() {
    cache.put(STALE_URL, staleEntry);

    assertNull(cache.getValid(STALE_URL, now.plus(1, ChronoUnit.MINUTES)));
    assertFalse(cache.contains(STALE_URL));
  }

  @Test
  void shouldReturnNullForUnknownKey() {
    assertNull(cache.getValid("http://ca.test/unknown.crl", now));
  }

  @Test
  void shouldReplaceEntryWholesale() throws Exception {
    cache.put(FRESH_URL, staleEntry);
    cache.put(FRESH_URL, freshEntry);

    assertSame(freshEntry, cache.getValid(FRESH_URL, now));
    assertEquals(1, cache.size());
  }

  @Test
  void shouldRemoveOnlyExpiredEntriesOnCleanup() {
    cache.put(FRESH_URL, freshEntry);
    cache.put(STALE_URL, staleEntry);

    int removed = cache.cleanup(now.plus(10, ChronoUnit.MINUTES));

    assertEquals(1, removed);
    assertTrue(cache.contains(FRESH_URL));
    assertFalse(cache.contains(STALE_URL));
  }

  @Test
  void shouldRemoveEntry() {
    cache.put(FRESH_URL, freshEntry);

    cache.remove(FRESH_URL);

    assertEquals(0, cache.size());
  }

  @Test
  void shouldReleaseLockAfterEveryOperation() {
    cache.put(FRESH_URL, freshEntry);
    assertNotNull(cache.getValid(FRESH_URL, now));
    cache.cleanup(now);

    assertFalse(lock.isLocked());
  }
}
