package net.certrevoke.client.core.crl;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.security.cert.X509CRL;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;
import net.certrevoke.client.core.RevocationErrorCode;
import net.certrevoke.client.core.RevocationException;
import net.certrevoke.client.core.cert.CertificateParser;
import net.certrevoke.client.core.transport.FetchResponse;
import net.certrevoke.client.core.transport.FileSystemReader;
import net.certrevoke.client.core.transport.ResourceFetcher;
import net.certrevoke.client.log.ArgSupplier;
import net.certrevoke.client.log.RevokeLogger;
import net.certrevoke.client.log.RevokeLoggerFactory;

/**
 * Expiry-aware CRL cache keyed by source (remote URL or local path) together with the logic that
 * decides whether to reuse a cached list or fetch a new one.
 *
 * <p>Fetching, parsing and signature verification happen outside the lock. Two threads that find
 * the same entry expired may both fetch it; the last one to finish wins.
 */
public class CRLStore {
  private static final RevokeLogger logger = RevokeLoggerFactory.getLogger(CRLStore.class);

  private final CRLCache cache;
  private final ResourceFetcher fetcher;
  private final FileSystemReader fileSystemReader;
  private final Clock clock;
  private final boolean requireVerifiedCrl;

  public CRLStore(
      Lock lock,
      ResourceFetcher fetcher,
      FileSystemReader fileSystemReader,
      Clock clock,
      boolean requireVerifiedCrl) {
    this.cache = new CRLCache(lock);
    this.fetcher = fetcher;
    this.fileSystemReader = fileSystemReader;
    this.clock = clock;
    this.requireVerifiedCrl = requireVerifiedCrl;
  }

  /** LDAP distribution points cannot be fetched. */
  public static boolean isLdapUrl(String url) {
    return url != null && url.toLowerCase(Locale.ROOT).startsWith("ldap:");
  }

  /**
   * @return true iff a list is cached for the key and its next update is strictly in the future.
   *     An expired entry is evicted as a side effect.
   */
  public boolean isCacheValid(String sourceKey) {
    return cache.getValid(sourceKey, clock.instant()) != null;
  }

  /**
   * Loads the CRL at a local path unless a valid copy is already cached.
   *
   * @param path filesystem path, also used as the cache key
   * @param force reload even if the cached copy is still valid
   * @return the list now in effect for the path
   * @throws RevocationException IO_ERROR, PARSE_ERROR or EMPTY_LIST
   */
  public RevocationList fetchLocal(String path, boolean force) throws RevocationException {
    if (!force) {
      CRLCacheEntry cached = cache.getValid(path, clock.instant());
      if (cached != null) {
        logger.debug("Using cached CRL for local file {}", path);
        return cached.getRevocationList();
      }
    }

    byte[] data;
    try {
      Path file = Paths.get(path);
      fileSystemReader.stat(file);
      data = fileSystemReader.readAll(file);
    } catch (IOException | InvalidPathException e) {
      throw new RevocationException(
          RevocationErrorCode.IO_ERROR,
          String.format("Failed to read local CRL path %s: %s", path, e.getMessage()),
          e);
    }

    Instant now = clock.instant();
    RevocationList list = toRevocationList(path, CertificateParser.parseCrl(data), now);
    cache.put(path, new CRLCacheEntry(list, now));
    logger.debug("Loaded local CRL {}", list);
    return list;
  }

  /**
   * Downloads the CRL at a URL unless a valid copy is already cached.
   *
   * @param url distribution point, also used as the cache key
   * @param issuer certificate the CRL signature is verified against, may be null
   * @param force download even if the cached copy is still valid
   * @return the list now in effect for the URL
   * @throws RevocationException FETCH_ERROR, PARSE_ERROR, EMPTY_LIST, SIGNATURE_ERROR or
   *     UNSUPPORTED_TRANSPORT
   */
  public RevocationList fetchRemote(String url, X509Certificate issuer, boolean force)
      throws RevocationException {
    return fetchRemote(url, () -> issuer, force);
  }

  /**
   * Same as {@link #fetchRemote(String, X509Certificate, boolean)} but the issuer is only looked up
   * when a download actually happens.
   */
  public RevocationList fetchRemote(
      String url, Supplier<X509Certificate> issuerSupplier, boolean force)
      throws RevocationException {
    if (isLdapUrl(url)) {
      throw new RevocationException(
          RevocationErrorCode.UNSUPPORTED_TRANSPORT,
          "LDAP CRL distribution points are not supported: " + url);
    }
    if (!force) {
      CRLCacheEntry cached = cache.getValid(url, clock.instant());
      if (cached != null) {
        logger.debug("Using cached CRL for {}", url);
        return cached.getRevocationList();
      }
    }

    logger.debug("Fetching CRL from {}", url);
    FetchResponse response;
    try {
      response = fetcher.get(url);
    } catch (IOException e) {
      throw new RevocationException(
          RevocationErrorCode.FETCH_ERROR,
          String.format("Failed to fetch CRL from %s: %s", url, e.getMessage()),
          e);
    }
    if (!response.isSuccessful()) {
      throw new RevocationException(
          RevocationErrorCode.FETCH_ERROR,
          String.format(
              "Failed to retrieve CRL from %s, status %d", url, response.getStatusCode()));
    }

    X509CRL crl = CertificateParser.parseCrl(response.getBody());
    X509Certificate issuer = issuerSupplier.get();
    if (issuer != null) {
      verifyCrlSignature(crl, issuer, url);
    } else if (requireVerifiedCrl) {
      throw new RevocationException(
          RevocationErrorCode.SIGNATURE_ERROR,
          "No issuer available to verify CRL from " + url);
    } else {
      logger.warn("No issuer available to verify CRL from {}, caching it unverified", url);
    }

    Instant now = clock.instant();
    RevocationList list = toRevocationList(url, crl, now);
    cache.put(url, new CRLCacheEntry(list, now));
    logger.debug("Cached CRL {}", list);
    logger.trace("Serials revoked by {}: {}", url, (ArgSupplier) list::getRevokedSerials);
    return list;
  }

  /**
   * @return whether the serial is listed in the CRL at the local path
   * @throws RevocationException if no list could be loaded
   */
  public boolean isSerialRevokedLocal(String path, BigInteger serialNumber)
      throws RevocationException {
    return fetchLocal(path, false).isRevoked(serialNumber);
  }

  /**
   * @return whether the serial is listed in the CRL at the URL
   * @throws RevocationException if no list could be loaded
   */
  public boolean isSerialRevokedRemote(
      String url, BigInteger serialNumber, Supplier<X509Certificate> issuerSupplier)
      throws RevocationException {
    return fetchRemote(url, issuerSupplier, false).isRevoked(serialNumber);
  }

  /** Drops the cached list for the key, if any. */
  public void evict(String sourceKey) {
    cache.remove(sourceKey);
  }

  /** @return number of expired entries removed */
  public int purgeExpired() {
    return cache.cleanup(clock.instant());
  }

  /** @return revoked serials of the valid cached list for the key, empty if there is none */
  public Set<BigInteger> getCachedRevokedSerials(String sourceKey) {
    CRLCacheEntry entry = cache.getValid(sourceKey, clock.instant());
    return entry != null
        ? entry.getRevocationList().getRevokedSerials()
        : Collections.<BigInteger>emptySet();
  }

  boolean isCached(String sourceKey) {
    return cache.contains(sourceKey);
  }

  private static RevocationList toRevocationList(String sourceKey, X509CRL crl, Instant now)
      throws RevocationException {
    RevocationList list = new RevocationList(sourceKey, crl);
    if (list.getNextUpdate() != null && !now.isBefore(list.getNextUpdate())) {
      throw new RevocationException(
          RevocationErrorCode.EMPTY_LIST,
          String.format(
              "CRL from %s expired at %s, current time %s", sourceKey, list.getNextUpdate(), now));
    }
    return list;
  }

  private static void verifyCrlSignature(X509CRL crl, X509Certificate issuer, String url)
      throws RevocationException {
    if (!crl.getIssuerX500Principal().equals(issuer.getSubjectX500Principal())) {
      throw new RevocationException(
          RevocationErrorCode.SIGNATURE_ERROR,
          String.format(
              "CRL issuer %s does not match issuer certificate subject %s for %s",
              crl.getIssuerX500Principal(),
              issuer.getSubjectX500Principal(),
              url));
    }
    try {
      crl.verify(issuer.getPublicKey());
      logger.debug(
          "CRL signature from {} verified against {}", url, issuer.getSubjectX500Principal());
    } catch (GeneralSecurityException e) {
      throw new RevocationException(
          RevocationErrorCode.SIGNATURE_ERROR,
          String.format("Failed to verify CRL from %s: %s", url, e.getMessage()),
          e);
    }
  }
}
