package net.certrevoke.client.core;

import java.io.Closeable;
import java.io.IOException;
import java.math.BigInteger;
import java.net.URI;
import java.net.URISyntaxException;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import net.certrevoke.client.core.cert.IssuerResolver;
import net.certrevoke.client.core.cert.RevocableCertificate;
import net.certrevoke.client.core.cert.X509RevocableCertificate;
import net.certrevoke.client.core.crl.CRLStore;
import net.certrevoke.client.core.ocsp.OCSPClient;
import net.certrevoke.client.core.transport.FileSystemReader;
import net.certrevoke.client.core.transport.HttpClientResourceFetcher;
import net.certrevoke.client.core.transport.LocalFileSystemReader;
import net.certrevoke.client.core.transport.ResourceFetcher;
import net.certrevoke.client.log.RevokeLogger;
import net.certrevoke.client.log.RevokeLoggerFactory;

/**
 * Decides whether a certificate is within its validity window and not revoked, consulting a pinned
 * local CRL, the certificate's CRL distribution points and its OCSP responders.
 *
 * <p>Instances are thread safe. A single lock guards the hard-fail flag, the pinned local CRL and
 * the CRL cache; all network and filesystem access happens outside of it.
 *
 * <p>Close the checker to release the HTTP client it created. A fetcher passed to the builder is
 * left open.
 */
public class RevocationChecker implements Closeable {
  private static final RevokeLogger logger = RevokeLoggerFactory.getLogger(RevocationChecker.class);

  private final ReentrantLock lock = new ReentrantLock();
  private final CRLStore crlStore;
  private final IssuerResolver issuerResolver;
  private final OCSPClient ocspClient;
  private final Clock clock;
  // fetcher created by the builder, null when the caller supplied one
  private Closeable ownedFetcher;

  // guarded by lock
  private boolean hardFail;
  // guarded by lock, null when no local CRL is pinned
  private String localCrl;

  RevocationChecker(
      RevocationCheckConfig config,
      ResourceFetcher fetcher,
      FileSystemReader fileSystemReader,
      Clock clock) {
    this.clock = clock;
    this.hardFail = config.isHardFail();
    this.crlStore =
        new CRLStore(lock, fetcher, fileSystemReader, clock, config.isRequireVerifiedCrl());
    this.issuerResolver = new IssuerResolver(fetcher);
    this.ocspClient =
        new OCSPClient(fetcher, issuerResolver, clock, config.getOcspGetMaxRequestBytes());
  }

  public static Builder builder() {
    return new Builder();
  }

  public void setHardFail(boolean hardFail) {
    lock.lock();
    try {
      this.hardFail = hardFail;
    } finally {
      lock.unlock();
    }
  }

  public boolean isHardFail() {
    lock.lock();
    try {
      return hardFail;
    } finally {
      lock.unlock();
    }
  }

  /** @return the pinned local CRL path, or null */
  public String getLocalCRL() {
    lock.lock();
    try {
      return localCrl;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Pins a local CRL. While pinned it is consulted before any distribution point, and a failure to
   * load it fails the whole check. The file is loaded immediately so a bad path is reported here.
   *
   * @param localCrlPath bare filesystem path or {@code file://} URI; null or empty clears the pin
   * @throws RevocationException INVALID_CONFIGURATION for other URI schemes, or the load failure
   */
  public void setLocalCRL(String localCrlPath) throws RevocationException {
    if (RevokeUtil.isNullOrEmpty(localCrlPath)) {
      lock.lock();
      try {
        if (localCrl != null) {
          logger.debug("Clearing pinned local CRL {}", localCrl);
          crlStore.evict(localCrl);
        }
        localCrl = null;
      } finally {
        lock.unlock();
      }
      return;
    }

    String path = toLocalPath(localCrlPath);
    crlStore.fetchLocal(path, true);

    lock.lock();
    try {
      if (!path.equals(localCrl)) {
        if (localCrl != null) {
          crlStore.evict(localCrl);
        }
        localCrl = path;
      }
    } finally {
      lock.unlock();
    }
    logger.debug("Pinned local CRL {}", path);
  }

  /**
   * Downloads a remote CRL into the cache.
   *
   * @param url distribution point
   * @param issuer certificate to verify the CRL against, may be null
   * @param force download even if the cached copy is still valid
   * @throws RevocationException if the CRL could not be fetched, parsed or verified
   */
  public void refreshCRL(String url, X509Certificate issuer, boolean force)
      throws RevocationException {
    crlStore.fetchRemote(url, issuer, force);
  }

  /** @return number of expired CRLs dropped from the cache */
  public int purgeExpiredCRLs() {
    return crlStore.purgeExpired();
  }

  /** @return serials listed by the valid cached CRL for a URL or local path, empty if none */
  public Set<BigInteger> getCachedRevokedSerials(String sourceKey) {
    return crlStore.getCachedRevokedSerials(sourceKey);
  }

  @Override
  public void close() throws IOException {
    if (ownedFetcher != null) {
      ownedFetcher.close();
    }
  }

  public RevocationResult check(X509Certificate certificate) {
    return check(new X509RevocableCertificate(certificate));
  }

  /**
   * Checks that the certificate is within its validity window and not revoked. Never throws for
   * revocation data problems; those are reported through {@link
   * RevocationResult#isCheckSucceeded()} according to the hard-fail setting.
   */
  public RevocationResult check(RevocableCertificate certificate) {
    Instant now = clock.instant();
    if (!now.isBefore(certificate.getNotAfter())) {
      logger.info(
          "Certificate {} expired {}", certificate.getSubject(), certificate.getNotAfter());
      return RevocationResult.REVOKED;
    }
    if (now.isBefore(certificate.getNotBefore())) {
      logger.info(
          "Certificate {} isn't valid until {}",
          certificate.getSubject(),
          certificate.getNotBefore());
      return RevocationResult.REVOKED;
    }
    return revCheck(certificate);
  }

  private RevocationResult revCheck(RevocableCertificate certificate) {
    String pinnedCrl;
    boolean hardFailSnapshot;
    lock.lock();
    try {
      pinnedCrl = localCrl;
      hardFailSnapshot = hardFail;
    } finally {
      lock.unlock();
    }

    BigInteger serialNumber = certificate.getSerialNumber();
    if (pinnedCrl != null) {
      try {
        if (crlStore.isSerialRevokedLocal(pinnedCrl, serialNumber)) {
          logger.info(
              "Certificate is revoked by '{}' CRL file (subject: {}, serial: {})",
              pinnedCrl,
              certificate.getSubject(),
              serialNumber);
          return RevocationResult.REVOKED;
        }
      } catch (RevocationException e) {
        logger.warn("Error checking revocation via local CRL file: {}", e.getMessage());
        return RevocationResult.failure(hardFailSnapshot);
      } finally {
        evictIfUnpinned(pinnedCrl);
      }
    }

    LazyIssuer issuer = new LazyIssuer(certificate);
    for (String url : certificate.getCrlDistributionPoints()) {
      if (CRLStore.isLdapUrl(url)) {
        logger.info("Skipping LDAP CRL {} ({})", url, RevocationErrorCode.UNSUPPORTED_TRANSPORT);
        continue;
      }

      try {
        if (crlStore.isSerialRevokedRemote(url, serialNumber, issuer)) {
          logger.info(
              "Certificate is revoked by '{}' CRL (subject: {}, serial: {})",
              url,
              certificate.getSubject(),
              serialNumber);
          return RevocationResult.REVOKED;
        }
      } catch (RevocationException e) {
        logger.warn("Error checking revocation via CRL {}: {}", url, e.getMessage());
        return RevocationResult.failure(hardFailSnapshot);
      }

      RevocationResult ocspResult =
          certificate.getOcspResponderUrls().isEmpty()
              ? RevocationResult.NOT_REVOKED
              : ocspClient.checkOCSP(certificate, issuer.get(), hardFailSnapshot);
      if (!ocspResult.isCheckSucceeded()) {
        logger.warn("Error checking revocation via OCSP for {}", certificate.getSubject());
        return RevocationResult.failure(hardFailSnapshot);
      }
      if (ocspResult.isRevoked()) {
        logger.info(
            "Certificate is revoked by OCSP, checked for '{}' (subject: {}, serial: {})",
            url,
            certificate.getSubject(),
            serialNumber);
        return RevocationResult.REVOKED;
      }
    }

    return RevocationResult.NOT_REVOKED;
  }

  /** A pin cleared or replaced while the file was being read must not stay cached. */
  private void evictIfUnpinned(String path) {
    lock.lock();
    try {
      if (!path.equals(localCrl)) {
        logger.debug("Local CRL {} was unpinned during the check, dropping it", path);
        crlStore.evict(path);
      }
    } finally {
      lock.unlock();
    }
  }

  static String toLocalPath(String localCrlPath) throws RevocationException {
    URI uri;
    try {
      uri = new URI(localCrlPath);
    } catch (URISyntaxException e) {
      // not a URI at all, e.g. a path containing spaces or backslashes
      return localCrlPath;
    }
    String scheme = uri.getScheme();
    if (scheme == null || scheme.length() == 1) {
      // no scheme, or a Windows drive letter
      return localCrlPath;
    }
    if ("file".equalsIgnoreCase(scheme)) {
      String path = uri.getPath();
      if (RevokeUtil.isNullOrEmpty(path)) {
        throw new RevocationException(
            RevocationErrorCode.INVALID_CONFIGURATION, "Path is not valid: " + localCrlPath);
      }
      return path;
    }
    throw new RevocationException(
        RevocationErrorCode.INVALID_CONFIGURATION, "Path is not valid: " + localCrlPath);
  }

  /** Resolves the issuer at most once per check, and only if something asks for it. */
  private class LazyIssuer implements Supplier<X509Certificate> {
    private final RevocableCertificate certificate;
    private boolean resolved;
    private X509Certificate issuer;

    LazyIssuer(RevocableCertificate certificate) {
      this.certificate = certificate;
    }

    @Override
    public X509Certificate get() {
      if (!resolved) {
        issuer = issuerResolver.resolveIssuer(certificate).orElse(null);
        resolved = true;
      }
      return issuer;
    }
  }

  public static class Builder {
    private RevocationCheckConfig config = RevocationCheckConfig.builder().build();
    private ResourceFetcher fetcher;
    private FileSystemReader fileSystemReader = LocalFileSystemReader.INSTANCE;
    private Clock clock = Clock.systemUTC();

    public Builder config(RevocationCheckConfig config) {
      this.config = config;
      return this;
    }

    public Builder fetcher(ResourceFetcher fetcher) {
      this.fetcher = fetcher;
      return this;
    }

    public Builder fileSystemReader(FileSystemReader fileSystemReader) {
      this.fileSystemReader = fileSystemReader;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * @return a new checker; pins the configured local CRL, if any
     * @throws RevocationException if the configured local CRL cannot be pinned
     */
    public RevocationChecker build() throws RevocationException {
      HttpClientResourceFetcher ownedFetcher = null;
      ResourceFetcher resourceFetcher = fetcher;
      if (resourceFetcher == null) {
        ownedFetcher =
            HttpClientResourceFetcher.create(
                config.getConnectionTimeoutMs(), config.getSocketTimeoutMs());
        resourceFetcher = ownedFetcher;
      }
      RevocationChecker checker =
          new RevocationChecker(config, resourceFetcher, fileSystemReader, clock);
      checker.ownedFetcher = ownedFetcher;
      if (!RevokeUtil.isNullOrEmpty(config.getLocalCrlPath())) {
        try {
          checker.setLocalCRL(config.getLocalCrlPath());
        } catch (RevocationException e) {
          try {
            checker.close();
          } catch (IOException closeFailure) {
            e.addSuppressed(closeFailure);
          }
          throw e;
        }
      }
      return checker;
    }
  }
}
