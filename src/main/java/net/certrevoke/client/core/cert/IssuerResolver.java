package net.certrevoke.client.core.cert;

import java.io.IOException;
import java.security.cert.X509Certificate;
import java.util.Optional;
import net.certrevoke.client.core.RevocationException;
import net.certrevoke.client.core.transport.FetchResponse;
import net.certrevoke.client.core.transport.ResourceFetcher;
import net.certrevoke.client.log.RevokeLogger;
import net.certrevoke.client.log.RevokeLoggerFactory;

/**
 * Downloads the certificate that issued a given certificate by walking its issuer-fetch URLs in
 * order. Failures are logged and skipped; callers only see whether an issuer was found.
 */
public class IssuerResolver {
  private static final RevokeLogger logger = RevokeLoggerFactory.getLogger(IssuerResolver.class);

  private final ResourceFetcher fetcher;

  public IssuerResolver(ResourceFetcher fetcher) {
    this.fetcher = fetcher;
  }

  /**
   * @param certificate certificate whose issuer is wanted
   * @return the first issuer certificate that could be fetched and parsed, or empty
   */
  public Optional<X509Certificate> resolveIssuer(RevocableCertificate certificate) {
    for (String url : certificate.getIssuingCertificateUrls()) {
      try {
        X509Certificate issuer = fetchCertificate(url);
        logger.debug(
            "Resolved issuer {} for {} from {}",
            issuer.getSubjectX500Principal(),
            certificate.getSubject(),
            url);
        return Optional.of(issuer);
      } catch (IOException | RevocationException e) {
        logger.debug("Failed to fetch issuer certificate from {}: {}", url, e.getMessage());
      }
    }
    logger.debug("No issuer certificate could be resolved for {}", certificate.getSubject());
    return Optional.empty();
  }

  private X509Certificate fetchCertificate(String url) throws IOException, RevocationException {
    FetchResponse response = fetcher.get(url);
    if (!response.isSuccessful()) {
      throw new IOException(
          String.format("Unexpected status %d from %s", response.getStatusCode(), url));
    }
    return CertificateParser.parseCertificate(response.getBody());
  }
}
