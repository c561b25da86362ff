package net.certrevoke.client.core.cert;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

/**
 * What the revocation checker needs to know about a certificate. Kept independent of any codec so
 * other certificate sources can be plugged in.
 */
public interface RevocableCertificate {
  BigInteger getSerialNumber();

  /** Start of the validity window, inclusive. */
  Instant getNotBefore();

  /** End of the validity window, exclusive. */
  Instant getNotAfter();

  /** CRL distribution point URLs in declaration order. */
  List<String> getCrlDistributionPoints();

  /** OCSP responder URLs in declaration order. */
  List<String> getOcspResponderUrls();

  /** URLs the issuing certificate can be fetched from, in declaration order. */
  List<String> getIssuingCertificateUrls();

  /** Human readable subject, used in log messages only. */
  String getSubject();
}
