package net.certrevoke.client.core.cert;

import java.math.BigInteger;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

/** {@link RevocableCertificate} backed by a JCA {@link X509Certificate}. */
public class X509RevocableCertificate implements RevocableCertificate {
  private final X509Certificate certificate;
  private final List<String> crlDistributionPoints;
  private final List<String> ocspResponderUrls;
  private final List<String> issuingCertificateUrls;

  public X509RevocableCertificate(X509Certificate certificate) {
    if (certificate == null) {
      throw new IllegalArgumentException("Certificate cannot be null");
    }
    this.certificate = certificate;
    this.crlDistributionPoints =
        Collections.unmodifiableList(
            CertificateExtensionUtils.extractCRLDistributionPoints(certificate));
    this.ocspResponderUrls =
        Collections.unmodifiableList(CertificateExtensionUtils.extractOcspUrls(certificate));
    this.issuingCertificateUrls =
        Collections.unmodifiableList(
            CertificateExtensionUtils.extractIssuingCertificateUrls(certificate));
  }

  public X509Certificate getCertificate() {
    return certificate;
  }

  @Override
  public BigInteger getSerialNumber() {
    return certificate.getSerialNumber();
  }

  @Override
  public Instant getNotBefore() {
    return certificate.getNotBefore().toInstant();
  }

  @Override
  public Instant getNotAfter() {
    return certificate.getNotAfter().toInstant();
  }

  @Override
  public List<String> getCrlDistributionPoints() {
    return crlDistributionPoints;
  }

  @Override
  public List<String> getOcspResponderUrls() {
    return ocspResponderUrls;
  }

  @Override
  public List<String> getIssuingCertificateUrls() {
    return issuingCertificateUrls;
  }

  @Override
  public String getSubject() {
    return certificate.getSubjectX500Principal().getName();
  }

  @Override
  public String toString() {
    return "X509RevocableCertificate{subject="
        + getSubject()
        + ", serial="
        + getSerialNumber()
        + "}";
  }
}
