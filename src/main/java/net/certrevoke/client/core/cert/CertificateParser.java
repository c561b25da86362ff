package net.certrevoke.client.core.cert;

import java.io.ByteArrayInputStream;
import java.security.cert.CRL;
import java.security.cert.CRLException;
import java.security.cert.Certificate;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509CRL;
import java.security.cert.X509Certificate;
import net.certrevoke.client.core.RevocationErrorCode;
import net.certrevoke.client.core.RevocationException;

/** Decodes certificates and CRLs given either PEM or raw DER bytes. */
public class CertificateParser {
  private static final String CERTIFICATE_TYPE = "X.509";

  private CertificateParser() {}

  public static X509Certificate parseCertificate(byte[] data) throws RevocationException {
    if (data == null || data.length == 0) {
      throw new RevocationException(RevocationErrorCode.PARSE_ERROR, "Certificate data is empty");
    }
    try {
      Certificate certificate =
          CertificateFactory.getInstance(CERTIFICATE_TYPE)
              .generateCertificate(new ByteArrayInputStream(data));
      if (!(certificate instanceof X509Certificate)) {
        throw new RevocationException(
            RevocationErrorCode.PARSE_ERROR, "Data is not an X.509 certificate");
      }
      return (X509Certificate) certificate;
    } catch (CertificateException e) {
      throw new RevocationException(
          RevocationErrorCode.PARSE_ERROR, "Failed to parse certificate: " + e.getMessage(), e);
    }
  }

  public static X509CRL parseCrl(byte[] data) throws RevocationException {
    if (data == null || data.length == 0) {
      throw new RevocationException(RevocationErrorCode.EMPTY_LIST, "CRL data is empty");
    }
    CRL crl;
    try {
      crl =
          CertificateFactory.getInstance(CERTIFICATE_TYPE)
              .generateCRL(new ByteArrayInputStream(data));
    } catch (CertificateException | CRLException e) {
      throw new RevocationException(
          RevocationErrorCode.PARSE_ERROR, "Failed to parse CRL: " + e.getMessage(), e);
    }
    if (crl == null) {
      throw new RevocationException(RevocationErrorCode.EMPTY_LIST, "CRL is empty");
    }
    if (!(crl instanceof X509CRL)) {
      throw new RevocationException(RevocationErrorCode.PARSE_ERROR, "Data is not an X.509 CRL");
    }
    return (X509CRL) crl;
  }
}
