package net.certrevoke.client.core;

import java.net.Socket;
import java.security.KeyStore;
import java.security.KeyStoreException;
import java.security.NoSuchAlgorithmException;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509ExtendedTrustManager;
import javax.net.ssl.X509TrustManager;
import net.certrevoke.client.log.RevokeLogger;
import net.certrevoke.client.log.RevokeLoggerFactory;
import org.apache.http.ssl.SSLInitializationException;

/**
 * Trust manager that runs the delegate's path validation and then asks a {@link
 * RevocationChecker} about every certificate in the chain except self-issued ones.
 */
public class RevocationTrustManager extends X509ExtendedTrustManager {
  private static final RevokeLogger logger =
      RevokeLoggerFactory.getLogger(RevocationTrustManager.class);

  private final X509TrustManager trustManager;
  /** Set when the delegate supports socket and engine aware checks. */
  private final X509ExtendedTrustManager exTrustManager;

  private final RevocationChecker checker;

  public RevocationTrustManager(X509TrustManager trustManager, RevocationChecker checker) {
    this.trustManager = trustManager;
    this.checker = checker;
    if (trustManager instanceof X509ExtendedTrustManager) {
      this.exTrustManager = (X509ExtendedTrustManager) trustManager;
    } else {
      logger.debug("Standard X509TrustManager is used instead of X509ExtendedTrustManager.");
      this.exTrustManager = null;
    }
  }

  /**
   * @param checker revocation checker
   * @return trust manager delegating to the JVM default trust store
   */
  public static RevocationTrustManager withDefaultTrustManager(RevocationChecker checker) {
    return new RevocationTrustManager(
        getTrustManager(TrustManagerFactory.getDefaultAlgorithm()), checker);
  }

  @Override
  public void checkClientTrusted(X509Certificate[] chain, String authType)
      throws CertificateException {
    verify(chain, () -> trustManager.checkClientTrusted(chain, authType));
  }

  @Override
  public void checkServerTrusted(X509Certificate[] chain, String authType)
      throws CertificateException {
    verify(chain, () -> trustManager.checkServerTrusted(chain, authType));
  }

  @Override
  public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket)
      throws CertificateException {
    verify(
        chain,
        exTrustManager == null
            ? () -> trustManager.checkClientTrusted(chain, authType)
            : () -> exTrustManager.checkClientTrusted(chain, authType, socket));
  }

  @Override
  public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine sslEngine)
      throws CertificateException {
    verify(
        chain,
        exTrustManager == null
            ? () -> trustManager.checkClientTrusted(chain, authType)
            : () -> exTrustManager.checkClientTrusted(chain, authType, sslEngine));
  }

  @Override
  public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket)
      throws CertificateException {
    verify(
        chain,
        exTrustManager == null
            ? () -> trustManager.checkServerTrusted(chain, authType)
            : () -> exTrustManager.checkServerTrusted(chain, authType, socket));
  }

  @Override
  public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine sslEngine)
      throws CertificateException {
    verify(
        chain,
        exTrustManager == null
            ? () -> trustManager.checkServerTrusted(chain, authType)
            : () -> exTrustManager.checkServerTrusted(chain, authType, sslEngine));
  }

  @Override
  public X509Certificate[] getAcceptedIssuers() {
    return trustManager.getAcceptedIssuers();
  }

  @FunctionalInterface
  private interface PathValidation {
    void run() throws CertificateException;
  }

  private void verify(X509Certificate[] chain, PathValidation pathValidation)
      throws CertificateException {
    pathValidation.run();
    validateRevocationStatus(chain);
  }

  void validateRevocationStatus(X509Certificate[] chain) throws CertificateException {
    for (X509Certificate certificate : chain) {
      if (certificate.getSubjectX500Principal().equals(certificate.getIssuerX500Principal())) {
        logger.trace("Skipping self-issued certificate {}", certificate.getSubjectX500Principal());
        continue;
      }
      RevocationResult result = checker.check(certificate);
      if (result.isRevoked()) {
        throw new CertificateException(
            String.format(
                "Certificate %s failed revocation check (serial: %s, checkSucceeded: %s)",
                certificate.getSubjectX500Principal(),
                certificate.getSerialNumber(),
                result.isCheckSucceeded()));
      }
      if (!result.isCheckSucceeded()) {
        logger.warn(
            "Could not determine revocation status of {}, accepting it",
            certificate.getSubjectX500Principal());
      }
    }
  }

  private static X509TrustManager getTrustManager(String algorithm) {
    try {
      TrustManagerFactory factory = TrustManagerFactory.getInstance(algorithm);
      factory.init((KeyStore) null);
      for (TrustManager tm : factory.getTrustManagers()) {
        if (tm instanceof X509TrustManager) {
          return (X509TrustManager) tm;
        }
      }
      throw new SSLInitializationException("No X509TrustManager available for " + algorithm, null);
    } catch (NoSuchAlgorithmException | KeyStoreException ex) {
      throw new SSLInitializationException(ex.getMessage(), ex);
    }
  }
}
