package net.certrevoke.client.core.ocsp;

import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.cert.CertificateEncodingException;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.util.Arrays;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.certrevoke.client.core.RevocationErrorCode;
import net.certrevoke.client.core.RevocationResult;
import net.certrevoke.client.core.cert.IssuerResolver;
import net.certrevoke.client.core.cert.RevocableCertificate;
import net.certrevoke.client.core.transport.FetchResponse;
import net.certrevoke.client.core.transport.ResourceFetcher;
import net.certrevoke.client.log.RevokeLogger;
import net.certrevoke.client.log.RevokeLoggerFactory;
import org.apache.commons.codec.binary.Base64;
import org.apache.http.HttpStatus;
import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.cert.CertException;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateHolder;
import org.bouncycastle.cert.ocsp.BasicOCSPResp;
import org.bouncycastle.cert.ocsp.CertificateID;
import org.bouncycastle.cert.ocsp.CertificateStatus;
import org.bouncycastle.cert.ocsp.OCSPException;
import org.bouncycastle.cert.ocsp.OCSPReq;
import org.bouncycastle.cert.ocsp.OCSPReqBuilder;
import org.bouncycastle.cert.ocsp.OCSPResp;
import org.bouncycastle.cert.ocsp.RevokedStatus;
import org.bouncycastle.cert.ocsp.SingleResp;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentVerifierProviderBuilder;

/**
 * Queries the OCSP responders listed on a certificate. Only the first responder that gives a usable
 * answer is consulted.
 */
public class OCSPClient {
  private static final RevokeLogger logger = RevokeLoggerFactory.getLogger(OCSPClient.class);

  static final String OCSP_REQUEST_CONTENT_TYPE = "application/ocsp-request";
  public static final int DEFAULT_GET_MAX_REQUEST_BYTES = 256;

  /** Tolerance for responder clocks running ahead of ours. */
  static final long MAX_CLOCK_SKEW_IN_MILLISECONDS = 900000L;
  /** Grace period after nextUpdate, as a fraction of the response's validity period. */
  private static final float TOLERABLE_VALIDITY_RANGE_RATIO = 0.01f;
  private static final long MIN_TOLERABLE_VALIDITY_IN_MILLISECONDS = 18000000L;

  private static final Map<Integer, OCSPErrorCode> OCSP_RESPONSE_STATUS_TO_ERROR_CODE =
      new HashMap<>();

  static {
    OCSP_RESPONSE_STATUS_TO_ERROR_CODE.put(
        OCSPResp.MALFORMED_REQUEST, OCSPErrorCode.MALFORMED_REQUEST);
    OCSP_RESPONSE_STATUS_TO_ERROR_CODE.put(OCSPResp.INTERNAL_ERROR, OCSPErrorCode.INTERNAL_ERROR);
    OCSP_RESPONSE_STATUS_TO_ERROR_CODE.put(OCSPResp.TRY_LATER, OCSPErrorCode.TRY_LATER);
    OCSP_RESPONSE_STATUS_TO_ERROR_CODE.put(OCSPResp.SIG_REQUIRED, OCSPErrorCode.SIG_REQUIRED);
    OCSP_RESPONSE_STATUS_TO_ERROR_CODE.put(OCSPResp.UNAUTHORIZED, OCSPErrorCode.UNAUTHORIZED);
  }

  private final ResourceFetcher fetcher;
  private final IssuerResolver issuerResolver;
  private final Clock clock;
  private final int getMaxRequestBytes;

  public OCSPClient(ResourceFetcher fetcher, IssuerResolver issuerResolver, Clock clock) {
    this(fetcher, issuerResolver, clock, DEFAULT_GET_MAX_REQUEST_BYTES);
  }

  public OCSPClient(
      ResourceFetcher fetcher, IssuerResolver issuerResolver, Clock clock, int getMaxRequestBytes) {
    this.fetcher = fetcher;
    this.issuerResolver = issuerResolver;
    this.clock = clock;
    this.getMaxRequestBytes = getMaxRequestBytes;
  }

  /**
   * Checks the leaf against its OCSP responders, resolving the issuer from the leaf.
   *
   * @param leaf certificate to check
   * @param strict give up on the first responder that cannot be reached or answers with an error
   * @return verified status, or a failed check with {@code revoked=false}
   */
  public RevocationResult checkOCSP(RevocableCertificate leaf, boolean strict) {
    if (leaf.getOcspResponderUrls().isEmpty()) {
      logger.debug("OCSP is not enabled for {}", leaf.getSubject());
      return RevocationResult.NOT_REVOKED;
    }
    return checkOCSP(leaf, issuerResolver.resolveIssuer(leaf).orElse(null), strict);
  }

  /**
   * Same as {@link #checkOCSP(RevocableCertificate, boolean)} with an already resolved issuer.
   *
   * @param issuer issuer of the leaf, null if it could not be resolved
   */
  public RevocationResult checkOCSP(
      RevocableCertificate leaf, X509Certificate issuer, boolean strict) {
    List<String> ocspUrls = leaf.getOcspResponderUrls();
    if (ocspUrls.isEmpty()) {
      logger.debug("OCSP is not enabled for {}", leaf.getSubject());
      return RevocationResult.NOT_REVOKED;
    }
    if (issuer == null) {
      logger.warn(
          "Cannot build OCSP request for {}: {}", leaf.getSubject(), OCSPErrorCode.NO_ISSUER);
      return RevocationResult.SOFT_FAILURE;
    }

    CertificateID certificateId;
    OCSPReq request;
    try {
      certificateId =
          new CertificateID(
              new SHA1DigestCalculator(),
              new JcaX509CertificateHolder(issuer),
              leaf.getSerialNumber());
      request = new OCSPReqBuilder().addRequest(certificateId).build();
    } catch (OCSPException | CertificateEncodingException ex) {
      logger.warn(
          "Failed to build OCSP request for {}: {} ({})",
          leaf.getSubject(),
          OCSPErrorCode.REQUEST_BUILD_FAILURE,
          ex.getMessage());
      return RevocationResult.SOFT_FAILURE;
    }

    for (String ocspUrl : ocspUrls) {
      SingleResp singleResp;
      try {
        BasicOCSPResp basicOcspResp = sendOCSPRequest(ocspUrl, request);
        verifyResponseSignature(basicOcspResp, issuer);
        singleResp = findResponse(basicOcspResp, certificateId);
        checkValidityRange(singleResp, ocspUrl);
      } catch (OCSPResponseException ex) {
        if (ex.getErrorCode() == RevocationErrorCode.SIGNATURE_ERROR) {
          logger.warn("OCSP response from {} failed verification: {}", ocspUrl, ex.getMessage());
          return RevocationResult.SOFT_FAILURE;
        }
        logger.debug("OCSP request to {} failed: {}", ocspUrl, ex);
        if (strict) {
          return RevocationResult.SOFT_FAILURE;
        }
        continue;
      }

      CertificateStatus certStatus = singleResp.getCertStatus();
      if (certStatus == CertificateStatus.GOOD) {
        logger.debug("OCSP responder {} reports {} as good", ocspUrl, leaf.getSubject());
        return RevocationResult.NOT_REVOKED;
      }
      if (certStatus instanceof RevokedStatus) {
        RevokedStatus status = (RevokedStatus) certStatus;
        logger.debug(
            "OCSP responder {} reports {} revoked at {}",
            ocspUrl,
            leaf.getSubject(),
            status.getRevocationTime());
      } else {
        logger.debug(
            "OCSP responder {} reports unknown status for {}", ocspUrl, leaf.getSubject());
      }
      return RevocationResult.REVOKED;
    }

    logger.debug("No OCSP responder gave a usable answer for {}", leaf.getSubject());
    return RevocationResult.SOFT_FAILURE;
  }

  /**
   * Sends the request with GET when the encoded request is small enough to fit in the URL, POST
   * otherwise.
   */
  BasicOCSPResp sendOCSPRequest(String ocspUrl, OCSPReq request) throws OCSPResponseException {
    FetchResponse response;
    try {
      byte[] ocspReqDer = request.getEncoded();
      if (ocspReqDer.length > getMaxRequestBytes) {
        logger.debug("Sending {} byte OCSP request to {} with POST", ocspReqDer.length, ocspUrl);
        response = fetcher.post(ocspUrl, OCSP_REQUEST_CONTENT_TYPE, ocspReqDer);
      } else {
        String url = buildGetUrl(ocspUrl, ocspReqDer);
        logger.debug("Sending {} byte OCSP request with GET: {}", ocspReqDer.length, url);
        response = fetcher.get(url);
      }
    } catch (IOException ex) {
      throw new OCSPResponseException(
          RevocationErrorCode.FETCH_ERROR,
          OCSPErrorCode.RESPONDER_UNREACHABLE,
          String.format("Failed to reach OCSP responder %s: %s", ocspUrl, ex.getMessage()),
          ex);
    }

    if (response.getStatusCode() != HttpStatus.SC_OK) {
      throw new OCSPResponseException(
          RevocationErrorCode.FETCH_ERROR,
          OCSPErrorCode.RESPONDER_UNREACHABLE,
          String.format(
              "Failed to get OCSP response. StatusCode: %d, URL: %s",
              response.getStatusCode(), ocspUrl));
    }

    OCSPResp ocspResp;
    try {
      ocspResp = new OCSPResp(response.getBody());
    } catch (IOException ex) {
      throw new OCSPResponseException(
          RevocationErrorCode.PARSE_ERROR,
          OCSPErrorCode.INVALID_RESPONSE,
          "Failed to parse OCSP response from " + ocspUrl,
          ex);
    }

    if (ocspResp.getStatus() != OCSPResp.SUCCESSFUL) {
      OCSPErrorCode errorCode = OCSP_RESPONSE_STATUS_TO_ERROR_CODE.get(ocspResp.getStatus());
      throw new OCSPResponseException(
          RevocationErrorCode.PROTOCOL_ERROR,
          errorCode != null ? errorCode : OCSPErrorCode.UNKNOWN_RESPONSE_STATUS,
          String.format(
              "OCSP responder %s returned error status %d", ocspUrl, ocspResp.getStatus()));
    }

    try {
      Object responseObject = ocspResp.getResponseObject();
      if (!(responseObject instanceof BasicOCSPResp)) {
        throw new OCSPResponseException(
            RevocationErrorCode.PARSE_ERROR,
            OCSPErrorCode.INVALID_RESPONSE,
            "OCSP response from " + ocspUrl + " is not a basic OCSP response");
      }
      return (BasicOCSPResp) responseObject;
    } catch (OCSPException ex) {
      throw new OCSPResponseException(
          RevocationErrorCode.PARSE_ERROR,
          OCSPErrorCode.INVALID_RESPONSE,
          "Failed to decode OCSP response from " + ocspUrl,
          ex);
    }
  }

  /**
   * A response carrying its own signing certificate must be signed by that certificate, which in
   * turn must be valid now, carry the OCSPSigning extended key usage and be signed by the issuer.
   * Otherwise the issuer must have signed the response directly.
   */
  private void verifyResponseSignature(BasicOCSPResp basicOcspResp, X509Certificate issuer)
      throws OCSPResponseException {
    try {
      X509CertificateHolder issuerHolder = new JcaX509CertificateHolder(issuer);
      X509CertificateHolder signer = issuerHolder;
      X509CertificateHolder[] attachedCerts = basicOcspResp.getCerts();
      if (attachedCerts.length > 0
          && !Arrays.equals(attachedCerts[0].getEncoded(), issuerHolder.getEncoded())) {
        X509CertificateHolder delegated = attachedCerts[0];
        ExtendedKeyUsage keyUsage = ExtendedKeyUsage.fromExtensions(delegated.getExtensions());
        if (keyUsage == null || !keyUsage.hasKeyPurposeId(KeyPurposeId.id_kp_OCSPSigning)) {
          throw new OCSPResponseException(
              RevocationErrorCode.SIGNATURE_ERROR,
              OCSPErrorCode.INVALID_SIGNING_CERTIFICATE,
              "Certificate attached to OCSP response is not authorized for OCSP signing: "
                  + delegated.getSubject());
        }
        Date now = Date.from(clock.instant());
        if (!delegated.isValidOn(now)) {
          throw new OCSPResponseException(
              RevocationErrorCode.SIGNATURE_ERROR,
              OCSPErrorCode.INVALID_SIGNING_CERTIFICATE,
              String.format(
                  "Certificate attached to OCSP response is not valid at %s: "
                      + "not before %s, not after %s",
                  now, delegated.getNotBefore(), delegated.getNotAfter()));
        }
        if (!delegated.isSignatureValid(
            new JcaContentVerifierProviderBuilder().build(issuer.getPublicKey()))) {
          throw new OCSPResponseException(
              RevocationErrorCode.SIGNATURE_ERROR,
              OCSPErrorCode.INVALID_SIGNING_CERTIFICATE,
              "OCSP signing certificate is not signed by the issuer");
        }
        logger.debug(
            "Verifying OCSP response with attached certificate {}", delegated.getSubject());
        signer = delegated;
      }
      if (!basicOcspResp.isSignatureValid(new JcaContentVerifierProviderBuilder().build(signer))) {
        throw new OCSPResponseException(
            RevocationErrorCode.SIGNATURE_ERROR,
            OCSPErrorCode.INVALID_RESPONSE_SIGNATURE,
            "OCSP response signature verification failed");
      }
    } catch (IOException
        | CertException
        | OCSPException
        | OperatorCreationException
        | CertificateException ex) {
      throw new OCSPResponseException(
          RevocationErrorCode.SIGNATURE_ERROR,
          OCSPErrorCode.INVALID_RESPONSE_SIGNATURE,
          "Failed to verify OCSP response signature: " + ex.getMessage(),
          ex);
    }
  }

  /**
   * Rejects answers produced too far in the future or past their next update. A response without
   * nextUpdate is treated as expiring at thisUpdate, so only the grace period applies.
   */
  void checkValidityRange(SingleResp singleResp, String ocspUrl) throws OCSPResponseException {
    long now = clock.millis();
    Date thisUpdate = singleResp.getThisUpdate();
    Date nextUpdate = singleResp.getNextUpdate();
    logger.debug(
        "Current time: {}, this update: {}, next update: {}",
        clock.instant(),
        thisUpdate,
        nextUpdate);
    long expiry = nextUpdate != null ? nextUpdate.getTime() : thisUpdate.getTime();
    long tolerableValidity =
        Math.max(
            (long) ((float) (expiry - thisUpdate.getTime()) * TOLERABLE_VALIDITY_RANGE_RATIO),
            MIN_TOLERABLE_VALIDITY_IN_MILLISECONDS);
    if (thisUpdate.getTime() - MAX_CLOCK_SKEW_IN_MILLISECONDS > now
        || now > expiry + tolerableValidity) {
      throw new OCSPResponseException(
          RevocationErrorCode.PARSE_ERROR,
          OCSPErrorCode.INVALID_RESPONSE,
          String.format(
              "OCSP response from %s is out of its validity range: "
                  + "current time %s, this update %s, next update %s",
              ocspUrl, clock.instant(), thisUpdate, nextUpdate));
    }
  }

  private static SingleResp findResponse(BasicOCSPResp basicOcspResp, CertificateID certificateId)
      throws OCSPResponseException {
    for (SingleResp singleResp : basicOcspResp.getResponses()) {
      if (matches(certificateId, singleResp.getCertID())) {
        return singleResp;
      }
    }
    throw new OCSPResponseException(
        RevocationErrorCode.PARSE_ERROR,
        OCSPErrorCode.NO_MATCHING_RESPONSE,
        "OCSP response does not cover the requested certificate");
  }

  /** Responders may encode the hash algorithm parameters differently, so only the OID counts. */
  static boolean matches(CertificateID requested, CertificateID answered) {
    return requested.getHashAlgOID().equals(answered.getHashAlgOID())
        && Arrays.equals(requested.getIssuerNameHash(), answered.getIssuerNameHash())
        && Arrays.equals(requested.getIssuerKeyHash(), answered.getIssuerKeyHash())
        && requested.getSerialNumber().equals(answered.getSerialNumber());
  }

  static String buildGetUrl(String ocspUrl, byte[] ocspReqDer) {
    String encoded;
    try {
      encoded =
          URLEncoder.encode(
              Base64.encodeBase64String(ocspReqDer), StandardCharsets.UTF_8.toString());
    } catch (UnsupportedEncodingException ex) {
      throw new IllegalStateException("UTF-8 is not supported", ex);
    }
    return ocspUrl.endsWith("/") ? ocspUrl + encoded : ocspUrl + "/" + encoded;
  }
}
