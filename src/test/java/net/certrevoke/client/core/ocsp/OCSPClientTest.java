package net.certrevoke.client.core.ocsp;

import static net.certrevoke.client.core.CertificateGeneratorUtil.ONE_DAY_MS;
import static net.certrevoke.client.core.CertificateGeneratorUtil.urls;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Date;
import net.certrevoke.client.category.TestTags;
import net.certrevoke.client.core.CertificateGeneratorUtil;
import net.certrevoke.client.core.CertificateGeneratorUtil.SignerCertificate;
import net.certrevoke.client.core.FakeResourceFetcher;
import net.certrevoke.client.core.MutableClock;
import net.certrevoke.client.core.RevocationErrorCode;
import net.certrevoke.client.core.RevocationResult;
import net.certrevoke.client.core.cert.IssuerResolver;
import net.certrevoke.client.core.cert.X509RevocableCertificate;
import org.bouncycastle.cert.jcajce.JcaX509CertificateHolder;
import org.bouncycastle.cert.ocsp.CertificateID;
import org.bouncycastle.cert.ocsp.CertificateStatus;
import org.bouncycastle.cert.ocsp.OCSPReq;
import org.bouncycastle.cert.ocsp.OCSPReqBuilder;
import org.bouncycastle.cert.ocsp.OCSPRespBuilder;
import org.bouncycastle.cert.ocsp.RevokedStatus;
import org.bouncycastle.cert.ocsp.UnknownStatus;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag(TestTags.CORE)
class OCSPClientTest {
  private static final String CA_URL = "http://ca.test/ca.crt";
  private static final String OCSP_URL = "http://ocsp1.ca.test";
  private static final String BACKUP_OCSP_URL = "http://ocsp2.ca.test";

  private static CertificateGeneratorUtil certGen;
  private static X509Certificate caCertificate;

  private FakeResourceFetcher fetcher;
  private MutableClock clock;
  private OCSPClient client;

  @BeforeAll
  static void setUpClass() {
    certGen = new CertificateGeneratorUtil();
    caCertificate = certGen.getCACertificate();
  }

  @BeforeEach
  void setUp() throws Exception {
    fetcher = new FakeResourceFetcher();
    fetcher.respond(CA_URL, caCertificate.getEncoded());
    clock = MutableClock.now();
    client = new OCSPClient(fetcher, new IssuerResolver(fetcher), clock);
  }

  private X509RevocableCertificate leaf(String... ocspUrls) throws Exception {
    return new X509RevocableCertificate(certGen.createLeaf(null, urls(ocspUrls), urls(CA_URL)));
  }

  @Test
  void shouldReportGoodCertificateUsingGet() throws Exception {
    X509RevocableCertificate leaf = leaf(OCSP_URL);
    fetcher.respond(
        OCSP_URL, certGen.generateOCSPResponse(leaf.getCertificate(), CertificateStatus.GOOD));

    assertEquals(RevocationResult.NOT_REVOKED, client.checkOCSP(leaf, true));
    assertTrue(fetcher.getPostedUrls().isEmpty());
    assertTrue(fetcher.getRequestedUrls().get(1).startsWith(OCSP_URL + "/"));
  }

  @Test
  void shouldReportRevokedCertificate() throws Exception {
    X509RevocableCertificate leaf = leaf(OCSP_URL);
    fetcher.respond(
        OCSP_URL,
        certGen.generateOCSPResponse(leaf.getCertificate(), new RevokedStatus(new Date(), 1)));

    assertEquals(RevocationResult.REVOKED, client.checkOCSP(leaf, caCertificate, false));
  }

  @Test
  void shouldTreatUnknownStatusAsRevoked() throws Exception {
    X509RevocableCertificate leaf = leaf(OCSP_URL);
    fetcher.respond(
        OCSP_URL, certGen.generateOCSPResponse(leaf.getCertificate(), new UnknownStatus()));

    assertEquals(RevocationResult.REVOKED, client.checkOCSP(leaf, caCertificate, false));
  }

  @Test
  void shouldPostRequestsLargerThanGetLimit() throws Exception {
    client = new OCSPClient(fetcher, new IssuerResolver(fetcher), clock, 16);
    X509RevocableCertificate leaf = leaf(OCSP_URL);
    fetcher.respond(
        OCSP_URL, certGen.generateOCSPResponse(leaf.getCertificate(), CertificateStatus.GOOD));

    assertEquals(RevocationResult.NOT_REVOKED, client.checkOCSP(leaf, caCertificate, true));
    assertEquals(urls(OCSP_URL), fetcher.getPostedUrls());
    assertEquals(OCSPClient.OCSP_REQUEST_CONTENT_TYPE, fetcher.getLastPostContentType());
    OCSPReq posted = new OCSPReq(fetcher.getLastPostBody());
    assertEquals(
        leaf.getSerialNumber(), posted.getRequestList()[0].getCertID().getSerialNumber());
  }

  @Test
  void shouldReportNotRevokedWithoutResponders() throws Exception {
    X509RevocableCertificate leaf =
        new X509RevocableCertificate(certGen.createLeaf(null, null, null));

    assertEquals(RevocationResult.NOT_REVOKED, client.checkOCSP(leaf, true));
    assertEquals(0, fetcher.totalRequests());
  }

  @Test
  void shouldFailWithoutIssuer() throws Exception {
    X509RevocableCertificate leaf =
        new X509RevocableCertificate(certGen.createLeaf(null, urls(OCSP_URL), null));

    assertEquals(RevocationResult.SOFT_FAILURE, client.checkOCSP(leaf, false));
    assertEquals(0, fetcher.requestCount(OCSP_URL));
  }

  @Test
  void shouldTryNextResponderWhenNotStrict() throws Exception {
    X509RevocableCertificate leaf = leaf(OCSP_URL, BACKUP_OCSP_URL);
    fetcher.fail(OCSP_URL, new IOException("timed out"));
    fetcher.respond(
        BACKUP_OCSP_URL,
        certGen.generateOCSPResponse(leaf.getCertificate(), CertificateStatus.GOOD));

    assertEquals(RevocationResult.NOT_REVOKED, client.checkOCSP(leaf, caCertificate, false));
    assertEquals(1, fetcher.requestCount(BACKUP_OCSP_URL));
  }

  @Test
  void shouldGiveUpOnFirstFailingResponderWhenStrict() throws Exception {
    X509RevocableCertificate leaf = leaf(OCSP_URL, BACKUP_OCSP_URL);
    fetcher.respond(
        OCSP_URL, CertificateGeneratorUtil.generateErrorOCSPResponse(OCSPRespBuilder.TRY_LATER));
    fetcher.respond(
        BACKUP_OCSP_URL,
        certGen.generateOCSPResponse(leaf.getCertificate(), CertificateStatus.GOOD));

    assertEquals(RevocationResult.SOFT_FAILURE, client.checkOCSP(leaf, caCertificate, true));
    assertEquals(0, fetcher.requestCount(BACKUP_OCSP_URL));
  }

  @Test
  void shouldFailWhenNoResponderAnswers() throws Exception {
    X509RevocableCertificate leaf = leaf(OCSP_URL, BACKUP_OCSP_URL);
    fetcher.respond(OCSP_URL, 500, new byte[0]);
    fetcher.respond(BACKUP_OCSP_URL, 503, new byte[0]);

    assertEquals(RevocationResult.SOFT_FAILURE, client.checkOCSP(leaf, caCertificate, false));
  }

  @Test
  void shouldFailImmediatelyOnBadSignature() throws Exception {
    X509RevocableCertificate leaf = leaf(OCSP_URL, BACKUP_OCSP_URL);
    CertificateGeneratorUtil otherCa = new CertificateGeneratorUtil();
    fetcher.respond(
        OCSP_URL,
        otherCa.generateOCSPResponse(leaf.getSerialNumber(), CertificateStatus.GOOD, null));
    fetcher.respond(
        BACKUP_OCSP_URL,
        certGen.generateOCSPResponse(leaf.getCertificate(), CertificateStatus.GOOD));

    assertEquals(RevocationResult.SOFT_FAILURE, client.checkOCSP(leaf, caCertificate, false));
    assertEquals(0, fetcher.requestCount(BACKUP_OCSP_URL));
  }

  @Test
  void shouldAcceptResponseFromDelegatedResponder() throws Exception {
    X509RevocableCertificate leaf = leaf(OCSP_URL);
    long now = clock.millis();
    SignerCertificate responder =
        certGen.createOcspSigningCertificate(
            new Date(now - ONE_DAY_MS), new Date(now + 30 * ONE_DAY_MS));
    fetcher.respond(
        OCSP_URL,
        certGen.generateOCSPResponse(leaf.getSerialNumber(), CertificateStatus.GOOD, responder));

    assertEquals(RevocationResult.NOT_REVOKED, client.checkOCSP(leaf, caCertificate, true));
  }

  @Test
  void shouldRejectExpiredDelegatedResponder() throws Exception {
    X509RevocableCertificate leaf = leaf(OCSP_URL);
    long now = clock.millis();
    SignerCertificate responder =
        certGen.createOcspSigningCertificate(
            new Date(now - 10 * ONE_DAY_MS), new Date(now - 5 * ONE_DAY_MS));
    fetcher.respond(
        OCSP_URL,
        certGen.generateOCSPResponse(leaf.getSerialNumber(), CertificateStatus.GOOD, responder));

    assertEquals(RevocationResult.SOFT_FAILURE, client.checkOCSP(leaf, caCertificate, false));
  }

  @Test
  void shouldRejectDelegatedResponderFromAnotherCa() throws Exception {
    X509RevocableCertificate leaf = leaf(OCSP_URL);
    long now = clock.millis();
    SignerCertificate responder =
        new CertificateGeneratorUtil()
            .createOcspSigningCertificate(
                new Date(now - ONE_DAY_MS), new Date(now + 30 * ONE_DAY_MS));
    fetcher.respond(
        OCSP_URL,
        certGen.generateOCSPResponse(leaf.getSerialNumber(), CertificateStatus.GOOD, responder));

    assertEquals(RevocationResult.SOFT_FAILURE, client.checkOCSP(leaf, caCertificate, false));
  }

  @Test
  void shouldRejectDelegatedResponderWithoutOcspSigningUsage() throws Exception {
    X509RevocableCertificate leaf = leaf(OCSP_URL);
    long now = clock.millis();
    SignerCertificate otherCustomer =
        certGen.createEndEntitySigner(new Date(now - ONE_DAY_MS), new Date(now + 30 * ONE_DAY_MS));
    fetcher.respond(
        OCSP_URL,
        certGen.generateOCSPResponse(
            leaf.getSerialNumber(), CertificateStatus.GOOD, otherCustomer));

    assertEquals(RevocationResult.SOFT_FAILURE, client.checkOCSP(leaf, caCertificate, false));
  }

  @Test
  void shouldRejectResponsePastNextUpdate() throws Exception {
    X509RevocableCertificate leaf = leaf(OCSP_URL);
    fetcher.respond(
        OCSP_URL, certGen.generateOCSPResponse(leaf.getCertificate(), CertificateStatus.GOOD));
    clock.advance(Duration.ofDays(60));

    assertEquals(RevocationResult.SOFT_FAILURE, client.checkOCSP(leaf, caCertificate, false));
  }

  @Test
  void shouldTryNextResponderWhenResponseIsStale() throws Exception {
    X509RevocableCertificate leaf = leaf(OCSP_URL, BACKUP_OCSP_URL);
    fetcher.respond(
        OCSP_URL, certGen.generateOCSPResponse(leaf.getCertificate(), CertificateStatus.GOOD));
    clock.advance(Duration.ofDays(60));
    fetcher.respond(
        BACKUP_OCSP_URL,
        certGen.generateOCSPResponse(
            leaf.getSerialNumber(),
            new RevokedStatus(new Date(), 1),
            null,
            Date.from(clock.instant()),
            Date.from(clock.instant().plus(Duration.ofDays(1)))));

    assertEquals(RevocationResult.REVOKED, client.checkOCSP(leaf, caCertificate, false));
    assertEquals(RevocationResult.SOFT_FAILURE, client.checkOCSP(leaf, caCertificate, true));
  }

  @Test
  void shouldAcceptResponseWithinGracePeriodAfterNextUpdate() throws Exception {
    X509RevocableCertificate leaf = leaf(OCSP_URL);
    fetcher.respond(
        OCSP_URL, certGen.generateOCSPResponse(leaf.getCertificate(), CertificateStatus.GOOD));
    clock.advance(Duration.ofDays(1).plusHours(1));

    assertEquals(RevocationResult.NOT_REVOKED, client.checkOCSP(leaf, caCertificate, false));
  }

  @Test
  void shouldOnlyBrieflyAcceptResponseWithoutNextUpdate() throws Exception {
    X509RevocableCertificate leaf = leaf(OCSP_URL);
    fetcher.respond(
        OCSP_URL,
        certGen.generateOCSPResponse(
            leaf.getSerialNumber(),
            CertificateStatus.GOOD,
            null,
            Date.from(clock.instant()),
            null));

    assertEquals(RevocationResult.NOT_REVOKED, client.checkOCSP(leaf, caCertificate, false));
    clock.advance(Duration.ofDays(1));
    assertEquals(RevocationResult.SOFT_FAILURE, client.checkOCSP(leaf, caCertificate, false));
  }

  @Test
  void shouldRejectResponseFromTheFuture() throws Exception {
    X509RevocableCertificate leaf = leaf(OCSP_URL);
    fetcher.respond(
        OCSP_URL, certGen.generateOCSPResponse(leaf.getCertificate(), CertificateStatus.GOOD));
    clock.advance(Duration.ofMinutes(-30));

    assertEquals(RevocationResult.SOFT_FAILURE, client.checkOCSP(leaf, caCertificate, false));
  }

  @Test
  void shouldFailWhenResponseCoversAnotherCertificate() throws Exception {
    X509RevocableCertificate leaf = leaf(OCSP_URL);
    fetcher.respond(
        OCSP_URL,
        certGen.generateOCSPResponse(
            leaf.getSerialNumber().add(BigInteger.ONE), CertificateStatus.GOOD, null));

    assertEquals(RevocationResult.SOFT_FAILURE, client.checkOCSP(leaf, caCertificate, false));
  }

  @Test
  void shouldMapErrorStatusToOcspErrorCode() throws Exception {
    fetcher.respond(
        OCSP_URL, CertificateGeneratorUtil.generateErrorOCSPResponse(OCSPRespBuilder.TRY_LATER));

    OCSPResponseException ex =
        assertThrows(
            OCSPResponseException.class, () -> client.sendOCSPRequest(OCSP_URL, request()));

    assertEquals(RevocationErrorCode.PROTOCOL_ERROR, ex.getErrorCode());
    assertEquals(OCSPErrorCode.TRY_LATER, ex.getOcspErrorCode());
  }

  @Test
  void shouldReportUnreachableResponder() throws Exception {
    fetcher.respond(OCSP_URL, 502, new byte[0]);

    OCSPResponseException ex =
        assertThrows(
            OCSPResponseException.class, () -> client.sendOCSPRequest(OCSP_URL, request()));

    assertEquals(RevocationErrorCode.FETCH_ERROR, ex.getErrorCode());
    assertEquals(OCSPErrorCode.RESPONDER_UNREACHABLE, ex.getOcspErrorCode());
  }

  @Test
  void shouldReportUnparsableResponse() throws Exception {
    fetcher.respond(OCSP_URL, "<html>oops</html>".getBytes(StandardCharsets.UTF_8));

    OCSPResponseException ex =
        assertThrows(
            OCSPResponseException.class, () -> client.sendOCSPRequest(OCSP_URL, request()));

    assertEquals(RevocationErrorCode.PARSE_ERROR, ex.getErrorCode());
    assertEquals(OCSPErrorCode.INVALID_RESPONSE, ex.getOcspErrorCode());
  }

  @Test
  void shouldReturnBasicResponse() throws Exception {
    fetcher.respond(
        OCSP_URL,
        certGen.generateOCSPResponse(BigInteger.valueOf(5), CertificateStatus.GOOD, null));

    assertNotNull(client.sendOCSPRequest(OCSP_URL, request()));
  }

  @Test
  void shouldAppendEncodedRequestToUrl() {
    byte[] der = {(byte) 0xfb, (byte) 0xff};

    assertEquals("http://ocsp.test/%2B%2F8%3D", OCSPClient.buildGetUrl("http://ocsp.test", der));
    assertEquals("http://ocsp.test/%2B%2F8%3D", OCSPClient.buildGetUrl("http://ocsp.test/", der));
  }

  private OCSPReq request() throws Exception {
    return new OCSPReqBuilder()
        .addRequest(
            new CertificateID(
                new SHA1DigestCalculator(),
                new JcaX509CertificateHolder(caCertificate),
                BigInteger.valueOf(5)))
        .build();
  }
}
