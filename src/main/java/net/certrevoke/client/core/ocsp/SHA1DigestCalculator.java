package net.certrevoke.client.core.ocsp;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import org.apache.commons.codec.digest.DigestUtils;
import org.bouncycastle.asn1.oiw.OIWObjectIdentifiers;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.operator.DigestCalculator;

/**
 * SHA-1 calculator for OCSP CertIDs. The identifier carries no parameters, which some responders
 * echo back differently, so responses are matched field by field in {@link OCSPClient#matches}.
 */
class SHA1DigestCalculator implements DigestCalculator {
  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

  @Override
  public AlgorithmIdentifier getAlgorithmIdentifier() {
    return new AlgorithmIdentifier(OIWObjectIdentifiers.idSHA1);
  }

  @Override
  public OutputStream getOutputStream() {
    return buffer;
  }

  @Override
  public byte[] getDigest() {
    byte[] digest = DigestUtils.sha1(buffer.toByteArray());
    buffer.reset();
    return digest;
  }
}
