package net.certrevoke.client.core.ocsp;

import net.certrevoke.client.core.RevocationErrorCode;
import net.certrevoke.client.core.RevocationException;

public class OCSPResponseException extends RevocationException {
  private static final long serialVersionUID = 1L;

  private final OCSPErrorCode ocspErrorCode;

  public OCSPResponseException(
      RevocationErrorCode errorCode, OCSPErrorCode ocspErrorCode, String errorMsg) {
    this(errorCode, ocspErrorCode, errorMsg, null);
  }

  public OCSPResponseException(
      RevocationErrorCode errorCode,
      OCSPErrorCode ocspErrorCode,
      String errorMsg,
      Throwable cause) {
    super(errorCode, errorMsg, cause);
    this.ocspErrorCode = ocspErrorCode;
  }

  public OCSPErrorCode getOcspErrorCode() {
    return ocspErrorCode;
  }

  @Override
  public String toString() {
    return super.toString() + (ocspErrorCode != null ? ", ocspErrorCode = " + ocspErrorCode : "");
  }
}
