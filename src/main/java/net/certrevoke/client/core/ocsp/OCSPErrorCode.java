package net.certrevoke.client.core.ocsp;

/** Detailed reasons an OCSP exchange did not yield a usable answer. */
public enum OCSPErrorCode {
  // error statuses returned by the responder
  MALFORMED_REQUEST,
  INTERNAL_ERROR,
  TRY_LATER,
  SIG_REQUIRED,
  UNAUTHORIZED,
  UNKNOWN_RESPONSE_STATUS,

  // client side failures
  NO_ISSUER,
  REQUEST_BUILD_FAILURE,
  RESPONDER_UNREACHABLE,
  INVALID_RESPONSE,
  NO_MATCHING_RESPONSE,
  INVALID_SIGNING_CERTIFICATE,
  INVALID_RESPONSE_SIGNATURE
}
