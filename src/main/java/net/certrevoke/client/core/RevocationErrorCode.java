package net.certrevoke.client.core;

/** Kinds of failure raised while fetching, parsing or verifying revocation data. */
public enum RevocationErrorCode {
  /** Bad local CRL path or scheme. */
  INVALID_CONFIGURATION,
  /** Filesystem read failure. */
  IO_ERROR,
  /** Transport failure or non-success response. */
  FETCH_ERROR,
  /** Malformed CRL, certificate or OCSP payload. */
  PARSE_ERROR,
  /** Parsed CRL has no usable content. */
  EMPTY_LIST,
  /** Verification against the issuer failed. */
  SIGNATURE_ERROR,
  /** The distribution point uses a transport that is not supported, e.g. ldap. */
  UNSUPPORTED_TRANSPORT,
  /** The OCSP responder answered with a named error status. */
  PROTOCOL_ERROR
}
