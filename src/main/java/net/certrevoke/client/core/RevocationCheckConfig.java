package net.certrevoke.client.core;

import static net.certrevoke.client.core.RevokeUtil.convertSystemPropertyToBooleanValue;
import static net.certrevoke.client.core.RevokeUtil.convertSystemPropertyToPositiveIntValue;
import static net.certrevoke.client.core.RevokeUtil.systemGetProperty;

import net.certrevoke.client.core.ocsp.OCSPClient;

/** Settings used to build a {@link RevocationChecker}. */
public class RevocationCheckConfig {
  public static final String HARD_FAIL = "net.certrevoke.hardFail";
  public static final String LOCAL_CRL = "net.certrevoke.localCrl";
  public static final String REQUIRE_VERIFIED_CRL = "net.certrevoke.requireVerifiedCrl";
  public static final String CONNECTION_TIMEOUT_MS = "net.certrevoke.connectionTimeoutMs";
  public static final String SOCKET_TIMEOUT_MS = "net.certrevoke.socketTimeoutMs";

  private final boolean hardFail;
  private final String localCrlPath;
  private final boolean requireVerifiedCrl;
  private final int connectionTimeoutMs;
  private final int socketTimeoutMs;
  private final int ocspGetMaxRequestBytes;

  private RevocationCheckConfig(Builder builder) {
    this.hardFail = builder.hardFail;
    this.localCrlPath = builder.localCrlPath;
    this.requireVerifiedCrl = builder.requireVerifiedCrl;
    this.connectionTimeoutMs = builder.connectionTimeoutMs;
    this.socketTimeoutMs = builder.socketTimeoutMs;
    this.ocspGetMaxRequestBytes = builder.ocspGetMaxRequestBytes;
  }

  public boolean isHardFail() {
    return hardFail;
  }

  /** Local CRL to pin at start-up, as a bare path or file URI. Null when none. */
  public String getLocalCrlPath() {
    return localCrlPath;
  }

  /**
   * When set, a remote CRL whose issuer cannot be resolved is rejected instead of being cached
   * without signature verification.
   */
  public boolean isRequireVerifiedCrl() {
    return requireVerifiedCrl;
  }

  public int getConnectionTimeoutMs() {
    return connectionTimeoutMs;
  }

  public int getSocketTimeoutMs() {
    return socketTimeoutMs;
  }

  /** Largest encoded OCSP request sent with GET; larger requests are POSTed. */
  public int getOcspGetMaxRequestBytes() {
    return ocspGetMaxRequestBytes;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads the settings from {@code net.certrevoke.*} system properties, falling back to the
   * defaults for unset ones.
   *
   * @return config
   * @throws IllegalArgumentException if a numeric property is not a positive integer
   */
  public static RevocationCheckConfig fromSystemProperties() {
    Builder builder =
        builder()
            .hardFail(convertSystemPropertyToBooleanValue(HARD_FAIL, false))
            .requireVerifiedCrl(convertSystemPropertyToBooleanValue(REQUIRE_VERIFIED_CRL, false))
            .connectionTimeoutMs(
                convertSystemPropertyToPositiveIntValue(
                    CONNECTION_TIMEOUT_MS, Builder.DEFAULT_TIMEOUT_MS))
            .socketTimeoutMs(
                convertSystemPropertyToPositiveIntValue(
                    SOCKET_TIMEOUT_MS, Builder.DEFAULT_TIMEOUT_MS));
    String localCrl = systemGetProperty(LOCAL_CRL);
    if (!RevokeUtil.isNullOrEmpty(localCrl)) {
      builder.localCrlPath(localCrl);
    }
    return builder.build();
  }

  public static class Builder {
    static final int DEFAULT_TIMEOUT_MS = 30000; // 30 seconds

    private boolean hardFail = false;
    private String localCrlPath = null;
    private boolean requireVerifiedCrl = false;
    private int connectionTimeoutMs = DEFAULT_TIMEOUT_MS;
    private int socketTimeoutMs = DEFAULT_TIMEOUT_MS;
    private int ocspGetMaxRequestBytes = OCSPClient.DEFAULT_GET_MAX_REQUEST_BYTES;

    public Builder hardFail(boolean hardFail) {
      this.hardFail = hardFail;
      return this;
    }

    public Builder localCrlPath(String localCrlPath) {
      this.localCrlPath = localCrlPath;
      return this;
    }

    public Builder requireVerifiedCrl(boolean requireVerifiedCrl) {
      this.requireVerifiedCrl = requireVerifiedCrl;
      return this;
    }

    public Builder connectionTimeoutMs(int timeoutMs) {
      this.connectionTimeoutMs = timeoutMs;
      return this;
    }

    public Builder socketTimeoutMs(int timeoutMs) {
      this.socketTimeoutMs = timeoutMs;
      return this;
    }

    public Builder ocspGetMaxRequestBytes(int maxBytes) {
      this.ocspGetMaxRequestBytes = maxBytes;
      return this;
    }

    public RevocationCheckConfig build() {
      return new RevocationCheckConfig(this);
    }
  }
}
