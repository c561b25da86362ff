package net.certrevoke.client.core;

public class RevocationException extends Exception {
  private static final long serialVersionUID = 1L;

  private final RevocationErrorCode errorCode;

  public RevocationException(RevocationErrorCode errorCode, String errorMsg) {
    this(errorCode, errorMsg, null);
  }

  public RevocationException(RevocationErrorCode errorCode, String errorMsg, Throwable cause) {
    super(errorMsg, cause);
    this.errorCode = errorCode;
  }

  public RevocationErrorCode getErrorCode() {
    return errorCode;
  }

  @Override
  public String toString() {
    return super.toString() + (getErrorCode() != null ? ", errorCode = " + getErrorCode() : "");
  }
}
