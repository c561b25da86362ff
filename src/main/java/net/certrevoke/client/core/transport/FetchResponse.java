package net.certrevoke.client.core.transport;

public final class FetchResponse {
  private final int statusCode;
  private final byte[] body;

  public FetchResponse(int statusCode, byte[] body) {
    this.statusCode = statusCode;
    this.body = body != null ? body : new byte[0];
  }

  public int getStatusCode() {
    return statusCode;
  }

  public byte[] getBody() {
    return body;
  }

  public boolean isSuccessful() {
    return statusCode >= 200 && statusCode < 300;
  }
}
