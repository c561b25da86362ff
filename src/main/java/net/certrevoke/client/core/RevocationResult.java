package net.certrevoke.client.core;

/**
 * Outcome of a revocation check. The two flags are kept independent because all four combinations
 * carry meaning:
 *
 * <ul>
 *   <li>{@code revoked=false, checkSucceeded=true}: verified not revoked
 *   <li>{@code revoked=true, checkSucceeded=true}: verified revoked
 *   <li>{@code revoked=false, checkSucceeded=false}: check failed under soft-fail, do not block
 *   <li>{@code revoked=true, checkSucceeded=false}: check failed under hard-fail, treat as revoked
 * </ul>
 */
public final class RevocationResult {
  public static final RevocationResult NOT_REVOKED = new RevocationResult(false, true);
  public static final RevocationResult REVOKED = new RevocationResult(true, true);
  public static final RevocationResult SOFT_FAILURE = new RevocationResult(false, false);
  public static final RevocationResult HARD_FAILURE = new RevocationResult(true, false);

  private final boolean revoked;
  private final boolean checkSucceeded;

  private RevocationResult(boolean revoked, boolean checkSucceeded) {
    this.revoked = revoked;
    this.checkSucceeded = checkSucceeded;
  }

  public static RevocationResult of(boolean revoked, boolean checkSucceeded) {
    if (checkSucceeded) {
      return revoked ? REVOKED : NOT_REVOKED;
    }
    return revoked ? HARD_FAILURE : SOFT_FAILURE;
  }

  /**
   * @param hardFail the failure policy in force
   * @return the result of a check that could not be completed
   */
  public static RevocationResult failure(boolean hardFail) {
    return hardFail ? HARD_FAILURE : SOFT_FAILURE;
  }

  public boolean isRevoked() {
    return revoked;
  }

  public boolean isCheckSucceeded() {
    return checkSucceeded;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RevocationResult)) {
      return false;
    }
    RevocationResult that = (RevocationResult) o;
    return revoked == that.revoked && checkSucceeded == that.checkSucceeded;
  }

  @Override
  public int hashCode() {
    return (revoked ? 2 : 0) + (checkSucceeded ? 1 : 0);
  }

  @Override
  public String toString() {
    return "RevocationResult{revoked=" + revoked + ", checkSucceeded=" + checkSucceeded + "}";
  }
}
