package net.certrevoke.client.core.crl;

import java.math.BigInteger;
import java.security.cert.X509CRL;
import java.security.cert.X509CRLEntry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** A parsed CRL tied to the source key it was loaded from. Immutable. */
public final class RevocationList {
  private final String sourceKey;
  private final Instant nextUpdate;
  private final List<BigInteger> revokedSerials;

  RevocationList(String sourceKey, X509CRL crl) {
    if (crl == null) {
      throw new IllegalArgumentException("CRL cannot be null");
    }
    this.sourceKey = sourceKey;
    this.nextUpdate = crl.getNextUpdate() != null ? crl.getNextUpdate().toInstant() : null;
    List<BigInteger> serials = new ArrayList<>();
    Set<? extends X509CRLEntry> entries = crl.getRevokedCertificates();
    if (entries != null) {
      for (X509CRLEntry entry : entries) {
        serials.add(entry.getSerialNumber());
      }
    }
    this.revokedSerials = Collections.unmodifiableList(serials);
  }

  public String getSourceKey() {
    return sourceKey;
  }

  /** May be null when the CRL does not announce its next update. */
  public Instant getNextUpdate() {
    return nextUpdate;
  }

  /**
   * A list is usable only strictly before its next update. Lists that announce no next update are
   * never reusable.
   */
  public boolean isUsable(Instant now) {
    return nextUpdate != null && now.isBefore(nextUpdate);
  }

  public boolean isRevoked(BigInteger serialNumber) {
    for (BigInteger revoked : revokedSerials) {
      if (revoked.compareTo(serialNumber) == 0) {
        return true;
      }
    }
    return false;
  }

  public Set<BigInteger> getRevokedSerials() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(revokedSerials));
  }

  @Override
  public String toString() {
    return "RevocationList{source="
        + sourceKey
        + ", entries="
        + revokedSerials.size()
        + ", nextUpdate="
        + nextUpdate
        + "}";
  }
}
