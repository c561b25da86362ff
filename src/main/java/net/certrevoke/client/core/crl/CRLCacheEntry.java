package net.certrevoke.client.core.crl;

import java.time.Instant;

class CRLCacheEntry {
  private final RevocationList revocationList;
  private final Instant downloadTime;

  CRLCacheEntry(RevocationList revocationList, Instant downloadTime) {
    if (revocationList == null) {
      throw new IllegalArgumentException("Revocation list cannot be null");
    }
    if (downloadTime == null) {
      throw new IllegalArgumentException("Download time cannot be null");
    }
    this.revocationList = revocationList;
    this.downloadTime = downloadTime;
  }

  RevocationList getRevocationList() {
    return revocationList;
  }

  Instant getDownloadTime() {
    return downloadTime;
  }

  boolean isCrlExpired(Instant time) {
    return !revocationList.isUsable(time);
  }
}
