package net.certrevoke.client.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import net.certrevoke.client.category.TestTags;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag(TestTags.CORE)
class RevocationResultTest {

  @Test
  void failureFollowsHardFailSetting() {
    RevocationResult hard = RevocationResult.failure(true);
    RevocationResult soft = RevocationResult.failure(false);

    assertTrue(hard.isRevoked());
    assertFalse(hard.isCheckSucceeded());
    assertFalse(soft.isRevoked());
    assertFalse(soft.isCheckSucceeded());
  }

  @Test
  void ofReturnsSharedConstants() {
    assertSame(RevocationResult.NOT_REVOKED, RevocationResult.of(false, true));
    assertSame(RevocationResult.REVOKED, RevocationResult.of(true, true));
    assertSame(RevocationResult.SOFT_FAILURE, RevocationResult.of(false, false));
    assertSame(RevocationResult.HARD_FAILURE, RevocationResult.of(true, false));
  }

  @Test
  void equalityIsByValue() {
    assertEquals(RevocationResult.REVOKED, RevocationResult.of(true, true));
    assertNotEquals(RevocationResult.REVOKED, RevocationResult.HARD_FAILURE);
    assertEquals(
        RevocationResult.SOFT_FAILURE.hashCode(), RevocationResult.of(false, false).hashCode());
  }
}
