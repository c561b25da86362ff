package net.certrevoke.client.log;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.math.BigInteger;
import net.certrevoke.client.category.TestTags;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag(TestTags.LOG)
public class LogMessagesTest {
  @Test
  public void testToMessageFormatPattern() {
    assertEquals("Error in {0} on {1}", LogMessages.toMessageFormatPattern("Error in {} on {}"));
    assertEquals("can''t fetch {0}", LogMessages.toMessageFormatPattern("can't fetch {}"));
    assertEquals("no placeholders", LogMessages.toMessageFormatPattern("no placeholders"));
    assertEquals("{x} {0}", LogMessages.toMessageFormatPattern("{x} {}"));
  }

  @Test
  public void testResolveEvaluatesSuppliers() {
    Object[] resolved =
        LogMessages.resolve(new Object[] {"a", (ArgSupplier) () -> "b", null}, false);

    assertArrayEquals(new Object[] {"a", "b", null}, resolved);
  }

  @Test
  public void testResolveRendersNumbersAsText() {
    BigInteger serial = new BigInteger("1234567");

    assertEquals("1234567", LogMessages.resolve(new Object[] {serial}, true)[0]);
    assertEquals(serial, LogMessages.resolve(new Object[] {serial}, false)[0]);
    assertEquals(0, LogMessages.resolve(null, true).length);
  }
}
