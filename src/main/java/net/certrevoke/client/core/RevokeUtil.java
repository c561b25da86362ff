package net.certrevoke.client.core;

import net.certrevoke.client.log.RevokeLogger;
import net.certrevoke.client.log.RevokeLoggerFactory;

/** Static helpers for reading configuration from system properties. */
public class RevokeUtil {
  private static final RevokeLogger logger = RevokeLoggerFactory.getLogger(RevokeUtil.class);

  private RevokeUtil() {}

  /**
   * Reads a system property, treating a denied read as unset.
   *
   * @return the value, or null when unset or not readable
   */
  public static String systemGetProperty(String property) {
    try {
      return System.getProperty(property);
    } catch (SecurityException ex) {
      // null while this class is still initializing the logger factory
      if (logger != null) {
        logger.debug("Cannot read system property {}: {}", property, ex.getMessage());
      }
      return null;
    }
  }

  /** @return the property parsed as a boolean, or {@code defaultValue} when unset */
  public static boolean convertSystemPropertyToBooleanValue(
      String systemProperty, boolean defaultValue) {
    String value = systemGetProperty(systemProperty);
    return value == null ? defaultValue : Boolean.parseBoolean(value);
  }

  /**
   * @return the property parsed as an int, or {@code defaultValue} when unset or blank
   * @throws IllegalArgumentException if the property is set but not a positive integer
   */
  public static int convertSystemPropertyToPositiveIntValue(
      String systemProperty, int defaultValue) {
    String systemPropertyValue = systemGetProperty(systemProperty);
    if (isNullOrEmpty(systemPropertyValue)) {
      return defaultValue;
    }
    try {
      int value = Integer.parseInt(systemPropertyValue.trim());
      if (value <= 0) {
        throw new IllegalArgumentException(
            String.format("%s must be positive: %s", systemProperty, systemPropertyValue));
      }
      return value;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("Invalid value of %s: %s", systemProperty, systemPropertyValue), e);
    }
  }

  public static boolean isNullOrEmpty(String str) {
    return str == null || str.isEmpty();
  }
}
