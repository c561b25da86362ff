package net.certrevoke.client.log;

/** Placeholder and argument handling shared by the logger implementations. */
final class LogMessages {
  private LogMessages() {}

  /**
   * @param arguments raw log arguments, may contain {@link ArgSupplier}s
   * @param numbersAsText render numbers with {@code toString()} so formatters that localize them
   *     do not insert grouping separators into serial numbers
   * @return arguments with every supplier evaluated
   */
  static Object[] resolve(Object[] arguments, boolean numbersAsText) {
    if (arguments == null) {
      return new Object[0];
    }
    Object[] resolved = new Object[arguments.length];
    for (int i = 0; i < arguments.length; i++) {
      Object value = arguments[i];
      if (value instanceof ArgSupplier) {
        value = ((ArgSupplier) value).get();
      }
      if (numbersAsText && value instanceof Number) {
        value = value.toString();
      }
      resolved[i] = value;
    }
    return resolved;
  }

  /**
   * Rewrites {@code {}} placeholders as indexed {@link java.text.MessageFormat} ones and escapes
   * single quotes, e.g. {@code "can't fetch {} from {}"} becomes {@code "can''t fetch {0} from
   * {1}"}.
   */
  static String toMessageFormatPattern(String msg) {
    StringBuilder pattern = new StringBuilder(msg.length() + 8);
    int index = 0;
    int i = 0;
    while (i < msg.length()) {
      char c = msg.charAt(i);
      if (c == '{' && i + 1 < msg.length() && msg.charAt(i + 1) == '}') {
        pattern.append('{').append(index++).append('}');
        i += 2;
        continue;
      }
      if (c == '\'') {
        pattern.append('\'');
      }
      pattern.append(c);
      i++;
    }
    return pattern.toString();
  }
}
