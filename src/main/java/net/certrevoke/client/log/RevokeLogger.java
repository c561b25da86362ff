package net.certrevoke.client.log;

/**
 * Logging facade used throughout the client so the backend can be switched between
 * java.util.logging and SLF4J with {@link RevokeLoggerFactory#LOGGER_IMPL_PROPERTY}.
 *
 * <p>Messages use SLF4J style {@code {}} placeholders. Arguments that are expensive to compute can
 * be passed as {@link ArgSupplier}; they are evaluated only when the level is enabled.
 */
public interface RevokeLogger {
  void error(String msg, Object... arguments);

  void error(String msg, Throwable t);

  boolean isErrorEnabled();

  void warn(String msg, Object... arguments);

  void warn(String msg, Throwable t);

  boolean isWarnEnabled();

  void info(String msg, Object... arguments);

  void info(String msg, Throwable t);

  boolean isInfoEnabled();

  void debug(String msg, Object... arguments);

  void debug(String msg, Throwable t);

  boolean isDebugEnabled();

  void trace(String msg, Object... arguments);

  void trace(String msg, Throwable t);

  boolean isTraceEnabled();
}
