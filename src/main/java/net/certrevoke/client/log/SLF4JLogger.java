package net.certrevoke.client.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;
import org.slf4j.spi.LocationAwareLogger;

/**
 * {@link RevokeLogger} over SLF4J. Location aware backends such as Logback report the caller of
 * the facade rather than this class.
 */
public class SLF4JLogger implements RevokeLogger {
  private static final String FQCN = SLF4JLogger.class.getName();

  private final Logger slf4jLogger;
  private final LocationAwareLogger locationAwareLogger;

  public SLF4JLogger(String name) {
    this.slf4jLogger = LoggerFactory.getLogger(name);
    this.locationAwareLogger =
        slf4jLogger instanceof LocationAwareLogger ? (LocationAwareLogger) slf4jLogger : null;
  }

  @Override
  public void error(String msg, Object... arguments) {
    if (isErrorEnabled()) {
      emit(LocationAwareLogger.ERROR_INT, format(msg, arguments), null);
    }
  }

  @Override
  public void error(String msg, Throwable t) {
    emit(LocationAwareLogger.ERROR_INT, msg, t);
  }

  @Override
  public boolean isErrorEnabled() {
    return slf4jLogger.isErrorEnabled();
  }

  @Override
  public void warn(String msg, Object... arguments) {
    if (isWarnEnabled()) {
      emit(LocationAwareLogger.WARN_INT, format(msg, arguments), null);
    }
  }

  @Override
  public void warn(String msg, Throwable t) {
    emit(LocationAwareLogger.WARN_INT, msg, t);
  }

  @Override
  public boolean isWarnEnabled() {
    return slf4jLogger.isWarnEnabled();
  }

  @Override
  public void info(String msg, Object... arguments) {
    if (isInfoEnabled()) {
      emit(LocationAwareLogger.INFO_INT, format(msg, arguments), null);
    }
  }

  @Override
  public void info(String msg, Throwable t) {
    emit(LocationAwareLogger.INFO_INT, msg, t);
  }

  @Override
  public boolean isInfoEnabled() {
    return slf4jLogger.isInfoEnabled();
  }

  @Override
  public void debug(String msg, Object... arguments) {
    if (isDebugEnabled()) {
      emit(LocationAwareLogger.DEBUG_INT, format(msg, arguments), null);
    }
  }

  @Override
  public void debug(String msg, Throwable t) {
    emit(LocationAwareLogger.DEBUG_INT, msg, t);
  }

  @Override
  public boolean isDebugEnabled() {
    return slf4jLogger.isDebugEnabled();
  }

  @Override
  public void trace(String msg, Object... arguments) {
    if (isTraceEnabled()) {
      emit(LocationAwareLogger.TRACE_INT, format(msg, arguments), null);
    }
  }

  @Override
  public void trace(String msg, Throwable t) {
    emit(LocationAwareLogger.TRACE_INT, msg, t);
  }

  @Override
  public boolean isTraceEnabled() {
    return slf4jLogger.isTraceEnabled();
  }

  private static String format(String msg, Object[] arguments) {
    return MessageFormatter.arrayFormat(msg, LogMessages.resolve(arguments, false)).getMessage();
  }

  private void emit(int level, String msg, Throwable t) {
    if (locationAwareLogger != null) {
      locationAwareLogger.log(null, FQCN, level, msg, null, t);
    } else if (level == LocationAwareLogger.ERROR_INT) {
      slf4jLogger.error(msg, t);
    } else if (level == LocationAwareLogger.WARN_INT) {
      slf4jLogger.warn(msg, t);
    } else if (level == LocationAwareLogger.INFO_INT) {
      slf4jLogger.info(msg, t);
    } else if (level == LocationAwareLogger.DEBUG_INT) {
      slf4jLogger.debug(msg, t);
    } else {
      slf4jLogger.trace(msg, t);
    }
  }
}
