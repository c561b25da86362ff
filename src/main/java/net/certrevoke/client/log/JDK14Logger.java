package net.certrevoke.client.log;

import java.text.MessageFormat;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link RevokeLogger} writing to java.util.logging. Levels map as ERROR to SEVERE, WARN to
 * WARNING, INFO to INFO, DEBUG to FINE and TRACE to FINEST.
 */
public class JDK14Logger implements RevokeLogger {
  private static final String THIS_CLASS = JDK14Logger.class.getName();

  private final Logger jdkLogger;

  public JDK14Logger(String name) {
    this.jdkLogger = Logger.getLogger(name);
  }

  @Override
  public void error(String msg, Object... arguments) {
    log(Level.SEVERE, msg, arguments);
  }

  @Override
  public void error(String msg, Throwable t) {
    log(Level.SEVERE, msg, t);
  }

  @Override
  public boolean isErrorEnabled() {
    return jdkLogger.isLoggable(Level.SEVERE);
  }

  @Override
  public void warn(String msg, Object... arguments) {
    log(Level.WARNING, msg, arguments);
  }

  @Override
  public void warn(String msg, Throwable t) {
    log(Level.WARNING, msg, t);
  }

  @Override
  public boolean isWarnEnabled() {
    return jdkLogger.isLoggable(Level.WARNING);
  }

  @Override
  public void info(String msg, Object... arguments) {
    log(Level.INFO, msg, arguments);
  }

  @Override
  public void info(String msg, Throwable t) {
    log(Level.INFO, msg, t);
  }

  @Override
  public boolean isInfoEnabled() {
    return jdkLogger.isLoggable(Level.INFO);
  }

  @Override
  public void debug(String msg, Object... arguments) {
    log(Level.FINE, msg, arguments);
  }

  @Override
  public void debug(String msg, Throwable t) {
    log(Level.FINE, msg, t);
  }

  @Override
  public boolean isDebugEnabled() {
    return jdkLogger.isLoggable(Level.FINE);
  }

  @Override
  public void trace(String msg, Object... arguments) {
    log(Level.FINEST, msg, arguments);
  }

  @Override
  public void trace(String msg, Throwable t) {
    log(Level.FINEST, msg, t);
  }

  @Override
  public boolean isTraceEnabled() {
    return jdkLogger.isLoggable(Level.FINEST);
  }

  private void log(Level level, String msg, Object[] arguments) {
    if (!jdkLogger.isLoggable(level)) {
      return;
    }
    String message;
    try {
      message =
          MessageFormat.format(
              LogMessages.toMessageFormatPattern(msg), LogMessages.resolve(arguments, true));
    } catch (IllegalArgumentException e) {
      message = "Unable to format msg: " + msg;
    }
    StackTraceElement caller = findCaller();
    jdkLogger.logp(level, caller.getClassName(), caller.getMethodName(), message);
  }

  private void log(Level level, String msg, Throwable t) {
    if (jdkLogger.isLoggable(level)) {
      StackTraceElement caller = findCaller();
      jdkLogger.logp(level, caller.getClassName(), caller.getMethodName(), msg, t);
    }
  }

  /** The frame right after the last one belonging to this class. */
  private static StackTraceElement findCaller() {
    StackTraceElement[] stack = new Throwable().getStackTrace();
    int last = -1;
    for (int i = 0; i < stack.length; i++) {
      if (THIS_CLASS.equals(stack[i].getClassName())) {
        last = i;
      }
    }
    if (last >= 0 && last + 1 < stack.length) {
      return stack[last + 1];
    }
    return new StackTraceElement(THIS_CLASS, "log", null, -1);
  }
}
