package net.certrevoke.client.log;

import static net.certrevoke.client.core.RevokeUtil.systemGetProperty;

/**
 * Hands out {@link RevokeLogger}s. The backend is picked once, from the {@value
 * #LOGGER_IMPL_PROPERTY} system property, and defaults to java.util.logging.
 */
public class RevokeLoggerFactory {
  public static final String LOGGER_IMPL_PROPERTY = "net.certrevoke.loggerImpl";

  private static LoggerImpl loggerImplementation;

  enum LoggerImpl {
    SLF4JLOGGER(SLF4JLogger.class.getName()) {
      @Override
      RevokeLogger create(String name) {
        return new SLF4JLogger(name);
      }
    },
    JDK14LOGGER(JDK14Logger.class.getName()) {
      @Override
      RevokeLogger create(String name) {
        return new JDK14Logger(name);
      }
    };

    private final String className;

    LoggerImpl(String className) {
      this.className = className;
    }

    abstract RevokeLogger create(String name);

    static LoggerImpl fromClassName(String className) {
      for (LoggerImpl impl : values()) {
        if (impl.className.equalsIgnoreCase(className)) {
          return impl;
        }
      }
      return JDK14LOGGER;
    }
  }

  private RevokeLoggerFactory() {}

  public static RevokeLogger getLogger(Class<?> clazz) {
    return getLogger(clazz.getName());
  }

  public static synchronized RevokeLogger getLogger(String name) {
    if (loggerImplementation == null) {
      String configured = systemGetProperty(LOGGER_IMPL_PROPERTY);
      loggerImplementation =
          configured == null ? LoggerImpl.JDK14LOGGER : LoggerImpl.fromClassName(configured);
    }
    return loggerImplementation.create(name);
  }

  static synchronized void resetLoggerImplementation() {
    loggerImplementation = null;
  }
}
