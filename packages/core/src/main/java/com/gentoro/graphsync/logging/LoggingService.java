package com.gentoro.graphsync.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Central access point for loggers. Levels can be tuned from the application configuration using
 * {@code logging.level.<logger-name>} keys, where {@code root} addresses the root logger:
 *
 * <pre>
 * logging:
 *   level:
 *     root: INFO
 *     com.gentoro.graphsync.graph: DEBUG
 * </pre>
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /** Apply {@code logging.level.*} entries to Logback. Unknown level names fall back to INFO. */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) return;
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      getLogger(LoggingService.class)
          .warn(
              "SLF4J is bound to {} instead of Logback; logging.level settings are ignored",
              factory.getClass().getName());
      return;
    }
    Iterator<String> keys = configuration.getKeys(LEVEL_PREFIX);
    while (keys.hasNext()) {
      String key = keys.next();
      if (key.length() <= LEVEL_PREFIX.length() + 1) continue;
      String loggerName = loggerName(key.substring(LEVEL_PREFIX.length() + 1));
      String value = configuration.getString(key);
      Level level = Level.toLevel(value, Level.INFO);
      String target = "root".equalsIgnoreCase(loggerName) ? Logger.ROOT_LOGGER_NAME : loggerName;
      context.getLogger(target).setLevel(level);
    }
  }

  // YAML keys containing dots are escaped as ".." by the default expression engine.
  static String loggerName(String configKeySuffix) {
    return configKeySuffix.replace("..", ".");
  }
}
