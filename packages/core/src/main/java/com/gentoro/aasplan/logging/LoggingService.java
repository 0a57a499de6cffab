package com.gentoro.aasplan.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Central access point for loggers.
 *
 * <p>Levels can be tuned from the application configuration using nested keys below {@code
 * logging.level}, for example:
 *
 * <pre>{@code
 * logging:
 *   level:
 *     root: INFO
 *     com:
 *       gentoro:
 *         aasplan: DEBUG
 * }</pre>
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /**
   * Apply logger levels found in the configuration. Unknown level names fall back to DEBUG as
   * Logback does; non-Logback bindings are left untouched.
   */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) {
      return;
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      getLogger(LoggingService.class)
          .debug("Logger factory {} is not Logback, skipping level configuration", factory);
      return;
    }

    Iterator<String> keys = configuration.getKeys(LEVEL_PREFIX);
    while (keys.hasNext()) {
      String key = keys.next();
      if (key.length() <= LEVEL_PREFIX.length() + 1) {
        continue;
      }
      String loggerName = key.substring(LEVEL_PREFIX.length() + 1);
      String value = configuration.getString(key);
      if (value == null || value.isBlank()) {
        continue;
      }
      String name = "root".equalsIgnoreCase(loggerName) ? Logger.ROOT_LOGGER_NAME : loggerName;
      context.getLogger(name).setLevel(Level.toLevel(value.trim(), Level.DEBUG));
    }
  }
}
