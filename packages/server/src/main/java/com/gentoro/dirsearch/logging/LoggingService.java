package com.gentoro.dirsearch.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logger factory for the application and bridge from {@code logging.level.*} configuration keys to
 * Logback levels.
 *
 * <pre>
 * logging:
 *   level:
 *     root: INFO
 *     com.gentoro.dirsearch: DEBUG
 *     org.eclipse.jetty: WARN
 * </pre>
 */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);
  static final String LEVELS_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /** Apply the configured levels. Unknown level names are reported and ignored. */
  public static void applyConfiguration(Configuration cfg) {
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext ctx)) {
      log.warn("Logback is not the active SLF4J binding; logging.level settings ignored");
      return;
    }
    configuredLevels(cfg)
        .forEach(
            (name, level) -> {
              ctx.getLogger(name).setLevel(level);
              log.debug("Set logger '{}' to level {}", name, level);
            });
  }

  /** Logger name to level, in configuration order. {@code root} maps to the root logger. */
  static Map<String, Level> configuredLevels(Configuration cfg) {
    Map<String, Level> levels = new LinkedHashMap<>();
    if (cfg == null) return levels;
    Configuration section = cfg.subset(LEVELS_PREFIX);
    for (Iterator<String> it = section.getKeys(); it.hasNext(); ) {
      String key = it.next();
      String value = section.getString(key, null);
      if (value == null || value.isBlank()) continue;
      Level level = Level.toLevel(value.trim(), null);
      if (level == null) {
        log.warn("Unknown log level '{}' for logger '{}'; ignoring", value, key);
        continue;
      }
      // dotted YAML keys come back with escaped separators
      String name = "root".equalsIgnoreCase(key) ? Logger.ROOT_LOGGER_NAME : key.replace("..", ".");
      levels.put(name, level);
    }
    return levels;
  }
}
