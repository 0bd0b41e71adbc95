package ca.gc.cra.parley.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts runtime logging for CLI-driven replays.
 * <p><strong>Why:</strong> Lets operators see guard rejections and malformed messages with
 * {@code --verbose} without editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for the single CLI bootstrap thread.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and keep their defaults.
 * @since PARLEY 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   *
   * @return {@code true} when the backend accepted the change
   */
  public static boolean enableVerboseLogging() {
    return setRootLevel(Level.DEBUG);
  }

  /**
   * Reduces the root logger to WARN, used by {@code --quiet}.
   *
   * @return {@code true} when the backend accepted the change
   */
  public static boolean enableQuietLogging() {
    return setRootLevel(Level.WARN);
  }

  private static boolean setRootLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      return true;
    }
    log.warn("Log level {} requested but backend {} does not support dynamic level updates",
        level, factory.getClass().getName());
    return false;
  }
}
