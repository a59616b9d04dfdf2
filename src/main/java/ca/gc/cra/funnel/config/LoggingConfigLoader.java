package ca.gc.cra.funnel.config;

import ca.gc.cra.funnel.util.PathUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Loads {@link LoggingConfig} instances from YAML or JSON files.
 * <p><strong>Why:</strong> Operators describe sinks and channel levels in a file instead of code.</p>
 * <p><strong>Role:</strong> Configuration entry point used by {@code LoggerFacade} constructors.</p>
 * <p><strong>Thread-safety:</strong> Stateless and thread-safe.</p>
 * <p><strong>Observability:</strong> Logs the resolved file and handler count at debug level.</p>
 *
 * @since 0.1.0
 */
public final class LoggingConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(LoggingConfigLoader.class);

  private LoggingConfigLoader() {}

  /**
   * Reads and validates the configuration at {@code path}; the format is chosen by file suffix
   * ({@code .yaml}/{@code .yml} or {@code .json}).
   *
   * @param path configuration file; must exist
   * @return validated configuration
   * @throws ConfigParseException if the file is missing, unreadable, of an unsupported type, or invalid
   */
  public static LoggingConfig load(Path path) {
    Objects.requireNonNull(path, "path");
    if (!Files.isRegularFile(path)) {
      throw new ConfigParseException(path, "Logging configuration file not found", null);
    }
    String suffix = suffixOf(path);
    Object document;
    try {
      document = switch (suffix) {
        case "yaml", "yml" -> YamlConfigLoader.load(path);
        case "json" -> JsonConfigLoader.load(path);
        default -> throw new ConfigParseException(
            path, "Unsupported logging configuration format '." + suffix + "'", null);
      };
    } catch (IOException ex) {
      throw new ConfigParseException(path, "Unable to read logging configuration", ex);
    } catch (IllegalArgumentException ex) {
      throw new ConfigParseException(path, ex.getMessage(), ex);
    }
    LoggingConfig config = LoggingConfig.fromDocument(document, path);
    log.debug("Loaded logging configuration {} with {} handlers and {} channels",
        path, config.sinks().size(), config.channels().size());
    return config;
  }

  private static String suffixOf(Path path) {
    String name = PathUtils.fileName(path).orElse("");
    int dot = name.lastIndexOf('.');
    return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
  }
}
