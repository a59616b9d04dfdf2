package ca.gc.cra.funnel.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a YAML logging configuration into a plain map/list object graph.
 */
final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Parses the YAML document at {@code path}.
   *
   * @param path YAML file
   * @return root node (usually a {@link java.util.Map}), or {@code null} for an empty document
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed
   */
  static Object load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }
}
