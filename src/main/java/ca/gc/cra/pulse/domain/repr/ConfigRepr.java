package ca.gc.cra.pulse.domain.repr;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of the engine configuration. The root path is what node ids are resolved against on the
 * receiving side.
 *
 * @param rootPath root directory of the test run
 * @param options command-line options rendered as text
 * @param pluginNames names of active engine plugins
 * @since 0.1.0
 */
public record ConfigRepr(Path rootPath, Map<String, Attr<String>> options, List<String> pluginNames)
    implements Representation {
  public ConfigRepr {
    Objects.requireNonNull(rootPath, "rootPath");
    options = options == null ? Map.of() : Map.copyOf(options);
    pluginNames = pluginNames == null ? List.of() : List.copyOf(pluginNames);
  }

  /**
   * Looks up an option value.
   *
   * @param name option name
   * @return option attribute; absent when the option is unknown
   */
  public Attr<String> option(String name) {
    return options.getOrDefault(name, Attr.absent());
  }
}
