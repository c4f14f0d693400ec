package ca.gc.cra.pulse.api;

import ca.gc.cra.pulse.config.DefaultsForMode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the {@code option=value} arguments of one PULSE subcommand into a lookup map.
 *
 * <p>Only options the subcommand has a default for (plus {@code config}) are accepted, so a misspelt
 * option fails with the list of valid names. An empty value ({@code selection=}) is kept so that it
 * can clear a value set in YAML. Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  static final String CONFIG_OPTION = "config";

  private static final Pattern OPTION = Pattern.compile("([A-Za-z][A-Za-z0-9._-]*)\\s*=(.*)", Pattern.DOTALL);

  private CliArgsParser() {}

  /**
   * Parses the options of {@code mode}.
   *
   * @param mode subcommand ({@code run}, {@code replay}, {@code demo-engine})
   * @param args option arguments; {@code null} returns an empty map
   * @return mutable map of option name to trimmed value, in argument order
   * @throws IllegalArgumentException for a bare word, an unknown or repeated option, or a value with
   *     control characters
   */
  public static Map<String, String> toMap(String mode, String[] args) {
    Map<String, String> options = new LinkedHashMap<>();
    if (args == null) {
      return options;
    }
    Set<String> known = knownOptions(mode);
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      Matcher m = OPTION.matcher(raw.trim());
      if (!m.matches()) {
        throw new IllegalArgumentException(
            "expected option=value but got '" + raw + "'; engine arguments go after --");
      }
      String name = m.group(1);
      String value = m.group(2).trim();
      if (!known.contains(name)) {
        throw new IllegalArgumentException(
            "unknown " + mode + " option '" + name + "'; expected one of " + String.join(", ", known));
      }
      if (value.chars().anyMatch(Character::isISOControl)) {
        throw new IllegalArgumentException("option " + name + " must not contain control characters");
      }
      if (options.putIfAbsent(name, value) != null) {
        throw new IllegalArgumentException("option " + name + " given more than once");
      }
    }
    return options;
  }

  static Set<String> knownOptions(String mode) {
    Set<String> known = new TreeSet<>(DefaultsForMode.asFlatMap(mode).keySet());
    known.add(CONFIG_OPTION);
    return known;
  }
}
