package ca.gc.cra.pulse.domain.repr;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Identifier of a single test, as reported by the test engine.
 * <p><strong>Why:</strong> Node ids arrive as plain strings; grouping and rendering need their
 * structure (file path, qualifying class names, final test name).</p>
 * <p><strong>Role:</strong> Domain value object keyed on by the aggregator and the progress grouper.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * <p>Equality and hashing use only the raw {@link #value()}; the root path is a rendering aid.</p>
 *
 * @since 0.1.0
 */
public final class NodeId implements Comparable<NodeId> {
  private static final String SEPARATOR = "::";

  private final String value;
  private final Path rootPath;

  private NodeId(String value, Path rootPath) {
    this.value = value;
    this.rootPath = rootPath;
  }

  /**
   * Creates a node id without root path information.
   *
   * @param value raw node id; must not be {@code null}
   * @return node id
   */
  public static NodeId of(String value) {
    return new NodeId(Objects.requireNonNull(value, "value"), null);
  }

  /**
   * Creates a node id bound to the run's root path.
   *
   * @param value raw node id; must not be {@code null}
   * @param rootPath run root used to relativize absolute file paths; may be {@code null}
   * @return node id
   */
  public static NodeId of(String value, Path rootPath) {
    return new NodeId(Objects.requireNonNull(value, "value"), rootPath);
  }

  /**
   * Strips a parallel-runner {@code @group} suffix from a reported id.
   *
   * <p>The suffix is kept when it ends with {@code ']'} because the {@code '@'} then belongs to a
   * parametrization.</p>
   *
   * @param reported id as reported by the engine
   * @return cleaned id
   */
  public static String clean(String reported) {
    if (reported == null) {
      return null;
    }
    int at = reported.lastIndexOf('@');
    if (at <= 0) {
      return reported;
    }
    String group = reported.substring(at + 1);
    if (!group.isEmpty() && group.charAt(group.length() - 1) == ']') {
      return reported;
    }
    return reported.substring(0, at);
  }

  /** Raw node id string. */
  public String value() {
    return value;
  }

  /** Root path this id was decoded against, or {@code null}. */
  public Path rootPath() {
    return rootPath;
  }

  /**
   * Returns a copy of this id bound to another root path.
   *
   * @param root new root path
   * @return rebound node id
   */
  public NodeId withRoot(Path root) {
    return new NodeId(value, root);
  }

  /**
   * Returns the file path portion, relative to the root path when it lies beneath it.
   *
   * @return relative file path
   */
  public Path filePath() {
    int idx = value.indexOf(SEPARATOR);
    String pathName = idx < 0 ? value : value.substring(0, idx);
    Path path = Path.of(pathName);
    if (rootPath != null && path.isAbsolute() && path.startsWith(rootPath)) {
      return rootPath.relativize(path);
    }
    return path;
  }

  /**
   * Returns the qualifying names between the file path and the final test name.
   *
   * @return class and nested-class names; may be empty
   */
  public List<String> qualifiers() {
    List<String> names = qualifiedNames();
    if (names.isEmpty()) {
      return List.of();
    }
    return List.copyOf(names.subList(0, names.size() - 1));
  }

  /**
   * Returns the final component of the id, usually the test function name.
   *
   * @return final name; empty when the id names a file only
   */
  public String name() {
    List<String> names = qualifiedNames();
    return names.isEmpty() ? "" : names.get(names.size() - 1);
  }

  /**
   * Returns path parts, qualifiers and the final name as a single list.
   *
   * @return flattened parts
   */
  public List<String> parts() {
    List<String> parts = new ArrayList<>();
    for (Path part : filePath()) {
      parts.add(part.toString());
    }
    parts.addAll(qualifiers());
    String name = name();
    if (!name.isEmpty()) {
      parts.add(name);
    }
    return List.copyOf(parts);
  }

  private List<String> qualifiedNames() {
    int idx = value.indexOf(SEPARATOR);
    if (idx < 0) {
      return List.of();
    }
    return Arrays.asList(value.substring(idx + SEPARATOR.length()).split(SEPARATOR, -1));
  }

  @Override
  public int compareTo(NodeId other) {
    return value.compareTo(other.value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof NodeId other && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return value;
  }
}
