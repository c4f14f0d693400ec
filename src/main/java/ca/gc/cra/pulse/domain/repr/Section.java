package ca.gc.cra.pulse.domain.repr;

import java.util.Objects;

/**
 * Captured output section attached to a report, for example {@code "Captured stdout call"}.
 *
 * @param title section title
 * @param content captured text
 * @since 0.1.0
 */
public record Section(String title, String content) {
  public Section {
    Objects.requireNonNull(title, "title");
    content = content == null ? "" : content;
  }
}
