package ca.gc.cra.pulse.domain.repr;

import java.util.Locale;

/**
 * Kind of a collected engine node. Functions and coroutines are runnable tests; the remaining
 * kinds are containers produced while walking the test tree.
 *
 * @since 0.1.0
 */
public enum NodeKind {
  FUNCTION(true),
  COROUTINE(true),
  ITEM(true),
  MODULE(false),
  CLASS(false),
  PACKAGE(false),
  DIR(false),
  COLLECTOR(false);

  private final boolean item;

  NodeKind(boolean item) {
    this.item = item;
  }

  /** Returns {@code true} for kinds that represent runnable tests. */
  public boolean isItem() {
    return item;
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a wire kind name, mapping unknown names to {@link #ITEM} or {@link #COLLECTOR}.
   *
   * @param value kind name
   * @param itemFallback whether an unknown name belongs to an item
   * @return node kind
   */
  public static NodeKind fromWire(String value, boolean itemFallback) {
    if (value != null) {
      for (NodeKind kind : values()) {
        if (kind.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
          return kind;
        }
      }
    }
    return itemFallback ? ITEM : COLLECTOR;
  }
}
