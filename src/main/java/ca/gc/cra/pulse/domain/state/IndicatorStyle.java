package ca.gc.cra.pulse.domain.state;

/**
 * Symbol set used for single-character test indicators.
 *
 * @since 0.1.0
 */
public enum IndicatorStyle {
  /** Unicode symbols such as {@code ✔} and {@code ✕}. */
  FANCY,
  /** The engine's traditional symbols such as {@code .} and {@code F}. */
  STANDARD;

  /**
   * Selects the style from the {@code stdSymbols} setting.
   *
   * @param standardSymbols whether standard symbols were requested
   * @return indicator style
   */
  public static IndicatorStyle of(boolean standardSymbols) {
    return standardSymbols ? STANDARD : FANCY;
  }
}
