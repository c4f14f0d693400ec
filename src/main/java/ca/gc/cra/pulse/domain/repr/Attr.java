package ca.gc.cra.pulse.domain.repr;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Optional representation attribute with an explicit third state for values the codec could not
 * carry across the process boundary.
 *
 * @param <T> attribute value type
 * @since 0.1.0
 */
public final class Attr<T> {
  /** State of an attribute. */
  public enum State {
    /** The engine object carried a value. */
    PRESENT,
    /** The engine object did not carry the attribute. */
    ABSENT,
    /** The engine object carried a value of a kind that could not be represented. */
    UNREPRESENTABLE
  }

  private final State state;
  private final T value;
  private final String typeName;

  private Attr(State state, T value, String typeName) {
    this.state = state;
    this.value = value;
    this.typeName = typeName;
  }

  /**
   * Wraps a present value.
   *
   * @param value attribute value; must not be {@code null}
   * @param <T> value type
   * @return present attribute
   */
  public static <T> Attr<T> present(T value) {
    return new Attr<>(State.PRESENT, Objects.requireNonNull(value, "value"), null);
  }

  /**
   * Returns an absent attribute.
   *
   * @param <T> value type
   * @return absent attribute
   */
  public static <T> Attr<T> absent() {
    return new Attr<>(State.ABSENT, null, null);
  }

  /**
   * Marks an attribute whose value could not be represented.
   *
   * @param typeName simple type name of the original value
   * @param <T> value type
   * @return unrepresentable attribute
   */
  public static <T> Attr<T> unrepresentable(String typeName) {
    return new Attr<>(State.UNREPRESENTABLE, null, Objects.requireNonNullElse(typeName, "?"));
  }

  /**
   * Wraps a nullable value, treating {@code null} as absent.
   *
   * @param value possibly {@code null} value
   * @param <T> value type
   * @return present or absent attribute
   */
  public static <T> Attr<T> ofNullable(T value) {
    return value == null ? absent() : present(value);
  }

  public State state() {
    return state;
  }

  public boolean isPresent() {
    return state == State.PRESENT;
  }

  public boolean isAbsent() {
    return state == State.ABSENT;
  }

  public boolean isUnrepresentable() {
    return state == State.UNREPRESENTABLE;
  }

  /**
   * Returns the present value.
   *
   * @return value
   * @throws NoSuchElementException when the attribute is not present
   */
  public T value() {
    if (state != State.PRESENT) {
      throw new NoSuchElementException("attribute is " + state);
    }
    return value;
  }

  public T orElse(T fallback) {
    return state == State.PRESENT ? value : fallback;
  }

  public Optional<T> toOptional() {
    return Optional.ofNullable(value);
  }

  /** Type name recorded for an unrepresentable value, otherwise {@code null}. */
  public String typeName() {
    return typeName;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Attr<?> other
        && state == other.state
        && Objects.equals(value, other.value)
        && Objects.equals(typeName, other.typeName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(state, value, typeName);
  }

  @Override
  public String toString() {
    return switch (state) {
      case PRESENT -> "Attr[" + value + "]";
      case ABSENT -> "Attr[absent]";
      case UNREPRESENTABLE -> "Attr[unrepresentable " + typeName + "]";
    };
  }
}
