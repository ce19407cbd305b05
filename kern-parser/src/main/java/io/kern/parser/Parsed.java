package io.kern.parser;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a single grammar rule: the node it built, or the error that stopped it.
 *
 * <p>Rules return failures instead of throwing; the program loop in {@link Parser} turns a failure
 * into a diagnostic and resynchronizes.
 *
 * @param <T> the node type the rule produces
 */
public sealed interface Parsed<T> permits Parsed.Success, Parsed.Failure {

  record Success<T>(T value) implements Parsed<T> {
    public Success {
      Objects.requireNonNull(value, "value");
    }
  }

  record Failure<T>(SyntaxError error) implements Parsed<T> {
    public Failure {
      Objects.requireNonNull(error, "error");
    }
  }

  static <T> Parsed<T> success(T value) {
    return new Success<>(value);
  }

  static <T> Parsed<T> failure(SyntaxError error) {
    return new Failure<>(error);
  }

  default boolean isFailure() {
    return this instanceof Failure;
  }

  /**
   * @throws IllegalStateException on a failure
   */
  default T value() {
    throw new IllegalStateException("No value: " + error().message());
  }

  /**
   * @throws IllegalStateException on a success
   */
  default SyntaxError error() {
    throw new IllegalStateException("Rule succeeded");
  }

  /** Re-types a failure so it can be returned from a rule producing another node type. */
  default <U> Parsed<U> propagate() {
    if (this instanceof Failure<T> f) {
      return new Failure<>(f.error());
    }
    throw new IllegalStateException("Cannot propagate a success");
  }

  default <U> Parsed<U> map(Function<? super T, ? extends U> fn) {
    if (this instanceof Success<T> s) {
      return new Success<>(fn.apply(s.value()));
    }
    return propagate();
  }
}
