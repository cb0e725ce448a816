package org.javai.tako.parse;

import java.util.Optional;
import java.util.function.Function;
import org.javai.tako.token.Location;

/**
 * Outcome of a parse step: either the parsed value or the {@link ParseError} that stopped it.
 * <p>
 * Grammar errors travel up the recursive descent as ordinary return values;
 * {@link #orElseThrow()} is the boundary for callers that prefer an exception.
 *
 * @param <T> the parsed type
 */
public sealed interface ParseResult<T> {

	record Success<T>(T parsed) implements ParseResult<T> {
	}

	record Failure<T>(ParseError error) implements ParseResult<T> {
	}

	static <T> ParseResult<T> success(T value) {
		return new Success<>(value);
	}

	static <T> ParseResult<T> failure(ParseError error) {
		return new Failure<>(error);
	}

	static <T> ParseResult<T> failure(ParseError.Kind kind, Location location, String message) {
		return new Failure<>(new ParseError(kind, location, message));
	}

	default boolean isSuccess() {
		return this instanceof Success;
	}

	default Optional<T> value() {
		return this instanceof Success<T> s ? Optional.of(s.parsed()) : Optional.empty();
	}

	default Optional<ParseError> parseError() {
		return this instanceof Failure<T> f ? Optional.of(f.error()) : Optional.empty();
	}

	/**
	 * Returns the parsed value.
	 *
	 * @throws TakoParseException if this is a failure
	 */
	default T orElseThrow() {
		if (this instanceof Success<T> s) {
			return s.parsed();
		}
		throw new TakoParseException(((Failure<T>) this).error());
	}

	default <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
		if (this instanceof Success<T> s) {
			return success(mapper.apply(s.parsed()));
		}
		return propagate();
	}

	/**
	 * Re-types a failure so it can be returned from a step producing a different type.
	 *
	 * @throws IllegalStateException if this is a success
	 */
	default <R> ParseResult<R> propagate() {
		if (this instanceof Failure<T> f) {
			return failure(f.error());
		}
		throw new IllegalStateException("Cannot propagate a successful parse result");
	}
}
