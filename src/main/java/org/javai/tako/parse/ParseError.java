package org.javai.tako.parse;

import java.util.Objects;
import org.javai.tako.token.Location;

/**
 * A grammar error that stops the current parse.
 *
 * @param kind what went wrong
 * @param location the offending token's span
 * @param message description naming the expected and found input
 */
public record ParseError(Kind kind, Location location, String message) {

	public enum Kind {
		UNKNOWN_CATEGORY,
		UNKNOWN_INFIX_OPERATOR,
		UNKNOWN_PREFIX_OPERATOR,
		MISSING_PREFIX_HANDLER,
		MISSING_INFIX_HANDLER,
		UNBALANCED_BRACKET,
		UNEXPECTED_CLOSING_BRACKET,
		UNEXPECTED_END_OF_INPUT
	}

	public ParseError {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(location, "location must not be null");
		message = message != null ? message : kind.name();
	}

	@Override
	public String toString() {
		return kind + " at " + location + ": " + message;
	}
}
