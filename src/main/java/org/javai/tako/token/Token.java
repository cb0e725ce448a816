package org.javai.tako.token;

import java.util.Objects;

/**
 * A categorised span of source text.
 *
 * @param category the lexical category
 * @param span where the token's text lives in its source
 */
public record Token(TokenCategory category, Location span) {

	public Token {
		Objects.requireNonNull(category, "category must not be null");
		Objects.requireNonNull(span, "span must not be null");
	}

	public boolean is(TokenCategory expected) {
		return category == expected;
	}

	@Override
	public String toString() {
		return category + "(" + span.start() + "," + span.length() + ")";
	}
}
