package org.javai.tako.token;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Pairing of opening and closing bracket categories. Quotes close themselves.
 */
public final class BracketPairs {

	private static final Map<TokenCategory, TokenCategory> CLOSERS;

	static {
		Map<TokenCategory, TokenCategory> closers = new EnumMap<>(TokenCategory.class);
		closers.put(TokenCategory.OPEN_PAREN, TokenCategory.CLOSE_PAREN);
		closers.put(TokenCategory.OPEN_BRACE, TokenCategory.CLOSE_BRACE);
		closers.put(TokenCategory.OPEN_BRACKET, TokenCategory.CLOSE_BRACKET);
		closers.put(TokenCategory.SINGLE_QUOTE, TokenCategory.SINGLE_QUOTE);
		closers.put(TokenCategory.DOUBLE_QUOTE, TokenCategory.DOUBLE_QUOTE);
		closers.put(TokenCategory.BACK_QUOTE, TokenCategory.BACK_QUOTE);

		CLOSERS = Collections.unmodifiableMap(closers);
	}

	private BracketPairs() {
		// Utility class - no instantiation
	}

	public static Optional<TokenCategory> closerFor(TokenCategory open) {
		return Optional.ofNullable(CLOSERS.get(open));
	}
}
