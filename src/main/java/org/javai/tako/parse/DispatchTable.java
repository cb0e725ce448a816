package org.javai.tako.parse;

import static org.javai.tako.parse.DispatchEntry.BindingStrategy.INFIX_TABLE;
import static org.javai.tako.parse.DispatchEntry.BindingStrategy.ZERO;

import java.util.Optional;
import org.javai.tako.parse.DispatchEntry.InfixRule;
import org.javai.tako.parse.DispatchEntry.PrefixRule;
import org.javai.tako.token.Source;
import org.javai.tako.token.Token;
import org.javai.tako.token.TokenCategory;

/**
 * Symbol table of the parser: maps each token category to its {@link DispatchEntry}.
 */
public final class DispatchTable {

	private static final DispatchEntry LEAF = new DispatchEntry(ZERO, PrefixRule.LEAF, InfixRule.NONE);
	private static final DispatchEntry OPERATOR = new DispatchEntry(INFIX_TABLE, PrefixRule.PREFIX_OPERATOR, InfixRule.BINARY);
	private static final DispatchEntry COMMA = new DispatchEntry(INFIX_TABLE, PrefixRule.NONE, InfixRule.BINARY);
	private static final DispatchEntry SEMICOLON = new DispatchEntry(ZERO, PrefixRule.NONE, InfixRule.NONE);
	private static final DispatchEntry CALL_GROUP = new DispatchEntry(INFIX_TABLE, PrefixRule.GROUP, InfixRule.CALL);
	private static final DispatchEntry GROUP = new DispatchEntry(INFIX_TABLE, PrefixRule.GROUP, InfixRule.NONE);
	private static final DispatchEntry QUOTE = new DispatchEntry(INFIX_TABLE, PrefixRule.QUOTE, InfixRule.NONE);
	private static final DispatchEntry CLOSER = new DispatchEntry(ZERO, PrefixRule.UNEXPECTED_CLOSER, InfixRule.NONE);
	private static final DispatchEntry END = new DispatchEntry(ZERO, PrefixRule.END_OF_INPUT, InfixRule.NONE);

	private DispatchTable() {
		// Utility class - no instantiation
	}

	/**
	 * Entry for a category, or empty for categories the parser never dispatches on.
	 */
	public static Optional<DispatchEntry> lookup(TokenCategory category) {
		return switch (category) {
			case SYMBOL, NUMBER, DOT, ERROR -> Optional.of(LEAF);
			case OPERATOR -> Optional.of(OPERATOR);
			case COMMA -> Optional.of(COMMA);
			case SEMICOLON -> Optional.of(SEMICOLON);
			case OPEN_PAREN -> Optional.of(CALL_GROUP);
			case OPEN_BRACE, OPEN_BRACKET -> Optional.of(GROUP);
			case SINGLE_QUOTE, DOUBLE_QUOTE, BACK_QUOTE -> Optional.of(QUOTE);
			case CLOSE_PAREN, CLOSE_BRACE, CLOSE_BRACKET -> Optional.of(CLOSER);
			case END_OF_INPUT -> Optional.of(END);
			default -> Optional.empty();
		};
	}

	/**
	 * Entry for the token's category, or an {@link ParseError.Kind#UNKNOWN_CATEGORY} failure.
	 */
	public static ParseResult<DispatchEntry> entryFor(Token token, Source source) {
		Optional<DispatchEntry> entry = lookup(token.category());
		if (entry.isPresent()) {
			return ParseResult.success(entry.get());
		}
		return ParseResult.failure(ParseError.Kind.UNKNOWN_CATEGORY, token.span(),
				token.category() + " '" + source.textOf(token) + "' not found in symbol table");
	}

	/**
	 * Left binding power of the token under the given entry's strategy.
	 */
	public static ParseResult<Integer> bindingPower(DispatchEntry entry, Token token, Source source) {
		if (entry.binding() == ZERO) {
			return ParseResult.success(0);
		}
		String spelling = source.textOf(token);
		Optional<Integer> power = BindingPowers.infix(spelling);
		if (power.isPresent()) {
			return ParseResult.success(power.get());
		}
		return ParseResult.failure(ParseError.Kind.UNKNOWN_INFIX_OPERATOR, token.span(),
				"Expected an infix operator but found (" + token.span().start() + ","
						+ token.span().length() + ") '" + spelling + "'");
	}
}
