package org.javai.tako.token;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits Tako source text into tokens.
 * <p>
 * Every character of the input ends up in exactly one token, whitespace
 * included, so token spans tile the source. Characters that belong to no
 * category become single-character {@link TokenCategory#ERROR} tokens and are
 * left for the parser to deal with. The returned list always ends with an
 * {@link TokenCategory#END_OF_INPUT} token of length zero.
 */
public class Tokenizer {

	private static final String OPERATOR_CHARS = "+-*/%<>=!&|^~:?";

	private final Source source;
	private final String input;
	private int pos = 0;

	public Tokenizer(Source source) {
		this.source = Objects.requireNonNull(source, "source must not be null");
		this.input = source.content();
	}

	/**
	 * Tokenizes the entire source.
	 *
	 * @return list of tokens (includes END_OF_INPUT at the end)
	 */
	public List<Token> tokenize() {
		List<Token> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			tokens.add(nextToken());
		}

		tokens.add(token(TokenCategory.END_OF_INPUT, pos));
		return tokens;
	}

	private Token nextToken() {
		int start = pos;
		char c = advance();

		return switch (c) {
			case ',' -> token(TokenCategory.COMMA, start);
			case ';' -> token(TokenCategory.SEMICOLON, start);
			case '(' -> token(TokenCategory.OPEN_PAREN, start);
			case ')' -> token(TokenCategory.CLOSE_PAREN, start);
			case '{' -> token(TokenCategory.OPEN_BRACE, start);
			case '}' -> token(TokenCategory.CLOSE_BRACE, start);
			case '[' -> token(TokenCategory.OPEN_BRACKET, start);
			case ']' -> token(TokenCategory.CLOSE_BRACKET, start);
			case '\'' -> token(TokenCategory.SINGLE_QUOTE, start);
			case '"' -> token(TokenCategory.DOUBLE_QUOTE, start);
			case '`' -> token(TokenCategory.BACK_QUOTE, start);
			case '.' -> token(TokenCategory.DOT, start);
			default -> {
				if (isWhitespace(c)) {
					consumeWhile(this::isWhitespace);
					yield token(TokenCategory.WHITESPACE, start);
				}
				if (isDigit(c)) {
					consumeWhile(this::isDigit);
					yield token(TokenCategory.NUMBER, start);
				}
				if (isIdentifierStart(c)) {
					consumeWhile(this::isIdentifierChar);
					yield token(TokenCategory.SYMBOL, start);
				}
				if (isOperatorChar(c)) {
					consumeWhile(this::isOperatorChar);
					yield token(TokenCategory.OPERATOR, start);
				}
				yield token(TokenCategory.ERROR, start);
			}
		};
	}

	private Token token(TokenCategory category, int start) {
		return new Token(category, new Location(start, pos - start, source.name()));
	}

	private void consumeWhile(CharPredicate predicate) {
		while (!isAtEnd() && predicate.test(input.charAt(pos))) {
			pos++;
		}
	}

	private char advance() {
		return input.charAt(pos++);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isWhitespace(char c) {
		return c == ' ' || c == '\t' || c == '\n' || c == '\r';
	}

	private boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private boolean isIdentifierStart(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private boolean isIdentifierChar(char c) {
		return isIdentifierStart(c) || isDigit(c);
	}

	private boolean isOperatorChar(char c) {
		return OPERATOR_CHARS.indexOf(c) >= 0;
	}

	@FunctionalInterface
	private interface CharPredicate {
		boolean test(char c);
	}
}
