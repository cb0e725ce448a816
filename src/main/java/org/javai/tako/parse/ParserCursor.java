package org.javai.tako.parse;

import java.util.List;
import java.util.Objects;
import org.javai.tako.diagnostics.MessageSink;
import org.javai.tako.diagnostics.Severity;
import org.javai.tako.token.Location;
import org.javai.tako.token.Source;
import org.javai.tako.token.Token;
import org.javai.tako.token.TokenCategory;

/**
 * Position of the parser in a token list.
 * <p>
 * Advancing skips whitespace, comma and semicolon tokens. Once the list (or an
 * {@link TokenCategory#END_OF_INPUT} token) is reached, {@link #hasToken()} is
 * false and {@link #current()} keeps returning an end-of-input sentinel.
 * A cursor belongs to a single parse call chain.
 */
public class ParserCursor {

	private final List<Token> tokens;
	private final Source source;
	private final MessageSink sink;
	private final Token endOfInput;
	private int current = 0;
	private boolean hasToken;

	public ParserCursor(List<Token> tokens, Source source, MessageSink sink) {
		this.tokens = tokens != null ? List.copyOf(tokens) : List.of();
		this.source = Objects.requireNonNull(source, "source must not be null");
		this.sink = Objects.requireNonNull(sink, "sink must not be null");
		this.endOfInput = new Token(TokenCategory.END_OF_INPUT,
				new Location(source.content().length(), 0, source.name()));
		this.hasToken = !this.tokens.isEmpty();
	}

	public boolean hasToken() {
		return hasToken;
	}

	public Token current() {
		return hasToken ? tokens.get(current) : endOfInput;
	}

	public String currentText() {
		return source.textOf(current());
	}

	public Source source() {
		return source;
	}

	/**
	 * Moves to the next significant token.
	 *
	 * @return whether a token is available afterwards
	 */
	public boolean next() {
		if (hasToken) {
			current++;
			while (current < tokens.size() && tokens.get(current).category().isSeparator()) {
				current++;
			}
			if (current < tokens.size() && !tokens.get(current).is(TokenCategory.END_OF_INPUT)) {
				return true;
			}
		}
		hasToken = false;
		return false;
	}

	/**
	 * Checks the current token's category, reporting an error diagnostic on a
	 * mismatch, and advances either way.
	 *
	 * @return whether a token is available after advancing
	 */
	public boolean expect(TokenCategory expected) {
		Token token = current();
		if (!token.is(expected)) {
			msg(Severity.ERROR, "Expected a " + expected + " but found " + token.category()
					+ " '" + currentText() + "'");
		}
		return next();
	}

	public void msg(Severity severity, String text) {
		msg(current().span(), severity, text);
	}

	public void msg(Location location, Severity severity, String text) {
		sink.msg(location, severity, text);
	}
}
