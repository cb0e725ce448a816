package org.javai.tako.token;

/**
 * Lexical categories produced by the {@link Tokenizer}.
 */
public enum TokenCategory {
	SYMBOL,         // identifiers
	NUMBER,         // decimal digit runs
	OPERATOR,       // runs of operator characters
	COMMA,          // ,
	SEMICOLON,      // ;
	WHITESPACE,     // spaces, tabs, newlines
	OPEN_PAREN,     // (
	CLOSE_PAREN,    // )
	OPEN_BRACE,     // {
	CLOSE_BRACE,    // }
	OPEN_BRACKET,   // [
	CLOSE_BRACKET,  // ]
	SINGLE_QUOTE,   // '
	DOUBLE_QUOTE,   // "
	BACK_QUOTE,     // `
	DOT,            // .
	ERROR,          // unrecognised character, also the parser's leading sentinel
	END_OF_INPUT;   // end of input

	/**
	 * Categories the parser cursor steps over without handing them to the grammar.
	 */
	public boolean isSeparator() {
		return this == WHITESPACE || this == COMMA || this == SEMICOLON;
	}

	public boolean isQuote() {
		return this == SINGLE_QUOTE || this == DOUBLE_QUOTE || this == BACK_QUOTE;
	}
}
