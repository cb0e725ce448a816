package org.javai.tako.parse;

import java.util.Objects;

/**
 * How the parser treats one token category: its binding power, its prefix
 * (null denotation) rule and its optional infix (left denotation) rule.
 */
public record DispatchEntry(BindingStrategy binding, PrefixRule prefix, InfixRule infix) {

	public enum BindingStrategy {
		/** Never continues an expression. */
		ZERO,
		/** Looks the token's spelling up in the infix table; unknown spellings are an error. */
		INFIX_TABLE
	}

	public enum PrefixRule {
		LEAF,
		PREFIX_OPERATOR,
		GROUP,
		QUOTE,
		UNEXPECTED_CLOSER,
		END_OF_INPUT,
		NONE
	}

	public enum InfixRule {
		BINARY,
		CALL,
		NONE
	}

	public DispatchEntry {
		Objects.requireNonNull(binding, "binding must not be null");
		Objects.requireNonNull(prefix, "prefix must not be null");
		Objects.requireNonNull(infix, "infix must not be null");
	}
}
