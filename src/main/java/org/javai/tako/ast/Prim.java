package org.javai.tako.ast;

import java.util.Objects;

/**
 * Primitive runtime value: an integer, a piece of text or an error.
 * <p>
 * Errors are ordinary values so evaluation problems travel back to the caller
 * as results rather than exceptions.
 */
public sealed interface Prim {

	record Int(int value) implements Prim {

		@Override
		public String render() {
			return Integer.toString(value);
		}
	}

	record Text(String value) implements Prim {

		public Text {
			Objects.requireNonNull(value, "value must not be null");
		}

		@Override
		public String render() {
			return value;
		}
	}

	record Error(String message) implements Prim {

		public Error {
			message = message != null ? message : "";
		}

		@Override
		public String render() {
			return message;
		}
	}

	static Prim of(int value) {
		return new Int(value);
	}

	static Prim of(String value) {
		return new Text(value);
	}

	static Prim error(String message) {
		return new Error(message);
	}

	/**
	 * Reads a base-10 integer, yielding an error value for malformed or out of range text.
	 */
	static Prim parseInteger(String text) {
		try {
			return new Int(Integer.parseInt(text, 10));
		} catch (NumberFormatException e) {
			return new Error("Malformed integer literal '" + text + "'");
		}
	}

	default boolean isError() {
		return this instanceof Error;
	}

	/**
	 * Printable form: the number, the raw text, or the error message.
	 */
	String render();
}
