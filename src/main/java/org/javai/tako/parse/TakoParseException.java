package org.javai.tako.parse;

/**
 * Exception thrown when a caller asks for the value of a failed parse.
 */
public class TakoParseException extends RuntimeException {

	private final ParseError error;

	public TakoParseException(ParseError error) {
		super(error.message() + " (" + error.location() + ")");
		this.error = error;
	}

	public ParseError error() {
		return error;
	}
}
