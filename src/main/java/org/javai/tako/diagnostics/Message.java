package org.javai.tako.diagnostics;

import java.util.Objects;
import org.javai.tako.token.Location;

/**
 * A diagnostic reported against a source location.
 */
public record Message(Location location, Severity severity, String text) {

	public Message {
		Objects.requireNonNull(location, "location must not be null");
		Objects.requireNonNull(severity, "severity must not be null");
		text = text != null ? text : "";
	}
}
