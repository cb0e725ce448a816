package org.javai.tako.diagnostics;

/**
 * Severity of a diagnostic message.
 */
public enum Severity {
	ERROR,
	WARNING,
	INFO;

	public String label() {
		return name().toLowerCase();
	}
}
