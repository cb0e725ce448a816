package org.javai.tako.diagnostics;

import org.javai.tako.token.Location;

/**
 * Receives recoverable diagnostics from the parser and the lowering pass.
 */
@FunctionalInterface
public interface MessageSink {

	/**
	 * Reports a message. Implementations must not throw; reporting never stops a pass.
	 *
	 * @param location where the problem was found
	 * @param severity how serious it is
	 * @param text human readable description
	 */
	void msg(Location location, Severity severity, String text);
}
