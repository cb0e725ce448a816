package org.javai.tako.parse;

import java.util.Map;
import java.util.Optional;

/**
 * Fixed operator precedence. Higher numbers bind tighter.
 */
public final class BindingPowers {

	private static final Map<String, Integer> INFIX = Map.ofEntries(
			Map.entry("-|", 20),
			Map.entry("|-", 30),
			Map.entry("=", 40),
			Map.entry("<", 60),
			Map.entry("<=", 60),
			Map.entry(">", 60),
			Map.entry(">=", 60),
			Map.entry("<>", 60),
			Map.entry("!=", 60),
			Map.entry("==", 60),
			Map.entry("|", 70),
			Map.entry("^", 80),
			Map.entry("&", 90),
			Map.entry("<<", 100),
			Map.entry(">>", 100),
			Map.entry("+", 110),
			Map.entry("-", 110),
			Map.entry("*", 120),
			Map.entry("/", 120),
			Map.entry("//", 120),
			Map.entry("%", 120),
			Map.entry(":", 130),
			Map.entry(".", 140),
			Map.entry("[", 150),
			Map.entry("(", 150),
			Map.entry("{", 150));

	private static final Map<String, Integer> PREFIX = Map.of(
			"-", 130,
			"+", 130,
			"~", 130,
			"!", 130);

	private BindingPowers() {
		// Utility class - no instantiation
	}

	/**
	 * Left binding power of an infix spelling, if it is one.
	 */
	public static Optional<Integer> infix(String spelling) {
		return Optional.ofNullable(INFIX.get(spelling));
	}

	/**
	 * Binding power a prefix operator parses its operand at, if the spelling is one.
	 */
	public static Optional<Integer> prefix(String spelling) {
		return Optional.ofNullable(PREFIX.get(spelling));
	}
}
