package org.javai.tako.eval;

import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.IntBinaryOperator;
import org.javai.tako.ast.Prim;

/**
 * Built-in operators. Each operator is a family of type-guarded overloads,
 * gated on the symbol's name; families are tried in a fixed order.
 */
public final class Builtins {

	private Builtins() {
		// Utility class - no instantiation
	}

	/**
	 * Resolves {@code symbol} applied to already evaluated {@code operands}.
	 * The resulting trial always produces a value: the operator's result, a type
	 * mismatch error, or an unknown symbol error.
	 */
	public static Trial resolve(String symbol, List<Prim> operands) {
		return Trials.tryEach(List.of(
				family("+", symbol, List.of(
						Trials.binary("+", operands, Prim.Int.class, Prim.Int.class, arithmetic("+", Math::addExact)),
						Trials.binary("+", operands, Prim.Text.class, Prim.Text.class,
								(x, y) -> Prim.of(x.value() + y.value())))),
				family("-", symbol, List.of(
						Trials.binary("-", operands, Prim.Int.class, Prim.Int.class, arithmetic("-", Math::subtractExact)))),
				family("*", symbol, List.of(
						Trials.binary("*", operands, Prim.Int.class, Prim.Int.class, arithmetic("*", Math::multiplyExact)),
						Trials.binary("*", operands, Prim.Text.class, Prim.Int.class,
								(text, times) -> repeat(times.value(), text.value())),
						Trials.binary("*", operands, Prim.Int.class, Prim.Text.class,
								(times, text) -> repeat(times.value(), text.value())))),
				family("/", symbol, List.of(
						Trials.binary("/", operands, Prim.Int.class, Prim.Int.class, Builtins::divide))),
				family("%", symbol, List.of(
						Trials.binary("%", operands, Prim.Int.class, Prim.Int.class, Builtins::remainder))),
				family("(", symbol, List.of(grouping(operands)))),
				"Unknown symbol " + symbol);
	}

	private static Trial family(String operator, String symbol, List<Trial> overloads) {
		return Trials.require(() -> operator.equals(symbol),
				Trials.tryEach(overloads, "Unexpected types at (" + operator + ") " + symbol));
	}

	/**
	 * Parentheses in value position evaluate to the single value they enclose.
	 */
	private static Trial grouping(List<Prim> operands) {
		return () -> Optional.of(operands.size() == 1
				? operands.get(0)
				: Prim.error("Expected one value in ( )"));
	}

	private static BiFunction<Prim.Int, Prim.Int, Prim> arithmetic(String operator,
			IntBinaryOperator operation) {
		return (x, y) -> {
			try {
				return Prim.of(operation.applyAsInt(x.value(), y.value()));
			} catch (ArithmeticException e) {
				return Prim.error("Integer overflow at " + operator);
			}
		};
	}

	private static Prim divide(Prim.Int x, Prim.Int y) {
		if (y.value() == 0) {
			return Prim.error("Division by zero at /");
		}
		if (x.value() == Integer.MIN_VALUE && y.value() == -1) {
			return Prim.error("Integer overflow at /");
		}
		return Prim.of(x.value() / y.value());
	}

	private static Prim remainder(Prim.Int x, Prim.Int y) {
		if (y.value() == 0) {
			return Prim.error("Division by zero at %");
		}
		return Prim.of(x.value() % y.value());
	}

	/**
	 * {@code text} repeated {@code times} times, built by doubling up to the exact length.
	 */
	static Prim repeat(int times, String text) {
		if (times < 0) {
			return Prim.error("Negative repeat count " + times + " at *");
		}
		long length = (long) text.length() * times;
		if (length > Integer.MAX_VALUE - 8) {
			return Prim.error("Integer overflow at *");
		}
		int target = (int) length;
		StringBuilder repeated = new StringBuilder(target);
		repeated.append(text, 0, Math.min(text.length(), target));
		while (repeated.length() < target) {
			// Never grow past the target length.
			repeated.append(repeated, 0, Math.min(repeated.length(), target - repeated.length()));
		}
		return Prim.of(repeated.toString());
	}
}
