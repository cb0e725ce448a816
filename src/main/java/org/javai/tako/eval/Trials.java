package org.javai.tako.eval;

import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.BooleanSupplier;
import org.javai.tako.ast.Prim;

/**
 * Combinators for building overload resolution out of {@link Trial}s.
 */
public final class Trials {

	private Trials() {
		// Utility class - no instantiation
	}

	/**
	 * Runs {@code trial} only when {@code predicate} holds; otherwise the result is empty.
	 */
	public static Trial require(BooleanSupplier predicate, Trial trial) {
		return () -> predicate.getAsBoolean() ? trial.attempt() : Optional.empty();
	}

	/**
	 * Tries each trial in order and returns the first present result. If none
	 * applies the result is an error value carrying {@code fallback}, so the
	 * returned trial is never empty.
	 */
	public static Trial tryEach(List<Trial> trials, String fallback) {
		List<Trial> ordered = List.copyOf(trials);
		return () -> {
			for (Trial trial : ordered) {
				Optional<Prim> result = trial.attempt();
				if (result.isPresent()) {
					return result;
				}
			}
			return Optional.of(Prim.error(fallback));
		};
	}

	/**
	 * An overload of a two-operand operator. Applies only when the operands are
	 * instances of {@code leftType} and {@code rightType}; a different number of
	 * operands is an error regardless of types.
	 */
	public static <L extends Prim, R extends Prim> Trial binary(String operator, List<Prim> operands,
			Class<L> leftType, Class<R> rightType, BiFunction<L, R, Prim> implementation) {
		if (operands.size() != 2) {
			return () -> Optional.of(Prim.error("Expected two arguments at " + operator));
		}
		Prim left = operands.get(0);
		Prim right = operands.get(1);
		return () -> {
			if (!leftType.isInstance(left) || !rightType.isInstance(right)) {
				return Optional.empty();
			}
			return Optional.of(implementation.apply(leftType.cast(left), rightType.cast(right)));
		};
	}
}
