package org.javai.tako.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.tako.token.Location;

/**
 * A lowered value: a symbol applied to arguments, or a numeric or text literal.
 * <p>
 * Arguments are {@link Definition}s so that named and positional arguments can
 * share one list; positional ones are named {@code #0}, {@code #1}, ...
 * Two values are equal when their names are equal and their arguments are
 * pairwise equal.
 */
public class Value {

	private final String name;
	private final Location location;
	private final List<Definition> args;
	private final AstNodeType nodeType;
	private final Prim literal;

	public Value(String name, Location location, List<Definition> args, AstNodeType nodeType, Prim literal) {
		this.name = Objects.requireNonNull(name, "name must not be null");
		this.location = Objects.requireNonNull(location, "location must not be null");
		this.args = args != null ? List.copyOf(args) : List.of();
		this.nodeType = Objects.requireNonNull(nodeType, "nodeType must not be null");
		if (nodeType == AstNodeType.SYMBOL && literal != null) {
			throw new IllegalArgumentException("Symbol value '" + name + "' cannot carry a literal");
		}
		if (nodeType != AstNodeType.SYMBOL && literal == null) {
			throw new IllegalArgumentException(nodeType + " value '" + name + "' requires a literal");
		}
		this.literal = literal;
	}

	public static Value symbol(String name, Location location, List<Definition> args) {
		return new Value(name, location, args, AstNodeType.SYMBOL, null);
	}

	public static Value numeric(String name, Location location) {
		return new Value(name, location, List.of(), AstNodeType.NUMERIC, Prim.parseInteger(name));
	}

	public static Value text(String name, Location location, String text) {
		return new Value(name, location, List.of(), AstNodeType.TEXT, Prim.of(text));
	}

	public String name() {
		return name;
	}

	public Location location() {
		return location;
	}

	public List<Definition> args() {
		return args;
	}

	public AstNodeType nodeType() {
		return nodeType;
	}

	public Optional<Prim> literal() {
		return Optional.ofNullable(literal);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Value other)) {
			return false;
		}
		return name.equals(other.name) && args.equals(other.args);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, args);
	}

	@Override
	public String toString() {
		return args.isEmpty() ? name : name + args;
	}
}
