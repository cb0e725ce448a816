package org.javai.tako.ast;

import java.util.List;
import java.util.Optional;
import org.javai.tako.token.Location;

/**
 * A named binding {@code name(params) = value}. Without a bound value it is a
 * bare parameter or declaration.
 */
public class Definition extends Value {

	private final Value boundValue;

	public Definition(String name, Location location, List<Definition> args, Value boundValue) {
		super(name, location, args, AstNodeType.SYMBOL, null);
		this.boundValue = boundValue;
	}

	public static Definition declaration(String name, Location location) {
		return new Definition(name, location, List.of(), null);
	}

	public Optional<Value> boundValue() {
		return Optional.ofNullable(boundValue);
	}

	public boolean isDeclaration() {
		return boundValue == null;
	}

	@Override
	public String toString() {
		return boundValue == null ? super.toString() : super.toString() + " = " + boundValue;
	}
}
