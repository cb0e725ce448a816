package org.javai.tako.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.tako.token.Location;

/**
 * The definitions of one source file, in source order.
 */
public record Module(String name, Location location, List<Definition> definitions) {

	public Module {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(location, "location must not be null");
		definitions = definitions != null ? List.copyOf(definitions) : List.of();
	}

	/**
	 * First top-level definition with the given name.
	 */
	public Optional<Definition> definition(String definitionName) {
		return definitions.stream()
				.filter(d -> d.name().equals(definitionName))
				.findFirst();
	}
}
