package org.javai.tako.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link Scope} over a lowered module. Nested scopes are the parameter lists of
 * enclosing definitions.
 */
public final class ModuleScope implements Scope {

	private final Module module;

	private ModuleScope(Module module) {
		this.module = module;
	}

	public static ModuleScope of(Module module) {
		return new ModuleScope(Objects.requireNonNull(module, "module must not be null"));
	}

	@Override
	public Optional<Definition> lookup(List<String> path, String name) {
		if (path == null || path.isEmpty()) {
			return module.definition(name);
		}
		List<Definition> candidates = module.definitions();
		for (String segment : path) {
			Optional<Definition> enclosing = find(candidates, segment);
			if (enclosing.isEmpty()) {
				return Optional.empty();
			}
			candidates = enclosing.get().args();
		}
		return find(candidates, name);
	}

	private static Optional<Definition> find(List<Definition> definitions, String name) {
		for (Definition definition : definitions) {
			if (definition.name().equals(name)) {
				return Optional.of(definition);
			}
		}
		return Optional.empty();
	}
}
