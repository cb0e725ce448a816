package org.javai.tako.ast;

import java.util.List;
import java.util.Optional;

/**
 * Name lookup across nested definitions.
 */
@FunctionalInterface
public interface Scope {

	/**
	 * Finds {@code name} inside the definition reached by following {@code path} from the root.
	 *
	 * @param path names of enclosing definitions, outermost first; empty for the top level
	 * @param name the definition to find
	 * @return the definition, or empty if the path or the name does not resolve
	 */
	Optional<Definition> lookup(List<String> path, String name);
}
