package org.javai.tako.eval;

import java.util.Optional;
import org.javai.tako.ast.Prim;

/**
 * A lazily evaluated candidate result. An empty result means the candidate does
 * not apply and the next one should be tried.
 */
@FunctionalInterface
public interface Trial {

	Optional<Prim> attempt();
}
