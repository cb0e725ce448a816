package org.javai.tako.eval;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.tako.ast.Definition;
import org.javai.tako.ast.Module;
import org.javai.tako.ast.Prim;
import org.javai.tako.ast.Scope;
import org.javai.tako.ast.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tree-walking evaluator over the lowered AST.
 * <p>
 * A symbol resolves, in order, to a parameter of the definition being
 * evaluated, to a top-level definition found through the {@link Scope}, or to a
 * {@link Builtins built-in operator}. Calling a definition binds its parameters
 * from the call's named arguments, then its positional arguments, then the
 * parameters' default values.
 * <p>
 * Evaluation never throws for program errors: missing values, unknown symbols
 * and operand type mismatches come back as {@link Prim.Error} values. The AST is
 * only read, never modified.
 */
public class Evaluator {

	public static final String DEFAULT_ENTRY_POINT = "main";

	/** Nested definition calls allowed before evaluation gives up. */
	static final int MAX_DEPTH = 256;

	private static final Logger logger = LoggerFactory.getLogger(Evaluator.class);

	private static final Scope NO_DEFINITIONS = (path, name) -> Optional.empty();

	private static final String POSITIONAL_PREFIX = "#";

	private final String entryPoint;

	public Evaluator() {
		this(DEFAULT_ENTRY_POINT);
	}

	public Evaluator(String entryPoint) {
		this.entryPoint = Objects.requireNonNull(entryPoint, "entryPoint must not be null");
	}

	/**
	 * Evaluates the module's entry point definition, found through {@code scope}.
	 */
	public Prim eval(Module module, Scope scope) {
		Optional<Definition> entry = scope.lookup(List.of(), entryPoint);
		if (entry.isEmpty()) {
			return Prim.error("Module has no " + entryPoint);
		}
		Prim result = eval(entry.get(), scope);
		logger.debug("Module '{}' evaluated to {}", module.name(), result);
		return result;
	}

	/**
	 * Evaluates a definition's bound value with its parameters set to their defaults.
	 */
	public Prim eval(Definition definition, Scope scope) {
		return call(definition, new LinkedHashMap<>(), new Frame(scope, Map.of(), 0));
	}

	public Prim eval(Definition definition) {
		return eval(definition, NO_DEFINITIONS);
	}

	public Prim eval(Value value, Scope scope) {
		return eval(value, new Frame(scope, Map.of(), 0));
	}

	public Prim eval(Value value) {
		return eval(value, NO_DEFINITIONS);
	}

	private Prim eval(Value value, Frame frame) {
		return switch (value.nodeType()) {
			case TEXT, NUMERIC -> value.literal()
					.orElseGet(() -> Prim.error("Missing literal for " + value.name()));
			case SYMBOL -> evalSymbol(value, frame);
		};
	}

	private Prim evalSymbol(Value value, Frame frame) {
		String name = value.name();
		Prim local = frame.locals().get(name);
		if (local != null && value.args().isEmpty()) {
			return local;
		}

		// Named arguments keep their names, positional ones keep their #n names in order.
		Map<String, Prim> arguments = new LinkedHashMap<>();
		for (Definition arg : value.args()) {
			Optional<Value> bound = arg.boundValue();
			if (bound.isEmpty()) {
				return Prim.error("Missing value for arg in " + name);
			}
			Prim operand = eval(bound.get(), frame);
			if (operand.isError()) {
				return operand;
			}
			arguments.put(arg.name(), operand);
		}

		Optional<Definition> definition = frame.scope().lookup(List.of(), name);
		if (definition.isPresent()) {
			return call(definition.get(), arguments, frame);
		}

		List<Prim> operands = new ArrayList<>(arguments.values());
		Prim result = Builtins.resolve(name, operands)
				.attempt()
				.orElseGet(() -> Prim.error("Unknown symbol " + name));
		logger.trace("{} {} -> {}", name, operands, result);
		return result;
	}

	private Prim call(Definition definition, Map<String, Prim> arguments, Frame caller) {
		String name = definition.name();
		if (definition.isDeclaration()) {
			return Prim.error(name + " has no set value");
		}
		if (caller.depth() >= MAX_DEPTH) {
			return Prim.error("Recursion too deep at " + name);
		}

		List<Prim> positional = new ArrayList<>();
		Map<String, Prim> named = new HashMap<>();
		arguments.forEach((argName, argValue) -> {
			if (argName.startsWith(POSITIONAL_PREFIX)) {
				positional.add(argValue);
			} else {
				named.put(argName, argValue);
			}
		});

		Map<String, Prim> bindings = new HashMap<>();
		Iterator<Prim> nextPositional = positional.iterator();
		for (Definition param : definition.args()) {
			String paramName = param.name();
			Prim bound;
			if (named.containsKey(paramName)) {
				bound = named.remove(paramName);
			} else if (nextPositional.hasNext()) {
				bound = nextPositional.next();
			} else if (!param.isDeclaration()) {
				bound = eval(param.boundValue().orElseThrow(),
						new Frame(caller.scope(), Map.copyOf(bindings), caller.depth() + 1));
				if (bound.isError()) {
					return bound;
				}
			} else {
				return Prim.error("Missing value for " + paramName + " in " + name);
			}
			bindings.put(paramName, bound);
		}
		if (nextPositional.hasNext()) {
			return Prim.error("Too many arguments to " + name);
		}
		if (!named.isEmpty()) {
			return Prim.error("Unknown argument " + named.keySet().iterator().next() + " of " + name);
		}

		logger.trace("call {} with {}", name, bindings);
		return eval(definition.boundValue().orElseThrow(), new Frame(caller.scope(), bindings, caller.depth() + 1));
	}

	/**
	 * What a body is evaluated against: top-level definitions and the parameters of the current call.
	 */
	private record Frame(Scope scope, Map<String, Prim> locals, int depth) {
	}
}
