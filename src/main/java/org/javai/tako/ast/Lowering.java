package org.javai.tako.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.tako.diagnostics.MessageSink;
import org.javai.tako.diagnostics.Severity;
import org.javai.tako.token.Source;
import org.javai.tako.token.Token;
import org.javai.tako.token.TokenCategory;
import org.javai.tako.tree.Tree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reshapes the parser's generic {@code Tree<Token>} into {@link Module},
 * {@link Definition} and {@link Value} nodes.
 * <p>
 * A definition is an {@code =} node whose first child is a symbol; that
 * symbol's children are the parameters and the second child is the bound
 * value. Anything that does not fit is reported to the message sink and left
 * out rather than failing the pass.
 */
public class Lowering {

	private static final Logger logger = LoggerFactory.getLogger(Lowering.class);

	private static final String ASSIGN = "=";

	private final Source source;
	private final MessageSink sink;

	public Lowering(Source source, MessageSink sink) {
		this.source = Objects.requireNonNull(source, "source must not be null");
		this.sink = Objects.requireNonNull(sink, "sink must not be null");
	}

	/**
	 * Lowers every top-level child as a definition. Children that are not definitions are dropped
	 * with a warning.
	 */
	public Module lowerModule(Tree<Token> tree) {
		List<Definition> definitions = new ArrayList<>();
		for (Tree<Token> child : tree.children()) {
			Optional<Definition> definition = lowerDefinition(child);
			if (definition.isPresent()) {
				definitions.add(definition.get());
			} else {
				sink.msg(child.value().span(), Severity.WARNING,
						"Ignoring top-level '" + source.textOf(child.value()) + "': not a definition");
			}
		}
		logger.debug("Lowered module '{}': {} definitions from {} top-level values",
				source.name(), definitions.size(), tree.children().size());
		return new Module(source.name(), tree.value().span(), definitions);
	}

	/**
	 * Lowers an {@code name(params) = value} tree.
	 *
	 * @return the definition, or empty if the tree does not have a definition's shape
	 */
	public Optional<Definition> lowerDefinition(Tree<Token> node) {
		if (!isAssignment(node.value()) || node.children().isEmpty()) {
			return Optional.empty();
		}
		Tree<Token> head = node.child(0);
		if (!head.value().is(TokenCategory.SYMBOL)) {
			return Optional.empty();
		}
		String name = source.textOf(head.value());

		List<Definition> params = new ArrayList<>();
		for (Tree<Token> param : head.children()) {
			Token token = param.value();
			if (isAssignment(token)) {
				Optional<Definition> withDefault = lowerDefinition(param);
				if (withDefault.isPresent()) {
					params.add(withDefault.get());
				} else {
					dropParameter(name, token);
				}
			} else if (token.is(TokenCategory.SYMBOL)) {
				params.add(Definition.declaration(source.textOf(token), token.span()));
			} else {
				dropParameter(name, token);
			}
		}

		Value bound = null;
		if (node.children().size() > 1) {
			bound = lowerValue(node.child(1)).orElse(null);
		}
		return Optional.of(new Definition(name, head.value().span(), params, bound));
	}

	/**
	 * Lowers a value. Children become arguments: {@code =} children as named
	 * arguments, everything else as positional arguments {@code #0}, {@code #1}, ...
	 *
	 * @return the value, or empty if the node covers no source text
	 */
	public Optional<Value> lowerValue(Tree<Token> node) {
		Token token = node.value();
		String name = source.textOf(token);
		if (name.isEmpty()) {
			return Optional.empty();
		}
		if (token.is(TokenCategory.NUMBER)) {
			return Optional.of(Value.numeric(name, token.span()));
		}
		if (token.category().isQuote()) {
			return Optional.of(Value.text(name, token.span(), unquote(name)));
		}

		List<Definition> args = new ArrayList<>();
		int ordinal = 0;
		for (Tree<Token> child : node.children()) {
			Optional<Definition> named = lowerDefinition(child);
			if (named.isPresent()) {
				args.add(named.get());
			} else {
				Value positional = lowerValue(child).orElse(null);
				args.add(new Definition("#" + ordinal++, child.value().span(), List.of(), positional));
			}
		}
		return Optional.of(Value.symbol(name, token.span(), args));
	}

	private boolean isAssignment(Token token) {
		return token.is(TokenCategory.OPERATOR) && ASSIGN.equals(source.textOf(token));
	}

	private void dropParameter(String definitionName, Token token) {
		sink.msg(token.span(), Severity.WARNING, "Ignoring parameter '" + source.textOf(token) + "' of '"
				+ definitionName + "': expected a symbol or a default value");
	}

	private static String unquote(String quoted) {
		return quoted.length() < 2 ? "" : quoted.substring(1, quoted.length() - 1);
	}
}
