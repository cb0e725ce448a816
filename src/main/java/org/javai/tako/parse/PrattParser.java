package org.javai.tako.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.tako.diagnostics.MessageSink;
import org.javai.tako.diagnostics.Severity;
import org.javai.tako.token.BracketPairs;
import org.javai.tako.token.Location;
import org.javai.tako.token.Source;
import org.javai.tako.token.Token;
import org.javai.tako.token.TokenCategory;
import org.javai.tako.tree.Tree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Top-down operator precedence parser building a generic {@code Tree<Token>}.
 * <p>
 * Every token category is dispatched through {@link DispatchTable}: its prefix
 * rule starts a value, its infix rule extends the value parsed so far, and its
 * binding power decides whether the infix rule gets a chance to. Right operands
 * are parsed at the operator's own binding power, so operators of equal power
 * group to the left: {@code 1 - 2 - 3} is {@code (1 - 2) - 3}.
 *
 * <pre>
 * List&lt;Token&gt; tokens = new Tokenizer(source).tokenize();
 * Tree&lt;Token&gt; tree = PrattParser.ast(tokens, source, sink, GrammarRule.MODULE).orElseThrow();
 * </pre>
 */
public final class PrattParser {

	private static final Logger logger = LoggerFactory.getLogger(PrattParser.class);

	private PrattParser() {
		// Utility class - no instantiation
	}

	/**
	 * Parses {@code tokens} starting from {@code rule} at binding power 0.
	 *
	 * @param tokens tokens as produced by the tokenizer, separators included
	 * @param source the text the tokens were cut from
	 * @param sink receiver for recoverable diagnostics
	 * @param rule the grammar rule to start from
	 * @return the parse tree, or the first grammar error
	 */
	public static ParseResult<Tree<Token>> ast(List<Token> tokens, Source source, MessageSink sink, GrammarRule rule) {
		Objects.requireNonNull(tokens, "tokens must not be null");
		Objects.requireNonNull(rule, "rule must not be null");
		// Disposable leading token so the first real token is reached through next() like every other.
		List<Token> primed = new ArrayList<>(tokens.size() + 1);
		primed.add(new Token(TokenCategory.ERROR, new Location(0, 0, source.name())));
		primed.addAll(tokens);
		ParserCursor cursor = new ParserCursor(primed, source, sink);
		cursor.next();
		return rule.parse(cursor, 0);
	}

	public static ParseResult<Tree<Token>> parseModule(ParserCursor cursor) {
		List<Tree<Token>> definitions = new ArrayList<>();
		while (cursor.hasToken()) {
			ParseResult<Tree<Token>> definition = parseDefinition(cursor, 0);
			if (!definition.isSuccess()) {
				return definition;
			}
			definitions.add(definition.orElseThrow());
		}
		Token fileToken = new Token(TokenCategory.SYMBOL, new Location(0, 0, cursor.source().name()));
		logger.debug("Parsed module '{}' with {} top-level values", cursor.source().name(), definitions.size());
		return ParseResult.success(Tree.of(fileToken, definitions));
	}

	/**
	 * Parses one definition. The shape is not checked here; lowering decides
	 * whether the tree really is a definition.
	 */
	public static ParseResult<Tree<Token>> parseDefinition(ParserCursor cursor, int rbp) {
		return parseValue(cursor, rbp);
	}

	/**
	 * Parses a value, continuing through infix operators while they bind tighter than {@code rbp}.
	 */
	public static ParseResult<Tree<Token>> parseValue(ParserCursor cursor, int rbp) {
		Token token = cursor.current();
		ParseResult<DispatchEntry> entry = DispatchTable.entryFor(token, cursor.source());
		if (!entry.isSuccess()) {
			return entry.propagate();
		}
		logger.trace("nud {} '{}' rbp={}", token.category(), cursor.currentText(), rbp);
		cursor.next();
		ParseResult<Tree<Token>> left = nud(entry.orElseThrow(), token, cursor);

		while (left.isSuccess() && cursor.hasToken()) {
			Token operator = cursor.current();
			ParseResult<DispatchEntry> operatorEntry = DispatchTable.entryFor(operator, cursor.source());
			if (!operatorEntry.isSuccess()) {
				return operatorEntry.propagate();
			}
			ParseResult<Integer> power = DispatchTable.bindingPower(operatorEntry.orElseThrow(), operator, cursor.source());
			if (!power.isSuccess()) {
				return power.propagate();
			}
			if (rbp >= power.orElseThrow()) {
				break;
			}
			logger.trace("led {} '{}' lbp={}", operator.category(), cursor.currentText(), power.orElseThrow());
			cursor.next();
			left = led(operatorEntry.orElseThrow(), left.orElseThrow(), operator, cursor);
		}
		return left;
	}

	private static ParseResult<Tree<Token>> nud(DispatchEntry entry, Token token, ParserCursor cursor) {
		Source source = cursor.source();
		return switch (entry.prefix()) {
			case LEAF -> {
				if (token.is(TokenCategory.ERROR)) {
					cursor.msg(token.span(), Severity.ERROR, "Unrecognised character '" + source.textOf(token) + "'");
				}
				yield ParseResult.success(Tree.leaf(token));
			}
			case PREFIX_OPERATOR -> prefixOperator(token, cursor);
			case GROUP -> bracketed(token, cursor).map(inner -> Tree.of(token, inner));
			case QUOTE -> quoted(token, cursor);
			case UNEXPECTED_CLOSER -> ParseResult.failure(ParseError.Kind.UNEXPECTED_CLOSING_BRACKET, token.span(),
					"Unexpected closing bracket '" + source.textOf(token) + "' at offset " + token.span().start());
			case END_OF_INPUT -> ParseResult.failure(ParseError.Kind.UNEXPECTED_END_OF_INPUT, token.span(),
					"Unexpected end of input, expected a value");
			case NONE -> ParseResult.failure(ParseError.Kind.MISSING_PREFIX_HANDLER, token.span(),
					token.category() + " '" + source.textOf(token) + "' cannot start a value");
		};
	}

	private static ParseResult<Tree<Token>> led(DispatchEntry entry, Tree<Token> left, Token token, ParserCursor cursor) {
		return switch (entry.infix()) {
			case BINARY -> infixOperator(left, token, cursor);
			case CALL -> bracketed(token, cursor).map(args -> call(left, token, args));
			case NONE -> ParseResult.failure(ParseError.Kind.MISSING_INFIX_HANDLER, token.span(),
					token.category() + " '" + cursor.source().textOf(token) + "' cannot follow a value");
		};
	}

	/**
	 * A bare callee takes the arguments as its children. A callee that already
	 * has children, such as {@code f(1)} in {@code f(1)(2)}, becomes the first
	 * child of a new node on the open paren, followed by the arguments.
	 */
	private static Tree<Token> call(Tree<Token> callee, Token open, List<Tree<Token>> args) {
		if (callee.isLeaf()) {
			return callee.withChildren(args);
		}
		List<Tree<Token>> children = new ArrayList<>(args.size() + 1);
		children.add(callee);
		children.addAll(args);
		return Tree.of(open, children);
	}

	private static ParseResult<Tree<Token>> prefixOperator(Token token, ParserCursor cursor) {
		String spelling = cursor.source().textOf(token);
		Optional<Integer> power = BindingPowers.prefix(spelling);
		if (power.isEmpty()) {
			return ParseResult.failure(ParseError.Kind.UNKNOWN_PREFIX_OPERATOR, token.span(),
					"Expected a prefix operator but found '" + spelling + "'");
		}
		return parseValue(cursor, power.get()).map(operand -> Tree.of(token, List.of(operand)));
	}

	private static ParseResult<Tree<Token>> infixOperator(Tree<Token> left, Token token, ParserCursor cursor) {
		String spelling = cursor.source().textOf(token);
		Optional<Integer> power = BindingPowers.infix(spelling);
		if (power.isEmpty()) {
			return ParseResult.failure(ParseError.Kind.UNKNOWN_INFIX_OPERATOR, token.span(),
					"Expected an infix operator but found '" + spelling + "'");
		}
		Tree<Token> root = Tree.of(token, List.of(left));
		return parseValue(cursor, power.get()).map(root::withChild);
	}

	/**
	 * Parses values up to the closer matching {@code open} and consumes the closer.
	 */
	private static ParseResult<List<Tree<Token>>> bracketed(Token open, ParserCursor cursor) {
		Optional<TokenCategory> close = BracketPairs.closerFor(open.category());
		if (close.isEmpty()) {
			return ParseResult.failure(ParseError.Kind.UNKNOWN_CATEGORY, open.span(),
					"Unknown bracket type " + open.category());
		}
		List<Tree<Token>> inner = new ArrayList<>();
		while (cursor.hasToken() && !cursor.current().is(close.get())) {
			ParseResult<Tree<Token>> value = parseValue(cursor, 0);
			if (!value.isSuccess()) {
				return value.propagate();
			}
			inner.add(value.orElseThrow());
		}
		if (!cursor.hasToken()) {
			return unbalanced(open, cursor);
		}
		cursor.expect(close.get());
		return ParseResult.success(inner);
	}

	/**
	 * Consumes everything up to the matching quote. The result is a leaf whose
	 * span runs from the opening quote through the closing one.
	 */
	private static ParseResult<Tree<Token>> quoted(Token open, ParserCursor cursor) {
		while (cursor.hasToken() && !cursor.current().is(open.category())) {
			cursor.next();
		}
		if (!cursor.hasToken()) {
			return unbalanced(open, cursor);
		}
		Token close = cursor.current();
		cursor.next();
		return ParseResult.success(Tree.leaf(new Token(open.category(), open.span().through(close.span()))));
	}

	private static <T> ParseResult<T> unbalanced(Token open, ParserCursor cursor) {
		return ParseResult.failure(ParseError.Kind.UNBALANCED_BRACKET, open.span(),
				"Unbalanced bracket: '" + cursor.source().textOf(open) + "' at offset " + open.span().start()
						+ " is never closed");
	}
}
