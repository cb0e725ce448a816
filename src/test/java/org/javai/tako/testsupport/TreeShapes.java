package org.javai.tako.testsupport;

import java.util.List;
import java.util.stream.Collectors;
import org.javai.tako.diagnostics.Diagnostics;
import org.javai.tako.parse.GrammarRule;
import org.javai.tako.parse.ParseResult;
import org.javai.tako.parse.PrattParser;
import org.javai.tako.token.Source;
import org.javai.tako.token.Token;
import org.javai.tako.token.Tokenizer;
import org.javai.tako.tree.Tree;

/**
 * Helpers that parse snippets and render trees as s-expressions such as {@code (+ 1 (* 2 3))}.
 */
public final class TreeShapes {

	private TreeShapes() {}

	public static ParseResult<Tree<Token>> parse(String text, GrammarRule rule) {
		Source source = Source.of("test", text);
		return PrattParser.ast(new Tokenizer(source).tokenize(), source, new Diagnostics(), rule);
	}

	public static String shape(String text, GrammarRule rule) {
		Source source = Source.of("test", text);
		Tree<Token> tree = PrattParser.ast(new Tokenizer(source).tokenize(), source, new Diagnostics(), rule)
				.orElseThrow();
		return shape(tree, source);
	}

	public static String shape(Tree<Token> tree, Source source) {
		String text = source.textOf(tree.value());
		if (tree.isLeaf()) {
			return text;
		}
		List<Tree<Token>> children = tree.children();
		return "(" + text + " " + children.stream()
				.map(child -> shape(child, source))
				.collect(Collectors.joining(" ")) + ")";
	}
}
