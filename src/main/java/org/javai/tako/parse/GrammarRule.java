package org.javai.tako.parse;

import org.javai.tako.token.Token;
import org.javai.tako.tree.Tree;

/**
 * Grammar rule a parse starts from.
 */
public enum GrammarRule {
	VALUE,
	DEFINITION,
	MODULE;

	public ParseResult<Tree<Token>> parse(ParserCursor cursor, int rbp) {
		return switch (this) {
			case VALUE -> PrattParser.parseValue(cursor, rbp);
			case DEFINITION -> PrattParser.parseDefinition(cursor, rbp);
			case MODULE -> PrattParser.parseModule(cursor);
		};
	}
}
