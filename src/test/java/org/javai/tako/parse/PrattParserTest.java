package org.javai.tako.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.javai.tako.testsupport.TreeShapes.parse;
import static org.javai.tako.testsupport.TreeShapes.shape;

import java.util.List;
import org.javai.tako.diagnostics.Diagnostics;
import org.javai.tako.token.Location;
import org.javai.tako.token.Source;
import org.javai.tako.token.Token;
import org.javai.tako.token.TokenCategory;
import org.javai.tako.token.Tokenizer;
import org.javai.tako.tree.Tree;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class PrattParserTest {

	private static ParseError.Kind errorKind(String text, GrammarRule rule) {
		ParseResult<Tree<Token>> result = parse(text, rule);
		assertThat(result.isSuccess()).as("parse of '%s' should fail", text).isFalse();
		return result.parseError().orElseThrow().kind();
	}

	@Nested
	class Precedence {

		@ParameterizedTest
		@CsvSource(delimiter = ';', quoteCharacter = '"', value = {
				"1 + 2 * 3     ; (+ 1 (* 2 3))",
				"1 * 2 + 3     ; (+ (* 1 2) 3)",
				"1 - 2 - 3     ; (- (- 1 2) 3)",
				"a = b = c     ; (= (= a b) c)",
				"-1 * 2        ; (* (- 1) 2)",
				"a < b + 1     ; (< a (+ b 1))",
				"a & b | c     ; (| (& a b) c)",
				"(1 + 2) * 3   ; (* (( (+ 1 2)) 3)"
		})
		void operatorsGroupByBindingPower(String text, String expected) {
			assertThat(shape(text, GrammarRule.VALUE)).isEqualTo(expected);
		}

		@Test
		void prefixOperatorBindsTighterThanMultiplication() {
			assertThat(shape("!a * b", GrammarRule.VALUE)).isEqualTo("(* (! a) b)");
		}
	}

	@Nested
	class Calls {

		@Test
		void callBecomesNodeWithArguments() {
			assertThat(shape("f(x, y)", GrammarRule.VALUE)).isEqualTo("(f x y)");
		}

		@Test
		void emptyCallIsTheBareCallee() {
			assertThat(shape("f()", GrammarRule.VALUE)).isEqualTo("f");
		}

		@Test
		void definitionWithParameters() {
			assertThat(shape("f(x, y) = x + y", GrammarRule.DEFINITION)).isEqualTo("(= (f x y) (+ x y))");
		}

		@Test
		void argumentsMayBeExpressions() {
			assertThat(shape("g(a = 1, 2 * 3)", GrammarRule.VALUE)).isEqualTo("(g (= a 1) (* 2 3))");
		}

		@Test
		void chainedCallKeepsEarlierArguments() {
			assertThat(shape("f(1)(2)", GrammarRule.VALUE)).isEqualTo("(( (f 1) 2)");
		}

		@Test
		void callOnGroupKeepsTheGroup() {
			assertThat(shape("(a)(b, c)", GrammarRule.VALUE)).isEqualTo("(( (( a) b c)");
		}

		@Test
		void chainedEmptyCallWrapsTheCallee() {
			assertThat(shape("f(1)()", GrammarRule.VALUE)).isEqualTo("(( (f 1))");
		}

		@Test
		void squareBracketsGroupWithoutCall() {
			assertThat(shape("[1 2]", GrammarRule.VALUE)).isEqualTo("([ 1 2)");
		}
	}

	@Nested
	class Quotes {

		@Test
		void quotedTextIsOneLeafIncludingQuotes() {
			assertThat(shape("\"hello, world!\"", GrammarRule.VALUE)).isEqualTo("\"hello, world!\"");
		}

		@Test
		void quotedTextTakesPartInOperators() {
			assertThat(shape("\"ab\" * 3", GrammarRule.VALUE)).isEqualTo("(* \"ab\" 3)");
		}

		@Test
		void closingBracketInsideQuotesIsText() {
			assertThat(shape("f('a)')", GrammarRule.VALUE)).isEqualTo("(f 'a)')");
		}
	}

	@Nested
	class Modules {

		@Test
		void eachDefinitionIsAChildOfTheRoot() {
			Tree<Token> tree = parse("a = 1\nb = 2", GrammarRule.MODULE).orElseThrow();

			assertThat(tree.children()).hasSize(2);
			assertThat(tree.value().category()).isEqualTo(TokenCategory.SYMBOL);
			assertThat(tree.value().span().length()).isZero();
		}

		@Test
		void semicolonsSeparateDefinitions() {
			Source source = Source.of("test", "a = 1; b = f(a)");
			Tree<Token> tree = PrattParser.ast(new Tokenizer(source).tokenize(), source, new Diagnostics(),
					GrammarRule.MODULE).orElseThrow();

			assertThat(tree.children()).extracting(child -> shape(child, source))
					.containsExactly("(= a 1)", "(= b (f a))");
		}

		@Test
		void emptyInputIsAnEmptyModule() {
			Tree<Token> tree = parse("", GrammarRule.MODULE).orElseThrow();

			assertThat(tree.isLeaf()).isTrue();
		}
	}

	@Test
	void parsingStopsAtTokenThatCannotContinue() {
		Source source = Source.of("test", "1 + 2 3");
		List<Token> tokens = new Tokenizer(source).tokenize();
		ParserCursor cursor = new ParserCursor(tokens, source, new Diagnostics());

		Tree<Token> tree = PrattParser.parseValue(cursor, 0).orElseThrow();

		assertThat(shape(tree, source)).isEqualTo("(+ 1 2)");
		assertThat(cursor.hasToken()).isTrue();
		assertThat(cursor.currentText()).isEqualTo("3");
	}

	@Test
	void unrecognisedCharacterIsReportedAndKept() {
		Source source = Source.of("test", "a + $");
		Diagnostics diagnostics = new Diagnostics();

		Tree<Token> tree = PrattParser.ast(new Tokenizer(source).tokenize(), source, diagnostics, GrammarRule.VALUE)
				.orElseThrow();

		assertThat(shape(tree, source)).isEqualTo("(+ a $)");
		assertThat(diagnostics.hasErrors()).isTrue();
		assertThat(diagnostics.messages()).singleElement().satisfies(message -> {
			assertThat(message.location()).isEqualTo(new Location(4, 1, "test"));
			assertThat(message.text()).isEqualTo("Unrecognised character '$'");
		});
	}

	@Nested
	class Errors {

		@ParameterizedTest
		@CsvSource(delimiter = ';', quoteCharacter = '"', value = {
				"(1 + 2  ; UNBALANCED_BRACKET",
				"f(1     ; UNBALANCED_BRACKET",
				"'abc    ; UNBALANCED_BRACKET",
				")       ; UNEXPECTED_CLOSING_BRACKET",
				"1 +     ; UNEXPECTED_END_OF_INPUT",
				"1 ? 2   ; UNKNOWN_INFIX_OPERATOR",
				"x 'a'   ; UNKNOWN_INFIX_OPERATOR",
				"* 2     ; UNKNOWN_PREFIX_OPERATOR",
				"a {b}   ; MISSING_INFIX_HANDLER",
				"a [b]   ; MISSING_INFIX_HANDLER"
		})
		void malformedInputFails(String text, ParseError.Kind expected) {
			assertThat(errorKind(text, GrammarRule.VALUE)).isEqualTo(expected);
		}

		@Test
		void emptyValueIsUnexpectedEnd() {
			assertThat(errorKind("", GrammarRule.VALUE)).isEqualTo(ParseError.Kind.UNEXPECTED_END_OF_INPUT);
		}

		@Test
		void unbalancedBracketPointsAtTheOpener() {
			ParseError error = parse("a = f(1", GrammarRule.MODULE).parseError().orElseThrow();

			assertThat(error.location().start()).isEqualTo(5);
			assertThat(error.message()).contains("'('").contains("never closed");
		}

		@Test
		void unknownInfixOperatorNamesTheSpelling() {
			ParseError error = parse("1 ?? 2", GrammarRule.VALUE).parseError().orElseThrow();

			assertThat(error.message()).isEqualTo("Expected an infix operator but found (2,2) '??'");
		}

		@Test
		void moduleStopsAtFirstError() {
			assertThat(errorKind("a = 1\nb = )", GrammarRule.MODULE))
					.isEqualTo(ParseError.Kind.UNEXPECTED_CLOSING_BRACKET);
		}

		@Test
		void orElseThrowRaisesParseException() {
			assertThatThrownBy(() -> parse("(", GrammarRule.VALUE).orElseThrow())
					.isInstanceOf(TakoParseException.class)
					.satisfies(e -> assertThat(((TakoParseException) e).error().kind())
							.isEqualTo(ParseError.Kind.UNBALANCED_BRACKET));
		}
	}
}
