package org.javai.tako.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import org.javai.tako.diagnostics.MessageSink;
import org.javai.tako.diagnostics.Severity;
import org.javai.tako.token.Location;
import org.javai.tako.token.Source;
import org.javai.tako.token.TokenCategory;
import org.javai.tako.token.Tokenizer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ParserCursorTest {

	@Mock
	private MessageSink sink;

	private ParserCursor cursorOver(String text) {
		Source source = Source.of("test", text);
		return new ParserCursor(new Tokenizer(source).tokenize(), source, sink);
	}

	@Test
	void nextSkipsSeparators() {
		ParserCursor cursor = cursorOver("a , ;  b");

		assertThat(cursor.currentText()).isEqualTo("a");
		assertThat(cursor.next()).isTrue();
		assertThat(cursor.currentText()).isEqualTo("b");
	}

	@Test
	void endOfInputTokenEndsTheCursor() {
		ParserCursor cursor = cursorOver("a  ");

		assertThat(cursor.next()).isFalse();
		assertThat(cursor.hasToken()).isFalse();
		assertThat(cursor.current().category()).isEqualTo(TokenCategory.END_OF_INPUT);
		assertThat(cursor.current().span()).isEqualTo(new Location(3, 0, "test"));
	}

	@Test
	void nextAfterEndStaysAtEnd() {
		ParserCursor cursor = cursorOver("a");
		cursor.next();

		assertThat(cursor.next()).isFalse();
		assertThat(cursor.current().category()).isEqualTo(TokenCategory.END_OF_INPUT);
	}

	@Test
	void expectMatchingCategoryAdvancesSilently() {
		ParserCursor cursor = cursorOver(") x");

		cursor.expect(TokenCategory.CLOSE_PAREN);

		assertThat(cursor.currentText()).isEqualTo("x");
		verify(sink, never()).msg(any(), any(), anyString());
	}

	@Test
	void expectMismatchReportsAndStillAdvances() {
		ParserCursor cursor = cursorOver("] x");

		cursor.expect(TokenCategory.CLOSE_PAREN);

		verify(sink).msg(eq(new Location(0, 1, "test")), eq(Severity.ERROR),
				eq("Expected a CLOSE_PAREN but found CLOSE_BRACKET ']'"));
		assertThat(cursor.currentText()).isEqualTo("x");
	}
}
