package org.javai.tako.token;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Named source text. Tokens and tree nodes only carry {@link Location}s; their
 * text is recovered from here.
 */
public final class Source {

	private final String name;
	private final String content;

	public Source(String name, String content) {
		this.name = Objects.requireNonNull(name, "name must not be null");
		this.content = content != null ? content : "";
	}

	public static Source of(String name, String content) {
		return new Source(name, content);
	}

	public static Source read(Path path) throws IOException {
		return new Source(path.toString(), Files.readString(path, StandardCharsets.UTF_8));
	}

	public String name() {
		return name;
	}

	public String content() {
		return content;
	}

	/**
	 * Returns the text covered by {@code location}, clipped to the content bounds.
	 */
	public String textAt(Location location) {
		int start = Math.min(location.start(), content.length());
		int end = Math.min(location.end(), content.length());
		return content.substring(start, end);
	}

	public String textOf(Token token) {
		return textAt(token.span());
	}

	/**
	 * 1-based line of the given offset.
	 */
	public int lineOf(int offset) {
		int line = 1;
		int limit = Math.min(offset, content.length());
		for (int i = 0; i < limit; i++) {
			if (content.charAt(i) == '\n') {
				line++;
			}
		}
		return line;
	}

	/**
	 * 1-based column of the given offset.
	 */
	public int columnOf(int offset) {
		int limit = Math.min(offset, content.length());
		int lineStart = content.lastIndexOf('\n', limit - 1) + 1;
		return limit - lineStart + 1;
	}
}
