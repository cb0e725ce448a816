package org.javai.tako.token;

import java.util.Objects;

/**
 * A span of source text.
 *
 * @param start offset of the first character
 * @param length number of characters covered
 * @param sourceName name of the source the span belongs to
 */
public record Location(int start, int length, String sourceName) {

	public Location {
		if (start < 0) {
			throw new IllegalArgumentException("start must not be negative: " + start);
		}
		if (length < 0) {
			throw new IllegalArgumentException("length must not be negative: " + length);
		}
		Objects.requireNonNull(sourceName, "sourceName must not be null");
	}

	public int end() {
		return start + length;
	}

	/**
	 * Span from the start of this location to the end of {@code other}.
	 */
	public Location through(Location other) {
		return new Location(start, Math.max(0, other.end() - start), sourceName);
	}

	@Override
	public String toString() {
		return sourceName + "@" + start + "+" + length;
	}
}
