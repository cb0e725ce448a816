package org.javai.tako.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable rose tree: one value and an ordered list of children.
 * <p>
 * The parser builds {@code Tree<Token>} bottom-up; child order follows source
 * order and is significant.
 *
 * @param <T> the payload type
 */
public record Tree<T>(T value, List<Tree<T>> children) {

	public Tree {
		Objects.requireNonNull(value, "value must not be null");
		children = children != null ? List.copyOf(children) : List.of();
	}

	/**
	 * Creates a leaf.
	 */
	public static <T> Tree<T> leaf(T value) {
		return new Tree<>(value, List.of());
	}

	public static <T> Tree<T> of(T value, List<Tree<T>> children) {
		return new Tree<>(value, children);
	}

	public boolean isLeaf() {
		return children.isEmpty();
	}

	public Tree<T> child(int index) {
		return children.get(index);
	}

	/**
	 * Returns a new node with this node's value and the given children. This node is unchanged.
	 */
	public Tree<T> withChildren(List<Tree<T>> replacement) {
		return new Tree<>(value, replacement);
	}

	/**
	 * Returns a new node with {@code child} appended after the existing children.
	 */
	public Tree<T> withChild(Tree<T> child) {
		List<Tree<T>> extended = new ArrayList<>(children);
		extended.add(child);
		return new Tree<>(value, extended);
	}

	/**
	 * Number of nodes in this tree, this node included.
	 */
	public int size() {
		int size = 1;
		for (Tree<T> child : children) {
			size += child.size();
		}
		return size;
	}
}
