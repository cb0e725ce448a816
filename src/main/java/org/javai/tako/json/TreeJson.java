package org.javai.tako.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.tako.ast.Definition;
import org.javai.tako.ast.Module;
import org.javai.tako.ast.Prim;
import org.javai.tako.ast.Value;
import org.javai.tako.token.Location;
import org.javai.tako.token.Source;
import org.javai.tako.token.Token;
import org.javai.tako.tree.Tree;

/**
 * JSON views of parse trees and lowered modules, for debugging output.
 */
public final class TreeJson {

	private static final ObjectMapper mapper = new ObjectMapper()
			.enable(SerializationFeature.INDENT_OUTPUT);

	private TreeJson() {}

	public static ObjectNode tree(Tree<Token> tree, Source source) {
		ObjectNode node = mapper.createObjectNode();
		Token token = tree.value();
		node.put("category", token.category().name());
		node.put("text", source.textOf(token));
		putSpan(node, token.span());
		if (!tree.isLeaf()) {
			ArrayNode children = node.putArray("children");
			tree.children().forEach(child -> children.add(tree(child, source)));
		}
		return node;
	}

	public static ObjectNode module(Module module) {
		ObjectNode root = mapper.createObjectNode();
		root.put("module", module.name());
		ArrayNode definitions = root.putArray("definitions");
		module.definitions().forEach(d -> definitions.add(definition(d)));
		return root;
	}

	public static ObjectNode definition(Definition definition) {
		ObjectNode node = value(definition);
		definition.boundValue().ifPresent(bound -> node.set("value", value(bound)));
		return node;
	}

	public static ObjectNode value(Value value) {
		ObjectNode node = mapper.createObjectNode();
		node.put("name", value.name());
		node.put("type", value.nodeType().name().toLowerCase());
		value.literal().ifPresent(literal -> putLiteral(node, literal));
		if (!value.args().isEmpty()) {
			ArrayNode args = node.putArray("args");
			value.args().forEach(arg -> args.add(definition(arg)));
		}
		return node;
	}

	public static String render(ObjectNode node) {
		try {
			return mapper.writeValueAsString(node);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to render JSON", e);
		}
	}

	private static void putSpan(ObjectNode node, Location span) {
		ObjectNode location = node.putObject("span");
		location.put("start", span.start());
		location.put("length", span.length());
	}

	private static void putLiteral(ObjectNode node, Prim literal) {
		if (literal instanceof Prim.Int i) {
			node.put("literal", i.value());
		} else if (literal instanceof Prim.Text t) {
			node.put("literal", t.value());
		} else if (literal instanceof Prim.Error e) {
			node.put("error", e.message());
		}
	}
}
