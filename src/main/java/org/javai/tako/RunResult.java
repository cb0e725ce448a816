package org.javai.tako;

import java.util.List;
import java.util.Optional;
import org.javai.tako.ast.Module;
import org.javai.tako.ast.Prim;
import org.javai.tako.diagnostics.Message;
import org.javai.tako.parse.ParseError;
import org.javai.tako.token.Token;
import org.javai.tako.tree.Tree;

/**
 * Everything one pipeline run produced. Stages that did not run are null.
 *
 * @param tree the parse tree, null if parsing failed
 * @param module the lowered module, null unless the run started from the module rule and parsing succeeded
 * @param value the evaluation result, null if evaluation did not run
 * @param parseError the grammar error that stopped the run, if any
 * @param messages diagnostics reported along the way
 */
public record RunResult(Tree<Token> tree, Module module, Prim value, ParseError parseError, List<Message> messages) {

	public RunResult {
		messages = messages != null ? List.copyOf(messages) : List.of();
	}

	static RunResult parseFailure(ParseError error, List<Message> messages) {
		return new RunResult(null, null, null, error, messages);
	}

	public boolean evaluated() {
		return value != null;
	}

	public Optional<Prim> result() {
		return Optional.ofNullable(value);
	}
}
