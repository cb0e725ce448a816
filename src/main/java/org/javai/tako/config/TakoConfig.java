package org.javai.tako.config;

import java.util.Objects;
import org.javai.tako.parse.GrammarRule;

/**
 * Settings for one run of the pipeline.
 *
 * @param entryPoint name of the definition a module run evaluates
 * @param startRule grammar rule parsing starts from
 * @param failOnErrors treat error diagnostics as a failed run
 * @param dumpTree print the parse tree as JSON
 * @param dumpAst print the lowered module as JSON
 */
public record TakoConfig(String entryPoint, GrammarRule startRule, boolean failOnErrors, boolean dumpTree,
		boolean dumpAst) {

	public TakoConfig {
		Objects.requireNonNull(entryPoint, "entryPoint must not be null");
		Objects.requireNonNull(startRule, "startRule must not be null");
		if (entryPoint.isBlank()) {
			throw new IllegalArgumentException("entryPoint must not be blank");
		}
	}

	public static TakoConfig defaults() {
		return new TakoConfig("main", GrammarRule.MODULE, false, false, false);
	}

	public TakoConfig withStartRule(GrammarRule rule) {
		return new TakoConfig(entryPoint, rule, failOnErrors, dumpTree, dumpAst);
	}

	public TakoConfig withDumpTree(boolean enabled) {
		return new TakoConfig(entryPoint, startRule, failOnErrors, enabled, dumpAst);
	}

	public TakoConfig withDumpAst(boolean enabled) {
		return new TakoConfig(entryPoint, startRule, failOnErrors, dumpTree, enabled);
	}
}
