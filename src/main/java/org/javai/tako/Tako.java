package org.javai.tako;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.javai.tako.ast.Definition;
import org.javai.tako.ast.Lowering;
import org.javai.tako.ast.Module;
import org.javai.tako.ast.ModuleScope;
import org.javai.tako.ast.Prim;
import org.javai.tako.ast.Value;
import org.javai.tako.config.TakoConfig;
import org.javai.tako.diagnostics.Diagnostics;
import org.javai.tako.eval.Evaluator;
import org.javai.tako.parse.ParseResult;
import org.javai.tako.parse.PrattParser;
import org.javai.tako.token.Source;
import org.javai.tako.token.Token;
import org.javai.tako.token.Tokenizer;
import org.javai.tako.tree.Tree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs source text through tokenizer, parser, lowering and evaluator.
 *
 * <pre>
 * RunResult result = new Tako(TakoConfig.defaults()).run(Source.of("demo", "main = 1 + 2"));
 * result.value(); // Int[value=3]
 * </pre>
 */
public class Tako {

	private static final Logger logger = LoggerFactory.getLogger(Tako.class);

	private final TakoConfig config;
	private final Evaluator evaluator;

	public Tako(TakoConfig config) {
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.evaluator = new Evaluator(config.entryPoint());
	}

	public TakoConfig config() {
		return config;
	}

	public RunResult run(Source source) {
		Diagnostics diagnostics = new Diagnostics();
		List<Token> tokens = new Tokenizer(source).tokenize();
		logger.debug("Tokenized '{}' into {} tokens", source.name(), tokens.size());

		ParseResult<Tree<Token>> parsed = PrattParser.ast(tokens, source, diagnostics, config.startRule());
		if (!parsed.isSuccess()) {
			return RunResult.parseFailure(parsed.parseError().orElseThrow(), diagnostics.messages());
		}
		Tree<Token> tree = parsed.orElseThrow();
		logger.debug("Parsed '{}' into {} nodes", source.name(), tree.size());

		Lowering lowering = new Lowering(source, diagnostics);
		return switch (config.startRule()) {
			case MODULE -> {
				Module module = lowering.lowerModule(tree);
				Prim value = evaluateUnlessFailed(diagnostics, () -> evaluator.eval(module, ModuleScope.of(module)));
				yield new RunResult(tree, module, value, null, diagnostics.messages());
			}
			case DEFINITION -> {
				Optional<Definition> definition = lowering.lowerDefinition(tree);
				Prim value = definition.isPresent()
						? evaluateUnlessFailed(diagnostics, () -> evaluator.eval(definition.get()))
						: Prim.error("Not a definition: " + source.textOf(tree.value()));
				yield new RunResult(tree, null, value, null, diagnostics.messages());
			}
			case VALUE -> {
				Optional<Value> lowered = lowering.lowerValue(tree);
				Prim value = lowered.isPresent()
						? evaluateUnlessFailed(diagnostics, () -> evaluator.eval(lowered.get()))
						: Prim.error("Empty value");
				yield new RunResult(tree, null, value, null, diagnostics.messages());
			}
		};
	}

	private Prim evaluateUnlessFailed(Diagnostics diagnostics, Supplier<Prim> evaluation) {
		if (config.failOnErrors() && diagnostics.hasErrors()) {
			logger.info("Skipping evaluation: {} diagnostics reported", diagnostics.messages().size());
			return null;
		}
		return evaluation.get();
	}
}
