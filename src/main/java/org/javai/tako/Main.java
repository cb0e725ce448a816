package org.javai.tako;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.javai.tako.config.TakoConfig;
import org.javai.tako.config.TakoConfigLoader;
import org.javai.tako.diagnostics.Diagnostics;
import org.javai.tako.diagnostics.Message;
import org.javai.tako.json.TreeJson;
import org.javai.tako.parse.ParseError;
import org.javai.tako.token.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 *
 * <pre>
 * tako [--config file.yml] [--rule module|definition|value] [--dump-tree] [--dump-ast] file...
 * </pre>
 *
 * Exit codes: 0 when every file ran (evaluation errors are ordinary output),
 * 1 when a file failed to parse or, with {@code fail-on-errors}, reported errors,
 * 2 for usage, I/O or configuration problems.
 */
public final class Main {

	static final int OK = 0;
	static final int FAILED = 1;
	static final int USAGE = 2;

	private static final Logger logger = LoggerFactory.getLogger(Main.class);

	private static final String USAGE_TEXT =
			"Usage: tako [--config file.yml] [--rule module|definition|value] [--dump-tree] [--dump-ast] file...";

	private Main() {}

	public static void main(String[] args) {
		System.exit(run(args, System.out, System.err));
	}

	static int run(String[] args, PrintStream out, PrintStream err) {
		TakoConfigLoader loader = new TakoConfigLoader();
		List<Path> files = new ArrayList<>();
		TakoConfig config;
		try {
			config = loader.loadDefaults();
			for (int i = 0; i < args.length; i++) {
				String arg = args[i];
				switch (arg) {
					case "--config" -> config = loader.load(Path.of(requireOperand(args, ++i, arg)));
					case "--rule" -> config = config.withStartRule(TakoConfigLoader.parseRule(requireOperand(args, ++i, arg)));
					case "--dump-tree" -> config = config.withDumpTree(true);
					case "--dump-ast" -> config = config.withDumpAst(true);
					case "--help", "-h" -> {
						out.println(USAGE_TEXT);
						return OK;
					}
					default -> {
						if (arg.startsWith("--")) {
							throw new IllegalArgumentException("Unknown option " + arg);
						}
						files.add(Path.of(arg));
					}
				}
			}
		} catch (IllegalArgumentException | IllegalStateException e) {
			err.println(e.getMessage());
			err.println(USAGE_TEXT);
			return USAGE;
		}
		if (files.isEmpty()) {
			err.println(USAGE_TEXT);
			return USAGE;
		}

		Tako tako = new Tako(config);
		int status = OK;
		for (Path file : files) {
			Source source;
			try {
				source = Source.read(file);
			} catch (IOException e) {
				logger.debug("Failed to read {}", file, e);
				err.println(file + ": cannot read: " + e.getMessage());
				return USAGE;
			}
			status = Math.max(status, report(tako, source, out, err));
		}
		return status;
	}

	private static int report(Tako tako, Source source, PrintStream out, PrintStream err) {
		RunResult result = tako.run(source);
		for (Message message : result.messages()) {
			err.println(Diagnostics.format(source, message));
		}
		if (result.parseError() != null) {
			ParseError error = result.parseError();
			err.println(source.name() + ":" + source.lineOf(error.location().start()) + ":"
					+ source.columnOf(error.location().start()) + ": error: " + error.message());
			return FAILED;
		}
		if (tako.config().dumpTree()) {
			out.println(TreeJson.render(TreeJson.tree(result.tree(), source)));
		}
		if (tako.config().dumpAst() && result.module() != null) {
			out.println(TreeJson.render(TreeJson.module(result.module())));
		}
		if (!result.evaluated()) {
			err.println(source.name() + ": not evaluated, errors were reported");
			return FAILED;
		}
		result.result().ifPresent(value -> out.println(value.isError() ? "Error: " + value.render() : value.render()));
		return OK;
	}

	private static String requireOperand(String[] args, int index, String option) {
		if (index >= args.length) {
			throw new IllegalArgumentException("Missing value for " + option);
		}
		return args[index];
	}
}
