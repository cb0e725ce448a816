package org.javai.tako.config;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.javai.tako.parse.GrammarRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@link TakoConfig} from YAML.
 * <p>
 * Built-in defaults come from the classpath resource {@value #DEFAULTS_RESOURCE};
 * a user file only needs the keys it changes:
 *
 * <pre>
 * entry: main
 * start-rule: module      # module | definition | value
 * fail-on-errors: false
 * dump-tree: false
 * dump-ast: false
 * </pre>
 */
public class TakoConfigLoader {

	public static final String DEFAULTS_RESOURCE = "META-INF/tako-defaults.yml";

	private static final Logger logger = LoggerFactory.getLogger(TakoConfigLoader.class);

	private static final Set<String> KNOWN_KEYS = Set.of("entry", "start-rule", "fail-on-errors", "dump-tree", "dump-ast");

	private final Yaml yaml = new Yaml();

	/**
	 * Loads the built-in defaults, falling back to {@link TakoConfig#defaults()} if the resource is missing.
	 */
	public TakoConfig loadDefaults() {
		ClassLoader loader = TakoConfigLoader.class.getClassLoader();
		try (InputStream is = loader.getResourceAsStream(DEFAULTS_RESOURCE)) {
			if (is == null) {
				logger.debug("No {} on the classpath; using built-in defaults", DEFAULTS_RESOURCE);
				return TakoConfig.defaults();
			}
			return overlay(TakoConfig.defaults(), yaml.load(is));
		} catch (IllegalArgumentException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to load configuration from resource: " + DEFAULTS_RESOURCE, e);
		}
	}

	/**
	 * Loads a user file on top of the built-in defaults.
	 */
	public TakoConfig load(Path path) {
		Objects.requireNonNull(path, "path must not be null");
		try (Reader reader = Files.newBufferedReader(path)) {
			TakoConfig config = overlay(loadDefaults(), yaml.load(reader));
			logger.info("Loaded configuration from {}", path);
			return config;
		} catch (IllegalArgumentException e) {
			throw e;
		} catch (Exception e) {
			throw new IllegalStateException("Failed to load configuration from path: " + path, e);
		}
	}

	/**
	 * Parses a YAML document on top of {@code base}.
	 */
	public TakoConfig parseString(String yamlContent, TakoConfig base) {
		return overlay(base, yaml.load(yamlContent));
	}

	private TakoConfig overlay(TakoConfig base, Object document) {
		if (document == null) {
			return base;
		}
		if (!(document instanceof Map<?, ?> data)) {
			throw new IllegalArgumentException("Configuration must be a YAML mapping, found: "
					+ document.getClass().getSimpleName());
		}
		for (Object key : data.keySet()) {
			if (!KNOWN_KEYS.contains(String.valueOf(key))) {
				logger.warn("Ignoring unknown configuration key '{}'", key);
			}
		}
		return new TakoConfig(
				stringValue(data.get("entry"), base.entryPoint()),
				ruleValue(data.get("start-rule"), base.startRule()),
				booleanValue(data, "fail-on-errors", base.failOnErrors()),
				booleanValue(data, "dump-tree", base.dumpTree()),
				booleanValue(data, "dump-ast", base.dumpAst()));
	}

	private static String stringValue(Object value, String fallback) {
		return value == null ? fallback : String.valueOf(value);
	}

	/**
	 * Parses a grammar rule name such as {@code module}, ignoring case.
	 */
	public static GrammarRule parseRule(String name) {
		try {
			return GrammarRule.valueOf(name.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Unknown start rule '" + name + "', expected module, definition or value", e);
		}
	}

	private static GrammarRule ruleValue(Object value, GrammarRule fallback) {
		return value == null ? fallback : parseRule(String.valueOf(value));
	}

	private static boolean booleanValue(Map<?, ?> data, String key, boolean fallback) {
		Object value = data.get(key);
		if (value == null) {
			return fallback;
		}
		if (value instanceof Boolean b) {
			return b;
		}
		throw new IllegalArgumentException("Configuration key '" + key + "' must be true or false, found: " + value);
	}
}
