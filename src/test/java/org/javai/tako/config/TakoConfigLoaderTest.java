package org.javai.tako.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.javai.tako.parse.GrammarRule;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TakoConfigLoaderTest {

	private final TakoConfigLoader loader = new TakoConfigLoader();

	@Test
	void classpathDefaultsMatchBuiltInDefaults() {
		assertThat(loader.loadDefaults()).isEqualTo(TakoConfig.defaults());
	}

	@Test
	void userFileOverridesOnlyGivenKeys(@TempDir Path dir) throws IOException {
		Path file = dir.resolve("tako.yml");
		Files.writeString(file, "entry: start\nstart-rule: Value\ndump-ast: true\n");

		TakoConfig config = loader.load(file);

		assertThat(config.entryPoint()).isEqualTo("start");
		assertThat(config.startRule()).isEqualTo(GrammarRule.VALUE);
		assertThat(config.dumpAst()).isTrue();
		assertThat(config.dumpTree()).isFalse();
		assertThat(config.failOnErrors()).isFalse();
	}

	@Test
	void emptyDocumentKeepsBase() {
		TakoConfig base = TakoConfig.defaults().withDumpTree(true);

		assertThat(loader.parseString("", base)).isEqualTo(base);
	}

	@Test
	void unknownKeysAreIgnored() {
		TakoConfig config = loader.parseString("colour: blue\nfail-on-errors: true\n", TakoConfig.defaults());

		assertThat(config.failOnErrors()).isTrue();
	}

	@Test
	void unknownRuleIsRejected() {
		assertThatThrownBy(() -> loader.parseString("start-rule: statement", TakoConfig.defaults()))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Unknown start rule 'statement'");
	}

	@Test
	void nonBooleanFlagIsRejected() {
		assertThatThrownBy(() -> loader.parseString("dump-tree: sometimes", TakoConfig.defaults()))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("dump-tree");
	}

	@Test
	void documentMustBeAMapping() {
		assertThatThrownBy(() -> loader.parseString("- a\n- b\n", TakoConfig.defaults()))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("YAML mapping");
	}

	@Test
	void missingFileIsAnIllegalState(@TempDir Path dir) {
		assertThatThrownBy(() -> loader.load(dir.resolve("absent.yml")))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("absent.yml");
	}

	@Test
	void ruleNamesIgnoreCaseAndSpace() {
		assertThat(TakoConfigLoader.parseRule(" Definition ")).isEqualTo(GrammarRule.DEFINITION);
	}
}
