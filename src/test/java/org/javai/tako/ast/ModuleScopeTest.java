package org.javai.tako.ast;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.javai.tako.token.Location;
import org.junit.jupiter.api.Test;

class ModuleScopeTest {

	private static final Location HERE = new Location(0, 0, "test");

	private final Definition x = Definition.declaration("x", HERE);
	private final Definition y = new Definition("y", HERE, List.of(), Value.numeric("2", HERE));
	private final Definition f = new Definition("f", HERE, List.of(x, y), Value.symbol("x", HERE, List.of()));
	private final Definition main = new Definition("main", HERE, List.of(), Value.numeric("1", HERE));
	private final ModuleScope scope = ModuleScope.of(new Module("test", HERE, List.of(f, main)));

	@Test
	void topLevelLookup() {
		assertThat(scope.lookup(List.of(), "main")).containsSame(main);
	}

	@Test
	void lookupThroughEnclosingDefinition() {
		assertThat(scope.lookup(List.of("f"), "y")).containsSame(y);
	}

	@Test
	void missingNamesAreEmpty() {
		assertThat(scope.lookup(List.of(), "nothing")).isEmpty();
		assertThat(scope.lookup(List.of("g"), "x")).isEmpty();
		assertThat(scope.lookup(List.of("main"), "x")).isEmpty();
	}
}
