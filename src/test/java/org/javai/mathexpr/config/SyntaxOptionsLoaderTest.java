package org.javai.mathexpr.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.javai.mathexpr.ast.MathNode;
import org.javai.mathexpr.ast.Operator;
import org.javai.mathexpr.parse.TextParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SyntaxOptionsLoaderTest {

	private static InputStream yaml(String text) {
		return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
	}

	@Nested
	@DisplayName("Bundled defaults")
	class Defaults {

		@Test
		void declareTheStandardSymbolTables() {
			SyntaxOptions options = SyntaxOptions.defaults();

			assertThat(options.appliedFunctionSymbols()).contains("sin", "log", "sqrt", "abs", "arcsec");
			assertThat(options.functionSymbols()).containsExactlyInAnyOrder("f", "g");
			assertThat(options.unsplitSymbols()).contains("pi", "theta", "mu", "chi");
			assertThat(options.allowedLatexSymbols()).contains("alpha", "Omega");
		}

		@Test
		void declareTheSwitches() {
			SyntaxOptions options = SyntaxOptions.defaults();

			assertThat(options.allowSimplifiedFunctionApplication()).isTrue();
			assertThat(options.splitSymbols()).isTrue();
			assertThat(options.outputUnicode()).isTrue();
			assertThat(options.maxNestingDepth()).isEqualTo(600);
		}

		@Test
		void areLoadedOnce() {
			assertThat(SyntaxOptions.defaults()).isSameAs(SyntaxOptionsLoader.defaults());
		}

		@Test
		void builderStartsFromThem() {
			SyntaxOptions options = SyntaxOptions.builder().splitSymbols(false).build();

			assertThat(options.splitSymbols()).isFalse();
			assertThat(options.appliedFunctionSymbols()).isEqualTo(SyntaxOptions.defaults().appliedFunctionSymbols());
		}
	}

	@Test
	void presentKeysOverrideTheBase() {
		SyntaxOptions base = SyntaxOptions.defaults();

		SyntaxOptions loaded = SyntaxOptionsLoader.load(yaml("""
				function_symbols: [f, g, h]
				split_symbols: false
				max_nesting_depth: 50
				"""), base);

		assertThat(loaded.functionSymbols()).containsExactlyInAnyOrder("f", "g", "h");
		assertThat(loaded.splitSymbols()).isFalse();
		assertThat(loaded.maxNestingDepth()).isEqualTo(50);
		assertThat(loaded.appliedFunctionSymbols()).isEqualTo(base.appliedFunctionSymbols());
		assertThat(loaded.outputUnicode()).isTrue();
	}

	@Test
	void emptyListClearsATable() {
		SyntaxOptions loaded = SyntaxOptionsLoader.load(yaml("function_symbols:\n"), SyntaxOptions.defaults());

		assertThat(loaded.functionSymbols()).isEmpty();
	}

	@Test
	void emptyDocumentKeepsTheBase() {
		SyntaxOptions base = SyntaxOptions.builder().allowedLatexSymbols(List.of("hbar")).build();

		assertThat(SyntaxOptionsLoader.load(yaml(""), base)).isSameAs(base);
	}

	@Test
	void loadsClasspathResources() {
		SyntaxOptions options = SyntaxOptionsLoader.loadResource(SyntaxOptionsLoader.DEFAULTS_RESOURCE);

		assertThat(options).isEqualTo(SyntaxOptions.defaults());
	}

	@Test
	void resourcesKeepTheBundledDefaultsForAbsentKeys() {
		SyntaxOptions options = SyntaxOptionsLoader.loadResource("syntax/no-splitting.yml");

		assertThat(options.splitSymbols()).isFalse();
		assertThat(options.appliedFunctionSymbols()).contains("arcsin", "log10", "cosec");
		assertThat(options.unsplitSymbols()).contains("gamma", "Omega");
		assertThat(options.toBuilder().splitSymbols(true).build()).isEqualTo(SyntaxOptions.defaults());
		assertThat(new TextParser(options).convert("arcsin(x)"))
				.isEqualTo(MathNode.apply(Operator.APPLY, MathNode.symbol("arcsin"), MathNode.symbol("x")));
	}

	@Test
	void functionNamesAreStoredLowerCased() {
		SyntaxOptions options = SyntaxOptions.builder().functionSymbols(List.of("F", "Gh")).build();

		assertThat(options.functionSymbols()).containsExactlyInAnyOrder("f", "gh");
		assertThat(options.isFunctionSymbol("F")).isTrue();
		assertThat(options.isFunctionSymbol("GH")).isTrue();
		assertThat(options.isAppliedFunctionSymbol("SIN")).isTrue();
		assertThat(new TextParser(options).convert("F(x)"))
				.isEqualTo(MathNode.apply(Operator.APPLY, MathNode.symbol("f"), MathNode.symbol("x")));
	}

	@Nested
	@DisplayName("Rejected documents")
	class Rejected {

		@Test
		void missingResource() {
			assertThatThrownBy(() -> SyntaxOptionsLoader.loadResource("META-INF/no-such-options.yml"))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessage("Resource not found: META-INF/no-such-options.yml");
		}

		@Test
		void malformedYaml() {
			assertThatThrownBy(() -> SyntaxOptionsLoader.load(yaml("split_symbols: [true"), SyntaxOptions.defaults()))
					.isInstanceOf(IllegalStateException.class)
					.hasMessageStartingWith("Malformed syntax options");
		}

		@Test
		void documentThatIsNotAMapping() {
			assertThatThrownBy(() -> SyntaxOptionsLoader.load(yaml("- sin\n- cos\n"), SyntaxOptions.defaults()))
					.isInstanceOf(IllegalStateException.class)
					.hasMessage("Syntax options must be a YAML mapping");
		}

		@Test
		void wronglyTypedValues() {
			assertThatThrownBy(() -> SyntaxOptionsLoader.load(yaml("split_symbols: sometimes"), SyntaxOptions.defaults()))
					.isInstanceOf(IllegalStateException.class)
					.hasMessage("split_symbols must be true or false but was sometimes");
			assertThatThrownBy(() -> SyntaxOptionsLoader.load(yaml("function_symbols: f"), SyntaxOptions.defaults()))
					.isInstanceOf(IllegalStateException.class)
					.hasMessage("function_symbols must be a list of names");
			assertThatThrownBy(() -> SyntaxOptionsLoader.load(yaml("max_nesting_depth: deep"), SyntaxOptions.defaults()))
					.isInstanceOf(IllegalStateException.class)
					.hasMessage("max_nesting_depth must be an integer but was deep");
		}

		@Test
		void nonPositiveDepth() {
			assertThatThrownBy(() -> SyntaxOptionsLoader.load(yaml("max_nesting_depth: 0"), SyntaxOptions.defaults()))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessage("maxNestingDepth must be positive");
		}
	}
}
