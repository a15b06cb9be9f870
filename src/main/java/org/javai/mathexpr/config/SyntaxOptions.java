package org.javai.mathexpr.config;

import java.util.Collection;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Construction-time settings of the parsers and printers.
 *
 * @param appliedFunctionSymbols names that must take an argument, such as {@code sin}
 * @param functionSymbols names applied only when an argument list follows, such as {@code f}
 * @param allowSimplifiedFunctionApplication whether {@code sin x} is accepted without parentheses
 * @param splitSymbols whether the text syntax reads {@code xyz} as {@code x*y*z}
 * @param unsplitSymbols identifiers the text syntax never splits
 * @param allowedLatexSymbols bare LaTeX commands accepted as symbols
 * @param outputUnicode whether the text printer emits glyphs rather than ASCII keywords
 * @param maxNestingDepth how deeply a parse may recurse before it is rejected
 */
public record SyntaxOptions(
		Set<String> appliedFunctionSymbols,
		Set<String> functionSymbols,
		boolean allowSimplifiedFunctionApplication,
		boolean splitSymbols,
		Set<String> unsplitSymbols,
		Set<String> allowedLatexSymbols,
		boolean outputUnicode,
		int maxNestingDepth) {

	public SyntaxOptions {
		appliedFunctionSymbols = lowerCased(Objects.requireNonNull(appliedFunctionSymbols, "appliedFunctionSymbols must not be null"));
		functionSymbols = lowerCased(Objects.requireNonNull(functionSymbols, "functionSymbols must not be null"));
		unsplitSymbols = Set.copyOf(Objects.requireNonNull(unsplitSymbols, "unsplitSymbols must not be null"));
		allowedLatexSymbols = Set.copyOf(Objects.requireNonNull(allowedLatexSymbols, "allowedLatexSymbols must not be null"));
		if (maxNestingDepth < 1) {
			throw new IllegalArgumentException("maxNestingDepth must be positive");
		}
	}

	/**
	 * The options declared in {@code META-INF/math-syntax-defaults.yml}.
	 */
	public static SyntaxOptions defaults() {
		return SyntaxOptionsLoader.defaults();
	}

	public static Builder builder() {
		return defaults().toBuilder();
	}

	public Builder toBuilder() {
		return new Builder(this);
	}

	/**
	 * Function names are matched ignoring case; both tables hold them lower-cased.
	 */
	public boolean isFunctionSymbol(String name) {
		String key = name.toLowerCase(Locale.ROOT);
		return appliedFunctionSymbols.contains(key) || functionSymbols.contains(key);
	}

	public boolean isAppliedFunctionSymbol(String name) {
		return appliedFunctionSymbols.contains(name.toLowerCase(Locale.ROOT));
	}

	private static Set<String> lowerCased(Set<String> names) {
		return names.stream()
				.map(name -> name.toLowerCase(Locale.ROOT))
				.collect(Collectors.toUnmodifiableSet());
	}

	public static final class Builder {

		private Set<String> appliedFunctionSymbols;
		private Set<String> functionSymbols;
		private boolean allowSimplifiedFunctionApplication;
		private boolean splitSymbols;
		private Set<String> unsplitSymbols;
		private Set<String> allowedLatexSymbols;
		private boolean outputUnicode;
		private int maxNestingDepth;

		private Builder(SyntaxOptions base) {
			this.appliedFunctionSymbols = base.appliedFunctionSymbols();
			this.functionSymbols = base.functionSymbols();
			this.allowSimplifiedFunctionApplication = base.allowSimplifiedFunctionApplication();
			this.splitSymbols = base.splitSymbols();
			this.unsplitSymbols = base.unsplitSymbols();
			this.allowedLatexSymbols = base.allowedLatexSymbols();
			this.outputUnicode = base.outputUnicode();
			this.maxNestingDepth = base.maxNestingDepth();
		}

		public Builder appliedFunctionSymbols(Collection<String> names) {
			this.appliedFunctionSymbols = Set.copyOf(names);
			return this;
		}

		public Builder functionSymbols(Collection<String> names) {
			this.functionSymbols = Set.copyOf(names);
			return this;
		}

		public Builder allowSimplifiedFunctionApplication(boolean allow) {
			this.allowSimplifiedFunctionApplication = allow;
			return this;
		}

		public Builder splitSymbols(boolean split) {
			this.splitSymbols = split;
			return this;
		}

		public Builder unsplitSymbols(Collection<String> names) {
			this.unsplitSymbols = Set.copyOf(names);
			return this;
		}

		public Builder allowedLatexSymbols(Collection<String> names) {
			this.allowedLatexSymbols = Set.copyOf(names);
			return this;
		}

		public Builder outputUnicode(boolean unicode) {
			this.outputUnicode = unicode;
			return this;
		}

		public Builder maxNestingDepth(int depth) {
			this.maxNestingDepth = depth;
			return this;
		}

		public SyntaxOptions build() {
			return new SyntaxOptions(appliedFunctionSymbols, functionSymbols, allowSimplifiedFunctionApplication,
					splitSymbols, unsplitSymbols, allowedLatexSymbols, outputUnicode, maxNestingDepth);
		}
	}
}
