package org.javai.mathexpr.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads {@link SyntaxOptions} from YAML. Keys use snake case
 * ({@code applied_function_symbols}, {@code split_symbols}, ...); a key that is absent keeps the
 * value of the base options, which for classpath resources are the bundled defaults.
 */
public final class SyntaxOptionsLoader {

	public static final String DEFAULTS_RESOURCE = "META-INF/math-syntax-defaults.yml";

	private static final Logger logger = LoggerFactory.getLogger(SyntaxOptionsLoader.class);

	private static final List<String> KEYS = List.of(
			"applied_function_symbols",
			"function_symbols",
			"unsplit_symbols",
			"allowed_latex_symbols",
			"allow_simplified_function_application",
			"split_symbols",
			"output_unicode",
			"max_nesting_depth");

	// base for the bundled defaults, which declare every key
	private static final SyntaxOptions NONE = new SyntaxOptions(
			Set.of(), Set.of(), false, false, Set.of(), Set.of(), false, 1);

	private SyntaxOptionsLoader() {
	}

	/**
	 * Options from {@value #DEFAULTS_RESOURCE}, loaded once.
	 */
	public static SyntaxOptions defaults() {
		return DefaultsHolder.DEFAULTS;
	}

	/**
	 * Loads options from a classpath resource, filling absent keys from {@link #defaults()}.
	 *
	 * @throws IllegalArgumentException if the resource does not exist
	 * @throws IllegalStateException if it cannot be read
	 */
	public static SyntaxOptions loadResource(String resourcePath) {
		Objects.requireNonNull(resourcePath, "resourcePath must not be null");
		SyntaxOptions options = apply(readResource(resourcePath), defaults());
		logger.debug("Loaded syntax options from {}", resourcePath);
		return options;
	}

	/**
	 * Loads options from a YAML document, filling absent keys from {@code base}.
	 */
	public static SyntaxOptions load(InputStream input, SyntaxOptions base) {
		Objects.requireNonNull(input, "input must not be null");
		Objects.requireNonNull(base, "base must not be null");
		return apply(read(input), base);
	}

	private static SyntaxOptions loadDefaults() {
		Map<?, ?> map = readResource(DEFAULTS_RESOURCE);
		List<String> missing = KEYS.stream().filter(key -> !map.containsKey(key)).toList();
		if (!missing.isEmpty()) {
			throw new IllegalStateException(DEFAULTS_RESOURCE + " does not declare " + missing);
		}
		SyntaxOptions options = apply(map, NONE);
		logger.debug("Loaded syntax options from {}", DEFAULTS_RESOURCE);
		return options;
	}

	private static Map<?, ?> readResource(String resourcePath) {
		ClassLoader classLoader = SyntaxOptionsLoader.class.getClassLoader();
		try (InputStream input = classLoader.getResourceAsStream(resourcePath)) {
			if (input == null) {
				throw new IllegalArgumentException("Resource not found: " + resourcePath);
			}
			return read(input);
		}
		catch (IOException e) {
			throw new IllegalStateException("Failed to read syntax options from " + resourcePath, e);
		}
	}

	/**
	 * @return the document as a mapping, empty for an empty document
	 */
	private static Map<?, ?> read(InputStream input) {
		Object document;
		try {
			document = new Yaml().load(input);
		}
		catch (YAMLException e) {
			throw new IllegalStateException("Malformed syntax options: " + e.getMessage(), e);
		}
		if (document == null) {
			return Map.of();
		}
		if (!(document instanceof Map<?, ?> map)) {
			throw new IllegalStateException("Syntax options must be a YAML mapping");
		}
		return map;
	}

	private static SyntaxOptions apply(Map<?, ?> map, SyntaxOptions base) {
		if (map.isEmpty()) {
			return base;
		}
		SyntaxOptions.Builder builder = base.toBuilder();
		if (map.containsKey("applied_function_symbols")) {
			builder.appliedFunctionSymbols(names(map, "applied_function_symbols"));
		}
		if (map.containsKey("function_symbols")) {
			builder.functionSymbols(names(map, "function_symbols"));
		}
		if (map.containsKey("unsplit_symbols")) {
			builder.unsplitSymbols(names(map, "unsplit_symbols"));
		}
		if (map.containsKey("allowed_latex_symbols")) {
			builder.allowedLatexSymbols(names(map, "allowed_latex_symbols"));
		}
		if (map.containsKey("allow_simplified_function_application")) {
			builder.allowSimplifiedFunctionApplication(flag(map, "allow_simplified_function_application"));
		}
		if (map.containsKey("split_symbols")) {
			builder.splitSymbols(flag(map, "split_symbols"));
		}
		if (map.containsKey("output_unicode")) {
			builder.outputUnicode(flag(map, "output_unicode"));
		}
		if (map.containsKey("max_nesting_depth")) {
			Object depth = map.get("max_nesting_depth");
			if (!(depth instanceof Integer value)) {
				throw new IllegalStateException("max_nesting_depth must be an integer but was " + depth);
			}
			builder.maxNestingDepth(value);
		}
		return builder.build();
	}

	private static Collection<String> names(Map<?, ?> map, String key) {
		Object value = map.get(key);
		if (value == null) {
			return List.of();
		}
		if (!(value instanceof Collection<?> items)) {
			throw new IllegalStateException(key + " must be a list of names");
		}
		return items.stream().map(String::valueOf).toList();
	}

	private static boolean flag(Map<?, ?> map, String key) {
		Object value = map.get(key);
		if (!(value instanceof Boolean bool)) {
			throw new IllegalStateException(key + " must be true or false but was " + value);
		}
		return bool;
	}

	private static final class DefaultsHolder {
		private static final SyntaxOptions DEFAULTS = loadDefaults();
	}
}
