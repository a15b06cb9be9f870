package org.javai.mathexpr.parse;

import java.util.Objects;
import org.javai.mathexpr.ast.MathNode;
import org.javai.mathexpr.config.SyntaxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds a {@link SyntaxFlavor} and its options to a {@link GrammarEngine}.
 */
abstract class AbstractMathParser implements MathParser {

	private final Logger logger = LoggerFactory.getLogger(getClass());

	private final SyntaxOptions options;
	private final GrammarEngine engine;

	AbstractMathParser(SyntaxFlavor flavor, SyntaxOptions options) {
		this.options = Objects.requireNonNull(options, "options must not be null");
		this.engine = new GrammarEngine(flavor, options);
	}

	public SyntaxOptions options() {
		return options;
	}

	@Override
	public MathNode convert(String input) {
		try {
			MathNode tree = engine.parse(input);
			logger.debug("Parsed {} input '{}' as {}", engine.flavor().name(), input, tree);
			return tree;
		}
		catch (MathParseException e) {
			logger.debug("Rejected {} input '{}': {}", engine.flavor().name(), input, e.getMessage());
			throw e;
		}
	}
}
