package org.javai.mathexpr.parse;

import org.javai.mathexpr.config.SyntaxOptions;

/**
 * Parses plain-text math such as {@code 2x^2 + sin(3y) <= |z|}.
 */
public class TextParser extends AbstractMathParser {

	public TextParser() {
		this(SyntaxOptions.defaults());
	}

	public TextParser(SyntaxOptions options) {
		super(TextSyntaxFlavor.INSTANCE, options);
	}
}
