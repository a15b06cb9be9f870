package org.javai.mathexpr.parse;

import org.javai.mathexpr.config.SyntaxOptions;

/**
 * Parses LaTeX math such as {@code \frac{1}{2}\sqrt[3]{x} \le \left|y\right|}.
 */
public class LatexParser extends AbstractMathParser {

	public LatexParser() {
		this(SyntaxOptions.defaults());
	}

	public LatexParser(SyntaxOptions options) {
		super(LatexSyntaxFlavor.INSTANCE, options);
	}
}
