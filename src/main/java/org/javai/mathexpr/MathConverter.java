package org.javai.mathexpr;

import java.util.Objects;
import org.javai.mathexpr.ast.MathNode;
import org.javai.mathexpr.config.SyntaxOptions;
import org.javai.mathexpr.parse.LatexParser;
import org.javai.mathexpr.parse.MathParser;
import org.javai.mathexpr.parse.TextParser;
import org.javai.mathexpr.print.LatexPrinter;
import org.javai.mathexpr.print.MathPrinter;
import org.javai.mathexpr.print.TextPrinter;

/**
 * Pairs a parser with a printer to translate between syntaxes, for example
 * {@code MathConverter.textToLatex().convert("1/(x^2+1)")} gives
 * {@code \frac{1}{x^{2} + 1}}.
 */
public final class MathConverter {

	private final MathParser parser;
	private final MathPrinter printer;

	public MathConverter(MathParser parser, MathPrinter printer) {
		this.parser = Objects.requireNonNull(parser, "parser must not be null");
		this.printer = Objects.requireNonNull(printer, "printer must not be null");
	}

	public static MathConverter textToLatex() {
		return textToLatex(SyntaxOptions.defaults());
	}

	public static MathConverter textToLatex(SyntaxOptions options) {
		return new MathConverter(new TextParser(options), new LatexPrinter(options));
	}

	public static MathConverter latexToText() {
		return latexToText(SyntaxOptions.defaults());
	}

	public static MathConverter latexToText(SyntaxOptions options) {
		return new MathConverter(new LatexParser(options), new TextPrinter(options));
	}

	/**
	 * Normalizes text input: parses it and prints it back in canonical spacing.
	 */
	public static MathConverter textToText() {
		return textToText(SyntaxOptions.defaults());
	}

	public static MathConverter textToText(SyntaxOptions options) {
		return new MathConverter(new TextParser(options), new TextPrinter(options));
	}

	/**
	 * @throws org.javai.mathexpr.parse.MathParseException if the input cannot be parsed
	 */
	public String convert(String input) {
		return printer.convert(parse(input));
	}

	public MathNode parse(String input) {
		return parser.convert(input);
	}
}
