package org.javai.mathexpr.print;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.stream.Stream;
import org.javai.mathexpr.ast.AstJsonMapper;
import org.javai.mathexpr.ast.MathNode;
import org.javai.mathexpr.ast.Operator;
import org.javai.mathexpr.config.SyntaxOptions;
import org.javai.mathexpr.parse.LatexParser;
import org.javai.mathexpr.parse.TextParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class LatexPrinterTest {

	private final TextParser textParser = new TextParser();
	private final LatexParser latexParser = new LatexParser();
	private final LatexPrinter printer = new LatexPrinter();

	static Stream<Arguments> textToLatex() {
		return Stream.of(
				Arguments.of("1+x+3", "1 + x + 3"),
				Arguments.of("1-x-3", "1 - x - 3"),
				Arguments.of("1 + x^2 + 3x^5", "1 + x^{2} + 3 \\, x^{5}"),
				Arguments.of("|x|", "\\left|x\\right|"),
				Arguments.of("sin^2 x", "\\sin^{2}\\left(x\\right)"),
				Arguments.of("sin^2 (3x)", "\\sin^{2}\\left(3 \\, x\\right)"),
				Arguments.of("sin x", "\\sin\\left(x\\right)"),
				Arguments.of("log x", "\\log\\left(x\\right)"),
				Arguments.of("log |x|", "\\log\\left(\\left|x\\right|\\right)"),
				Arguments.of("ln x", "\\ln\\left(x\\right)"),
				Arguments.of("ln |x|", "\\ln\\left(\\left|x\\right|\\right)"),
				Arguments.of("x!", "x!"),
				Arguments.of("17!", "17!"),
				Arguments.of("n!", "n!"),
				Arguments.of("x_(n+1)!", "x_{n + 1}!"),
				Arguments.of("sqrt(-x)", "\\sqrt{- x}"),
				Arguments.of("x^y z", "x^{y} \\, z"),
				Arguments.of("2^(2^x)", "2^{2^{x}}"),
				Arguments.of("(2^x)^y", "\\left(2^{x}\\right)^{y}"),
				Arguments.of("x^(2y) z", "x^{2 \\, y} \\, z"),
				Arguments.of("1/(x^2 + x + 1)", "\\frac{1}{x^{2} + x + 1}"),
				Arguments.of("(x/y)^2", "\\left(\\frac{x}{y}\\right)^{2}"),
				Arguments.of("2^(x/y)", "2^{\\frac{x}{y}}"),
				Arguments.of("oo", "\\infty"),
				Arguments.of("theta + alpha", "\\theta + \\alpha"),
				Arguments.of("x 2", "x \\cdot 2"),
				Arguments.of("a*|b|", "a \\cdot \\left|b\\right|"),
				Arguments.of("|a|*|b|^2", "\\left|a\\right| \\cdot \\left|b\\right|^{2}"),
				Arguments.of("-(xy)", "- \\left(x \\, y\\right)"),
				Arguments.of("a-xy", "a - x \\, y"),
				Arguments.of("a+(-x)y", "a + \\left(- x \\, y\\right)"),
				Arguments.of("-(x/y)", "- \\frac{x}{y}"),
				Arguments.of("a+(-x)/y", "a + \\frac{- x}{y}"),
				Arguments.of("x <= y < z", "x \\le y < z"),
				Arguments.of("x != y", "x \\ne y"),
				Arguments.of("A and (B or C)", "A \\land \\left(B \\lor C\\right)"),
				Arguments.of("not (A and B)", "\\lnot \\left(A \\land B\\right)"),
				Arguments.of("A=1 or B=2", "\\left(A = 1\\right) \\lor \\left(B = 2\\right)"),
				Arguments.of("x elementof A union B", "x \\in A \\cup B"),
				Arguments.of("A notsubset B", "A \\not\\subset B"),
				Arguments.of("(a,b]", "\\left( a, b \\right]"),
				Arguments.of("{a,b}", "\\left\\{ a, b \\right\\}"),
				Arguments.of("[1,2,3]", "\\left[ 1, 2, 3 \\right]"),
				Arguments.of("f(x,y)", "f\\left( x, y \\right)"),
				Arguments.of("f'(x)", "f'\\left(x\\right)"),
				Arguments.of("dy/dx", "\\frac{dy}{dx}"),
				Arguments.of("d^2y/dx^2", "\\frac{d^{2}y}{dx^{2}}"));
	}

	@ParameterizedTest(name = "{0}")
	@MethodSource("textToLatex")
	void printsTextInputAsLatex(String input, String expected) {
		assertThat(printer.convert(textParser.convert(input))).isEqualTo(expected);
	}

	@ParameterizedTest(name = "{0}")
	@MethodSource("textToLatex")
	void printedLatexParsesToTheSameTree(String input, String expected) {
		MathNode tree = textParser.convert(input);

		assertThat(latexParser.convert(printer.convert(tree))).isEqualTo(tree);
	}

	static Stream<String> latexInputs() {
		return Stream.of(
				"\\frac{\\frac{x}{y}}{z}",
				"\\sqrt{x + 1} - \\left|x\\right|^{2}",
				"f_{t}'^{2}\\left(x\\right)",
				"\\sin\\left(x\\right)^{2} + \\cos\\left(x\\right)^{2}",
				"e^{2 \\, x + 1}",
				"\\alpha \\, \\mu",
				"- x^{2}",
				"\\left( 0, 1 \\right]",
				"\\begin{bmatrix} 1 & 2 \\\\ 3 & 4 \\end{bmatrix}",
				"\\begin{bmatrix} x + 1 & \\frac{1}{2} \\end{bmatrix}");
	}

	@ParameterizedTest(name = "{0}")
	@MethodSource("latexInputs")
	void canonicalLatexPrintsUnchanged(String input) {
		assertThat(printer.convert(latexParser.convert(input))).isEqualTo(input);
	}

	@Nested
	@DisplayName("Names")
	class Names {

		@Test
		void wrapsUnknownMultiLetterNames() {
			TextParser unsplit = new TextParser(SyntaxOptions.builder().splitSymbols(false).build());
			MathNode tree = unsplit.convert("abc + 1");

			String printed = printer.convert(tree);

			assertThat(printed).isEqualTo("\\var{abc} + 1");
			assertThat(latexParser.convert(printed)).isEqualTo(tree);
		}

		@Test
		void knownNamesBecomeCommands() {
			assertThat(printer.convert(MathNode.symbol("Omega"))).isEqualTo("\\Omega");
			assertThat(printer.convert(MathNode.symbol("x"))).isEqualTo("x");
		}

		@Test
		void separatesAFunctionNameFromAFollowingGroup() {
			MathNode tree = AstJsonMapper.fromJsonString("['*','f',['+','x',1]]");

			String printed = printer.convert(tree);

			assertThat(printed).isEqualTo("f \\cdot \\left(x + 1\\right)");
			assertThat(latexParser.convert(printed)).isEqualTo(tree);
		}
	}

	@Test
	void groupsARelationUsedAsAnOperand() {
		MathNode tree = AstJsonMapper.fromJsonString("['=',['lts',['tuple','x','y','z'],['tuple',true,false]],1]");

		assertThat(printer.convert(tree)).isEqualTo("\\left(x < y \\le z\\right) = 1");
	}

	@Test
	void rejectsOperatorsWithoutARelationalForm() {
		assertThatThrownBy(() -> printer.operatorSymbol(Operator.TIMES))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("No LaTeX form for operator '*'");
	}
}
