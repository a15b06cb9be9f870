package org.javai.mathexpr.print;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.stream.Stream;
import org.javai.mathexpr.ast.AstJsonMapper;
import org.javai.mathexpr.ast.MathNode;
import org.javai.mathexpr.config.SyntaxOptions;
import org.javai.mathexpr.parse.TextParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class TextPrinterTest {

	private final TextParser parser = new TextParser();
	private final TextPrinter printer = new TextPrinter();

	private String roundTrip(String input) {
		return printer.convert(parser.convert(input));
	}

	private static String withoutSpaces(String text) {
		return text.replace(" ", "");
	}

	/**
	 * Input and the text it prints as, compared without spaces. Inputs that already are in
	 * printed form map to themselves.
	 */
	static Stream<Arguments> roundTrips() {
		return Stream.of(
				same("3+4"),
				same("3-4"),
				same("1+2+3"),
				same("1/2"),
				same("-2"),
				same("x+y-z+w"),
				same("-x-y+z-w"),
				same("x^2(x-3)"),
				same("x^2(x-3)-z^3e^(2x+1)+x/(x-1)"),
				same("-1/x+((x-3)x)/((x-3)(x+4))"),
				same("(x/y)/(z/w)"),
				same("x!"),
				same("17!"),
				same("(x+1)!"),
				same("(x^2+1)!"),
				same("(n-1)!"),
				same("x_(n+1)!"),
				same("sin(x)"),
				same("cos(3)"),
				same("arcsec(x)"),
				Arguments.of("theta", "θ"),
				same("log(exp(x))"),
				same("e^x"),
				same("sqrt(4)"),
				same("1/sqrt(-x)"),
				same("sin(3x)^2"),
				same("sin(x)^2 + cos(x)^2"),
				same("sin(x)^2 / cos(x)^2"),
				same("sin(x+y+z)^2"),
				same("sqrt(sqrt(x))"),
				same("sqrt(1/(x+y))"),
				same("log(-x^2)"),
				same("|3|"),
				same("|sin(||x||)|"),
				same("||x|+|y|+|z||"),
				same("|x+y < z|"),
				same("|x|^2"),
				Arguments.of("infinity", "∞"),
				same("sin(x)''"),
				same("f'(x)"),
				same("f''(x)"),
				same("f(x)'"),
				same("sin'(x)"),
				Arguments.of("sin x", "sin(x)"),
				Arguments.of("sin xy", "sin(x)y"),
				Arguments.of("sin^xyz", "sin^x(y)z"),
				Arguments.of("y(x)", "yx"),
				Arguments.of("y'(x)", "y'x"),
				same("x^22"),
				same("x^ab"),
				Arguments.of("x^y^z", "x^(y^z)"),
				same("(x^y)^z"),
				Arguments.of("x_y_z", "x_(y_z)"),
				same("(x_y)_z"),
				same("x_y^z"),
				Arguments.of("x^y_z", "x^(y_z)"),
				same("f^2"),
				same("f^2(x)"),
				same("f(x)^2"),
				same("f_t(x)"),
				same("f_t^2(x)"),
				same("f_t'(x)"),
				same("f'^2(x)"),
				same("f_t'^2(x)"),
				same("f_(s+t)''^2(x)"),
				same("x_(s+t)''"),
				same("(x-1-2)^2"),
				same("(a,b)"),
				same("(a,b]"),
				same("[a,b)"),
				same("[a,b]"),
				same("{a,b,c}"),
				same("{a}"),
				same("[a,b,c] + (a,b]"),
				same("((a,b),c)"),
				same("a,b,c"),
				same("x=y=z"),
				same("x>y>z"),
				Arguments.of("x>=y", "x≥y"),
				Arguments.of("x>y>=z", "x>y≥z"),
				Arguments.of("x<=y<z", "x≤y<z"),
				Arguments.of("x<y<=z", "x<y≤z"),
				Arguments.of("x != y", "x≠y"),
				Arguments.of("A union B", "A ∪ B"),
				same("C = A ∩ B"),
				Arguments.of("A=1 & B=2", "(A=1) and (B=2)"),
				same("(A and B) or C"),
				same("A and (B or C)"),
				same("not(A and B)"),
				same("(A and B) < C"),
				same("(not A) = B"),
				same("(A and B) > (C and D) > (E and F)"),
				same("(A and B) ∪ (C and D)"),
				Arguments.of("x/y/z/w", "((x/y)/z)/w"),
				Arguments.of("x(x-1)/z", "(x(x-1))/z"),
				Arguments.of("A && B or C", "(A and B) or C"),
				Arguments.of("!A or B", "(not A) or B"),
				Arguments.of("A=1 or B=x/y", "(A=1) or (B=x/y)"),
				Arguments.of("x elementof (a,b)", "x ∈ (a,b)"),
				Arguments.of("(a,b) notcontainselement x", "(a,b) ∌ x"),
				Arguments.of("(a,b) notsuperset (c,d)", "(a,b) ⊅ (c,d)"),
				Arguments.of("2 * 3", "2*3"),
				Arguments.of("x 2", "x*2"),
				same("-(xy)"),
				same("a-xy"),
				Arguments.of("a+(-x)y", "a+(-xy)"),
				same("-(x/y)"),
				same("a-x/y"),
				Arguments.of("a+(-x)/y", "a+(-x/y)"),
				same("a*|b|"),
				same("|a|*|b|"),
				same("2*|x|^2"),
				Arguments.of("1E999", "∞"),
				same("dy/dx"),
				same("d^2y/dx^2"),
				Arguments.of("alpha mu chi", "αμχ"));
	}

	private static Arguments same(String input) {
		return Arguments.of(input, input);
	}

	@ParameterizedTest(name = "{0}")
	@MethodSource("roundTrips")
	void printsWithMinimalGrouping(String input, String expected) {
		assertThat(withoutSpaces(roundTrip(input))).isEqualTo(withoutSpaces(expected));
	}

	@ParameterizedTest(name = "{0}")
	@MethodSource("roundTrips")
	void printedTextIsStable(String input, String expected) {
		String once = roundTrip(input);

		assertThat(roundTrip(once)).isEqualTo(once);
	}

	@ParameterizedTest(name = "{0}")
	@MethodSource("roundTrips")
	void printedTextParsesToTheSameTree(String input, String expected) {
		MathNode tree = parser.convert(input);

		assertThat(parser.convert(printer.convert(tree))).isEqualTo(tree);
	}

	@Test
	void usesCanonicalSpacing() {
		assertThat(roundTrip("1-x+y*z")).isEqualTo("1 - x + y z");
		assertThat(roundTrip("(1,2]")).isEqualTo("( 1, 2 ]");
		assertThat(roundTrip("A&B*|x|")).isEqualTo("A and (B * |x|)");
		assertThat(roundTrip("-(xy)+a")).isEqualTo("- (x y) + a");
	}

	@Nested
	@DisplayName("ASCII output")
	class AsciiOutput {

		private final TextPrinter ascii = new TextPrinter(SyntaxOptions.builder().outputUnicode(false).build());

		@Test
		void spellsOutRelationsAndNames() {
			assertThat(ascii.convert(parser.convert("x ≥ y"))).isEqualTo("x >= y");
			assertThat(ascii.convert(parser.convert("x≤y<z"))).isEqualTo("x <= y < z");
			assertThat(ascii.convert(parser.convert("x ≠ y"))).isEqualTo("x != y");
			assertThat(ascii.convert(parser.convert("A ∩ B"))).isEqualTo("A intersect B");
			assertThat(ascii.convert(parser.convert("A ∪ B"))).isEqualTo("A union B");
			assertThat(ascii.convert(parser.convert("x ∉ A"))).isEqualTo("x notelementof A");
			assertThat(ascii.convert(parser.convert("θ + ∞"))).isEqualTo("theta + infinity");
		}

		@Test
		void asciiOutputParsesBack() {
			for (String input : new String[] {"x≠y", "A ⊂ B", "A ∋ x", "π r^2 ≤ oo", "x ∈ (a,b]"}) {
				MathNode tree = parser.convert(input);

				assertThat(parser.convert(ascii.convert(tree))).as(input).isEqualTo(tree);
			}
		}
	}

	@Nested
	@DisplayName("Trees without a text parse")
	class BuiltTrees {

		@Test
		void printsMatricesAsNestedArrays() {
			MathNode matrix = AstJsonMapper.fromJsonString(
					"['matrix',['tuple',2,2],['tuple',['tuple',1,2],['tuple',3,['-','x']]]]");

			assertThat(printer.convert(matrix)).isEqualTo("[ [ 1, 2 ], [ 3, - x ] ]");
		}

		@Test
		void printsNonIntegralNumbers() {
			assertThat(printer.convert(AstJsonMapper.fromJsonString("['*',0.5,'x']"))).isEqualTo("0.5 x");
			assertThat(printer.convert(AstJsonMapper.fromJsonString("['+',1.0E20,1]"))).isEqualTo("1.0E20 + 1");
		}

		@Test
		void separatesAFunctionNameFromAFollowingGroup() {
			MathNode tree = AstJsonMapper.fromJsonString("['*','f',['+','x',1]]");

			String printed = printer.convert(tree);

			assertThat(printed).isEqualTo("f * (x + 1)");
			assertThat(parser.convert(printed)).isEqualTo(tree);
		}

		@Test
		void keepsAQuotientOfNamesApartFromADerivative() {
			TextParser unsplit = new TextParser(SyntaxOptions.builder().splitSymbols(false).build());
			MathNode quotient = unsplit.convert("(dy)/(dx)");

			String printed = printer.convert(quotient);

			assertThat(quotient).isEqualTo(AstJsonMapper.fromJsonString("['/','dy','dx']"));
			assertThat(printed).isEqualTo("dy/(dx)");
			assertThat(unsplit.convert(printed)).isEqualTo(quotient);
			assertThat(printer.convert(unsplit.convert("(dy)/(dx^2)"))).isEqualTo("dy/(dx^2)");
		}

		@Test
		void groupsASumTermThatStartsWithAMinus() {
			MathNode tree = AstJsonMapper.fromJsonString("['+','a',['*',['-','x'],'y']]");

			String printed = printer.convert(tree);

			assertThat(printed).isEqualTo("a + (- x y)");
			assertThat(parser.convert(printed)).isEqualTo(tree);
		}

		@Test
		void rejectsNullTree() {
			assertThatThrownBy(() -> printer.convert(null)).isInstanceOf(NullPointerException.class);
		}
	}
}
