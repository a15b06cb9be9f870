package org.javai.mathexpr.print;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.javai.mathexpr.ast.MathNode;
import org.javai.mathexpr.ast.MathNode.Apply;
import org.javai.mathexpr.ast.Operator;
import org.javai.mathexpr.config.SyntaxOptions;

/**
 * Prints trees as LaTeX read by {@link org.javai.mathexpr.parse.LatexParser}: quotients as
 * {@code \frac}, groups with {@code \left( \right)}, matrices as {@code bmatrix}, and
 * multi-letter names as commands when they are known or {@code \var{...}} otherwise.
 */
public class LatexPrinter extends AbstractMathPrinter {

	private static final Map<Operator, String> OPERATORS = new EnumMap<>(Operator.class);

	static {
		OPERATORS.put(Operator.AND, " \\land ");
		OPERATORS.put(Operator.OR, " \\lor ");
		OPERATORS.put(Operator.NOT, "\\lnot ");
		OPERATORS.put(Operator.EQUALS, " = ");
		OPERATORS.put(Operator.NE, " \\ne ");
		OPERATORS.put(Operator.LT, " < ");
		OPERATORS.put(Operator.GT, " > ");
		OPERATORS.put(Operator.LE, " \\le ");
		OPERATORS.put(Operator.GE, " \\ge ");
		OPERATORS.put(Operator.IN, " \\in ");
		OPERATORS.put(Operator.NOTIN, " \\notin ");
		OPERATORS.put(Operator.NI, " \\ni ");
		OPERATORS.put(Operator.NOTNI, " \\not\\ni ");
		OPERATORS.put(Operator.SUBSET, " \\subset ");
		OPERATORS.put(Operator.NOTSUBSET, " \\not\\subset ");
		OPERATORS.put(Operator.SUPERSET, " \\supset ");
		OPERATORS.put(Operator.NOTSUPERSET, " \\not\\supset ");
		OPERATORS.put(Operator.UNION, " \\cup ");
		OPERATORS.put(Operator.INTERSECT, " \\cap ");
	}

	public LatexPrinter() {
		this(SyntaxOptions.defaults());
	}

	public LatexPrinter(SyntaxOptions options) {
		super(options);
	}

	@Override
	protected String operatorSymbol(Operator operator) {
		String symbol = OPERATORS.get(operator);
		if (symbol == null) {
			throw new IllegalArgumentException("No LaTeX form for operator '" + operator.tag() + "'");
		}
		return symbol;
	}

	@Override
	protected String symbol(String name) {
		if (name.equals("infinity")) {
			return "\\infty";
		}
		if (name.length() == 1) {
			return name;
		}
		if (options.allowedLatexSymbols().contains(name) || options.isFunctionSymbol(name)) {
			return "\\" + name;
		}
		return "\\var{" + name + "}";
	}

	@Override
	protected String parenthesize(String text) {
		return "\\left(" + text + "\\right)";
	}

	@Override
	protected boolean isParenthesized(String text) {
		return isEnclosed(text, "\\left(", "\\right)", "\\left", "\\right");
	}

	@Override
	protected boolean opensArgumentList(String text) {
		return text.startsWith("\\left(") || text.startsWith("(");
	}

	@Override
	protected boolean opensAbsoluteValue(String text) {
		return text.startsWith("\\left|");
	}

	@Override
	protected boolean isInlineQuotient() {
		return false;
	}

	@Override
	protected String implicitProductSeparator() {
		return " \\, ";
	}

	@Override
	protected String explicitProductSeparator() {
		return " \\cdot ";
	}

	@Override
	protected String quotient(MathNode numerator, MathNode denominator) {
		return "\\frac{" + statement(numerator) + "}{" + statement(denominator) + "}";
	}

	@Override
	protected String compound(Apply apply) {
		if (apply.operator() == Operator.DIVIDE) {
			return quotient(apply.operand(0), apply.operand(1));
		}
		return super.compound(apply);
	}

	@Override
	protected String superscript(MathNode exponent) {
		return "^{" + statement(exponent) + "}";
	}

	@Override
	protected String subscript(MathNode index) {
		return "_{" + statement(index) + "}";
	}

	@Override
	protected String namedApplication(String function, MathNode argument) {
		if (function.equals("sqrt")) {
			return "\\sqrt{" + statement(argument) + "}";
		}
		return null;
	}

	@Override
	protected String collection(Operator operator, List<String> elements) {
		String joined = String.join(", ", elements);
		return switch (operator) {
			case ARRAY -> "\\left[ " + joined + " \\right]";
			case SET -> "\\left\\{ " + joined + " \\right\\}";
			case LIST -> joined;
			default -> "\\left( " + joined + " \\right)";
		};
	}

	@Override
	protected String interval(String left, String right, boolean leftClosed, boolean rightClosed) {
		return (leftClosed ? "\\left[ " : "\\left( ") + left + ", " + right
				+ (rightClosed ? " \\right]" : " \\right)");
	}

	@Override
	protected String matrix(List<List<String>> rows) {
		return rows.stream()
				.map(row -> String.join(" & ", row))
				.collect(Collectors.joining(" \\\\ ", "\\begin{bmatrix} ", " \\end{bmatrix}"));
	}

	@Override
	protected String absoluteValue(String argument) {
		return "\\left|" + argument + "\\right|";
	}

	@Override
	protected String derivative(int order, String dependent, String independent) {
		if (order == 0) {
			return "\\frac{d" + dependent + "}{d" + independent + "}";
		}
		return "\\frac{d^{" + order + "}" + dependent + "}{d" + independent + "^{" + order + "}}";
	}
}
