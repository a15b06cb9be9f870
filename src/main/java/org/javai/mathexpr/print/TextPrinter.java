package org.javai.mathexpr.print;

import static java.util.Map.entry;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.javai.mathexpr.ast.MathNode;
import org.javai.mathexpr.ast.Operator;
import org.javai.mathexpr.config.SyntaxOptions;

/**
 * Prints trees in the plain-text syntax read by {@link org.javai.mathexpr.parse.TextParser}.
 * With {@link SyntaxOptions#outputUnicode()} set, Greek names, infinity and relation
 * operators come out as glyphs; otherwise as ASCII keywords.
 */
public class TextPrinter extends AbstractMathPrinter {

	private static final Pattern DIFFERENTIAL = Pattern.compile("d[a-zA-Z]\\b");

	private static final Map<String, String> GLYPHS = Map.ofEntries(
			entry("infinity", "∞"),
			entry("alpha", "α"),
			entry("beta", "β"),
			entry("Gamma", "Γ"),
			entry("gamma", "γ"),
			entry("Delta", "Δ"),
			entry("delta", "δ"),
			entry("epsilon", "ε"),
			entry("zeta", "ζ"),
			entry("eta", "η"),
			entry("Theta", "ϴ"),
			entry("theta", "θ"),
			entry("iota", "ι"),
			entry("kappa", "κ"),
			entry("Lambda", "Λ"),
			entry("lambda", "λ"),
			entry("mu", "μ"),
			entry("nu", "ν"),
			entry("Xi", "Ξ"),
			entry("xi", "ξ"),
			entry("Pi", "Π"),
			entry("pi", "π"),
			entry("rho", "ρ"),
			entry("Sigma", "Σ"),
			entry("sigma", "σ"),
			entry("tau", "τ"),
			entry("Upsilon", "Υ"),
			entry("upsilon", "υ"),
			entry("Phi", "Φ"),
			entry("phi", "ϕ"),
			entry("chi", "χ"),
			entry("Psi", "Ψ"),
			entry("psi", "ψ"),
			entry("Omega", "Ω"),
			entry("omega", "ω"));

	private static final Map<Operator, String> UNICODE_OPERATORS = new EnumMap<>(Operator.class);
	private static final Map<Operator, String> ASCII_OPERATORS = new EnumMap<>(Operator.class);

	static {
		for (Map<Operator, String> table : List.of(UNICODE_OPERATORS, ASCII_OPERATORS)) {
			table.put(Operator.AND, " and ");
			table.put(Operator.OR, " or ");
			table.put(Operator.NOT, "not ");
			table.put(Operator.EQUALS, " = ");
			table.put(Operator.LT, " < ");
			table.put(Operator.GT, " > ");
		}

		UNICODE_OPERATORS.put(Operator.LE, " ≤ ");
		UNICODE_OPERATORS.put(Operator.GE, " ≥ ");
		UNICODE_OPERATORS.put(Operator.NE, " ≠ ");
		UNICODE_OPERATORS.put(Operator.IN, " ∈ ");
		UNICODE_OPERATORS.put(Operator.NOTIN, " ∉ ");
		UNICODE_OPERATORS.put(Operator.NI, " ∋ ");
		UNICODE_OPERATORS.put(Operator.NOTNI, " ∌ ");
		UNICODE_OPERATORS.put(Operator.SUBSET, " ⊂ ");
		UNICODE_OPERATORS.put(Operator.NOTSUBSET, " ⊄ ");
		UNICODE_OPERATORS.put(Operator.SUPERSET, " ⊃ ");
		UNICODE_OPERATORS.put(Operator.NOTSUPERSET, " ⊅ ");
		UNICODE_OPERATORS.put(Operator.UNION, " ∪ ");
		UNICODE_OPERATORS.put(Operator.INTERSECT, " ∩ ");

		ASCII_OPERATORS.put(Operator.LE, " <= ");
		ASCII_OPERATORS.put(Operator.GE, " >= ");
		ASCII_OPERATORS.put(Operator.NE, " != ");
		ASCII_OPERATORS.put(Operator.IN, " elementof ");
		ASCII_OPERATORS.put(Operator.NOTIN, " notelementof ");
		ASCII_OPERATORS.put(Operator.NI, " containselement ");
		ASCII_OPERATORS.put(Operator.NOTNI, " notcontainselement ");
		ASCII_OPERATORS.put(Operator.SUBSET, " subset ");
		ASCII_OPERATORS.put(Operator.NOTSUBSET, " notsubset ");
		ASCII_OPERATORS.put(Operator.SUPERSET, " superset ");
		ASCII_OPERATORS.put(Operator.NOTSUPERSET, " notsuperset ");
		ASCII_OPERATORS.put(Operator.UNION, " union ");
		ASCII_OPERATORS.put(Operator.INTERSECT, " intersect ");
	}

	private final Map<Operator, String> operators;

	public TextPrinter() {
		this(SyntaxOptions.defaults());
	}

	public TextPrinter(SyntaxOptions options) {
		super(options);
		this.operators = options.outputUnicode() ? UNICODE_OPERATORS : ASCII_OPERATORS;
	}

	@Override
	protected String operatorSymbol(Operator operator) {
		String symbol = operators.get(operator);
		if (symbol == null) {
			throw new IllegalArgumentException("No text form for operator '" + operator.tag() + "'");
		}
		return symbol;
	}

	@Override
	protected String symbol(String name) {
		if (options.outputUnicode()) {
			return GLYPHS.getOrDefault(name, name);
		}
		return name;
	}

	@Override
	protected String parenthesize(String text) {
		return "(" + text + ")";
	}

	@Override
	protected boolean isParenthesized(String text) {
		return isEnclosed(text, "(", ")", "(", ")");
	}

	@Override
	protected boolean opensArgumentList(String text) {
		return text.startsWith("(");
	}

	@Override
	protected boolean opensAbsoluteValue(String text) {
		return text.startsWith("|");
	}

	@Override
	protected String implicitProductSeparator() {
		return " ";
	}

	@Override
	protected String explicitProductSeparator() {
		return " * ";
	}

	@Override
	protected String quotient(MathNode numerator, MathNode denominator) {
		String below = factor(denominator);
		// "dy/dx" would lex as a derivative
		if (DIFFERENTIAL.matcher(below).lookingAt()) {
			below = parenthesize(below);
		}
		return factor(numerator) + "/" + below;
	}

	@Override
	protected String superscript(MathNode exponent) {
		return "^" + parenthesizeUnlessSimple(exponent);
	}

	@Override
	protected String subscript(MathNode index) {
		return "_" + parenthesizeUnlessSimple(index);
	}

	@Override
	protected String collection(Operator operator, List<String> elements) {
		String joined = String.join(", ", elements);
		return switch (operator) {
			case ARRAY -> "[ " + joined + " ]";
			case SET -> "{ " + joined + " }";
			case LIST -> joined;
			default -> "( " + joined + " )";
		};
	}

	@Override
	protected String interval(String left, String right, boolean leftClosed, boolean rightClosed) {
		return (leftClosed ? "[ " : "( ") + left + ", " + right + (rightClosed ? " ]" : " )");
	}

	/**
	 * The text syntax has no matrix notation; rows come out as nested arrays.
	 */
	@Override
	protected String matrix(List<List<String>> rows) {
		List<String> printedRows = rows.stream()
				.map(row -> collection(Operator.ARRAY, row))
				.toList();
		return collection(Operator.ARRAY, printedRows);
	}

	@Override
	protected String absoluteValue(String argument) {
		return "|" + argument + "|";
	}

	@Override
	protected String derivative(int order, String dependent, String independent) {
		if (order == 0) {
			return "d" + dependent + "/d" + independent;
		}
		return "d^" + order + dependent + "/d" + independent + "^" + order;
	}
}
