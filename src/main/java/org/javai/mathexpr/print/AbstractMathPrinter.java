package org.javai.mathexpr.print;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.javai.mathexpr.ast.MathNode;
import org.javai.mathexpr.ast.MathNode.Apply;
import org.javai.mathexpr.ast.Operator;
import org.javai.mathexpr.config.SyntaxOptions;

/**
 * Walks a tree through the same precedence levels the parsers use (statement, relation,
 * expression, term, factor) and adds grouping only where a child would otherwise be read back
 * differently. Subclasses supply the concrete notation.
 */
public abstract class AbstractMathPrinter implements MathPrinter {

	protected final SyntaxOptions options;

	protected AbstractMathPrinter(SyntaxOptions options) {
		this.options = Objects.requireNonNull(options, "options must not be null");
	}

	@Override
	public String convert(MathNode tree) {
		Objects.requireNonNull(tree, "tree must not be null");
		return statement(tree);
	}

	// notation

	/**
	 * @return the infix or prefix spelling of a logical, relational or set operator
	 */
	protected abstract String operatorSymbol(Operator operator);

	protected abstract String symbol(String name);

	protected abstract String parenthesize(String text);

	protected abstract boolean isParenthesized(String text);

	/**
	 * @return whether the text starts with something that would be read as the argument list
	 * of a preceding function name
	 */
	protected abstract boolean opensArgumentList(String text);

	/**
	 * @return whether the text starts with an absolute value, which cannot follow a factor
	 * without an explicit operator
	 */
	protected abstract boolean opensAbsoluteValue(String text);

	protected abstract String implicitProductSeparator();

	protected abstract String explicitProductSeparator();

	protected abstract String quotient(MathNode numerator, MathNode denominator);

	/**
	 * Whether {@link #quotient} writes the numerator and denominator in line, so that a leading
	 * minus binds to the numerator alone.
	 */
	protected boolean isInlineQuotient() {
		return true;
	}

	protected abstract String superscript(MathNode exponent);

	protected abstract String subscript(MathNode index);

	protected abstract String collection(Operator operator, List<String> elements);

	protected abstract String interval(String left, String right, boolean leftClosed, boolean rightClosed);

	protected abstract String matrix(List<List<String>> rows);

	protected abstract String absoluteValue(String argument);

	/**
	 * @param order the derivative order, or 0 for a first derivative written without one
	 */
	protected abstract String derivative(int order, String dependent, String independent);

	/**
	 * Hook for functions with their own notation.
	 *
	 * @return the rendering, or null to use the generic application form
	 */
	protected String namedApplication(String function, MathNode argument) {
		return null;
	}

	/**
	 * Rendering of an operator node that has no notation at factor level.
	 */
	protected String compound(Apply apply) {
		return parenthesize(statement(apply));
	}

	// precedence levels

	protected String statement(MathNode tree) {
		if (tree.isApply(Operator.AND) || tree.isApply(Operator.OR)) {
			Apply apply = (Apply) tree;
			return apply.operands().stream()
					.map(operand -> clarify(singleStatement(operand)))
					.collect(Collectors.joining(operatorSymbol(apply.operator())));
		}
		return singleStatement(tree);
	}

	protected String singleStatement(MathNode tree) {
		if (tree instanceof Apply apply) {
			Operator operator = apply.operator();
			if (operator == Operator.NOT) {
				return operatorSymbol(operator) + clarify(singleStatement(apply.operand(0)));
			}
			if (isRelation(operator)) {
				return apply.operands().stream()
						.map(this::expression)
						.collect(Collectors.joining(operatorSymbol(operator)));
			}
			if (operator == Operator.LTS || operator == Operator.GTS) {
				return chain(apply);
			}
		}
		return expression(tree);
	}

	private String chain(Apply apply) {
		boolean ascending = apply.operator() == Operator.LTS;
		List<MathNode> terms = ((Apply) apply.operand(0)).operands();
		List<MathNode> strict = ((Apply) apply.operand(1)).operands();
		StringBuilder result = new StringBuilder(expression(terms.get(0)));
		for (int i = 0; i < strict.size(); i++) {
			boolean isStrict = ((MathNode.Bool) strict.get(i)).value();
			Operator comparison = ascending
					? (isStrict ? Operator.LT : Operator.LE)
					: (isStrict ? Operator.GT : Operator.GE);
			result.append(operatorSymbol(comparison)).append(expression(terms.get(i + 1)));
		}
		return result.toString();
	}

	protected String expression(MathNode tree) {
		if (tree.isApply(Operator.PLUS)) {
			List<MathNode> operands = ((Apply) tree).operands();
			StringBuilder result = new StringBuilder(term(operands.get(0)));
			for (MathNode operand : operands.subList(1, operands.size())) {
				result.append(addend(operand));
			}
			return result.toString();
		}
		if (tree.isApply(Operator.UNION) || tree.isApply(Operator.INTERSECT)) {
			Apply apply = (Apply) tree;
			return apply.operands().stream()
					.map(this::term)
					.collect(Collectors.joining(operatorSymbol(apply.operator())));
		}
		return term(tree);
	}

	/**
	 * A later term of a sum with its sign. {@code a - x y} reads back as a negated product, so
	 * a term printed with a minus of its own is grouped.
	 */
	private String addend(MathNode operand) {
		if (operand.isApply(Operator.NEGATE)) {
			return " - " + term(((Apply) operand).operand(0));
		}
		String rendered = term(operand);
		return " + " + (rendered.startsWith("-") ? parenthesize(rendered) : rendered);
	}

	protected String term(MathNode tree) {
		if (tree instanceof Apply apply) {
			switch (apply.operator()) {
				case NEGATE:
					return "- " + negated(apply.operand(0));
				case TIMES:
					return product(apply.operands());
				case DIVIDE:
					return quotient(apply.operand(0), apply.operand(1));
				default:
					break;
			}
		}
		return factor(tree);
	}

	/**
	 * {@code - x y} reads back as {@code (-x) y}.
	 */
	private String negated(MathNode operand) {
		String rendered = term(operand);
		boolean splits = operand.isApply(Operator.TIMES)
				|| (operand.isApply(Operator.DIVIDE) && isInlineQuotient());
		return splits ? parenthesize(rendered) : rendered;
	}

	private String product(List<MathNode> operands) {
		StringBuilder result = new StringBuilder(factor(operands.get(0)));
		for (int i = 1; i < operands.size(); i++) {
			String rendered = factor(operands.get(i));
			if (rendered.startsWith("-")) {
				rendered = parenthesize(rendered);
			}
			boolean explicit = Character.isDigit(rendered.charAt(0))
					|| opensAbsoluteValue(rendered)
					|| (opensArgumentList(rendered) && endsWithFunctionName(operands.get(i - 1)));
			result.append(explicit ? explicitProductSeparator() : implicitProductSeparator()).append(rendered);
		}
		return result.toString();
	}

	protected String factor(MathNode tree) {
		if (tree instanceof MathNode.Symbol symbol) {
			return symbol(symbol.name());
		}
		if (tree instanceof MathNode.Num number) {
			return number(number.value());
		}
		if (tree instanceof MathNode.Bool bool) {
			return String.valueOf(bool.value());
		}

		Apply apply = (Apply) tree;
		switch (apply.operator()) {
			case POWER:
				return decorated(apply.operand(0)) + superscript(apply.operand(1));
			case SUBSCRIPT:
				return parenthesizeUnlessSimple(apply.operand(0)) + subscript(apply.operand(1));
			case PRIME:
				return decorated(apply);
			case NEGATE:
				return "- " + factor(apply.operand(0));
			case TUPLE:
			case ARRAY:
			case SET:
			case LIST:
			case VECTOR:
				return collection(apply.operator(), statements(apply.operands()));
			case INTERVAL:
				return interval(apply);
			case MATRIX:
				List<List<String>> rows = new ArrayList<>();
				for (MathNode row : ((Apply) apply.operand(1)).operands()) {
					rows.add(statements(((Apply) row).operands()));
				}
				return matrix(rows);
			case DERIVATIVE_LEIBNIZ:
				return derivative(0, factor(apply.operand(0)), factor(apply.operand(1)));
			case DERIVATIVE_LEIBNIZ_MULT:
				return derivative((int) ((MathNode.Num) apply.operand(0)).value(),
						factor(apply.operand(1)), factor(apply.operand(2)));
			case APPLY:
				return application(apply);
			default:
				return compound(apply);
		}
	}

	private String interval(Apply apply) {
		List<MathNode> endpoints = ((Apply) apply.operand(0)).operands();
		List<MathNode> closed = ((Apply) apply.operand(1)).operands();
		return interval(statement(endpoints.get(0)), statement(endpoints.get(1)),
				((MathNode.Bool) closed.get(0)).value(), ((MathNode.Bool) closed.get(1)).value());
	}

	private String application(Apply apply) {
		MathNode function = apply.operand(0);
		MathNode argument = apply.operand(1);
		if (function.isSymbol("abs")) {
			return absoluteValue(statement(argument));
		}
		if (function.isSymbol("factorial")) {
			String base = factor(argument);
			if (!isSimple(argument, base) && !isSymbolSubscript(argument)) {
				base = parenthesize(base);
			}
			return base + "!";
		}
		if (function instanceof MathNode.Symbol symbol) {
			String special = namedApplication(symbol.name(), argument);
			if (special != null) {
				return special;
			}
		}
		String arguments = statement(argument);
		if (!argument.isApply(Operator.TUPLE)) {
			arguments = parenthesize(arguments);
		}
		return factor(function) + arguments;
	}

	/**
	 * Renders the base of a power or a primed expression. Primes are peeled off before
	 * deciding on grouping so that {@code f_t'^2(x)} keeps reading as a function call.
	 */
	private String decorated(MathNode node) {
		int primes = 0;
		MathNode base = node;
		while (base.isApply(Operator.PRIME)) {
			base = ((Apply) base).operand(0);
			primes++;
		}
		String rendered = factor(base);
		if (!isSimple(base, rendered) && !isSymbolSubscript(base)) {
			rendered = parenthesize(rendered);
		}
		return rendered + "'".repeat(primes);
	}

	protected String parenthesizeUnlessSimple(MathNode node) {
		String rendered = factor(node);
		return isSimple(node, rendered) ? rendered : parenthesize(rendered);
	}

	/**
	 * A rendering that can stand as an operand of {@code ^}, {@code _}, {@code '} or {@code !}
	 * without grouping.
	 */
	protected boolean isSimple(MathNode node, String rendered) {
		return rendered.length() == 1
				|| node instanceof MathNode.Num
				|| node instanceof MathNode.Symbol
				|| node.isApply(Operator.APPLY)
				|| isParenthesized(rendered);
	}

	private static boolean isSymbolSubscript(MathNode node) {
		return node instanceof Apply apply && apply.operator() == Operator.SUBSCRIPT
				&& apply.operand(0) instanceof MathNode.Symbol;
	}

	/**
	 * Whether a following argument list would be taken as the arguments of a function name
	 * that this node ends with.
	 */
	private boolean endsWithFunctionName(MathNode node) {
		if (node instanceof MathNode.Symbol symbol) {
			return options.isFunctionSymbol(symbol.name());
		}
		if (node instanceof Apply apply) {
			return switch (apply.operator()) {
				case PRIME -> endsWithFunctionName(apply.operand(0));
				case POWER, SUBSCRIPT -> endsWithFunctionName(apply.operand(0)) || endsWithFunctionName(apply.operand(1));
				default -> false;
			};
		}
		return false;
	}

	private List<String> statements(List<MathNode> nodes) {
		return nodes.stream().map(this::statement).toList();
	}

	private String clarify(String rendered) {
		return rendered.contains(" ") && !isParenthesized(rendered) ? parenthesize(rendered) : rendered;
	}

	/**
	 * @return whether {@code text} is one group: it starts with {@code open}, ends with
	 * {@code close}, and the opening delimiter is matched only by the last one
	 */
	protected static boolean isEnclosed(String text, String open, String close, String opener, String closer) {
		if (!text.startsWith(open) || !text.endsWith(close) || text.length() < open.length() + close.length()) {
			return false;
		}
		int depth = 0;
		int i = 0;
		while (i < text.length()) {
			if (text.startsWith(opener, i)) {
				depth++;
				i += opener.length();
			}
			else if (text.startsWith(closer, i)) {
				depth--;
				i += closer.length();
				if (depth == 0) {
					return i + close.length() - closer.length() == text.length();
				}
			}
			else {
				i++;
			}
		}
		return false;
	}

	protected String number(double value) {
		if (Double.isInfinite(value)) {
			return value > 0 ? symbol("infinity") : "- " + symbol("infinity");
		}
		if (value == Math.rint(value) && Math.abs(value) < 1e15) {
			return Long.toString((long) value);
		}
		return Double.toString(value);
	}

	private static boolean isRelation(Operator operator) {
		return switch (operator) {
			case EQUALS, NE, LT, GT, LE, GE, IN, NOTIN, NI, NOTNI, SUBSET, NOTSUBSET, SUPERSET, NOTSUPERSET -> true;
			default -> false;
		};
	}
}
