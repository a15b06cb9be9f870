package org.javai.mathexpr.ast;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of interior node tags. Each tag carries the name used in the array form
 * ({@code "+"}, {@code "apply"}, {@code "lts"}, ...) and an {@link Arity} that bounds its
 * operand count. Tags with a fixed internal structure (chained relations, intervals,
 * matrices, Leibniz derivatives) check that structure as well.
 */
public enum Operator {

	PLUS("+", Arity.ASSOCIATIVE),
	TIMES("*", Arity.ASSOCIATIVE),
	AND("and", Arity.ASSOCIATIVE),
	OR("or", Arity.ASSOCIATIVE),

	NEGATE("-", Arity.UNARY),
	NOT("not", Arity.UNARY),
	PRIME("prime", Arity.UNARY),

	DIVIDE("/", Arity.BINARY),
	POWER("^", Arity.BINARY),
	SUBSCRIPT("_", Arity.BINARY),
	APPLY("apply", Arity.BINARY),

	EQUALS("=", Arity.VARIADIC),
	NE("ne", Arity.BINARY),
	LT("<", Arity.BINARY),
	GT(">", Arity.BINARY),
	LE("le", Arity.BINARY),
	GE("ge", Arity.BINARY),
	LTS("lts", Arity.BINARY),
	GTS("gts", Arity.BINARY),

	IN("in", Arity.BINARY),
	NOTIN("notin", Arity.BINARY),
	NI("ni", Arity.BINARY),
	NOTNI("notni", Arity.BINARY),
	SUBSET("subset", Arity.BINARY),
	NOTSUBSET("notsubset", Arity.BINARY),
	SUPERSET("superset", Arity.BINARY),
	NOTSUPERSET("notsuperset", Arity.BINARY),
	UNION("union", Arity.VARIADIC),
	INTERSECT("intersect", Arity.VARIADIC),

	TUPLE("tuple", Arity.COLLECTION),
	ARRAY("array", Arity.COLLECTION),
	SET("set", Arity.COLLECTION),
	LIST("list", Arity.COLLECTION),
	VECTOR("vector", Arity.COLLECTION),

	INTERVAL("interval", Arity.BINARY),
	MATRIX("matrix", Arity.BINARY),

	DERIVATIVE_LEIBNIZ("derivative_leibniz", Arity.BINARY),
	DERIVATIVE_LEIBNIZ_MULT("derivative_leibniz_mult", Arity.TERNARY);

	/**
	 * Bounds on the number of operands.
	 */
	public enum Arity {
		UNARY(1, 1),
		BINARY(2, 2),
		TERNARY(3, 3),
		/** n-ary, never flattened */
		VARIADIC(2, Integer.MAX_VALUE),
		/** n-ary, nested runs collapse into one node */
		ASSOCIATIVE(2, Integer.MAX_VALUE),
		/** n-ary container; a single element is allowed (singleton sets, one-column matrix rows) */
		COLLECTION(1, Integer.MAX_VALUE);

		private final int min;
		private final int max;

		Arity(int min, int max) {
			this.min = min;
			this.max = max;
		}

		public boolean accepts(int count) {
			return count >= min && count <= max;
		}
	}

	private static final Map<String, Operator> BY_TAG = Arrays.stream(values())
			.collect(Collectors.toUnmodifiableMap(Operator::tag, Function.identity()));

	private final String tag;
	private final Arity arity;

	Operator(String tag, Arity arity) {
		this.tag = tag;
		this.arity = arity;
	}

	public String tag() {
		return tag;
	}

	public Arity arity() {
		return arity;
	}

	public boolean isAssociative() {
		return arity == Arity.ASSOCIATIVE;
	}

	public boolean isCollection() {
		return arity == Arity.COLLECTION;
	}

	/**
	 * Looks up an operator by its array-form tag.
	 *
	 * @throws InvalidTreeException if the tag is unknown
	 */
	public static Operator fromTag(String tag) {
		Operator operator = BY_TAG.get(tag);
		if (operator == null) {
			throw new InvalidTreeException("Unknown operator '" + tag + "'");
		}
		return operator;
	}

	void checkOperands(List<MathNode> operands) {
		if (!arity.accepts(operands.size())) {
			throw new InvalidTreeException("Operator '" + tag + "' does not accept "
					+ operands.size() + " operand(s)");
		}
		switch (this) {
			case APPLY -> {
				MathNode function = operands.get(0);
				if (!(function instanceof MathNode.Symbol) && !(function instanceof MathNode.Apply)) {
					throw new InvalidTreeException("Cannot apply " + function);
				}
			}
			case LTS, GTS -> {
				List<MathNode> terms = tupleElements(operands.get(0), "terms");
				List<MathNode> strict = tupleElements(operands.get(1), "strictness flags");
				if (terms.size() < 3 || strict.size() != terms.size() - 1) {
					throw new InvalidTreeException("Chained relation needs at least 3 terms and one flag per comparison");
				}
				requireBooleans(strict);
			}
			case INTERVAL -> {
				List<MathNode> endpoints = tupleElements(operands.get(0), "endpoints");
				List<MathNode> closed = tupleElements(operands.get(1), "closed flags");
				if (endpoints.size() != 2 || closed.size() != 2) {
					throw new InvalidTreeException("Interval needs two endpoints and two closed flags");
				}
				requireBooleans(closed);
			}
			case MATRIX -> checkMatrix(operands);
			case DERIVATIVE_LEIBNIZ -> requireLetters(operands);
			case DERIVATIVE_LEIBNIZ_MULT -> {
				if (!(operands.get(0) instanceof MathNode.Num order) || !order.isIntegral()
						|| order.value() < 1 || order.value() > 9) {
					throw new InvalidTreeException("Derivative order must be a digit from 1 to 9");
				}
				requireLetters(operands.subList(1, 3));
			}
			default -> {
			}
		}
	}

	private static void checkMatrix(List<MathNode> operands) {
		List<MathNode> size = tupleElements(operands.get(0), "matrix size");
		if (size.size() != 2 || !(size.get(0) instanceof MathNode.Num rows) || !rows.isIntegral()
				|| !(size.get(1) instanceof MathNode.Num columns) || !columns.isIntegral()) {
			throw new InvalidTreeException("Matrix size must be a tuple of two whole numbers");
		}
		List<MathNode> body = tupleElements(operands.get(1), "matrix body");
		if (body.size() != (int) rows.value()) {
			throw new InvalidTreeException("Matrix declares " + (int) rows.value() + " rows but has " + body.size());
		}
		for (MathNode row : body) {
			if (tupleElements(row, "matrix row").size() != (int) columns.value()) {
				throw new InvalidTreeException("Matrix row " + row + " does not have " + (int) columns.value() + " entries");
			}
		}
	}

	private static List<MathNode> tupleElements(MathNode node, String role) {
		if (node instanceof MathNode.Apply apply && apply.operator() == TUPLE) {
			return apply.operands();
		}
		throw new InvalidTreeException("Expected a tuple of " + role + " but found " + node);
	}

	private static void requireBooleans(List<MathNode> flags) {
		for (MathNode flag : flags) {
			if (!(flag instanceof MathNode.Bool)) {
				throw new InvalidTreeException("Expected a boolean flag but found " + flag);
			}
		}
	}

	private static void requireLetters(List<MathNode> variables) {
		for (MathNode variable : variables) {
			if (!(variable instanceof MathNode.Symbol symbol) || !symbol.name().matches("[a-zA-Z]")) {
				throw new InvalidTreeException("Derivative variable must be a single letter but found " + variable);
			}
		}
	}
}
