package org.javai.mathexpr.ast;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Canonical expression tree. Leaves are numbers, symbols and booleans; every interior node
 * is an {@link Apply} of an {@link Operator} to its operands. Operand counts and shapes are
 * checked when an {@code Apply} is built, so a malformed tree cannot be constructed.
 * <p>
 * {@code toString()} renders the array form used by {@link AstJsonMapper}, e.g.
 * {@code ["+",1,"x"]}.
 */
public sealed interface MathNode {

	<R> R accept(MathNodeVisitor<R> visitor);

	static Num number(double value) {
		return new Num(value);
	}

	static Symbol symbol(String name) {
		return new Symbol(name);
	}

	static Bool bool(boolean value) {
		return new Bool(value);
	}

	static Apply apply(Operator operator, MathNode... operands) {
		return new Apply(operator, Arrays.asList(operands));
	}

	static Apply apply(Operator operator, List<? extends MathNode> operands) {
		return new Apply(operator, List.copyOf(operands));
	}

	/**
	 * @return true when this node is an {@link Apply} of the given operator
	 */
	default boolean isApply(Operator operator) {
		return this instanceof Apply apply && apply.operator() == operator;
	}

	/**
	 * @return true when this node is the symbol with the given name
	 */
	default boolean isSymbol(String name) {
		return this instanceof Symbol symbol && symbol.name().equals(name);
	}

	record Num(double value) implements MathNode {

		@Override
		public <R> R accept(MathNodeVisitor<R> visitor) {
			return visitor.visitNumber(this);
		}

		/**
		 * @return true when the value is a whole number small enough to print without an exponent
		 */
		public boolean isIntegral() {
			return value == Math.rint(value) && Math.abs(value) < 1e15;
		}

		@Override
		public String toString() {
			return AstJsonMapper.toJsonString(this);
		}
	}

	record Symbol(String name) implements MathNode {

		public Symbol {
			Objects.requireNonNull(name, "name must not be null");
			if (name.isEmpty()) {
				throw new InvalidTreeException("Symbol name must not be empty");
			}
		}

		@Override
		public <R> R accept(MathNodeVisitor<R> visitor) {
			return visitor.visitSymbol(this);
		}

		@Override
		public String toString() {
			return AstJsonMapper.toJsonString(this);
		}
	}

	/**
	 * Boolean leaf. Only appears as a strictness flag of a chained relation or a closed flag of
	 * an interval.
	 */
	record Bool(boolean value) implements MathNode {

		@Override
		public <R> R accept(MathNodeVisitor<R> visitor) {
			return visitor.visitBoolean(this);
		}

		@Override
		public String toString() {
			return AstJsonMapper.toJsonString(this);
		}
	}

	record Apply(Operator operator, List<MathNode> operands) implements MathNode {

		public Apply {
			Objects.requireNonNull(operator, "operator must not be null");
			Objects.requireNonNull(operands, "operands must not be null");
			operands = List.copyOf(operands);
			operator.checkOperands(operands);
		}

		public MathNode operand(int index) {
			return operands.get(index);
		}

		public int arity() {
			return operands.size();
		}

		@Override
		public <R> R accept(MathNodeVisitor<R> visitor) {
			return visitor.visitApply(this);
		}

		@Override
		public String toString() {
			return AstJsonMapper.toJsonString(this);
		}
	}
}
