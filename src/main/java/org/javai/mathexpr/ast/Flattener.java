package org.javai.mathexpr.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes a raw parse tree by collapsing nested runs of an associative operator
 * ({@code + * and or}) into a single n-ary node, keeping operands in left-to-right order.
 * Any other operator stops the collapse. The rewrite is pure and idempotent.
 */
public final class Flattener implements MathNodeVisitor<MathNode> {

	private static final Flattener INSTANCE = new Flattener();

	private Flattener() {
	}

	public static MathNode flatten(MathNode tree) {
		return tree.accept(INSTANCE);
	}

	@Override
	public MathNode visitNumber(MathNode.Num node) {
		return node;
	}

	@Override
	public MathNode visitSymbol(MathNode.Symbol node) {
		return node;
	}

	@Override
	public MathNode visitBoolean(MathNode.Bool node) {
		return node;
	}

	@Override
	public MathNode visitApply(MathNode.Apply node) {
		Operator operator = node.operator();
		List<MathNode> operands = new ArrayList<>(node.arity());
		for (MathNode operand : node.operands()) {
			MathNode flat = operand.accept(this);
			if (operator.isAssociative() && flat.isApply(operator)) {
				operands.addAll(((MathNode.Apply) flat).operands());
			}
			else {
				operands.add(flat);
			}
		}
		if (operands.equals(node.operands())) {
			return node;
		}
		return MathNode.apply(operator, operands);
	}
}
