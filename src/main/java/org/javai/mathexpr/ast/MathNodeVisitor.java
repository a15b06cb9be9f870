package org.javai.mathexpr.ast;

/**
 * Visitor over the four node variants.
 *
 * @param <R> the result type
 */
public interface MathNodeVisitor<R> {

	R visitNumber(MathNode.Num node);

	R visitSymbol(MathNode.Symbol node);

	R visitBoolean(MathNode.Bool node);

	R visitApply(MathNode.Apply node);
}
