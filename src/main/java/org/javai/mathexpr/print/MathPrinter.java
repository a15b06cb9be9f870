package org.javai.mathexpr.print;

import org.javai.mathexpr.ast.MathNode;

/**
 * Renders an expression tree as source text that the matching parser reads back to the same
 * tree.
 */
public interface MathPrinter {

	String convert(MathNode tree);
}
