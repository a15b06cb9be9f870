package org.javai.mathexpr.parse;

import org.javai.mathexpr.ast.MathNode;

/**
 * Converts source text into a normalized expression tree.
 */
public interface MathParser {

	/**
	 * @throws MathParseException if the input is not a valid expression
	 */
	MathNode convert(String input);
}
