package org.javai.mathexpr.parse;

import org.javai.mathexpr.ast.Operator;
import org.javai.mathexpr.lexer.TokenKind;

/**
 * How a bracket pair reads its comma list.
 *
 * @param close the matching closing token
 * @param intervalClose the mismatched closer that makes a two-element group an interval, or null
 * @param collection operator for two or more elements
 * @param keepsSingleton whether one element stays wrapped as a singleton set
 * @param closedOnLeft whether an interval opened by this token includes its left endpoint
 */
record Grouping(TokenKind close, TokenKind intervalClose, Operator collection, boolean keepsSingleton,
		boolean closedOnLeft) {

	static final Grouping PARENTHESES = new Grouping(TokenKind.RPAREN, TokenKind.RBRACKET, Operator.TUPLE, false, false);

	static final Grouping BRACKETS = new Grouping(TokenKind.RBRACKET, TokenKind.RPAREN, Operator.ARRAY, false, true);

	static final Grouping SET_BRACES = new Grouping(TokenKind.RCURLY, null, Operator.SET, true, false);

	String expectedMessage() {
		return "Expected " + close.display();
	}
}
