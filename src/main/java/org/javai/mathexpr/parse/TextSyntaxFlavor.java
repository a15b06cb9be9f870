package org.javai.mathexpr.parse;

import org.javai.mathexpr.ast.MathNode;
import org.javai.mathexpr.config.SyntaxOptions;
import org.javai.mathexpr.lexer.TextSyntaxRules;
import org.javai.mathexpr.lexer.Token;
import org.javai.mathexpr.lexer.TokenKind;
import org.javai.mathexpr.lexer.Tokenizer;

/**
 * Plain-text syntax: {@code ( [ {} } groups, identifiers split into letters unless exempt,
 * and Leibniz derivatives such as {@code dy/dx}.
 */
final class TextSyntaxFlavor implements SyntaxFlavor {

	static final TextSyntaxFlavor INSTANCE = new TextSyntaxFlavor();

	private TextSyntaxFlavor() {
	}

	@Override
	public String name() {
		return "text";
	}

	@Override
	public Tokenizer newTokenizer() {
		return TextSyntaxRules.newTokenizer();
	}

	@Override
	public Grouping grouping(TokenKind opener) {
		return switch (opener) {
			case LPAREN -> Grouping.PARENTHESES;
			case LBRACKET -> Grouping.BRACKETS;
			case LCURLY -> Grouping.SET_BRACES;
			default -> null;
		};
	}

	@Override
	public TokenKind argumentListCloser(TokenKind opener) {
		return opener == TokenKind.LPAREN ? TokenKind.RPAREN : null;
	}

	@Override
	public String symbolName(ParseCursor cursor, SyntaxOptions options) {
		return cursor.token().text();
	}

	@Override
	public boolean splits(Token token, String name, SyntaxOptions options) {
		return options.splitSymbols()
				&& token.is(TokenKind.VAR)
				&& name.length() > 1
				&& !options.unsplitSymbols().contains(name)
				&& name.chars().noneMatch(Character::isDigit);
	}

	@Override
	public MathNode leaf(GrammarEngine engine, ParseCursor cursor) {
		return switch (cursor.kind()) {
			case DERIVATIVE -> engine.derivative(cursor, TextSyntaxRules.DERIVATIVE);
			case DERIVATIVEMULT -> engine.derivative(cursor, TextSyntaxRules.DERIVATIVE_MULT);
			default -> null;
		};
	}
}
