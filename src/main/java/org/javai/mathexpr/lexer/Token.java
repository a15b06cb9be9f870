package org.javai.mathexpr.lexer;

/**
 * A lexed token.
 *
 * @param kind the token category
 * @param text the matched text, or the canonical replacement a rule substitutes for it
 * @param position absolute offset of the first matched character in the input
 */
public record Token(TokenKind kind, String text, int position) {

	public boolean is(TokenKind other) {
		return kind == other;
	}

	@Override
	public String toString() {
		return switch (kind) {
			case EOF -> "EOF";
			case NUMBER, VAR, VARMULTICHAR, LATEXCOMMAND -> kind + "(" + text + ")";
			default -> "'" + text + "'";
		};
	}
}
