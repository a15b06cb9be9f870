package org.javai.mathexpr.parse;

import org.javai.mathexpr.lexer.Token;
import org.javai.mathexpr.lexer.TokenKind;
import org.javai.mathexpr.lexer.Tokenizer;

/**
 * Per-parse state: the tokenizer, the lookahead token and the recursion depth.
 */
final class ParseCursor {

	private final Tokenizer tokenizer;
	private final int maxDepth;
	private Token token;
	private int depth;

	ParseCursor(Tokenizer tokenizer, String input, int maxDepth) {
		this.tokenizer = tokenizer;
		this.maxDepth = maxDepth;
		tokenizer.setInput(input);
		advance();
	}

	Token token() {
		return token;
	}

	TokenKind kind() {
		return token.kind();
	}

	boolean is(TokenKind kind) {
		return token.kind() == kind;
	}

	void advance() {
		token = tokenizer.advance();
		if (token.is(TokenKind.INVALID)) {
			throw error(ParseErrorKind.UNRECOGNIZED_CHARACTER, "Invalid symbol '" + token.text() + "'");
		}
	}

	void expect(TokenKind kind, String reason) {
		if (!is(kind)) {
			throw error(ParseErrorKind.EXPECTED_TOKEN, reason);
		}
	}

	/**
	 * Pushes the current identifier back so that its letters are read one at a time, then
	 * advances to the first of them.
	 */
	void splitCurrentToken() {
		tokenizer.unputCharacters(token.text());
		advance();
	}

	void enter() {
		if (++depth > maxDepth) {
			throw error(ParseErrorKind.NESTING_TOO_DEEP, "Expression nests more than " + maxDepth + " levels deep");
		}
	}

	void exit() {
		exit(1);
	}

	void exit(int levels) {
		depth -= levels;
	}

	MathParseException error(ParseErrorKind kind, String reason) {
		return new MathParseException(kind, reason, token.position());
	}

	/**
	 * Error for a token that cannot start or continue the current production.
	 */
	MathParseException unexpected() {
		if (is(TokenKind.EOF)) {
			return error(ParseErrorKind.UNEXPECTED_END_OF_INPUT, "Unexpected end of input");
		}
		return error(ParseErrorKind.UNEXPECTED_TOKEN, "Invalid location of '" + token.text() + "'");
	}
}
