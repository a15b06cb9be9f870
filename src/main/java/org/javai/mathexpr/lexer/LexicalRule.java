package org.javai.mathexpr.lexer;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One entry of a rule table: a pattern matched at the head of the remaining input, the kind
 * of token it produces and, optionally, the text the token carries instead of the match.
 */
public record LexicalRule(Pattern pattern, TokenKind kind, String replacement) {

	public LexicalRule {
		Objects.requireNonNull(pattern, "pattern must not be null");
		Objects.requireNonNull(kind, "kind must not be null");
	}

	public static LexicalRule of(String regex, TokenKind kind) {
		return new LexicalRule(Pattern.compile(regex), kind, null);
	}

	public static LexicalRule of(String regex, TokenKind kind, String replacement) {
		return new LexicalRule(Pattern.compile(regex), kind, replacement);
	}
}
