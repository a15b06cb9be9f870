package org.javai.mathexpr.lexer;

import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-driven scanner. Each {@link #advance()} skips whitespace, then tries the rules in table
 * order against the head of the remaining input and returns the first match. Text that was
 * consumed can be pushed back with {@link #unput(String)}; the location moves back by the same
 * amount so offsets keep pointing into the original input.
 * <p>
 * Instances hold cursor state and are meant for a single parse at a time.
 */
public class Tokenizer {

	private final List<LexicalRule> rules;
	private final Pattern whitespace;

	private String remaining = "";
	private int location;
	private int singleCharacterBudget;

	public Tokenizer(List<LexicalRule> rules, Pattern whitespace) {
		this.rules = List.copyOf(Objects.requireNonNull(rules, "rules must not be null"));
		this.whitespace = Objects.requireNonNull(whitespace, "whitespace must not be null");
	}

	public void setInput(String input) {
		Objects.requireNonNull(input, "input must not be null");
		this.remaining = input;
		this.location = 0;
		this.singleCharacterBudget = 0;
	}

	/**
	 * @return offset of the next unconsumed character
	 */
	public int location() {
		return location;
	}

	public Token advance() {
		Matcher blank = whitespace.matcher(remaining);
		blank.region(0, limit());
		if (blank.lookingAt()) {
			consume(blank.end());
		}
		if (remaining.isEmpty()) {
			return new Token(TokenKind.EOF, "", location);
		}

		int start = location;
		for (LexicalRule rule : rules) {
			Matcher matcher = rule.pattern().matcher(remaining);
			matcher.region(0, limit());
			if (matcher.lookingAt() && matcher.end() > 0) {
				String text = matcher.group();
				consume(matcher.end());
				return new Token(rule.kind(), rule.replacement() != null ? rule.replacement() : text, start);
			}
		}
		String offending = remaining.substring(0, Character.charCount(remaining.codePointAt(0)));
		return new Token(TokenKind.INVALID, offending, start);
	}

	/**
	 * Prepends text to the unconsumed input.
	 */
	public void unput(String text) {
		remaining = text + remaining;
		location -= text.length();
	}

	/**
	 * Prepends text so that each of its characters is lexed as a token of its own, which is how
	 * a multi-letter identifier is re-read as a product of single letters.
	 */
	public void unputCharacters(String text) {
		unput(text);
		singleCharacterBudget = text.length();
	}

	private int limit() {
		return singleCharacterBudget > 0 ? Math.min(1, remaining.length()) : remaining.length();
	}

	private void consume(int length) {
		remaining = remaining.substring(length);
		location += length;
		singleCharacterBudget = Math.max(0, singleCharacterBudget - length);
	}
}
