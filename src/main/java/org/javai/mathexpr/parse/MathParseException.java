package org.javai.mathexpr.parse;

/**
 * Raised when input cannot be parsed. Carries the error category and the absolute offset
 * of the offending token.
 */
public class MathParseException extends RuntimeException {

	private final ParseErrorKind kind;
	private final String reason;
	private final int location;

	public MathParseException(ParseErrorKind kind, String reason, int location) {
		super(reason + " at position " + location);
		this.kind = kind;
		this.reason = reason;
		this.location = location;
	}

	public ParseErrorKind kind() {
		return kind;
	}

	/**
	 * @return the message without the position suffix
	 */
	public String reason() {
		return reason;
	}

	public int location() {
		return location;
	}
}
