package org.javai.mathexpr.parse;

/**
 * Categories of rejected input.
 */
public enum ParseErrorKind {
	/** no lexical rule matches the next character */
	UNRECOGNIZED_CHARACTER,
	UNEXPECTED_END_OF_INPUT,
	/** a token that cannot appear where it was found */
	UNEXPECTED_TOKEN,
	/** a closing or matching token is missing */
	EXPECTED_TOKEN,
	/** a LaTeX command or environment name that is not configured */
	UNKNOWN_IDENTIFIER,
	MALFORMED_ENVIRONMENT,
	/** the input nests more deeply than the configured limit */
	NESTING_TOO_DEEP
}
