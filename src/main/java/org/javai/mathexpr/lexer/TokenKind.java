package org.javai.mathexpr.lexer;

/**
 * Token categories shared by the text and LaTeX rule tables. The display form is what
 * error messages show when a token of this kind is expected.
 */
public enum TokenKind {
	NUMBER("number"),
	VAR("variable"),
	VARMULTICHAR("variable"),
	INFINITY("infinity"),
	DERIVATIVE("derivative"),
	DERIVATIVEMULT("derivative"),
	LATEXCOMMAND("command"),

	PLUS("+"),
	MINUS("-"),
	TIMES("*"),
	DIVIDE("/"),
	POWER("^"),
	UNDERSCORE("_"),
	BANG("!"),
	PRIME("'"),
	PIPE("|"),
	COMMA(","),

	LPAREN("("),
	RPAREN(")"),
	LBRACKET("["),
	RBRACKET("]"),
	LCURLY("{"),
	RCURLY("}"),
	LBRACE("\\{"),
	RBRACE("\\}"),

	AND("and"),
	OR("or"),
	NOT("not"),
	EQUALS("="),
	NE("!="),
	LT("<"),
	GT(">"),
	LE("<="),
	GE(">="),
	IN("elementof"),
	NOTIN("notelementof"),
	NI("containselement"),
	NOTNI("notcontainselement"),
	SUBSET("subset"),
	NOTSUBSET("notsubset"),
	SUPERSET("superset"),
	NOTSUPERSET("notsuperset"),
	UNION("union"),
	INTERSECT("intersect"),

	FRAC("\\frac"),
	SQRT("\\sqrt"),
	BEGINENVIRONMENT("\\begin"),
	ENDENVIRONMENT("\\end"),
	AMPERSAND("&"),
	LINEBREAK("\\\\"),

	EOF("end of input"),
	INVALID("invalid symbol");

	private final String display;

	TokenKind(String display) {
		this.display = display;
	}

	public String display() {
		return display;
	}
}
