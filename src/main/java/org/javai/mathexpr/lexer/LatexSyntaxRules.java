package org.javai.mathexpr.lexer;

import static org.javai.mathexpr.lexer.LexicalRule.of;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Rule table for the LaTeX syntax. Letters lex one at a time; multi-letter names come from
 * {@code \command} or {@code \var{name}} tokens. Spacing commands such as {@code \,} and
 * {@code \quad} count as whitespace.
 */
public final class LatexSyntaxRules {

	public static final Pattern WHITESPACE = Pattern.compile(
			"(\\s|\\\\,|\\\\!|\\\\ |\\\\>|\\\\;|\\\\:|\\\\quad\\b|\\\\qquad\\b)+");

	public static final Pattern DERIVATIVE = Pattern.compile(
			"\\\\frac\\s*\\{\\s*d\\s*([a-zA-Z])\\s*}\\s*\\{\\s*d\\s*([a-zA-Z])\\s*}");

	public static final Pattern DERIVATIVE_MULT = Pattern.compile(
			"\\\\frac\\s*\\{\\s*d\\s*\\^\\s*\\{?\\s*([1-9])\\s*}?\\s*([a-zA-Z])\\s*}"
					+ "\\s*\\{\\s*d\\s*([a-zA-Z])\\s*\\^\\s*\\{?\\s*\\1\\s*}?\\s*}");

	public static final Pattern ENVIRONMENT_NAME = Pattern.compile("\\{\\s*([a-zA-Z0-9]+)\\s*}");

	private static final String OPEN_SIZE = "\\\\(?:left|bigl|Bigl|biggl|Biggl)\\s*";
	private static final String CLOSE_SIZE = "\\\\(?:right|bigr|Bigr|biggr|Biggr)\\s*";

	public static final List<LexicalRule> RULES = List.of(
			of("[0-9]+(\\.[0-9]+)?(E[+\\-]?[0-9]+)?", TokenKind.NUMBER),
			of("\\.[0-9]+(E[+\\-]?[0-9]+)?", TokenKind.NUMBER),
			of("\\*", TokenKind.TIMES),
			of("/", TokenKind.DIVIDE),
			of("-", TokenKind.MINUS),
			of("\\+", TokenKind.PLUS),
			of("\\^", TokenKind.POWER),
			of("\\(", TokenKind.LPAREN),
			of(OPEN_SIZE + "\\(", TokenKind.LPAREN),
			of("\\)", TokenKind.RPAREN),
			of(CLOSE_SIZE + "\\)", TokenKind.RPAREN),
			of("\\[", TokenKind.LBRACKET),
			of(OPEN_SIZE + "\\[", TokenKind.LBRACKET),
			of("]", TokenKind.RBRACKET),
			of(CLOSE_SIZE + "]", TokenKind.RBRACKET),
			of("\\|", TokenKind.PIPE),
			of(OPEN_SIZE + "\\|", TokenKind.PIPE),
			of(CLOSE_SIZE + "\\|", TokenKind.PIPE),
			of("\\\\(?:big|Big|bigg|Bigg)\\s*\\|", TokenKind.PIPE),
			of("\\{", TokenKind.LCURLY),
			of("}", TokenKind.RCURLY),
			of("\\\\\\{", TokenKind.LBRACE),
			of(OPEN_SIZE + "\\\\\\{", TokenKind.LBRACE),
			of("\\\\}", TokenKind.RBRACE),
			of(CLOSE_SIZE + "\\\\}", TokenKind.RBRACE),
			of("\\\\cdot\\b", TokenKind.TIMES),
			of("\\\\times\\b", TokenKind.TIMES),
			new LexicalRule(DERIVATIVE, TokenKind.DERIVATIVE, null),
			new LexicalRule(DERIVATIVE_MULT, TokenKind.DERIVATIVEMULT, null),
			of("\\\\frac\\b", TokenKind.FRAC),
			of(",", TokenKind.COMMA),

			of("\\\\vartheta\\b", TokenKind.LATEXCOMMAND, "\\theta"),
			of("\\\\varepsilon\\b", TokenKind.LATEXCOMMAND, "\\epsilon"),
			of("\\\\varrho\\b", TokenKind.LATEXCOMMAND, "\\rho"),
			of("\\\\varphi\\b", TokenKind.LATEXCOMMAND, "\\phi"),

			of("\\\\infty\\b", TokenKind.INFINITY),

			of("\\\\asin\\b", TokenKind.LATEXCOMMAND, "\\arcsin"),
			of("\\\\acos\\b", TokenKind.LATEXCOMMAND, "\\arccos"),
			of("\\\\atan\\b", TokenKind.LATEXCOMMAND, "\\arctan"),
			of("\\\\sqrt\\b", TokenKind.SQRT),

			of("\\\\(?:land|wedge)\\b", TokenKind.AND),
			of("\\\\(?:lor|vee)\\b", TokenKind.OR),
			of("\\\\lnot\\b", TokenKind.NOT),

			of("=", TokenKind.EQUALS),
			of("\\\\(?:neq|ne)\\b", TokenKind.NE),
			of("\\\\not\\s*=", TokenKind.NE),
			of("\\\\(?:leq|le)\\b", TokenKind.LE),
			of("\\\\(?:geq|ge)\\b", TokenKind.GE),
			of("<", TokenKind.LT),
			of("\\\\lt\\b", TokenKind.LT),
			of(">", TokenKind.GT),
			of("\\\\gt\\b", TokenKind.GT),

			of("\\\\in\\b", TokenKind.IN),
			of("\\\\notin\\b", TokenKind.NOTIN),
			of("\\\\not\\s*\\\\in\\b", TokenKind.NOTIN),
			of("\\\\ni\\b", TokenKind.NI),
			of("\\\\not\\s*\\\\ni\\b", TokenKind.NOTNI),
			of("\\\\subset\\b", TokenKind.SUBSET),
			of("\\\\not\\s*\\\\subset\\b", TokenKind.NOTSUBSET),
			of("\\\\supset\\b", TokenKind.SUPERSET),
			of("\\\\not\\s*\\\\supset\\b", TokenKind.NOTSUPERSET),
			of("\\\\cup\\b", TokenKind.UNION),
			of("\\\\cap\\b", TokenKind.INTERSECT),

			of("!", TokenKind.BANG),
			of("'", TokenKind.PRIME),
			of("_", TokenKind.UNDERSCORE),
			of("&", TokenKind.AMPERSAND),
			of("\\\\\\\\", TokenKind.LINEBREAK),

			of("\\\\begin\\s*\\{\\s*[a-zA-Z0-9]+\\s*}", TokenKind.BEGINENVIRONMENT),
			of("\\\\end\\s*\\{\\s*[a-zA-Z0-9]+\\s*}", TokenKind.ENDENVIRONMENT),
			of("\\\\var\\s*\\{\\s*[a-zA-Z0-9]+\\s*}", TokenKind.VARMULTICHAR),

			of("\\\\[a-zA-Z][a-zA-Z0-9]*", TokenKind.LATEXCOMMAND),
			of("[a-zA-Z]", TokenKind.VAR)
	);

	private LatexSyntaxRules() {
	}

	public static Tokenizer newTokenizer() {
		return new Tokenizer(RULES, WHITESPACE);
	}
}
