package org.javai.mathexpr.lexer;

import static org.javai.mathexpr.lexer.LexicalRule.of;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Rule table for the plain-text syntax. Order matters: longer and keyword forms come before
 * the generic identifier rule, which must stay last.
 */
public final class TextSyntaxRules {

	public static final Pattern WHITESPACE = Pattern.compile("\\s+");

	public static final Pattern DERIVATIVE = Pattern.compile("d([a-zA-Z])\\s*/\\s*d([a-zA-Z])\\b");

	public static final Pattern DERIVATIVE_MULT = Pattern.compile(
			"d\\^([1-9])([a-zA-Z])\\s*/\\s*d([a-zA-Z])\\^\\1\\b");

	public static final List<LexicalRule> RULES = List.of(
			of("[0-9]+(\\.[0-9]+)?(E[+\\-]?[0-9]+)?", TokenKind.NUMBER),
			of("\\.[0-9]+(E[+\\-]?[0-9]+)?", TokenKind.NUMBER),
			of("\\*\\*", TokenKind.POWER),
			of("[*·•⋅×]", TokenKind.TIMES),
			of("/", TokenKind.DIVIDE),
			// hyphens, dashes and minus signs
			of("[\\-֊־᠆‐-―⁻₋−⸺⸻﹘﹣－]", TokenKind.MINUS),
			of("\\+", TokenKind.PLUS),
			of("[\\^‸ʌ]", TokenKind.POWER),
			of("\\|", TokenKind.PIPE),
			of("\\(", TokenKind.LPAREN),
			of("\\)", TokenKind.RPAREN),
			of("\\[", TokenKind.LBRACKET),
			of("\\]", TokenKind.RBRACKET),
			of("\\{", TokenKind.LCURLY),
			of("\\}", TokenKind.RCURLY),
			of(",", TokenKind.COMMA),

			of("α", TokenKind.VARMULTICHAR, "alpha"),
			of("[βϐ]", TokenKind.VARMULTICHAR, "beta"),
			of("Γ", TokenKind.VARMULTICHAR, "Gamma"),
			of("γ", TokenKind.VARMULTICHAR, "gamma"),
			of("Δ", TokenKind.VARMULTICHAR, "Delta"),
			of("δ", TokenKind.VARMULTICHAR, "delta"),
			of("[εϵ]", TokenKind.VARMULTICHAR, "epsilon"),
			of("ζ", TokenKind.VARMULTICHAR, "zeta"),
			of("η", TokenKind.VARMULTICHAR, "eta"),
			of("[Θϴ]", TokenKind.VARMULTICHAR, "Theta"),
			of("[θᶿϑ]", TokenKind.VARMULTICHAR, "theta"),
			of("ι", TokenKind.VARMULTICHAR, "iota"),
			of("κ", TokenKind.VARMULTICHAR, "kappa"),
			of("Λ", TokenKind.VARMULTICHAR, "Lambda"),
			of("λ", TokenKind.VARMULTICHAR, "lambda"),
			of("[μµ]", TokenKind.VARMULTICHAR, "mu"),
			of("ν", TokenKind.VARMULTICHAR, "nu"),
			of("Ξ", TokenKind.VARMULTICHAR, "Xi"),
			of("ξ", TokenKind.VARMULTICHAR, "xi"),
			of("Π", TokenKind.VARMULTICHAR, "Pi"),
			of("[πϖ]", TokenKind.VARMULTICHAR, "pi"),
			of("[ρϱ]", TokenKind.VARMULTICHAR, "rho"),
			of("Σ", TokenKind.VARMULTICHAR, "Sigma"),
			of("[σς]", TokenKind.VARMULTICHAR, "sigma"),
			of("τ", TokenKind.VARMULTICHAR, "tau"),
			of("Υ", TokenKind.VARMULTICHAR, "Upsilon"),
			of("υ", TokenKind.VARMULTICHAR, "upsilon"),
			of("Φ", TokenKind.VARMULTICHAR, "Phi"),
			of("[φϕ]", TokenKind.VARMULTICHAR, "phi"),
			of("χ", TokenKind.VARMULTICHAR, "chi"),
			of("Ψ", TokenKind.VARMULTICHAR, "Psi"),
			of("ψ", TokenKind.VARMULTICHAR, "psi"),
			of("Ω", TokenKind.VARMULTICHAR, "Omega"),
			of("ω", TokenKind.VARMULTICHAR, "omega"),

			of("(oo|OO|infty|infinity|Infinity)\\b", TokenKind.INFINITY),
			of("∞", TokenKind.INFINITY),

			of("ℯ", TokenKind.VAR, "e"),

			of("♠", TokenKind.VARMULTICHAR, "spade"),
			of("♡", TokenKind.VARMULTICHAR, "heart"),
			of("♢", TokenKind.VARMULTICHAR, "diamond"),
			of("♣", TokenKind.VARMULTICHAR, "club"),
			of("★", TokenKind.VARMULTICHAR, "bigstar"),
			of("◯", TokenKind.VARMULTICHAR, "bigcirc"),
			of("◊", TokenKind.VARMULTICHAR, "lozenge"),
			of("△", TokenKind.VARMULTICHAR, "bigtriangleup"),
			of("▽", TokenKind.VARMULTICHAR, "bigtriangledown"),
			of("⧫", TokenKind.VARMULTICHAR, "blacklozenge"),
			of("■", TokenKind.VARMULTICHAR, "blacksquare"),
			of("▲", TokenKind.VARMULTICHAR, "blacktriangle"),
			of("▼", TokenKind.VARMULTICHAR, "blacktriangledown"),
			of("◀", TokenKind.VARMULTICHAR, "blacktriangleleft"),
			of("▶", TokenKind.VARMULTICHAR, "blacktriangleright"),
			of("□", TokenKind.VARMULTICHAR, "Box"),
			of("∘", TokenKind.VARMULTICHAR, "circ"),
			of("⋆", TokenKind.VARMULTICHAR, "star"),

			of("and\\b", TokenKind.AND),
			of("&&?", TokenKind.AND),
			of("∧", TokenKind.AND),
			of("or\\b", TokenKind.OR),
			of("∨", TokenKind.OR),
			of("not\\b", TokenKind.NOT),
			of("¬", TokenKind.NOT),

			of("[=᐀゠]", TokenKind.EQUALS),
			of("!=", TokenKind.NE),
			of("≠", TokenKind.NE),
			of("<=", TokenKind.LE),
			of("≤", TokenKind.LE),
			of(">=", TokenKind.GE),
			of("≥", TokenKind.GE),
			of("<", TokenKind.LT),
			of(">", TokenKind.GT),

			of("elementof\\b", TokenKind.IN),
			of("∈", TokenKind.IN),
			of("notelementof\\b", TokenKind.NOTIN),
			of("∉", TokenKind.NOTIN),
			of("containselement\\b", TokenKind.NI),
			of("∋", TokenKind.NI),
			of("notcontainselement\\b", TokenKind.NOTNI),
			of("∌", TokenKind.NOTNI),
			of("subset\\b", TokenKind.SUBSET),
			of("⊂", TokenKind.SUBSET),
			of("notsubset\\b", TokenKind.NOTSUBSET),
			of("⊄", TokenKind.NOTSUBSET),
			of("superset\\b", TokenKind.SUPERSET),
			of("⊃", TokenKind.SUPERSET),
			of("notsuperset\\b", TokenKind.NOTSUPERSET),
			of("⊅", TokenKind.NOTSUPERSET),
			of("union\\b", TokenKind.UNION),
			of("∪", TokenKind.UNION),
			of("intersect\\b", TokenKind.INTERSECT),
			of("∩", TokenKind.INTERSECT),

			of("!", TokenKind.BANG),
			of("'", TokenKind.PRIME),
			of("_", TokenKind.UNDERSCORE),

			new LexicalRule(DERIVATIVE, TokenKind.DERIVATIVE, null),
			new LexicalRule(DERIVATIVE_MULT, TokenKind.DERIVATIVEMULT, null),

			of("[a-zA-Z][a-zA-Z0-9]*", TokenKind.VAR)
	);

	private TextSyntaxRules() {
	}

	public static Tokenizer newTokenizer() {
		return new Tokenizer(RULES, WHITESPACE);
	}
}
