package org.javai.mathexpr.parse;

import static org.javai.mathexpr.ast.MathNode.apply;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import org.javai.mathexpr.ast.MathNode;
import org.javai.mathexpr.ast.Operator;
import org.javai.mathexpr.config.SyntaxOptions;
import org.javai.mathexpr.lexer.LatexSyntaxRules;
import org.javai.mathexpr.lexer.Token;
import org.javai.mathexpr.lexer.TokenKind;
import org.javai.mathexpr.lexer.Tokenizer;

/**
 * LaTeX syntax: {@code \frac}, {@code \sqrt}, matrix environments, {@code \command} names
 * checked against the configured sets, {@code {...}} as plain grouping and {@code \{...\}} as
 * set braces.
 */
final class LatexSyntaxFlavor implements SyntaxFlavor {

	static final LatexSyntaxFlavor INSTANCE = new LatexSyntaxFlavor();

	private static final Set<String> MATRIX_ENVIRONMENTS = Set.of("matrix", "pmatrix", "bmatrix");

	private static final Grouping CURLY_BRACES = new Grouping(TokenKind.RCURLY, null, Operator.TUPLE, false, false);

	private static final Grouping SET_BRACES = new Grouping(TokenKind.RBRACE, null, Operator.SET, true, false);

	private static final MathNode ZERO = MathNode.number(0);

	private LatexSyntaxFlavor() {
	}

	@Override
	public String name() {
		return "LaTeX";
	}

	@Override
	public Tokenizer newTokenizer() {
		return LatexSyntaxRules.newTokenizer();
	}

	@Override
	public Grouping grouping(TokenKind opener) {
		return switch (opener) {
			case LPAREN -> Grouping.PARENTHESES;
			case LBRACKET -> Grouping.BRACKETS;
			case LCURLY -> CURLY_BRACES;
			case LBRACE -> SET_BRACES;
			default -> null;
		};
	}

	@Override
	public TokenKind argumentListCloser(TokenKind opener) {
		return switch (opener) {
			case LPAREN -> TokenKind.RPAREN;
			case LCURLY -> TokenKind.RCURLY;
			default -> null;
		};
	}

	@Override
	public String symbolName(ParseCursor cursor, SyntaxOptions options) {
		Token token = cursor.token();
		return switch (token.kind()) {
			case VARMULTICHAR -> braced(token);
			case LATEXCOMMAND -> {
				String name = token.text().substring(1);
				if (!options.isFunctionSymbol(name) && !options.allowedLatexSymbols().contains(name)) {
					throw cursor.error(ParseErrorKind.UNKNOWN_IDENTIFIER, "Unrecognized LaTeX command " + token.text());
				}
				yield name;
			}
			default -> token.text();
		};
	}

	@Override
	public boolean splits(Token token, String name, SyntaxOptions options) {
		return false;
	}

	@Override
	public MathNode leaf(GrammarEngine engine, ParseCursor cursor) {
		return switch (cursor.kind()) {
			case FRAC -> fraction(engine, cursor);
			case SQRT -> root(engine, cursor);
			case BEGINENVIRONMENT -> environment(engine, cursor);
			case DERIVATIVE -> engine.derivative(cursor, LatexSyntaxRules.DERIVATIVE);
			case DERIVATIVEMULT -> engine.derivative(cursor, LatexSyntaxRules.DERIVATIVE_MULT);
			default -> null;
		};
	}

	private MathNode fraction(GrammarEngine engine, ParseCursor cursor) {
		cursor.advance();
		MathNode numerator = bracedStatement(engine, cursor);
		MathNode denominator = bracedStatement(engine, cursor);
		return apply(Operator.DIVIDE, numerator, denominator);
	}

	/**
	 * {@code \sqrt{a}} and {@code \sqrt[2]{a}} apply sqrt, {@code \sqrt[n]{a}} is a to the 1/n.
	 */
	private MathNode root(GrammarEngine engine, ParseCursor cursor) {
		cursor.advance();
		MathNode index = null;
		if (cursor.is(TokenKind.LBRACKET)) {
			cursor.advance();
			index = engine.statement(cursor);
			cursor.expect(TokenKind.RBRACKET, "Expected ]");
			cursor.advance();
		}
		MathNode radicand = bracedStatement(engine, cursor);
		if (index == null || index.equals(MathNode.number(2))) {
			return apply(Operator.APPLY, MathNode.symbol("sqrt"), radicand);
		}
		return apply(Operator.POWER, radicand, apply(Operator.DIVIDE, MathNode.number(1), index));
	}

	private MathNode bracedStatement(GrammarEngine engine, ParseCursor cursor) {
		cursor.expect(TokenKind.LCURLY, "Expected {");
		cursor.advance();
		MathNode statement = engine.statement(cursor);
		cursor.expect(TokenKind.RCURLY, "Expected }");
		cursor.advance();
		return statement;
	}

	/**
	 * Reads a matrix environment. Entries are separated by {@code &}, rows by {@code \\}. An
	 * entry left empty between two separators, or between a {@code &} and the closing
	 * {@code \end}, is zero; a separator right after {@code \begin} adds none. A trailing
	 * {@code \\} opens one more row, and short rows are padded with zeros.
	 */
	private MathNode environment(GrammarEngine engine, ParseCursor cursor) {
		String name = braced(cursor.token());
		if (!MATRIX_ENVIRONMENTS.contains(name)) {
			throw cursor.error(ParseErrorKind.UNKNOWN_IDENTIFIER, "Unrecognized environment " + name);
		}
		cursor.advance();

		List<List<MathNode>> rows = new ArrayList<>();
		List<MathNode> row = new ArrayList<>();
		// the separator just passed, or null once an entry follows it
		TokenKind separator = TokenKind.BEGINENVIRONMENT;
		while (!cursor.is(TokenKind.ENDENVIRONMENT)) {
			if (cursor.is(TokenKind.EOF)) {
				throw cursor.error(ParseErrorKind.MALFORMED_ENVIRONMENT, "Expected \\end{" + name + "}");
			}
			if (cursor.is(TokenKind.AMPERSAND) || cursor.is(TokenKind.LINEBREAK)) {
				if (isSeparator(separator)) {
					row.add(ZERO);
				}
				separator = cursor.kind();
				if (separator == TokenKind.LINEBREAK) {
					rows.add(row);
					row = new ArrayList<>();
				}
				cursor.advance();
			}
			else {
				if (separator == null) {
					throw cursor.unexpected();
				}
				row.add(engine.statement(cursor));
				separator = null;
			}
		}

		String closing = braced(cursor.token());
		if (!closing.equals(name)) {
			throw cursor.error(ParseErrorKind.MALFORMED_ENVIRONMENT, "Expected \\end{" + name + "}");
		}
		if (separator == TokenKind.AMPERSAND) {
			row.add(ZERO);
		}
		rows.add(row);
		if (rows.stream().allMatch(List::isEmpty)) {
			throw cursor.error(ParseErrorKind.MALFORMED_ENVIRONMENT, "Matrix has no entries");
		}
		cursor.advance();
		return matrix(rows);
	}

	private static boolean isSeparator(TokenKind kind) {
		return kind == TokenKind.AMPERSAND || kind == TokenKind.LINEBREAK;
	}

	private static MathNode matrix(List<List<MathNode>> rows) {
		int columns = rows.stream().mapToInt(List::size).max().orElse(0);
		List<MathNode> body = new ArrayList<>(rows.size());
		for (List<MathNode> row : rows) {
			List<MathNode> padded = new ArrayList<>(row);
			while (padded.size() < columns) {
				padded.add(ZERO);
			}
			body.add(apply(Operator.TUPLE, padded));
		}
		return apply(Operator.MATRIX,
				apply(Operator.TUPLE, MathNode.number(rows.size()), MathNode.number(columns)),
				apply(Operator.TUPLE, body));
	}

	private static String braced(Token token) {
		Matcher matcher = LatexSyntaxRules.ENVIRONMENT_NAME.matcher(token.text());
		if (!matcher.find()) {
			throw new IllegalStateException("No braced name in " + token);
		}
		return matcher.group(1);
	}
}
