package org.javai.mathexpr.parse;

import static org.javai.mathexpr.ast.MathNode.apply;
import static org.javai.mathexpr.ast.MathNode.symbol;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.mathexpr.ast.Flattener;
import org.javai.mathexpr.ast.MathNode;
import org.javai.mathexpr.ast.Operator;
import org.javai.mathexpr.config.SyntaxOptions;
import org.javai.mathexpr.lexer.Token;
import org.javai.mathexpr.lexer.TokenKind;

/**
 * Recursive-descent parser shared by all syntaxes. Productions, loosest binding first:
 *
 * <pre>
 * statementList   := statement (',' statement)*
 * statement       := conjunction ('or' conjunction)*
 * conjunction     := relation ('and' relation)*
 * relation        := ('not' | '!') relation | expression (relationOp expression)*
 * expression      := '+'? term (('+' | '-' | 'union' | 'intersect') term)*
 * term            := factor (('*' | '/') factor | nonMinusFactor)*
 * factor          := '-' factor | '|' statement '|' postfix | nonMinusFactor
 * nonMinusFactor  := baseFactor postfix
 * postfix         := ('!' | ''')* ('^' factor)?
 * baseFactor      := (number | infinity | identifier | group | flavor leaf) ('_' baseFactor)?
 * </pre>
 *
 * Each call to {@link #parse(String)} works on its own {@link ParseCursor}, so an engine can be
 * shared. The raw tree is flattened before it is returned.
 */
final class GrammarEngine {

	private static final Map<TokenKind, Operator> RELATIONS = new EnumMap<>(TokenKind.class);

	static {
		RELATIONS.put(TokenKind.EQUALS, Operator.EQUALS);
		RELATIONS.put(TokenKind.NE, Operator.NE);
		RELATIONS.put(TokenKind.LT, Operator.LT);
		RELATIONS.put(TokenKind.GT, Operator.GT);
		RELATIONS.put(TokenKind.LE, Operator.LE);
		RELATIONS.put(TokenKind.GE, Operator.GE);
		RELATIONS.put(TokenKind.IN, Operator.IN);
		RELATIONS.put(TokenKind.NOTIN, Operator.NOTIN);
		RELATIONS.put(TokenKind.NI, Operator.NI);
		RELATIONS.put(TokenKind.NOTNI, Operator.NOTNI);
		RELATIONS.put(TokenKind.SUBSET, Operator.SUBSET);
		RELATIONS.put(TokenKind.NOTSUBSET, Operator.NOTSUBSET);
		RELATIONS.put(TokenKind.SUPERSET, Operator.SUPERSET);
		RELATIONS.put(TokenKind.NOTSUPERSET, Operator.NOTSUPERSET);
	}

	private final SyntaxFlavor flavor;
	private final SyntaxOptions options;

	GrammarEngine(SyntaxFlavor flavor, SyntaxOptions options) {
		this.flavor = Objects.requireNonNull(flavor, "flavor must not be null");
		this.options = Objects.requireNonNull(options, "options must not be null");
	}

	SyntaxFlavor flavor() {
		return flavor;
	}

	MathNode parse(String input) {
		Objects.requireNonNull(input, "input must not be null");
		ParseCursor cursor = new ParseCursor(flavor.newTokenizer(), input, options.maxNestingDepth());
		MathNode tree = statementList(cursor);
		if (!cursor.is(TokenKind.EOF)) {
			throw cursor.unexpected();
		}
		return Flattener.flatten(tree);
	}

	MathNode statementList(ParseCursor cursor) {
		List<MathNode> statements = new ArrayList<>();
		statements.add(statement(cursor));
		while (cursor.is(TokenKind.COMMA)) {
			cursor.advance();
			statements.add(statement(cursor));
		}
		return statements.size() == 1 ? statements.get(0) : apply(Operator.LIST, statements);
	}

	/*
	 * Every operator that wraps the left operand of a chain adds a level to the raw tree, so
	 * the chain loops below count against the nesting limit like recursion does.
	 */

	MathNode statement(ParseCursor cursor) {
		MathNode lhs = conjunction(cursor);
		int links = 0;
		try {
			while (cursor.is(TokenKind.OR)) {
				cursor.enter();
				links++;
				cursor.advance();
				lhs = apply(Operator.OR, lhs, conjunction(cursor));
			}
			return lhs;
		}
		finally {
			cursor.exit(links);
		}
	}

	private MathNode conjunction(ParseCursor cursor) {
		MathNode lhs = relation(cursor);
		int links = 0;
		try {
			while (cursor.is(TokenKind.AND)) {
				cursor.enter();
				links++;
				cursor.advance();
				lhs = apply(Operator.AND, lhs, relation(cursor));
			}
			return lhs;
		}
		finally {
			cursor.exit(links);
		}
	}

	private MathNode relation(ParseCursor cursor) {
		cursor.enter();
		int links = 0;
		try {
			if (cursor.is(TokenKind.NOT) || cursor.is(TokenKind.BANG)) {
				cursor.advance();
				return apply(Operator.NOT, relation(cursor));
			}

			MathNode lhs = expression(cursor);
			while (RELATIONS.containsKey(cursor.kind())) {
				cursor.enter();
				links++;
				TokenKind kind = cursor.kind();
				cursor.advance();
				MathNode rhs = expression(cursor);

				if (isAscending(kind) && isAscending(cursor.kind())) {
					lhs = chain(cursor, Operator.LTS, kind, lhs, rhs);
				}
				else if (isDescending(kind) && isDescending(cursor.kind())) {
					lhs = chain(cursor, Operator.GTS, kind, lhs, rhs);
				}
				else if (kind == TokenKind.EQUALS) {
					List<MathNode> sides = new ArrayList<>(List.of(lhs, rhs));
					while (cursor.is(TokenKind.EQUALS)) {
						cursor.advance();
						sides.add(expression(cursor));
					}
					lhs = apply(Operator.EQUALS, sides);
				}
				else {
					lhs = apply(RELATIONS.get(kind), lhs, rhs);
				}
			}
			return lhs;
		}
		finally {
			cursor.exit(links + 1);
		}
	}

	/**
	 * Collects a run of same-direction comparisons into one node holding the terms and, per
	 * comparison, whether it is strict.
	 */
	private MathNode chain(ParseCursor cursor, Operator operator, TokenKind first, MathNode lhs, MathNode rhs) {
		boolean ascending = operator == Operator.LTS;
		List<MathNode> terms = new ArrayList<>(List.of(lhs, rhs));
		List<MathNode> strict = new ArrayList<>();
		strict.add(MathNode.bool(isStrict(first)));
		while (ascending ? isAscending(cursor.kind()) : isDescending(cursor.kind())) {
			strict.add(MathNode.bool(isStrict(cursor.kind())));
			cursor.advance();
			terms.add(expression(cursor));
		}
		return apply(operator, apply(Operator.TUPLE, terms), apply(Operator.TUPLE, strict));
	}

	private static boolean isAscending(TokenKind kind) {
		return kind == TokenKind.LT || kind == TokenKind.LE;
	}

	private static boolean isDescending(TokenKind kind) {
		return kind == TokenKind.GT || kind == TokenKind.GE;
	}

	private static boolean isStrict(TokenKind kind) {
		return kind == TokenKind.LT || kind == TokenKind.GT;
	}

	private MathNode expression(ParseCursor cursor) {
		if (cursor.is(TokenKind.PLUS)) {
			cursor.advance();
		}
		MathNode lhs = term(cursor);
		int links = 0;
		try {
			while (cursor.is(TokenKind.PLUS) || cursor.is(TokenKind.MINUS)
					|| cursor.is(TokenKind.UNION) || cursor.is(TokenKind.INTERSECT)) {
				cursor.enter();
				links++;
				TokenKind kind = cursor.kind();
				cursor.advance();
				MathNode rhs = term(cursor);
				lhs = switch (kind) {
					case PLUS -> apply(Operator.PLUS, lhs, rhs);
					case MINUS -> apply(Operator.PLUS, lhs, apply(Operator.NEGATE, rhs));
					case UNION -> apply(Operator.UNION, lhs, rhs);
					default -> apply(Operator.INTERSECT, lhs, rhs);
				};
			}
			return lhs;
		}
		finally {
			cursor.exit(links);
		}
	}

	private MathNode term(ParseCursor cursor) {
		MathNode lhs = factor(cursor);
		int links = 0;
		try {
			while (true) {
				if (cursor.is(TokenKind.TIMES)) {
					cursor.enter();
					links++;
					cursor.advance();
					lhs = apply(Operator.TIMES, lhs, factor(cursor));
				}
				else if (cursor.is(TokenKind.DIVIDE)) {
					cursor.enter();
					links++;
					cursor.advance();
					lhs = apply(Operator.DIVIDE, lhs, factor(cursor));
				}
				else {
					// implicit multiplication
					MathNode rhs = nonMinusFactor(cursor);
					if (rhs == null) {
						return lhs;
					}
					cursor.enter();
					links++;
					lhs = apply(Operator.TIMES, lhs, rhs);
				}
			}
		}
		finally {
			cursor.exit(links);
		}
	}

	MathNode factor(ParseCursor cursor) {
		cursor.enter();
		try {
			if (cursor.is(TokenKind.MINUS)) {
				cursor.advance();
				return apply(Operator.NEGATE, factor(cursor));
			}
			if (cursor.is(TokenKind.PIPE)) {
				cursor.advance();
				MathNode inner = statement(cursor);
				cursor.expect(TokenKind.PIPE, "Expected |");
				cursor.advance();
				return postfix(cursor, apply(Operator.APPLY, symbol("abs"), inner));
			}
			MathNode result = nonMinusFactor(cursor);
			if (result == null) {
				throw cursor.unexpected();
			}
			return result;
		}
		finally {
			cursor.exit();
		}
	}

	/**
	 * @return the factor, or null if the current token cannot start one
	 */
	private MathNode nonMinusFactor(ParseCursor cursor) {
		return postfix(cursor, baseFactor(cursor));
	}

	private MathNode postfix(ParseCursor cursor, MathNode base) {
		MathNode result = base;
		if (cursor.is(TokenKind.BANG) || cursor.is(TokenKind.PRIME)) {
			if (result == null) {
				throw cursor.unexpected();
			}
			int links = 0;
			try {
				while (cursor.is(TokenKind.BANG) || cursor.is(TokenKind.PRIME)) {
					cursor.enter();
					links++;
					result = cursor.is(TokenKind.BANG)
							? apply(Operator.APPLY, symbol("factorial"), result)
							: apply(Operator.PRIME, result);
					cursor.advance();
				}
			}
			finally {
				cursor.exit(links);
			}
		}
		if (cursor.is(TokenKind.POWER)) {
			if (result == null) {
				throw cursor.unexpected();
			}
			cursor.advance();
			return apply(Operator.POWER, result, factor(cursor));
		}
		return result;
	}

	private MathNode baseFactor(ParseCursor cursor) {
		cursor.enter();
		try {
			MathNode result = flavor.leaf(this, cursor);
			if (result == null) {
				Token token = cursor.token();
				switch (token.kind()) {
					case NUMBER -> {
						double value = Double.parseDouble(token.text());
						// a literal past the double range reads as infinity
						result = Double.isInfinite(value) ? symbol("infinity") : MathNode.number(value);
						cursor.advance();
					}
					case INFINITY -> {
						result = symbol("infinity");
						cursor.advance();
					}
					case VAR, VARMULTICHAR, LATEXCOMMAND -> result = identifier(cursor);
					default -> {
						Grouping grouping = flavor.grouping(token.kind());
						if (grouping != null) {
							result = group(cursor, grouping);
						}
					}
				}
			}

			if (cursor.is(TokenKind.UNDERSCORE)) {
				if (result == null) {
					throw cursor.unexpected();
				}
				cursor.advance();
				result = apply(Operator.SUBSCRIPT, result, requiredBaseFactor(cursor));
			}
			return result;
		}
		finally {
			cursor.exit();
		}
	}

	private MathNode requiredBaseFactor(ParseCursor cursor) {
		MathNode result = baseFactor(cursor);
		if (result == null) {
			throw cursor.unexpected();
		}
		return result;
	}

	private MathNode identifier(ParseCursor cursor) {
		Token token = cursor.token();
		String name = flavor.symbolName(cursor, options);
		if (options.isFunctionSymbol(name)) {
			return function(cursor, name);
		}
		if (flavor.splits(token, name, options)) {
			cursor.splitCurrentToken();
			return baseFactor(cursor);
		}
		cursor.advance();
		return symbol(name);
	}

	/**
	 * A function name with optional subscript, primes and power, followed by an argument list,
	 * by an implicit argument (applied functions only) or by nothing, in which case the name is
	 * an ordinary symbol. An applied name is lower-cased; an unapplied one keeps its spelling.
	 */
	private MathNode function(ParseCursor cursor, String name) {
		boolean mustApply = options.isAppliedFunctionSymbol(name);
		MathNode function = symbol(name);
		cursor.advance();

		if (cursor.is(TokenKind.UNDERSCORE)) {
			cursor.advance();
			function = apply(Operator.SUBSCRIPT, function, requiredBaseFactor(cursor));
		}
		int primes = 0;
		while (cursor.is(TokenKind.PRIME)) {
			cursor.enter();
			primes++;
			function = apply(Operator.PRIME, function);
			cursor.advance();
		}
		cursor.exit(primes);
		if (cursor.is(TokenKind.POWER)) {
			cursor.advance();
			function = apply(Operator.POWER, function, factor(cursor));
		}

		TokenKind closer = flavor.argumentListCloser(cursor.kind());
		if (closer != null) {
			cursor.advance();
			MathNode arguments = statementList(cursor);
			cursor.expect(closer, "Expected " + closer.display());
			cursor.advance();
			if (arguments instanceof MathNode.Apply list && list.operator() == Operator.LIST) {
				arguments = apply(Operator.TUPLE, list.operands());
			}
			return apply(Operator.APPLY, renamed(function, name.toLowerCase(Locale.ROOT)), arguments);
		}
		if (mustApply) {
			if (!options.allowSimplifiedFunctionApplication()) {
				throw cursor.error(ParseErrorKind.EXPECTED_TOKEN, "Expected ( after function");
			}
			return apply(Operator.APPLY, renamed(function, name.toLowerCase(Locale.ROOT)), factor(cursor));
		}
		return function;
	}

	/**
	 * Replaces the name at the root of a decorated function such as {@code F_t'^2}.
	 */
	private static MathNode renamed(MathNode function, String name) {
		if (function instanceof MathNode.Apply decorated) {
			List<MathNode> operands = new ArrayList<>(decorated.operands());
			operands.set(0, renamed(operands.get(0), name));
			return apply(decorated.operator(), operands);
		}
		return symbol(name);
	}

	private MathNode group(ParseCursor cursor, Grouping grouping) {
		cursor.advance();
		MathNode inner = statementList(cursor);
		List<MathNode> elements = inner instanceof MathNode.Apply list && list.operator() == Operator.LIST
				? list.operands()
				: List.of(inner);

		MathNode result;
		if (cursor.is(grouping.close())) {
			if (elements.size() > 1) {
				result = apply(grouping.collection(), elements);
			}
			else if (grouping.keepsSingleton()) {
				result = apply(grouping.collection(), inner);
			}
			else {
				result = inner;
			}
		}
		else if (grouping.intervalClose() != null && elements.size() == 2) {
			cursor.expect(grouping.intervalClose(),
					"Expected " + grouping.close().display() + " or " + grouping.intervalClose().display());
			boolean left = grouping.closedOnLeft();
			result = apply(Operator.INTERVAL,
					apply(Operator.TUPLE, elements),
					apply(Operator.TUPLE, MathNode.bool(left), MathNode.bool(!left)));
		}
		else {
			throw cursor.error(ParseErrorKind.EXPECTED_TOKEN, grouping.expectedMessage());
		}
		cursor.advance();
		return result;
	}

	/**
	 * Builds a Leibniz derivative from the current token, whose text matches {@code pattern}
	 * with groups (y, x) or (order, y, x).
	 */
	MathNode derivative(ParseCursor cursor, Pattern pattern) {
		Matcher matcher = pattern.matcher(cursor.token().text());
		if (!matcher.matches()) {
			throw cursor.unexpected();
		}
		cursor.advance();
		if (matcher.groupCount() == 2) {
			return apply(Operator.DERIVATIVE_LEIBNIZ, symbol(matcher.group(1)), symbol(matcher.group(2)));
		}
		return apply(Operator.DERIVATIVE_LEIBNIZ_MULT,
				MathNode.number(Integer.parseInt(matcher.group(1))),
				symbol(matcher.group(2)),
				symbol(matcher.group(3)));
	}
}
