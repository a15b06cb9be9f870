package org.javai.mathexpr.parse;

import org.javai.mathexpr.ast.MathNode;
import org.javai.mathexpr.config.SyntaxOptions;
import org.javai.mathexpr.lexer.Token;
import org.javai.mathexpr.lexer.TokenKind;
import org.javai.mathexpr.lexer.Tokenizer;

/**
 * What distinguishes one concrete syntax from another on top of the shared
 * {@link GrammarEngine}: its rule table, its bracket pairs, how identifiers are named and
 * split, and the primaries only it knows about.
 */
interface SyntaxFlavor {

	/**
	 * @return a name for log output
	 */
	String name();

	Tokenizer newTokenizer();

	/**
	 * @return how a group opened by this token reads, or null if the token opens no group
	 */
	Grouping grouping(TokenKind opener);

	/**
	 * @return the token that closes an argument list opened by this token after a function
	 * name, or null if the token cannot open one
	 */
	TokenKind argumentListCloser(TokenKind opener);

	/**
	 * Resolves the symbol name of the identifier under the cursor without consuming it.
	 *
	 * @throws MathParseException if the identifier is not allowed
	 */
	String symbolName(ParseCursor cursor, SyntaxOptions options);

	/**
	 * @return whether the identifier token should be re-read as a product of single letters
	 */
	boolean splits(Token token, String name, SyntaxOptions options);

	/**
	 * Parses a primary specific to this syntax.
	 *
	 * @return the primary, or null if the current token does not start one
	 */
	MathNode leaf(GrammarEngine engine, ParseCursor cursor);
}
