package org.javai.pyjsx.parse;

import org.javai.pyjsx.ast.Expr;

/**
 * Entry points of the host expression grammar that the markup parser calls
 * back into. Implementations read from the same {@link ParseContext} as the
 * markup parser.
 */
public interface HostExpressionGrammar {

	/**
	 * Parses one complete host expression at the cursor. Called for the body
	 * of an expression hole, after its opening brace has been consumed; the
	 * closing brace is left for the caller.
	 */
	Expr parseExpression();

	/**
	 * Parses the string literal at the cursor, adjacent literals concatenated.
	 *
	 * @return a {@link Expr.StringLiteral} or an {@link Expr.FormattedString}
	 */
	Expr parseStringLiteral();
}
