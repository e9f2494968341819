package org.javai.pyjsx.markup;

import org.javai.pyjsx.ast.Expr;

/**
 * Value of a markup attribute: a quoted string or an expression hole.
 */
public sealed interface AttributeValue permits MarkupNode.TextLiteral, MarkupNode.ExpressionHole {

	/**
	 * The host expression this value evaluates to.
	 */
	default Expr expr() {
		if (this instanceof MarkupNode.TextLiteral text) {
			return text.value();
		}
		return ((MarkupNode.ExpressionHole) this).expression();
	}
}
