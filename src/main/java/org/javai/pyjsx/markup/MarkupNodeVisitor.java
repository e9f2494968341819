package org.javai.pyjsx.markup;

import org.javai.pyjsx.markup.MarkupNode.Element;
import org.javai.pyjsx.markup.MarkupNode.ExpressionHole;
import org.javai.pyjsx.markup.MarkupNode.Fragment;
import org.javai.pyjsx.markup.MarkupNode.TextLiteral;

/**
 * Visitor over markup nodes.
 *
 * @param <R> the result type
 */
public interface MarkupNodeVisitor<R> {

	R visitElement(Element element);

	R visitFragment(Fragment fragment);

	R visitText(TextLiteral text);

	R visitHole(ExpressionHole hole);
}
