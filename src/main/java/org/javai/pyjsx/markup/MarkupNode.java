package org.javai.pyjsx.markup;

import java.util.List;
import java.util.Objects;
import org.javai.pyjsx.ast.Expr;

/**
 * Node of a parsed markup literal, before lowering.
 * <p>
 * These nodes exist only between the markup parser and the lowering pass. Text
 * children and attribute values hold host string nodes; holes hold fully
 * parsed host expressions.
 */
public sealed interface MarkupNode {

	<R> R accept(MarkupNodeVisitor<R> visitor);

	/**
	 * {@code <tag attr=...>children</tag>} or {@code <tag attr=... />}.
	 */
	record Element(TagRef tag, List<MarkupAttribute> attributes, List<MarkupNode> children) implements MarkupNode {
		public Element {
			Objects.requireNonNull(tag, "tag must not be null");
			attributes = List.copyOf(attributes);
			children = List.copyOf(children);
		}

		@Override
		public <R> R accept(MarkupNodeVisitor<R> visitor) {
			return visitor.visitElement(this);
		}
	}

	/**
	 * {@code <>children</>}: a tagless grouping of children.
	 */
	record Fragment(List<MarkupNode> children) implements MarkupNode {
		public Fragment {
			children = List.copyOf(children);
		}

		@Override
		public <R> R accept(MarkupNodeVisitor<R> visitor) {
			return visitor.visitFragment(this);
		}
	}

	/**
	 * A quoted string child or attribute value. The value is a
	 * {@link Expr.StringLiteral} or an {@link Expr.FormattedString}.
	 */
	record TextLiteral(Expr value) implements MarkupNode, AttributeValue {
		public TextLiteral {
			Objects.requireNonNull(value, "value must not be null");
		}

		@Override
		public <R> R accept(MarkupNodeVisitor<R> visitor) {
			return visitor.visitText(this);
		}
	}

	/**
	 * {@code {expression}} as a child or attribute value.
	 */
	record ExpressionHole(Expr expression) implements MarkupNode, AttributeValue {
		public ExpressionHole {
			Objects.requireNonNull(expression, "expression must not be null");
		}

		@Override
		public <R> R accept(MarkupNodeVisitor<R> visitor) {
			return visitor.visitHole(this);
		}
	}
}
