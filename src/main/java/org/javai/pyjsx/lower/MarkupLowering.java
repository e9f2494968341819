package org.javai.pyjsx.lower;

import java.util.ArrayList;
import java.util.List;
import org.javai.pyjsx.ast.Expr;
import org.javai.pyjsx.ast.Expr.Call;
import org.javai.pyjsx.ast.Expr.DictExpr;
import org.javai.pyjsx.ast.Expr.ListExpr;
import org.javai.pyjsx.ast.Expr.NoneLiteral;
import org.javai.pyjsx.ast.Expr.StringLiteral;
import org.javai.pyjsx.config.FrontEndConfig;
import org.javai.pyjsx.markup.MarkupAttribute;
import org.javai.pyjsx.markup.MarkupNode;
import org.javai.pyjsx.markup.MarkupNode.Element;
import org.javai.pyjsx.markup.MarkupNode.ExpressionHole;
import org.javai.pyjsx.markup.MarkupNode.Fragment;
import org.javai.pyjsx.markup.MarkupNode.TextLiteral;
import org.javai.pyjsx.markup.MarkupNodeVisitor;
import org.javai.pyjsx.markup.TagRef;

/**
 * Rewrites markup nodes into ordinary host AST.
 * <p>
 * An element becomes {@code ctor(tag, {attrs}, [children])}, where the tag is
 * a string for intrinsic elements and a name reference for components. A
 * fragment has the same shape with the fragment tag, {@code None} unless
 * configured otherwise. Text and holes are passed through as the expressions
 * they already hold. Attribute order and child order are kept.
 */
public final class MarkupLowering implements MarkupNodeVisitor<Expr> {

	private final Expr constructor;
	private final Expr fragmentTag;

	public MarkupLowering(FrontEndConfig config) {
		this.constructor = References.dotted(config.elementConstructor());
		this.fragmentTag = config.fragmentTag() == null
				? NoneLiteral.INSTANCE
				: References.dotted(config.fragmentTag());
	}

	public Expr lower(MarkupNode node) {
		return node.accept(this);
	}

	@Override
	public Expr visitElement(Element element) {
		return construct(tagExpr(element.tag()), element.attributes(), element.children());
	}

	@Override
	public Expr visitFragment(Fragment fragment) {
		return construct(fragmentTag, List.of(), fragment.children());
	}

	@Override
	public Expr visitText(TextLiteral text) {
		return text.value();
	}

	@Override
	public Expr visitHole(ExpressionHole hole) {
		return hole.expression();
	}

	private Expr construct(Expr tag, List<MarkupAttribute> attributes, List<MarkupNode> children) {
		List<Expr> keys = new ArrayList<>(attributes.size());
		List<Expr> values = new ArrayList<>(attributes.size());
		for (MarkupAttribute attribute : attributes) {
			keys.add(StringLiteral.of(attribute.name()));
			values.add(attribute.value().expr());
		}
		List<Expr> loweredChildren = new ArrayList<>(children.size());
		for (MarkupNode child : children) {
			loweredChildren.add(lower(child));
		}
		return new Call(constructor, List.of(tag, new DictExpr(keys, values), new ListExpr(loweredChildren)), List.of());
	}

	private static Expr tagExpr(TagRef tag) {
		if (tag instanceof TagRef.Intrinsic intrinsic) {
			return StringLiteral.of(intrinsic.name());
		}
		return References.path(((TagRef.Component) tag).path());
	}
}
