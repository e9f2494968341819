package org.javai.pyjsx.lower;

import java.util.Arrays;
import java.util.List;
import org.javai.pyjsx.ast.Expr;
import org.javai.pyjsx.ast.Expr.Attribute;
import org.javai.pyjsx.ast.Expr.Name;

/**
 * Builds name references: {@code a} as a {@link Name}, {@code a.b.c} as an
 * {@link Attribute} chain rooted at a {@link Name}.
 */
public final class References {

	private References() {
	}

	public static Expr dotted(String dottedName) {
		return path(Arrays.asList(dottedName.split("\\.", -1)));
	}

	public static Expr path(List<String> segments) {
		if (segments.isEmpty()) {
			throw new IllegalArgumentException("Reference path must not be empty");
		}
		Expr reference = new Name(segments.get(0));
		for (int i = 1; i < segments.size(); i++) {
			reference = new Attribute(reference, segments.get(i));
		}
		return reference;
	}
}
