package org.javai.pyjsx.markup;

import java.util.List;
import java.util.Objects;

/**
 * The tag of an element.
 * <p>
 * A single identifier starting with a lowercase letter names an intrinsic
 * element ({@code div}); anything else, a capitalised identifier or a dotted
 * path, refers to a component resolved at runtime.
 */
public sealed interface TagRef {

	/**
	 * The tag as written in source, segments joined with dots.
	 */
	String spelling();

	/**
	 * Classifies a tag from its dotted segments.
	 */
	static TagRef of(List<String> segments) {
		if (segments.isEmpty()) {
			throw new IllegalArgumentException("Tag name must have at least one segment");
		}
		String first = segments.get(0);
		if (segments.size() == 1 && !first.isEmpty() && Character.isLowerCase(first.charAt(0))) {
			return new Intrinsic(first);
		}
		return new Component(segments);
	}

	record Intrinsic(String name) implements TagRef {
		public Intrinsic {
			Objects.requireNonNull(name, "name must not be null");
		}

		@Override
		public String spelling() {
			return name;
		}
	}

	record Component(List<String> path) implements TagRef {
		public Component {
			path = List.copyOf(path);
			if (path.isEmpty()) {
				throw new IllegalArgumentException("Component path must not be empty");
			}
		}

		@Override
		public String spelling() {
			return String.join(".", path);
		}
	}
}
