package org.javai.pyjsx.markup;

import java.util.Objects;

/**
 * {@code name=value} inside an opening tag.
 */
public record MarkupAttribute(String name, AttributeValue value) {

	public MarkupAttribute {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(value, "value must not be null");
	}
}
