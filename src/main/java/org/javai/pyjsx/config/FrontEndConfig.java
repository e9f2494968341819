package org.javai.pyjsx.config;

import org.javai.pyjsx.lex.Keywords;

/**
 * Settings of the markup front end.
 *
 * @param elementConstructor dotted name of the function element calls lower to
 * @param fragmentTag dotted name passed as the tag of fragments, or null for
 *        {@code None}
 */
public record FrontEndConfig(String elementConstructor, String fragmentTag) {

	public static final String DEFAULT_ELEMENT_CONSTRUCTOR = "jsx";

	public FrontEndConfig {
		checkDottedName("element constructor", elementConstructor);
		if (fragmentTag != null) {
			checkDottedName("fragment tag", fragmentTag);
		}
	}

	public static FrontEndConfig defaults() {
		return new FrontEndConfig(DEFAULT_ELEMENT_CONSTRUCTOR, null);
	}

	public FrontEndConfig withElementConstructor(String elementConstructor) {
		return new FrontEndConfig(elementConstructor, fragmentTag);
	}

	public FrontEndConfig withFragmentTag(String fragmentTag) {
		return new FrontEndConfig(elementConstructor, fragmentTag);
	}

	private static void checkDottedName(String what, String value) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("The " + what + " must not be blank");
		}
		for (String segment : value.split("\\.", -1)) {
			if (!isIdentifier(segment) || Keywords.isKeyword(segment)) {
				throw new IllegalArgumentException("Invalid " + what + " '" + value
						+ "': each segment must be an identifier");
			}
		}
	}

	private static boolean isIdentifier(String segment) {
		if (segment.isEmpty() || !(Character.isLetter(segment.charAt(0)) || segment.charAt(0) == '_')) {
			return false;
		}
		for (int i = 1; i < segment.length(); i++) {
			char c = segment.charAt(i);
			if (!Character.isLetterOrDigit(c) && c != '_') {
				return false;
			}
		}
		return true;
	}
}
