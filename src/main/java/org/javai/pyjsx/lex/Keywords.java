package org.javai.pyjsx.lex;

import java.util.Set;

/**
 * Reserved words of the host language.
 */
public final class Keywords {

	private static final Set<String> KEYWORDS = Set.of(
			"False", "None", "True", "and", "as", "assert", "async", "await",
			"break", "class", "continue", "def", "del", "elif", "else", "except",
			"finally", "for", "from", "global", "if", "import", "in", "is",
			"lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try",
			"while", "with", "yield");

	private static final Set<String> CONSTANTS = Set.of("False", "None", "True");

	private Keywords() {
	}

	public static boolean isKeyword(String name) {
		return KEYWORDS.contains(name);
	}

	/**
	 * Keywords that are complete operands on their own.
	 */
	public static boolean isConstant(String name) {
		return CONSTANTS.contains(name);
	}
}
