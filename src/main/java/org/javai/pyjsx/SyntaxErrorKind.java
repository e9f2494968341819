package org.javai.pyjsx;

/**
 * Which stage detected a syntax error. Both kinds are reported through
 * {@link PySyntaxException}; the kind is diagnostic detail only.
 */
public enum SyntaxErrorKind {
	/** Malformed tag punctuation, unterminated strings or holes. */
	LEX,
	/** Grammar violations: mismatched tags, bad attribute values, unexpected tokens. */
	PARSE
}
