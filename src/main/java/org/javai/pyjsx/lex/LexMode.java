package org.javai.pyjsx.lex;

/**
 * Tokenization mode in effect at a source position.
 */
public enum LexMode {
	/** Ordinary host-language expression tokens. */
	CODE,
	/** Inside a tag: tag names, attributes and tag punctuation. */
	TAG,
	/** Element content between tags: string literals, holes and nested tags. */
	TEXT
}
