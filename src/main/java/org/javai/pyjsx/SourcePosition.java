package org.javai.pyjsx;

/**
 * A location in a source unit.
 *
 * @param offset zero-based character offset
 * @param line one-based line number
 * @param column one-based column number
 */
public record SourcePosition(int offset, int line, int column) {

	@Override
	public String toString() {
		return line + ":" + column;
	}
}
