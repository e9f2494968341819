package org.javai.pyjsx;

import java.util.Objects;

/**
 * Compile-time syntax error of the host language.
 * <p>
 * Markup literals report through this exception as well, so callers see one
 * error channel regardless of whether the problem was found in ordinary code,
 * inside a tag, or in an expression embedded in markup.
 */
public class PySyntaxException extends RuntimeException {

	private final SyntaxErrorKind kind;
	private final SourcePosition position;
	private final String detail;

	public PySyntaxException(SyntaxErrorKind kind, String message, SourcePosition position) {
		super("line " + position.line() + ":" + position.column() + " " + message);
		this.kind = Objects.requireNonNull(kind, "kind must not be null");
		this.position = position;
		this.detail = message;
	}

	public SyntaxErrorKind getKind() {
		return kind;
	}

	public SourcePosition getPosition() {
		return position;
	}

	public int getLine() {
		return position.line();
	}

	public int getColumn() {
		return position.column();
	}

	/**
	 * The message without the location prefix.
	 */
	public String getDetail() {
		return detail;
	}
}
