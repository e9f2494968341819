package org.javai.pyjsx.parse;

import java.util.ArrayList;
import java.util.List;
import org.javai.pyjsx.PySyntaxException;
import org.javai.pyjsx.SyntaxErrorKind;
import org.javai.pyjsx.ast.Expr;
import org.javai.pyjsx.ast.Expr.FormattedString;
import org.javai.pyjsx.ast.Expr.FormattedValue;
import org.javai.pyjsx.ast.Expr.StringLiteral;
import org.javai.pyjsx.lex.Token;

/**
 * Decodes string literal tokens into string nodes.
 * <p>
 * Adjacent literals are concatenated. Plain literals produce a
 * {@link StringLiteral}; if any part is an f-string the result is a
 * {@link FormattedString} whose replacement fields are parsed by the supplied
 * {@link FieldParser}, so fields may contain any host expression, markup
 * included.
 */
public final class StringLiteralParser {

	/**
	 * Parses the host expression in a replacement field, given its absolute
	 * source region.
	 */
	@FunctionalInterface
	public interface FieldParser {
		Expr parse(int start, int end);
	}

	private final ParseContext ctx;
	private final FieldParser fieldParser;

	public StringLiteralParser(ParseContext ctx, FieldParser fieldParser) {
		this.ctx = ctx;
		this.fieldParser = fieldParser;
	}

	public Expr parse(List<Token> tokens) {
		if (tokens.isEmpty()) {
			throw new IllegalArgumentException("No string tokens to parse");
		}
		List<Expr> parts = new ArrayList<>();
		StringBuilder pending = new StringBuilder();
		boolean formatted = false;
		Boolean bytes = null;

		for (Token token : tokens) {
			Literal literal = Literal.of(token);
			if (bytes != null && bytes != literal.bytes) {
				throw error("Cannot mix bytes and nonbytes literals", token.position());
			}
			bytes = literal.bytes;
			if (literal.formatted) {
				formatted = true;
				scanFormatted(literal, pending, parts);
			} else {
				pending.append(literal.raw ? literal.body : decode(literal, 0, literal.body.length()));
			}
		}

		if (!formatted) {
			return new StringLiteral(pending.toString(), bytes);
		}
		flush(pending, parts);
		return new FormattedString(parts);
	}

	// ==================== f-strings ====================

	private void scanFormatted(Literal literal, StringBuilder pending, List<Expr> parts) {
		String body = literal.body;
		int i = 0;
		int segmentStart = 0;
		while (i < body.length()) {
			char c = body.charAt(i);
			if (c == '{' && at(body, i + 1) == '{') {
				pending.append(segment(literal, segmentStart, i + 1));
				i += 2;
				segmentStart = i;
			} else if (c == '}' && at(body, i + 1) == '}') {
				pending.append(segment(literal, segmentStart, i + 1));
				i += 2;
				segmentStart = i;
			} else if (c == '}') {
				throw error("f-string: single '}' is not allowed", literal.bodyStart + i);
			} else if (c == '{') {
				pending.append(segment(literal, segmentStart, i));
				flush(pending, parts);
				i = scanField(literal, i, parts);
				segmentStart = i;
			} else if (c == '\\' && !literal.raw) {
				i += 2;
			} else {
				i++;
			}
		}
		pending.append(segment(literal, segmentStart, body.length()));
	}

	/**
	 * Scans the replacement field opening at {@code open} and returns the index
	 * just past its closing brace.
	 */
	private int scanField(Literal literal, int open, List<Expr> parts) {
		String body = literal.body;
		int exprStart = open + 1;
		int i = exprStart;
		int depth = 0;
		while (i < body.length()) {
			char c = body.charAt(i);
			if (c == '\'' || c == '"') {
				i = skipQuoted(literal, i);
				continue;
			}
			if (c == '(' || c == '[' || c == '{') {
				depth++;
			} else if (c == ')' || c == ']' || (c == '}' && depth > 0)) {
				depth--;
			} else if (depth == 0 && (c == '}' || c == ':' || (c == '!' && at(body, i + 1) != '='))) {
				break;
			}
			i++;
		}
		if (i >= body.length()) {
			throw error("f-string: expecting '}'", literal.bodyStart + open);
		}
		if (body.substring(exprStart, i).isBlank()) {
			throw error("f-string: empty expression not allowed", literal.bodyStart + open);
		}
		Expr value = fieldParser.parse(literal.bodyStart + exprStart, literal.bodyStart + i);

		String conversion = null;
		if (body.charAt(i) == '!') {
			char kind = at(body, i + 1);
			if (kind != 'r' && kind != 's' && kind != 'a') {
				throw error("f-string: invalid conversion character: expected 's', 'r', or 'a'",
						literal.bodyStart + i);
			}
			conversion = String.valueOf(kind);
			i += 2;
		}

		String formatSpec = null;
		if (at(body, i) == ':') {
			int specStart = i + 1;
			i = specStart;
			while (i < body.length() && body.charAt(i) != '}') {
				if (body.charAt(i) == '{') {
					throw error("f-string: nested replacement fields in a format spec are not supported",
							literal.bodyStart + i);
				}
				i++;
			}
			formatSpec = body.substring(specStart, i);
		}

		if (at(body, i) != '}') {
			throw error("f-string: expecting '}'", literal.bodyStart + Math.min(i, body.length()));
		}
		parts.add(new FormattedValue(value, conversion, formatSpec));
		return i + 1;
	}

	private int skipQuoted(Literal literal, int start) {
		String body = literal.body;
		char quote = body.charAt(start);
		int i = start + 1;
		while (i < body.length() && body.charAt(i) != quote) {
			i++;
		}
		if (i >= body.length()) {
			throw error("f-string: unterminated string in replacement field", literal.bodyStart + start);
		}
		return i + 1;
	}

	private String segment(Literal literal, int start, int end) {
		return literal.raw ? literal.body.substring(start, end) : decode(literal, start, end);
	}

	private static void flush(StringBuilder pending, List<Expr> parts) {
		if (!pending.isEmpty()) {
			parts.add(StringLiteral.of(pending.toString()));
			pending.setLength(0);
		}
	}

	// ==================== Escapes ====================

	private String decode(Literal literal, int start, int end) {
		String body = literal.body;
		StringBuilder out = new StringBuilder(end - start);
		int i = start;
		while (i < end) {
			char c = body.charAt(i);
			if (literal.bytes && c > 0x7f) {
				throw error("bytes can only contain ASCII literal characters", literal.bodyStart + i);
			}
			if (c != '\\' || i + 1 >= end) {
				out.append(c);
				i++;
				continue;
			}
			int escapeAt = i;
			char e = body.charAt(i + 1);
			i += 2;
			switch (e) {
				case '\n' -> {
					// line continuation
				}
				case '\r' -> {
					if (i < end && body.charAt(i) == '\n') {
						i++;
					}
				}
				case '\\' -> out.append('\\');
				case '\'' -> out.append('\'');
				case '"' -> out.append('"');
				case 'a' -> out.append('\u0007');
				case 'b' -> out.append('\b');
				case 'f' -> out.append('\f');
				case 'n' -> out.append('\n');
				case 'r' -> out.append('\r');
				case 't' -> out.append('\t');
				case 'v' -> out.append('\u000b');
				case '0', '1', '2', '3', '4', '5', '6', '7' -> {
					int value = e - '0';
					int digits = 1;
					while (digits < 3 && i < end && body.charAt(i) >= '0' && body.charAt(i) <= '7') {
						value = value * 8 + (body.charAt(i) - '0');
						i++;
						digits++;
					}
					out.append((char) value);
				}
				case 'x' -> {
					out.append((char) hex(literal, i, 2, end, escapeAt, "\\xXX"));
					i += 2;
				}
				case 'u', 'U' -> {
					if (literal.bytes) {
						out.append('\\').append(e);
					} else {
						int width = e == 'u' ? 4 : 8;
						out.appendCodePoint(hex(literal, i, width, end, escapeAt, e == 'u' ? "\\uXXXX" : "\\UXXXXXXXX"));
						i += width;
					}
				}
				case 'N' -> throw error("\\N{...} escapes are not supported", literal.bodyStart + escapeAt);
				default -> out.append('\\').append(e);
			}
		}
		return out.toString();
	}

	private int hex(Literal literal, int from, int width, int end, int escapeAt, String form) {
		if (from + width > end) {
			throw error("Truncated " + form + " escape", literal.bodyStart + escapeAt);
		}
		String digits = literal.body.substring(from, from + width);
		if (!digits.chars().allMatch(c -> Character.digit(c, 16) >= 0)) {
			throw error("Truncated " + form + " escape", literal.bodyStart + escapeAt);
		}
		try {
			int value = Integer.parseUnsignedInt(digits, 16);
			if (!Character.isValidCodePoint(value)) {
				throw error("Illegal Unicode character in " + form + " escape", literal.bodyStart + escapeAt);
			}
			return value;
		} catch (NumberFormatException e) {
			throw error("Truncated " + form + " escape", literal.bodyStart + escapeAt);
		}
	}

	private static char at(String s, int index) {
		return index < s.length() ? s.charAt(index) : '\0';
	}

	private PySyntaxException error(String message, int offset) {
		return ctx.error(SyntaxErrorKind.PARSE, message, offset);
	}

	/**
	 * A string token split into its prefix flags and body.
	 */
	private static final class Literal {
		final boolean raw;
		final boolean bytes;
		final boolean formatted;
		final String body;
		final int bodyStart;

		private Literal(boolean raw, boolean bytes, boolean formatted, String body, int bodyStart) {
			this.raw = raw;
			this.bytes = bytes;
			this.formatted = formatted;
			this.body = body;
			this.bodyStart = bodyStart;
		}

		static Literal of(Token token) {
			String text = token.value();
			int prefixLength = 0;
			while (text.charAt(prefixLength) != '\'' && text.charAt(prefixLength) != '"') {
				prefixLength++;
			}
			String prefix = text.substring(0, prefixLength).toLowerCase();
			char quote = text.charAt(prefixLength);
			boolean triple = text.length() >= prefixLength + 6
					&& text.charAt(prefixLength + 1) == quote && text.charAt(prefixLength + 2) == quote;
			int quoteLength = triple ? 3 : 1;
			int bodyStart = prefixLength + quoteLength;
			return new Literal(
					prefix.indexOf('r') >= 0,
					prefix.indexOf('b') >= 0,
					prefix.indexOf('f') >= 0,
					text.substring(bodyStart, text.length() - quoteLength),
					token.position() + bodyStart);
		}
	}
}
