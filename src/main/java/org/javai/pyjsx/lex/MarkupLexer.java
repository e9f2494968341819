package org.javai.pyjsx.lex;

import java.util.ArrayList;
import java.util.List;
import org.javai.pyjsx.PySyntaxException;
import org.javai.pyjsx.SyntaxErrorKind;
import org.javai.pyjsx.lex.Token.TokenType;

/**
 * Mode-switching lexer for host code with embedded markup literals.
 * <p>
 * The lexer itself only owns a cursor. Which mode the next token is read in is
 * decided by the caller (see {@link ModeTracker}), so the same lexer can serve
 * a parser that re-enters itself for expressions nested inside markup.
 * <ul>
 * <li>{@link LexMode#CODE}: names, numbers, strings, operators, newlines</li>
 * <li>{@link LexMode#TAG}: tag punctuation, names, {@code =}, {@code .}, strings, {@code {}</li>
 * <li>{@link LexMode#TEXT}: tag openers, strings, {@code {}; anything else is bare text</li>
 * </ul>
 */
public final class MarkupLexer {

	private final String input;
	private final int end;
	private final LineMap lineMap;
	private int pos;

	public MarkupLexer(String input) {
		this(input != null ? input : "", 0, input != null ? input.length() : 0, null);
	}

	private MarkupLexer(String input, int start, int end, LineMap lineMap) {
		this.input = input;
		this.end = end;
		this.pos = start;
		this.lineMap = lineMap != null ? lineMap : new LineMap(input);
	}

	/**
	 * Creates a lexer over a region of the same source. Offsets stay absolute,
	 * so errors inside the region point into the enclosing source unit.
	 */
	public MarkupLexer slice(int start, int end) {
		if (start < 0 || end > input.length() || start > end) {
			throw new IllegalArgumentException("Invalid region [" + start + ", " + end + ")");
		}
		return new MarkupLexer(input, start, end, lineMap);
	}

	/**
	 * Tokenizes the whole source unit, switching modes as markup literals open
	 * and close.
	 *
	 * @return list of tokens, ending with EOF
	 * @throws PySyntaxException on malformed input
	 */
	public List<Token> tokenize() {
		ModeTracker tracker = new ModeTracker(lineMap);
		List<Token> tokens = new ArrayList<>();
		while (true) {
			Token token = tracker.lex(this);
			tokens.add(token);
			tracker.accept(token);
			if (token.isType(TokenType.EOF)) {
				return tokens;
			}
		}
	}

	/**
	 * Reads the next token in the given mode.
	 */
	public Token next(LexMode mode) {
		return switch (mode) {
			case CODE -> nextCode();
			case TAG -> nextTag();
			case TEXT -> nextText();
		};
	}

	/**
	 * Whether the next token read as code would open a tag: a {@code <} not
	 * followed by {@code =} or {@code <}. Skips what {@link #next} skips in
	 * code mode, line continuations included.
	 */
	public boolean atTagStart() {
		int i = skipInlineWhitespace(pos);
		if (i >= end || input.charAt(i) != '<') {
			return false;
		}
		char next = charAt(i + 1);
		return next != '=' && next != '<';
	}

	public int position() {
		return pos;
	}

	/**
	 * Whether {@code c} occurs in the region at or after {@code from}.
	 */
	public boolean containsFrom(char c, int from) {
		int found = input.indexOf(c, Math.max(from, 0));
		return found >= 0 && found < end;
	}

	public LineMap lineMap() {
		return lineMap;
	}

	PySyntaxException error(String message, int offset) {
		return new PySyntaxException(SyntaxErrorKind.LEX, message, lineMap.positionOf(offset));
	}

	// ==================== CODE mode ====================

	private Token nextCode() {
		pos = skipInlineWhitespace(pos);
		if (isAtEnd()) {
			return token(TokenType.EOF, pos, LexMode.CODE);
		}

		int start = pos;
		char c = peek();

		if (c == '\n' || c == '\r') {
			pos++;
			if (c == '\r' && peek() == '\n') {
				pos++;
			}
			return token(TokenType.NEWLINE, start, LexMode.CODE);
		}

		if (startsString(pos)) {
			return scanString(LexMode.CODE);
		}
		if (isDigit(c) || (c == '.' && isDigit(charAt(pos + 1)))) {
			return scanNumber(LexMode.CODE);
		}
		if (isIdentifierStart(c)) {
			return scanName(LexMode.CODE);
		}

		TokenType twoCharType = switch (lookahead(2)) {
			case "**" -> TokenType.DOUBLE_STAR;
			case "//" -> TokenType.DOUBLE_SLASH;
			case "<<" -> TokenType.LEFT_SHIFT;
			case ">>" -> TokenType.RIGHT_SHIFT;
			case "<=" -> TokenType.LESS_EQUAL;
			case ">=" -> TokenType.GREATER_EQUAL;
			case "==" -> TokenType.EQUAL_EQUAL;
			case "!=" -> TokenType.NOT_EQUAL;
			default -> null;
		};
		if (twoCharType != null) {
			pos += 2;
			return token(twoCharType, start, LexMode.CODE);
		}

		TokenType singleCharType = switch (c) {
			case '(' -> TokenType.LPAREN;
			case ')' -> TokenType.RPAREN;
			case '[' -> TokenType.LBRACKET;
			case ']' -> TokenType.RBRACKET;
			case '{' -> TokenType.LBRACE;
			case '}' -> TokenType.RBRACE;
			case ',' -> TokenType.COMMA;
			case ':' -> TokenType.COLON;
			case ';' -> TokenType.SEMICOLON;
			case '.' -> TokenType.DOT;
			case '=' -> TokenType.ASSIGN;
			case '+' -> TokenType.PLUS;
			case '-' -> TokenType.MINUS;
			case '*' -> TokenType.STAR;
			case '/' -> TokenType.SLASH;
			case '%' -> TokenType.PERCENT;
			case '@' -> TokenType.AT;
			case '&' -> TokenType.AMPERSAND;
			case '|' -> TokenType.PIPE;
			case '^' -> TokenType.CARET;
			case '~' -> TokenType.TILDE;
			case '<' -> TokenType.LESS;
			case '>' -> TokenType.GREATER;
			default -> null;
		};
		if (singleCharType != null) {
			pos++;
			return token(singleCharType, start, LexMode.CODE);
		}

		throw error("Unexpected character: '" + c + "'", start);
	}

	// ==================== TAG mode ====================

	private Token nextTag() {
		skipAllWhitespace();
		if (isAtEnd()) {
			return token(TokenType.EOF, pos, LexMode.TAG);
		}

		int start = pos;
		Token opener = scanTagOpener(LexMode.TAG);
		if (opener != null) {
			return opener;
		}

		char c = peek();
		if (c == '/' && charAt(pos + 1) == '>') {
			pos += 2;
			return token(TokenType.SELF_CLOSE, start, LexMode.TAG);
		}
		if (startsString(pos)) {
			return scanString(LexMode.TAG);
		}
		if (isIdentifierStart(c)) {
			return scanName(LexMode.TAG);
		}
		if (isDigit(c)) {
			// rejected by the parser as an attribute value
			return scanNumber(LexMode.TAG);
		}

		TokenType type = switch (c) {
			case '>' -> TokenType.TAG_END;
			case '=' -> TokenType.ASSIGN;
			case '.' -> TokenType.DOT;
			case '{' -> TokenType.LBRACE;
			default -> null;
		};
		if (type == null) {
			throw error("Malformed tag: unexpected character '" + c + "'", start);
		}
		pos++;
		return token(type, start, LexMode.TAG);
	}

	// ==================== TEXT mode ====================

	private Token nextText() {
		skipAllWhitespace();
		if (isAtEnd()) {
			return token(TokenType.EOF, pos, LexMode.TEXT);
		}

		int start = pos;
		Token opener = scanTagOpener(LexMode.TEXT);
		if (opener != null) {
			return opener;
		}

		char c = peek();
		if (c == '{') {
			pos++;
			return token(TokenType.LBRACE, start, LexMode.TEXT);
		}
		if (c == '}') {
			pos++;
			return token(TokenType.RBRACE, start, LexMode.TEXT);
		}
		if (startsString(pos)) {
			return scanString(LexMode.TEXT);
		}

		// Unquoted content runs up to the next tag, hole or quote
		while (!isAtEnd() && "<{}\"'".indexOf(peek()) < 0) {
			pos++;
		}
		int stop = pos;
		while (stop > start && Character.isWhitespace(input.charAt(stop - 1))) {
			stop--;
		}
		return new Token(TokenType.BARE_TEXT, input.substring(start, stop), start, LexMode.TEXT);
	}

	private Token scanTagOpener(LexMode mode) {
		if (peek() != '<') {
			return null;
		}
		int start = pos;
		TokenType type;
		if (lookahead(3).equals("</>")) {
			type = TokenType.FRAGMENT_CLOSE;
		} else if (lookahead(2).equals("</")) {
			type = TokenType.TAG_OPEN_CLOSE;
		} else if (lookahead(2).equals("<>")) {
			type = TokenType.FRAGMENT_OPEN;
		} else {
			type = TokenType.TAG_OPEN;
		}
		pos += switch (type) {
			case FRAGMENT_CLOSE -> 3;
			case TAG_OPEN_CLOSE, FRAGMENT_OPEN -> 2;
			default -> 1;
		};
		return token(type, start, mode);
	}

	// ==================== Scanners ====================

	private Token scanName(LexMode mode) {
		int start = pos;
		while (!isAtEnd() && isIdentifierChar(peek())) {
			pos++;
		}
		return token(TokenType.NAME, start, mode);
	}

	private Token scanNumber(LexMode mode) {
		int start = pos;

		if (peek() == '0' && "xXoObB".indexOf(charAt(pos + 1)) >= 0) {
			pos += 2;
			while (!isAtEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_')) {
				pos++;
			}
			return token(TokenType.NUMBER, start, mode);
		}

		scanDigits();
		if (peek() == '.') {
			pos++;
			scanDigits();
		}
		if ((peek() == 'e' || peek() == 'E')
				&& (isDigit(charAt(pos + 1))
						|| ((charAt(pos + 1) == '+' || charAt(pos + 1) == '-') && isDigit(charAt(pos + 2))))) {
			pos += 2;
			scanDigits();
		}
		if (peek() == 'j' || peek() == 'J') {
			pos++;
		}
		return token(TokenType.NUMBER, start, mode);
	}

	private void scanDigits() {
		while (!isAtEnd() && (isDigit(peek()) || peek() == '_')) {
			pos++;
		}
	}

	/**
	 * Scans a complete string literal, prefix and quotes included. The token
	 * value is the raw source text; decoding belongs to the parser.
	 */
	private Token scanString(LexMode mode) {
		int start = pos;
		while (peek() != '\'' && peek() != '"') {
			pos++;
		}
		char quote = peek();
		boolean triple = charAt(pos + 1) == quote && charAt(pos + 2) == quote;
		pos += triple ? 3 : 1;

		while (true) {
			if (isAtEnd()) {
				throw error("Unterminated string literal", start);
			}
			char c = peek();
			if (c == '\\') {
				pos += Math.min(2, end - pos);
				continue;
			}
			if (!triple && (c == '\n' || c == '\r')) {
				throw error("Unterminated string literal", start);
			}
			if (c == quote) {
				if (!triple) {
					pos++;
					break;
				}
				if (charAt(pos + 1) == quote && charAt(pos + 2) == quote) {
					pos += 3;
					break;
				}
			}
			pos++;
		}
		return token(TokenType.STRING, start, mode);
	}

	/**
	 * A string starts at {@code at} if there is a quote, optionally preceded by
	 * a valid prefix: r, u, b, f, or one of the two-letter combinations.
	 */
	private boolean startsString(int at) {
		int i = at;
		while (i < end && i - at < 2 && Character.isLetter(input.charAt(i))) {
			i++;
		}
		if (i >= end || (input.charAt(i) != '\'' && input.charAt(i) != '"')) {
			return false;
		}
		String prefix = input.substring(at, i).toLowerCase();
		return switch (prefix) {
			case "", "r", "u", "b", "f", "rb", "br", "fr", "rf" -> true;
			default -> false;
		};
	}

	// ==================== Helpers ====================

	private int skipInlineWhitespace(int from) {
		int i = from;
		while (i < end) {
			char c = input.charAt(i);
			if (c == ' ' || c == '\t' || c == '\f') {
				i++;
			} else if (c == '\\' && i + 1 < end && (input.charAt(i + 1) == '\n' || input.charAt(i + 1) == '\r')) {
				i += 2;
				if (input.charAt(i - 1) == '\r' && i < end && input.charAt(i) == '\n') {
					i++;
				}
			} else if (c == '#') {
				while (i < end && input.charAt(i) != '\n' && input.charAt(i) != '\r') {
					i++;
				}
			} else {
				break;
			}
		}
		return i;
	}

	private void skipAllWhitespace() {
		while (!isAtEnd() && Character.isWhitespace(peek())) {
			pos++;
		}
	}

	private Token token(TokenType type, int start, LexMode mode) {
		return new Token(type, input.substring(start, pos), start, mode);
	}

	private String lookahead(int length) {
		return input.substring(pos, Math.min(end, pos + length));
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char charAt(int index) {
		return index < end ? input.charAt(index) : '\0';
	}

	private boolean isAtEnd() {
		return pos >= end;
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isIdentifierStart(char c) {
		return Character.isLetter(c) || c == '_';
	}

	private static boolean isIdentifierChar(char c) {
		return Character.isLetterOrDigit(c) || c == '_';
	}
}
