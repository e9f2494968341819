package org.javai.pyjsx.lex;

/**
 * A token of the host language or of an embedded markup literal.
 *
 * @param type the token type
 * @param value the source text of the token ("" for EOF)
 * @param position the character offset in the source unit
 * @param mode the lexer mode the token was read in
 */
public record Token(TokenType type, String value, int position, LexMode mode) {

	public enum TokenType {
		// Shared by all modes
		NAME,            // identifiers and keywords, tag and attribute names
		STRING,          // "quoted", 'quoted', r"...", f"...", """triple"""
		LBRACE,          // {
		RBRACE,          // }
		DOT,             // .
		ASSIGN,          // = (also the attribute separator in tags)
		EOF,

		// Ordinary code
		NUMBER,          // 42, 3.14, 0x1f, 1e-3, 2j
		NEWLINE,
		LPAREN,          // (
		RPAREN,          // )
		LBRACKET,        // [
		RBRACKET,        // ]
		COMMA,           // ,
		COLON,           // :
		SEMICOLON,       // ;
		PLUS,            // +
		MINUS,           // -
		STAR,            // *
		DOUBLE_STAR,     // **
		SLASH,           // /
		DOUBLE_SLASH,    // //
		PERCENT,         // %
		AT,              // @
		AMPERSAND,       // &
		PIPE,            // |
		CARET,           // ^
		TILDE,           // ~
		LEFT_SHIFT,      // <<
		RIGHT_SHIFT,     // >>
		LESS,            // < as an operator
		GREATER,         // > as an operator
		LESS_EQUAL,      // <=
		GREATER_EQUAL,   // >=
		EQUAL_EQUAL,     // ==
		NOT_EQUAL,       // !=

		// Markup
		TAG_OPEN,        // <
		TAG_END,         // >
		TAG_OPEN_CLOSE,  // </
		SELF_CLOSE,      // />
		FRAGMENT_OPEN,   // <>
		FRAGMENT_CLOSE,  // </>
		BARE_TEXT        // unquoted element content, always rejected by the parser
	}

	public boolean isType(TokenType expectedType) {
		return type == expectedType;
	}

	public boolean isName(String expected) {
		return type == TokenType.NAME && value.equals(expected);
	}

	/**
	 * Human-readable form used in error messages.
	 */
	public String describe() {
		return switch (type) {
			case EOF -> "end of input";
			case NEWLINE -> "end of line";
			default -> "'" + value + "'";
		};
	}

	@Override
	public String toString() {
		return switch (type) {
			case EOF, NEWLINE -> type + "@" + position;
			default -> type + "(" + value + ")@" + position;
		};
	}
}
