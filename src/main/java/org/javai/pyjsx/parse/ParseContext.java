package org.javai.pyjsx.parse;

import java.util.List;
import org.javai.pyjsx.PySyntaxException;
import org.javai.pyjsx.SyntaxErrorKind;
import org.javai.pyjsx.lex.LexMode;
import org.javai.pyjsx.lex.MarkupLexer;
import org.javai.pyjsx.lex.ModeTracker;
import org.javai.pyjsx.lex.Token;
import org.javai.pyjsx.lex.Token.TokenType;

/**
 * Cursor state shared by the host expression parser and the markup parser.
 * <p>
 * Both parsers read tokens through one context, so whichever of them consumes
 * a token also advances the mode tracker, and the next token is always lexed in
 * the mode the consumed tokens imply. A context is used for one parse only.
 */
public final class ParseContext {

	private final MarkupLexer lexer;
	private final ModeTracker tracker;
	private final ParseContext root;
	private Token lookahead;
	private int markupLiterals;

	private ParseContext(MarkupLexer lexer, ParseContext root) {
		this.lexer = lexer;
		this.tracker = new ModeTracker(lexer.lineMap());
		this.root = root != null ? root : this;
	}

	public static ParseContext of(String source) {
		return new ParseContext(new MarkupLexer(source), null);
	}

	/**
	 * A context over a region of the same source, e.g. a replacement field of
	 * an f-string. Errors keep absolute positions and literal counts go to the
	 * outermost context.
	 */
	public ParseContext nested(int start, int end) {
		return new ParseContext(lexer.slice(start, end), root);
	}

	/**
	 * The next token, lexed in the current mode but not consumed.
	 */
	public Token peek() {
		if (lookahead == null) {
			lookahead = tracker.lex(lexer);
		}
		return lookahead;
	}

	/**
	 * Consumes the next token. End of input is never consumed.
	 */
	public Token advance() {
		Token token = peek();
		if (!token.isType(TokenType.EOF)) {
			lookahead = null;
			tracker.accept(token);
		}
		return token;
	}

	public boolean check(TokenType type) {
		return peek().isType(type);
	}

	/**
	 * Whether the next token is the given keyword read as code.
	 */
	public boolean checkKeyword(String keyword) {
		Token token = peek();
		return token.mode() == LexMode.CODE && token.isName(keyword);
	}

	public boolean match(TokenType type) {
		if (check(type)) {
			advance();
			return true;
		}
		return false;
	}

	public boolean matchKeyword(String keyword) {
		if (checkKeyword(keyword)) {
			advance();
			return true;
		}
		return false;
	}

	/**
	 * Consumes a token of the given type or fails with a parse error.
	 *
	 * @param expected what was expected, for the message, e.g. {@code "')'"}
	 */
	public Token expect(TokenType type, String expected) {
		if (!check(type)) {
			throw error(SyntaxErrorKind.PARSE, "Expected " + expected + ", found " + peek().describe(), peek());
		}
		return advance();
	}

	public void expectKeyword(String keyword) {
		if (!checkKeyword(keyword)) {
			throw error(SyntaxErrorKind.PARSE, "Expected '" + keyword + "', found " + peek().describe(), peek());
		}
		advance();
	}

	public LexMode mode() {
		return tracker.mode();
	}

	/**
	 * Open tag names, innermost first; fragments appear as the empty string.
	 */
	public List<String> openTags() {
		return tracker.openTags();
	}

	/**
	 * Whether the unread source, from {@code offset} on, still holds {@code c}.
	 */
	public boolean remainingContains(char c, int offset) {
		return lexer.containsFrom(c, offset);
	}

	public void markupLiteralParsed() {
		root.markupLiterals++;
	}

	/**
	 * Number of complete markup literals parsed in this source unit.
	 */
	public int markupLiterals() {
		return root.markupLiterals;
	}

	public PySyntaxException error(SyntaxErrorKind kind, String message, Token at) {
		return error(kind, message, at.position());
	}

	public PySyntaxException error(SyntaxErrorKind kind, String message, int offset) {
		return new PySyntaxException(kind, message, lexer.lineMap().positionOf(offset));
	}
}
