package org.javai.pyjsx.lex;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.javai.pyjsx.PySyntaxException;
import org.javai.pyjsx.SyntaxErrorKind;
import org.javai.pyjsx.lex.Token.TokenType;

/**
 * Decides the lexer mode for each token from the tokens consumed so far.
 * <p>
 * State is a stack of frames: the root code frame, one frame per open element
 * or fragment, and one code frame per expression hole. Each code frame counts
 * its own bracket depth, so the {@code }} that closes a hole is told apart from
 * one closing a dictionary inside it. The tracker also keeps the stack of open
 * tag names and checks closing tags against it.
 * <p>
 * A {@code <} in code opens a tag only where an operand may start, i.e. when
 * the previous token does not end an operand (a non-keyword name, a literal, a
 * closing bracket or a complete markup literal).
 */
public final class ModeTracker {

	private enum FrameKind {
		ROOT, HOLE, ELEMENT, FRAGMENT
	}

	private enum NameState {
		EXPECT_NAME, AFTER_NAME, DONE
	}

	private static final class Frame {
		final FrameKind kind;
		LexMode mode;
		int depth;
		boolean closing;
		int closeStart;
		NameState nameState = NameState.EXPECT_NAME;
		final StringBuilder spelling = new StringBuilder();

		Frame(FrameKind kind, LexMode mode) {
			this.kind = kind;
			this.mode = mode;
		}

		void startTagName() {
			nameState = NameState.EXPECT_NAME;
			spelling.setLength(0);
		}
	}

	private final LineMap lineMap;
	private final Deque<Frame> frames = new ArrayDeque<>();
	private final Deque<String> openTags = new ArrayDeque<>();
	private boolean operandEnded;

	public ModeTracker(LineMap lineMap) {
		this.lineMap = lineMap;
		frames.push(new Frame(FrameKind.ROOT, LexMode.CODE));
	}

	/**
	 * Mode of the innermost frame.
	 */
	public LexMode mode() {
		return frames.peek().mode;
	}

	/**
	 * Newlines end statements only in top-level code outside any brackets.
	 */
	public boolean newlinesSignificant() {
		return frames.size() == 1 && frames.peek().depth == 0;
	}

	/**
	 * Whether a markup literal is currently open.
	 */
	public boolean inMarkup() {
		return frames.size() > 1;
	}

	/**
	 * Open tag names, innermost first. Fragments appear as the empty string.
	 */
	public List<String> openTags() {
		return List.copyOf(openTags);
	}

	/**
	 * Reads the next significant token without changing the tracker state.
	 */
	public Token lex(MarkupLexer lexer) {
		while (true) {
			LexMode mode = mode();
			if (mode == LexMode.CODE && !operandEnded && lexer.atTagStart()) {
				mode = LexMode.TAG;
			}
			Token token = lexer.next(mode);
			if (token.isType(TokenType.NEWLINE) && !newlinesSignificant()) {
				continue;
			}
			return token;
		}
	}

	/**
	 * Consumes a token and returns the mode for the token that follows it.
	 *
	 * @throws PySyntaxException when a closing tag does not match, or markup is
	 *         left open at end of input
	 */
	public LexMode accept(Token token) {
		Frame frame = frames.peek();
		switch (frame.mode) {
			case CODE -> acceptCode(frame, token);
			case TAG -> acceptTag(frame, token);
			case TEXT -> acceptText(frame, token);
		}
		return mode();
	}

	private void acceptCode(Frame frame, Token token) {
		if (token.mode() == LexMode.TAG) {
			switch (token.type()) {
				case TAG_OPEN -> openElement();
				case FRAGMENT_OPEN -> openFragment();
				default -> throw lexError("Closing tag " + token.describe() + " without an open tag", token.position());
			}
			return;
		}

		switch (token.type()) {
			case LPAREN, LBRACKET, LBRACE -> {
				frame.depth++;
				operandEnded = false;
			}
			case RPAREN, RBRACKET -> {
				frame.depth = Math.max(0, frame.depth - 1);
				operandEnded = true;
			}
			case RBRACE -> {
				if (frame.kind == FrameKind.HOLE && frame.depth == 0) {
					frames.pop();
					operandEnded = false;
				} else {
					frame.depth = Math.max(0, frame.depth - 1);
					operandEnded = true;
				}
			}
			case NAME -> operandEnded = !Keywords.isKeyword(token.value()) || Keywords.isConstant(token.value());
			case NUMBER, STRING -> operandEnded = true;
			case EOF -> checkClosedAtEnd(token);
			default -> operandEnded = false;
		}
	}

	private void acceptTag(Frame frame, Token token) {
		switch (token.type()) {
			case NAME -> {
				if (frame.nameState == NameState.EXPECT_NAME) {
					frame.spelling.append(token.value());
					frame.nameState = NameState.AFTER_NAME;
				} else {
					frame.nameState = NameState.DONE;
				}
			}
			case DOT -> {
				if (frame.nameState == NameState.AFTER_NAME) {
					frame.spelling.append('.');
					frame.nameState = NameState.EXPECT_NAME;
				}
			}
			case TAG_END -> {
				if (frame.closing) {
					closeElement(frame);
				} else {
					openTags.push(frame.spelling.toString());
					frame.mode = LexMode.TEXT;
				}
			}
			case SELF_CLOSE -> {
				frames.pop();
				operandEnded = true;
			}
			case LBRACE -> {
				frame.nameState = NameState.DONE;
				pushHole();
			}
			case ASSIGN, STRING -> frame.nameState = NameState.DONE;
			case EOF -> checkClosedAtEnd(token);
			default -> throw lexError("Malformed tag: unexpected " + token.describe(), token.position());
		}
	}

	private void acceptText(Frame frame, Token token) {
		switch (token.type()) {
			case TAG_OPEN -> openElement();
			case FRAGMENT_OPEN -> openFragment();
			case TAG_OPEN_CLOSE -> {
				if (frame.kind == FrameKind.FRAGMENT) {
					throw lexError("Mismatched closing tag: fragment closed by '</'", token.position());
				}
				frame.mode = LexMode.TAG;
				frame.closing = true;
				frame.closeStart = token.position();
				frame.startTagName();
			}
			case FRAGMENT_CLOSE -> {
				if (frame.kind != FrameKind.FRAGMENT) {
					throw lexError("Mismatched closing tag: expected </" + openTags.peek() + "> but found </>",
							token.position());
				}
				openTags.pop();
				frames.pop();
				operandEnded = true;
			}
			case LBRACE -> pushHole();
			case EOF -> checkClosedAtEnd(token);
			default -> {
				// string literals, stray braces and bare text do not change the mode
			}
		}
	}

	private void openElement() {
		frames.push(new Frame(FrameKind.ELEMENT, LexMode.TAG));
	}

	private void openFragment() {
		openTags.push("");
		frames.push(new Frame(FrameKind.FRAGMENT, LexMode.TEXT));
	}

	private void pushHole() {
		frames.push(new Frame(FrameKind.HOLE, LexMode.CODE));
		operandEnded = false;
	}

	private void closeElement(Frame frame) {
		String expected = openTags.pop();
		String actual = frame.spelling.toString();
		if (!expected.equals(actual)) {
			throw lexError("Mismatched closing tag: expected </" + expected + "> but found </" + actual + ">",
					frame.closeStart);
		}
		frames.pop();
		operandEnded = true;
	}

	private void checkClosedAtEnd(Token eof) {
		if (inMarkup()) {
			throw new PySyntaxException(SyntaxErrorKind.PARSE,
					"Unterminated markup literal: reached end of input", lineMap.positionOf(eof.position()));
		}
	}

	private PySyntaxException lexError(String message, int offset) {
		return new PySyntaxException(SyntaxErrorKind.LEX, message, lineMap.positionOf(offset));
	}
}
