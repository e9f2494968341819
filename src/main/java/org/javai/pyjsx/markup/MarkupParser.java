package org.javai.pyjsx.markup;

import java.util.ArrayList;
import java.util.List;
import org.javai.pyjsx.PySyntaxException;
import org.javai.pyjsx.SyntaxErrorKind;
import org.javai.pyjsx.ast.Expr;
import org.javai.pyjsx.lex.Keywords;
import org.javai.pyjsx.lex.Token;
import org.javai.pyjsx.lex.Token.TokenType;
import org.javai.pyjsx.markup.MarkupNode.Element;
import org.javai.pyjsx.markup.MarkupNode.ExpressionHole;
import org.javai.pyjsx.markup.MarkupNode.Fragment;
import org.javai.pyjsx.markup.MarkupNode.TextLiteral;
import org.javai.pyjsx.parse.HostExpressionGrammar;
import org.javai.pyjsx.parse.ParseContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent parser for markup literals.
 * <p>
 * Grammar:
 * <pre>
 * Element        := '&lt;' TagName Attribute* ( '/&gt;' | '&gt;' Children '&lt;/' TagName '&gt;' )
 * Fragment       := '&lt;&gt;' Children '&lt;/&gt;'
 * Children       := ( Element | Fragment | TextLiteral | ExpressionHole )*
 * Attribute      := Identifier '=' ( StringLiteral | '{' HostExpr '}' )
 * TextLiteral    := StringLiteral
 * ExpressionHole := '{' HostExpr '}'
 * TagName        := Identifier ( '.' Identifier )*
 * </pre>
 * String literals and hole bodies are parsed by the host grammar, through the
 * same {@link ParseContext}. The first error aborts the literal.
 */
public final class MarkupParser {

	private static final Logger logger = LoggerFactory.getLogger(MarkupParser.class);

	private final ParseContext ctx;
	private final HostExpressionGrammar host;

	public MarkupParser(ParseContext ctx, HostExpressionGrammar host) {
		this.ctx = ctx;
		this.host = host;
	}

	/**
	 * Parses the element or fragment starting at the cursor.
	 *
	 * @throws PySyntaxException on malformed markup, or as raised by the host
	 *         grammar inside a hole
	 */
	public MarkupNode parseMarkupLiteral() {
		Token open = ctx.peek();
		if (logger.isTraceEnabled()) {
			logger.trace("Markup literal at {} (open tags: {})", open.position(), ctx.openTags());
		}
		if (open.isType(TokenType.TAG_OPEN)) {
			return parseElement();
		}
		if (open.isType(TokenType.FRAGMENT_OPEN)) {
			return parseFragment();
		}
		throw ctx.error(SyntaxErrorKind.PARSE, "Expected a markup literal, found " + open.describe(), open);
	}

	private Element parseElement() {
		ctx.expect(TokenType.TAG_OPEN, "'<'");
		TagRef tag = parseTagName("'<'");

		List<MarkupAttribute> attributes = new ArrayList<>();
		while (ctx.check(TokenType.NAME)) {
			attributes.add(parseAttribute());
		}

		if (ctx.match(TokenType.SELF_CLOSE)) {
			return new Element(tag, attributes, List.of());
		}
		if (!ctx.match(TokenType.TAG_END)) {
			Token found = ctx.peek();
			String message = found.isType(TokenType.EOF)
					? "Unterminated tag <" + tag.spelling() + ">: expected '>' or '/>', found end of input"
					: "Expected '>' or '/>' to end tag <" + tag.spelling() + ">, found " + found.describe();
			throw ctx.error(SyntaxErrorKind.PARSE, message, found);
		}

		List<MarkupNode> children = parseChildren("<" + tag.spelling() + ">");

		Token close = ctx.peek();
		if (close.isType(TokenType.FRAGMENT_CLOSE)) {
			throw mismatch(tag.spelling(), "</>", close);
		}
		ctx.expect(TokenType.TAG_OPEN_CLOSE, "'</'");
		TagRef closing = parseTagName("'</'");
		if (!closing.spelling().equals(tag.spelling())) {
			throw mismatch(tag.spelling(), "</" + closing.spelling() + ">", close);
		}
		ctx.expect(TokenType.TAG_END, "'>' to end closing tag </" + closing.spelling() + ">");
		return new Element(tag, attributes, children);
	}

	private Fragment parseFragment() {
		ctx.expect(TokenType.FRAGMENT_OPEN, "'<>'");
		List<MarkupNode> children = parseChildren("<>");
		Token close = ctx.peek();
		if (!close.isType(TokenType.FRAGMENT_CLOSE)) {
			throw ctx.error(SyntaxErrorKind.PARSE,
					"Mismatched closing tag: fragment <> closed by " + close.describe(), close);
		}
		ctx.advance();
		return new Fragment(children);
	}

	/**
	 * Parses children up to, not including, the closing tag.
	 */
	private List<MarkupNode> parseChildren(String opening) {
		List<MarkupNode> children = new ArrayList<>();
		while (true) {
			Token token = ctx.peek();
			switch (token.type()) {
				case TAG_OPEN -> children.add(parseElement());
				case FRAGMENT_OPEN -> children.add(parseFragment());
				case STRING -> children.add(new TextLiteral(host.parseStringLiteral()));
				case LBRACE -> children.add(parseHole());
				case TAG_OPEN_CLOSE, FRAGMENT_CLOSE -> {
					return children;
				}
				case BARE_TEXT -> throw ctx.error(SyntaxErrorKind.PARSE,
						"Text content must be a quoted string literal, found " + token.describe(), token);
				case EOF -> throw ctx.error(SyntaxErrorKind.PARSE,
						"Unterminated markup literal: " + opening + " is never closed", token);
				default -> throw ctx.error(SyntaxErrorKind.PARSE,
						"Unexpected " + token.describe() + " in content of " + opening, token);
			}
		}
	}

	private MarkupAttribute parseAttribute() {
		Token name = ctx.expect(TokenType.NAME, "an attribute name");
		if (!ctx.check(TokenType.ASSIGN)) {
			throw ctx.error(SyntaxErrorKind.PARSE, "Expected '=' after attribute '" + name.value() + "', found "
					+ ctx.peek().describe(), ctx.peek());
		}
		ctx.advance();

		Token value = ctx.peek();
		if (value.isType(TokenType.STRING)) {
			return new MarkupAttribute(name.value(), new TextLiteral(host.parseStringLiteral()));
		}
		if (value.isType(TokenType.LBRACE)) {
			return new MarkupAttribute(name.value(), parseHole());
		}
		throw ctx.error(SyntaxErrorKind.PARSE, "Invalid value for attribute '" + name.value()
				+ "': expected a string literal or {expression}, found " + value.describe(), value);
	}

	/**
	 * {@code '{' HostExpr '}'}. The host grammar parses the body in code mode
	 * and stops at the closing brace, which is consumed here.
	 */
	private ExpressionHole parseHole() {
		Token open = ctx.expect(TokenType.LBRACE, "'{'");
		if (ctx.check(TokenType.RBRACE)) {
			throw ctx.error(SyntaxErrorKind.PARSE, "Empty expression hole", open);
		}
		Expr expression;
		try {
			expression = host.parseExpression();
		} catch (PySyntaxException e) {
			if (!ctx.remainingContains('}', open.position() + 1)) {
				throw ctx.error(SyntaxErrorKind.LEX, "Unterminated expression hole", open);
			}
			throw e;
		}
		Token close = ctx.peek();
		if (close.isType(TokenType.EOF)) {
			throw ctx.error(SyntaxErrorKind.LEX, "Unterminated expression hole", open);
		}
		if (!close.isType(TokenType.RBRACE)) {
			throw ctx.error(SyntaxErrorKind.PARSE,
					"Expected '}' to close expression hole, found " + close.describe(), close);
		}
		ctx.advance();
		return new ExpressionHole(expression);
	}

	/**
	 * Component tags lower to host references, so none of their segments may
	 * be a keyword. An intrinsic such as {@code <if/>} lowers to a string and
	 * is allowed.
	 */
	private TagRef parseTagName(String after) {
		List<Token> tokens = new ArrayList<>();
		tokens.add(expectTagSegment(after));
		while (ctx.match(TokenType.DOT)) {
			tokens.add(expectTagSegment("'.'"));
		}
		TagRef tag = TagRef.of(tokens.stream().map(Token::value).toList());
		if (tag instanceof TagRef.Component) {
			for (Token segment : tokens) {
				if (Keywords.isKeyword(segment.value())) {
					throw ctx.error(SyntaxErrorKind.PARSE, "Keyword '" + segment.value()
							+ "' cannot be used in component tag <" + tag.spelling() + ">", segment);
				}
			}
		}
		return tag;
	}

	private Token expectTagSegment(String after) {
		Token token = ctx.peek();
		if (!token.isType(TokenType.NAME)) {
			throw ctx.error(SyntaxErrorKind.PARSE, "Expected a tag name after " + after + ", found "
					+ token.describe(), token);
		}
		return ctx.advance();
	}

	private PySyntaxException mismatch(String opened, String closedBy, Token at) {
		return ctx.error(SyntaxErrorKind.PARSE,
				"Mismatched closing tag: <" + opened + "> closed by " + closedBy, at);
	}
}
