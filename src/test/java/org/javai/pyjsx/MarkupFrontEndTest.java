package org.javai.pyjsx;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import java.util.List;
import org.apache.logging.log4j.Level;
import org.javai.pyjsx.ast.Expr;
import org.javai.pyjsx.ast.Expr.Call;
import org.javai.pyjsx.ast.Expr.ListExpr;
import org.javai.pyjsx.ast.Stmt;
import org.javai.pyjsx.config.FrontEndConfig;
import org.javai.pyjsx.lex.LexMode;
import org.javai.pyjsx.lex.Token;
import org.javai.pyjsx.lex.Token.TokenType;
import org.javai.pyjsx.markup.MarkupNode;
import org.javai.pyjsx.print.ExprPrettyPrinter;
import org.javai.pyjsx.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MarkupFrontEndTest {

	private static final String PAGE_MODULE = """
			from jsx import jsx
			import sys
			import unittest

			from pathlib import Path


			TEST_DATA = Path(__file__).parent / 'jsx_data'


			tests = [
			    <img src="test.jpg" />,
			    <a href="google.com">"Click here!"</a>,
			    <a href="google.com"><b>"Click here!"</b></a>,
			    <div style={{"color": "red"}}>{"Hello, world!"}</div>,
			    <div>
			        {[<p>f"Row: {i}"</p> for i in range(10)]}
			    </div>,
			    <p style={{'backgroundColor': 'blue', 'marginTop': '10px'}}>"test"</p>,
			    <div>
			        <h1>"Title"</h1>
			        <p>"Paragraph"</p>
			        {<footer/> if True else None}
			    </div>
			]
			""";

	private MarkupFrontEnd frontEnd;

	@BeforeEach
	void setUp() {
		frontEnd = MarkupFrontEnd.create();
	}

	private String lowered(String source) {
		return ExprPrettyPrinter.print(frontEnd.parseExpression(source));
	}

	@Nested
	@DisplayName("Lowering scenarios")
	class Scenarios {

		@Test
		void emptyElement() {
			assertThat(lowered("<div></div>")).isEqualTo("jsx(\"div\", {}, [])");
		}

		@Test
		void selfClosingElement() {
			assertThat(lowered("<img />")).isEqualTo("jsx(\"img\", {}, [])");
		}

		@Test
		void attributeAndText() {
			assertThat(lowered("<a href=\"example.com\">\"Click me!\"</a>"))
					.isEqualTo("jsx(\"a\", {\"href\": \"example.com\"}, [\"Click me!\"])");
		}

		@Test
		void fragmentOfParagraphs() {
			assertThat(lowered("<><p>\"1st\"</p><p>\"2nd\"</p></>"))
					.isEqualTo("jsx(None, {}, [jsx(\"p\", {}, [\"1st\"]), jsx(\"p\", {}, [\"2nd\"])])");
		}

		@Test
		void mismatchedClosingTagIsReportedAtTheClosingTag() {
			assertThatThrownBy(() -> frontEnd.parseExpression("<div></span>"))
					.isInstanceOfSatisfying(PySyntaxException.class, e -> {
						assertThat(e.getKind()).isEqualTo(SyntaxErrorKind.PARSE);
						assertThat(e.getLine()).isEqualTo(1);
						assertThat(e.getColumn()).isEqualTo(6);
						assertThat(e.getDetail()).isEqualTo("Mismatched closing tag: <div> closed by </span>");
					});
		}

		@Test
		void comprehensionHoleIsKeptAsOneChild() {
			Expr expr = frontEnd.parseExpression("<p>{[ \"x\" for i in range(3) ]}</p>");

			Call call = (Call) expr;
			assertThat(((ListExpr) call.args().get(2)).elements()).singleElement()
					.isEqualTo(frontEnd.parseExpression("[\"x\" for i in range(3)]"));
		}
	}

	@Nested
	@DisplayName("Nesting")
	class Nesting {

		@Test
		void holesAndMarkupAlternateFourLevelsDeep() {
			assertThat(lowered("<a>{<b>{<c>{<d>{x}</d>}</c>}</b>}</a>")).isEqualTo(
					"jsx(\"a\", {}, [jsx(\"b\", {}, [jsx(\"c\", {}, [jsx(\"d\", {}, [x])])])])");
		}

		@Test
		void mixedChildrenKeepSourceOrder() {
			assertThat(lowered("<p>\"Hello, \"{name}\"!\"<br/>{count}</p>")).isEqualTo(
					"jsx(\"p\", {}, [\"Hello, \", name, \"!\", jsx(\"br\", {}, []), count])");
		}

		@Test
		void markupInsideAnFStringField() {
			assertThat(lowered("f\"<{<b>'x'</b>}>\"")).isEqualTo("f\"<{jsx('b', {}, ['x'])}>\"");
		}
	}

	@Nested
	@DisplayName("Modules")
	class Modules {

		@Test
		void compilesAPageModule() {
			CompiledModule module = frontEnd.compileModule("test_jsx", PAGE_MODULE);

			assertThat(module.name()).isEqualTo("test_jsx");
			assertThat(module.body().body()).hasSize(6);
			assertThat(module.body().body().get(0))
					.isEqualTo(new Stmt.ImportFrom("jsx", List.of(new Stmt.Alias("jsx", null))));
			assertThat(module.markupLiterals()).isEqualTo(9);
			assertThat(module.usesMarkup()).isTrue();

			Stmt.Assign tests = (Stmt.Assign) module.body().body().get(5);
			assertThat(((ListExpr) tests.value()).elements()).hasSize(7).allSatisfy(
					element -> assertThat(element).isInstanceOf(Call.class));
		}

		@Test
		void moduleWithoutMarkup() {
			CompiledModule module = frontEnd.compileModule("plain", "x = a < b\ny = x << 2\n");

			assertThat(module.usesMarkup()).isFalse();
			assertThat(module.body().body()).hasSize(2);
		}

		@Test
		void compilationIsLoggedAtDebug() {
			try (LogCaptorAppender logs = LogCaptorAppender.create(MarkupFrontEnd.class, Level.DEBUG)) {
				frontEnd.compileModule("page", "x = <br/>\n");

				assertThat(logs.messagesAt(Level.DEBUG))
						.containsExactly("Compiled module 'page': 1 statement(s), 1 markup literal(s)");
			}
		}

		@Test
		void firstErrorAbortsTheModule() {
			assertThatThrownBy(() -> frontEnd.compileModule("broken", "a = 1\nb = <p>Hello</p>\nc = <div></span>\n"))
					.isInstanceOf(PySyntaxException.class)
					.hasMessage("line 2:8 Text content must be a quoted string literal, found 'Hello'");
		}
	}

	@Nested
	@DisplayName("Other entry points")
	class EntryPoints {

		@Test
		void parseMarkupReturnsTheUnloweredTree() {
			MarkupNode node = frontEnd.parseMarkup("<Card title=\"t\" />");

			assertThat(node).isInstanceOf(MarkupNode.Element.class);
		}

		@Test
		void tokenizeTagsTokensWithTheirMode() {
			List<Token> tokens = frontEnd.tokenize("x = <b>\"y\"</b>");

			assertThat(tokens).extracting(Token::type, Token::mode).containsExactly(
					tuple(TokenType.NAME, LexMode.CODE),
					tuple(TokenType.ASSIGN, LexMode.CODE),
					tuple(TokenType.TAG_OPEN, LexMode.TAG),
					tuple(TokenType.NAME, LexMode.TAG),
					tuple(TokenType.TAG_END, LexMode.TAG),
					tuple(TokenType.STRING, LexMode.TEXT),
					tuple(TokenType.TAG_OPEN_CLOSE, LexMode.TEXT),
					tuple(TokenType.NAME, LexMode.TAG),
					tuple(TokenType.TAG_END, LexMode.TAG),
					tuple(TokenType.EOF, LexMode.CODE));
		}

		@Test
		void configuredFrontEnd() {
			MarkupFrontEnd custom = MarkupFrontEnd.create(new FrontEndConfig("h", "Fragment"));

			assertThat(ExprPrettyPrinter.print(custom.parseExpression("<></>"))).isEqualTo("h(Fragment, {}, [])");
			assertThat(custom.config().elementConstructor()).isEqualTo("h");
		}

		@Test
		void frontEndIsReusable() {
			assertThatThrownBy(() -> frontEnd.parseExpression("<a>")).isInstanceOf(PySyntaxException.class);

			assertThat(lowered("<i/>")).isEqualTo("jsx(\"i\", {}, [])");
		}

		@Test
		void nullConfigIsRejected() {
			assertThatThrownBy(() -> MarkupFrontEnd.create(null)).isInstanceOf(NullPointerException.class);
		}
	}
}
