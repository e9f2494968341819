package org.javai.pyjsx;

import java.util.List;
import java.util.Objects;
import org.javai.pyjsx.ast.Expr;
import org.javai.pyjsx.ast.Module;
import org.javai.pyjsx.config.FrontEndConfig;
import org.javai.pyjsx.config.FrontEndConfigLoader;
import org.javai.pyjsx.lex.MarkupLexer;
import org.javai.pyjsx.lex.Token;
import org.javai.pyjsx.lower.MarkupLowering;
import org.javai.pyjsx.markup.MarkupNode;
import org.javai.pyjsx.parse.ExpressionParser;
import org.javai.pyjsx.parse.ParseContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the front end: parses host source containing markup literals
 * into host AST.
 * <p>
 * Every call parses with a fresh {@link ParseContext}; an instance holds only
 * its immutable configuration and may be shared between threads.
 *
 * <pre>{@code
 * MarkupFrontEnd frontEnd = MarkupFrontEnd.create();
 * Expr call = frontEnd.parseExpression("<a href=\"x\">\"y\"</a>");
 * // jsx("a", {"href": "x"}, ["y"])
 * }</pre>
 */
public final class MarkupFrontEnd {

	private static final Logger logger = LoggerFactory.getLogger(MarkupFrontEnd.class);

	private final FrontEndConfig config;
	private final MarkupLowering lowering;

	private MarkupFrontEnd(FrontEndConfig config) {
		this.config = config;
		this.lowering = new MarkupLowering(config);
	}

	/**
	 * Creates a front end configured from {@code META-INF/pyjsx/frontend.yml}
	 * if present on the classpath, with built-in defaults otherwise.
	 */
	public static MarkupFrontEnd create() {
		return create(new FrontEndConfigLoader().load());
	}

	public static MarkupFrontEnd create(FrontEndConfig config) {
		Objects.requireNonNull(config, "config must not be null");
		return new MarkupFrontEnd(config);
	}

	public FrontEndConfig config() {
		return config;
	}

	/**
	 * Parses a source unit holding a single expression, with markup lowered.
	 *
	 * @throws PySyntaxException on a syntax error
	 */
	public Expr parseExpression(String source) {
		return new ExpressionParser(ParseContext.of(source), lowering).parseEval();
	}

	/**
	 * Parses a whole module.
	 *
	 * @throws PySyntaxException on a syntax error
	 */
	public CompiledModule compileModule(String name, String source) {
		Objects.requireNonNull(name, "name must not be null");
		ParseContext ctx = ParseContext.of(source);
		Module body = new ExpressionParser(ctx, lowering).parseModule();
		CompiledModule module = new CompiledModule(name, body, ctx.markupLiterals());
		logger.debug("Compiled module '{}': {} statement(s), {} markup literal(s)",
				name, body.body().size(), module.markupLiterals());
		return module;
	}

	/**
	 * Parses a source unit consisting of one markup literal, without lowering.
	 */
	public MarkupNode parseMarkup(String source) {
		return new ExpressionParser(ParseContext.of(source), lowering).parseMarkupDocument();
	}

	/**
	 * Tokenizes a source unit, each token tagged with the mode it was read in.
	 */
	public List<Token> tokenize(String source) {
		return new MarkupLexer(source).tokenize();
	}
}
