package org.javai.pyjsx.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.javai.pyjsx.SyntaxErrorKind;
import org.javai.pyjsx.ast.Expr;
import org.javai.pyjsx.ast.Expr.Attribute;
import org.javai.pyjsx.ast.Expr.BinOp;
import org.javai.pyjsx.ast.Expr.BoolOp;
import org.javai.pyjsx.ast.Expr.BooleanLiteral;
import org.javai.pyjsx.ast.Expr.Call;
import org.javai.pyjsx.ast.Expr.Compare;
import org.javai.pyjsx.ast.Expr.Comprehension;
import org.javai.pyjsx.ast.Expr.DictComp;
import org.javai.pyjsx.ast.Expr.DictExpr;
import org.javai.pyjsx.ast.Expr.GeneratorExp;
import org.javai.pyjsx.ast.Expr.IfExp;
import org.javai.pyjsx.ast.Expr.Keyword;
import org.javai.pyjsx.ast.Expr.Lambda;
import org.javai.pyjsx.ast.Expr.ListComp;
import org.javai.pyjsx.ast.Expr.ListExpr;
import org.javai.pyjsx.ast.Expr.Name;
import org.javai.pyjsx.ast.Expr.NoneLiteral;
import org.javai.pyjsx.ast.Expr.NumberLiteral;
import org.javai.pyjsx.ast.Expr.SetComp;
import org.javai.pyjsx.ast.Expr.SetExpr;
import org.javai.pyjsx.ast.Expr.Slice;
import org.javai.pyjsx.ast.Expr.Subscript;
import org.javai.pyjsx.ast.Expr.TupleExpr;
import org.javai.pyjsx.ast.Expr.UnaryOp;
import org.javai.pyjsx.ast.Module;
import org.javai.pyjsx.ast.Stmt;
import org.javai.pyjsx.lex.Keywords;
import org.javai.pyjsx.lex.LexMode;
import org.javai.pyjsx.lex.Token;
import org.javai.pyjsx.lex.Token.TokenType;
import org.javai.pyjsx.lower.MarkupLowering;
import org.javai.pyjsx.markup.MarkupNode;
import org.javai.pyjsx.markup.MarkupParser;

/**
 * Recursive-descent parser for host expressions and simple statements.
 * <p>
 * Markup literals are recognised in {@link #parseAtom()}: when the lexer reads
 * a tag opener where an operand may start, the literal is handed to the
 * {@link MarkupParser}, which calls back into this parser for its expression
 * holes, and the result is lowered to ordinary call AST on the spot.
 */
public final class ExpressionParser implements HostExpressionGrammar {

	private static final Set<String> COMPOUND_STATEMENTS = Set.of(
			"def", "class", "if", "elif", "else", "for", "while", "try", "except", "finally", "with",
			"async", "return", "yield", "pass", "break", "continue", "raise", "del", "global", "nonlocal",
			"assert");

	private final ParseContext ctx;
	private final MarkupLowering lowering;
	private final MarkupParser markup;
	private final StringLiteralParser strings;

	public ExpressionParser(ParseContext ctx, MarkupLowering lowering) {
		this.ctx = ctx;
		this.lowering = lowering;
		this.markup = new MarkupParser(ctx, this);
		this.strings = new StringLiteralParser(ctx, this::parseField);
	}

	// ==================== Entry points ====================

	/**
	 * Parses a whole source unit as a list of simple statements.
	 */
	public Module parseModule() {
		List<Stmt> body = new ArrayList<>();
		while (true) {
			while (ctx.match(TokenType.NEWLINE) || ctx.match(TokenType.SEMICOLON)) {
				// blank lines and empty statements
			}
			if (ctx.check(TokenType.EOF)) {
				return new Module(body);
			}
			body.add(parseStatement());
			while (ctx.match(TokenType.SEMICOLON)) {
				if (ctx.check(TokenType.NEWLINE) || ctx.check(TokenType.EOF)) {
					break;
				}
				body.add(parseStatement());
			}
			if (!ctx.check(TokenType.EOF)) {
				ctx.expect(TokenType.NEWLINE, "end of line");
			}
		}
	}

	/**
	 * Parses a source unit consisting of a single expression (list).
	 */
	public Expr parseEval() {
		skipNewlines();
		Expr expr = parseExpressionList();
		skipNewlines();
		ctx.expect(TokenType.EOF, "end of input");
		return expr;
	}

	/**
	 * Parses a source unit consisting of exactly one markup literal and
	 * returns it without lowering.
	 */
	public MarkupNode parseMarkupDocument() {
		skipNewlines();
		if (!isMarkupStart(ctx.peek())) {
			throw ctx.error(SyntaxErrorKind.PARSE, "Expected a markup literal, found " + ctx.peek().describe(),
					ctx.peek());
		}
		MarkupNode node = markup.parseMarkupLiteral();
		ctx.markupLiteralParsed();
		skipNewlines();
		ctx.expect(TokenType.EOF, "end of input");
		return node;
	}

	@Override
	public Expr parseExpression() {
		if (ctx.checkKeyword("lambda")) {
			return parseLambda();
		}
		Expr body = parseOr();
		if (ctx.matchKeyword("if")) {
			Expr test = parseOr();
			ctx.expectKeyword("else");
			Expr orElse = parseExpression();
			return new IfExp(test, body, orElse);
		}
		return body;
	}

	@Override
	public Expr parseStringLiteral() {
		List<Token> tokens = new ArrayList<>();
		tokens.add(ctx.expect(TokenType.STRING, "a string literal"));
		while (ctx.check(TokenType.STRING)) {
			tokens.add(ctx.advance());
		}
		return strings.parse(tokens);
	}

	/**
	 * {@code expr (',' expr)* [',']}; a comma makes a tuple.
	 */
	public Expr parseExpressionList() {
		Expr first = parseExpression();
		if (!ctx.check(TokenType.COMMA)) {
			return first;
		}
		List<Expr> elements = new ArrayList<>();
		elements.add(first);
		while (ctx.match(TokenType.COMMA)) {
			if (!startsExpression(ctx.peek())) {
				break;
			}
			elements.add(parseExpression());
		}
		return new TupleExpr(elements);
	}

	/**
	 * Parses the expression of an f-string replacement field.
	 */
	Expr parseField(int start, int end) {
		ParseContext field = ctx.nested(start, end);
		ExpressionParser parser = new ExpressionParser(field, lowering);
		Expr expr = parser.parseExpressionList();
		parser.skipNewlines();
		if (!field.check(TokenType.EOF)) {
			throw field.error(SyntaxErrorKind.PARSE, "f-string: expecting '}', found " + field.peek().describe(),
					field.peek());
		}
		return expr;
	}

	// ==================== Statements ====================

	private Stmt parseStatement() {
		Token start = ctx.peek();
		if (ctx.checkKeyword("import")) {
			return parseImport();
		}
		if (ctx.checkKeyword("from")) {
			return parseImportFrom();
		}
		if (start.mode() == LexMode.CODE && COMPOUND_STATEMENTS.contains(start.value())
				&& start.isType(TokenType.NAME)) {
			throw ctx.error(SyntaxErrorKind.PARSE, "Unsupported statement: '" + start.value() + "'", start);
		}

		Expr first = parseExpressionList();
		if (!ctx.check(TokenType.ASSIGN)) {
			return new Stmt.ExprStmt(first);
		}

		List<Expr> targets = new ArrayList<>();
		Token valueStart = start;
		Expr value = first;
		while (ctx.match(TokenType.ASSIGN)) {
			checkAssignable(value, valueStart);
			targets.add(value);
			valueStart = ctx.peek();
			value = parseExpressionList();
		}
		return new Stmt.Assign(targets, value);
	}

	private void checkAssignable(Expr target, Token at) {
		if (target instanceof Name || target instanceof Attribute || target instanceof Subscript) {
			return;
		}
		if (target instanceof TupleExpr tuple) {
			tuple.elements().forEach(e -> checkAssignable(e, at));
			return;
		}
		if (target instanceof ListExpr list) {
			list.elements().forEach(e -> checkAssignable(e, at));
			return;
		}
		throw ctx.error(SyntaxErrorKind.PARSE, "Cannot assign to expression", at);
	}

	private Stmt parseImport() {
		ctx.expectKeyword("import");
		List<Stmt.Alias> names = new ArrayList<>();
		do {
			String name = parseDottedName();
			names.add(new Stmt.Alias(name, parseAsName()));
		} while (ctx.match(TokenType.COMMA));
		return new Stmt.Import(names);
	}

	private Stmt parseImportFrom() {
		ctx.expectKeyword("from");
		StringBuilder module = new StringBuilder();
		while (ctx.match(TokenType.DOT)) {
			module.append('.');
		}
		if (!ctx.checkKeyword("import")) {
			module.append(parseDottedName());
		}
		ctx.expectKeyword("import");

		List<Stmt.Alias> names = new ArrayList<>();
		if (ctx.match(TokenType.STAR)) {
			names.add(new Stmt.Alias("*", null));
			return new Stmt.ImportFrom(module.toString(), names);
		}
		boolean parenthesized = ctx.match(TokenType.LPAREN);
		do {
			if (parenthesized && ctx.check(TokenType.RPAREN)) {
				break;
			}
			String name = parseIdentifier("an imported name");
			names.add(new Stmt.Alias(name, parseAsName()));
		} while (ctx.match(TokenType.COMMA));
		if (parenthesized) {
			ctx.expect(TokenType.RPAREN, "')'");
		}
		return new Stmt.ImportFrom(module.toString(), names);
	}

	private String parseDottedName() {
		StringBuilder name = new StringBuilder(parseIdentifier("a module name"));
		while (ctx.match(TokenType.DOT)) {
			name.append('.').append(parseIdentifier("a module name"));
		}
		return name.toString();
	}

	private String parseAsName() {
		return ctx.matchKeyword("as") ? parseIdentifier("a name after 'as'") : null;
	}

	private String parseIdentifier(String expected) {
		Token token = ctx.peek();
		if (!token.isType(TokenType.NAME) || Keywords.isKeyword(token.value())) {
			throw ctx.error(SyntaxErrorKind.PARSE, "Expected " + expected + ", found " + token.describe(), token);
		}
		return ctx.advance().value();
	}

	// ==================== Expressions ====================

	private Expr parseLambda() {
		ctx.expectKeyword("lambda");
		List<String> params = new ArrayList<>();
		if (!ctx.check(TokenType.COLON)) {
			do {
				params.add(parseIdentifier("a parameter name"));
			} while (ctx.match(TokenType.COMMA) && !ctx.check(TokenType.COLON));
		}
		ctx.expect(TokenType.COLON, "':'");
		return new Lambda(params, parseExpression());
	}

	private Expr parseOr() {
		Expr first = parseAnd();
		if (!ctx.checkKeyword("or")) {
			return first;
		}
		List<Expr> values = new ArrayList<>(List.of(first));
		while (ctx.matchKeyword("or")) {
			values.add(parseAnd());
		}
		return new BoolOp(BoolOp.Operator.OR, values);
	}

	private Expr parseAnd() {
		Expr first = parseNot();
		if (!ctx.checkKeyword("and")) {
			return first;
		}
		List<Expr> values = new ArrayList<>(List.of(first));
		while (ctx.matchKeyword("and")) {
			values.add(parseNot());
		}
		return new BoolOp(BoolOp.Operator.AND, values);
	}

	private Expr parseNot() {
		if (ctx.matchKeyword("not")) {
			return new UnaryOp(UnaryOp.Operator.NOT, parseNot());
		}
		return parseComparison();
	}

	private Expr parseComparison() {
		Expr left = parseBitOr();
		List<Compare.Operator> ops = new ArrayList<>();
		List<Expr> comparators = new ArrayList<>();
		Compare.Operator op;
		while ((op = matchComparisonOperator()) != null) {
			ops.add(op);
			comparators.add(parseBitOr());
		}
		return ops.isEmpty() ? left : new Compare(left, ops, comparators);
	}

	private Compare.Operator matchComparisonOperator() {
		Compare.Operator op = switch (ctx.peek().type()) {
			case LESS -> Compare.Operator.LT;
			case GREATER -> Compare.Operator.GT;
			case LESS_EQUAL -> Compare.Operator.LT_E;
			case GREATER_EQUAL -> Compare.Operator.GT_E;
			case EQUAL_EQUAL -> Compare.Operator.EQ;
			case NOT_EQUAL -> Compare.Operator.NOT_EQ;
			default -> null;
		};
		if (op != null) {
			ctx.advance();
			return op;
		}
		if (ctx.matchKeyword("in")) {
			return Compare.Operator.IN;
		}
		if (ctx.matchKeyword("not")) {
			ctx.expectKeyword("in");
			return Compare.Operator.NOT_IN;
		}
		if (ctx.matchKeyword("is")) {
			return ctx.matchKeyword("not") ? Compare.Operator.IS_NOT : Compare.Operator.IS;
		}
		return null;
	}

	private Expr parseBitOr() {
		Expr left = parseBitXor();
		while (ctx.match(TokenType.PIPE)) {
			left = new BinOp(left, BinOp.Operator.BIT_OR, parseBitXor());
		}
		return left;
	}

	private Expr parseBitXor() {
		Expr left = parseBitAnd();
		while (ctx.match(TokenType.CARET)) {
			left = new BinOp(left, BinOp.Operator.BIT_XOR, parseBitAnd());
		}
		return left;
	}

	private Expr parseBitAnd() {
		Expr left = parseShift();
		while (ctx.match(TokenType.AMPERSAND)) {
			left = new BinOp(left, BinOp.Operator.BIT_AND, parseShift());
		}
		return left;
	}

	private Expr parseShift() {
		Expr left = parseArith();
		while (true) {
			if (ctx.match(TokenType.LEFT_SHIFT)) {
				left = new BinOp(left, BinOp.Operator.LSHIFT, parseArith());
			} else if (ctx.match(TokenType.RIGHT_SHIFT)) {
				left = new BinOp(left, BinOp.Operator.RSHIFT, parseArith());
			} else {
				return left;
			}
		}
	}

	private Expr parseArith() {
		Expr left = parseTerm();
		while (true) {
			if (ctx.match(TokenType.PLUS)) {
				left = new BinOp(left, BinOp.Operator.ADD, parseTerm());
			} else if (ctx.match(TokenType.MINUS)) {
				left = new BinOp(left, BinOp.Operator.SUB, parseTerm());
			} else {
				return left;
			}
		}
	}

	private Expr parseTerm() {
		Expr left = parseFactor();
		while (true) {
			BinOp.Operator op = switch (ctx.peek().type()) {
				case STAR -> BinOp.Operator.MULT;
				case SLASH -> BinOp.Operator.DIV;
				case DOUBLE_SLASH -> BinOp.Operator.FLOOR_DIV;
				case PERCENT -> BinOp.Operator.MOD;
				case AT -> BinOp.Operator.MAT_MULT;
				default -> null;
			};
			if (op == null) {
				return left;
			}
			ctx.advance();
			left = new BinOp(left, op, parseFactor());
		}
	}

	private Expr parseFactor() {
		if (ctx.match(TokenType.PLUS)) {
			return new UnaryOp(UnaryOp.Operator.PLUS, parseFactor());
		}
		if (ctx.match(TokenType.MINUS)) {
			return new UnaryOp(UnaryOp.Operator.MINUS, parseFactor());
		}
		if (ctx.match(TokenType.TILDE)) {
			return new UnaryOp(UnaryOp.Operator.INVERT, parseFactor());
		}
		return parsePower();
	}

	private Expr parsePower() {
		Expr base = parsePrimary();
		if (ctx.match(TokenType.DOUBLE_STAR)) {
			// right-associative, and binds tighter than a unary operator on its left only
			return new BinOp(base, BinOp.Operator.POW, parseFactor());
		}
		return base;
	}

	private Expr parsePrimary() {
		Expr expr = parseAtom();
		while (true) {
			if (ctx.match(TokenType.DOT)) {
				expr = new Attribute(expr, parseIdentifier("an attribute name"));
			} else if (ctx.match(TokenType.LPAREN)) {
				expr = parseCall(expr);
			} else if (ctx.match(TokenType.LBRACKET)) {
				expr = new Subscript(expr, parseSubscriptList());
				ctx.expect(TokenType.RBRACKET, "']'");
			} else {
				return expr;
			}
		}
	}

	private Expr parseCall(Expr func) {
		List<Expr> args = new ArrayList<>();
		List<Keyword> keywords = new ArrayList<>();
		while (!ctx.check(TokenType.RPAREN)) {
			Token start = ctx.peek();
			Expr arg = parseExpression();
			if (ctx.match(TokenType.ASSIGN)) {
				if (!(arg instanceof Name name)) {
					throw ctx.error(SyntaxErrorKind.PARSE, "Expression cannot be a keyword argument", start);
				}
				keywords.add(new Keyword(name.id(), parseExpression()));
			} else {
				if (!keywords.isEmpty()) {
					throw ctx.error(SyntaxErrorKind.PARSE, "Positional argument follows keyword argument", start);
				}
				if (ctx.checkKeyword("for")) {
					arg = new GeneratorExp(arg, parseComprehensionClauses());
				}
				args.add(arg);
			}
			if (!ctx.match(TokenType.COMMA)) {
				break;
			}
		}
		ctx.expect(TokenType.RPAREN, "')'");
		return new Call(func, args, keywords);
	}

	private Expr parseSubscriptList() {
		Expr first = parseSubscript();
		if (!ctx.check(TokenType.COMMA)) {
			return first;
		}
		List<Expr> elements = new ArrayList<>(List.of(first));
		while (ctx.match(TokenType.COMMA) && !ctx.check(TokenType.RBRACKET)) {
			elements.add(parseSubscript());
		}
		return new TupleExpr(elements);
	}

	private Expr parseSubscript() {
		Expr lower = ctx.check(TokenType.COLON) ? null : parseExpression();
		if (!ctx.match(TokenType.COLON)) {
			return lower;
		}
		Expr upper = startsExpression(ctx.peek()) ? parseExpression() : null;
		Expr step = null;
		if (ctx.match(TokenType.COLON) && startsExpression(ctx.peek())) {
			step = parseExpression();
		}
		return new Slice(lower, upper, step);
	}

	// ==================== Atoms ====================

	private Expr parseAtom() {
		Token token = ctx.peek();

		if (isMarkupStart(token)) {
			MarkupNode node = markup.parseMarkupLiteral();
			ctx.markupLiteralParsed();
			return lowering.lower(node);
		}

		switch (token.type()) {
			case NAME -> {
				return parseNameAtom(token);
			}
			case NUMBER -> {
				ctx.advance();
				return new NumberLiteral(token.value());
			}
			case STRING -> {
				return parseStringLiteral();
			}
			case LPAREN -> {
				return parseParenthesized();
			}
			case LBRACKET -> {
				return parseListDisplay();
			}
			case LBRACE -> {
				return parseBraceDisplay();
			}
			case EOF -> throw ctx.error(SyntaxErrorKind.PARSE, "Unexpected end of input", token);
			default -> throw ctx.error(SyntaxErrorKind.PARSE, "Unexpected token " + token.describe(), token);
		}
	}

	private Expr parseNameAtom(Token token) {
		switch (token.value()) {
			case "True" -> {
				ctx.advance();
				return new BooleanLiteral(true);
			}
			case "False" -> {
				ctx.advance();
				return new BooleanLiteral(false);
			}
			case "None" -> {
				ctx.advance();
				return NoneLiteral.INSTANCE;
			}
			default -> {
				if (Keywords.isKeyword(token.value())) {
					throw ctx.error(SyntaxErrorKind.PARSE, "Unexpected keyword '" + token.value() + "'", token);
				}
				ctx.advance();
				return new Name(token.value());
			}
		}
	}

	private Expr parseParenthesized() {
		ctx.expect(TokenType.LPAREN, "'('");
		if (ctx.match(TokenType.RPAREN)) {
			return new TupleExpr(List.of());
		}
		Expr first = parseExpression();
		if (ctx.checkKeyword("for")) {
			Expr generator = new GeneratorExp(first, parseComprehensionClauses());
			ctx.expect(TokenType.RPAREN, "')'");
			return generator;
		}
		if (!ctx.check(TokenType.COMMA)) {
			ctx.expect(TokenType.RPAREN, "')'");
			return first;
		}
		List<Expr> elements = new ArrayList<>(List.of(first));
		while (ctx.match(TokenType.COMMA) && !ctx.check(TokenType.RPAREN)) {
			elements.add(parseExpression());
		}
		ctx.expect(TokenType.RPAREN, "')'");
		return new TupleExpr(elements);
	}

	private Expr parseListDisplay() {
		ctx.expect(TokenType.LBRACKET, "'['");
		if (ctx.match(TokenType.RBRACKET)) {
			return new ListExpr(List.of());
		}
		Expr first = parseExpression();
		if (ctx.checkKeyword("for")) {
			Expr comprehension = new ListComp(first, parseComprehensionClauses());
			ctx.expect(TokenType.RBRACKET, "']'");
			return comprehension;
		}
		List<Expr> elements = new ArrayList<>(List.of(first));
		while (ctx.match(TokenType.COMMA) && !ctx.check(TokenType.RBRACKET)) {
			elements.add(parseExpression());
		}
		ctx.expect(TokenType.RBRACKET, "']'");
		return new ListExpr(elements);
	}

	private Expr parseBraceDisplay() {
		ctx.expect(TokenType.LBRACE, "'{'");
		if (ctx.match(TokenType.RBRACE)) {
			return new DictExpr(List.of(), List.of());
		}
		Expr first = parseExpression();

		if (ctx.match(TokenType.COLON)) {
			Expr firstValue = parseExpression();
			if (ctx.checkKeyword("for")) {
				Expr comprehension = new DictComp(first, firstValue, parseComprehensionClauses());
				ctx.expect(TokenType.RBRACE, "'}'");
				return comprehension;
			}
			List<Expr> keys = new ArrayList<>(List.of(first));
			List<Expr> values = new ArrayList<>(List.of(firstValue));
			while (ctx.match(TokenType.COMMA) && !ctx.check(TokenType.RBRACE)) {
				keys.add(parseExpression());
				ctx.expect(TokenType.COLON, "':'");
				values.add(parseExpression());
			}
			ctx.expect(TokenType.RBRACE, "'}'");
			return new DictExpr(keys, values);
		}

		if (ctx.checkKeyword("for")) {
			Expr comprehension = new SetComp(first, parseComprehensionClauses());
			ctx.expect(TokenType.RBRACE, "'}'");
			return comprehension;
		}
		List<Expr> elements = new ArrayList<>(List.of(first));
		while (ctx.match(TokenType.COMMA) && !ctx.check(TokenType.RBRACE)) {
			elements.add(parseExpression());
		}
		ctx.expect(TokenType.RBRACE, "'}'");
		return new SetExpr(elements);
	}

	private List<Comprehension> parseComprehensionClauses() {
		List<Comprehension> generators = new ArrayList<>();
		while (ctx.matchKeyword("for")) {
			Token targetStart = ctx.peek();
			Expr target = parseTargetList();
			checkAssignable(target, targetStart);
			ctx.expectKeyword("in");
			Expr iter = parseOr();
			List<Expr> ifs = new ArrayList<>();
			while (ctx.matchKeyword("if")) {
				ifs.add(parseOr());
			}
			generators.add(new Comprehension(target, iter, ifs));
		}
		return generators;
	}

	private Expr parseTargetList() {
		Expr first = parseBitOr();
		if (!ctx.check(TokenType.COMMA)) {
			return first;
		}
		List<Expr> elements = new ArrayList<>(List.of(first));
		while (ctx.match(TokenType.COMMA) && !ctx.checkKeyword("in")) {
			elements.add(parseBitOr());
		}
		return new TupleExpr(elements);
	}

	// ==================== Helpers ====================

	private static boolean isMarkupStart(Token token) {
		return token.mode() == LexMode.TAG
				&& (token.isType(TokenType.TAG_OPEN) || token.isType(TokenType.FRAGMENT_OPEN));
	}

	private static boolean startsExpression(Token token) {
		if (isMarkupStart(token)) {
			return true;
		}
		return switch (token.type()) {
			case NUMBER, STRING, LPAREN, LBRACKET, LBRACE, PLUS, MINUS, TILDE -> true;
			case NAME -> !Keywords.isKeyword(token.value()) || Keywords.isConstant(token.value())
					|| token.value().equals("not") || token.value().equals("lambda");
			default -> false;
		};
	}

	private void skipNewlines() {
		while (ctx.match(TokenType.NEWLINE)) {
			// skip
		}
	}
}
