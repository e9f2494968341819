package org.javai.pyjsx.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.javai.pyjsx.PySyntaxException;
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
import org.javai.pyjsx.ast.Expr.StringLiteral;
import org.javai.pyjsx.ast.Expr.Subscript;
import org.javai.pyjsx.ast.Expr.TupleExpr;
import org.javai.pyjsx.ast.Expr.UnaryOp;
import org.javai.pyjsx.ast.Module;
import org.javai.pyjsx.ast.Stmt;
import org.javai.pyjsx.config.FrontEndConfig;
import org.javai.pyjsx.lower.MarkupLowering;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ExpressionParserTest {

	private static Expr parse(String source) {
		return parser(source).parseEval();
	}

	private static Module parseModule(String source) {
		return parser(source).parseModule();
	}

	private static ExpressionParser parser(String source) {
		return new ExpressionParser(ParseContext.of(source), new MarkupLowering(FrontEndConfig.defaults()));
	}

	private static Name name(String id) {
		return new Name(id);
	}

	private static NumberLiteral num(String text) {
		return new NumberLiteral(text);
	}

	@Nested
	@DisplayName("Operator precedence")
	class Precedence {

		@Test
		void multiplicationBindsTighterThanAddition() {
			assertThat(parse("a + b * c")).isEqualTo(
					new BinOp(name("a"), BinOp.Operator.ADD, new BinOp(name("b"), BinOp.Operator.MULT, name("c"))));
		}

		@Test
		void subtractionIsLeftAssociative() {
			assertThat(parse("a - b - c")).isEqualTo(
					new BinOp(new BinOp(name("a"), BinOp.Operator.SUB, name("b")), BinOp.Operator.SUB, name("c")));
		}

		@Test
		void powerIsRightAssociativeAndBindsTighterThanUnaryMinusOnItsLeft() {
			assertThat(parse("-x ** 2")).isEqualTo(
					new UnaryOp(UnaryOp.Operator.MINUS, new BinOp(name("x"), BinOp.Operator.POW, num("2"))));
			assertThat(parse("2 ** -1")).isEqualTo(
					new BinOp(num("2"), BinOp.Operator.POW, new UnaryOp(UnaryOp.Operator.MINUS, num("1"))));
			assertThat(parse("a ** b ** c")).isEqualTo(
					new BinOp(name("a"), BinOp.Operator.POW, new BinOp(name("b"), BinOp.Operator.POW, name("c"))));
		}

		@Test
		void bitwiseOperatorsNestByStrength() {
			assertThat(parse("a | b ^ c & d << 1")).isEqualTo(
					new BinOp(name("a"), BinOp.Operator.BIT_OR,
							new BinOp(name("b"), BinOp.Operator.BIT_XOR,
									new BinOp(name("c"), BinOp.Operator.BIT_AND,
											new BinOp(name("d"), BinOp.Operator.LSHIFT, num("1"))))));
		}

		@Test
		void booleanOperatorsCollectOperands() {
			assertThat(parse("not a and b or c or d")).isEqualTo(
					new BoolOp(BoolOp.Operator.OR, List.of(
							new BoolOp(BoolOp.Operator.AND, List.of(new UnaryOp(UnaryOp.Operator.NOT, name("a")), name("b"))),
							name("c"),
							name("d"))));
		}

		@Test
		void comparisonsChain() {
			assertThat(parse("a < b <= c")).isEqualTo(
					new Compare(name("a"), List.of(Compare.Operator.LT, Compare.Operator.LT_E), List.of(name("b"), name("c"))));
		}

		@Test
		void twoWordComparisonOperators() {
			assertThat(parse("x not in y")).isEqualTo(
					new Compare(name("x"), List.of(Compare.Operator.NOT_IN), List.of(name("y"))));
			assertThat(parse("x is not None")).isEqualTo(
					new Compare(name("x"), List.of(Compare.Operator.IS_NOT), List.of(NoneLiteral.INSTANCE)));
		}

		@Test
		void conditionalExpressionIsRightNested() {
			assertThat(parse("a if b else c if d else e")).isEqualTo(
					new IfExp(name("b"), name("a"), new IfExp(name("d"), name("c"), name("e"))));
		}

		@Test
		void lambdaTakesTheWholeConditionalAsBody() {
			assertThat(parse("lambda x, y: x if y else None")).isEqualTo(
					new Lambda(List.of("x", "y"), new IfExp(name("y"), name("x"), NoneLiteral.INSTANCE)));
			assertThat(parse("lambda: 0")).isEqualTo(new Lambda(List.of(), num("0")));
		}
	}

	@Nested
	@DisplayName("Primaries")
	class Primaries {

		@Test
		void attributeCallAndSubscriptChain() {
			assertThat(parse("a.b(c)[0]")).isEqualTo(
					new Subscript(new Call(new Attribute(name("a"), "b"), List.of(name("c")), List.of()), num("0")));
		}

		@Test
		void callWithKeywordArguments() {
			assertThat(parse("f(a, key=1,)")).isEqualTo(
					new Call(name("f"), List.of(name("a")), List.of(new Keyword("key", num("1")))));
		}

		@Test
		void callWithBareGeneratorArgument() {
			Expr expr = parse("sum(x for x in xs)");

			assertThat(expr).isEqualTo(new Call(name("sum"),
					List.of(new GeneratorExp(name("x"), List.of(new Comprehension(name("x"), name("xs"), List.of())))),
					List.of()));
		}

		@Test
		void slices() {
			assertThat(parse("a[1:2]")).isEqualTo(new Subscript(name("a"), new Slice(num("1"), num("2"), null)));
			assertThat(parse("a[::2]")).isEqualTo(new Subscript(name("a"), new Slice(null, null, num("2"))));
			assertThat(parse("a[:]")).isEqualTo(new Subscript(name("a"), new Slice(null, null, null)));
			assertThat(parse("a[i, j]")).isEqualTo(
					new Subscript(name("a"), new TupleExpr(List.of(name("i"), name("j")))));
		}

		@Test
		void positionalArgumentAfterKeywordIsRejected() {
			assertThatThrownBy(() -> parse("f(k=1, a)"))
					.isInstanceOf(PySyntaxException.class)
					.hasMessage("line 1:8 Positional argument follows keyword argument");
		}

		@Test
		void keywordMustBeAPlainName() {
			assertThatThrownBy(() -> parse("f(a.b=1)"))
					.isInstanceOf(PySyntaxException.class)
					.hasMessage("line 1:3 Expression cannot be a keyword argument");
		}
	}

	@Nested
	@DisplayName("Atoms and displays")
	class Displays {

		@Test
		void constants() {
			assertThat(parse("True")).isEqualTo(new BooleanLiteral(true));
			assertThat(parse("False")).isEqualTo(new BooleanLiteral(false));
			assertThat(parse("None")).isEqualTo(NoneLiteral.INSTANCE);
			assertThat(parse("0x1f")).isEqualTo(num("0x1f"));
		}

		@Test
		void parenthesesTuplesAndGenerators() {
			assertThat(parse("(x)")).isEqualTo(name("x"));
			assertThat(parse("()")).isEqualTo(new TupleExpr(List.of()));
			assertThat(parse("(1,)")).isEqualTo(new TupleExpr(List.of(num("1"))));
			assertThat(parse("a, b")).isEqualTo(new TupleExpr(List.of(name("a"), name("b"))));
			assertThat(parse("(x for x in y)")).isInstanceOf(GeneratorExp.class);
		}

		@Test
		void listsAndListComprehensions() {
			assertThat(parse("[1, 2,]")).isEqualTo(new ListExpr(List.of(num("1"), num("2"))));
			assertThat(parse("[x for x in y if x if not x]")).isEqualTo(new ListComp(name("x"),
					List.of(new Comprehension(name("x"), name("y"),
							List.of(name("x"), new UnaryOp(UnaryOp.Operator.NOT, name("x")))))));
		}

		@Test
		void bracesMakeDictsSetsAndTheirComprehensions() {
			assertThat(parse("{}")).isEqualTo(new DictExpr(List.of(), List.of()));
			assertThat(parse("{\"color\": \"red\"}")).isEqualTo(
					new DictExpr(List.of(StringLiteral.of("color")), List.of(StringLiteral.of("red"))));
			assertThat(parse("{1, 2}")).isEqualTo(new SetExpr(List.of(num("1"), num("2"))));
			assertThat(parse("{x for x in y}")).isInstanceOf(SetComp.class);
			assertThat(parse("{k: v for k, v in items}")).isEqualTo(new DictComp(name("k"), name("v"),
					List.of(new Comprehension(new TupleExpr(List.of(name("k"), name("v"))), name("items"), List.of()))));
		}

		@Test
		void multipleGeneratorClauses() {
			ListComp comp = (ListComp) parse("[(i, j) for i in a for j in b]");

			assertThat(comp.generators()).extracting(Comprehension::target)
					.containsExactly(name("i"), name("j"));
		}

		@Test
		void newlinesInsideBracketsAreIgnored() {
			assertThat(parse("[\n  1,\n  2\n]")).isEqualTo(new ListExpr(List.of(num("1"), num("2"))));
		}

		@Test
		void unexpectedEndOfInput() {
			assertThatThrownBy(() -> parse("1 +"))
					.isInstanceOf(PySyntaxException.class)
					.hasMessage("line 1:4 Unexpected end of input");
		}

		@Test
		void keywordIsNotAnOperand() {
			assertThatThrownBy(() -> parse("def"))
					.isInstanceOf(PySyntaxException.class)
					.hasMessage("line 1:1 Unexpected keyword 'def'");
		}

		@Test
		void trailingTokensAreRejected() {
			assertThatThrownBy(() -> parse("a b"))
					.isInstanceOf(PySyntaxException.class)
					.hasMessage("line 1:3 Expected end of input, found 'b'");
		}
	}

	@Nested
	@DisplayName("Markup in code")
	class MarkupInCode {

		@Test
		void lessThanAfterAnOperandIsAComparison() {
			assertThat(parse("a<b")).isInstanceOf(Compare.class);
			assertThat(parse("f(x) < (y)")).isInstanceOf(Compare.class);
		}

		@Test
		void lessThanWhereAnOperandStartsOpensMarkup() {
			Expr expr = parse("f(<br/>)");

			Call call = (Call) expr;
			assertThat(call.args()).singleElement().isEqualTo(new Call(name("jsx"),
					List.of(StringLiteral.of("br"), new DictExpr(List.of(), List.of()), new ListExpr(List.of())),
					List.of()));
		}

		@Test
		void markupIsAnOperandOfComparisons() {
			Expr expr = parse("<br/> == <br/>");

			assertThat(expr).isInstanceOf(Compare.class);
			assertThat(((Compare) expr).comparators()).singleElement().isInstanceOf(Call.class);
		}

		@Test
		void markupAsConditionalBranch() {
			Expr expr = parse("<footer/> if True else None");

			assertThat(expr).isInstanceOf(IfExp.class);
			assertThat(((IfExp) expr).body()).isInstanceOf(Call.class);
		}
	}

	@Nested
	@DisplayName("Statements")
	class Statements {

		@Test
		void expressionStatementsSeparatedByNewlinesAndSemicolons() {
			Module module = parseModule("a; b\n\n c\n");

			assertThat(module.body()).containsExactly(
					new Stmt.ExprStmt(name("a")), new Stmt.ExprStmt(name("b")), new Stmt.ExprStmt(name("c")));
		}

		@Test
		void chainedAssignment() {
			Module module = parseModule("x = y = 1");

			assertThat(module.body()).containsExactly(new Stmt.Assign(List.of(name("x"), name("y")), num("1")));
		}

		@Test
		void tupleTargets() {
			Module module = parseModule("a, b.c, d[0] = t");

			Stmt.Assign assign = (Stmt.Assign) module.body().get(0);
			assertThat(assign.targets()).singleElement().isInstanceOf(TupleExpr.class);
		}

		@Test
		void assignmentToACallIsRejected() {
			assertThatThrownBy(() -> parseModule("f() = 1"))
					.isInstanceOf(PySyntaxException.class)
					.hasMessage("line 1:1 Cannot assign to expression");
		}

		@Test
		void assignmentToALiteralInAChainIsRejected() {
			assertThatThrownBy(() -> parseModule("x = 1 = y"))
					.isInstanceOf(PySyntaxException.class)
					.hasMessage("line 1:5 Cannot assign to expression");
		}

		@Test
		void imports() {
			Module module = parseModule("import a.b as c, d\nfrom ..pkg import (x, y as z,)\nfrom m import *\n");

			assertThat(module.body()).containsExactly(
					new Stmt.Import(List.of(new Stmt.Alias("a.b", "c"), new Stmt.Alias("d", null))),
					new Stmt.ImportFrom("..pkg", List.of(new Stmt.Alias("x", null), new Stmt.Alias("y", "z"))),
					new Stmt.ImportFrom("m", List.of(new Stmt.Alias("*", null))));
		}

		@Test
		void compoundStatementsAreUnsupported() {
			assertThatThrownBy(() -> parseModule("x = 1\ndef f(): pass"))
					.isInstanceOf(PySyntaxException.class)
					.hasMessage("line 2:1 Unsupported statement: 'def'");
		}

		@Test
		void statementsMustEndAtEndOfLine() {
			assertThatThrownBy(() -> parseModule("x = 1 2"))
					.isInstanceOf(PySyntaxException.class)
					.hasMessage("line 1:7 Expected end of line, found '2'");
		}

		@Test
		void commentsAreIgnored() {
			Module module = parseModule("x = 1  # note\n# full line\ny = 2\n");

			assertThat(module.body()).hasSize(2);
		}

		@Test
		void emptySourceIsAnEmptyModule() {
			assertThat(parseModule("\n\n").body()).isEmpty();
		}
	}
}
