package org.javai.pyjsx.ast;

import java.util.List;
import java.util.Objects;

/**
 * Expression node of the host language AST.
 * <p>
 * Markup literals do not appear here: they are lowered to {@link Call},
 * {@link DictExpr} and {@link ListExpr} nodes before the parser returns.
 */
public sealed interface Expr {

	<R> R accept(ExprVisitor<R> visitor);

	// ==================== Atoms ====================

	record Name(String id) implements Expr {
		public Name {
			Objects.requireNonNull(id, "id must not be null");
		}

		@Override
		public <R> R accept(ExprVisitor<R> visitor) {
			return visitor.visitName(this);
		}
	}

	/**
	 * A decoded string constant.
	 *
	 * @param value the decoded text
	 * @param bytes true for a bytes literal ({@code b"..."})
	 */
	record StringLiteral(String value, boolean bytes) implements Expr {
		public StringLiteral {
			Objects.requireNonNull(value, "value must not be null");
		}

		public static StringLiteral of(String value) {
			return new StringLiteral(value, false);
		}

		@Override
		public <R> R accept(ExprVisitor<R> visitor) {
			return visitor.visitStringLiteral(this);
		}
	}

	/**
	 * An f-string: literal parts are {@link StringLiteral}s, fields are
	 * {@link FormattedValue}s.
	 */
	record FormattedString(List<Expr> parts) implements Expr {
		public FormattedString {
			parts = List.copyOf(parts);
		}

		@Override
		public <R> R accept(ExprVisitor<R> visitor) {
			return visitor.visitFormattedString(this);
		}
	}

	/**
	 * A replacement field of an f-string.
	 *
	 * @param value the embedded expression
	 * @param conversion {@code r}, {@code s}, {@code a}, or null
	 * @param formatSpec literal format spec, or null
	 */
	record FormattedValue(Expr value, String conversion, String formatSpec) implements Expr {
		public FormattedValue {
			Objects.requireNonNull(value, "value must not be null");
		}

		@Override
		public <R> R accept(ExprVisitor<R> visitor) {
			return visitor.visitFormattedValue(this);
		}
	}

	/**
	 * A numeric literal, kept as written.
	 */
	record NumberLiteral(String text) implements Expr {
		public NumberLiteral {
			Objects.requireNonNull(text, "text must not be null");
		}

		@Override
		public <R> R accept(ExprVisitor<R> visitor) {
			return visitor.visitNumberLiteral(this);
		}
	}

	record BooleanLiteral(boolean value) implements Expr {
		@Override
		public <R> R accept(ExprVisitor<R> visitor) {
			return visitor.visitBooleanLiteral(this);
		}
	}

	record NoneLiteral() implements Expr {
		public static final NoneLiteral INSTANCE = new NoneLiteral();

		@Override
		public <R> R accept(ExprVisitor<R> visitor) {
			return visitor.visitNoneLiteral(this);
		}
	}

	// ==================== Primaries ====================

	record Attribute(Expr value, String attr) implements Expr {
		public Attribute {
			Objects.requireNonNull(value, "value must not be null");
			Objects.requireNonNull(attr, "attr must not be null");
		}

		@Override
		public <R> R accept(ExprVisitor<R> visitor) {
			return visitor.visitAttribute(this);
		}
	}

	record Subscript(Expr value, Expr index) implements Expr {
		public Subscript {
			Objects.requireNonNull(value, "value must not be null");
			Objects.requireNonNull(index, "index must not be null");
		}

		@Override
		public <R> R accept(ExprVisitor<R> visitor) {
			return visitor.visitSubscript(this);
		}
	}

	/**
	 * {@code lower:upper:step}; each part may be null.
	 */
	record Slice(Expr lower, Expr upper, Expr step) implements Expr {
		@Override
		public <R> R accept(ExprVisitor<R> visitor) {
			return visitor.visitSlice(this);
		}
	}

	record Call(Expr func, List<Expr> args, List<Keyword> keywords) implements Expr {
		public Call {
			Objects.requireNonNull(func, "func must not be null");
			args = List.copyOf(args);
			keywords = List.copyOf(keywords);
		}

		@Override
		public <R> R accept(ExprVisitor<R> visitor) {
			return visitor.visitCall(this);
		}
	}

	/**
	 * A keyword argument {@code name=value} of a call.
	 */
	record Keyword(String name, Expr value) {
		public Keyword {
			Objects.requireNonNull(name, "name must not be null");
			Objects.requireNonNull(value, "value must not be null");
		}
	}

	// ==================== Displays ====================

	record ListExpr(List<Expr> elements) implements Expr {
		public ListExpr {
			elements = List.copyOf(elements);
		}

		@Override
		public <R> R accept(ExprVisitor<R> visitor) {
			return visitor.visitList(this);
		}
	}

	record TupleExpr(List<Expr> elements) implements Expr {
		public TupleExpr {
			elements = List.copyOf(elements);
		}

		@Override
		public <R> R accept(ExprVisitor<R> visitor) {
			return visitor.visitTuple(this);
		}
	}

	record SetExpr(List<Expr> elements) implements Expr {
		public SetExpr {
			elements = List.copyOf(elements);
		}

		@Override
		public <R> R accept(ExprVisitor<R> visitor) {
			return visitor.visitSet(this);
		}
	}

	/**
	 * A dictionary display. Keys and values are parallel lists in source order.
	 */
	record DictExpr(List<Expr> keys, List<Expr> values) implements Expr {
		public DictExpr {
			keys = List.copyOf(keys);
			values = List.copyOf(values);
			if (keys.size() != values.size()) {
				throw new IllegalArgumentException("keys and values differ in size: "
						+ keys.size() + " != " + values.size());
			}
		}

		@Override
		public <R> R accept(ExprVisitor<R> visitor) {
			return visitor.visitDict(this);
		}
	}

	// ==================== Comprehensions ====================

	/**
	 * One {@code for target in iter if cond...} clause.
	 */
	record Comprehension(Expr target, Expr iter, List<Expr> ifs) {
		public Comprehension {
			Objects.requireNonNull(target, "target must not be null");
			Objects.requireNonNull(iter, "iter must not be null");
			ifs = List.copyOf(ifs);
		}
	}

	record ListComp(Expr element, List<Comprehension> generators) implements Expr {
		public ListComp {
			Objects.requireNonNull(element, "element must not be null");
			generators = List.copyOf(generators);
		}

		@Override
		public <R> R accept(ExprVisitor<R> visitor) {
			return visitor.visitListComp(this);
		}
	}

	record SetComp(Expr element, List<Comprehension> generators) implements Expr {
		public SetComp {
			Objects.requireNonNull(element, "element must not be null");
			generators = List.copyOf(generators);
		}

		@Override
		public <R> R accept(ExprVisitor<R> visitor) {
			return visitor.visitSetComp(this);
		}
	}

	record GeneratorExp(Expr element, List<Comprehension> generators) implements Expr {
		public GeneratorExp {
			Objects.requireNonNull(element, "element must not be null");
			generators = List.copyOf(generators);
		}

		@Override
		public <R> R accept(ExprVisitor<R> visitor) {
			return visitor.visitGeneratorExp(this);
		}
	}

	record DictComp(Expr key, Expr value, List<Comprehension> generators) implements Expr {
		public DictComp {
			Objects.requireNonNull(key, "key must not be null");
			Objects.requireNonNull(value, "value must not be null");
			generators = List.copyOf(generators);
		}

		@Override
		public <R> R accept(ExprVisitor<R> visitor) {
			return visitor.visitDictComp(this);
		}
	}

	// ==================== Operators ====================

	record BinOp(Expr left, Operator op, Expr right) implements Expr {
		public BinOp {
			Objects.requireNonNull(left, "left must not be null");
			Objects.requireNonNull(op, "op must not be null");
			Objects.requireNonNull(right, "right must not be null");
		}

		@Override
		public <R> R accept(ExprVisitor<R> visitor) {
			return visitor.visitBinOp(this);
		}

		/**
		 * Binary operators with their binding strength; higher binds tighter.
		 */
		public enum Operator {
			BIT_OR("|", 7),
			BIT_XOR("^", 8),
			BIT_AND("&", 9),
			LSHIFT("<<", 10),
			RSHIFT(">>", 10),
			ADD("+", 11),
			SUB("-", 11),
			MULT("*", 12),
			DIV("/", 12),
			FLOOR_DIV("//", 12),
			MOD("%", 12),
			MAT_MULT("@", 12),
			POW("**", 14);

			private final String symbol;
			private final int precedence;

			Operator(String symbol, int precedence) {
				this.symbol = symbol;
				this.precedence = precedence;
			}

			public String symbol() {
				return symbol;
			}

			public int precedence() {
				return precedence;
			}
		}
	}

	record UnaryOp(Operator op, Expr operand) implements Expr {
		public UnaryOp {
			Objects.requireNonNull(op, "op must not be null");
			Objects.requireNonNull(operand, "operand must not be null");
		}

		@Override
		public <R> R accept(ExprVisitor<R> visitor) {
			return visitor.visitUnaryOp(this);
		}

		public enum Operator {
			NOT("not "),
			PLUS("+"),
			MINUS("-"),
			INVERT("~");

			private final String symbol;

			Operator(String symbol) {
				this.symbol = symbol;
			}

			public String symbol() {
				return symbol;
			}
		}
	}

	/**
	 * {@code and} / {@code or} over two or more operands.
	 */
	record BoolOp(Operator op, List<Expr> values) implements Expr {
		public BoolOp {
			Objects.requireNonNull(op, "op must not be null");
			values = List.copyOf(values);
			if (values.size() < 2) {
				throw new IllegalArgumentException("BoolOp needs at least two operands");
			}
		}

		@Override
		public <R> R accept(ExprVisitor<R> visitor) {
			return visitor.visitBoolOp(this);
		}

		public enum Operator {
			AND("and"),
			OR("or");

			private final String symbol;

			Operator(String symbol) {
				this.symbol = symbol;
			}

			public String symbol() {
				return symbol;
			}
		}
	}

	/**
	 * A comparison chain {@code a < b <= c}: one operator per comparator.
	 */
	record Compare(Expr left, List<Operator> ops, List<Expr> comparators) implements Expr {
		public Compare {
			Objects.requireNonNull(left, "left must not be null");
			ops = List.copyOf(ops);
			comparators = List.copyOf(comparators);
			if (ops.isEmpty() || ops.size() != comparators.size()) {
				throw new IllegalArgumentException("Compare needs one operator per comparator");
			}
		}

		@Override
		public <R> R accept(ExprVisitor<R> visitor) {
			return visitor.visitCompare(this);
		}

		public enum Operator {
			EQ("=="),
			NOT_EQ("!="),
			LT("<"),
			LT_E("<="),
			GT(">"),
			GT_E(">="),
			IS("is"),
			IS_NOT("is not"),
			IN("in"),
			NOT_IN("not in");

			private final String symbol;

			Operator(String symbol) {
				this.symbol = symbol;
			}

			public String symbol() {
				return symbol;
			}
		}
	}

	/**
	 * {@code body if test else orElse}.
	 */
	record IfExp(Expr test, Expr body, Expr orElse) implements Expr {
		public IfExp {
			Objects.requireNonNull(test, "test must not be null");
			Objects.requireNonNull(body, "body must not be null");
			Objects.requireNonNull(orElse, "orElse must not be null");
		}

		@Override
		public <R> R accept(ExprVisitor<R> visitor) {
			return visitor.visitIfExp(this);
		}
	}

	/**
	 * {@code lambda a, b: body}. Parameters are plain names.
	 */
	record Lambda(List<String> params, Expr body) implements Expr {
		public Lambda {
			params = List.copyOf(params);
			Objects.requireNonNull(body, "body must not be null");
		}

		@Override
		public <R> R accept(ExprVisitor<R> visitor) {
			return visitor.visitLambda(this);
		}
	}
}
