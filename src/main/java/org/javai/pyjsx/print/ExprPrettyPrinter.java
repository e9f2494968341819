package org.javai.pyjsx.print;

import java.util.List;
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
import org.javai.pyjsx.ast.Expr.FormattedString;
import org.javai.pyjsx.ast.Expr.FormattedValue;
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
import org.javai.pyjsx.ast.ExprVisitor;
import org.javai.pyjsx.ast.Module;
import org.javai.pyjsx.ast.Stmt;

/**
 * Renders host AST back to source text.
 * <p>
 * Output parses back to an equal tree: parentheses are inserted from operator
 * precedence, tuples are always parenthesised and strings use double quotes
 * (single quotes inside f-string fields). Lowered markup prints as its call
 * form, e.g. {@code jsx("a", {"href": "x"}, ["y"])}.
 */
public class ExprPrettyPrinter implements ExprVisitor<Void> {

	private static final int TEST = 1;
	private static final int IF_EXP = 2;
	private static final int OR = 3;
	private static final int AND = 4;
	private static final int NOT = 5;
	private static final int COMPARE = 6;
	private static final int BIT_OR = 7;
	private static final int UNARY = 13;
	private static final int POWER = 14;
	private static final int PRIMARY = 16;

	private final StringBuilder output = new StringBuilder();
	private char quote = '"';

	/**
	 * Static convenience method to print an expression.
	 */
	public static String print(Expr expr) {
		ExprPrettyPrinter printer = new ExprPrettyPrinter();
		printer.emit(expr, 0);
		return printer.toString();
	}

	/**
	 * Prints a module, one statement per line.
	 */
	public static String print(Module module) {
		ExprPrettyPrinter printer = new ExprPrettyPrinter();
		for (Stmt stmt : module.body()) {
			printer.emitStatement(stmt);
			printer.output.append('\n');
		}
		return printer.toString();
	}

	@Override
	public String toString() {
		return output.toString();
	}

	// ==================== Statements ====================

	private void emitStatement(Stmt stmt) {
		if (stmt instanceof Stmt.ExprStmt exprStmt) {
			emit(exprStmt.value(), 0);
		} else if (stmt instanceof Stmt.Assign assign) {
			for (Expr target : assign.targets()) {
				emit(target, 0);
				output.append(" = ");
			}
			emit(assign.value(), 0);
		} else if (stmt instanceof Stmt.Import importStmt) {
			output.append("import ");
			emitAliases(importStmt.names());
		} else if (stmt instanceof Stmt.ImportFrom importFrom) {
			output.append("from ").append(importFrom.module()).append(" import ");
			emitAliases(importFrom.names());
		}
	}

	private void emitAliases(List<Stmt.Alias> aliases) {
		for (int i = 0; i < aliases.size(); i++) {
			if (i > 0) {
				output.append(", ");
			}
			Stmt.Alias alias = aliases.get(i);
			output.append(alias.name());
			if (alias.asName() != null) {
				output.append(" as ").append(alias.asName());
			}
		}
	}

	// ==================== Atoms ====================

	@Override
	public Void visitName(Name node) {
		output.append(node.id());
		return null;
	}

	@Override
	public Void visitStringLiteral(StringLiteral node) {
		if (node.bytes()) {
			output.append('b');
		}
		output.append(quote).append(escape(node.value(), false)).append(quote);
		return null;
	}

	@Override
	public Void visitFormattedString(FormattedString node) {
		output.append('f').append(quote);
		for (Expr part : node.parts()) {
			if (part instanceof StringLiteral literal) {
				output.append(escape(literal.value(), true));
			} else {
				part.accept(this);
			}
		}
		output.append(quote);
		return null;
	}

	@Override
	public Void visitFormattedValue(FormattedValue node) {
		char outer = quote;
		quote = outer == '"' ? '\'' : '"';
		output.append('{');
		int mark = output.length();
		emit(node.value(), IF_EXP);
		if (output.charAt(mark) == '{') {
			output.insert(mark, ' ');
		}
		quote = outer;
		if (node.conversion() != null) {
			output.append('!').append(node.conversion());
		}
		if (node.formatSpec() != null) {
			output.append(':').append(node.formatSpec());
		}
		output.append('}');
		return null;
	}

	@Override
	public Void visitNumberLiteral(NumberLiteral node) {
		output.append(node.text());
		return null;
	}

	@Override
	public Void visitBooleanLiteral(BooleanLiteral node) {
		output.append(node.value() ? "True" : "False");
		return null;
	}

	@Override
	public Void visitNoneLiteral(NoneLiteral node) {
		output.append("None");
		return null;
	}

	// ==================== Primaries ====================

	@Override
	public Void visitAttribute(Attribute node) {
		emit(node.value(), PRIMARY);
		output.append('.').append(node.attr());
		return null;
	}

	@Override
	public Void visitSubscript(Subscript node) {
		emit(node.value(), PRIMARY);
		output.append('[');
		// slices are only valid unparenthesised
		if (node.index() instanceof TupleExpr tuple && !tuple.elements().isEmpty()) {
			emitAll(tuple.elements());
			if (tuple.elements().size() == 1) {
				output.append(',');
			}
		} else {
			emit(node.index(), TEST);
		}
		output.append(']');
		return null;
	}

	@Override
	public Void visitSlice(Slice node) {
		if (node.lower() != null) {
			emit(node.lower(), TEST);
		}
		output.append(':');
		if (node.upper() != null) {
			emit(node.upper(), TEST);
		}
		if (node.step() != null) {
			output.append(':');
			emit(node.step(), TEST);
		}
		return null;
	}

	@Override
	public Void visitCall(Call node) {
		emit(node.func(), PRIMARY);
		output.append('(');
		boolean first = true;
		for (Expr arg : node.args()) {
			first = separate(first);
			emit(arg, TEST);
		}
		for (Keyword keyword : node.keywords()) {
			first = separate(first);
			output.append(keyword.name()).append('=');
			emit(keyword.value(), TEST);
		}
		output.append(')');
		return null;
	}

	// ==================== Displays ====================

	@Override
	public Void visitList(ListExpr node) {
		output.append('[');
		emitAll(node.elements());
		output.append(']');
		return null;
	}

	@Override
	public Void visitTuple(TupleExpr node) {
		output.append('(');
		emitAll(node.elements());
		if (node.elements().size() == 1) {
			output.append(',');
		}
		output.append(')');
		return null;
	}

	@Override
	public Void visitSet(SetExpr node) {
		output.append('{');
		emitAll(node.elements());
		output.append('}');
		return null;
	}

	@Override
	public Void visitDict(DictExpr node) {
		output.append('{');
		for (int i = 0; i < node.keys().size(); i++) {
			if (i > 0) {
				output.append(", ");
			}
			emit(node.keys().get(i), TEST);
			output.append(": ");
			emit(node.values().get(i), TEST);
		}
		output.append('}');
		return null;
	}

	// ==================== Comprehensions ====================

	@Override
	public Void visitListComp(ListComp node) {
		output.append('[');
		emit(node.element(), TEST);
		emitGenerators(node.generators());
		output.append(']');
		return null;
	}

	@Override
	public Void visitSetComp(SetComp node) {
		output.append('{');
		emit(node.element(), TEST);
		emitGenerators(node.generators());
		output.append('}');
		return null;
	}

	@Override
	public Void visitGeneratorExp(GeneratorExp node) {
		output.append('(');
		emit(node.element(), TEST);
		emitGenerators(node.generators());
		output.append(')');
		return null;
	}

	@Override
	public Void visitDictComp(DictComp node) {
		output.append('{');
		emit(node.key(), TEST);
		output.append(": ");
		emit(node.value(), TEST);
		emitGenerators(node.generators());
		output.append('}');
		return null;
	}

	private void emitGenerators(List<Comprehension> generators) {
		for (Comprehension generator : generators) {
			output.append(" for ");
			if (generator.target() instanceof TupleExpr tuple && !tuple.elements().isEmpty()) {
				for (int i = 0; i < tuple.elements().size(); i++) {
					if (i > 0) {
						output.append(", ");
					}
					emit(tuple.elements().get(i), BIT_OR);
				}
			} else {
				emit(generator.target(), BIT_OR);
			}
			output.append(" in ");
			emit(generator.iter(), OR);
			for (Expr condition : generator.ifs()) {
				output.append(" if ");
				emit(condition, OR);
			}
		}
	}

	// ==================== Operators ====================

	@Override
	public Void visitBinOp(BinOp node) {
		int precedence = node.op().precedence();
		if (node.op() == BinOp.Operator.POW) {
			emit(node.left(), PRIMARY);
			output.append(" ** ");
			emit(node.right(), UNARY);
			return null;
		}
		emit(node.left(), precedence);
		output.append(' ').append(node.op().symbol()).append(' ');
		emit(node.right(), precedence + 1);
		return null;
	}

	@Override
	public Void visitUnaryOp(UnaryOp node) {
		output.append(node.op().symbol());
		emit(node.operand(), node.op() == UnaryOp.Operator.NOT ? NOT : UNARY);
		return null;
	}

	@Override
	public Void visitBoolOp(BoolOp node) {
		int precedence = precedence(node);
		for (int i = 0; i < node.values().size(); i++) {
			if (i > 0) {
				output.append(' ').append(node.op().symbol()).append(' ');
			}
			emit(node.values().get(i), precedence + 1);
		}
		return null;
	}

	@Override
	public Void visitCompare(Compare node) {
		emit(node.left(), BIT_OR);
		for (int i = 0; i < node.ops().size(); i++) {
			output.append(' ').append(node.ops().get(i).symbol()).append(' ');
			emit(node.comparators().get(i), BIT_OR);
		}
		return null;
	}

	@Override
	public Void visitIfExp(IfExp node) {
		emit(node.body(), OR);
		output.append(" if ");
		emit(node.test(), OR);
		output.append(" else ");
		emit(node.orElse(), IF_EXP);
		return null;
	}

	@Override
	public Void visitLambda(Lambda node) {
		output.append("lambda");
		if (!node.params().isEmpty()) {
			output.append(' ').append(String.join(", ", node.params()));
		}
		output.append(": ");
		emit(node.body(), TEST);
		return null;
	}

	// ==================== Helpers ====================

	private void emit(Expr expr, int minPrecedence) {
		if (precedence(expr) < minPrecedence) {
			output.append('(');
			expr.accept(this);
			output.append(')');
		} else {
			expr.accept(this);
		}
	}

	private void emitAll(List<Expr> elements) {
		boolean first = true;
		for (Expr element : elements) {
			first = separate(first);
			emit(element, TEST);
		}
	}

	private boolean separate(boolean first) {
		if (!first) {
			output.append(", ");
		}
		return false;
	}

	private static int precedence(Expr expr) {
		if (expr instanceof Lambda) {
			return TEST;
		}
		if (expr instanceof IfExp) {
			return IF_EXP;
		}
		if (expr instanceof BoolOp boolOp) {
			return boolOp.op() == BoolOp.Operator.OR ? OR : AND;
		}
		if (expr instanceof UnaryOp unaryOp) {
			return unaryOp.op() == UnaryOp.Operator.NOT ? NOT : UNARY;
		}
		if (expr instanceof Compare) {
			return COMPARE;
		}
		if (expr instanceof BinOp binOp) {
			return binOp.op().precedence();
		}
		return PRIMARY;
	}

	private String escape(String value, boolean formatted) {
		StringBuilder escaped = new StringBuilder(value.length());
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			switch (c) {
				case '\\' -> escaped.append("\\\\");
				case '\n' -> escaped.append("\\n");
				case '\t' -> escaped.append("\\t");
				case '\r' -> escaped.append("\\r");
				case '{', '}' -> escaped.append(formatted ? String.valueOf(c) + c : String.valueOf(c));
				default -> {
					if (c == quote) {
						escaped.append('\\').append(c);
					} else if (c < 0x20 || c == 0x7f) {
						escaped.append(String.format("\\x%02x", (int) c));
					} else {
						escaped.append(c);
					}
				}
			}
		}
		return escaped.toString();
	}
}
