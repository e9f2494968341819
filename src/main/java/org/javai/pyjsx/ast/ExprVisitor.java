package org.javai.pyjsx.ast;

import org.javai.pyjsx.ast.Expr.Attribute;
import org.javai.pyjsx.ast.Expr.BinOp;
import org.javai.pyjsx.ast.Expr.BoolOp;
import org.javai.pyjsx.ast.Expr.BooleanLiteral;
import org.javai.pyjsx.ast.Expr.Call;
import org.javai.pyjsx.ast.Expr.Compare;
import org.javai.pyjsx.ast.Expr.DictComp;
import org.javai.pyjsx.ast.Expr.DictExpr;
import org.javai.pyjsx.ast.Expr.FormattedString;
import org.javai.pyjsx.ast.Expr.FormattedValue;
import org.javai.pyjsx.ast.Expr.GeneratorExp;
import org.javai.pyjsx.ast.Expr.IfExp;
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

/**
 * Visitor over host expression nodes.
 *
 * @param <R> the result type
 */
public interface ExprVisitor<R> {

	R visitName(Name node);

	R visitStringLiteral(StringLiteral node);

	R visitFormattedString(FormattedString node);

	R visitFormattedValue(FormattedValue node);

	R visitNumberLiteral(NumberLiteral node);

	R visitBooleanLiteral(BooleanLiteral node);

	R visitNoneLiteral(NoneLiteral node);

	R visitAttribute(Attribute node);

	R visitSubscript(Subscript node);

	R visitSlice(Slice node);

	R visitCall(Call node);

	R visitList(ListExpr node);

	R visitTuple(TupleExpr node);

	R visitSet(SetExpr node);

	R visitDict(DictExpr node);

	R visitListComp(ListComp node);

	R visitSetComp(SetComp node);

	R visitGeneratorExp(GeneratorExp node);

	R visitDictComp(DictComp node);

	R visitBinOp(BinOp node);

	R visitUnaryOp(UnaryOp node);

	R visitBoolOp(BoolOp node);

	R visitCompare(Compare node);

	R visitIfExp(IfExp node);

	R visitLambda(Lambda node);
}
