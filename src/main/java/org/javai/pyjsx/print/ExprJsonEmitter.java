package org.javai.pyjsx.print;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
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

/**
 * Emits host AST as a JSON tree for tooling.
 * <p>
 * Every node is an object with a {@code "node"} field naming its type, e.g.
 * {@code {"node":"Name","id":"x"}}; child nodes nest as objects or arrays.
 */
public final class ExprJsonEmitter implements ExprVisitor<ObjectNode> {

	private static final ObjectMapper mapper = new ObjectMapper();

	private ExprJsonEmitter() {
	}

	public static ObjectNode emit(Expr expr) {
		return expr.accept(new ExprJsonEmitter());
	}

	/**
	 * Indented JSON text of {@link #emit(Expr)}.
	 */
	public static String toJson(Expr expr) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(emit(expr));
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize expression tree", e);
		}
	}

	@Override
	public ObjectNode visitName(Name node) {
		return node("Name").put("id", node.id());
	}

	@Override
	public ObjectNode visitStringLiteral(StringLiteral node) {
		ObjectNode json = node("String").put("value", node.value());
		if (node.bytes()) {
			json.put("bytes", true);
		}
		return json;
	}

	@Override
	public ObjectNode visitFormattedString(FormattedString node) {
		ObjectNode json = node("FormattedString");
		json.set("parts", array(node.parts()));
		return json;
	}

	@Override
	public ObjectNode visitFormattedValue(FormattedValue node) {
		ObjectNode json = node("FormattedValue");
		json.set("value", node.value().accept(this));
		if (node.conversion() != null) {
			json.put("conversion", node.conversion());
		}
		if (node.formatSpec() != null) {
			json.put("formatSpec", node.formatSpec());
		}
		return json;
	}

	@Override
	public ObjectNode visitNumberLiteral(NumberLiteral node) {
		return node("Number").put("value", node.text());
	}

	@Override
	public ObjectNode visitBooleanLiteral(BooleanLiteral node) {
		return node("Boolean").put("value", node.value());
	}

	@Override
	public ObjectNode visitNoneLiteral(NoneLiteral node) {
		return node("None");
	}

	@Override
	public ObjectNode visitAttribute(Attribute node) {
		ObjectNode json = node("Attribute");
		json.set("value", node.value().accept(this));
		json.put("attr", node.attr());
		return json;
	}

	@Override
	public ObjectNode visitSubscript(Subscript node) {
		ObjectNode json = node("Subscript");
		json.set("value", node.value().accept(this));
		json.set("index", node.index().accept(this));
		return json;
	}

	@Override
	public ObjectNode visitSlice(Slice node) {
		ObjectNode json = node("Slice");
		optional(json, "lower", node.lower());
		optional(json, "upper", node.upper());
		optional(json, "step", node.step());
		return json;
	}

	@Override
	public ObjectNode visitCall(Call node) {
		ObjectNode json = node("Call");
		json.set("func", node.func().accept(this));
		json.set("args", array(node.args()));
		ArrayNode keywords = json.putArray("keywords");
		node.keywords().forEach(k -> {
			ObjectNode keyword = keywords.addObject();
			keyword.put("name", k.name());
			keyword.set("value", k.value().accept(this));
		});
		return json;
	}

	@Override
	public ObjectNode visitList(ListExpr node) {
		ObjectNode json = node("List");
		json.set("elements", array(node.elements()));
		return json;
	}

	@Override
	public ObjectNode visitTuple(TupleExpr node) {
		ObjectNode json = node("Tuple");
		json.set("elements", array(node.elements()));
		return json;
	}

	@Override
	public ObjectNode visitSet(SetExpr node) {
		ObjectNode json = node("Set");
		json.set("elements", array(node.elements()));
		return json;
	}

	@Override
	public ObjectNode visitDict(DictExpr node) {
		ObjectNode json = node("Dict");
		ArrayNode entries = json.putArray("entries");
		for (int i = 0; i < node.keys().size(); i++) {
			ObjectNode entry = entries.addObject();
			entry.set("key", node.keys().get(i).accept(this));
			entry.set("value", node.values().get(i).accept(this));
		}
		return json;
	}

	@Override
	public ObjectNode visitListComp(ListComp node) {
		return comprehension("ListComp", node.element(), node.generators());
	}

	@Override
	public ObjectNode visitSetComp(SetComp node) {
		return comprehension("SetComp", node.element(), node.generators());
	}

	@Override
	public ObjectNode visitGeneratorExp(GeneratorExp node) {
		return comprehension("GeneratorExp", node.element(), node.generators());
	}

	@Override
	public ObjectNode visitDictComp(DictComp node) {
		ObjectNode json = node("DictComp");
		json.set("key", node.key().accept(this));
		json.set("value", node.value().accept(this));
		json.set("generators", generators(node.generators()));
		return json;
	}

	@Override
	public ObjectNode visitBinOp(BinOp node) {
		ObjectNode json = node("BinOp");
		json.set("left", node.left().accept(this));
		json.put("op", node.op().symbol());
		json.set("right", node.right().accept(this));
		return json;
	}

	@Override
	public ObjectNode visitUnaryOp(UnaryOp node) {
		ObjectNode json = node("UnaryOp");
		json.put("op", node.op().symbol().trim());
		json.set("operand", node.operand().accept(this));
		return json;
	}

	@Override
	public ObjectNode visitBoolOp(BoolOp node) {
		ObjectNode json = node("BoolOp");
		json.put("op", node.op().symbol());
		json.set("values", array(node.values()));
		return json;
	}

	@Override
	public ObjectNode visitCompare(Compare node) {
		ObjectNode json = node("Compare");
		json.set("left", node.left().accept(this));
		ArrayNode ops = json.putArray("ops");
		node.ops().forEach(op -> ops.add(op.symbol()));
		json.set("comparators", array(node.comparators()));
		return json;
	}

	@Override
	public ObjectNode visitIfExp(IfExp node) {
		ObjectNode json = node("IfExp");
		json.set("test", node.test().accept(this));
		json.set("body", node.body().accept(this));
		json.set("orElse", node.orElse().accept(this));
		return json;
	}

	@Override
	public ObjectNode visitLambda(Lambda node) {
		ObjectNode json = node("Lambda");
		ArrayNode params = json.putArray("params");
		node.params().forEach(params::add);
		json.set("body", node.body().accept(this));
		return json;
	}

	private ObjectNode comprehension(String type, Expr element, List<Comprehension> generators) {
		ObjectNode json = node(type);
		json.set("element", element.accept(this));
		json.set("generators", generators(generators));
		return json;
	}

	private ArrayNode generators(List<Comprehension> generators) {
		ArrayNode array = mapper.createArrayNode();
		for (Comprehension generator : generators) {
			ObjectNode clause = array.addObject();
			clause.set("target", generator.target().accept(this));
			clause.set("iter", generator.iter().accept(this));
			clause.set("ifs", array(generator.ifs()));
		}
		return array;
	}

	private ArrayNode array(List<Expr> nodes) {
		ArrayNode array = mapper.createArrayNode();
		nodes.forEach(n -> array.add(n.accept(this)));
		return array;
	}

	private void optional(ObjectNode json, String field, Expr value) {
		if (value != null) {
			json.set(field, value.accept(this));
		}
	}

	private static ObjectNode node(String type) {
		return mapper.createObjectNode().put("node", type);
	}
}
