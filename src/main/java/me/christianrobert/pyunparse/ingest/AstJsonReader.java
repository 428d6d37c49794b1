package me.christianrobert.pyunparse.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.pyunparse.context.MalformedTreeException;
import me.christianrobert.pyunparse.context.UnsupportedNodeKindException;
import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.Statement;
import me.christianrobert.pyunparse.tree.SyntaxNode;
import me.christianrobert.pyunparse.tree.element.Alias;
import me.christianrobert.pyunparse.tree.element.Arg;
import me.christianrobert.pyunparse.tree.element.Arguments;
import me.christianrobert.pyunparse.tree.element.Comprehension;
import me.christianrobert.pyunparse.tree.element.ExceptHandler;
import me.christianrobert.pyunparse.tree.element.Keyword;
import me.christianrobert.pyunparse.tree.element.WithItem;
import me.christianrobert.pyunparse.tree.expression.Attribute;
import me.christianrobert.pyunparse.tree.expression.BinOp;
import me.christianrobert.pyunparse.tree.expression.BoolOp;
import me.christianrobert.pyunparse.tree.expression.Bytes;
import me.christianrobert.pyunparse.tree.expression.Call;
import me.christianrobert.pyunparse.tree.expression.Compare;
import me.christianrobert.pyunparse.tree.expression.DictComp;
import me.christianrobert.pyunparse.tree.expression.DictDisplay;
import me.christianrobert.pyunparse.tree.expression.EllipsisLiteral;
import me.christianrobert.pyunparse.tree.expression.ExtSlice;
import me.christianrobert.pyunparse.tree.expression.GeneratorExp;
import me.christianrobert.pyunparse.tree.expression.IfExp;
import me.christianrobert.pyunparse.tree.expression.Index;
import me.christianrobert.pyunparse.tree.expression.Lambda;
import me.christianrobert.pyunparse.tree.expression.ListComp;
import me.christianrobert.pyunparse.tree.expression.ListDisplay;
import me.christianrobert.pyunparse.tree.expression.Name;
import me.christianrobert.pyunparse.tree.expression.NameConstant;
import me.christianrobert.pyunparse.tree.expression.Num;
import me.christianrobert.pyunparse.tree.expression.SetComp;
import me.christianrobert.pyunparse.tree.expression.SetDisplay;
import me.christianrobert.pyunparse.tree.expression.Slice;
import me.christianrobert.pyunparse.tree.expression.Starred;
import me.christianrobert.pyunparse.tree.expression.Str;
import me.christianrobert.pyunparse.tree.expression.Subscript;
import me.christianrobert.pyunparse.tree.expression.TupleDisplay;
import me.christianrobert.pyunparse.tree.expression.UnaryOp;
import me.christianrobert.pyunparse.tree.expression.Yield;
import me.christianrobert.pyunparse.tree.expression.YieldFrom;
import me.christianrobert.pyunparse.tree.operator.BinaryOperator;
import me.christianrobert.pyunparse.tree.operator.BooleanOperator;
import me.christianrobert.pyunparse.tree.operator.ComparisonOperator;
import me.christianrobert.pyunparse.tree.operator.UnaryOperator;
import me.christianrobert.pyunparse.tree.statement.Assert;
import me.christianrobert.pyunparse.tree.statement.Assign;
import me.christianrobert.pyunparse.tree.statement.AugAssign;
import me.christianrobert.pyunparse.tree.statement.Break;
import me.christianrobert.pyunparse.tree.statement.ClassDef;
import me.christianrobert.pyunparse.tree.statement.Continue;
import me.christianrobert.pyunparse.tree.statement.Delete;
import me.christianrobert.pyunparse.tree.statement.ExprStatement;
import me.christianrobert.pyunparse.tree.statement.For;
import me.christianrobert.pyunparse.tree.statement.FunctionDef;
import me.christianrobert.pyunparse.tree.statement.Global;
import me.christianrobert.pyunparse.tree.statement.If;
import me.christianrobert.pyunparse.tree.statement.Import;
import me.christianrobert.pyunparse.tree.statement.ImportFrom;
import me.christianrobert.pyunparse.tree.statement.Module;
import me.christianrobert.pyunparse.tree.statement.Nonlocal;
import me.christianrobert.pyunparse.tree.statement.Pass;
import me.christianrobert.pyunparse.tree.statement.Raise;
import me.christianrobert.pyunparse.tree.statement.Return;
import me.christianrobert.pyunparse.tree.statement.Try;
import me.christianrobert.pyunparse.tree.statement.While;
import me.christianrobert.pyunparse.tree.statement.With;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;

/**
 * Builds a syntax tree from the JSON form of Python's {@code ast} module.
 *
 * <p>Input format: every node is an object tagged with its class name in {@code _type}, fields
 * carry the {@code ast} field names, lists are arrays and identifiers are plain strings:</p>
 * <pre>
 * {"_type": "Module", "body": [
 *   {"_type": "Expr", "lineno": 1, "value":
 *     {"_type": "Call", "func": {"_type": "Name", "id": "print"},
 *      "args": [{"_type": "Str", "s": "hi"}], "keywords": []}}]}
 * </pre>
 *
 * <p>Shapes of older and newer interpreter versions are normalized to the canonical tree:</p>
 * <ul>
 *   <li>{@code TryExcept} / {@code TryFinally} become {@code Try}; a {@code TryFinally} whose
 *       body is a single {@code TryExcept} merges into one {@code Try}</li>
 *   <li>single-item {@code With} ({@code context_expr} / {@code optional_vars}) becomes a
 *       {@code With} with one {@code withitem}</li>
 *   <li>{@code Name} parameters and string {@code vararg} / {@code kwarg} become {@code arg}</li>
 *   <li>{@code Constant} becomes {@code Num}, {@code Str}, {@code NameConstant} or the node
 *       it wraps</li>
 *   <li>a subscript tuple containing slices becomes {@code ExtSlice}</li>
 * </ul>
 *
 * <p>Unknown {@code _type} values raise {@link UnsupportedNodeKindException}; any other
 * structural problem raises {@link MalformedTreeException}. Context fields such as {@code ctx}
 * and position fields other than {@code lineno} are ignored.</p>
 */
@ApplicationScoped
public class AstJsonReader {

    private static final Logger log = LoggerFactory.getLogger(AstJsonReader.class);

    private static final String TYPE_FIELD = "_type";

    // Python's json module writes inf and nan as the bare tokens Infinity, -Infinity and NaN
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .build();

    /**
     * Parses JSON text and builds the tree.
     *
     * @param json JSON text of a single node, usually a {@code Module}
     * @return Root node
     * @throws MalformedTreeException if the text is not JSON or the tree is structurally invalid
     * @throws UnsupportedNodeKindException if a node kind is unknown
     */
    public SyntaxNode read(String json) {
        if (json == null || json.trim().isEmpty()) {
            throw new MalformedTreeException("Tree JSON cannot be empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedTreeException("Invalid JSON: " + e.getOriginalMessage(), null, e);
        }
        return read(root);
    }

    /**
     * Builds the tree from an already parsed JSON document.
     */
    public SyntaxNode read(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            throw new MalformedTreeException("Tree JSON cannot be empty");
        }
        log.debug("Reading syntax tree with root kind {}", root.path(TYPE_FIELD).asText("?"));
        return node(root);
    }

    // ========== Dispatch ==========

    private SyntaxNode node(JsonNode json) {
        String kind = kindOf(json);
        try {
            return build(kind, json);
        } catch (IllegalArgumentException e) {
            throw new MalformedTreeException("Invalid " + kind + " node: " + e.getMessage(), kind, e);
        }
    }

    private SyntaxNode build(String kind, JsonNode json) {
        switch (kind) {
            // Statements
            case "Module":
                return new Module(statements(json, "body"));
            case "Expr":
                return new ExprStatement(expression(json, "value"), line(json));
            case "Assign":
                return new Assign(expressions(json, "targets"), expression(json, "value"), line(json));
            case "AugAssign":
                return new AugAssign(expression(json, "target"), binaryOperator(json, "op"),
                        expression(json, "value"), line(json));
            case "Import":
                return new Import(list(json, "names", this::alias), line(json));
            case "ImportFrom":
                return new ImportFrom(optionalText(json, "module"), list(json, "names", this::alias),
                        optionalInt(json, "level"), line(json));
            case "FunctionDef":
                return new FunctionDef(text(json, "name"), arguments(field(json, "args")),
                        statements(json, "body"), expressions(json, "decorator_list"),
                        optionalExpression(json, "returns"), line(json));
            case "ClassDef":
                return new ClassDef(text(json, "name"), expressions(json, "bases"),
                        list(json, "keywords", this::keyword), optionalExpression(json, "starargs"),
                        optionalExpression(json, "kwargs"), statements(json, "body"),
                        expressions(json, "decorator_list"), line(json));
            case "If":
                return new If(expression(json, "test"), statements(json, "body"),
                        statements(json, "orelse"), line(json));
            case "For":
                return new For(expression(json, "target"), expression(json, "iter"),
                        statements(json, "body"), statements(json, "orelse"), line(json));
            case "While":
                return new While(expression(json, "test"), statements(json, "body"),
                        statements(json, "orelse"), line(json));
            case "With":
                return with(json);
            case "Try":
                return new Try(statements(json, "body"), list(json, "handlers", this::exceptHandler),
                        statements(json, "orelse"), statements(json, "finalbody"), line(json));
            case "TryExcept":
                return new Try(statements(json, "body"), list(json, "handlers", this::exceptHandler),
                        statements(json, "orelse"), null, line(json));
            case "TryFinally":
                return tryFinally(json);
            case "Pass":
                return new Pass(line(json));
            case "Break":
                return new Break(line(json));
            case "Continue":
                return new Continue(line(json));
            case "Delete":
                return new Delete(expressions(json, "targets"), line(json));
            case "Assert":
                return new Assert(expression(json, "test"), optionalExpression(json, "msg"), line(json));
            case "Global":
                return new Global(list(json, "names", this::identifier), line(json));
            case "Nonlocal":
                return new Nonlocal(list(json, "names", this::identifier), line(json));
            case "Return":
                return new Return(optionalExpression(json, "value"), line(json));
            case "Raise":
                return raise(json);

            // Expressions
            case "Name":
                return new Name(text(json, "id"));
            case "NameConstant":
                return nameConstant(field(json, "value"));
            case "Num":
                return new Num(number(required(json, "n"), "Num"));
            case "Str":
                return new Str(text(json, "s"));
            case "Bytes":
                return new Bytes(bytes(required(json, "s")));
            case "Ellipsis":
                return new EllipsisLiteral();
            case "Constant":
                return constant(json);
            case "Attribute":
                return new Attribute(expression(json, "value"), text(json, "attr"));
            case "Call":
                return new Call(expression(json, "func"), expressions(json, "args"),
                        list(json, "keywords", this::keyword), optionalExpression(json, "starargs"),
                        optionalExpression(json, "kwargs"));
            case "BinOp":
                return new BinOp(expression(json, "left"), binaryOperator(json, "op"),
                        expression(json, "right"));
            case "BoolOp":
                return new BoolOp(operator(required(json, "op"), BooleanOperator::fromKind),
                        expressions(json, "values"));
            case "Compare":
                return new Compare(expression(json, "left"),
                        list(json, "ops", op -> operator(op, ComparisonOperator::fromKind)),
                        expressions(json, "comparators"));
            case "UnaryOp":
                return new UnaryOp(operator(required(json, "op"), UnaryOperator::fromKind),
                        expression(json, "operand"));
            case "IfExp":
                return new IfExp(expression(json, "test"), expression(json, "body"),
                        expression(json, "orelse"));
            case "Lambda":
                return new Lambda(arguments(field(json, "args")), expression(json, "body"));
            case "Tuple":
                return new TupleDisplay(expressions(json, "elts"));
            case "List":
                return new ListDisplay(expressions(json, "elts"));
            case "Set":
                return new SetDisplay(expressions(json, "elts"));
            case "Dict":
                return new DictDisplay(list(json, "keys", this::optionalExpressionNode),
                        expressions(json, "values"));
            case "ListComp":
                return new ListComp(expression(json, "elt"), list(json, "generators", this::comprehension));
            case "SetComp":
                return new SetComp(expression(json, "elt"), list(json, "generators", this::comprehension));
            case "GeneratorExp":
                return new GeneratorExp(expression(json, "elt"),
                        list(json, "generators", this::comprehension));
            case "DictComp":
                return new DictComp(expression(json, "key"), expression(json, "value"),
                        list(json, "generators", this::comprehension));
            case "Subscript":
                return new Subscript(expression(json, "value"), subscriptSlice(expression(json, "slice")));
            case "Index":
                return new Index(expression(json, "value"));
            case "Slice":
                return new Slice(optionalExpression(json, "lower"), optionalExpression(json, "upper"),
                        optionalExpression(json, "step"));
            case "ExtSlice":
                return new ExtSlice(expressions(json, "dims"));
            case "Starred":
                return new Starred(expression(json, "value"));
            case "Yield":
                return new Yield(optionalExpression(json, "value"));
            case "YieldFrom":
                return new YieldFrom(expression(json, "value"));

            // Helper nodes that may also appear as a root
            case "arguments":
                return arguments(json);
            case "arg":
                return arg(json);
            case "keyword":
                return keyword(json);
            case "alias":
                return alias(json);
            case "comprehension":
                return comprehension(json);
            case "ExceptHandler":
                return exceptHandler(json);
            case "withitem":
                return withItem(json);

            default:
                throw new UnsupportedNodeKindException(kind);
        }
    }

    // ========== Legacy and version-specific shapes ==========

    private With with(JsonNode json) {
        if (field(json, "items") != null) {
            return new With(list(json, "items", this::withItem), statements(json, "body"), line(json));
        }
        WithItem item = new WithItem(expression(json, "context_expr"), optionalExpression(json, "optional_vars"));
        return new With(List.of(item), statements(json, "body"), line(json));
    }

    private Try tryFinally(JsonNode json) {
        JsonNode body = required(json, "body");
        if (body.isArray() && body.size() == 1 && "TryExcept".equals(body.get(0).path(TYPE_FIELD).asText())) {
            JsonNode inner = body.get(0);
            return new Try(statements(inner, "body"), list(inner, "handlers", this::exceptHandler),
                    statements(inner, "orelse"), statements(json, "finalbody"), line(json));
        }
        return new Try(statements(json, "body"), null, null, statements(json, "finalbody"), line(json));
    }

    private Raise raise(JsonNode json) {
        if (field(json, "exc") == null && field(json, "type") != null) {
            if (field(json, "inst") != null || field(json, "tback") != null) {
                throw new MalformedTreeException("Three-argument raise is not supported", Raise.KIND);
            }
            return new Raise(expression(json, "type"), null, line(json));
        }
        return new Raise(optionalExpression(json, "exc"), optionalExpression(json, "cause"), line(json));
    }

    private Expression constant(JsonNode json) {
        JsonNode value = field(json, "value");
        if (value == null || value.isBoolean()) {
            return nameConstant(value);
        }
        if (value.isNumber()) {
            return new Num(number(value, "Constant"));
        }
        if (value.isTextual()) {
            return new Str(value.asText());
        }
        if (value.isObject()) {
            return expressionNode(value);
        }
        throw new MalformedTreeException("Unsupported Constant value: " + value, "Constant");
    }

    /**
     * A tuple subscript containing slices ({@code a[1:2, 3]}) is only valid without the tuple
     * parentheses, so it is read as an extended slice.
     */
    private Expression subscriptSlice(Expression slice) {
        if (slice instanceof TupleDisplay) {
            List<Expression> elements = ((TupleDisplay) slice).getElements();
            if (elements.stream().anyMatch(e -> e instanceof Slice)) {
                return new ExtSlice(elements);
            }
        }
        return slice;
    }

    // ========== Helper nodes ==========

    private Arguments arguments(JsonNode json) {
        if (json == null) {
            return Arguments.empty();
        }
        requireKind(json, Arguments.KIND);
        if (!list(json, "posonlyargs", this::arg).isEmpty()) {
            throw new MalformedTreeException("Positional-only parameters are not supported", Arguments.KIND);
        }
        return new Arguments(list(json, "args", this::arg), expressions(json, "defaults"),
                starParameter(json, "vararg", "varargannotation"),
                list(json, "kwonlyargs", this::arg), list(json, "kw_defaults", this::optionalExpressionNode),
                starParameter(json, "kwarg", "kwargannotation"));
    }

    private Arg starParameter(JsonNode json, String name, String annotationName) {
        JsonNode value = field(json, name);
        if (value == null) {
            return null;
        }
        if (value.isTextual()) {
            return new Arg(value.asText(), optionalExpression(json, annotationName));
        }
        return arg(value);
    }

    private Arg arg(JsonNode json) {
        String kind = kindOf(json);
        if (Name.KIND.equals(kind)) {
            return new Arg(text(json, "id"));
        }
        if (!Arg.KIND.equals(kind)) {
            throw new MalformedTreeException("Expected a parameter but found " + kind, kind);
        }
        return new Arg(text(json, "arg"), optionalExpression(json, "annotation"));
    }

    private Keyword keyword(JsonNode json) {
        requireKind(json, Keyword.KIND);
        return new Keyword(optionalText(json, "arg"), expression(json, "value"));
    }

    private Alias alias(JsonNode json) {
        requireKind(json, Alias.KIND);
        return new Alias(text(json, "name"), optionalText(json, "asname"));
    }

    private Comprehension comprehension(JsonNode json) {
        requireKind(json, Comprehension.KIND);
        if (optionalInt(json, "is_async") != 0) {
            throw new MalformedTreeException("Async comprehensions are not supported", Comprehension.KIND);
        }
        return new Comprehension(expression(json, "target"), expression(json, "iter"),
                expressions(json, "ifs"));
    }

    private ExceptHandler exceptHandler(JsonNode json) {
        requireKind(json, ExceptHandler.KIND);
        String name = null;
        JsonNode nameNode = field(json, "name");
        if (nameNode != null) {
            // older trees bind the exception to a Name node
            name = nameNode.isTextual() ? nameNode.asText() : text(nameNode, "id");
        }
        return new ExceptHandler(optionalExpression(json, "type"), name, statements(json, "body"), line(json));
    }

    private WithItem withItem(JsonNode json) {
        requireKind(json, WithItem.KIND);
        return new WithItem(expression(json, "context_expr"), optionalExpression(json, "optional_vars"));
    }

    private NameConstant nameConstant(JsonNode value) {
        if (value == null) {
            return NameConstant.NONE;
        }
        if (value.isBoolean()) {
            return NameConstant.of(value.booleanValue());
        }
        if (value.isTextual()) {
            return NameConstant.of(value.asText());
        }
        throw new MalformedTreeException("Invalid NameConstant value: " + value, NameConstant.KIND);
    }

    // ========== Field access ==========

    private String kindOf(JsonNode json) {
        if (json == null || !json.isObject()) {
            throw new MalformedTreeException("Expected a node object but found " + json);
        }
        JsonNode type = json.get(TYPE_FIELD);
        if (type == null || !type.isTextual() || type.asText().isEmpty()) {
            throw new MalformedTreeException("Node object has no " + TYPE_FIELD + " field: " + abbreviate(json));
        }
        return type.asText();
    }

    private void requireKind(JsonNode json, String expected) {
        String kind = kindOf(json);
        if (!expected.equals(kind)) {
            throw new MalformedTreeException("Expected " + expected + " but found " + kind, kind);
        }
    }

    /**
     * @return The field value, or null when the field is absent or JSON null
     */
    private static JsonNode field(JsonNode json, String name) {
        JsonNode value = json.get(name);
        return value == null || value.isNull() ? null : value;
    }

    private JsonNode required(JsonNode json, String name) {
        JsonNode value = field(json, name);
        if (value == null) {
            String kind = json.path(TYPE_FIELD).asText(null);
            throw new MalformedTreeException("Missing field '" + name + "' on " + kind, kind);
        }
        return value;
    }

    private Expression expressionNode(JsonNode json) {
        SyntaxNode node = node(json);
        if (!(node instanceof Expression)) {
            throw new MalformedTreeException("Expected an expression but found " + node.getKind(), node.getKind());
        }
        return (Expression) node;
    }

    private Expression optionalExpressionNode(JsonNode json) {
        return json == null || json.isNull() ? null : expressionNode(json);
    }

    private Expression expression(JsonNode json, String name) {
        return expressionNode(required(json, name));
    }

    private Expression optionalExpression(JsonNode json, String name) {
        return optionalExpressionNode(field(json, name));
    }

    private Statement statement(JsonNode json) {
        SyntaxNode node = node(json);
        if (!(node instanceof Statement)) {
            throw new MalformedTreeException("Expected a statement but found " + node.getKind(), node.getKind());
        }
        return (Statement) node;
    }

    private List<Statement> statements(JsonNode json, String name) {
        return list(json, name, this::statement);
    }

    private List<Expression> expressions(JsonNode json, String name) {
        return list(json, name, this::expressionNode);
    }

    /**
     * Converts an array field element by element. An absent field is an empty list; JSON null
     * elements are passed to the converter as {@code null}.
     */
    private <T> List<T> list(JsonNode json, String name, Function<JsonNode, T> converter) {
        JsonNode value = field(json, name);
        List<T> result = new ArrayList<>();
        if (value == null) {
            return result;
        }
        if (!value.isArray()) {
            String kind = json.path(TYPE_FIELD).asText(null);
            throw new MalformedTreeException("Field '" + name + "' on " + kind + " must be an array", kind);
        }
        Iterator<JsonNode> elements = value.elements();
        while (elements.hasNext()) {
            JsonNode element = elements.next();
            result.add(converter.apply(element.isNull() ? null : element));
        }
        return result;
    }

    private String text(JsonNode json, String name) {
        JsonNode value = required(json, name);
        if (!value.isTextual()) {
            String kind = json.path(TYPE_FIELD).asText(null);
            throw new MalformedTreeException("Field '" + name + "' on " + kind + " must be a string", kind);
        }
        return value.asText();
    }

    private static String optionalText(JsonNode json, String name) {
        JsonNode value = field(json, name);
        return value != null ? value.asText() : null;
    }

    private String identifier(JsonNode json) {
        if (json == null || !json.isTextual()) {
            throw new MalformedTreeException("Expected an identifier but found " + json);
        }
        return json.asText();
    }

    private static int optionalInt(JsonNode json, String name) {
        JsonNode value = field(json, name);
        return value != null ? value.asInt() : 0;
    }

    private static int line(JsonNode json) {
        return Math.max(0, optionalInt(json, "lineno"));
    }

    private BinaryOperator binaryOperator(JsonNode json, String name) {
        return operator(required(json, name), BinaryOperator::fromKind);
    }

    /**
     * Resolves an operator given either as a tagged object ({@code {"_type": "Add"}}) or as its
     * bare kind name.
     */
    private <T> T operator(JsonNode json, Function<String, T> resolver) {
        if (json == null) {
            throw new MalformedTreeException("Missing operator");
        }
        String kind = json.isTextual() ? json.asText() : kindOf(json);
        T operator = resolver.apply(kind);
        if (operator == null) {
            throw new UnsupportedNodeKindException(kind);
        }
        return operator;
    }

    private Number number(JsonNode value, String kind) {
        if (value.isNumber()) {
            return value.numberValue();
        }
        if (value.isTextual()) {
            // infinities and NaN have no JSON number form
            switch (value.asText()) {
                case "inf":
                case "Infinity":
                    return Double.POSITIVE_INFINITY;
                case "-inf":
                case "-Infinity":
                    return Double.NEGATIVE_INFINITY;
                case "nan":
                case "NaN":
                    return Double.NaN;
                default:
                    break;
            }
        }
        throw new MalformedTreeException("Invalid numeric value: " + value, kind);
    }

    /**
     * Byte strings arrive either as an array of byte values or as text whose characters are the
     * Latin-1 code points of the bytes.
     */
    private byte[] bytes(JsonNode value) {
        if (value.isTextual()) {
            return value.asText().getBytes(StandardCharsets.ISO_8859_1);
        }
        if (value.isArray()) {
            byte[] result = new byte[value.size()];
            for (int i = 0; i < value.size(); i++) {
                int b = value.get(i).asInt(-1);
                if (b < 0 || b > 255) {
                    throw new MalformedTreeException("Invalid byte value: " + value.get(i), Bytes.KIND);
                }
                result[i] = (byte) b;
            }
            return result;
        }
        throw new MalformedTreeException("Invalid Bytes value: " + value, Bytes.KIND);
    }

    private static String abbreviate(JsonNode json) {
        String text = json.toString();
        return text.length() > 80 ? text.substring(0, 77) + "..." : text;
    }
}
