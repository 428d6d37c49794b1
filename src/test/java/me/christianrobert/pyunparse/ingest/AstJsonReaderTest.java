package me.christianrobert.pyunparse.ingest;

import me.christianrobert.pyunparse.context.MalformedTreeException;
import me.christianrobert.pyunparse.context.UnsupportedNodeKindException;
import me.christianrobert.pyunparse.generator.SourceGenerator;
import me.christianrobert.pyunparse.tree.SyntaxNode;
import me.christianrobert.pyunparse.tree.element.Arguments;
import me.christianrobert.pyunparse.tree.element.WithItem;
import me.christianrobert.pyunparse.tree.expression.Bytes;
import me.christianrobert.pyunparse.tree.expression.ExtSlice;
import me.christianrobert.pyunparse.tree.expression.NameConstant;
import me.christianrobert.pyunparse.tree.expression.Num;
import me.christianrobert.pyunparse.tree.expression.Str;
import me.christianrobert.pyunparse.tree.expression.Subscript;
import me.christianrobert.pyunparse.tree.statement.Assign;
import me.christianrobert.pyunparse.tree.statement.FunctionDef;
import me.christianrobert.pyunparse.tree.statement.If;
import me.christianrobert.pyunparse.tree.statement.Module;
import me.christianrobert.pyunparse.tree.statement.Try;
import me.christianrobert.pyunparse.tree.statement.With;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AstJsonReaderTest {

    private AstJsonReader reader;

    @BeforeEach
    void setUp() {
        reader = new AstJsonReader();
    }

    private Module module(String json) {
        SyntaxNode node = reader.read(json);
        assertInstanceOf(Module.class, node);
        return (Module) node;
    }

    // ========== CANONICAL SHAPES ==========

    @Test
    void readsModuleWithLineNumbers() {
        String json = """
                {"_type": "Module", "body": [
                  {"_type": "If", "lineno": 3,
                   "test": {"_type": "Name", "id": "x", "ctx": {"_type": "Load"}},
                   "body": [{"_type": "Pass", "lineno": 4}],
                   "orelse": []}
                ]}
                """;

        Module module = module(json);

        If statement = (If) module.getBody().get(0);
        assertEquals(3, statement.getLineNumber());
        assertEquals(4, statement.getBody().get(0).getLineNumber());
        assertEquals("if x:\n    pass", SourceGenerator.toSource(module));
    }

    @Test
    void readsFunctionWithFullSignature() {
        String json = """
                {"_type": "FunctionDef", "name": "f", "lineno": 1,
                 "args": {"_type": "arguments",
                          "args": [{"_type": "arg", "arg": "a", "annotation": {"_type": "Name", "id": "int"}},
                                   {"_type": "arg", "arg": "b", "annotation": null}],
                          "defaults": [{"_type": "Num", "n": 1}],
                          "vararg": {"_type": "arg", "arg": "args"},
                          "kwonlyargs": [{"_type": "arg", "arg": "k"}],
                          "kw_defaults": [null],
                          "kwarg": {"_type": "arg", "arg": "kw"}},
                 "body": [{"_type": "Return", "value": {"_type": "Name", "id": "a"}}],
                 "decorator_list": [{"_type": "Name", "id": "staticmethod"}],
                 "returns": null}
                """;

        SyntaxNode node = reader.read(json);

        assertInstanceOf(FunctionDef.class, node);
        assertEquals("@staticmethod\ndef f(a: int, b=1, *args, k, **kw):\n    return a",
                SourceGenerator.toSource(node));
    }

    @Test
    void readsOperatorsAsObjectsOrNames() {
        String json = """
                {"_type": "BinOp",
                 "left": {"_type": "UnaryOp", "op": {"_type": "USub"}, "operand": {"_type": "Num", "n": 2}},
                 "op": "Pow",
                 "right": {"_type": "Num", "n": 2}}
                """;

        assertEquals("((- 2) ** 2)", SourceGenerator.toSource(reader.read(json)));
    }

    @Test
    void readsLiterals() {
        assertEquals(new Num(3).getValue().longValue(),
                ((Num) reader.read("{\"_type\": \"Num\", \"n\": 3}")).getValue().longValue());
        assertEquals(2.5, ((Num) reader.read("{\"_type\": \"Num\", \"n\": 2.5}")).getValue().doubleValue());
        assertEquals(Double.POSITIVE_INFINITY,
                ((Num) reader.read("{\"_type\": \"Num\", \"n\": \"inf\"}")).getValue().doubleValue());
        assertEquals("hi", ((Str) reader.read("{\"_type\": \"Str\", \"s\": \"hi\"}")).getValue());
        assertArrayEquals(new byte[]{1, (byte) 255},
                ((Bytes) reader.read("{\"_type\": \"Bytes\", \"s\": [1, 255]}")).getValue());
        assertSame(NameConstant.TRUE, reader.read("{\"_type\": \"NameConstant\", \"value\": true}"));
        assertSame(NameConstant.NONE, reader.read("{\"_type\": \"NameConstant\", \"value\": null}"));
    }

    @Test
    void readsDictWithUnpackingEntry() {
        String json = """
                {"_type": "Dict",
                 "keys": [{"_type": "Str", "s": "a"}, null],
                 "values": [{"_type": "Num", "n": 1}, {"_type": "Name", "id": "rest"}]}
                """;

        assertEquals("{'a': 1, **rest, }", SourceGenerator.toSource(reader.read(json)));
    }

    // ========== LEGACY AND VERSION-SPECIFIC SHAPES ==========

    @Test
    void tryExceptBecomesTry() {
        String json = """
                {"_type": "TryExcept", "lineno": 1,
                 "body": [{"_type": "Pass"}],
                 "handlers": [{"_type": "ExceptHandler", "type": {"_type": "Name", "id": "E"},
                               "name": {"_type": "Name", "id": "e"}, "body": [{"_type": "Pass"}]}],
                 "orelse": [{"_type": "Pass"}]}
                """;

        Try statement = (Try) reader.read(json);

        assertEquals(1, statement.getHandlers().size());
        assertEquals("e", statement.getHandlers().get(0).getName());
        assertEquals(1, statement.getOrelse().size());
        assertTrue(statement.getFinalbody().isEmpty());
    }

    @Test
    void tryFinallyWrappingTryExceptMergesIntoOneTry() {
        String json = """
                {"_type": "TryFinally", "lineno": 1,
                 "body": [{"_type": "TryExcept", "lineno": 1,
                           "body": [{"_type": "Pass"}],
                           "handlers": [{"_type": "ExceptHandler", "type": null, "name": null,
                                         "body": [{"_type": "Pass"}]}],
                           "orelse": []}],
                 "finalbody": [{"_type": "Expr", "value": {"_type": "Call",
                                "func": {"_type": "Name", "id": "close"}, "args": [], "keywords": []}}]}
                """;

        Try statement = (Try) reader.read(json);

        assertEquals(1, statement.getHandlers().size());
        assertEquals(1, statement.getFinalbody().size());
        assertEquals("try:\n    pass\nexcept:\n    pass\nfinally:\n    close()",
                SourceGenerator.toSource(statement));
    }

    @Test
    void plainTryFinallyBecomesTryWithoutHandlers() {
        String json = """
                {"_type": "TryFinally",
                 "body": [{"_type": "Pass"}, {"_type": "Pass"}],
                 "finalbody": [{"_type": "Pass"}]}
                """;

        Try statement = (Try) reader.read(json);

        assertTrue(statement.getHandlers().isEmpty());
        assertEquals(2, statement.getBody().size());
    }

    @Test
    void singleItemWithBecomesWithItem() {
        String json = """
                {"_type": "With",
                 "context_expr": {"_type": "Name", "id": "lock"},
                 "optional_vars": {"_type": "Name", "id": "held"},
                 "body": [{"_type": "Pass"}]}
                """;

        With statement = (With) reader.read(json);

        assertEquals(1, statement.getItems().size());
        WithItem item = statement.getItems().get(0);
        assertNotNull(item.getOptionalVars());
        assertEquals("with lock as held:\n    pass", SourceGenerator.toSource(statement));
    }

    @Test
    void legacyParametersBecomeArgs() {
        String json = """
                {"_type": "arguments",
                 "args": [{"_type": "Name", "id": "self"}, {"_type": "Name", "id": "x"}],
                 "defaults": [],
                 "vararg": "rest",
                 "kwarg": "options"}
                """;

        Arguments arguments = (Arguments) reader.read(json);

        assertEquals("self", arguments.getArgs().get(0).getName());
        assertEquals("rest", arguments.getVararg().getName());
        assertEquals("options", arguments.getKwarg().getName());
    }

    @Test
    void constantMapsToLiteralKinds() {
        assertInstanceOf(Num.class, reader.read("{\"_type\": \"Constant\", \"value\": 7}"));
        assertInstanceOf(Str.class, reader.read("{\"_type\": \"Constant\", \"value\": \"s\"}"));
        assertSame(NameConstant.FALSE, reader.read("{\"_type\": \"Constant\", \"value\": false}"));
        assertSame(NameConstant.NONE, reader.read("{\"_type\": \"Constant\", \"value\": null}"));
        assertEquals("...", SourceGenerator.toSource(
                reader.read("{\"_type\": \"Constant\", \"value\": {\"_type\": \"Ellipsis\"}}")));
    }

    @Test
    void nonFiniteFloatsAcceptedAsBareJsonTokens() {
        // Given - json.dumps output for float('inf'), float('-inf') and float('nan')
        String json = """
                {"_type": "Module", "body": [
                  {"_type": "Assign", "lineno": 1, "targets": [{"_type": "Name", "id": "a"}],
                   "value": {"_type": "Constant", "value": Infinity}},
                  {"_type": "Assign", "lineno": 2, "targets": [{"_type": "Name", "id": "b"}],
                   "value": {"_type": "Num", "n": -Infinity}},
                  {"_type": "Assign", "lineno": 3, "targets": [{"_type": "Name", "id": "c"}],
                   "value": {"_type": "Constant", "value": NaN}}]}
                """;

        // When
        Module module = module(json);

        // Then
        Num nan = (Num) ((Assign) module.getBody().get(2)).getValue();
        assertTrue(Double.isNaN(nan.getValue().doubleValue()));
        assertEquals("a = 1e309\nb = (-1e309)\nc = (1e309 - 1e309)", SourceGenerator.toSource(module));
    }

    @Test
    void subscriptTupleWithSlicesBecomesExtendedSlice() {
        String json = """
                {"_type": "Subscript", "value": {"_type": "Name", "id": "a"},
                 "slice": {"_type": "Tuple", "elts": [
                   {"_type": "Slice", "lower": {"_type": "Constant", "value": 1}, "upper": null, "step": null},
                   {"_type": "Constant", "value": 2}]}}
                """;

        Subscript subscript = (Subscript) reader.read(json);

        assertInstanceOf(ExtSlice.class, subscript.getSlice());
        assertEquals("a[1:, 2]", SourceGenerator.toSource(subscript));
    }

    // ========== ERRORS ==========

    @Test
    void unknownKindIsUnsupported() {
        String json = """
                {"_type": "Module", "body": [
                  {"_type": "Expr", "value": {"_type": "Await", "value": {"_type": "Name", "id": "x"}}}]}
                """;

        UnsupportedNodeKindException e = assertThrows(UnsupportedNodeKindException.class, () -> reader.read(json));
        assertEquals("Await", e.getKind());
    }

    @Test
    void unknownOperatorIsUnsupported() {
        String json = "{\"_type\": \"BinOp\", \"left\": {\"_type\": \"Name\", \"id\": \"a\"},"
                + " \"op\": {\"_type\": \"Walrus\"}, \"right\": {\"_type\": \"Name\", \"id\": \"b\"}}";

        UnsupportedNodeKindException e = assertThrows(UnsupportedNodeKindException.class, () -> reader.read(json));
        assertEquals("Walrus", e.getKind());
    }

    @Test
    void missingTypeTagIsMalformed() {
        assertThrows(MalformedTreeException.class, () -> reader.read("{\"body\": []}"));
        assertThrows(MalformedTreeException.class, () -> reader.read("[1, 2]"));
    }

    @Test
    void invalidJsonIsMalformed() {
        assertThrows(MalformedTreeException.class, () -> reader.read("{\"_type\": "));
        assertThrows(MalformedTreeException.class, () -> reader.read("   "));
    }

    @Test
    void missingRequiredFieldIsMalformed() {
        MalformedTreeException e = assertThrows(MalformedTreeException.class,
                () -> reader.read("{\"_type\": \"Assign\", \"targets\": [{\"_type\": \"Name\", \"id\": \"x\"}]}"));
        assertEquals("Assign", e.getKind());
        assertTrue(e.getMessage().contains("value"));
    }

    @Test
    void constructorRejectionIsMalformed() {
        String json = "{\"_type\": \"If\", \"test\": {\"_type\": \"Name\", \"id\": \"x\"}, \"body\": []}";

        MalformedTreeException e = assertThrows(MalformedTreeException.class, () -> reader.read(json));
        assertEquals("If", e.getKind());
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }

    @Test
    void expressionInStatementPositionIsMalformed() {
        String json = "{\"_type\": \"Module\", \"body\": [{\"_type\": \"Name\", \"id\": \"x\"}]}";

        assertThrows(MalformedTreeException.class, () -> reader.read(json));
    }

    @Test
    void positionalOnlyParametersAreRejected() {
        String json = "{\"_type\": \"arguments\", \"posonlyargs\": [{\"_type\": \"arg\", \"arg\": \"a\"}]}";

        assertThrows(MalformedTreeException.class, () -> reader.read(json));
    }
}
