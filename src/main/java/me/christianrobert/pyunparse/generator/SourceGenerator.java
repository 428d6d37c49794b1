package me.christianrobert.pyunparse.generator;

import me.christianrobert.pyunparse.context.RenderContext;
import me.christianrobert.pyunparse.context.SourceGenerationException;
import me.christianrobert.pyunparse.context.UnsupportedNodeKindException;
import me.christianrobert.pyunparse.tree.SyntaxNode;
import me.christianrobert.pyunparse.tree.element.Alias;
import me.christianrobert.pyunparse.tree.element.Arg;
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

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Turns a syntax tree into Python source text.
 *
 * <p>Architecture:
 * <pre>
 * SyntaxNode tree → SourceGenerator.visit (rule lookup by kind) → Visit* rule → SourceBuffer
 *                          ↑                                          |
 *                          └──────────── ctx.visit(child) ────────────┘
 * </pre>
 *
 * <p>Each rule is a static method of a {@code Visit*} helper class. Rules never mutate the tree
 * and never keep state outside the {@link RenderContext} they are given, so a single generator
 * (its rule table is immutable) can serve any number of concurrent conversions.</p>
 *
 * <p>Usage:
 * <pre>
 * String source = SourceGenerator.toSource(module);
 * String annotated = SourceGenerator.toSource(module, "  ", true);
 * </pre>
 */
public class SourceGenerator {

    // no logging here, one line per node would flood the logs

    public static final String DEFAULT_INDENT = "    ";

    private static final SourceGenerator SHARED = new SourceGenerator();

    private final Map<String, NodeRule<SyntaxNode>> rules;

    public SourceGenerator() {
        Map<String, NodeRule<SyntaxNode>> table = new HashMap<>();

        // Statements
        register(table, Module.KIND, Module.class, VisitModule::v);
        register(table, Assign.KIND, Assign.class, VisitAssignment::assign);
        register(table, AugAssign.KIND, AugAssign.class, VisitAssignment::augAssign);
        register(table, Import.KIND, Import.class, VisitImport::importStatement);
        register(table, ImportFrom.KIND, ImportFrom.class, VisitImport::importFrom);
        register(table, ExprStatement.KIND, ExprStatement.class, VisitSimpleStatement::expr);
        register(table, FunctionDef.KIND, FunctionDef.class, VisitFunctionDef::v);
        register(table, ClassDef.KIND, ClassDef.class, VisitClassDef::v);
        register(table, If.KIND, If.class, VisitIf::v);
        register(table, For.KIND, For.class, VisitLoop::forLoop);
        register(table, While.KIND, While.class, VisitLoop::whileLoop);
        register(table, With.KIND, With.class, VisitWith::v);
        register(table, Try.KIND, Try.class, VisitTry::v);
        register(table, Pass.KIND, Pass.class, VisitSimpleStatement::pass);
        register(table, Break.KIND, Break.class, VisitSimpleStatement::breakStatement);
        register(table, Continue.KIND, Continue.class, VisitSimpleStatement::continueStatement);
        register(table, Delete.KIND, Delete.class, VisitSimpleStatement::delete);
        register(table, Assert.KIND, Assert.class, VisitSimpleStatement::assertStatement);
        register(table, Global.KIND, Global.class, VisitSimpleStatement::global);
        register(table, Nonlocal.KIND, Nonlocal.class, VisitSimpleStatement::nonlocal);
        register(table, Return.KIND, Return.class, VisitSimpleStatement::returnStatement);
        register(table, Raise.KIND, Raise.class, VisitSimpleStatement::raise);

        // Expressions
        register(table, Name.KIND, Name.class, VisitExpression::name);
        register(table, Attribute.KIND, Attribute.class, VisitExpression::attribute);
        register(table, Starred.KIND, Starred.class, VisitExpression::starred);
        register(table, Yield.KIND, Yield.class, VisitExpression::yieldExpression);
        register(table, YieldFrom.KIND, YieldFrom.class, VisitExpression::yieldFrom);
        register(table, Lambda.KIND, Lambda.class, VisitExpression::lambda);
        register(table, Num.KIND, Num.class, VisitLiteral::num);
        register(table, Str.KIND, Str.class, VisitLiteral::str);
        register(table, Bytes.KIND, Bytes.class, VisitLiteral::bytes);
        register(table, NameConstant.KIND, NameConstant.class, VisitLiteral::nameConstant);
        register(table, EllipsisLiteral.KIND, EllipsisLiteral.class, VisitLiteral::ellipsis);
        register(table, Call.KIND, Call.class, VisitCall::v);
        register(table, BinOp.KIND, BinOp.class, VisitOperation::binOp);
        register(table, BoolOp.KIND, BoolOp.class, VisitOperation::boolOp);
        register(table, Compare.KIND, Compare.class, VisitOperation::compare);
        register(table, UnaryOp.KIND, UnaryOp.class, VisitOperation::unaryOp);
        register(table, IfExp.KIND, IfExp.class, VisitOperation::ifExp);
        register(table, TupleDisplay.KIND, TupleDisplay.class, VisitCollection::tuple);
        register(table, ListDisplay.KIND, ListDisplay.class, VisitCollection::list);
        register(table, SetDisplay.KIND, SetDisplay.class, VisitCollection::set);
        register(table, DictDisplay.KIND, DictDisplay.class, VisitCollection::dict);
        register(table, ListComp.KIND, ListComp.class, VisitComprehension::listComp);
        register(table, SetComp.KIND, SetComp.class, VisitComprehension::setComp);
        register(table, GeneratorExp.KIND, GeneratorExp.class, VisitComprehension::generatorExp);
        register(table, DictComp.KIND, DictComp.class, VisitComprehension::dictComp);
        register(table, Subscript.KIND, Subscript.class, VisitSubscript::subscript);
        register(table, Index.KIND, Index.class, VisitSubscript::index);
        register(table, Slice.KIND, Slice.class, VisitSubscript::slice);
        register(table, ExtSlice.KIND, ExtSlice.class, VisitSubscript::extSlice);

        // Helper nodes
        register(table, Arg.KIND, Arg.class, ListFormatter::arg);
        register(table, Keyword.KIND, Keyword.class, VisitCall::keyword);
        register(table, Alias.KIND, Alias.class, VisitImport::alias);
        register(table, Comprehension.KIND, Comprehension.class, VisitComprehension::comprehension);
        register(table, ExceptHandler.KIND, ExceptHandler.class, VisitTry::exceptHandler);
        register(table, WithItem.KIND, WithItem.class, VisitWith::withItem);

        this.rules = Map.copyOf(table);
    }

    private static <T extends SyntaxNode> void register(Map<String, NodeRule<SyntaxNode>> table,
                                                        String kind, Class<T> type, NodeRule<T> rule) {
        table.put(kind, (node, ctx) -> {
            if (!type.isInstance(node)) {
                throw new SourceGenerationException("Node of kind " + kind + " has unexpected type "
                        + node.getClass().getName() + " (expected " + type.getName() + ")", kind);
            }
            rule.render(type.cast(node), ctx);
        });
    }

    // ========== Entry points ==========

    /**
     * Converts a tree to source with four-space indentation and no line annotations.
     */
    public static String toSource(SyntaxNode tree) {
        return toSource(tree, DEFAULT_INDENT, false);
    }

    /**
     * Converts a tree to source.
     *
     * @param tree Root node, usually a {@link Module}
     * @param indentWith Text written once per indentation level, used verbatim
     * @param addLineInformation Whether each statement is preceded by a {@code # line: n} comment
     * @return Complete source text
     * @throws UnsupportedNodeKindException if the tree contains a kind without a rule
     */
    public static String toSource(SyntaxNode tree, String indentWith, boolean addLineInformation) {
        return SHARED.generate(tree, indentWith, addLineInformation);
    }

    /**
     * Instance variant of {@link #toSource(SyntaxNode, String, boolean)}.
     * The text is returned only once the whole tree has been rendered.
     */
    public String generate(SyntaxNode tree, String indentWith, boolean addLineInformation) {
        if (tree == null) {
            throw new IllegalArgumentException("Tree cannot be null");
        }
        RenderContext ctx = new RenderContext(this, indentWith, addLineInformation);
        visit(tree, ctx);
        return ctx.finish();
    }

    // ========== Dispatch ==========

    /**
     * Renders one node with the rule registered for its kind.
     *
     * @throws UnsupportedNodeKindException if no rule is registered for the node's kind
     */
    public void visit(SyntaxNode node, RenderContext ctx) {
        if (node == null) {
            throw new SourceGenerationException("Cannot render a missing node");
        }
        NodeRule<SyntaxNode> rule = rules.get(node.getKind());
        if (rule == null) {
            throw new UnsupportedNodeKindException(node.getKind());
        }
        rule.render(node, ctx);
    }

    public boolean supports(String kind) {
        return rules.containsKey(kind);
    }

    public Set<String> getSupportedKinds() {
        return rules.keySet();
    }
}
