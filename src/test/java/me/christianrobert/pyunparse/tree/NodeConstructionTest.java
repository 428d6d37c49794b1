package me.christianrobert.pyunparse.tree;

import me.christianrobert.pyunparse.tree.element.Arg;
import me.christianrobert.pyunparse.tree.element.Arguments;
import me.christianrobert.pyunparse.tree.element.ExceptHandler;
import me.christianrobert.pyunparse.tree.element.Keyword;
import me.christianrobert.pyunparse.tree.expression.BoolOp;
import me.christianrobert.pyunparse.tree.expression.Bytes;
import me.christianrobert.pyunparse.tree.expression.Compare;
import me.christianrobert.pyunparse.tree.expression.DictDisplay;
import me.christianrobert.pyunparse.tree.expression.Name;
import me.christianrobert.pyunparse.tree.expression.NameConstant;
import me.christianrobert.pyunparse.tree.expression.Num;
import me.christianrobert.pyunparse.tree.operator.BinaryOperator;
import me.christianrobert.pyunparse.tree.operator.BooleanOperator;
import me.christianrobert.pyunparse.tree.operator.ComparisonOperator;
import me.christianrobert.pyunparse.tree.operator.UnaryOperator;
import me.christianrobert.pyunparse.tree.statement.Assign;
import me.christianrobert.pyunparse.tree.statement.If;
import me.christianrobert.pyunparse.tree.statement.ImportFrom;
import me.christianrobert.pyunparse.tree.statement.Pass;
import me.christianrobert.pyunparse.tree.statement.Raise;
import me.christianrobert.pyunparse.tree.statement.Try;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Invalid trees are rejected when they are built, so the generator never sees them.
 */
class NodeConstructionTest {

    private static final Name X = new Name("x");

    @Test
    void requiredFieldsCannotBeNull() {
        assertThrows(IllegalArgumentException.class, () -> new Name(null));
        assertThrows(IllegalArgumentException.class, () -> new Assign(List.of(X), null));
        assertThrows(IllegalArgumentException.class, () -> new Keyword("k", null));
    }

    @Test
    void blocksCannotBeEmpty() {
        assertThrows(IllegalArgumentException.class, () -> new If(X, List.of(), List.of()));
        assertThrows(IllegalArgumentException.class, () -> new Assign(List.of(), X));
    }

    @Test
    void listsCannotContainNulls() {
        List<Expression> targets = new ArrayList<>();
        targets.add(null);
        assertThrows(IllegalArgumentException.class, () -> new Assign(targets, X));
    }

    @Test
    void listsAreCopied() {
        List<Statement> body = new ArrayList<>(List.of(new Pass()));
        If statement = new If(X, body, null);
        body.add(new Pass());

        assertEquals(1, statement.getBody().size());
        assertTrue(statement.getOrelse().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> statement.getBody().add(new Pass()));
    }

    @Test
    void negativeLineNumberIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Pass(-1));
    }

    @Test
    void tryNeedsHandlerOrFinally() {
        List<Statement> body = List.of(new Pass());
        assertThrows(IllegalArgumentException.class, () -> new Try(body, null, null, null));
        assertThrows(IllegalArgumentException.class, () -> new Try(body, null, List.of(new Pass()), List.of(new Pass())));
    }

    @Test
    void exceptHandlerNameRequiresType() {
        assertThrows(IllegalArgumentException.class, () -> new ExceptHandler(null, "e", List.of(new Pass())));
    }

    @Test
    void raiseCauseRequiresException() {
        assertThrows(IllegalArgumentException.class, () -> new Raise(null, X));
    }

    @Test
    void importFromWithoutModuleMustBeRelative() {
        assertThrows(IllegalArgumentException.class, () -> new ImportFrom(null, List.of(), 0));
        assertThrows(IllegalArgumentException.class, () -> new ImportFrom("os", List.of(), -1));
    }

    @Test
    void compareNeedsOneComparatorPerOperator() {
        assertThrows(IllegalArgumentException.class,
                () -> new Compare(X, List.of(ComparisonOperator.EQ, ComparisonOperator.LT), List.of(X)));
    }

    @Test
    void boolOpNeedsTwoValues() {
        assertThrows(IllegalArgumentException.class, () -> new BoolOp(BooleanOperator.AND, List.of(X)));
    }

    @Test
    void dictKeysAndValuesMustMatch() {
        assertThrows(IllegalArgumentException.class, () -> new DictDisplay(List.of(X), List.of()));
        DictDisplay unpacking = new DictDisplay(Arrays.asList((Expression) null), List.of(X));
        assertNull(unpacking.getKeys().get(0));
    }

    @Test
    void argumentsValidateDefaults() {
        assertThrows(IllegalArgumentException.class,
                () -> new Arguments(List.of(new Arg("a")), List.of(X, X), null, null, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new Arguments(null, null, null, List.of(new Arg("k")), List.of(X, X), null));

        Arguments noKwDefaults = new Arguments(null, null, null, List.of(new Arg("k")), null, null);
        assertEquals(1, noKwDefaults.getKwDefaults().size());
        assertNull(noKwDefaults.getKwDefaults().get(0));
        assertTrue(Arguments.empty().isEmpty());
        assertFalse(noKwDefaults.isEmpty());
    }

    @Test
    void numAcceptsIntegralAndFloatingTypesOnly() {
        assertTrue(new Num(new BigInteger("10")).isIntegral());
        assertFalse(new Num(1.0).isIntegral());
        assertThrows(IllegalArgumentException.class, () -> new Num(new AtomicInteger(1)));
    }

    @Test
    void bytesAreDefensivelyCopied() {
        byte[] data = {1, 2};
        Bytes bytes = new Bytes(data);
        data[0] = 9;

        assertEquals(1, bytes.getValue()[0]);
    }

    @Test
    void nameConstantsResolveFromText() {
        assertSame(NameConstant.TRUE, NameConstant.of("True"));
        assertSame(NameConstant.NONE, NameConstant.of((Boolean) null));
        assertThrows(IllegalArgumentException.class, () -> NameConstant.of("true"));
    }

    @Test
    void operatorsResolveFromKind() {
        assertEquals(BinaryOperator.POW, BinaryOperator.fromKind("Pow"));
        assertEquals("**", BinaryOperator.POW.getToken());
        assertEquals(ComparisonOperator.IS_NOT, ComparisonOperator.fromKind("IsNot"));
        assertEquals("not", UnaryOperator.fromKind("Not").getToken());
        assertNull(BinaryOperator.fromKind("Walrus"));
    }
}
