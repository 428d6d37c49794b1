package me.christianrobert.pyunparse.generator;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceBufferTest {

    private SourceBuffer buffer;

    @BeforeEach
    void setUp() {
        buffer = new SourceBuffer("    ");
    }

    @Test
    void writeWithoutPendingBreakAppendsDirectly() {
        buffer.write("x");
        buffer.write(" = ");
        buffer.write("1");

        assertEquals("x = 1", buffer.finish());
    }

    @Test
    void firstLineHasNoLeadingNewline() {
        // Given: a break requested before anything was written
        buffer.newline(2);

        // When
        buffer.write("pass");

        // Then: only the indentation of depth 0 is materialized
        assertEquals("pass", buffer.finish());
        assertEquals(0, buffer.getPendingNewLines());
    }

    @Test
    void breakRequestsCollapseToTheirMaximum() {
        buffer.write("a");
        buffer.newline(0);
        buffer.newline(2);
        buffer.newline(1);
        buffer.write("b");

        assertEquals("a\n\n\nb", buffer.finish());
    }

    @Test
    void indentationIsWrittenAfterTheBreak() {
        buffer.write("if x:");
        buffer.indent();
        buffer.newline(0);
        buffer.write("pass");
        buffer.dedent();
        buffer.newline(0);
        buffer.write("y");

        assertEquals("if x:\n    pass\ny", buffer.finish());
    }

    @Test
    void indentationUnitIsUsedVerbatim() {
        SourceBuffer tabs = new SourceBuffer("\t");
        tabs.write("a");
        tabs.indent();
        tabs.indent();
        tabs.newline(0);
        tabs.write("b");

        assertEquals("a\n\t\tb", tabs.finish());
    }

    @Test
    void trailingBreakRequestIsNotWritten() {
        buffer.write("x");
        buffer.newline(3);

        assertEquals("x", buffer.finish());
        assertEquals(4, buffer.getPendingNewLines());
    }

    @Test
    void dedentBelowZeroIsRejected() {
        assertThrows(IllegalStateException.class, () -> buffer.dedent());
    }

    @Test
    void negativeExtraIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> buffer.newline(-1));
    }

    @Test
    void nullIndentationUnitIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SourceBuffer(null));
    }
}
