package me.christianrobert.py2lua.transformation.output;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LuaCodeWriterTest {

    @Test
    void emitsLinesInOrderJoinedByNewline() {
        LuaCodeWriter writer = new LuaCodeWriter();
        writer.emit("local x = 1");
        writer.emit("print(x)");

        assertEquals("local x = 1\nprint(x)", writer.toCode());
        assertEquals(2, writer.getLines().size());
    }

    @Test
    void emptyWriterProducesEmptyText() {
        assertEquals("", new LuaCodeWriter().toCode());
    }

    @Test
    void indentScopePrefixesFourSpacesPerLevel() {
        LuaCodeWriter writer = new LuaCodeWriter();
        writer.emit("a");
        try (LuaCodeWriter.IndentScope outer = writer.indent()) {
            writer.emit("b");
            try (LuaCodeWriter.IndentScope inner = writer.indent()) {
                writer.emit("c");
            }
        }
        writer.emit("d");

        assertEquals("a\n    b\n        c\nd", writer.toCode());
        assertEquals(0, writer.getDepth());
    }

    @Test
    void depthRestoredWhenBodyThrows() {
        LuaCodeWriter writer = new LuaCodeWriter();

        assertThrows(IllegalStateException.class, () -> {
            try (LuaCodeWriter.IndentScope ignored = writer.indent()) {
                writer.emit("partial");
                throw new IllegalStateException("boom");
            }
        });

        assertEquals(0, writer.getDepth());
    }

    @Test
    void closingScopeTwiceDecrementsOnce() {
        LuaCodeWriter writer = new LuaCodeWriter();
        LuaCodeWriter.IndentScope scope = writer.indent();
        scope.close();
        scope.close();

        assertEquals(0, writer.getDepth());
    }

    @Test
    void linesViewIsReadOnly() {
        LuaCodeWriter writer = new LuaCodeWriter();
        writer.emit("x");
        assertThrows(UnsupportedOperationException.class, () -> writer.getLines().add("y"));
    }
}
