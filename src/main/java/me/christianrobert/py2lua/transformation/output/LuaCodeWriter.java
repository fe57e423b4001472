package me.christianrobert.py2lua.transformation.output;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Line sink for generated Lua code.
 *
 * <p>Keeps the emitted lines in order and the current indentation depth.
 * Depth only changes through {@link #indent()}, which returns a scope that
 * restores the previous depth when closed:
 * <pre>
 * writer.emit("while (x &lt; 3) do");
 * try (LuaCodeWriter.IndentScope ignored = writer.indent()) {
 *     writer.emit("local x = (x + 1)");
 * }
 * writer.emit("end");
 * </pre>
 *
 * <p>Owned by a single translation run.
 */
public class LuaCodeWriter {

    public static final String INDENT_UNIT = "    ";

    private final List<String> lines = new ArrayList<>();
    private int depth;

    /**
     * Appends one line, prefixed with the current indentation.
     */
    public void emit(String text) {
        lines.add(INDENT_UNIT.repeat(depth) + text);
    }

    /**
     * Opens one additional indentation level until the returned scope is closed.
     */
    public IndentScope indent() {
        depth++;
        return new IndentScope();
    }

    public int getDepth() {
        return depth;
    }

    public List<String> getLines() {
        return Collections.unmodifiableList(lines);
    }

    /**
     * @return All lines joined by '\n', in emission order
     */
    public String toCode() {
        return String.join("\n", lines);
    }

    /**
     * One level of indentation. Closing is idempotent.
     */
    public final class IndentScope implements AutoCloseable {

        private boolean closed;

        private IndentScope() {
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                depth--;
            }
        }
    }
}
