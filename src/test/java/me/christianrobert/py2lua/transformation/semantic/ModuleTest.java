package me.christianrobert.py2lua.transformation.semantic;

import me.christianrobert.py2lua.transformation.context.TransformationContext;
import me.christianrobert.py2lua.transformation.mapping.ApiMappingTable;
import me.christianrobert.py2lua.transformation.output.LuaCodeWriter;
import me.christianrobert.py2lua.transformation.resolver.ImportBindings;
import me.christianrobert.py2lua.transformation.semantic.expression.Call;
import me.christianrobert.py2lua.transformation.semantic.expression.Identifier;
import me.christianrobert.py2lua.transformation.semantic.expression.NumberLiteral;
import me.christianrobert.py2lua.transformation.semantic.statement.Assignment;
import me.christianrobert.py2lua.transformation.semantic.statement.Conditional;
import me.christianrobert.py2lua.transformation.semantic.statement.ExpressionStatement;
import me.christianrobert.py2lua.transformation.semantic.statement.FunctionDefinition;
import me.christianrobert.py2lua.transformation.semantic.statement.Statement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Module-level emission and the main() auto-invocation.
 */
class ModuleTest {

    private final TransformationContext context = new TransformationContext(ImportBindings.empty(), ApiMappingTable.defaults());

    private String emit(Module module) {
        LuaCodeWriter writer = new LuaCodeWriter();
        module.toLua(context, writer);
        return writer.toCode();
    }

    private static Statement printOne() {
        return new ExpressionStatement(new Call(new Identifier("print"), List.of(new NumberLiteral(1))));
    }

    @Test
    void mainIsCalledAfterAllStatements() {
        Module module = new Module(List.of(
                new FunctionDefinition("main", List.of(), List.of(printOne())),
                new Assignment(new Identifier("x"), new NumberLiteral(1))));

        List<String> lines = List.of(emit(module).split("\n"));
        assertEquals("main()", lines.get(lines.size() - 1));
        assertEquals("local x = 1", lines.get(lines.size() - 2));
    }

    @Test
    void noCallWithoutMain() {
        Module module = new Module(List.of(new FunctionDefinition("setup", List.of(), List.of(printOne()))));

        String lua = emit(module);
        assertFalse(lua.contains("main()"));
        assertFalse(module.definesEntryPoint());
    }

    @Test
    void nestedMainIsNotAnEntryPoint() {
        Statement nestedMain = new FunctionDefinition("main", List.of(), List.of(printOne()));
        Module module = new Module(List.of(
                new Conditional(new Identifier("enabled"), List.of(nestedMain), List.of())));

        assertFalse(module.definesEntryPoint());
        assertFalse(emit(module).endsWith("main()"));
    }

    @Test
    void emptyModuleProducesEmptyText() {
        assertEquals("", emit(new Module(List.of())));
    }
}
