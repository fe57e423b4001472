package me.christianrobert.py2lua.transformation.semantic.expression;

import me.christianrobert.py2lua.transformation.context.TransformationContext;
import me.christianrobert.py2lua.transformation.mapping.ApiMappingTable;
import me.christianrobert.py2lua.transformation.resolver.ImportResolver;
import me.christianrobert.py2lua.transformation.semantic.statement.FromImport;
import me.christianrobert.py2lua.transformation.semantic.statement.ImportedName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CallTest {

    private final TransformationContext context = new TransformationContext(ImportResolver.resolve(List.of(
            new FromImport("cc_lib", List.of(
                    new ImportedName("peripheral", null),
                    new ImportedName("get_side_names", null))))), ApiMappingTable.defaults());

    @Test
    void callWithoutArguments() {
        assertEquals("main()", new Call(new Identifier("main"), List.of()).toLua(context));
    }

    @Test
    void callWithArgumentsSeparatedByCommaSpace() {
        Call call = new Call(new Identifier("print"), List.of(
                new StringLiteral("side"), new NumberLiteral(3), new Identifier("x")));
        assertEquals("print(\"side\", 3, x)", call.toLua(context));
    }

    @Test
    void apiMethodCallIsRenamedThroughAttributeAccess() {
        Call call = new Call(new AttributeAccess(new Identifier("peripheral"), "get_names"), List.of());
        assertEquals("peripheral.getNames()", call.toLua(context));
    }

    @Test
    void importedFunctionCalledDirectlyIsNotRenamed() {
        Call call = new Call(new Identifier("get_side_names"), List.of());
        assertEquals("get_side_names()", call.toLua(context));
    }

    @Test
    void argumentsAreTranslatedRecursively() {
        Call call = new Call(new Identifier("print"), List.of(
                new BinaryOperation(new Identifier("a"), BinaryOperator.ADD, new NumberLiteral(1)),
                new Call(new AttributeAccess(new Identifier("peripheral"), "get_type"), List.of(new StringLiteral("left")))));
        assertEquals("print((a + 1), peripheral.getType(\"left\"))", call.toLua(context));
    }

    @Test
    void nullArgumentsTreatedAsEmpty() {
        assertEquals("f()", new Call(new Identifier("f"), null).toLua(context));
    }
}
