package me.christianrobert.py2lua.transformation.semantic.expression;

import me.christianrobert.py2lua.transformation.context.TransformationContext;
import me.christianrobert.py2lua.transformation.mapping.ApiMappingTable;
import me.christianrobert.py2lua.transformation.resolver.ImportBindings;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Identifier semantic node.
 */
class IdentifierTest {

    private final TransformationContext context = new TransformationContext(ImportBindings.empty(), ApiMappingTable.defaults());

    @Test
    void simpleIdentifierPassesThrough() {
        assertEquals("count", new Identifier("count").toLua(context));
    }

    @Test
    void identifierWithUnderscoreIsNotRenamed() {
        assertEquals("side_name", new Identifier("side_name").toLua(context));
    }

    @Test
    void nullIdentifierThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Identifier(null));
    }

    @Test
    void whitespaceIdentifierThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Identifier("   "));
    }

    @Test
    void identifierToStringIncludesName() {
        assertTrue(new Identifier("count").toString().contains("count"));
    }
}
