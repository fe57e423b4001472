package me.christianrobert.py2lua.transformation.parser;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of reading a serialized syntax tree.
 * Contains the JSON tree and any errors encountered.
 */
public class ParseResult {

    private final JsonNode tree;
    private final List<String> errors;

    public ParseResult(JsonNode tree, List<String> errors) {
        this.tree = tree;
        this.errors = new ArrayList<>(errors);
    }

    /**
     * Gets the root node of the syntax tree ({@code Module}).
     */
    public JsonNode getTree() {
        return tree;
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Gets a formatted error message combining all errors.
     */
    public String getErrorMessage() {
        if (errors.isEmpty()) {
            return null;
        }
        return String.join("\n", errors);
    }

    @Override
    public String toString() {
        return "ParseResult{success=" + isSuccess() + ", errors=" + errors.size() + "}";
    }
}
