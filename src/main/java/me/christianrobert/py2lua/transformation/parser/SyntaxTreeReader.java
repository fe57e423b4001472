package me.christianrobert.py2lua.transformation.parser;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.py2lua.transformation.context.TransformationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the syntax tree the Python front-end serialized as JSON.
 *
 * <p>The front-end dumps Python's {@code ast} module output, one JSON object per node
 * with a {@code _type} field naming the node class. This class only checks that the
 * document is well-formed and rooted at a {@code Module}; node interpretation is done
 * by {@link me.christianrobert.py2lua.transformation.builder.SemanticTreeBuilder}.
 */
@ApplicationScoped
public class SyntaxTreeReader {

    private static final Logger log = LoggerFactory.getLogger(SyntaxTreeReader.class);

    static final String ROOT_TYPE = "Module";

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * @param treeJson Serialized syntax tree
     * @return ParseResult containing the JSON tree and any errors
     */
    public ParseResult read(String treeJson) {
        if (treeJson == null || treeJson.trim().isEmpty()) {
            throw new TransformationException("Syntax tree JSON cannot be null or empty");
        }

        log.debug("Reading syntax tree: {}", treeJson.substring(0, Math.min(100, treeJson.length())));

        List<String> errors = new ArrayList<>();
        JsonNode tree = null;
        try {
            tree = objectMapper.readTree(treeJson);
            if (tree == null || !tree.isObject()) {
                errors.add("Syntax tree root must be a JSON object");
            } else if (!ROOT_TYPE.equals(tree.path("_type").asText())) {
                errors.add("Syntax tree root must be a " + ROOT_TYPE + " node, found: "
                        + tree.path("_type").asText("<none>"));
            }
        } catch (JsonProcessingException e) {
            JsonLocation location = e.getLocation();
            String error = location != null
                    ? String.format("Line %d:%d - %s", location.getLineNr(), location.getColumnNr(), e.getOriginalMessage())
                    : e.getOriginalMessage();
            errors.add(error);
            log.warn("Parse error: {}", error);
        }

        return new ParseResult(tree, errors);
    }
}
