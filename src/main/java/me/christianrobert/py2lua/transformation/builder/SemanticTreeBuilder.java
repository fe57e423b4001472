package me.christianrobert.py2lua.transformation.builder;

import com.fasterxml.jackson.databind.JsonNode;
import me.christianrobert.py2lua.transformation.context.TransformationException;
import me.christianrobert.py2lua.transformation.context.UnsupportedConstructException;
import me.christianrobert.py2lua.transformation.semantic.Module;
import me.christianrobert.py2lua.transformation.semantic.expression.AttributeAccess;
import me.christianrobert.py2lua.transformation.semantic.expression.BinaryOperation;
import me.christianrobert.py2lua.transformation.semantic.expression.BinaryOperator;
import me.christianrobert.py2lua.transformation.semantic.expression.Call;
import me.christianrobert.py2lua.transformation.semantic.expression.Comparison;
import me.christianrobert.py2lua.transformation.semantic.expression.ComparisonOperator;
import me.christianrobert.py2lua.transformation.semantic.expression.Expression;
import me.christianrobert.py2lua.transformation.semantic.expression.Identifier;
import me.christianrobert.py2lua.transformation.semantic.expression.NumberLiteral;
import me.christianrobert.py2lua.transformation.semantic.expression.StringLiteral;
import me.christianrobert.py2lua.transformation.semantic.expression.UnaryOperation;
import me.christianrobert.py2lua.transformation.semantic.expression.UnaryOperator;
import me.christianrobert.py2lua.transformation.semantic.statement.Assignment;
import me.christianrobert.py2lua.transformation.semantic.statement.Conditional;
import me.christianrobert.py2lua.transformation.semantic.statement.ExpressionStatement;
import me.christianrobert.py2lua.transformation.semantic.statement.FromImport;
import me.christianrobert.py2lua.transformation.semantic.statement.FunctionDefinition;
import me.christianrobert.py2lua.transformation.semantic.statement.ImportedName;
import me.christianrobert.py2lua.transformation.semantic.statement.ModuleImport;
import me.christianrobert.py2lua.transformation.semantic.statement.Parameter;
import me.christianrobert.py2lua.transformation.semantic.statement.Statement;
import me.christianrobert.py2lua.transformation.semantic.statement.WhileLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts the front-end's JSON syntax tree into the semantic tree.
 * This is the only class that knows the JSON node layout.
 *
 * <p>Each node is a JSON object whose {@code _type} names the Python {@code ast} class:
 * <pre>
 * {"_type": "Assign", "lineno": 1,
 *  "targets": [{"_type": "Name", "id": "x"}],
 *  "value": {"_type": "Constant", "value": 1}}
 * </pre>
 *
 * <p>Supported statements: Assign, If, While, FunctionDef, Expr, Import, ImportFrom.
 * <br>Supported expressions: Constant (string, number), Name, Attribute, BinOp,
 * UnaryOp, Compare, Call.
 *
 * <p>Any other node type fails with {@link UnsupportedConstructException} naming the
 * type and, when the front-end supplied it, the source line. Shapes that only the
 * JSON layout can reveal (keyword arguments, loop else branches, decorators) are
 * rejected here too; everything else is rejected by the semantic nodes on translation.
 */
public class SemanticTreeBuilder {

    private static final Logger log = LoggerFactory.getLogger(SemanticTreeBuilder.class);

    static final String TYPE_FIELD = "_type";
    static final String LINE_FIELD = "lineno";

    // ========== MODULE ==========

    public Module buildModule(JsonNode node) {
        String type = typeOf(node);
        if (!"Module".equals(type)) {
            throw new TransformationException("Expected Module node at tree root, found: " + describe(node));
        }
        log.debug("Building module");
        return new Module(buildStatements(node.get("body")));
    }

    // ========== STATEMENTS ==========

    public Statement buildStatement(JsonNode node) {
        String type = typeOf(node);
        log.trace("Visiting statement {}", describe(node));

        try {
            return buildStatementOfType(type, node);
        } catch (IllegalArgumentException e) {
            throw malformedNode(node, e);
        }
    }

    private Statement buildStatementOfType(String type, JsonNode node) {
        switch (type) {
            case "Assign":
                return buildAssignment(node);
            case "If":
                return new Conditional(
                        buildExpression(node.get("test")),
                        buildStatements(node.get("body")),
                        buildStatements(node.get("orelse")));
            case "While":
                return buildWhile(node);
            case "FunctionDef":
                return buildFunctionDefinition(node);
            case "Expr":
                return new ExpressionStatement(buildExpression(node.get("value")));
            case "ImportFrom":
                return new FromImport(textOrNull(node.get("module")), buildImportedNames(node.get("names")));
            case "Import":
                return new ModuleImport(buildImportedNames(node.get("names")));
            default:
                throw unsupportedNode(node);
        }
    }

    private List<Statement> buildStatements(JsonNode array) {
        List<Statement> statements = new ArrayList<>();
        for (JsonNode element : elements(array, "statements")) {
            statements.add(buildStatement(element));
        }
        return statements;
    }

    private Statement buildAssignment(JsonNode node) {
        List<Expression> targets = buildExpressions(node.get("targets"));
        if (targets.isEmpty()) {
            throw new TransformationException("Syntax node " + describe(node) + " has no assignment targets");
        }
        return new Assignment(targets, buildExpression(node.get("value")));
    }

    private Statement buildWhile(JsonNode node) {
        if (!elements(node.get("orelse"), "orelse").isEmpty()) {
            throw new UnsupportedConstructException(
                    UnsupportedConstructException.Reason.LOOP_ELSE, describe(node));
        }
        return new WhileLoop(buildExpression(node.get("test")), buildStatements(node.get("body")));
    }

    private Statement buildFunctionDefinition(JsonNode node) {
        String name = requiredText(node, "name");
        if (!elements(node.get("decorator_list"), "decorator_list").isEmpty()) {
            throw new UnsupportedConstructException(
                    UnsupportedConstructException.Reason.UNSUPPORTED_NODE,
                    "decorator on function " + name + lineSuffix(node));
        }
        List<Parameter> parameters = buildParameters(node.get("args"));
        return new FunctionDefinition(name, parameters, buildStatements(node.get("body")));
    }

    /**
     * Maps an {@code arguments} node to parameters in declaration order.
     * Positional-only and regular parameters are both positional; the last
     * {@code defaults.size()} of them carry a default value.
     */
    private List<Parameter> buildParameters(JsonNode arguments) {
        List<Parameter> parameters = new ArrayList<>();
        if (arguments == null || arguments.isNull()) {
            return parameters;
        }

        List<JsonNode> positional = new ArrayList<>();
        positional.addAll(elements(arguments.get("posonlyargs"), "posonlyargs"));
        positional.addAll(elements(arguments.get("args"), "args"));

        int defaultCount = elements(arguments.get("defaults"), "defaults").size();
        int firstDefaulted = positional.size() - defaultCount;
        for (int i = 0; i < positional.size(); i++) {
            Parameter.Kind kind = i >= firstDefaulted ? Parameter.Kind.DEFAULTED : Parameter.Kind.POSITIONAL;
            parameters.add(new Parameter(requiredText(positional.get(i), "arg"), kind));
        }

        JsonNode vararg = arguments.get("vararg");
        if (vararg != null && vararg.isObject()) {
            parameters.add(new Parameter(requiredText(vararg, "arg"), Parameter.Kind.VARIADIC));
        }
        for (JsonNode keywordOnly : elements(arguments.get("kwonlyargs"), "kwonlyargs")) {
            parameters.add(new Parameter(requiredText(keywordOnly, "arg"), Parameter.Kind.KEYWORD_ONLY));
        }
        JsonNode kwarg = arguments.get("kwarg");
        if (kwarg != null && kwarg.isObject()) {
            parameters.add(new Parameter(requiredText(kwarg, "arg"), Parameter.Kind.KEYWORD_VARIADIC));
        }

        return parameters;
    }

    private List<ImportedName> buildImportedNames(JsonNode array) {
        List<ImportedName> names = new ArrayList<>();
        for (JsonNode alias : elements(array, "names")) {
            names.add(new ImportedName(requiredText(alias, "name"), textOrNull(alias.get("asname"))));
        }
        return names;
    }

    // ========== EXPRESSIONS ==========

    public Expression buildExpression(JsonNode node) {
        String type = typeOf(node);
        log.trace("Visiting expression {}", describe(node));

        try {
            return buildExpressionOfType(type, node);
        } catch (IllegalArgumentException e) {
            throw malformedNode(node, e);
        }
    }

    private Expression buildExpressionOfType(String type, JsonNode node) {
        switch (type) {
            case "Constant":
                return buildConstant(node);
            case "Name":
                return new Identifier(requiredText(node, "id"));
            case "Attribute":
                return new AttributeAccess(buildExpression(node.get("value")), requiredText(node, "attr"));
            case "BinOp":
                return new BinaryOperation(
                        buildExpression(node.get("left")),
                        binaryOperator(node.get("op")),
                        buildExpression(node.get("right")));
            case "UnaryOp":
                return new UnaryOperation(unaryOperator(node.get("op")), buildExpression(node.get("operand")));
            case "Compare":
                return buildComparison(node);
            case "Call":
                return buildCall(node);
            default:
                throw unsupportedNode(node);
        }
    }

    private List<Expression> buildExpressions(JsonNode array) {
        List<Expression> expressions = new ArrayList<>();
        for (JsonNode element : elements(array, "expressions")) {
            expressions.add(buildExpression(element));
        }
        return expressions;
    }

    private Expression buildConstant(JsonNode node) {
        JsonNode value = node.get("value");
        if (value != null && value.isTextual()) {
            return new StringLiteral(value.textValue());
        }
        if (value != null && value.isNumber()) {
            return new NumberLiteral(value.numberValue());
        }
        String shown = value == null || value.isNull() ? "None" : value.toString();
        throw new UnsupportedConstructException(
                UnsupportedConstructException.Reason.UNSUPPORTED_NODE,
                "Constant(" + shown + ")" + lineSuffix(node));
    }

    private Expression buildComparison(JsonNode node) {
        List<ComparisonOperator> operators = new ArrayList<>();
        for (JsonNode op : elements(node.get("ops"), "ops")) {
            String opType = typeOf(op);
            ComparisonOperator operator = ComparisonOperator.fromSourceName(opType);
            if (operator == null) {
                throw new UnsupportedConstructException(
                        UnsupportedConstructException.Reason.UNSUPPORTED_OPERATOR, opType + lineSuffix(node));
            }
            operators.add(operator);
        }
        List<Expression> comparators = buildExpressions(node.get("comparators"));
        if (operators.isEmpty() || operators.size() != comparators.size()) {
            throw new TransformationException("Syntax node " + describe(node) + " has " + operators.size()
                    + " operator(s) but " + comparators.size() + " comparator(s)");
        }
        return new Comparison(buildExpression(node.get("left")), operators, comparators);
    }

    private Expression buildCall(JsonNode node) {
        List<JsonNode> keywords = elements(node.get("keywords"), "keywords");
        if (!keywords.isEmpty()) {
            String keyword = textOrNull(keywords.get(0).get("arg"));
            throw new UnsupportedConstructException(
                    UnsupportedConstructException.Reason.KEYWORD_ARGUMENT,
                    (keyword != null ? keyword + "=" : "**") + lineSuffix(node));
        }
        return new Call(buildExpression(node.get("func")), buildExpressions(node.get("args")));
    }

    private BinaryOperator binaryOperator(JsonNode op) {
        String opType = typeOf(op);
        BinaryOperator operator = BinaryOperator.fromSourceName(opType);
        if (operator == null) {
            throw new UnsupportedConstructException(UnsupportedConstructException.Reason.UNSUPPORTED_OPERATOR, opType);
        }
        return operator;
    }

    private UnaryOperator unaryOperator(JsonNode op) {
        String opType = typeOf(op);
        UnaryOperator operator = UnaryOperator.fromSourceName(opType);
        if (operator == null) {
            throw new UnsupportedConstructException(UnsupportedConstructException.Reason.UNSUPPORTED_OPERATOR, opType);
        }
        return operator;
    }

    // ========== JSON HELPERS ==========

    private static String typeOf(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new TransformationException("Expected a syntax node object, found: " + node);
        }
        JsonNode type = node.get(TYPE_FIELD);
        if (type == null || !type.isTextual()) {
            throw new TransformationException("Syntax node without " + TYPE_FIELD + " field: " + node);
        }
        return type.textValue();
    }

    private static List<JsonNode> elements(JsonNode array, String fieldName) {
        List<JsonNode> result = new ArrayList<>();
        if (array == null || array.isNull()) {
            return result;
        }
        if (!array.isArray()) {
            throw new TransformationException("Expected a list for field '" + fieldName + "', found: " + array);
        }
        array.forEach(result::add);
        return result;
    }

    private static String requiredText(JsonNode node, String fieldName) {
        JsonNode field = node.get(fieldName);
        if (field == null || !field.isTextual() || field.textValue().trim().isEmpty()) {
            throw new TransformationException("Syntax node " + describe(node) + " is missing text field '" + fieldName + "'");
        }
        return field.textValue();
    }

    private static String textOrNull(JsonNode node) {
        return node != null && node.isTextual() ? node.textValue() : null;
    }

    /**
     * Node constructors reject shapes the builder did not check; report those against the JSON node.
     */
    private static TransformationException malformedNode(JsonNode node, IllegalArgumentException cause) {
        String where = describe(node);
        return new TransformationException("Malformed syntax node " + where + ": " + cause.getMessage(),
                where, "building semantic tree", cause);
    }

    private static UnsupportedConstructException unsupportedNode(JsonNode node) {
        return new UnsupportedConstructException(UnsupportedConstructException.Reason.UNSUPPORTED_NODE, describe(node));
    }

    private static String describe(JsonNode node) {
        JsonNode type = node.get(TYPE_FIELD);
        String typeName = type != null ? type.asText() : "<untyped>";
        return typeName + lineSuffix(node);
    }

    private static String lineSuffix(JsonNode node) {
        JsonNode line = node.get(LINE_FIELD);
        return line != null && line.isInt() ? " at line " + line.intValue() : "";
    }
}
