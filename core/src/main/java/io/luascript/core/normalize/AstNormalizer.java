package io.luascript.core.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.luascript.core.error.NormalizationException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites a raw ESTree-shaped tree into the canonical shape the lowerer consumes.
 *
 * <p>The output is always a fresh tree; raw nodes are never aliased or mutated. Normalization is
 * idempotent: normalizing a canonical tree yields an equal tree.
 *
 * <p>Canonical shape, beyond the raw ESTree fields:
 *
 * <ul>
 *   <li>boolean flags ({@code computed}, {@code optional}, {@code prefix}, {@code static},
 *       {@code shorthand}, {@code method}, {@code async}, {@code generator}, {@code delegate}) are
 *       always present
 *   <li>optional children that are absent are explicit JSON {@code null}
 *   <li>arrow functions always have a block body
 *   <li>class members sit directly in the class node's {@code body} array
 *   <li>optional member/call chains are wrapped in a single {@code ChainExpression}
 *   <li>the directive prologue lives in {@code Program.directives}
 * </ul>
 */
public final class AstNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(AstNormalizer.class);
    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    /** Destructuring declaration recognized when the parser recovered nothing at all. */
    static final Pattern FALLBACK_DECLARATION =
            Pattern.compile("^\\s*(?:const|let|var)\\s*\\[([^\\]]+)\\]\\s*=\\s*([^;]+)\\s*;?");

    private static final Pattern NAME = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");
    private static final Pattern DOTTED_NAME = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*(?:\\.[A-Za-z_$][A-Za-z0-9_$]*)*");

    private static final Set<String> DROPPED_FIELDS = Set.of("type", "loc", "parent", "_parent", "start", "end", "range");

    private final String sourcePath;

    public AstNormalizer(String sourcePath) {
        this.sourcePath = sourcePath;
    }

    // --- Program ---

    /**
     * Normalizes a whole program.
     *
     * @param rawProgram raw {@code Program} node
     * @param source     the source text, consulted only by the destructuring fallback
     * @throws NormalizationException when the input is not a program, when error placeholders are
     *                                mixed with valid statements, or when every statement failed
     *                                and the fallback does not match
     */
    public ObjectNode normalizeProgram(JsonNode rawProgram, String source) {
        if (rawProgram == null || !rawProgram.isObject() || !"Program".equals(rawProgram.path("type").asText())) {
            throw new NormalizationException("Expected a Program node at the root", sourcePath, -1, -1);
        }
        List<JsonNode> statements = new ArrayList<>();
        flatten(rawProgram.path("body"), statements, false);

        List<JsonNode> errors = statements.stream()
                .filter(s -> AstType.ERROR.typeName().equals(s.path("type").asText()))
                .toList();
        if (!errors.isEmpty()) {
            if (errors.size() == statements.size()) {
                statements = List.of(fallback(source, errors.get(0)));
            } else {
                JsonNode first = errors.get(0);
                throw new NormalizationException(
                        "Unparseable statement: " + first.path("message").asText("syntax error"),
                        sourcePath,
                        line(first),
                        column(first));
            }
        }

        ObjectNode program = fresh(AstType.PROGRAM.typeName(), rawProgram);
        program.put("sourceType", rawProgram.path("sourceType").asText("script"));
        ArrayNode directives = program.putArray("directives");
        for (JsonNode directive : rawProgram.path("directives")) {
            directives.add(directive.isTextual() ? directive.asText() : directive.path("value").asText());
        }
        ArrayNode body = program.putArray("body");
        boolean prologue = true;
        for (JsonNode statement : statements) {
            if (prologue && statement.path("directive").isTextual()
                    && AstType.EXPRESSION_STATEMENT.typeName().equals(statement.path("type").asText())) {
                directives.add(statement.path("directive").asText());
                continue;
            }
            prologue = false;
            body.add(statement);
        }
        return program;
    }

    private void flatten(JsonNode array, List<JsonNode> into, boolean holesAllowed) {
        for (JsonNode element : array) {
            if (element.isArray()) {
                flatten(element, into, holesAllowed);
            } else if (element.isNull() || element.isMissingNode()) {
                if (holesAllowed) {
                    into.add(NullNode.instance);
                }
            } else {
                into.add(normalize(element, false));
            }
        }
    }

    // --- Nodes ---

    /** Normalizes a single raw node (and its subtree). {@code null} or missing input yields JSON null. */
    public JsonNode normalizeNode(JsonNode raw) {
        return normalize(raw, false);
    }

    private JsonNode normalize(JsonNode raw, boolean inChain) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            return NullNode.instance;
        }
        if (raw.isArray()) {
            ArrayNode out = JSON.arrayNode();
            List<JsonNode> items = new ArrayList<>();
            flatten(raw, items, false);
            out.addAll(items);
            return out;
        }
        if (!raw.isObject()) {
            return raw.deepCopy();
        }
        if (!raw.has("type")) {
            return plainCopy(raw);
        }
        String type = raw.path("type").asText();
        if ("ParenthesizedExpression".equals(type)) {
            return normalize(raw.get("expression"), inChain);
        }
        if (AstType.CHAIN_EXPRESSION.typeName().equals(type)) {
            ObjectNode chain = fresh(type, raw);
            chain.set("expression", normalize(raw.get("expression"), true));
            return chain;
        }
        String canonical = switch (type) {
            case "ArrowFunction" -> AstType.ARROW_FUNCTION_EXPRESSION.typeName();
            case "Parameter" -> AstType.IDENTIFIER.typeName();
            default -> type;
        };
        boolean chainLink = isChainLink(canonical);

        ObjectNode out = fresh(canonical, raw);
        Iterator<Map.Entry<String, JsonNode>> fields = raw.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            if (DROPPED_FIELDS.contains(name)) {
                continue;
            }
            JsonNode value = field.getValue();
            if (value.isArray()) {
                List<JsonNode> items = new ArrayList<>();
                flatten(value, items, "elements".equals(name));
                out.putArray(name).addAll(items);
            } else {
                boolean childInChain = chainLink && ("object".equals(name) || "callee".equals(name));
                out.set(name, normalize(value, childInChain));
            }
        }
        applyDefaults(canonical, out);

        if (chainLink && !inChain && hasOptionalLink(out)) {
            ObjectNode chain = fresh(AstType.CHAIN_EXPRESSION.typeName(), out);
            chain.set("expression", out);
            return chain;
        }
        return out;
    }

    private void applyDefaults(String type, ObjectNode node) {
        switch (type) {
            case "Literal" -> {
                if (!node.has("value")) {
                    node.putNull("value");
                }
                if (!node.path("raw").isTextual()) {
                    node.put("raw", deriveRaw(node.get("value")));
                }
            }
            case "VariableDeclaration" -> {
                node.put("kind", node.path("kind").asText("var").toLowerCase(Locale.ROOT));
                defaultArray(node, "declarations");
            }
            case "VariableDeclarator" -> defaultNull(node, "init");
            case "MemberExpression" -> defaultBooleans(node, "computed", "optional");
            case "CallExpression" -> {
                defaultBooleans(node, "optional");
                defaultArray(node, "arguments");
            }
            case "NewExpression" -> defaultArray(node, "arguments");
            case "UnaryExpression" -> node.put("prefix", node.path("prefix").asBoolean(true));
            case "UpdateExpression" -> defaultBooleans(node, "prefix");
            case "Property" -> {
                node.put("kind", node.path("kind").asText("init"));
                defaultBooleans(node, "computed", "shorthand", "method");
            }
            case "MethodDefinition" -> {
                node.put("kind", node.path("kind").asText("method"));
                defaultBooleans(node, "computed", "static");
            }
            case "PropertyDefinition" -> {
                defaultBooleans(node, "computed", "static");
                defaultNull(node, "value");
            }
            case "FunctionDeclaration", "FunctionExpression" -> {
                defaultBooleans(node, "async", "generator");
                defaultNull(node, "id");
                defaultArray(node, "params");
            }
            case "ArrowFunctionExpression" -> {
                defaultBooleans(node, "async", "generator");
                defaultNull(node, "id");
                defaultArray(node, "params");
                JsonNode body = node.path("body");
                if (!AstType.BLOCK_STATEMENT.typeName().equals(body.path("type").asText())) {
                    ObjectNode ret = fresh(AstType.RETURN_STATEMENT.typeName(), body);
                    ret.set("argument", body.isMissingNode() ? NullNode.instance : body);
                    ObjectNode block = fresh(AstType.BLOCK_STATEMENT.typeName(), body);
                    block.putArray("body").add(ret);
                    node.set("body", block);
                }
                node.put("expression", false);
            }
            case "ClassDeclaration", "ClassExpression" -> {
                defaultNull(node, "id");
                defaultNull(node, "superClass");
                JsonNode body = node.path("body");
                if (body.isObject()) {
                    ArrayNode members = JSON.arrayNode();
                    body.path("body").forEach(members::add);
                    node.set("body", members);
                } else {
                    defaultArray(node, "body");
                }
            }
            case "YieldExpression" -> {
                defaultBooleans(node, "delegate");
                defaultNull(node, "argument");
            }
            case "ReturnStatement" -> defaultNull(node, "argument");
            case "IfStatement" -> defaultNull(node, "alternate");
            case "TryStatement" -> {
                defaultNull(node, "handler");
                defaultNull(node, "finalizer");
            }
            case "CatchClause" -> defaultNull(node, "param");
            case "ForStatement" -> {
                defaultNull(node, "init");
                defaultNull(node, "test");
                defaultNull(node, "update");
            }
            case "SwitchCase" -> {
                defaultNull(node, "test");
                defaultArray(node, "consequent");
            }
            case "BreakStatement", "ContinueStatement" -> defaultNull(node, "label");
            case "TemplateElement" -> defaultBooleans(node, "tail");
            case "ArrayExpression", "ArrayPattern" -> defaultArray(node, "elements");
            case "ObjectExpression", "ObjectPattern" -> defaultArray(node, "properties");
            case "BlockStatement" -> defaultArray(node, "body");
            case "TemplateLiteral" -> {
                defaultArray(node, "quasis");
                defaultArray(node, "expressions");
            }
            default -> {
                // no defaults
            }
        }
    }

    private static boolean isChainLink(String type) {
        return AstType.MEMBER_EXPRESSION.typeName().equals(type) || AstType.CALL_EXPRESSION.typeName().equals(type);
    }

    /** Whether any link of the member/call chain ending at {@code node} is optional. */
    private static boolean hasOptionalLink(JsonNode node) {
        JsonNode current = node;
        while (current != null && isChainLink(current.path("type").asText())) {
            if (current.path("optional").asBoolean(false)) {
                return true;
            }
            current = current.has("object") ? current.get("object") : current.get("callee");
        }
        return false;
    }

    // --- Fallback ---

    private ObjectNode fallback(String source, JsonNode firstError) {
        Matcher m = source == null ? null : FALLBACK_DECLARATION.matcher(source);
        if (m == null || !m.find()) {
            throw new NormalizationException(
                    "Unparseable program and no recoverable destructuring declaration: "
                            + firstError.path("message").asText("syntax error"),
                    sourcePath,
                    line(firstError),
                    column(firstError));
        }
        int line = 1 + (int) source.substring(0, m.start(1)).chars().filter(c -> c == '\n').count();
        ObjectNode at = JSON.objectNode();
        ObjectNode start = at.putObject("loc").putObject("start");
        start.put("line", line);
        start.put("column", 0);

        ObjectNode pattern = fresh(AstType.ARRAY_PATTERN.typeName(), at);
        ArrayNode elements = pattern.putArray("elements");
        List<String> names = new ArrayList<>();
        for (String part : m.group(1).split(",", -1)) {
            String name = part.trim();
            if (name.isEmpty()) {
                elements.addNull();
            } else if (name.startsWith("...") && NAME.matcher(name.substring(3).trim()).matches()) {
                ObjectNode rest = fresh(AstType.REST_ELEMENT.typeName(), at);
                rest.set("argument", identifier(name.substring(3).trim(), at));
                elements.add(rest);
                names.add(name);
            } else if (NAME.matcher(name).matches()) {
                elements.add(identifier(name, at));
                names.add(name);
            } else {
                throw new NormalizationException(
                        "Fallback cannot bind destructuring element '" + name + "'", sourcePath, line, 0);
            }
        }
        String init = m.group(2).trim();
        if (!DOTTED_NAME.matcher(init).matches()) {
            throw new NormalizationException(
                    "Fallback requires a plain name on the right-hand side, got '" + init + "'", sourcePath, line, 0);
        }

        ObjectNode declarator = fresh(AstType.VARIABLE_DECLARATOR.typeName(), at);
        declarator.set("id", pattern);
        declarator.set("init", dottedName(init, at));
        ObjectNode declaration = fresh(AstType.VARIABLE_DECLARATION.typeName(), at);
        declaration.put("kind", "const");
        declaration.putArray("declarations").add(declarator);

        LOG.warn("Parser recovered nothing from {}; using destructuring fallback: names={}, init={}",
                sourcePath, names, init);
        return declaration;
    }

    // --- helpers ---

    /** {@code a.b.c} as a chain of non-computed member expressions. */
    private static ObjectNode dottedName(String dotted, JsonNode at) {
        String[] parts = dotted.split("\\.");
        ObjectNode expr = identifier(parts[0].trim(), at);
        for (int i = 1; i < parts.length; i++) {
            ObjectNode member = fresh(AstType.MEMBER_EXPRESSION.typeName(), at);
            member.set("object", expr);
            member.set("property", identifier(parts[i].trim(), at));
            member.put("computed", false);
            member.put("optional", false);
            expr = member;
        }
        return expr;
    }

    private static ObjectNode identifier(String name, JsonNode at) {
        ObjectNode id = fresh(AstType.IDENTIFIER.typeName(), at);
        id.put("name", name);
        return id;
    }

    private static ObjectNode fresh(String type, JsonNode locationSource) {
        ObjectNode node = JSON.objectNode();
        node.put("type", type);
        JsonNode loc = locationSource.path("loc");
        if (loc.isObject()) {
            node.set("loc", loc.deepCopy());
        }
        return node;
    }

    private static JsonNode plainCopy(JsonNode raw) {
        ObjectNode copy = raw.deepCopy();
        copy.remove("parent");
        copy.remove("_parent");
        return copy;
    }

    private static String deriveRaw(JsonNode value) {
        if (value == null || value.isNull()) {
            return "null";
        }
        if (value.isTextual()) {
            return value.toString();
        }
        return value.asText();
    }

    private static void defaultBooleans(ObjectNode node, String... names) {
        for (String name : names) {
            node.put(name, node.path(name).asBoolean(false));
        }
    }

    private static void defaultNull(ObjectNode node, String name) {
        if (!node.has(name)) {
            node.putNull(name);
        }
    }

    private static void defaultArray(ObjectNode node, String name) {
        if (!node.path(name).isArray()) {
            node.putArray(name);
        }
    }

    private static int line(JsonNode node) {
        return node.path("loc").path("start").path("line").asInt(-1);
    }

    private static int column(JsonNode node) {
        return node.path("loc").path("start").path("column").asInt(-1);
    }
}
