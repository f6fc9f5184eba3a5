package io.luascript.core.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.luascript.core.error.SourceParseException;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent parser producing an ESTree-shaped raw AST as a Jackson tree.
 *
 * <p>The output is intentionally raw: optional-chain members are not wrapped in
 * {@code ChainExpression}, optional booleans are omitted when false, and class members sit under a
 * {@code ClassBody}. The normalizer reconciles these shapes. Every node carries
 * {@code loc.start.line} (1-based) and {@code loc.start.column} (0-based).
 *
 * <p>{@link #parse(String)} fails on the first syntax error. {@link #parseTolerant(String)} turns a
 * top-level statement it cannot parse into an {@code {"type":"Error"}} placeholder and resumes at
 * the next line.
 */
public final class SourceParser {

    private static final Logger LOG = LoggerFactory.getLogger(SourceParser.class);
    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private static final Set<String> ASSIGNMENT_OPERATORS = Set.of(
            "=", "+=", "-=", "*=", "/=", "%=", "**=", "<<=", ">>=", ">>>=", "&=", "|=", "^=", "&&=", "||=", "??=");

    private final String sourcePath;

    public SourceParser(String sourcePath) {
        this.sourcePath = sourcePath;
    }

    /**
     * Parses a whole program.
     *
     * @throws SourceParseException on the first syntax error
     */
    public ObjectNode parse(String source) {
        Objects.requireNonNull(source, "source must not be null");
        return new Cursor(source, new Lexer(sourcePath, source).tokenize(), false).program();
    }

    /**
     * Parses a whole program, replacing unparseable top-level statements with error placeholders.
     *
     * @throws SourceParseException only when the text cannot be tokenized at all
     */
    public ObjectNode parseTolerant(String source) {
        Objects.requireNonNull(source, "source must not be null");
        return new Cursor(source, new Lexer(sourcePath, source).tokenize(), true).program();
    }

    /** Parse state for one token stream. */
    private final class Cursor {

        private final String source;
        private final List<Token> tokens;
        private final boolean tolerant;
        private int index;
        private boolean noIn;
        private boolean inGenerator;
        private boolean inAsync;

        Cursor(String source, List<Token> tokens, boolean tolerant) {
            this.source = source;
            this.tokens = tokens;
            this.tolerant = tolerant;
        }

        // --- Program ---

        ObjectNode program() {
            ObjectNode program = node("Program", peek());
            program.put("sourceType", "script");
            ArrayNode body = program.putArray("body");
            boolean prologue = true;
            while (!atEnd()) {
                if (!tolerant) {
                    body.add(statement());
                    continue;
                }
                Token start = peek();
                try {
                    ObjectNode statement = statement();
                    if (prologue && isDirective(statement)) {
                        statement.put("directive", statement.path("expression").path("value").asText());
                    } else {
                        prologue = false;
                    }
                    body.add(statement);
                } catch (SourceParseException e) {
                    LOG.debug("Replacing unparseable statement at line {} with placeholder: {}", start.line(),
                            e.getMessage());
                    ObjectNode error = node("Error", start);
                    error.put("message", e.getMessage());
                    body.add(error);
                    prologue = false;
                    recover(start);
                }
            }
            if (!tolerant) {
                markDirectives(body);
            }
            return program;
        }

        private boolean isDirective(ObjectNode statement) {
            return "ExpressionStatement".equals(statement.path("type").asText())
                    && statement.path("expression").path("value").isTextual()
                    && "Literal".equals(statement.path("expression").path("type").asText());
        }

        private void markDirectives(ArrayNode body) {
            for (JsonNode statement : body) {
                if (!isDirective((ObjectNode) statement)) {
                    return;
                }
                ((ObjectNode) statement)
                        .put("directive", statement.path("expression").path("value").asText());
            }
        }

        private void recover(Token failedAt) {
            if (index < tokens.size() && peek() == failedAt) {
                index++;
            }
            int depth = 0;
            while (!atEnd()) {
                Token t = peek();
                if (depth == 0 && t.newlineBefore()) {
                    return;
                }
                if (t.isPunctuator("{") || t.isPunctuator("(") || t.isPunctuator("[")) {
                    depth++;
                } else if (t.isPunctuator("}") || t.isPunctuator(")") || t.isPunctuator("]")) {
                    depth = Math.max(0, depth - 1);
                } else if (depth == 0 && t.isPunctuator(";")) {
                    index++;
                    return;
                }
                index++;
            }
        }

        // --- Statements ---

        ObjectNode statement() {
            Token t = peek();
            if (t.isPunctuator("{")) {
                return block();
            }
            if (t.isPunctuator(";")) {
                index++;
                return node("EmptyStatement", t);
            }
            if (t.type() == Token.Type.KEYWORD) {
                switch (t.text()) {
                    case "var", "let", "const" -> {
                        ObjectNode declaration = variableDeclaration();
                        consumeSemicolon();
                        return declaration;
                    }
                    case "function" -> {
                        return function(false, false);
                    }
                    case "class" -> {
                        return classNode(false);
                    }
                    case "if" -> {
                        return ifStatement();
                    }
                    case "while" -> {
                        return whileStatement();
                    }
                    case "do" -> {
                        return doWhileStatement();
                    }
                    case "for" -> {
                        return forStatement();
                    }
                    case "return" -> {
                        return returnStatement();
                    }
                    case "break", "continue" -> {
                        return jumpStatement();
                    }
                    case "throw" -> {
                        return throwStatement();
                    }
                    case "try" -> {
                        return tryStatement();
                    }
                    case "switch" -> {
                        return switchStatement();
                    }
                    case "import", "export", "with", "debugger" -> throw unexpected(t, "'" + t.text()
                            + "' statements are not supported");
                    default -> {
                        // expression statement starting with a keyword (this, new, typeof, ...)
                    }
                }
            }
            if (t.isIdentifier("async") && peek(1).isKeyword("function") && !peek(1).newlineBefore()) {
                index++;
                return function(false, true);
            }
            if (t.type() == Token.Type.IDENTIFIER && peek(1).isPunctuator(":")) {
                index += 2;
                ObjectNode labeled = node("LabeledStatement", t);
                labeled.set("label", identifier(t));
                labeled.set("body", statement());
                return labeled;
            }
            ObjectNode statement = node("ExpressionStatement", t);
            statement.set("expression", expression());
            consumeSemicolon();
            return statement;
        }

        private ObjectNode block() {
            ObjectNode block = node("BlockStatement", expect("{"));
            ArrayNode body = block.putArray("body");
            while (!peek().isPunctuator("}")) {
                if (atEnd()) {
                    throw unexpected(peek(), "Expected '}'");
                }
                body.add(statement());
            }
            index++;
            return block;
        }

        private ObjectNode variableDeclaration() {
            Token kind = next();
            ObjectNode declaration = node("VariableDeclaration", kind);
            declaration.put("kind", kind.text());
            ArrayNode declarations = declaration.putArray("declarations");
            do {
                Token at = peek();
                ObjectNode declarator = node("VariableDeclarator", at);
                declarator.set("id", bindingTarget());
                if (eat("=")) {
                    declarator.set("init", assignment());
                }
                declarations.add(declarator);
            } while (eat(","));
            return declaration;
        }

        private ObjectNode ifStatement() {
            ObjectNode statement = node("IfStatement", next());
            statement.set("test", parenthesized());
            statement.set("consequent", statement());
            if (peek().isKeyword("else")) {
                index++;
                statement.set("alternate", statement());
            }
            return statement;
        }

        private ObjectNode whileStatement() {
            ObjectNode statement = node("WhileStatement", next());
            statement.set("test", parenthesized());
            statement.set("body", statement());
            return statement;
        }

        private ObjectNode doWhileStatement() {
            ObjectNode statement = node("DoWhileStatement", next());
            statement.set("body", statement());
            expectKeyword("while");
            statement.set("test", parenthesized());
            eat(";");
            return statement;
        }

        private ObjectNode forStatement() {
            Token forToken = next();
            if (peek().isIdentifier("await")) {
                throw unexpected(peek(), "'for await' loops are not supported");
            }
            expect("(");
            ObjectNode init = null;
            if (!peek().isPunctuator(";")) {
                boolean savedNoIn = noIn;
                noIn = true;
                try {
                    Token t = peek();
                    if (t.isKeyword("var") || t.isKeyword("let") || t.isKeyword("const")) {
                        init = variableDeclaration();
                    } else {
                        init = expression();
                    }
                } finally {
                    noIn = savedNoIn;
                }
                if (peek().isIdentifier("of") || peek().isKeyword("in")) {
                    boolean of = next().isIdentifier("of");
                    ObjectNode loop = node(of ? "ForOfStatement" : "ForInStatement", forToken);
                    loop.set("left", "VariableDeclaration".equals(init.path("type").asText()) ? init : toPattern(init));
                    loop.set("right", of ? assignment() : expression());
                    expect(")");
                    loop.set("body", statement());
                    return loop;
                }
            }
            ObjectNode loop = node("ForStatement", forToken);
            loop.set("init", init);
            expect(";");
            loop.set("test", peek().isPunctuator(";") ? null : expression());
            expect(";");
            loop.set("update", peek().isPunctuator(")") ? null : expression());
            expect(")");
            loop.set("body", statement());
            return loop;
        }

        private ObjectNode returnStatement() {
            ObjectNode statement = node("ReturnStatement", next());
            if (!statementEnds()) {
                statement.set("argument", expression());
            }
            consumeSemicolon();
            return statement;
        }

        private ObjectNode jumpStatement() {
            Token keyword = next();
            ObjectNode statement = node(keyword.isKeyword("break") ? "BreakStatement" : "ContinueStatement", keyword);
            if (peek().type() == Token.Type.IDENTIFIER && !peek().newlineBefore()) {
                statement.set("label", identifier(next()));
            }
            consumeSemicolon();
            return statement;
        }

        private ObjectNode throwStatement() {
            Token keyword = next();
            if (peek().newlineBefore()) {
                throw unexpected(peek(), "Illegal newline after throw");
            }
            ObjectNode statement = node("ThrowStatement", keyword);
            statement.set("argument", expression());
            consumeSemicolon();
            return statement;
        }

        private ObjectNode tryStatement() {
            ObjectNode statement = node("TryStatement", next());
            statement.set("block", block());
            if (peek().isKeyword("catch")) {
                ObjectNode handler = node("CatchClause", next());
                if (eat("(")) {
                    handler.set("param", bindingTarget());
                    expect(")");
                }
                handler.set("body", block());
                statement.set("handler", handler);
            }
            if (peek().isKeyword("finally")) {
                index++;
                statement.set("finalizer", block());
            }
            if (!statement.has("handler") && !statement.has("finalizer")) {
                throw unexpected(peek(), "Missing catch or finally after try");
            }
            return statement;
        }

        private ObjectNode switchStatement() {
            ObjectNode statement = node("SwitchStatement", next());
            statement.set("discriminant", parenthesized());
            expect("{");
            ArrayNode cases = statement.putArray("cases");
            while (!eat("}")) {
                Token t = peek();
                ObjectNode switchCase = node("SwitchCase", t);
                if (t.isKeyword("case")) {
                    index++;
                    switchCase.set("test", expression());
                } else if (t.isKeyword("default")) {
                    index++;
                } else {
                    throw unexpected(t, "Expected 'case' or 'default'");
                }
                expect(":");
                ArrayNode consequent = switchCase.putArray("consequent");
                while (!peek().isKeyword("case") && !peek().isKeyword("default") && !peek().isPunctuator("}")) {
                    if (atEnd()) {
                        throw unexpected(peek(), "Expected '}'");
                    }
                    consequent.add(statement());
                }
                cases.add(switchCase);
            }
            return statement;
        }

        // --- Functions and classes ---

        private ObjectNode function(boolean expression, boolean isAsync) {
            Token keyword = expectKeyword("function");
            ObjectNode fn = node(expression ? "FunctionExpression" : "FunctionDeclaration", keyword);
            boolean generator = eat("*");
            if (peek().type() == Token.Type.IDENTIFIER) {
                fn.set("id", identifier(next()));
            } else if (!expression) {
                throw unexpected(peek(), "Expected function name");
            }
            if (generator) {
                fn.put("generator", true);
            }
            if (isAsync) {
                fn.put("async", true);
            }
            functionRest(fn, generator, isAsync);
            return fn;
        }

        /** Parses {@code (params) { body }} into {@code fn} under the given function context. */
        private void functionRest(ObjectNode fn, boolean generator, boolean isAsync) {
            boolean savedGenerator = inGenerator;
            boolean savedAsync = inAsync;
            boolean savedNoIn = noIn;
            inGenerator = generator;
            inAsync = isAsync;
            noIn = false;
            try {
                fn.set("params", parameters());
                fn.set("body", block());
            } finally {
                inGenerator = savedGenerator;
                inAsync = savedAsync;
                noIn = savedNoIn;
            }
        }

        private ArrayNode parameters() {
            expect("(");
            ArrayNode params = JSON.arrayNode();
            while (!eat(")")) {
                Token t = peek();
                if (eat("...")) {
                    ObjectNode rest = node("RestElement", t);
                    rest.set("argument", bindingTarget());
                    params.add(rest);
                } else {
                    params.add(bindingElement());
                }
                if (!peek().isPunctuator(")")) {
                    expect(",");
                }
            }
            return params;
        }

        private ObjectNode arrowFunction() {
            Token start = peek();
            boolean isAsync = false;
            if (start.isIdentifier("async") && !peek(1).isPunctuator("=>")) {
                index++;
                isAsync = true;
            }
            ObjectNode fn = node("ArrowFunctionExpression", start);
            ArrayNode params;
            if (peek().type() == Token.Type.IDENTIFIER) {
                params = JSON.arrayNode();
                params.add(identifier(next()));
            } else {
                params = parameters();
            }
            fn.set("params", params);
            expect("=>");
            if (isAsync) {
                fn.put("async", true);
            }
            boolean savedGenerator = inGenerator;
            boolean savedAsync = inAsync;
            inGenerator = false;
            inAsync = isAsync;
            try {
                if (peek().isPunctuator("{")) {
                    boolean savedNoIn = noIn;
                    noIn = false;
                    try {
                        fn.set("body", block());
                    } finally {
                        noIn = savedNoIn;
                    }
                } else {
                    fn.put("expression", true);
                    fn.set("body", assignment());
                }
            } finally {
                inGenerator = savedGenerator;
                inAsync = savedAsync;
            }
            return fn;
        }

        private ObjectNode classNode(boolean expression) {
            Token keyword = expectKeyword("class");
            ObjectNode cls = node(expression ? "ClassExpression" : "ClassDeclaration", keyword);
            if (peek().type() == Token.Type.IDENTIFIER) {
                cls.set("id", identifier(next()));
            } else if (!expression) {
                throw unexpected(peek(), "Expected class name");
            }
            if (peek().isKeyword("extends")) {
                index++;
                cls.set("superClass", leftHandSide());
            }
            ObjectNode body = node("ClassBody", expect("{"));
            ArrayNode members = body.putArray("body");
            while (!eat("}")) {
                if (eat(";")) {
                    continue;
                }
                members.add(classMember());
            }
            cls.set("body", body);
            return cls;
        }

        private ObjectNode classMember() {
            Token start = peek();
            boolean isStatic = false;
            if (start.isIdentifier("static") && !peek(1).isPunctuator("(") && !peek(1).isPunctuator("=")) {
                index++;
                isStatic = true;
            }
            boolean isAsync = false;
            if (peek().isIdentifier("async") && !peek(1).isPunctuator("(") && !peek(1).newlineBefore()) {
                index++;
                isAsync = true;
            }
            boolean generator = eat("*");
            String accessor = null;
            if ((peek().isIdentifier("get") || peek().isIdentifier("set")) && isPropertyNameStart(peek(1))) {
                accessor = next().text();
            }
            Token keyToken = peek();
            boolean computed = peek().isPunctuator("[");
            ObjectNode key = propertyKey();
            if (peek().isPunctuator("(")) {
                ObjectNode method = node("MethodDefinition", start);
                method.set("key", key);
                method.put("computed", computed);
                String kind = accessor != null ? accessor : "method";
                if (!isStatic && !computed && "constructor".equals(keyToken.text())) {
                    kind = "constructor";
                }
                method.put("kind", kind);
                method.put("static", isStatic);
                ObjectNode fn = node("FunctionExpression", keyToken);
                if (generator) {
                    fn.put("generator", true);
                }
                if (isAsync) {
                    fn.put("async", true);
                }
                functionRest(fn, generator, isAsync);
                method.set("value", fn);
                return method;
            }
            ObjectNode field = node("PropertyDefinition", start);
            field.set("key", key);
            field.put("computed", computed);
            field.put("static", isStatic);
            if (eat("=")) {
                field.set("value", assignment());
            }
            consumeSemicolon();
            return field;
        }

        // --- Patterns ---

        /** Identifier, array pattern or object pattern. */
        private ObjectNode bindingTarget() {
            Token t = peek();
            if (t.isPunctuator("[")) {
                return arrayPattern();
            }
            if (t.isPunctuator("{")) {
                return objectPattern();
            }
            if (t.type() == Token.Type.IDENTIFIER) {
                return identifier(next());
            }
            throw unexpected(t, "Expected binding identifier or pattern");
        }

        /** Binding target with an optional {@code = default}. */
        private ObjectNode bindingElement() {
            Token t = peek();
            ObjectNode target = bindingTarget();
            if (eat("=")) {
                ObjectNode pattern = node("AssignmentPattern", t);
                pattern.set("left", target);
                pattern.set("right", assignment());
                return pattern;
            }
            return target;
        }

        private ObjectNode arrayPattern() {
            ObjectNode pattern = node("ArrayPattern", expect("["));
            ArrayNode elements = pattern.putArray("elements");
            while (!eat("]")) {
                if (peek().isPunctuator(",")) {
                    index++;
                    elements.addNull();
                    continue;
                }
                Token t = peek();
                if (eat("...")) {
                    ObjectNode rest = node("RestElement", t);
                    rest.set("argument", bindingTarget());
                    elements.add(rest);
                } else {
                    elements.add(bindingElement());
                }
                if (!peek().isPunctuator("]")) {
                    expect(",");
                }
            }
            return pattern;
        }

        private ObjectNode objectPattern() {
            ObjectNode pattern = node("ObjectPattern", expect("{"));
            ArrayNode properties = pattern.putArray("properties");
            while (!eat("}")) {
                Token t = peek();
                if (eat("...")) {
                    ObjectNode rest = node("RestElement", t);
                    rest.set("argument", bindingTarget());
                    properties.add(rest);
                } else {
                    ObjectNode property = node("Property", t);
                    boolean computed = t.isPunctuator("[");
                    ObjectNode key = propertyKey();
                    property.set("key", key);
                    property.put("computed", computed);
                    if (eat(":")) {
                        property.set("value", bindingElement());
                    } else {
                        if (!"Identifier".equals(key.path("type").asText()) || computed) {
                            throw unexpected(t, "Expected ':' in object pattern");
                        }
                        property.put("shorthand", true);
                        ObjectNode value = identifier(t);
                        if (eat("=")) {
                            ObjectNode withDefault = node("AssignmentPattern", t);
                            withDefault.set("left", value);
                            withDefault.set("right", assignment());
                            value = withDefault;
                        }
                        property.set("value", value);
                    }
                    properties.add(property);
                }
                if (!peek().isPunctuator("}")) {
                    expect(",");
                }
            }
            return pattern;
        }

        /** Reinterprets an expression parsed before {@code =} or {@code of} as an assignment target. */
        private ObjectNode toPattern(ObjectNode expr) {
            String type = expr.path("type").asText();
            switch (type) {
                case "Identifier", "MemberExpression", "ArrayPattern", "ObjectPattern", "AssignmentPattern" -> {
                    return expr;
                }
                case "ArrayExpression" -> {
                    ObjectNode pattern = copyLoc("ArrayPattern", expr);
                    ArrayNode elements = pattern.putArray("elements");
                    for (JsonNode element : expr.path("elements")) {
                        elements.add(element.isNull() ? element : toPattern((ObjectNode) element));
                    }
                    return pattern;
                }
                case "ObjectExpression" -> {
                    ObjectNode pattern = copyLoc("ObjectPattern", expr);
                    ArrayNode properties = pattern.putArray("properties");
                    for (JsonNode property : expr.path("properties")) {
                        if ("SpreadElement".equals(property.path("type").asText())) {
                            properties.add(toPattern((ObjectNode) property));
                        } else {
                            ObjectNode converted = ((ObjectNode) property).deepCopy();
                            converted.set("value", toPattern((ObjectNode) property.get("value")));
                            properties.add(converted);
                        }
                    }
                    return pattern;
                }
                case "SpreadElement" -> {
                    ObjectNode rest = copyLoc("RestElement", expr);
                    rest.set("argument", toPattern((ObjectNode) expr.get("argument")));
                    return rest;
                }
                case "AssignmentExpression" -> {
                    if (!"=".equals(expr.path("operator").asText())) {
                        break;
                    }
                    ObjectNode pattern = copyLoc("AssignmentPattern", expr);
                    pattern.set("left", toPattern((ObjectNode) expr.get("left")));
                    pattern.set("right", expr.get("right"));
                    return pattern;
                }
                default -> {
                    // not a valid target
                }
            }
            JsonNode start = expr.path("loc").path("start");
            throw new SourceParseException(
                    "Invalid destructuring or assignment target: " + type,
                    sourcePath,
                    start.path("line").asInt(-1),
                    start.path("column").asInt(-1));
        }

        // --- Expressions ---

        ObjectNode expression() {
            Token start = peek();
            ObjectNode first = assignment();
            if (!peek().isPunctuator(",")) {
                return first;
            }
            ObjectNode sequence = node("SequenceExpression", start);
            ArrayNode expressions = sequence.putArray("expressions");
            expressions.add(first);
            while (eat(",")) {
                expressions.add(assignment());
            }
            return sequence;
        }

        private ObjectNode assignment() {
            if (isArrowAhead()) {
                return arrowFunction();
            }
            Token start = peek();
            if (inGenerator && start.isIdentifier("yield")) {
                return yieldExpression();
            }
            ObjectNode left = conditional();
            Token op = peek();
            if (op.type() == Token.Type.PUNCTUATOR && ASSIGNMENT_OPERATORS.contains(op.text())) {
                index++;
                ObjectNode target;
                if (op.isPunctuator("=")) {
                    target = toPattern(left);
                } else {
                    String type = left.path("type").asText();
                    if (!"Identifier".equals(type) && !"MemberExpression".equals(type)) {
                        throw unexpected(op, "Invalid left-hand side in assignment");
                    }
                    target = left;
                }
                ObjectNode assign = node("AssignmentExpression", start);
                assign.put("operator", op.text());
                assign.set("left", target);
                assign.set("right", assignment());
                return assign;
            }
            return left;
        }

        private ObjectNode yieldExpression() {
            ObjectNode yield = node("YieldExpression", next());
            if (eat("*")) {
                yield.put("delegate", true);
            }
            Token t = peek();
            boolean hasArgument = !t.newlineBefore()
                    && !t.isPunctuator(")")
                    && !t.isPunctuator("]")
                    && !t.isPunctuator("}")
                    && !t.isPunctuator(",")
                    && !t.isPunctuator(";")
                    && !t.isPunctuator(":")
                    && t.type() != Token.Type.EOF;
            if (hasArgument) {
                yield.set("argument", assignment());
            }
            return yield;
        }

        private ObjectNode conditional() {
            Token start = peek();
            ObjectNode test = binary(0);
            if (!eat("?")) {
                return test;
            }
            ObjectNode conditional = node("ConditionalExpression", start);
            conditional.set("test", test);
            boolean savedNoIn = noIn;
            noIn = false;
            try {
                conditional.set("consequent", assignment());
            } finally {
                noIn = savedNoIn;
            }
            expect(":");
            conditional.set("alternate", assignment());
            return conditional;
        }

        private ObjectNode binary(int minPrecedence) {
            Token start = peek();
            ObjectNode left = unary();
            while (true) {
                Token op = peek();
                int precedence = binaryPrecedence(op);
                if (precedence <= minPrecedence) {
                    return left;
                }
                index++;
                // ** is right-associative
                ObjectNode right = op.isPunctuator("**") ? binary(precedence - 1) : binary(precedence);
                boolean logical = op.isPunctuator("&&") || op.isPunctuator("||") || op.isPunctuator("??");
                ObjectNode combined = node(logical ? "LogicalExpression" : "BinaryExpression", start);
                combined.put("operator", op.text());
                combined.set("left", left);
                combined.set("right", right);
                left = combined;
            }
        }

        private int binaryPrecedence(Token t) {
            if (t.type() == Token.Type.KEYWORD) {
                if (t.text().equals("instanceof")) {
                    return 8;
                }
                if (t.text().equals("in")) {
                    return noIn ? -1 : 8;
                }
                return -1;
            }
            if (t.type() != Token.Type.PUNCTUATOR) {
                return -1;
            }
            return switch (t.text()) {
                case "??" -> 1;
                case "||" -> 2;
                case "&&" -> 3;
                case "|" -> 4;
                case "^" -> 5;
                case "&" -> 6;
                case "==", "!=", "===", "!==" -> 7;
                case "<", ">", "<=", ">=" -> 8;
                case "<<", ">>", ">>>" -> 9;
                case "+", "-" -> 10;
                case "*", "/", "%" -> 11;
                case "**" -> 12;
                default -> -1;
            };
        }

        private ObjectNode unary() {
            Token t = peek();
            boolean prefixPunctuator = t.isPunctuator("!") || t.isPunctuator("-") || t.isPunctuator("+")
                    || t.isPunctuator("~");
            boolean prefixKeyword = t.isKeyword("typeof") || t.isKeyword("void") || t.isKeyword("delete");
            if (prefixPunctuator || prefixKeyword) {
                index++;
                ObjectNode unary = node("UnaryExpression", t);
                unary.put("operator", t.text());
                unary.set("argument", unary());
                return unary;
            }
            if (t.isPunctuator("++") || t.isPunctuator("--")) {
                index++;
                ObjectNode update = node("UpdateExpression", t);
                update.put("operator", t.text());
                update.put("prefix", true);
                update.set("argument", unary());
                return update;
            }
            if (inAsync && t.isIdentifier("await")) {
                index++;
                ObjectNode await = node("AwaitExpression", t);
                await.set("argument", unary());
                return await;
            }
            ObjectNode expr = leftHandSide();
            Token after = peek();
            if ((after.isPunctuator("++") || after.isPunctuator("--")) && !after.newlineBefore()) {
                index++;
                ObjectNode update = node("UpdateExpression", t);
                update.put("operator", after.text());
                update.set("argument", expr);
                return update;
            }
            return expr;
        }

        private ObjectNode leftHandSide() {
            ObjectNode expr = peek().isKeyword("new") ? newExpression() : primary();
            return callTail(expr, true);
        }

        private ObjectNode newExpression() {
            Token keyword = next();
            if (peek().isPunctuator(".")) {
                throw unexpected(peek(), "'new.target' is not supported");
            }
            ObjectNode callee = callTail(peek().isKeyword("new") ? newExpression() : primary(), false);
            ObjectNode expr = node("NewExpression", keyword);
            expr.set("callee", callee);
            expr.set("arguments", peek().isPunctuator("(") ? arguments() : JSON.arrayNode());
            return expr;
        }

        private ObjectNode callTail(ObjectNode base, boolean allowCalls) {
            ObjectNode expr = base;
            while (true) {
                Token t = peek();
                if (t.isPunctuator(".")) {
                    index++;
                    expr = member(expr, propertyIdentifier(), false, false);
                } else if (t.isPunctuator("?.")) {
                    if (!allowCalls) {
                        throw unexpected(t, "Optional chain is not allowed in a 'new' callee");
                    }
                    index++;
                    if (peek().isPunctuator("(")) {
                        expr = call(expr, true);
                    } else if (eat("[")) {
                        ObjectNode property = expressionAllowingIn();
                        expect("]");
                        expr = member(expr, property, true, true);
                    } else {
                        expr = member(expr, propertyIdentifier(), false, true);
                    }
                } else if (t.isPunctuator("[")) {
                    index++;
                    ObjectNode property = expressionAllowingIn();
                    expect("]");
                    expr = member(expr, property, true, false);
                } else if (t.isPunctuator("(") && allowCalls) {
                    expr = call(expr, false);
                } else if (t.type() == Token.Type.TEMPLATE) {
                    throw unexpected(t, "Tagged templates are not supported");
                } else {
                    return expr;
                }
            }
        }

        private ObjectNode member(ObjectNode object, ObjectNode property, boolean computed, boolean optional) {
            ObjectNode member = copyLoc("MemberExpression", object);
            member.set("object", object);
            member.set("property", property);
            if (computed) {
                member.put("computed", true);
            }
            if (optional) {
                member.put("optional", true);
            }
            return member;
        }

        private ObjectNode call(ObjectNode callee, boolean optional) {
            ObjectNode call = copyLoc("CallExpression", callee);
            call.set("callee", callee);
            call.set("arguments", arguments());
            if (optional) {
                call.put("optional", true);
            }
            return call;
        }

        private ArrayNode arguments() {
            expect("(");
            ArrayNode args = JSON.arrayNode();
            while (!eat(")")) {
                args.add(spreadOrAssignment());
                if (!peek().isPunctuator(")")) {
                    expect(",");
                }
            }
            return args;
        }

        private ObjectNode spreadOrAssignment() {
            Token t = peek();
            if (eat("...")) {
                ObjectNode spread = node("SpreadElement", t);
                spread.set("argument", assignmentAllowingIn());
                return spread;
            }
            return assignmentAllowingIn();
        }

        private ObjectNode primary() {
            Token t = peek();
            switch (t.type()) {
                case IDENTIFIER -> {
                    if (t.isIdentifier("async") && peek(1).isKeyword("function") && !peek(1).newlineBefore()) {
                        index++;
                        return function(true, true);
                    }
                    return identifier(next());
                }
                case NUMBER -> {
                    index++;
                    ObjectNode literal = node("Literal", t);
                    double value = (Double) t.value();
                    if (value == Math.rint(value) && Math.abs(value) < 9.007199254740992E15) {
                        literal.put("value", (long) value);
                    } else {
                        literal.put("value", value);
                    }
                    literal.put("raw", t.text());
                    return literal;
                }
                case STRING -> {
                    index++;
                    ObjectNode literal = node("Literal", t);
                    literal.put("value", (String) t.value());
                    literal.put("raw", t.text());
                    return literal;
                }
                case TEMPLATE -> {
                    index++;
                    return template(t);
                }
                case KEYWORD -> {
                    return keywordPrimary(t);
                }
                case PUNCTUATOR -> {
                    if (t.isPunctuator("(")) {
                        index++;
                        ObjectNode inner = expressionAllowingIn();
                        expect(")");
                        return inner;
                    }
                    if (t.isPunctuator("[")) {
                        return arrayLiteral();
                    }
                    if (t.isPunctuator("{")) {
                        return objectLiteral();
                    }
                    throw unexpected(t, "Unexpected token " + t.describe());
                }
                default -> throw unexpected(t, "Unexpected " + t.describe());
            }
        }

        private ObjectNode keywordPrimary(Token t) {
            switch (t.text()) {
                case "this" -> {
                    index++;
                    return node("ThisExpression", t);
                }
                case "super" -> {
                    index++;
                    return node("Super", t);
                }
                case "null" -> {
                    index++;
                    ObjectNode literal = node("Literal", t);
                    literal.putNull("value");
                    literal.put("raw", "null");
                    return literal;
                }
                case "true", "false" -> {
                    index++;
                    ObjectNode literal = node("Literal", t);
                    literal.put("value", t.text().equals("true"));
                    literal.put("raw", t.text());
                    return literal;
                }
                case "function" -> {
                    return function(true, false);
                }
                case "class" -> {
                    return classNode(true);
                }
                default -> throw unexpected(t, "Unexpected keyword '" + t.text() + "'");
            }
        }

        private ObjectNode template(Token t) {
            Token.TemplateParts parts = (Token.TemplateParts) t.value();
            ObjectNode template = node("TemplateLiteral", t);
            ArrayNode quasis = template.putArray("quasis");
            for (int i = 0; i < parts.cooked().size(); i++) {
                ObjectNode element = node("TemplateElement", t);
                ObjectNode value = element.putObject("value");
                value.put("raw", parts.raw().get(i));
                value.put("cooked", parts.cooked().get(i));
                element.put("tail", i == parts.cooked().size() - 1);
                quasis.add(element);
            }
            ArrayNode expressions = template.putArray("expressions");
            for (Token.Span span : parts.expressions()) {
                List<Token> inner = new Lexer(sourcePath, source, span).tokenize();
                Cursor sub = new Cursor(source, inner, false);
                sub.inAsync = inAsync;
                sub.inGenerator = inGenerator;
                ObjectNode expr = sub.expression();
                if (!sub.atEnd()) {
                    throw sub.unexpected(sub.peek(), "Unexpected token in template substitution");
                }
                expressions.add(expr);
            }
            return template;
        }

        private ObjectNode arrayLiteral() {
            ObjectNode array = node("ArrayExpression", expect("["));
            ArrayNode elements = array.putArray("elements");
            while (!eat("]")) {
                if (peek().isPunctuator(",")) {
                    index++;
                    elements.addNull();
                    continue;
                }
                elements.add(spreadOrAssignment());
                if (!peek().isPunctuator("]")) {
                    expect(",");
                }
            }
            return array;
        }

        private ObjectNode objectLiteral() {
            ObjectNode object = node("ObjectExpression", expect("{"));
            ArrayNode properties = object.putArray("properties");
            while (!eat("}")) {
                properties.add(objectMember());
                if (!peek().isPunctuator("}")) {
                    expect(",");
                }
            }
            return object;
        }

        private ObjectNode objectMember() {
            Token start = peek();
            if (eat("...")) {
                ObjectNode spread = node("SpreadElement", start);
                spread.set("argument", assignmentAllowingIn());
                return spread;
            }
            boolean isAsync = false;
            if (start.isIdentifier("async") && isPropertyNameStart(peek(1)) && !peek(1).newlineBefore()) {
                index++;
                isAsync = true;
            }
            boolean generator = eat("*");
            String accessor = null;
            if ((peek().isIdentifier("get") || peek().isIdentifier("set")) && isPropertyNameStart(peek(1))) {
                accessor = next().text();
            }
            Token keyToken = peek();
            boolean computed = keyToken.isPunctuator("[");
            ObjectNode key = propertyKey();
            ObjectNode property = node("Property", start);
            property.set("key", key);
            if (computed) {
                property.put("computed", true);
            }
            if (peek().isPunctuator("(")) {
                ObjectNode fn = node("FunctionExpression", keyToken);
                if (generator) {
                    fn.put("generator", true);
                }
                if (isAsync) {
                    fn.put("async", true);
                }
                functionRest(fn, generator, isAsync);
                property.set("value", fn);
                if (accessor != null) {
                    property.put("kind", accessor);
                } else {
                    property.put("method", true);
                }
                return property;
            }
            if (accessor != null || generator || isAsync) {
                throw unexpected(peek(), "Expected '(' after method name");
            }
            if (eat(":")) {
                property.set("value", assignmentAllowingIn());
                return property;
            }
            if (!"Identifier".equals(key.path("type").asText()) || computed) {
                throw unexpected(peek(), "Expected ':' after property name");
            }
            property.put("shorthand", true);
            ObjectNode value = identifier(keyToken);
            if (peek().isPunctuator("=")) {
                Token eq = next();
                ObjectNode withDefault = node("AssignmentPattern", eq);
                withDefault.set("left", value);
                withDefault.set("right", assignmentAllowingIn());
                value = withDefault;
            }
            property.set("value", value);
            return property;
        }

        private boolean isPropertyNameStart(Token t) {
            return t.type() == Token.Type.IDENTIFIER
                    || t.type() == Token.Type.KEYWORD
                    || t.type() == Token.Type.STRING
                    || t.type() == Token.Type.NUMBER
                    || t.isPunctuator("[");
        }

        private ObjectNode propertyKey() {
            Token t = peek();
            if (eat("[")) {
                ObjectNode key = assignmentAllowingIn();
                expect("]");
                return key;
            }
            if (t.type() == Token.Type.STRING || t.type() == Token.Type.NUMBER) {
                return primary();
            }
            return propertyIdentifier();
        }

        /** Identifier after a dot or as a property key; keywords are allowed. */
        private ObjectNode propertyIdentifier() {
            Token t = peek();
            if (t.type() != Token.Type.IDENTIFIER && t.type() != Token.Type.KEYWORD) {
                throw unexpected(t, "Expected property name");
            }
            index++;
            return identifier(t);
        }

        private ObjectNode expressionAllowingIn() {
            boolean saved = noIn;
            noIn = false;
            try {
                return expression();
            } finally {
                noIn = saved;
            }
        }

        private ObjectNode assignmentAllowingIn() {
            boolean saved = noIn;
            noIn = false;
            try {
                return assignment();
            } finally {
                noIn = saved;
            }
        }

        private ObjectNode parenthesized() {
            expect("(");
            ObjectNode expr = expressionAllowingIn();
            expect(")");
            return expr;
        }

        // --- Arrow detection ---

        private boolean isArrowAhead() {
            Token t = peek();
            if (t.type() == Token.Type.IDENTIFIER && peek(1).isPunctuator("=>")) {
                return true;
            }
            int offset = 0;
            if (t.isIdentifier("async") && !peek(1).newlineBefore()) {
                if (peek(1).type() == Token.Type.IDENTIFIER && peek(2).isPunctuator("=>")) {
                    return true;
                }
                offset = 1;
            }
            if (!peek(offset).isPunctuator("(")) {
                return false;
            }
            int depth = 0;
            for (int i = index + offset; i < tokens.size(); i++) {
                Token token = tokens.get(i);
                if (token.isPunctuator("(") || token.isPunctuator("[") || token.isPunctuator("{")) {
                    depth++;
                } else if (token.isPunctuator(")") || token.isPunctuator("]") || token.isPunctuator("}")) {
                    depth--;
                    if (depth == 0) {
                        return i + 1 < tokens.size()
                                && tokens.get(i + 1).isPunctuator("=>")
                                && !tokens.get(i + 1).newlineBefore();
                    }
                } else if (token.type() == Token.Type.EOF) {
                    return false;
                }
            }
            return false;
        }

        // --- Token helpers ---

        private ObjectNode identifier(Token t) {
            ObjectNode id = node("Identifier", t);
            id.put("name", t.text());
            return id;
        }

        private ObjectNode node(String type, Token at) {
            ObjectNode node = JSON.objectNode();
            node.put("type", type);
            ObjectNode start = node.putObject("loc").putObject("start");
            start.put("line", at.line());
            start.put("column", at.column());
            return node;
        }

        private ObjectNode copyLoc(String type, ObjectNode from) {
            ObjectNode node = JSON.objectNode();
            node.put("type", type);
            if (from.has("loc")) {
                node.set("loc", from.get("loc").deepCopy());
            }
            return node;
        }

        private boolean statementEnds() {
            Token t = peek();
            return t.isPunctuator(";") || t.isPunctuator("}") || t.type() == Token.Type.EOF || t.newlineBefore();
        }

        private void consumeSemicolon() {
            if (eat(";")) {
                return;
            }
            Token t = peek();
            if (t.isPunctuator("}") || t.type() == Token.Type.EOF || t.newlineBefore()) {
                return;
            }
            throw unexpected(t, "Expected ';' but found " + t.describe());
        }

        private Token peek() {
            return peek(0);
        }

        private Token peek(int offset) {
            int i = Math.min(index + offset, tokens.size() - 1);
            return tokens.get(i);
        }

        private Token next() {
            Token t = peek();
            if (t.type() != Token.Type.EOF) {
                index++;
            }
            return t;
        }

        private boolean eat(String punctuator) {
            if (peek().isPunctuator(punctuator)) {
                index++;
                return true;
            }
            return false;
        }

        private Token expect(String punctuator) {
            Token t = peek();
            if (!t.isPunctuator(punctuator)) {
                throw unexpected(t, "Expected '" + punctuator + "' but found " + t.describe());
            }
            index++;
            return t;
        }

        private Token expectKeyword(String keyword) {
            Token t = peek();
            if (!t.isKeyword(keyword)) {
                throw unexpected(t, "Expected '" + keyword + "' but found " + t.describe());
            }
            index++;
            return t;
        }

        private boolean atEnd() {
            return peek().type() == Token.Type.EOF;
        }

        private SourceParseException unexpected(Token t, String message) {
            return new SourceParseException(message, sourcePath, t.line(), t.column());
        }
    }
}
