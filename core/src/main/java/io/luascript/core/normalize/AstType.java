package io.luascript.core.normalize;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of canonical AST node types produced by {@link AstNormalizer}.
 *
 * <p>Raw aliases ({@code ArrowFunction}, {@code Parameter}, {@code ParenthesizedExpression},
 * {@code ClassBody}) never appear here; the normalizer rewrites them away.
 */
public enum AstType {
    PROGRAM("Program", Category.OTHER),

    // statements
    EXPRESSION_STATEMENT("ExpressionStatement", Category.STATEMENT),
    VARIABLE_DECLARATION("VariableDeclaration", Category.STATEMENT),
    FUNCTION_DECLARATION("FunctionDeclaration", Category.STATEMENT),
    CLASS_DECLARATION("ClassDeclaration", Category.STATEMENT),
    RETURN_STATEMENT("ReturnStatement", Category.STATEMENT),
    IF_STATEMENT("IfStatement", Category.STATEMENT),
    BLOCK_STATEMENT("BlockStatement", Category.STATEMENT),
    WHILE_STATEMENT("WhileStatement", Category.STATEMENT),
    DO_WHILE_STATEMENT("DoWhileStatement", Category.STATEMENT),
    FOR_STATEMENT("ForStatement", Category.STATEMENT),
    FOR_IN_STATEMENT("ForInStatement", Category.STATEMENT),
    FOR_OF_STATEMENT("ForOfStatement", Category.STATEMENT),
    BREAK_STATEMENT("BreakStatement", Category.STATEMENT),
    CONTINUE_STATEMENT("ContinueStatement", Category.STATEMENT),
    THROW_STATEMENT("ThrowStatement", Category.STATEMENT),
    TRY_STATEMENT("TryStatement", Category.STATEMENT),
    SWITCH_STATEMENT("SwitchStatement", Category.STATEMENT),
    EMPTY_STATEMENT("EmptyStatement", Category.STATEMENT),
    LABELED_STATEMENT("LabeledStatement", Category.STATEMENT),

    // expressions
    IDENTIFIER("Identifier", Category.EXPRESSION),
    LITERAL("Literal", Category.EXPRESSION),
    TEMPLATE_LITERAL("TemplateLiteral", Category.EXPRESSION),
    THIS_EXPRESSION("ThisExpression", Category.EXPRESSION),
    SUPER("Super", Category.EXPRESSION),
    ARRAY_EXPRESSION("ArrayExpression", Category.EXPRESSION),
    OBJECT_EXPRESSION("ObjectExpression", Category.EXPRESSION),
    FUNCTION_EXPRESSION("FunctionExpression", Category.EXPRESSION),
    ARROW_FUNCTION_EXPRESSION("ArrowFunctionExpression", Category.EXPRESSION),
    CLASS_EXPRESSION("ClassExpression", Category.EXPRESSION),
    UNARY_EXPRESSION("UnaryExpression", Category.EXPRESSION),
    UPDATE_EXPRESSION("UpdateExpression", Category.EXPRESSION),
    BINARY_EXPRESSION("BinaryExpression", Category.EXPRESSION),
    LOGICAL_EXPRESSION("LogicalExpression", Category.EXPRESSION),
    ASSIGNMENT_EXPRESSION("AssignmentExpression", Category.EXPRESSION),
    CONDITIONAL_EXPRESSION("ConditionalExpression", Category.EXPRESSION),
    CALL_EXPRESSION("CallExpression", Category.EXPRESSION),
    NEW_EXPRESSION("NewExpression", Category.EXPRESSION),
    MEMBER_EXPRESSION("MemberExpression", Category.EXPRESSION),
    CHAIN_EXPRESSION("ChainExpression", Category.EXPRESSION),
    SEQUENCE_EXPRESSION("SequenceExpression", Category.EXPRESSION),
    SPREAD_ELEMENT("SpreadElement", Category.EXPRESSION),
    YIELD_EXPRESSION("YieldExpression", Category.EXPRESSION),
    AWAIT_EXPRESSION("AwaitExpression", Category.EXPRESSION),

    // patterns
    ARRAY_PATTERN("ArrayPattern", Category.PATTERN),
    OBJECT_PATTERN("ObjectPattern", Category.PATTERN),
    ASSIGNMENT_PATTERN("AssignmentPattern", Category.PATTERN),
    REST_ELEMENT("RestElement", Category.PATTERN),

    // structural parts
    PROPERTY("Property", Category.OTHER),
    VARIABLE_DECLARATOR("VariableDeclarator", Category.OTHER),
    SWITCH_CASE("SwitchCase", Category.OTHER),
    CATCH_CLAUSE("CatchClause", Category.OTHER),
    TEMPLATE_ELEMENT("TemplateElement", Category.OTHER),
    METHOD_DEFINITION("MethodDefinition", Category.OTHER),
    PROPERTY_DEFINITION("PropertyDefinition", Category.OTHER),

    /** Placeholder for a statement the tolerant parser could not read. */
    ERROR("Error", Category.OTHER);

    /** Grammatical role of a node type. */
    public enum Category {
        STATEMENT,
        EXPRESSION,
        PATTERN,
        OTHER
    }

    private static final Map<String, AstType> BY_NAME =
            Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(AstType::typeName, Function.identity()));

    private final String typeName;
    private final Category category;

    AstType(String typeName, Category category) {
        this.typeName = typeName;
        this.category = category;
    }

    /** The {@code type} string used in the JSON tree. */
    public String typeName() {
        return typeName;
    }

    public Category category() {
        return category;
    }

    public static Optional<AstType> fromTypeName(String typeName) {
        return Optional.ofNullable(BY_NAME.get(typeName));
    }

    /** Every statement type; the lowerer's dispatch table must cover exactly these. */
    public static Set<AstType> statements() {
        EnumSet<AstType> set = EnumSet.noneOf(AstType.class);
        for (AstType type : values()) {
            if (type.category == Category.STATEMENT) {
                set.add(type);
            }
        }
        return Collections.unmodifiableSet(set);
    }

    @Override
    public String toString() {
        return typeName;
    }
}
