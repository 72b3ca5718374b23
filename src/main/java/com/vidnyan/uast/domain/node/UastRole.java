package com.vidnyan.uast.domain.node;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Universal role vocabulary shared by every language's rule table.
 * Tags are the PascalCase form of the constant name ({@code LESS_THAN_OR_EQUAL -> LessThanOrEqual}).
 */
public enum UastRole implements Role {
    // Identifiers and names
    IDENTIFIER,
    QUALIFIED,
    NAME,
    ALIAS,
    PATHNAME,

    // Operators
    OPERATOR,
    BINARY,
    UNARY,
    LEFT,
    RIGHT,
    INFIX,
    POSTFIX,
    BITWISE,
    BOOLEAN,
    UNSIGNED,
    LEFT_SHIFT,
    RIGHT_SHIFT,
    OR,
    XOR,
    AND,
    NOT,
    EQUAL,
    LESS_THAN,
    LESS_THAN_OR_EQUAL,
    GREATER_THAN,
    GREATER_THAN_OR_EQUAL,
    IDENTICAL,
    CONTAINS,
    INCREMENT,
    DECREMENT,
    NEGATIVE,
    POSITIVE,
    DEREFERENCE,
    TAKE_ADDRESS,
    ADD,
    SUBSTRACT,
    MULTIPLY,
    DIVIDE,
    MODULO,
    ARITHMETIC,
    RELATIONAL,

    // Structure
    EXPRESSION,
    STATEMENT,
    FILE,
    PACKAGE,
    MODULE,
    SUBPACKAGE,
    DECLARATION,
    IMPORT,
    FUNCTION,
    BODY,
    RECEIVER,
    ARGUMENT,
    VALUE,
    ARGS_LIST,
    BASE,
    IMPLEMENTS,
    INSTANCE,
    SUBTYPE,
    FRIEND,
    WORLD,
    VARIABLE,
    VISIBILITY,
    ANNOTATION,
    ANONYMOUS,
    ENUMERATION,

    // Control flow
    IF,
    CONDITION,
    THEN,
    ELSE,
    SWITCH,
    CASE,
    DEFAULT,
    FOR,
    INITIALIZATION,
    UPDATE,
    ITERATOR,
    WHILE,
    DO_WHILE,
    BREAK,
    CONTINUE,
    GOTO,
    BLOCK,
    SCOPE,
    RETURN,
    TRY,
    CATCH,
    FINALLY,
    THROW,
    ASSERT,
    CALL,
    CALLEE,
    POSITIONAL,
    NOOP,

    // Literals and types
    LITERAL,
    BYTE,
    BYTE_STRING,
    CHARACTER,
    LIST,
    MAP,
    NULL,
    NUMBER,
    REGEXP,
    SET,
    STRING,
    TUPLE,
    TYPE,
    ENTRY,
    KEY,
    PRIMITIVE,
    ASSIGNMENT,
    THIS,

    // Trivia
    COMMENT,
    DOCUMENTATION,
    WHITESPACE,

    // Bookkeeping
    INCOMPLETE,
    UNANNOTATED;

    private static final Map<String, UastRole> BY_KEY = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(r -> key(r.name()), Function.identity()));

    private final String tag;

    UastRole() {
        this.tag = Arrays.stream(name().split("_"))
                .map(part -> part.charAt(0) + part.substring(1).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining());
    }

    @Override
    public String tag() {
        return tag;
    }

    /**
     * Find a declared role by tag, accepting both {@code LessThan} and {@code LESS_THAN}.
     */
    public static Optional<UastRole> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_KEY.get(key(tag)));
    }

    private static String key(String tag) {
        return tag.replace("_", "").toUpperCase(Locale.ROOT);
    }
}
