package com.tyron.treedit.api.syntax;

/**
 * Kind tags of the syntax tree elements understood by the editing engine.
 * <p>
 * Token kinds come first, node kinds after {@link #SOURCE_FILE}.
 */
public enum SyntaxKind {

    // trivia
    WHITESPACE,
    COMMENT,

    // punctuation
    L_CURLY("{"),
    R_CURLY("}"),
    L_PAREN("("),
    R_PAREN(")"),
    L_BRACK("["),
    R_BRACK("]"),
    L_ANGLE("<"),
    R_ANGLE(">"),
    COLON(":"),
    COMMA(","),
    SEMICOLON(";"),
    PLUS("+"),
    POUND("#"),
    EQ("="),
    THIN_ARROW("->"),

    // keywords
    FN_KW("fn"),
    STRUCT_KW("struct"),
    IMPL_KW("impl"),
    FOR_KW("for"),
    CONST_KW("const"),
    TYPE_KW("type"),
    PUB_KW("pub"),

    IDENT,
    INT_NUMBER,
    ERROR_TOKEN,

    // nodes
    SOURCE_FILE,
    STRUCT_DEF,
    RECORD_FIELD_LIST,
    RECORD_FIELD,
    IMPL_BLOCK,
    ITEM_LIST,
    FN_DEF,
    CONST_DEF,
    TYPE_ALIAS_DEF,
    PARAM_LIST,
    PARAM,
    RET_TYPE,
    BLOCK,
    ATTR,
    VISIBILITY,
    NAME,
    NAME_REF,
    PATH_TYPE,
    LITERAL,
    TYPE_PARAM_LIST,
    TYPE_PARAM,
    TYPE_BOUND_LIST,
    TYPE_BOUND,
    ERROR;

    private final String fixedText;

    SyntaxKind() {
        this(null);
    }

    SyntaxKind(String fixedText) {
        this.fixedText = fixedText;
    }

    /**
     * @return the literal text of a punctuation or keyword token, or {@code null} for kinds with variable text.
     */
    public String getFixedText() {
        return fixedText;
    }

    public boolean isTrivia() {
        return this == WHITESPACE || this == COMMENT;
    }

    public boolean isKeyword() {
        return name().endsWith("_KW");
    }

    public boolean isNode() {
        return ordinal() >= SOURCE_FILE.ordinal();
    }

    public boolean isToken() {
        return !isNode();
    }

    /**
     * Resolves a keyword or punctuation kind from its text.
     *
     * @return the matching kind or {@code null}
     */
    public static SyntaxKind fromFixedText(String text) {
        for (SyntaxKind kind : values()) {
            if (kind.fixedText != null && kind.fixedText.equals(text)) {
                return kind;
            }
        }
        return null;
    }
}
