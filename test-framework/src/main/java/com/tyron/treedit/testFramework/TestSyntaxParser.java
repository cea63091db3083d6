package com.tyron.treedit.testFramework;

import com.tyron.treedit.api.syntax.SyntaxKind;
import com.tyron.treedit.core.syntax.SyntaxNode;
import com.tyron.treedit.core.syntax.SyntaxTreeBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Lossless parser for the small Rust-like language used by the tests: structs with record fields, impl blocks,
 * functions, constants, type aliases, attributes and generic parameters with bounds.
 * <p>
 * Whitespace and comments become tokens of the tree. Comments directly above an item or field (no blank line
 * in between) belong to that item, like doc comments; other trivia belongs to the enclosing node.
 */
public final class TestSyntaxParser {

    private record Token(SyntaxKind kind, String text) {
    }

    private final List<Token> tokens;
    private final SyntaxTreeBuilder builder = new SyntaxTreeBuilder();
    private int pos;

    private TestSyntaxParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * @throws IllegalArgumentException if the text is outside the supported language
     */
    public static SyntaxNode parse(String text) {
        TestSyntaxParser parser = new TestSyntaxParser(lex(text));
        parser.sourceFile();
        return parser.builder.finishRoot();
    }

    private static List<Token> lex(String text) {
        List<Token> result = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            int start = i;
            SyntaxKind kind;
            if (Character.isWhitespace(c)) {
                while (i < text.length() && Character.isWhitespace(text.charAt(i))) i++;
                kind = SyntaxKind.WHITESPACE;
            } else if (text.startsWith("//", i)) {
                while (i < text.length() && text.charAt(i) != '\n') i++;
                kind = SyntaxKind.COMMENT;
            } else if (Character.isLetter(c) || c == '_') {
                while (i < text.length() && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) i++;
                SyntaxKind keyword = SyntaxKind.fromFixedText(text.substring(start, i));
                kind = keyword != null && keyword.isKeyword() ? keyword : SyntaxKind.IDENT;
            } else if (Character.isDigit(c)) {
                while (i < text.length() && Character.isDigit(text.charAt(i))) i++;
                kind = SyntaxKind.INT_NUMBER;
            } else if (text.startsWith("->", i)) {
                i += 2;
                kind = SyntaxKind.THIN_ARROW;
            } else {
                i++;
                SyntaxKind punct = SyntaxKind.fromFixedText(String.valueOf(c));
                kind = punct != null ? punct : SyntaxKind.ERROR_TOKEN;
            }
            result.add(new Token(kind, text.substring(start, i)));
        }
        return result;
    }

    private void sourceFile() {
        builder.startNode(SyntaxKind.SOURCE_FILE);
        while (peek() != null) {
            item();
        }
        bumpTrivia();
        builder.finishNode();
    }

    private void item() {
        SyntaxKind keyword = itemKeywordAhead();
        SyntaxKind kind;
        if (keyword == SyntaxKind.STRUCT_KW) {
            kind = SyntaxKind.STRUCT_DEF;
        } else if (keyword == SyntaxKind.IMPL_KW) {
            kind = SyntaxKind.IMPL_BLOCK;
        } else if (keyword == SyntaxKind.FN_KW) {
            kind = SyntaxKind.FN_DEF;
        } else if (keyword == SyntaxKind.CONST_KW) {
            kind = SyntaxKind.CONST_DEF;
        } else if (keyword == SyntaxKind.TYPE_KW) {
            kind = SyntaxKind.TYPE_ALIAS_DEF;
        } else {
            throw error("item");
        }

        startAttached(kind);
        attrsAndVisibility();
        if (kind == SyntaxKind.STRUCT_DEF) {
            structDef();
        } else if (kind == SyntaxKind.IMPL_BLOCK) {
            implBlock();
        } else if (kind == SyntaxKind.FN_DEF) {
            fnDef();
        } else if (kind == SyntaxKind.CONST_DEF) {
            constDef();
        } else {
            typeAlias();
        }
        builder.finishNode();
    }

    private void structDef() {
        expect(SyntaxKind.STRUCT_KW);
        name();
        if (peek() == SyntaxKind.L_ANGLE) {
            typeParamList();
        }
        if (peek() == SyntaxKind.L_CURLY) {
            recordFieldList();
        } else {
            expect(SyntaxKind.SEMICOLON);
        }
    }

    private void recordFieldList() {
        start(SyntaxKind.RECORD_FIELD_LIST);
        expect(SyntaxKind.L_CURLY);
        while (peek() != SyntaxKind.R_CURLY && peek() != null) {
            if (!eat(SyntaxKind.COMMA)) {
                startAttached(SyntaxKind.RECORD_FIELD);
                attrsAndVisibility();
                name();
                expect(SyntaxKind.COLON);
                type();
                builder.finishNode();
            }
        }
        expect(SyntaxKind.R_CURLY);
        builder.finishNode();
    }

    private void implBlock() {
        expect(SyntaxKind.IMPL_KW);
        if (peek() == SyntaxKind.L_ANGLE) {
            typeParamList();
        }
        type();
        if (eat(SyntaxKind.FOR_KW)) {
            type();
        }
        start(SyntaxKind.ITEM_LIST);
        expect(SyntaxKind.L_CURLY);
        while (peek() != SyntaxKind.R_CURLY && peek() != null) {
            item();
        }
        expect(SyntaxKind.R_CURLY);
        builder.finishNode();
    }

    private void fnDef() {
        expect(SyntaxKind.FN_KW);
        name();
        if (peek() == SyntaxKind.L_ANGLE) {
            typeParamList();
        }
        start(SyntaxKind.PARAM_LIST);
        expect(SyntaxKind.L_PAREN);
        while (peek() != SyntaxKind.R_PAREN && peek() != null) {
            if (!eat(SyntaxKind.COMMA)) {
                start(SyntaxKind.PARAM);
                name();
                expect(SyntaxKind.COLON);
                type();
                builder.finishNode();
            }
        }
        expect(SyntaxKind.R_PAREN);
        builder.finishNode();
        if (peek() == SyntaxKind.THIN_ARROW) {
            start(SyntaxKind.RET_TYPE);
            bump();
            type();
            builder.finishNode();
        }
        if (peek() == SyntaxKind.L_CURLY) {
            block();
        } else {
            expect(SyntaxKind.SEMICOLON);
        }
    }

    private void block() {
        start(SyntaxKind.BLOCK);
        expect(SyntaxKind.L_CURLY);
        while (peek() != SyntaxKind.R_CURLY && peek() != null) {
            if (peek() == SyntaxKind.L_CURLY) {
                block();
            } else {
                bump();
            }
        }
        expect(SyntaxKind.R_CURLY);
        builder.finishNode();
    }

    private void constDef() {
        expect(SyntaxKind.CONST_KW);
        name();
        expect(SyntaxKind.COLON);
        type();
        expect(SyntaxKind.EQ);
        start(SyntaxKind.LITERAL);
        bump();
        builder.finishNode();
        expect(SyntaxKind.SEMICOLON);
    }

    private void typeAlias() {
        expect(SyntaxKind.TYPE_KW);
        name();
        expect(SyntaxKind.EQ);
        type();
        expect(SyntaxKind.SEMICOLON);
    }

    private void typeParamList() {
        start(SyntaxKind.TYPE_PARAM_LIST);
        expect(SyntaxKind.L_ANGLE);
        while (peek() != SyntaxKind.R_ANGLE && peek() != null) {
            if (!eat(SyntaxKind.COMMA)) {
                start(SyntaxKind.TYPE_PARAM);
                name();
                if (eat(SyntaxKind.COLON)) {
                    start(SyntaxKind.TYPE_BOUND_LIST);
                    typeBound();
                    while (eat(SyntaxKind.PLUS)) {
                        typeBound();
                    }
                    builder.finishNode();
                }
                builder.finishNode();
            }
        }
        expect(SyntaxKind.R_ANGLE);
        builder.finishNode();
    }

    private void typeBound() {
        start(SyntaxKind.TYPE_BOUND);
        type();
        builder.finishNode();
    }

    private void type() {
        start(SyntaxKind.PATH_TYPE);
        if (eat(SyntaxKind.L_PAREN)) {
            expect(SyntaxKind.R_PAREN);
        } else {
            start(SyntaxKind.NAME_REF);
            expect(SyntaxKind.IDENT);
            builder.finishNode();
            if (eat(SyntaxKind.L_ANGLE)) {
                type();
                while (eat(SyntaxKind.COMMA)) {
                    type();
                }
                expect(SyntaxKind.R_ANGLE);
            }
        }
        builder.finishNode();
    }

    private void name() {
        start(SyntaxKind.NAME);
        expect(SyntaxKind.IDENT);
        builder.finishNode();
    }

    private void attrsAndVisibility() {
        while (peek() == SyntaxKind.POUND) {
            start(SyntaxKind.ATTR);
            expect(SyntaxKind.POUND);
            expect(SyntaxKind.L_BRACK);
            int depth = 0;
            while (peek() != null && (depth > 0 || peek() != SyntaxKind.R_BRACK)) {
                if (peek() == SyntaxKind.L_BRACK) depth++;
                if (peek() == SyntaxKind.R_BRACK) depth--;
                bump();
            }
            expect(SyntaxKind.R_BRACK);
            builder.finishNode();
        }
        if (peek() == SyntaxKind.PUB_KW) {
            start(SyntaxKind.VISIBILITY);
            bump();
            builder.finishNode();
        }
    }

    /**
     * @return the keyword that decides the item kind, looking past attributes and visibility
     */
    private SyntaxKind itemKeywordAhead() {
        int depth = 0;
        for (int i = pos; i < tokens.size(); i++) {
            SyntaxKind kind = tokens.get(i).kind();
            if (kind.isTrivia()) continue;
            if (kind == SyntaxKind.L_BRACK) depth++;
            if (kind == SyntaxKind.R_BRACK) depth--;
            if (depth > 0 || kind == SyntaxKind.R_BRACK || kind == SyntaxKind.POUND || kind == SyntaxKind.PUB_KW) {
                continue;
            }
            return kind;
        }
        return null;
    }

    /**
     * Starts a node, attaching the comments right in front of it.
     */
    private void startAttached(SyntaxKind kind) {
        int firstSignificant = pos;
        while (firstSignificant < tokens.size() && tokens.get(firstSignificant).kind().isTrivia()) {
            firstSignificant++;
        }
        int attachFrom = firstSignificant;
        for (int i = firstSignificant - 1; i >= pos; i--) {
            Token token = tokens.get(i);
            if (token.kind() == SyntaxKind.COMMENT) {
                attachFrom = i;
            } else if (token.text().chars().filter(ch -> ch == '\n').count() >= 2) {
                break;
            }
        }
        while (pos < attachFrom) {
            emit(tokens.get(pos++));
        }
        builder.startNode(kind);
    }

    private void start(SyntaxKind kind) {
        bumpTrivia();
        builder.startNode(kind);
    }

    private SyntaxKind peek() {
        int i = pos;
        while (i < tokens.size() && tokens.get(i).kind().isTrivia()) {
            i++;
        }
        return i < tokens.size() ? tokens.get(i).kind() : null;
    }

    private void bumpTrivia() {
        while (pos < tokens.size() && tokens.get(pos).kind().isTrivia()) {
            emit(tokens.get(pos++));
        }
    }

    private void bump() {
        bumpTrivia();
        emit(tokens.get(pos++));
    }

    private boolean eat(SyntaxKind kind) {
        if (peek() != kind) {
            return false;
        }
        bump();
        return true;
    }

    private void expect(SyntaxKind kind) {
        if (peek() != kind) {
            throw error(kind.toString());
        }
        bump();
    }

    private void emit(Token token) {
        builder.token(token.kind(), token.text());
    }

    private IllegalArgumentException error(String expected) {
        return new IllegalArgumentException("expected " + expected + " but found " + peek() + " at token " + pos);
    }
}
