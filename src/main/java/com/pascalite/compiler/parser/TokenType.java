package com.pascalite.compiler.parser;

public enum TokenType implements GrammarSymbol {
    // Keywords
    PROGRAM(Category.KEYWORD, "program"),
    CONST(Category.KEYWORD, "const"),
    VAR(Category.KEYWORD, "var"),
    PROCEDURE(Category.KEYWORD, "procedure"),
    BEGIN(Category.KEYWORD, "begin"),
    END(Category.KEYWORD, "end"),
    IF(Category.KEYWORD, "if"),
    THEN(Category.KEYWORD, "then"),
    ELSE(Category.KEYWORD, "else"),
    WHILE(Category.KEYWORD, "while"),
    DO(Category.KEYWORD, "do"),
    REPEAT(Category.KEYWORD, "repeat"),
    UNTIL(Category.KEYWORD, "until"),
    FOR(Category.KEYWORD, "for"),
    TO(Category.KEYWORD, "to"),
    DOWNTO(Category.KEYWORD, "downto"),
    DIV(Category.KEYWORD, "div"),
    MOD(Category.KEYWORD, "mod"),
    AND(Category.KEYWORD, "and"),
    OR(Category.KEYWORD, "or"),
    NOT(Category.KEYWORD, "not"),
    TRUE(Category.KEYWORD, "true"),
    FALSE(Category.KEYWORD, "false"),
    INTEGER(Category.KEYWORD, "integer"),
    REAL(Category.KEYWORD, "real"),
    BOOLEAN(Category.KEYWORD, "boolean"),
    STRING(Category.KEYWORD, "string"),

    IDENTIFIER(Category.IDENTIFIER, null),
    INTEGER_LITERAL(Category.INTEGER_LITERAL, null),
    REAL_LITERAL(Category.REAL_LITERAL, null),
    STRING_LITERAL(Category.STRING_LITERAL, null),

    // Operators
    PLUS(Category.OPERATOR, "+"),
    MINUS(Category.OPERATOR, "-"),
    STAR(Category.OPERATOR, "*"),
    SLASH(Category.OPERATOR, "/"),
    ASSIGN(Category.OPERATOR, ":="),
    EQUAL(Category.OPERATOR, "="),
    NOT_EQUAL(Category.OPERATOR, "<>"),
    LESS(Category.OPERATOR, "<"),
    LESS_EQUAL(Category.OPERATOR, "<="),
    GREATER(Category.OPERATOR, ">"),
    GREATER_EQUAL(Category.OPERATOR, ">="),

    // Punctuation
    LEFT_PAREN(Category.PUNCTUATION, "("),
    RIGHT_PAREN(Category.PUNCTUATION, ")"),
    SEMICOLON(Category.PUNCTUATION, ";"),
    COLON(Category.PUNCTUATION, ":"),
    COMMA(Category.PUNCTUATION, ","),
    DOT(Category.PUNCTUATION, "."),

    EOF(Category.END_OF_INPUT, null);

    public enum Category {
        KEYWORD,
        IDENTIFIER,
        INTEGER_LITERAL,
        REAL_LITERAL,
        STRING_LITERAL,
        OPERATOR,
        PUNCTUATION,
        END_OF_INPUT
    }

    public final Category category;
    /** Fixed spelling for keywords, operators and punctuation; null for open classes. */
    public final String spelling;

    TokenType(Category category, String spelling) {
        this.category = category;
        this.spelling = spelling;
    }

    @Override
    public boolean isTerminal() {
        return true;
    }

    /** Human-readable form used in syntax error messages. */
    public String describe() {
        if (spelling != null) return "'" + spelling + "'";
        switch (this) {
            case IDENTIFIER: return "identifier";
            case INTEGER_LITERAL: return "integer literal";
            case REAL_LITERAL: return "real literal";
            case STRING_LITERAL: return "string literal";
            default: return "end of input";
        }
    }
}
