package com.pascalite.compiler.parser;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The LL(1) productions of the language. An empty right-hand side is an
 * epsilon production. {@link Grammar} derives the predict table from this
 * list and {@link Parser} switches over the constant it selects.
 */
public enum Production {
    PROGRAM(Nonterminal.PROGRAM, Nonterminal.PROGRAM_HEADING, Nonterminal.BLOCK, TokenType.DOT),

    PROGRAM_HEADING(Nonterminal.PROGRAM_HEADING, TokenType.PROGRAM, TokenType.IDENTIFIER, TokenType.SEMICOLON),
    PROGRAM_HEADING_EMPTY(Nonterminal.PROGRAM_HEADING),

    BLOCK(Nonterminal.BLOCK, Nonterminal.DECLARATIONS, Nonterminal.COMPOUND_STATEMENT),

    DECLARATIONS(Nonterminal.DECLARATIONS, Nonterminal.DECLARATION, Nonterminal.DECLARATIONS),
    DECLARATIONS_EMPTY(Nonterminal.DECLARATIONS),

    DECLARATION_CONST(Nonterminal.DECLARATION, Nonterminal.CONST_SECTION),
    DECLARATION_VAR(Nonterminal.DECLARATION, Nonterminal.VAR_SECTION),
    DECLARATION_PROCEDURE(Nonterminal.DECLARATION, Nonterminal.PROCEDURE_DECLARATION),

    CONST_SECTION(Nonterminal.CONST_SECTION, TokenType.CONST, Nonterminal.CONST_DEFINITION, Nonterminal.CONST_DEFINITIONS),
    CONST_DEFINITIONS(Nonterminal.CONST_DEFINITIONS, Nonterminal.CONST_DEFINITION, Nonterminal.CONST_DEFINITIONS),
    CONST_DEFINITIONS_EMPTY(Nonterminal.CONST_DEFINITIONS),
    CONST_DEFINITION(Nonterminal.CONST_DEFINITION, TokenType.IDENTIFIER, TokenType.EQUAL, Nonterminal.CONSTANT, TokenType.SEMICOLON),

    CONSTANT_SIGNED(Nonterminal.CONSTANT, Nonterminal.SIGN, Nonterminal.UNSIGNED_NUMBER),
    CONSTANT_UNSIGNED(Nonterminal.CONSTANT, Nonterminal.UNSIGNED_NUMBER),
    CONSTANT_STRING(Nonterminal.CONSTANT, TokenType.STRING_LITERAL),
    CONSTANT_TRUE(Nonterminal.CONSTANT, TokenType.TRUE),
    CONSTANT_FALSE(Nonterminal.CONSTANT, TokenType.FALSE),

    VAR_SECTION(Nonterminal.VAR_SECTION, TokenType.VAR, Nonterminal.VAR_DECLARATION, Nonterminal.VAR_DECLARATIONS),
    VAR_DECLARATIONS(Nonterminal.VAR_DECLARATIONS, Nonterminal.VAR_DECLARATION, Nonterminal.VAR_DECLARATIONS),
    VAR_DECLARATIONS_EMPTY(Nonterminal.VAR_DECLARATIONS),
    VAR_DECLARATION(Nonterminal.VAR_DECLARATION, Nonterminal.IDENTIFIER_LIST, TokenType.COLON, Nonterminal.TYPE, TokenType.SEMICOLON),

    IDENTIFIER_LIST(Nonterminal.IDENTIFIER_LIST, TokenType.IDENTIFIER, Nonterminal.IDENTIFIER_LIST_TAIL),
    IDENTIFIER_LIST_TAIL(Nonterminal.IDENTIFIER_LIST_TAIL, TokenType.COMMA, TokenType.IDENTIFIER, Nonterminal.IDENTIFIER_LIST_TAIL),
    IDENTIFIER_LIST_TAIL_EMPTY(Nonterminal.IDENTIFIER_LIST_TAIL),

    TYPE_INTEGER(Nonterminal.TYPE, TokenType.INTEGER),
    TYPE_REAL(Nonterminal.TYPE, TokenType.REAL),
    TYPE_BOOLEAN(Nonterminal.TYPE, TokenType.BOOLEAN),
    TYPE_STRING(Nonterminal.TYPE, TokenType.STRING),

    PROCEDURE_DECLARATION(Nonterminal.PROCEDURE_DECLARATION,
            TokenType.PROCEDURE, TokenType.IDENTIFIER, TokenType.SEMICOLON, Nonterminal.BLOCK, TokenType.SEMICOLON),

    COMPOUND_STATEMENT(Nonterminal.COMPOUND_STATEMENT, TokenType.BEGIN, Nonterminal.STATEMENT_LIST, TokenType.END),

    STATEMENT_LIST(Nonterminal.STATEMENT_LIST, Nonterminal.STATEMENT, Nonterminal.STATEMENT_LIST_TAIL),
    STATEMENT_LIST_TAIL(Nonterminal.STATEMENT_LIST_TAIL, TokenType.SEMICOLON, Nonterminal.STATEMENT, Nonterminal.STATEMENT_LIST_TAIL),
    STATEMENT_LIST_TAIL_EMPTY(Nonterminal.STATEMENT_LIST_TAIL),

    STATEMENT_IDENT(Nonterminal.STATEMENT, TokenType.IDENTIFIER, Nonterminal.IDENT_STATEMENT_TAIL),
    STATEMENT_COMPOUND(Nonterminal.STATEMENT, Nonterminal.COMPOUND_STATEMENT),
    STATEMENT_IF(Nonterminal.STATEMENT,
            TokenType.IF, Nonterminal.EXPRESSION, TokenType.THEN, Nonterminal.STATEMENT, Nonterminal.ELSE_PART),
    STATEMENT_WHILE(Nonterminal.STATEMENT, TokenType.WHILE, Nonterminal.EXPRESSION, TokenType.DO, Nonterminal.STATEMENT),
    STATEMENT_REPEAT(Nonterminal.STATEMENT, TokenType.REPEAT, Nonterminal.STATEMENT_LIST, TokenType.UNTIL, Nonterminal.EXPRESSION),
    STATEMENT_FOR(Nonterminal.STATEMENT,
            TokenType.FOR, TokenType.IDENTIFIER, TokenType.ASSIGN, Nonterminal.EXPRESSION,
            Nonterminal.DIRECTION, Nonterminal.EXPRESSION, TokenType.DO, Nonterminal.STATEMENT),
    STATEMENT_EMPTY(Nonterminal.STATEMENT),

    IDENT_STATEMENT_ASSIGN(Nonterminal.IDENT_STATEMENT_TAIL, TokenType.ASSIGN, Nonterminal.EXPRESSION),
    IDENT_STATEMENT_CALL_ARGS(Nonterminal.IDENT_STATEMENT_TAIL,
            TokenType.LEFT_PAREN, Nonterminal.EXPRESSION_LIST, TokenType.RIGHT_PAREN),
    IDENT_STATEMENT_CALL(Nonterminal.IDENT_STATEMENT_TAIL),

    ELSE_PART(Nonterminal.ELSE_PART, TokenType.ELSE, Nonterminal.STATEMENT),
    ELSE_PART_EMPTY(Nonterminal.ELSE_PART),

    DIRECTION_TO(Nonterminal.DIRECTION, TokenType.TO),
    DIRECTION_DOWNTO(Nonterminal.DIRECTION, TokenType.DOWNTO),

    EXPRESSION_LIST(Nonterminal.EXPRESSION_LIST, Nonterminal.EXPRESSION, Nonterminal.EXPRESSION_LIST_TAIL),
    EXPRESSION_LIST_TAIL(Nonterminal.EXPRESSION_LIST_TAIL,
            TokenType.COMMA, Nonterminal.EXPRESSION, Nonterminal.EXPRESSION_LIST_TAIL),
    EXPRESSION_LIST_TAIL_EMPTY(Nonterminal.EXPRESSION_LIST_TAIL),

    EXPRESSION(Nonterminal.EXPRESSION, Nonterminal.SIMPLE_EXPRESSION, Nonterminal.RELATION_TAIL),
    RELATION_TAIL(Nonterminal.RELATION_TAIL, Nonterminal.RELATIONAL_OPERATOR, Nonterminal.SIMPLE_EXPRESSION),
    RELATION_TAIL_EMPTY(Nonterminal.RELATION_TAIL),

    RELATIONAL_EQUAL(Nonterminal.RELATIONAL_OPERATOR, TokenType.EQUAL),
    RELATIONAL_NOT_EQUAL(Nonterminal.RELATIONAL_OPERATOR, TokenType.NOT_EQUAL),
    RELATIONAL_LESS(Nonterminal.RELATIONAL_OPERATOR, TokenType.LESS),
    RELATIONAL_LESS_EQUAL(Nonterminal.RELATIONAL_OPERATOR, TokenType.LESS_EQUAL),
    RELATIONAL_GREATER(Nonterminal.RELATIONAL_OPERATOR, TokenType.GREATER),
    RELATIONAL_GREATER_EQUAL(Nonterminal.RELATIONAL_OPERATOR, TokenType.GREATER_EQUAL),

    SIMPLE_EXPRESSION_SIGNED(Nonterminal.SIMPLE_EXPRESSION, Nonterminal.SIGN, Nonterminal.TERM, Nonterminal.ADD_TAIL),
    SIMPLE_EXPRESSION(Nonterminal.SIMPLE_EXPRESSION, Nonterminal.TERM, Nonterminal.ADD_TAIL),
    ADD_TAIL(Nonterminal.ADD_TAIL, Nonterminal.ADDING_OPERATOR, Nonterminal.TERM, Nonterminal.ADD_TAIL),
    ADD_TAIL_EMPTY(Nonterminal.ADD_TAIL),

    ADDING_PLUS(Nonterminal.ADDING_OPERATOR, TokenType.PLUS),
    ADDING_MINUS(Nonterminal.ADDING_OPERATOR, TokenType.MINUS),
    ADDING_OR(Nonterminal.ADDING_OPERATOR, TokenType.OR),

    TERM(Nonterminal.TERM, Nonterminal.FACTOR, Nonterminal.MUL_TAIL),
    MUL_TAIL(Nonterminal.MUL_TAIL, Nonterminal.MULTIPLYING_OPERATOR, Nonterminal.FACTOR, Nonterminal.MUL_TAIL),
    MUL_TAIL_EMPTY(Nonterminal.MUL_TAIL),

    MULTIPLYING_STAR(Nonterminal.MULTIPLYING_OPERATOR, TokenType.STAR),
    MULTIPLYING_SLASH(Nonterminal.MULTIPLYING_OPERATOR, TokenType.SLASH),
    MULTIPLYING_DIV(Nonterminal.MULTIPLYING_OPERATOR, TokenType.DIV),
    MULTIPLYING_MOD(Nonterminal.MULTIPLYING_OPERATOR, TokenType.MOD),
    MULTIPLYING_AND(Nonterminal.MULTIPLYING_OPERATOR, TokenType.AND),

    FACTOR_VARIABLE(Nonterminal.FACTOR, TokenType.IDENTIFIER),
    FACTOR_INTEGER(Nonterminal.FACTOR, TokenType.INTEGER_LITERAL),
    FACTOR_REAL(Nonterminal.FACTOR, TokenType.REAL_LITERAL),
    FACTOR_STRING(Nonterminal.FACTOR, TokenType.STRING_LITERAL),
    FACTOR_TRUE(Nonterminal.FACTOR, TokenType.TRUE),
    FACTOR_FALSE(Nonterminal.FACTOR, TokenType.FALSE),
    FACTOR_PARENTHESIZED(Nonterminal.FACTOR, TokenType.LEFT_PAREN, Nonterminal.EXPRESSION, TokenType.RIGHT_PAREN),
    FACTOR_NOT(Nonterminal.FACTOR, TokenType.NOT, Nonterminal.FACTOR),

    SIGN_PLUS(Nonterminal.SIGN, TokenType.PLUS),
    SIGN_MINUS(Nonterminal.SIGN, TokenType.MINUS),

    UNSIGNED_INTEGER(Nonterminal.UNSIGNED_NUMBER, TokenType.INTEGER_LITERAL),
    UNSIGNED_REAL(Nonterminal.UNSIGNED_NUMBER, TokenType.REAL_LITERAL);

    public final Nonterminal lhs;
    private final List<GrammarSymbol> rhs;

    Production(Nonterminal lhs, GrammarSymbol... rhs) {
        this.lhs = lhs;
        this.rhs = Collections.unmodifiableList(Arrays.asList(rhs));
    }

    public List<GrammarSymbol> rhs() {
        return rhs;
    }

    public boolean isEmpty() {
        return rhs.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(lhs.name()).append(" ->");
        if (rhs.isEmpty()) return sb.append(" ε").toString();
        for (GrammarSymbol s : rhs) sb.append(' ').append(((Enum<?>) s).name());
        return sb.toString();
    }
}
