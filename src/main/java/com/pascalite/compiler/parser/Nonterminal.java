package com.pascalite.compiler.parser;

public enum Nonterminal implements GrammarSymbol {
    PROGRAM,
    PROGRAM_HEADING,
    BLOCK,
    DECLARATIONS,
    DECLARATION,
    CONST_SECTION,
    CONST_DEFINITIONS,
    CONST_DEFINITION,
    CONSTANT,
    VAR_SECTION,
    VAR_DECLARATIONS,
    VAR_DECLARATION,
    IDENTIFIER_LIST,
    IDENTIFIER_LIST_TAIL,
    TYPE,
    PROCEDURE_DECLARATION,
    COMPOUND_STATEMENT,
    STATEMENT_LIST,
    STATEMENT_LIST_TAIL,
    STATEMENT,
    IDENT_STATEMENT_TAIL,
    ELSE_PART,
    DIRECTION,
    EXPRESSION_LIST,
    EXPRESSION_LIST_TAIL,
    EXPRESSION,
    RELATION_TAIL,
    RELATIONAL_OPERATOR,
    SIMPLE_EXPRESSION,
    ADD_TAIL,
    ADDING_OPERATOR,
    TERM,
    MUL_TAIL,
    MULTIPLYING_OPERATOR,
    FACTOR,
    SIGN,
    UNSIGNED_NUMBER;

    @Override
    public boolean isTerminal() {
        return false;
    }
}
