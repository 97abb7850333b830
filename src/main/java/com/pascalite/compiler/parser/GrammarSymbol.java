package com.pascalite.compiler.parser;

/** A terminal ({@link TokenType}) or nonterminal ({@link Nonterminal}) on the right-hand side of a production. */
public interface GrammarSymbol {
    boolean isTerminal();
}
