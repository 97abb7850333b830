package com.pascalite.compiler.parser;

/**
 * Two productions of one nonterminal are predicted by the same lookahead
 * token. Raised while the grammar table is built, never while parsing.
 */
public final class GrammarConflictException extends IllegalStateException {
    private final Nonterminal nonterminal;
    private final TokenType lookahead;

    public GrammarConflictException(Nonterminal nonterminal, TokenType lookahead, Production first, Production second) {
        super("LL(1) conflict in " + nonterminal + " on " + lookahead + ": " + first + " vs " + second);
        this.nonterminal = nonterminal;
        this.lookahead = lookahead;
    }

    public Nonterminal getNonterminal() {
        return nonterminal;
    }

    public TokenType getLookahead() {
        return lookahead;
    }
}
