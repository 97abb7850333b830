package com.pascalite.compiler.parser;

public final class LexicalException extends CompileException {
    private final char offending;

    public LexicalException(SourcePosition position, char offending, String message) {
        super(position, message);
        this.offending = offending;
    }

    /** The character at which scanning stopped. */
    public char getOffending() {
        return offending;
    }

    @Override
    public String kind() {
        return "Lexical";
    }
}
