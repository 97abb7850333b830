package com.pascalite.compiler.parser;

/**
 * Base class of every located compilation failure. Messages carry a
 * {@code [line L:C]} prefix so the CLI can print them as-is.
 */
public abstract class CompileException extends RuntimeException {
    private final SourcePosition position;

    protected CompileException(SourcePosition position, String message) {
        super("[line " + position + "] " + message);
        this.position = position;
    }

    public SourcePosition getPosition() {
        return position;
    }

    /** "Lexical", "Syntax" or "Semantic". */
    public abstract String kind();
}
