package com.pascalite.compiler.codegen;

import com.pascalite.compiler.parser.CompileException;
import com.pascalite.compiler.parser.SourcePosition;

/** Undeclared or duplicate names, type mismatches and misused symbols. */
public final class SemanticException extends CompileException {

    public SemanticException(SourcePosition position, String message) {
        super(position, message);
    }

    @Override
    public String kind() {
        return "Semantic";
    }
}
